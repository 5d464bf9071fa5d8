package com.blueprintbridge.transpiler.diff;

import com.blueprintbridge.transpiler.report.ConflictLevel;
import com.google.gson.annotations.SerializedName;

/**
 * Deserialized diff policy. Every field is optional; getters fall back to the built-in
 * policy, which {@code blueprint-diff-policy.json} on the classpath spells out.
 */
public class DiffPolicy {

    /** Minimum normalized name similarity (0..1) for an unmatched pair to count as a rename (default: 0.6). */
    @SerializedName("rename_similarity_threshold")
    private Double renameSimilarityThreshold;

    /** Whether bool to int to float type changes are compatible (default: true). */
    @SerializedName("widening_compatible")
    private Boolean wideningCompatible;

    /** Whether adding only defaulted parameters is compatible (default: true). */
    @SerializedName("optional_parameters_compatible")
    private Boolean optionalParametersCompatible;

    /** Conflict level of a symbol present only in C++ (default: conflict). */
    @SerializedName("removal_conflict_level")
    private ConflictLevel removalConflictLevel;

    public static DiffPolicy defaults() {
        return new DiffPolicy();
    }

    public double getRenameSimilarityThreshold() {
        return renameSimilarityThreshold != null ? renameSimilarityThreshold : 0.6;
    }
    public boolean isWideningCompatible() { return wideningCompatible == null || wideningCompatible; }
    public boolean isOptionalParametersCompatible() {
        return optionalParametersCompatible == null || optionalParametersCompatible;
    }
    public ConflictLevel getRemovalConflictLevel() {
        return removalConflictLevel != null ? removalConflictLevel : ConflictLevel.CONFLICT;
    }
}
