package com.blueprintbridge.transpiler.report;

import java.util.List;

/**
 * Output of one diff invocation. {@code overallConflict} is always the highest
 * {@link ConflictLevel} among {@code changes}, or NONE when there are none.
 */
public record DiffResult(
        ConflictLevel overallConflict,
        List<SemanticChange> changes,
        String blueprintSummary,
        String cppSummary,
        List<Warning> warnings
) {
    public DiffResult {
        changes = List.copyOf(changes);
        warnings = List.copyOf(warnings);
    }

    public static DiffResult of(List<SemanticChange> changes, String blueprintSummary,
                                String cppSummary, List<Warning> warnings) {
        ConflictLevel overall = ConflictLevel.NONE;
        for (SemanticChange change : changes) {
            overall = overall.max(change.conflictLevel());
        }
        return new DiffResult(overall, changes, blueprintSummary, cppSummary, warnings);
    }

    /** Result for existing source that could not be analyzed at all: no changes, one warning. */
    public static DiffResult analysisFailure(String blueprintSummary, Warning warning) {
        return new DiffResult(ConflictLevel.NONE, List.of(), blueprintSummary, "not analyzed", List.of(warning));
    }
}
