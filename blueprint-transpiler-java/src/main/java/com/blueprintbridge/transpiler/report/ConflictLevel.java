package com.blueprintbridge.transpiler.report;

import com.google.gson.annotations.SerializedName;

/** Ordered by severity: NONE &lt; COMPATIBLE &lt; CONFLICT. */
public enum ConflictLevel {
    @SerializedName("none")       NONE,
    @SerializedName("compatible") COMPATIBLE,
    @SerializedName("conflict")   CONFLICT;

    public ConflictLevel max(ConflictLevel other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
