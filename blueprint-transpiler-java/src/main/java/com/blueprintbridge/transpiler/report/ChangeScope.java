package com.blueprintbridge.transpiler.report;

import com.google.gson.annotations.SerializedName;

/** Declaration order is the order changes are listed in a {@link DiffResult}. */
public enum ChangeScope {
    @SerializedName("class")    CLASS,
    @SerializedName("variable") VARIABLE,
    @SerializedName("function") FUNCTION
}
