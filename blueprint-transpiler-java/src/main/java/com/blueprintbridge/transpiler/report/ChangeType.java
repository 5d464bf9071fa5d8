package com.blueprintbridge.transpiler.report;

import com.google.gson.annotations.SerializedName;

public enum ChangeType {
    @SerializedName("add")    ADD,
    @SerializedName("remove") REMOVE,
    @SerializedName("modify") MODIFY,
    @SerializedName("move")   MOVE,
    @SerializedName("rename") RENAME
}
