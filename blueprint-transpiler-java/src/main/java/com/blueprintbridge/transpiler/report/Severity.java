package com.blueprintbridge.transpiler.report;

import com.google.gson.annotations.SerializedName;

public enum Severity {
    @SerializedName("info")    INFO,
    @SerializedName("warning") WARNING,
    @SerializedName("error")   ERROR
}
