package com.blueprintbridge.transpiler.graph;

import com.google.gson.annotations.SerializedName;
import java.util.Locale;

public enum GraphType {
    @SerializedName("event")    EVENT,
    @SerializedName("function") FUNCTION,
    @SerializedName("macro")    MACRO;

    /** "function" anywhere in the raw type means function, "macro" means macro, else event. */
    public static GraphType fromExport(String raw) {
        String t = raw == null ? "" : raw.toLowerCase(Locale.ROOT);
        if (t.contains("function")) return FUNCTION;
        if (t.contains("macro")) return MACRO;
        return EVENT;
    }
}
