package com.blueprintbridge.transpiler.symbols;

import com.google.gson.annotations.SerializedName;

public enum SymbolKind {
    @SerializedName("variable") VARIABLE,
    @SerializedName("function") FUNCTION
}
