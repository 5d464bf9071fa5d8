package com.blueprintbridge.transpiler.graph;

import com.google.gson.annotations.SerializedName;
import java.util.Locale;

/** Pin and variable type category. */
public enum TypeTag {
    @SerializedName("exec")     EXEC,
    @SerializedName("bool")     BOOL,
    @SerializedName("int")      INT,
    @SerializedName("float")    FLOAT,
    @SerializedName("string")   STRING,
    @SerializedName("object")   OBJECT,
    @SerializedName("wildcard") WILDCARD;

    /**
     * Maps an export category ("float", "real", "name", "struct", "Array&lt;int&gt;", ...) to a tag.
     * Returns null for categories that are not recognized.
     */
    public static TypeTag fromCategory(String category) {
        if (category == null || category.isBlank()) return null;
        String c = category.trim().toLowerCase(Locale.ROOT);
        if (c.startsWith("array") || c.startsWith("tarray") || c.startsWith("map")
                || c.startsWith("tmap") || c.startsWith("set") || c.startsWith("tset")) {
            return OBJECT;
        }
        return switch (c) {
            case "exec" -> EXEC;
            case "bool", "boolean" -> BOOL;
            case "int", "int32", "int64", "integer", "byte", "uint8", "enum" -> INT;
            case "float", "double", "real" -> FLOAT;
            case "string", "name", "text", "fstring", "fname", "ftext" -> STRING;
            case "object", "class", "struct", "interface", "softobject", "softclass", "actor",
                 "vector", "rotator", "transform", "color", "delegate" -> OBJECT;
            case "wildcard" -> WILDCARD;
            default -> null;
        };
    }

    /** Whether a link between pins of these two tags is type-compatible. */
    public boolean linksWith(TypeTag other) {
        return this == other || this == WILDCARD || other == WILDCARD;
    }
}
