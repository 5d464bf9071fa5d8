package com.blueprintbridge.transpiler.symbols;

import com.google.gson.annotations.SerializedName;

/** Coarse type tag used to compare signatures across the graph and the C++ side. */
public enum ValueType {
    @SerializedName("void")   VOID,
    @SerializedName("bool")   BOOL,
    @SerializedName("int")    INT,
    @SerializedName("float")  FLOAT,
    @SerializedName("string") STRING,
    @SerializedName("object") OBJECT;

    /**
     * Classifies C++ type text. Qualifiers, references and the class/struct keywords are
     * ignored; pointers and templates are objects; enums named E* count as integers.
     */
    public static ValueType fromCppType(String cppType) {
        if (cppType == null) return OBJECT;
        String t = cppType
                .replaceAll("\\b(const|volatile|class|struct|typename|unsigned|signed)\\b", " ")
                .replace("&", " ")
                .trim()
                .replaceAll("\\s+", " ");
        if (t.isEmpty()) return INT; // bare "unsigned"
        if (t.contains("*")) return OBJECT;
        if (t.startsWith("TEnumAsByte<")) return INT;
        if (t.contains("<")) return OBJECT;
        switch (t) {
            case "void": return VOID;
            case "bool": return BOOL;
            case "int": case "short": case "long": case "long long": case "char": case "short int": case "long int":
            case "int8": case "int16": case "int32": case "int64":
            case "uint8": case "uint16": case "uint32": case "uint64": case "size_t":
                return INT;
            case "float": case "double": case "long double":
                return FLOAT;
            case "FString": case "FName": case "FText":
                return STRING;
            default:
                break;
        }
        if (t.length() > 1 && t.charAt(0) == 'E' && Character.isUpperCase(t.charAt(1))) return INT;
        return OBJECT;
    }

    /** True when a value of this type converts to {@code wider} without loss (bool &lt; int &lt; float). */
    public boolean widensTo(ValueType wider) {
        return rank() > 0 && wider.rank() > rank();
    }

    /**
     * Storage width in bits of a numeric C++ spelling, or 0 when it is not a plain number type.
     * Orders spellings that share a tag, such as int32 and int64, or float and double.
     */
    public static int bitWidth(String cppType) {
        if (cppType == null) return 0;
        String t = cppType.replaceAll("\\b(const|volatile|unsigned|signed)\\b", " ")
                .replace("&", " ")
                .trim()
                .replaceAll("\\s+", " ");
        return switch (t) {
            case "bool" -> 1;
            case "char", "int8", "uint8" -> 8;
            case "short", "short int", "int16", "uint16" -> 16;
            case "", "int", "int32", "uint32", "float" -> 32;
            case "long", "long int", "long long", "int64", "uint64", "size_t", "double" -> 64;
            case "long double" -> 80;
            default -> 0;
        };
    }

    private int rank() {
        return switch (this) {
            case BOOL -> 1;
            case INT -> 2;
            case FLOAT -> 3;
            default -> 0;
        };
    }
}
