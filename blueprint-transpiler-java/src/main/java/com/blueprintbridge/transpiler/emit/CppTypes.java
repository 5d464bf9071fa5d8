package com.blueprintbridge.transpiler.emit;

import com.blueprintbridge.transpiler.graph.TypeTag;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Blueprint type names and pin types to C++ type text, zero values and literal text. */
public final class CppTypes {

    private static final Map<String, String> TYPE_MAP = Map.ofEntries(
            Map.entry("bool", "bool"),
            Map.entry("boolean", "bool"),
            Map.entry("byte", "uint8"),
            Map.entry("int", "int32"),
            Map.entry("int64", "int64"),
            Map.entry("float", "float"),
            Map.entry("real", "float"),
            Map.entry("double", "double"),
            Map.entry("name", "FName"),
            Map.entry("string", "FString"),
            Map.entry("text", "FText"),
            Map.entry("vector", "FVector"),
            Map.entry("rotator", "FRotator"),
            Map.entry("transform", "FTransform"),
            Map.entry("color", "FLinearColor"),
            Map.entry("object", "UObject*"),
            Map.entry("class", "UClass*"),
            Map.entry("actor", "AActor*"),
            Map.entry("exec", "void"),
            Map.entry("struct", "FStruct"),
            Map.entry("softobject", "TSoftObjectPtr<UObject>"),
            Map.entry("softclass", "TSoftClassPtr<UObject>"));

    private static final Pattern ARRAY = Pattern.compile("^(?:Array|TArray)\\s*<\\s*(.+?)\\s*>$", Pattern.CASE_INSENSITIVE);
    private static final Pattern MAP = Pattern.compile("^(?:Map|TMap)\\s*<\\s*(.+?)\\s*,\\s*(.+?)\\s*>$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SET = Pattern.compile("^(?:Set|TSet)\\s*<\\s*(.+?)\\s*>$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PLAIN_NUMBER = Pattern.compile("^[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?$");

    private CppTypes() {}

    /** C++ type for a variable's raw Blueprint type; unknown types pass through unchanged. */
    public static String forBlueprintType(String bpType) {
        if (bpType == null || bpType.isBlank()) return "int32";
        String trimmed = bpType.trim();
        String direct = TYPE_MAP.get(trimmed.toLowerCase(Locale.ROOT).replaceAll("\\s+", ""));
        if (direct != null) return direct;

        Matcher m = ARRAY.matcher(trimmed);
        if (m.matches()) return "TArray<" + forBlueprintType(m.group(1)) + ">";
        m = MAP.matcher(trimmed);
        if (m.matches()) return "TMap<" + forBlueprintType(m.group(1)) + ", " + forBlueprintType(m.group(2)) + ">";
        m = SET.matcher(trimmed);
        if (m.matches()) return "TSet<" + forBlueprintType(m.group(1)) + ">";
        return trimmed;
    }

    /**
     * C++ type of a pin. The raw category decides when present; object pins use their
     * sub-category class. Wildcards become {@code auto}.
     */
    public static String forPin(TypeTag tag, String category, String objectClass) {
        if (category != null) {
            String key = category.trim().toLowerCase(Locale.ROOT);
            if (key.equals("object") && objectClass != null) return objectClassName(objectClass) + "*";
            if (key.equals("struct") && objectClass != null) return structName(objectClass);
            if (TYPE_MAP.containsKey(key)) return TYPE_MAP.get(key);
        }
        if (tag == TypeTag.OBJECT && objectClass != null) return objectClassName(objectClass) + "*";
        if (tag == null) return "auto";
        return switch (tag) {
            case BOOL -> "bool";
            case INT -> "int32";
            case FLOAT -> "float";
            case STRING -> "FString";
            case OBJECT -> "UObject*";
            case EXEC -> "void";
            case WILDCARD -> "auto";
        };
    }

    /** "/Script/Engine.StaticMesh" becomes "UStaticMesh"; already prefixed names are kept. */
    static String objectClassName(String objectClass) {
        String name = shortName(objectClass);
        if (hasClassPrefix(name)) return name;
        return (name.endsWith("Actor") || name.endsWith("Pawn") || name.endsWith("Character")
                || name.endsWith("Controller") ? "A" : "U") + name;
    }

    /** "/Script/CoreUObject.Vector" becomes "FVector". */
    static String structName(String objectClass) {
        String name = shortName(objectClass);
        return hasClassPrefix(name) ? name : "F" + name;
    }

    private static String shortName(String path) {
        String name = path.trim();
        int dot = name.lastIndexOf('.');
        if (dot >= 0) name = name.substring(dot + 1);
        int slash = name.lastIndexOf('/');
        if (slash >= 0) name = name.substring(slash + 1);
        return IdentifierSanitizer.sanitize(name);
    }

    static boolean hasClassPrefix(String name) {
        return name.length() > 1 && "AUF".indexOf(name.charAt(0)) >= 0 && Character.isUpperCase(name.charAt(1));
    }

    public static String zeroValue(String cppType) {
        return switch (cppType) {
            case "bool" -> "false";
            case "uint8", "int8", "int16", "int32", "int64", "uint16", "uint32", "uint64", "auto" -> "0";
            case "float" -> "0.0f";
            case "double" -> "0.0";
            case "void" -> "";
            default -> cppType.endsWith("*") ? "nullptr" : cppType + "()";
        };
    }

    /** Formats a Blueprint default value as a C++ literal of the given type. */
    public static String literal(String text, String cppType) {
        String value = text.trim();
        switch (cppType) {
            case "FString":
            case "FName":
                return "TEXT(\"" + escape(text) + "\")";
            case "FText":
                return "FText::FromString(TEXT(\"" + escape(text) + "\"))";
            case "bool":
                return value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false")
                        ? value.toLowerCase(Locale.ROOT) : value;
            case "float":
                if (PLAIN_NUMBER.matcher(value).matches()) {
                    if (!value.contains(".") && !value.contains("e") && !value.contains("E")) value = value + ".0";
                    return value + "f";
                }
                return value;
            default:
                return value;
        }
    }

    private static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
