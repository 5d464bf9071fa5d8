package com.blueprintbridge.transpiler.emit;

import java.util.Set;

/**
 * Maps a raw Blueprint name to a valid C++ identifier. Pure and deterministic: whitespace is
 * removed, every other invalid character becomes '_', runs of '_' collapse, a leading digit
 * gets a '_' prefix and a keyword gets a '_' suffix. Case is preserved.
 */
public final class IdentifierSanitizer {

    private static final Set<String> KEYWORDS = Set.of(
            "alignas", "alignof", "and", "asm", "auto", "bool", "break", "case", "catch", "char",
            "class", "const", "constexpr", "const_cast", "continue", "decltype", "default", "delete",
            "do", "double", "dynamic_cast", "else", "enum", "explicit", "export", "extern", "false",
            "float", "for", "friend", "goto", "if", "inline", "int", "long", "mutable", "namespace",
            "new", "noexcept", "not", "nullptr", "operator", "or", "private", "protected", "public",
            "register", "reinterpret_cast", "return", "short", "signed", "sizeof", "static",
            "static_assert", "static_cast", "struct", "switch", "template", "this", "thread_local",
            "throw", "true", "try", "typedef", "typeid", "typename", "union", "unsigned", "using",
            "virtual", "void", "volatile", "wchar_t", "while", "xor");

    private IdentifierSanitizer() {}

    public static String sanitize(String raw) {
        if (raw == null) return "Unnamed";
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (Character.isWhitespace(c)) continue;
            boolean valid = c < 128 && (Character.isLetterOrDigit(c) || c == '_');
            if (!valid) c = '_';
            if (c == '_' && sb.length() > 0 && sb.charAt(sb.length() - 1) == '_') continue;
            sb.append(c);
        }
        String result = sb.toString();
        if (result.isEmpty() || result.equals("_")) return "Unnamed";
        if (Character.isDigit(result.charAt(0))) result = "_" + result;
        if (KEYWORDS.contains(result)) result = result + "_";
        return result;
    }

    public static boolean isKeyword(String identifier) {
        return KEYWORDS.contains(identifier);
    }
}
