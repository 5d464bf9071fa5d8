package com.blueprintbridge.transpiler.flow;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Math-library members that are rendered as C++ operators instead of calls.
 * Keys are member-name prefixes; longer prefixes are listed before their shorter forms.
 */
public final class OperatorTable {

    private static final Map<String, String> PREFIXES = new LinkedHashMap<>();
    static {
        PREFIXES.put("Add_", "+");
        PREFIXES.put("Subtract_", "-");
        PREFIXES.put("Multiply_", "*");
        PREFIXES.put("Divide_", "/");
        PREFIXES.put("Percent_", "%");
        PREFIXES.put("LessEqual_", "<=");
        PREFIXES.put("GreaterEqual_", ">=");
        PREFIXES.put("Less_", "<");
        PREFIXES.put("Greater_", ">");
        PREFIXES.put("EqualEqual_", "==");
        PREFIXES.put("NotEqual_", "!=");
        PREFIXES.put("BooleanAND", "&&");
        PREFIXES.put("BooleanOR", "||");
        PREFIXES.put("Not_PreBool", "!");
    }

    private OperatorTable() {}

    public static Optional<String> symbolFor(String member) {
        if (member == null) return Optional.empty();
        for (Map.Entry<String, String> e : PREFIXES.entrySet()) {
            if (member.startsWith(e.getKey())) return Optional.of(e.getValue());
        }
        return Optional.empty();
    }

    /** Unary operators take exactly one operand. */
    public static boolean isUnary(String symbol) {
        return "!".equals(symbol);
    }
}
