package com.blueprintbridge.transpiler.graph;

import java.util.Set;

/**
 * Closed set of node kinds the transpiler understands. Anything else parses as
 * {@link #UNSUPPORTED} and keeps its raw class string on the {@link Node}.
 */
public enum NodeKind {
    EVENT,
    CUSTOM_EVENT,
    FUNCTION_ENTRY,
    RETURN,
    CALL_FUNCTION,
    VARIABLE_GET,
    VARIABLE_SET,
    BRANCH,
    SEQUENCE,
    LOOP,
    BINARY_OPERATOR,
    SELF,
    REROUTE,
    UNSUPPORTED;

    private static final Set<String> LOOP_MACROS = Set.of("ForLoop", "ForEachLoop", "WhileLoop");

    /**
     * @param shortClass node class without its package path, e.g. "K2Node_CallFunction"
     * @param member     MemberName (or Name) of the node; selects the loop flavour of macro instances
     */
    public static NodeKind classify(String shortClass, String member) {
        return switch (shortClass) {
            case "K2Node_Event" -> EVENT;
            case "K2Node_CustomEvent" -> CUSTOM_EVENT;
            case "K2Node_FunctionEntry" -> FUNCTION_ENTRY;
            case "K2Node_FunctionResult" -> RETURN;
            case "K2Node_CallFunction" -> CALL_FUNCTION;
            case "K2Node_VariableGet" -> VARIABLE_GET;
            case "K2Node_VariableSet" -> VARIABLE_SET;
            case "K2Node_IfThenElse" -> BRANCH;
            case "K2Node_ExecutionSequence", "K2Node_Sequence" -> SEQUENCE;
            case "K2Node_MacroInstance" -> member != null && LOOP_MACROS.contains(member) ? LOOP : UNSUPPORTED;
            case "K2Node_CommutativeAssociativeBinaryOperator" -> BINARY_OPERATOR;
            case "K2Node_Self" -> SELF;
            case "K2Node_Knot" -> REROUTE;
            default -> UNSUPPORTED;
        };
    }

    public boolean isEntryPoint() {
        return this == EVENT || this == CUSTOM_EVENT || this == FUNCTION_ENTRY;
    }
}
