package com.blueprintbridge.transpiler.symbols;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A comparable declaration: name, kind, owning class and coarse signature. For variables
 * {@code type} is the variable's type and {@code params} is empty; for functions it is the
 * return type. {@code line} is 1-based, or 0 for symbols built from a graph.
 */
public record CodeSymbol(
        SymbolKind kind,
        String name,
        String container,
        ValueType type,
        String typeText,
        List<Param> params,
        int line
) {
    /** One parameter; {@code optional} when it has a default argument. */
    public record Param(ValueType type, String typeText, boolean optional) {}

    public CodeSymbol {
        params = List.copyOf(params);
    }

    public boolean isFunction() {
        return kind == SymbolKind.FUNCTION;
    }

    /** Same return/variable type and parameter types, ignoring names and defaults. */
    public boolean sameSignature(CodeSymbol other) {
        if (kind != other.kind || type != other.type || params.size() != other.params.size()) return false;
        for (int i = 0; i < params.size(); i++) {
            if (params.get(i).type() != other.params.get(i).type()) return false;
        }
        return true;
    }

    /** "float Health" or "void TakeDamage(float)". */
    public String summary() {
        if (!isFunction()) return typeText + " " + name;
        return typeText + " " + name + "(" + params.stream().map(Param::typeText).collect(Collectors.joining(", ")) + ")";
    }
}
