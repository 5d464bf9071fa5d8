package com.blueprintbridge.transpiler.symbols;

import com.blueprintbridge.transpiler.report.Warning;

import java.util.List;

/** Everything extracted from one source text. Partial when {@code warnings} says so. */
public record SymbolTable(List<ClassSymbol> classes, List<CodeSymbol> symbols, List<Warning> warnings, boolean blankInput) {

    public SymbolTable {
        classes = List.copyOf(classes);
        symbols = List.copyOf(symbols);
        warnings = List.copyOf(warnings);
    }

    public List<CodeSymbol> variables() {
        return symbols.stream().filter(s -> s.kind() == SymbolKind.VARIABLE).toList();
    }

    public List<CodeSymbol> functions() {
        return symbols.stream().filter(s -> s.kind() == SymbolKind.FUNCTION).toList();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }
}
