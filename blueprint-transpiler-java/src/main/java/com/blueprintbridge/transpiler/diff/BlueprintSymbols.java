package com.blueprintbridge.transpiler.diff;

import com.blueprintbridge.transpiler.emit.ClassLayout;
import com.blueprintbridge.transpiler.emit.MethodSignature;
import com.blueprintbridge.transpiler.symbols.CodeSymbol;
import com.blueprintbridge.transpiler.symbols.SymbolKind;
import com.blueprintbridge.transpiler.symbols.ValueType;

import java.util.ArrayList;
import java.util.List;

/**
 * The Blueprint side of a diff: the symbols the emitter would declare for the asset, named
 * and typed exactly as in emitted code so they compare directly with extracted symbols.
 */
final class BlueprintSymbols {

    private BlueprintSymbols() {}

    static List<CodeSymbol> of(ClassLayout layout) {
        List<CodeSymbol> symbols = new ArrayList<>();
        for (ClassLayout.Property property : layout.properties()) {
            symbols.add(new CodeSymbol(SymbolKind.VARIABLE, property.name(), layout.className(),
                    ValueType.fromCppType(property.cppType()), property.cppType(), List.of(), 0));
        }
        for (MethodSignature method : layout.methods()) {
            List<CodeSymbol.Param> params = new ArrayList<>();
            for (MethodSignature.Param param : method.params()) {
                params.add(new CodeSymbol.Param(ValueType.fromCppType(param.type()), param.type(), param.isOptional()));
            }
            symbols.add(new CodeSymbol(SymbolKind.FUNCTION, method.name(), layout.className(),
                    ValueType.fromCppType(method.returnType()), method.returnType(), params, 0));
        }
        return symbols;
    }
}
