package com.blueprintbridge.transpiler.emit;

import com.blueprintbridge.transpiler.report.Warning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Header and source text for one class, with the emitter's own warnings. */
public record EmittedCode(
        String className,
        String parentClass,
        String headerFileName,
        String sourceFileName,
        String headerCode,
        String sourceCode,
        List<String> includes,
        Map<String, String> identifierMap,
        List<Warning> warnings
) {
    public EmittedCode {
        includes = List.copyOf(includes);
        identifierMap = Collections.unmodifiableMap(new LinkedHashMap<>(identifierMap));
        warnings = List.copyOf(warnings);
    }
}
