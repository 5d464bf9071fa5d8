package com.blueprintbridge.transpiler.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one transpile invocation. Component order is the JSON field order.
 *
 * @param identifierMap raw Blueprint name to emitted C++ identifier, in encounter order
 */
public record TranspileResult(
        String className,
        String parentClass,
        String headerCode,
        String sourceCode,
        int nodeCount,
        int functionCount,
        List<Warning> warnings,
        String headerFileName,
        String sourceFileName,
        List<String> includes,
        Map<String, String> identifierMap
) {
    public TranspileResult {
        warnings = List.copyOf(warnings);
        includes = List.copyOf(includes);
        identifierMap = Collections.unmodifiableMap(new LinkedHashMap<>(identifierMap));
    }
}
