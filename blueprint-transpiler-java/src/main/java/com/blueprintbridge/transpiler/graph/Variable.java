package com.blueprintbridge.transpiler.graph;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A Blueprint member variable. {@code type} is the raw export type ("float", "Array&lt;int&gt;",
 * "UStaticMesh") and {@code typeTag} its coarse category. Optional fields are null when absent.
 */
public record Variable(
        String name,
        String type,
        TypeTag typeTag,
        Set<PropertyFlag> propertyFlags,
        String category,
        String defaultValue,
        String tooltip
) {
    public Variable {
        propertyFlags = propertyFlags.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(PropertyFlag.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(propertyFlags));
    }

    public boolean has(PropertyFlag flag) {
        return propertyFlags.contains(flag);
    }
}
