package com.blueprintbridge.transpiler.flow;

import com.blueprintbridge.transpiler.graph.TypeTag;

/** A named local holding a shared or impure value, typed from the producing output pin. */
public record Temporary(String name, TypeTag type, String category, String objectClass) {
}
