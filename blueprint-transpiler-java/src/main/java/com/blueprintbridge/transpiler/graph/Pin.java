package com.blueprintbridge.transpiler.graph;

import java.util.List;

/**
 * A pin on a node. {@code linkedTo} holds ids of the nodes on the other end of each link.
 * {@code category} is the raw PinCategory ("real", "name", ...) and {@code objectClass} the
 * PinSubCategoryObject of object pins; both are null when absent.
 */
public record Pin(
        String name,
        PinDirection direction,
        TypeTag type,
        String category,
        String objectClass,
        List<String> linkedTo,
        String defaultValue
) {
    public Pin {
        linkedTo = List.copyOf(linkedTo);
    }

    public boolean isExec()   { return type == TypeTag.EXEC; }
    public boolean isInput()  { return direction == PinDirection.IN; }
    public boolean isOutput() { return direction == PinDirection.OUT; }
    public boolean isLinked() { return !linkedTo.isEmpty(); }
}
