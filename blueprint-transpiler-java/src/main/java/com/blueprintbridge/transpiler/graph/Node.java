package com.blueprintbridge.transpiler.graph;

import java.util.List;
import java.util.Optional;

/**
 * A graph node. {@code rawClass} is the short export class ("K2Node_Timeline") and is what
 * stubs and warnings report for {@link NodeKind#UNSUPPORTED} nodes. Position is layout only.
 */
public record Node(
        String id,
        NodeKind kind,
        String rawClass,
        String name,
        String memberName,
        String memberParent,
        String comment,
        List<Pin> pins,
        double posX,
        double posY
) {
    public Node {
        pins = List.copyOf(pins);
    }

    /** MemberName when present, else the display name. */
    public String member() {
        return memberName != null ? memberName : name;
    }

    public List<Pin> execOutputs() {
        return pins.stream().filter(p -> p.isExec() && p.isOutput()).toList();
    }

    public List<Pin> execInputs() {
        return pins.stream().filter(p -> p.isExec() && p.isInput()).toList();
    }

    public List<Pin> dataInputs() {
        return pins.stream().filter(p -> !p.isExec() && p.isInput()).toList();
    }

    public List<Pin> dataOutputs() {
        return pins.stream().filter(p -> !p.isExec() && p.isOutput()).toList();
    }

    /** True for nodes with no exec pins at all, i.e. value producers evaluated on demand. */
    public boolean isPure() {
        return pins.stream().noneMatch(Pin::isExec);
    }

    public Optional<Pin> pin(PinDirection direction, String pinName) {
        return pins.stream()
                .filter(p -> p.direction() == direction && p.name().equalsIgnoreCase(pinName))
                .findFirst();
    }
}
