package com.blueprintbridge.transpiler.graph;

import com.blueprintbridge.transpiler.report.Severity;
import com.blueprintbridge.transpiler.report.Warning;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Checks every pin link of a graph. A link must name a node of the same graph that has a pin
 * of the opposite direction and a compatible type. Bad links are reported, never removed.
 */
public class LinkValidator {

    public List<Warning> validate(GraphDefinition graph) {
        List<Warning> warnings = new ArrayList<>();
        for (Node node : graph.nodes()) {
            for (Pin pin : node.pins()) {
                for (String targetId : pin.linkedTo()) {
                    Optional<Node> target = graph.node(targetId);
                    if (target.isEmpty()) {
                        warnings.add(Warning.atNode(Severity.WARNING, node.id(),
                                "dangling link: pin " + pin.name() + " on node " + node.id()
                                        + " in " + graph.graphName() + " links to missing node " + targetId));
                    } else if (!hasMatchingPin(target.get(), pin)) {
                        warnings.add(Warning.atNode(Severity.WARNING, node.id(),
                                "incompatible link: " + (pin.isExec() ? "exec" : pin.type().name().toLowerCase(Locale.ROOT))
                                        + " pin " + pin.name() + " on node " + node.id()
                                        + " links to node " + targetId + ", which has no matching "
                                        + (pin.isOutput() ? "input" : "output") + " pin"));
                    }
                }
            }
        }
        return warnings;
    }

    private boolean hasMatchingPin(Node target, Pin pin) {
        PinDirection wanted = pin.direction().opposite();
        for (Pin candidate : target.pins()) {
            if (candidate.direction() != wanted || candidate.isExec() != pin.isExec()) continue;
            if (pin.isExec() || candidate.type().linksWith(pin.type())) return true;
        }
        return false;
    }
}
