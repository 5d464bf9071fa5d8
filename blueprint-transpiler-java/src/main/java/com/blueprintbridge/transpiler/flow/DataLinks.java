package com.blueprintbridge.transpiler.flow;

import com.blueprintbridge.transpiler.graph.GraphDefinition;
import com.blueprintbridge.transpiler.graph.Node;
import com.blueprintbridge.transpiler.graph.NodeKind;
import com.blueprintbridge.transpiler.graph.Pin;
import com.blueprintbridge.transpiler.report.Severity;
import com.blueprintbridge.transpiler.report.Warning;

import java.util.*;

/**
 * Index of data edges: for every data input pin, the producing node and output pin.
 *
 * Links recorded on the input pin win. Inputs without links fall back to output pins of other
 * nodes that name the consumer, claimed in node order so each producer pin feeds one input of a
 * given consumer. Multiple producers for one input are ordered by their position in the graph.
 */
final class DataLinks {

    record Source(Node producer, Pin output) {}

    private final GraphDefinition graph;
    private final Map<Pin, Source> sources = new IdentityHashMap<>();
    private final Map<String, Integer> consumerCounts = new HashMap<>();

    DataLinks(GraphDefinition graph, List<Warning> warnings) {
        this.graph = graph;
        for (Node consumer : graph.nodes()) {
            index(consumer, warnings);
        }
        for (Source source : sources.values()) {
            Source effective = effective(source);
            if (effective != null) {
                consumerCounts.merge(effective.producer().id(), 1, Integer::sum);
            }
        }
    }

    /** Source of a data input, or null when the input is unconnected. */
    Source source(Pin input) {
        return sources.get(input);
    }

    /** Number of input pins, across the graph, whose value comes from the node. */
    int consumerCount(String producerId) {
        return consumerCounts.getOrDefault(producerId, 0);
    }

    /** Follows reroute nodes back to the real producer; null when a reroute has no input. */
    Source effective(Source source) {
        Set<String> seen = new HashSet<>();
        Source current = source;
        while (current != null && current.producer().kind() == NodeKind.REROUTE) {
            if (!seen.add(current.producer().id())) return null;
            Pin knotInput = current.producer().dataInputs().stream().findFirst().orElse(null);
            current = knotInput == null ? null : sources.get(knotInput);
        }
        return current;
    }

    private void index(Node consumer, List<Warning> warnings) {
        Set<String> claimed = new HashSet<>();
        List<Pin> unlinked = new ArrayList<>();

        for (Pin input : consumer.dataInputs()) {
            if (!input.isLinked()) {
                unlinked.add(input);
                continue;
            }
            List<Node> producers = input.linkedTo().stream()
                    .map(graph::node)
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparingInt(n -> graph.indexOf(n.id())))
                    .toList();
            if (producers.isEmpty()) continue;
            if (producers.size() > 1) {
                warnings.add(Warning.atNode(Severity.WARNING, consumer.id(), "data input " + input.name()
                        + " on node " + consumer.id() + " has " + producers.size()
                        + " producers; using the first in node order"));
            }
            Node producer = producers.get(0);
            Pin output = outputFor(producer, consumer, input);
            if (output != null) {
                sources.put(input, new Source(producer, output));
                claimed.add(producer.id() + "/" + output.name());
            }
        }

        for (Pin input : unlinked) {
            for (Node producer : graph.nodes()) {
                if (producer == consumer) continue;
                Pin match = producer.dataOutputs().stream()
                        .filter(o -> o.linkedTo().contains(consumer.id()))
                        .filter(o -> o.type().linksWith(input.type()))
                        .filter(o -> !claimed.contains(producer.id() + "/" + o.name()))
                        .findFirst().orElse(null);
                if (match != null) {
                    sources.put(input, new Source(producer, match));
                    claimed.add(producer.id() + "/" + match.name());
                    break;
                }
            }
        }
    }

    private static Pin outputFor(Node producer, Node consumer, Pin input) {
        List<Pin> outputs = producer.dataOutputs();
        return outputs.stream()
                .filter(o -> o.linkedTo().contains(consumer.id()) && o.type().linksWith(input.type()))
                .findFirst()
                .or(() -> outputs.stream().filter(o -> o.type().linksWith(input.type())).findFirst())
                .or(() -> outputs.stream().findFirst())
                .orElse(null);
    }
}
