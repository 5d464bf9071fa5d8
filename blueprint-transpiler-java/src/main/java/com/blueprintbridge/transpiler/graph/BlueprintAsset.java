package com.blueprintbridge.transpiler.graph;

import java.util.List;

/** The parsed, immutable Blueprint: one class, its variables and its graphs. */
public record BlueprintAsset(
        String className,
        String parentClass,
        List<Variable> variables,
        List<GraphDefinition> graphs
) {
    public BlueprintAsset {
        variables = List.copyOf(variables);
        graphs = List.copyOf(graphs);
    }

    public List<GraphDefinition> graphsOfType(GraphType type) {
        return graphs.stream().filter(g -> g.graphType() == type).toList();
    }

    public int nodeCount() {
        return graphs.stream().mapToInt(g -> g.nodes().size()).sum();
    }

    /** Custom event nodes across all event graphs, in graph then node order. */
    public List<Node> customEvents() {
        return graphsOfType(GraphType.EVENT).stream()
                .flatMap(g -> g.nodesOfKind(NodeKind.CUSTOM_EVENT).stream())
                .toList();
    }

    /** Function graphs plus custom events. */
    public int functionCount() {
        return graphsOfType(GraphType.FUNCTION).size() + customEvents().size();
    }
}
