package com.blueprintbridge.transpiler.graph;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One Blueprint graph. Nodes form an arena keyed by their graph-local id; every edge is an
 * id lookup through {@link #node(String)}. Node ids are unique (the parser drops duplicates).
 */
public final class GraphDefinition {

    private final String graphName;
    private final GraphType graphType;
    private final List<Node> nodes;
    private final Map<String, Integer> indexById;

    public GraphDefinition(String graphName, GraphType graphType, List<Node> nodes) {
        this.graphName = graphName;
        this.graphType = graphType;
        this.nodes = List.copyOf(nodes);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            index.putIfAbsent(this.nodes.get(i).id(), i);
        }
        this.indexById = Collections.unmodifiableMap(index);
    }

    public String graphName()  { return graphName; }
    public GraphType graphType() { return graphType; }
    public List<Node> nodes()  { return nodes; }

    public Optional<Node> node(String id) {
        Integer i = indexById.get(id);
        return i == null ? Optional.empty() : Optional.of(nodes.get(i));
    }

    /** Position of the node in the export's node array; used to break ordering ties. */
    public int indexOf(String id) {
        Integer i = indexById.get(id);
        return i == null ? Integer.MAX_VALUE : i;
    }

    public List<Node> nodesOfKind(NodeKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).toList();
    }
}
