package com.blueprintbridge.transpiler.flow;

import com.blueprintbridge.transpiler.graph.GraphType;
import com.blueprintbridge.transpiler.graph.Node;
import com.blueprintbridge.transpiler.report.Warning;

import java.util.List;
import java.util.Optional;

/** Ordered statement tree of one graph: one body per entry node, plus resolution warnings. */
public record StatementTree(String graphName, GraphType graphType, List<EntryPoint> entries, List<Warning> warnings) {

    public StatementTree {
        entries = List.copyOf(entries);
        warnings = List.copyOf(warnings);
    }

    public Optional<EntryPoint> entry(String nodeId) {
        return entries.stream().filter(e -> e.node().id().equals(nodeId)).findFirst();
    }

    public record EntryPoint(Node node, Block body) {
    }
}
