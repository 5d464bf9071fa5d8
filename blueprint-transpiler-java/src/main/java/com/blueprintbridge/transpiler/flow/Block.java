package com.blueprintbridge.transpiler.flow;

import java.util.List;

/** An ordered statement list; branch arms and loop bodies are nested blocks. */
public record Block(List<Statement> statements) {

    public static final Block EMPTY = new Block(List.of());

    public Block {
        statements = List.copyOf(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    /** Statements in this block and all nested blocks. */
    public int deepSize() {
        int size = 0;
        for (Statement statement : statements) {
            size++;
            if (statement instanceof Statement.BranchStatement branch) {
                size += branch.thenBlock().deepSize() + branch.elseBlock().deepSize();
            } else if (statement instanceof Statement.LoopStatement loop) {
                size += loop.body().deepSize();
            }
        }
        return size;
    }
}
