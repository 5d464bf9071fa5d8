package com.blueprintbridge.transpiler.flow;

import java.util.List;

/**
 * One statement of a reconstructed exec chain. Every statement keeps the id of the graph node
 * it came from, so emitted code can be traced back to the graph.
 */
public sealed interface Statement {

    String nodeId();

    <R> R accept(StatementVisitor<R> visitor);

    /**
     * Impure function call. {@code result} is non-null when a later node reads one of the
     * call's outputs.
     */
    record CallStatement(String nodeId, String function, String owner, Expression target,
                         List<Expression> arguments, Temporary result) implements Statement {
        public CallStatement {
            arguments = List.copyOf(arguments);
        }
        public <R> R accept(StatementVisitor<R> v) { return v.visitCall(this); }
    }

    record AssignStatement(String nodeId, String variable, Expression value) implements Statement {
        public <R> R accept(StatementVisitor<R> v) { return v.visitAssign(this); }
    }

    record BranchStatement(String nodeId, Expression condition, Block thenBlock, Block elseBlock)
            implements Statement {
        public <R> R accept(StatementVisitor<R> v) { return v.visitBranch(this); }
    }

    /**
     * Loop macro. Operands are [first, last] for FOR, [array] for FOR_EACH and [condition] for
     * WHILE. {@code elementName} is null except for FOR_EACH.
     */
    record LoopStatement(String nodeId, LoopKind kind, List<Expression> operands,
                         String indexName, String elementName, Block body) implements Statement {
        public LoopStatement {
            operands = List.copyOf(operands);
        }
        public <R> R accept(StatementVisitor<R> v) { return v.visitLoop(this); }
    }

    /** {@code value} is null for functions without a return value. */
    record ReturnStatement(String nodeId, Expression value) implements Statement {
        public <R> R accept(StatementVisitor<R> v) { return v.visitReturn(this); }
    }

    /** Declaration of a shared pure value before its first consumer. */
    record TemporaryStatement(String nodeId, Temporary temporary, Expression value) implements Statement {
        public <R> R accept(StatementVisitor<R> v) { return v.visitTemporary(this); }
    }

    /** Placeholder for a node that cannot be translated. */
    record StubStatement(String nodeId, String nodeClass, String nodeName) implements Statement {
        public <R> R accept(StatementVisitor<R> v) { return v.visitStub(this); }
    }

    /** The walk reached a node already on its path; descent stopped here. */
    record CycleStatement(String nodeId, String nodeName) implements Statement {
        public <R> R accept(StatementVisitor<R> v) { return v.visitCycle(this); }
    }

    enum LoopKind {
        FOR, FOR_EACH, WHILE;

        static LoopKind fromMacro(String member) {
            if ("ForEachLoop".equals(member)) return FOR_EACH;
            if ("WhileLoop".equals(member)) return WHILE;
            return FOR;
        }
    }
}
