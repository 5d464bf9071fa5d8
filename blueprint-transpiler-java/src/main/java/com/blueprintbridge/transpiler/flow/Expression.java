package com.blueprintbridge.transpiler.flow;

import com.blueprintbridge.transpiler.graph.TypeTag;

import java.util.List;

/**
 * A value expression resolved backward along data links. Expressions are immutable trees and are
 * rendered inline by the emitter; shared values appear as {@link TemporaryRef}s.
 */
public sealed interface Expression {

    <R> R accept(ExpressionVisitor<R> visitor);

    /** Inline default of an unconnected input pin, in Blueprint text form ("100.0", "Player Spawned!"). */
    record Literal(String text, TypeTag type, String category) implements Expression {
        public <R> R accept(ExpressionVisitor<R> v) { return v.visitLiteral(this); }
    }

    /** Member variable read, by raw Blueprint name. */
    record VariableRef(String name) implements Expression {
        public <R> R accept(ExpressionVisitor<R> v) { return v.visitVariable(this); }
    }

    /** Data output of the event or entry node; {@code index} is its position among those outputs. */
    record ParameterRef(String name, int index) implements Expression {
        public <R> R accept(ExpressionVisitor<R> v) { return v.visitParameter(this); }
    }

    record SelfRef() implements Expression {
        public <R> R accept(ExpressionVisitor<R> v) { return v.visitSelf(this); }
    }

    /**
     * Call of a pure function. {@code target} is null when the call is on self or static
     * on {@code owner} (the MemberParent, may be null).
     */
    record CallExpression(String function, String owner, Expression target, List<Expression> arguments)
            implements Expression {
        public CallExpression {
            arguments = List.copyOf(arguments);
        }
        public <R> R accept(ExpressionVisitor<R> v) { return v.visitCall(this); }
    }

    /** Infix (two or more operands, left-folded) or prefix (one operand) operator. */
    record OperatorExpression(String symbol, List<Expression> operands) implements Expression {
        public OperatorExpression {
            operands = List.copyOf(operands);
        }
        public boolean isUnary() { return operands.size() == 1; }
        public <R> R accept(ExpressionVisitor<R> v) { return v.visitOperator(this); }
    }

    record TemporaryRef(Temporary temporary) implements Expression {
        public <R> R accept(ExpressionVisitor<R> v) { return v.visitTemporary(this); }
    }

    /** Index or element variable of an enclosing loop. */
    record LoopVariableRef(String name) implements Expression {
        public <R> R accept(ExpressionVisitor<R> v) { return v.visitLoopVariable(this); }
    }

    /** Zero value of an unconnected input that has no default. */
    record ZeroValue(TypeTag type, String category, String objectClass) implements Expression {
        public <R> R accept(ExpressionVisitor<R> v) { return v.visitZero(this); }
    }

    /** A value that could not be resolved; rendered as a commented zero value. */
    record Unresolved(String reason, TypeTag type) implements Expression {
        public <R> R accept(ExpressionVisitor<R> v) { return v.visitUnresolved(this); }
    }
}
