package com.blueprintbridge.transpiler.emit;

import com.blueprintbridge.transpiler.emit.IdentifierMap.Kind;
import com.blueprintbridge.transpiler.flow.Block;
import com.blueprintbridge.transpiler.flow.Expression;
import com.blueprintbridge.transpiler.flow.Expression.*;
import com.blueprintbridge.transpiler.flow.ExpressionVisitor;
import com.blueprintbridge.transpiler.flow.Statement;
import com.blueprintbridge.transpiler.flow.Statement.*;
import com.blueprintbridge.transpiler.flow.StatementVisitor;
import com.blueprintbridge.transpiler.flow.Temporary;
import com.blueprintbridge.transpiler.graph.TypeTag;
import com.blueprintbridge.transpiler.report.Warning;

import java.util.*;

/**
 * Writes one method body from its statement block. Statements go to the writer; expressions
 * render to strings. Library headers the body needs are collected into {@code includes}.
 */
final class BodyEmitter implements StatementVisitor<Void>, ExpressionVisitor<String> {

    /** Static library calls the emitter knows without a MemberParent. */
    private static final Map<String, String> DEFAULT_LIBRARY = Map.of(
            "PrintString", "UKismetSystemLibrary",
            "PrintText", "UKismetSystemLibrary",
            "Delay", "UKismetSystemLibrary");

    private static final Set<String> WORLD_CONTEXT_FUNCTIONS = Set.of(
            "PrintString", "PrintText", "Delay", "GetPlayerController", "GetPlayerPawn",
            "GetPlayerCharacter", "GetAllActorsOfClass", "PlaySoundAtLocation", "SpawnEmitterAtLocation");

    private final ClassLayout layout;
    private final MethodSignature method;
    private final SourceWriter writer;
    private final Set<String> includes;
    private final List<Warning> warnings;

    BodyEmitter(ClassLayout layout, MethodSignature method, SourceWriter writer, Set<String> includes,
                List<Warning> warnings) {
        this.layout = layout;
        this.method = method;
        this.writer = writer;
        this.includes = includes;
        this.warnings = warnings;
    }

    void emit(Block block) {
        for (Statement statement : block.statements()) {
            statement.accept(this);
        }
    }

    // --- Statements ---

    @Override
    public Void visitCall(CallStatement call) {
        String rendered = renderCall(call.function(), call.owner(), call.target(), call.arguments());
        Temporary result = call.result();
        writer.line(result == null ? rendered + ";" : declare(result) + " = " + rendered + ";");
        return null;
    }

    @Override
    public Void visitAssign(AssignStatement assign) {
        writer.line(layout.identifiers().resolve(Kind.VARIABLE, assign.variable()) + " = " + expr(assign.value()) + ";");
        return null;
    }

    @Override
    public Void visitBranch(BranchStatement branch) {
        writer.line("if (" + expr(branch.condition()) + ")");
        writer.open();
        emit(branch.thenBlock());
        writer.close();
        if (!branch.elseBlock().isEmpty()) {
            writer.line("else");
            writer.open();
            emit(branch.elseBlock());
            writer.close();
        }
        return null;
    }

    @Override
    public Void visitLoop(LoopStatement loop) {
        List<Expression> operands = loop.operands();
        switch (loop.kind()) {
            case FOR -> writer.line("for (int32 " + loop.indexName() + " = " + expr(operands.get(0)) + "; "
                    + loop.indexName() + " <= " + expr(operands.get(1)) + "; ++" + loop.indexName() + ")");
            case FOR_EACH -> writer.line("for (int32 " + loop.indexName() + " = 0; " + loop.indexName() + " < "
                    + expr(operands.get(0)) + ".Num(); ++" + loop.indexName() + ")");
            case WHILE -> writer.line("while (" + expr(operands.get(0)) + ")");
        }
        writer.open();
        if (loop.elementName() != null) {
            writer.line("auto& " + loop.elementName() + " = " + expr(operands.get(0)) + "[" + loop.indexName() + "];");
        }
        emit(loop.body());
        writer.close();
        return null;
    }

    @Override
    public Void visitReturn(ReturnStatement ret) {
        if (!method.returnsValue()) {
            writer.line("return;");
        } else if (ret.value() == null) {
            writer.line("return " + CppTypes.zeroValue(method.returnType()) + ";");
        } else {
            writer.line("return " + expr(ret.value()) + ";");
        }
        return null;
    }

    @Override
    public Void visitTemporary(TemporaryStatement temporary) {
        writer.line(declare(temporary.temporary()) + " = " + expr(temporary.value()) + ";");
        return null;
    }

    @Override
    public Void visitStub(StubStatement stub) {
        writer.line("// Unsupported node " + stub.nodeClass() + " \"" + stub.nodeName() + "\" (" + stub.nodeId() + ")");
        writer.line("(void)0;");
        return null;
    }

    @Override
    public Void visitCycle(CycleStatement cycle) {
        writer.line("// Exec path returns to \"" + cycle.nodeName() + "\" (" + cycle.nodeId() + "); not followed");
        writer.line("(void)0;");
        return null;
    }

    // --- Expressions ---

    String expr(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public String visitLiteral(Literal literal) {
        return CppTypes.literal(literal.text(), CppTypes.forPin(literal.type(), literal.category(), null));
    }

    @Override
    public String visitVariable(VariableRef variable) {
        return layout.identifiers().resolve(Kind.VARIABLE, variable.name());
    }

    @Override
    public String visitParameter(ParameterRef parameter) {
        List<MethodSignature.Param> params = method.params();
        if (parameter.index() >= 0 && parameter.index() < params.size()) {
            return params.get(parameter.index()).name();
        }
        warnings.add(Warning.warning("parameter " + parameter.name() + " is not declared by "
                + method.name() + "; using zero value"));
        return "/* unresolved: parameter " + parameter.name().replace("*/", "* /") + " */ 0";
    }

    @Override
    public String visitSelf(SelfRef self) {
        return "this";
    }

    @Override
    public String visitCall(CallExpression call) {
        return renderCall(call.function(), call.owner(), call.target(), call.arguments());
    }

    @Override
    public String visitOperator(OperatorExpression operator) {
        if (operator.isUnary()) {
            return operator.symbol() + operand(operator.operands().get(0));
        }
        StringJoiner joined = new StringJoiner(" " + operator.symbol() + " ");
        for (Expression operand : operator.operands()) {
            joined.add(operand(operand));
        }
        return joined.toString();
    }

    private String operand(Expression operand) {
        String text = expr(operand);
        return operand instanceof OperatorExpression nested && !nested.isUnary() ? "(" + text + ")" : text;
    }

    @Override
    public String visitTemporary(TemporaryRef temporary) {
        return temporary.temporary().name();
    }

    @Override
    public String visitLoopVariable(LoopVariableRef loopVariable) {
        return loopVariable.name();
    }

    @Override
    public String visitZero(ZeroValue zero) {
        return CppTypes.zeroValue(CppTypes.forPin(zero.type(), zero.category(), zero.objectClass()));
    }

    @Override
    public String visitUnresolved(Unresolved unresolved) {
        TypeTag type = unresolved.type() == null ? TypeTag.WILDCARD : unresolved.type();
        return "/* unresolved: " + unresolved.reason().replace("*/", "* /") + " */ "
                + CppTypes.zeroValue(CppTypes.forPin(type, null, null));
    }

    // --- Helpers ---

    private String renderCall(String function, String owner, Expression target, List<Expression> arguments) {
        List<String> args = new ArrayList<>();
        for (Expression argument : arguments) {
            args.add(expr(argument));
        }
        if (target != null && !(target instanceof SelfRef)) {
            return expr(target) + "->" + IdentifierSanitizer.sanitize(function) + "(" + String.join(", ", args) + ")";
        }
        String library = libraryClass(function, owner);
        if (library != null) {
            if (WORLD_CONTEXT_FUNCTIONS.contains(function) && arguments.stream().noneMatch(a -> a instanceof SelfRef)) {
                args.add(0, "this");
            }
            if (library.startsWith("UKismet") || library.equals("UGameplayStatics")) {
                includes.add("Kismet/" + library.substring(1) + ".h");
            }
            return library + "::" + IdentifierSanitizer.sanitize(function) + "(" + String.join(", ", args) + ")";
        }
        String name = layout.identifiers().lookup(Kind.FUNCTION, function)
                .or(() -> layout.identifiers().lookup(Kind.EVENT, function))
                .orElseGet(() -> IdentifierSanitizer.sanitize(function));
        return name + "(" + String.join(", ", args) + ")";
    }

    /** Static function library a call belongs to, or null for member calls. */
    private static String libraryClass(String function, String owner) {
        if (owner == null || owner.isBlank()) return DEFAULT_LIBRARY.get(function);
        String name = owner.trim();
        int dot = name.lastIndexOf('.');
        if (dot >= 0) name = name.substring(dot + 1);
        name = IdentifierSanitizer.sanitize(name);
        boolean library = name.endsWith("Library") || name.endsWith("GameplayStatics");
        if (!library) return null;
        return name.startsWith("U") && name.length() > 1 && Character.isUpperCase(name.charAt(1)) ? name : "U" + name;
    }

    private static String declare(Temporary temporary) {
        return CppTypes.forPin(temporary.type(), temporary.category(), temporary.objectClass()) + " " + temporary.name();
    }
}
