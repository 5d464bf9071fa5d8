package com.blueprintbridge.transpiler.flow;

import com.blueprintbridge.transpiler.flow.DataLinks.Source;
import com.blueprintbridge.transpiler.flow.Expression.*;
import com.blueprintbridge.transpiler.flow.Statement.*;
import com.blueprintbridge.transpiler.flow.StatementTree.EntryPoint;
import com.blueprintbridge.transpiler.graph.GraphDefinition;
import com.blueprintbridge.transpiler.graph.GraphType;
import com.blueprintbridge.transpiler.graph.Node;
import com.blueprintbridge.transpiler.graph.NodeKind;
import com.blueprintbridge.transpiler.graph.Pin;
import com.blueprintbridge.transpiler.graph.PinDirection;
import com.blueprintbridge.transpiler.graph.TypeTag;
import com.blueprintbridge.transpiler.report.Severity;
import com.blueprintbridge.transpiler.report.Warning;

import java.util.*;

/**
 * Rebuilds an ordered statement tree from a graph's unordered pin links.
 *
 * Statement order comes from exec edges only. Each entry node (events in event graphs, the
 * FunctionEntry in function graphs) starts a walk that follows the exec chain, nests branch
 * arms and loop bodies, and flattens sequence outputs in pin order. Data inputs are resolved
 * backward into inline expressions; a pure value read by more than one input becomes a
 * temporary declared in the innermost block that first needs it.
 *
 * The walk keeps the ids of the nodes on its current path. Reaching one of them again stops
 * descent with a {@link CycleStatement}, unless the node is an enclosing loop, which is the
 * loop's normal continuation. A statement budget bounds output on diamond-heavy graphs, and
 * a nesting limit bounds how deep exec arms and data expressions may go.
 */
public class ControlFlowResolver {

    static final int STATEMENT_BUDGET = 10_000;
    static final int MAX_NESTING_DEPTH = 128;

    public StatementTree resolve(GraphDefinition graph) {
        return new Walk(graph).run();
    }

    private static final class Scope {
        private final Scope parent;
        private final Map<String, Temporary> values = new HashMap<>();

        Scope(Scope parent) {
            this.parent = parent;
        }

        Temporary lookup(String producerId) {
            for (Scope s = this; s != null; s = s.parent) {
                Temporary t = s.values.get(producerId);
                if (t != null) return t;
            }
            return null;
        }

        void bind(String producerId, Temporary temporary) {
            values.put(producerId, temporary);
        }
    }

    private record LoopNames(String index, String element) {}

    private static final class Walk {
        private final GraphDefinition graph;
        private final List<Warning> warnings = new ArrayList<>();
        private final DataLinks links;

        private final Set<String> visited = new HashSet<>();
        private final Set<String> onPath = new HashSet<>();
        private final Set<String> activeLoops = new HashSet<>();
        private final Set<String> resolving = new HashSet<>();
        private final Map<String, LoopNames> loopNames = new HashMap<>();
        private final Map<String, Integer> counters = new HashMap<>();
        private int statements;
        private boolean budgetReported;
        private int execDepth;
        private int dataDepth;
        private boolean depthReported;
        private Node entry;

        Walk(GraphDefinition graph) {
            this.graph = graph;
            this.links = new DataLinks(graph, warnings);
        }

        StatementTree run() {
            List<Node> entryNodes = entryNodes();
            List<EntryPoint> entries = new ArrayList<>();
            for (Node start : entryNodes) {
                entry = start;
                visited.add(start.id());
                onPath.add(start.id());
                try {
                    entries.add(new EntryPoint(start, block(next(start, primaryExecOutput(start)), null)));
                } finally {
                    onPath.remove(start.id());
                }
            }
            if (!entryNodes.isEmpty() || graph.graphType() == GraphType.EVENT) {
                reportUnreached();
            }
            return new StatementTree(graph.graphName(), graph.graphType(), entries, warnings);
        }

        private List<Node> entryNodes() {
            switch (graph.graphType()) {
                case EVENT:
                    return graph.nodes().stream()
                            .filter(n -> n.kind() == NodeKind.EVENT || n.kind() == NodeKind.CUSTOM_EVENT)
                            .toList();
                case FUNCTION: {
                    List<Node> found = graph.nodesOfKind(NodeKind.FUNCTION_ENTRY);
                    if (found.isEmpty()) {
                        warnings.add(Warning.error("function graph " + graph.graphName() + " has no FunctionEntry node"));
                        return List.of();
                    }
                    if (found.size() > 1) {
                        warnings.add(Warning.error("function graph " + graph.graphName() + " has "
                                + found.size() + " FunctionEntry nodes; using the first"));
                    }
                    return List.of(found.get(0));
                }
                default:
                    warnings.add(Warning.info("macro graph " + graph.graphName() + " is not translated"));
                    return List.of();
            }
        }

        private void reportUnreached() {
            for (Node node : graph.nodes()) {
                if (!visited.contains(node.id())) {
                    warnings.add(Warning.atNode(Severity.WARNING, node.id(), "unreachable node: "
                            + node.name() + " (" + node.rawClass() + ") in " + graph.graphName()));
                }
            }
        }

        // --- Exec walk ---

        private Block block(Node start, Scope parent) {
            if (start == null) return Block.EMPTY;
            List<Statement> out = new ArrayList<>();
            chain(start, new Scope(parent), out);
            return new Block(out);
        }

        private void chain(Node start, Scope scope, List<Statement> out) {
            if (execDepth >= MAX_NESTING_DEPTH) {
                reportDepth(start);
                return;
            }
            List<String> entered = new ArrayList<>();
            Node current = start;
            execDepth++;
            try {
                while (current != null) {
                    if (onPath.contains(current.id())) {
                        if (!activeLoops.contains(current.id())) {
                            warnings.add(Warning.atNode(Severity.WARNING, current.id(),
                                    "potential infinite loop / unrecognized loop construct: exec path returns to "
                                            + current.name() + " (" + current.id() + ") in " + graph.graphName()));
                            add(out, new CycleStatement(current.id(), current.name()));
                        }
                        return;
                    }
                    if (statements >= STATEMENT_BUDGET) {
                        if (!budgetReported) {
                            warnings.add(Warning.error("statement budget of " + STATEMENT_BUDGET
                                    + " exceeded in " + graph.graphName() + "; output truncated"));
                            budgetReported = true;
                        }
                        return;
                    }
                    onPath.add(current.id());
                    entered.add(current.id());
                    visited.add(current.id());
                    current = step(current, scope, out);
                }
            } finally {
                entered.forEach(onPath::remove);
                execDepth--;
            }
        }

        private void reportDepth(Node node) {
            if (depthReported) return;
            warnings.add(Warning.atNode(Severity.ERROR, node.id(), "nesting depth limit of " + MAX_NESTING_DEPTH
                    + " exceeded at " + node.name() + " (" + node.id() + ") in " + graph.graphName() + "; output truncated"));
            depthReported = true;
        }

        /** Appends the statements for one exec node and returns its sequential successor. */
        private Node step(Node node, Scope scope, List<Statement> out) {
            return switch (node.kind()) {
                case CALL_FUNCTION -> {
                    add(out, callStatement(node, scope, out));
                    yield next(node, primaryExecOutput(node));
                }
                case VARIABLE_SET -> {
                    Pin valuePin = node.dataInputs().stream().filter(p -> !isTargetPin(p)).findFirst().orElse(null);
                    Expression value = valuePin != null ? input(node, valuePin, scope, out)
                            : new Unresolved("no value pin", TypeTag.WILDCARD);
                    add(out, new AssignStatement(node.id(), node.member(), value));
                    yield next(node, primaryExecOutput(node));
                }
                case BRANCH -> {
                    branch(node, scope, out);
                    yield null;
                }
                case SEQUENCE -> {
                    for (Pin output : node.execOutputs()) {
                        Node target = next(node, output);
                        if (target != null) chain(target, scope, out);
                    }
                    yield null;
                }
                case LOOP -> {
                    loop(node, scope, out);
                    yield next(node, execOutput(node, "Completed"));
                }
                case RETURN -> {
                    List<Pin> values = node.dataInputs();
                    if (values.size() > 1) {
                        warnings.add(Warning.atNode(Severity.INFO, node.id(), "return node " + node.id()
                                + " has " + values.size() + " values; only the first is returned"));
                    }
                    add(out, new ReturnStatement(node.id(), values.isEmpty() ? null : input(node, values.get(0), scope, out)));
                    yield null;
                }
                case REROUTE -> next(node, primaryExecOutput(node));
                case EVENT, CUSTOM_EVENT, FUNCTION_ENTRY -> {
                    warnings.add(Warning.atNode(Severity.WARNING, node.id(),
                            "exec link into entry node " + node.name() + "; walk stopped"));
                    yield null;
                }
                case VARIABLE_GET, SELF, BINARY_OPERATOR, UNSUPPORTED -> {
                    add(out, new StubStatement(node.id(), node.rawClass(), node.name()));
                    yield next(node, primaryExecOutput(node));
                }
            };
        }

        private void branch(Node node, Scope scope, List<Statement> out) {
            Pin conditionPin = node.pin(PinDirection.IN, "Condition")
                    .or(() -> node.dataInputs().stream().findFirst())
                    .orElse(null);
            Expression condition = conditionPin != null ? input(node, conditionPin, scope, out)
                    : new ZeroValue(TypeTag.BOOL, "bool", null);

            List<Pin> outputs = node.execOutputs();
            Pin thenPin = named(outputs, "then", "true").orElse(outputs.isEmpty() ? null : outputs.get(0));
            Pin elsePin = named(outputs, "else", "false")
                    .orElse(outputs.stream().filter(p -> p != thenPin).findFirst().orElse(null));

            Block thenBlock = block(next(node, thenPin), scope);
            Block elseBlock = block(next(node, elsePin), scope);
            add(out, new BranchStatement(node.id(), condition, thenBlock, elseBlock));
        }

        private void loop(Node node, Scope scope, List<Statement> out) {
            LoopKind kind = LoopKind.fromMacro(node.member());
            List<Expression> operands = switch (kind) {
                case FOR -> List.of(
                        namedInput(node, "FirstIndex", TypeTag.INT, scope, out),
                        namedInput(node, "LastIndex", TypeTag.INT, scope, out));
                case FOR_EACH -> List.of(namedInput(node, "Array", TypeTag.OBJECT, scope, out));
                case WHILE -> List.of(namedInput(node, "Condition", TypeTag.BOOL, scope, out));
            };
            String index = kind == LoopKind.WHILE ? null : nextName("Index");
            String element = kind == LoopKind.FOR_EACH ? nextName("Element") : null;
            loopNames.put(node.id(), new LoopNames(index, element));

            activeLoops.add(node.id());
            Block body;
            try {
                body = block(next(node, execOutput(node, "LoopBody")), scope);
            } finally {
                activeLoops.remove(node.id());
            }
            add(out, new LoopStatement(node.id(), kind, operands, index, element, body));
        }

        private CallStatement callStatement(Node node, Scope scope, List<Statement> out) {
            Expression target = null;
            List<Expression> arguments = new ArrayList<>();
            for (Pin pin : node.dataInputs()) {
                if (isTargetPin(pin)) {
                    if (links.source(pin) != null) target = input(node, pin, scope, out);
                } else if (isWorldContextPin(pin) && links.source(pin) == null) {
                    arguments.add(new SelfRef());
                } else {
                    arguments.add(input(node, pin, scope, out));
                }
            }
            Temporary result = null;
            if (links.consumerCount(node.id()) > 0 && !node.dataOutputs().isEmpty()) {
                Pin output = node.dataOutputs().get(0);
                result = new Temporary(nextName("Temp_" + fragment(node.member())),
                        output.type(), output.category(), output.objectClass());
                scope.bind(node.id(), result);
            }
            return new CallStatement(node.id(), node.member(), node.memberParent(), target, arguments, result);
        }

        /**
         * Target of an exec output: its first link, or for nodes with a single exec output, the
         * first node whose exec input links back to this one.
         */
        private Node next(Node node, Pin execOutput) {
            if (execOutput == null) return null;
            List<String> targets = execOutput.linkedTo();
            if (!targets.isEmpty()) {
                if (targets.size() > 1) {
                    warnings.add(Warning.atNode(Severity.WARNING, node.id(), "exec output " + execOutput.name()
                            + " on node " + node.id() + " links to " + targets.size() + " nodes; following the first"));
                }
                return graph.node(targets.get(0)).orElse(null);
            }
            if (node.execOutputs().size() != 1) return null;
            for (Node candidate : graph.nodes()) {
                if (candidate == node) continue;
                for (Pin pin : candidate.execInputs()) {
                    if (pin.linkedTo().contains(node.id())) return candidate;
                }
            }
            return null;
        }

        private void add(List<Statement> out, Statement statement) {
            out.add(statement);
            statements++;
        }

        // --- Data resolution ---

        private Expression namedInput(Node node, String pinName, TypeTag type, Scope scope, List<Statement> out) {
            Optional<Pin> pin = node.pin(PinDirection.IN, pinName);
            if (pin.isEmpty()) {
                warnings.add(Warning.atNode(Severity.WARNING, node.id(),
                        node.member() + " node " + node.id() + " has no " + pinName + " pin"));
                return new ZeroValue(type, null, null);
            }
            return input(node, pin.get(), scope, out);
        }

        private Expression input(Node consumer, Pin input, Scope scope, List<Statement> out) {
            Source source = links.source(input);
            if (source == null) {
                if (input.defaultValue() != null) {
                    return new Literal(input.defaultValue(), input.type(), input.category());
                }
                if (isTargetPin(input)) return new SelfRef();
                warnings.add(Warning.atNode(Severity.INFO, consumer.id(), "input " + input.name() + " on node "
                        + consumer.id() + " is not connected and has no default; using zero value"));
                return new ZeroValue(input.type(), input.category(), input.objectClass());
            }
            Source effective = links.effective(source);
            if (effective == null) {
                visited.add(source.producer().id());
                return new ZeroValue(input.type(), input.category(), input.objectClass());
            }
            visited.add(source.producer().id());
            if (dataDepth >= MAX_NESTING_DEPTH) {
                reportDepth(effective.producer());
                return new Unresolved("expression nested too deeply", input.type());
            }
            dataDepth++;
            try {
                return produce(effective, scope, out);
            } finally {
                dataDepth--;
            }
        }

        private Expression produce(Source source, Scope scope, List<Statement> out) {
            Node producer = source.producer();
            Pin output = source.output();
            visited.add(producer.id());
            return switch (producer.kind()) {
                case VARIABLE_GET, VARIABLE_SET -> new VariableRef(producer.member());
                case SELF -> new SelfRef();
                case EVENT, CUSTOM_EVENT, FUNCTION_ENTRY -> entry != null && producer.id().equals(entry.id())
                        ? new ParameterRef(output.name(), producer.dataOutputs().indexOf(output))
                        : unresolved(producer, "parameter " + output.name() + " of "
                                + (producer.member() != null ? producer.member() : producer.name())
                                + " is read outside its entry", output.type());
                case LOOP -> loopVariable(producer, output);
                case CALL_FUNCTION, BINARY_OPERATOR -> {
                    if (!producer.dataOutputs().isEmpty() && producer.dataOutputs().get(0) != output) {
                        yield unresolved(producer, "output " + output.name() + " of " + producer.member()
                                + " is an out parameter", output.type());
                    }
                    if (!producer.isPure()) {
                        Temporary result = scope.lookup(producer.id());
                        yield result != null ? new TemporaryRef(result)
                                : unresolved(producer, "result of " + producer.member()
                                        + " is read outside the block that executes it", output.type());
                    }
                    yield pureValue(producer, output, scope, out);
                }
                case REROUTE -> new ZeroValue(output.type(), output.category(), output.objectClass());
                case BRANCH, SEQUENCE, RETURN, UNSUPPORTED ->
                        unresolved(producer, "node class " + producer.rawClass() + " produces no value", output.type());
            };
        }

        private Expression pureValue(Node producer, Pin output, Scope scope, List<Statement> out) {
            if (resolving.contains(producer.id())) {
                return unresolved(producer, "cyclic data dependency through " + producer.member(), output.type());
            }
            boolean shared = links.consumerCount(producer.id()) > 1;
            if (shared) {
                Temporary existing = scope.lookup(producer.id());
                if (existing != null) return new TemporaryRef(existing);
            }
            Expression value;
            resolving.add(producer.id());
            try {
                value = pureCall(producer, scope, out);
            } finally {
                resolving.remove(producer.id());
            }
            if (!shared) return value;

            Temporary temporary = new Temporary(nextName("Temp_" + fragment(producer.member())),
                    output.type(), output.category(), output.objectClass());
            scope.bind(producer.id(), temporary);
            add(out, new TemporaryStatement(producer.id(), temporary, value));
            return new TemporaryRef(temporary);
        }

        private Expression pureCall(Node node, Scope scope, List<Statement> out) {
            Expression target = null;
            List<Expression> arguments = new ArrayList<>();
            for (Pin pin : node.dataInputs()) {
                if (isTargetPin(pin)) {
                    if (links.source(pin) != null) target = input(node, pin, scope, out);
                } else if (isWorldContextPin(pin) && links.source(pin) == null) {
                    arguments.add(new SelfRef());
                } else {
                    arguments.add(input(node, pin, scope, out));
                }
            }
            Optional<String> operator = OperatorTable.symbolFor(node.member());
            if (operator.isPresent() && target == null && !arguments.isEmpty()) {
                return new OperatorExpression(operator.get(), arguments);
            }
            return new CallExpression(node.member(), node.memberParent(), target, arguments);
        }

        private Expression loopVariable(Node loop, Pin output) {
            LoopNames names = loopNames.get(loop.id());
            if (names == null || !activeLoops.contains(loop.id())) {
                return unresolved(loop, output.name() + " of " + loop.member() + " is read outside its loop body",
                        output.type());
            }
            boolean element = output.name().equalsIgnoreCase("Array Element") && names.element() != null;
            if (element) return new LoopVariableRef(names.element());
            if (names.index() == null) {
                return unresolved(loop, loop.member() + " has no index variable", output.type());
            }
            return new LoopVariableRef(names.index());
        }

        private Expression unresolved(Node node, String reason, TypeTag type) {
            warnings.add(Warning.atNode(Severity.WARNING, node.id(), "unresolved value: " + reason));
            return new Unresolved(reason, type);
        }

        // --- Helpers ---

        private String nextName(String prefix) {
            int n = counters.merge(prefix, 1, Integer::sum) - 1;
            return prefix + "_" + n;
        }

        private static String fragment(String member) {
            String cleaned = member == null ? "" : member.replaceAll("[^A-Za-z0-9_]", "");
            return cleaned.isEmpty() ? "Value" : cleaned;
        }

        private static Pin primaryExecOutput(Node node) {
            List<Pin> outputs = node.execOutputs();
            return named(outputs, "then").orElse(outputs.isEmpty() ? null : outputs.get(0));
        }

        private static Pin execOutput(Node node, String name) {
            return named(node.execOutputs(), name).orElse(null);
        }

        private static Optional<Pin> named(List<Pin> pins, String... names) {
            for (String name : names) {
                for (Pin pin : pins) {
                    if (pin.name().equalsIgnoreCase(name)) return Optional.of(pin);
                }
            }
            return Optional.empty();
        }

        private static boolean isTargetPin(Pin pin) {
            return pin.name().equalsIgnoreCase("self") || pin.name().equalsIgnoreCase("Target");
        }

        private static boolean isWorldContextPin(Pin pin) {
            return pin.name().equals("WorldContextObject") || pin.name().equals("__WorldContext");
        }
    }
}
