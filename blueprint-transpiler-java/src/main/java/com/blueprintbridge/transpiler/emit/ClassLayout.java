package com.blueprintbridge.transpiler.emit;

import com.blueprintbridge.transpiler.emit.EventSignatures.EventSignature;
import com.blueprintbridge.transpiler.emit.IdentifierMap.Kind;
import com.blueprintbridge.transpiler.emit.MethodSignature.Param;
import com.blueprintbridge.transpiler.graph.*;
import com.blueprintbridge.transpiler.report.Severity;
import com.blueprintbridge.transpiler.report.Warning;

import java.util.*;

/**
 * The members an asset's C++ class declares, with every identifier already assigned.
 *
 * Names are registered in a fixed order so collisions resolve the same way on every run:
 * known engine events first (their override names are fixed), then variables, then function
 * graphs, then custom events and unknown engine events in node order. The emitter writes this
 * layout out; the diff engine compares it against symbols extracted from existing source.
 */
public final class ClassLayout {

    /** A UPROPERTY member. */
    public record Property(Variable variable, String name, String cppType) {

        public String specifiers() {
            List<String> specifiers = new ArrayList<>();
            specifiers.add(variable.has(PropertyFlag.EDITABLE) ? "EditAnywhere" : "VisibleAnywhere");
            specifiers.add(variable.has(PropertyFlag.READ_ONLY) ? "BlueprintReadOnly" : "BlueprintReadWrite");
            if (variable.has(PropertyFlag.REPLICATED)) specifiers.add("Replicated");
            String category = variable.category() != null ? variable.category() : "Default";
            specifiers.add("Category = \"" + category.replace("\"", "'") + "\"");
            if (variable.has(PropertyFlag.EXPOSE_ON_SPAWN)) specifiers.add("meta = (ExposeOnSpawn = true)");
            return String.join(", ", specifiers);
        }

        /** Initializer text, or null when the variable has no default. */
        public String initializer() {
            return variable.defaultValue() == null ? null : CppTypes.literal(variable.defaultValue(), cppType);
        }
    }

    private final String blueprintName;
    private final String className;
    private final String parentClass;
    private final String fileStem;
    private final List<Property> properties;
    private final List<MethodSignature> methods;
    private final IdentifierMap identifiers;
    private final List<Warning> warnings;

    private ClassLayout(String blueprintName, String className, String parentClass, String fileStem,
                        List<Property> properties, List<MethodSignature> methods,
                        IdentifierMap identifiers, List<Warning> warnings) {
        this.blueprintName = blueprintName;
        this.className = className;
        this.parentClass = parentClass;
        this.fileStem = fileStem;
        this.properties = List.copyOf(properties);
        this.methods = List.copyOf(methods);
        this.identifiers = identifiers;
        this.warnings = List.copyOf(warnings);
    }

    public static ClassLayout plan(BlueprintAsset asset, TranspileOptions options) {
        List<Warning> warnings = new ArrayList<>();
        String parent = parentClassName(asset.parentClass());
        String className = className(asset.className(), parent, options.rewriteBlueprintPrefix());

        IdentifierMap ids = new IdentifierMap();
        ids.reserve(className);
        ids.reserve("Super");
        ids.reserve("ThisClass");

        List<MethodSignature> engineEvents = new ArrayList<>();
        List<Node> customEvents = new ArrayList<>();
        Map<String, String> graphOfNode = new HashMap<>();

        for (GraphDefinition graph : asset.graphsOfType(GraphType.EVENT)) {
            for (Node node : graph.nodes()) {
                if (node.kind() == NodeKind.CUSTOM_EVENT) {
                    customEvents.add(node);
                    graphOfNode.put(node.id(), graph.graphName());
                } else if (node.kind() == NodeKind.EVENT) {
                    Optional<EventSignature> signature = EventSignatures.lookup(node.member());
                    if (signature.isEmpty()) {
                        warnings.add(Warning.atNode(Severity.WARNING, node.id(),
                                "unknown engine event " + node.member() + " emitted as a custom event"));
                        customEvents.add(node);
                        graphOfNode.put(node.id(), graph.graphName());
                        continue;
                    }
                    EventSignature sig = signature.get();
                    if (engineEvents.stream().anyMatch(m -> m.name().equals(sig.methodName()))) {
                        warnings.add(Warning.atNode(Severity.WARNING, node.id(),
                                "duplicate engine event " + node.member() + " ignored"));
                        continue;
                    }
                    ids.bind(Kind.EVENT, node.member(), sig.methodName());
                    engineEvents.add(new MethodSignature(MethodSignature.Kind.ENGINE_EVENT, node.member(),
                            sig.methodName(), "void", sig.params(), graph.graphName(), node.id(), sig));
                }
            }
        }

        List<Property> properties = new ArrayList<>();
        for (Variable variable : asset.variables()) {
            String name = ids.register(Kind.VARIABLE, variable.name());
            properties.add(new Property(variable, name, CppTypes.forBlueprintType(variable.type())));
            if (variable.has(PropertyFlag.REPLICATED)) {
                warnings.add(Warning.info("replicated property " + name
                        + " also needs a GetLifetimeReplicatedProps entry"));
            }
        }

        List<MethodSignature> methods = new ArrayList<>();
        for (GraphDefinition graph : asset.graphsOfType(GraphType.FUNCTION)) {
            String name = ids.register(Kind.FUNCTION, graph.graphName());
            Node entry = graph.nodesOfKind(NodeKind.FUNCTION_ENTRY).stream().findFirst().orElse(null);
            List<Param> params = entry == null ? List.of() : parameters(entry);
            String returnType = graph.nodesOfKind(NodeKind.RETURN).stream()
                    .flatMap(n -> n.dataInputs().stream())
                    .findFirst()
                    .map(p -> CppTypes.forPin(p.type(), p.category(), p.objectClass()))
                    .orElse("void");
            methods.add(new MethodSignature(MethodSignature.Kind.FUNCTION, graph.graphName(), name, returnType,
                    params, graph.graphName(), entry == null ? null : entry.id(), null));
        }

        for (Node node : customEvents) {
            if (ids.lookup(Kind.EVENT, node.member()).isPresent()) {
                warnings.add(Warning.atNode(Severity.WARNING, node.id(),
                        "duplicate custom event " + node.member() + " ignored"));
                continue;
            }
            String name = ids.register(Kind.EVENT, node.member());
            methods.add(new MethodSignature(MethodSignature.Kind.CUSTOM_EVENT, node.member(), name, "void",
                    parameters(node), graphOfNode.get(node.id()), node.id(), null));
        }

        List<MethodSignature> ordered = new ArrayList<>(engineEvents);
        ordered.addAll(methods);
        return new ClassLayout(asset.className(), className, parent, fileStem(className),
                properties, ordered, ids, warnings);
    }

    /** Data outputs of an entry or event node become parameters; a pin default makes it optional. */
    private static List<Param> parameters(Node entry) {
        List<Param> params = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (Pin pin : entry.dataOutputs()) {
            String type = CppTypes.forPin(pin.type(), pin.category(), pin.objectClass());
            String base = IdentifierSanitizer.sanitize(pin.name());
            String name = base;
            for (int n = 1; !used.add(name); n++) {
                name = base + "_" + n;
            }
            String defaultValue = pin.defaultValue() == null ? null : CppTypes.literal(pin.defaultValue(), type);
            params.add(new Param(type, name, defaultValue));
        }
        return params;
    }

    // --- Naming ---

    /**
     * "BP_PlayerCharacter" becomes "APlayerCharacter" ("U" for component parents); names that
     * already carry an A/U prefix are kept, anything else gets the prefix.
     */
    static String className(String blueprintName, String parentClass, boolean rewritePrefix) {
        String sanitized = IdentifierSanitizer.sanitize(blueprintName);
        if (!rewritePrefix) return sanitized;
        String prefix = parentClass.startsWith("U") ? "U" : "A";
        if (sanitized.startsWith("BP_") && sanitized.length() > 3) {
            return prefix + sanitized.substring(3);
        }
        if (hasUnrealPrefix(sanitized)) return sanitized;
        return prefix + sanitized;
    }

    /** "Character" becomes "ACharacter", "ActorComponent" becomes "UActorComponent". */
    static String parentClassName(String raw) {
        String name = IdentifierSanitizer.sanitize(raw);
        if (hasUnrealPrefix(name)) return name;
        return (name.endsWith("Component") || name.equals("Object") ? "U" : "A") + name;
    }

    /** "APlayerCharacter" becomes "PlayerCharacter". */
    static String fileStem(String className) {
        return hasUnrealPrefix(className) ? className.substring(1) : className;
    }

    private static boolean hasUnrealPrefix(String name) {
        return name.length() > 1 && (name.charAt(0) == 'A' || name.charAt(0) == 'U')
                && Character.isUpperCase(name.charAt(1));
    }

    // --- Derived facts ---

    public boolean isComponent() {
        return parentClass.endsWith("Component");
    }

    /** Engine header for the parent class, or null when it is not a known framework class. */
    public String parentInclude() {
        return switch (parentClass) {
            case "ACharacter" -> "GameFramework/Character.h";
            case "APawn" -> "GameFramework/Pawn.h";
            case "AActor" -> "GameFramework/Actor.h";
            default -> isComponent() ? "Components/ActorComponent.h" : null;
        };
    }

    public List<String> headerIncludes() {
        List<String> includes = new ArrayList<>();
        includes.add("CoreMinimal.h");
        if (parentInclude() != null) includes.add(parentInclude());
        includes.add(generatedHeaderFileName());
        return includes;
    }

    public boolean hasTick() {
        return methods.stream().anyMatch(m -> m.kind() == MethodSignature.Kind.ENGINE_EVENT && m.name().equals("Tick"));
    }

    public List<MethodSignature> methodsOfKind(MethodSignature.Kind kind) {
        return methods.stream().filter(m -> m.kind() == kind).toList();
    }

    public String blueprintName()     { return blueprintName; }
    public String className()         { return className; }
    public String parentClass()       { return parentClass; }
    public String headerFileName()    { return fileStem + ".h"; }
    public String sourceFileName()    { return fileStem + ".cpp"; }
    public String generatedHeaderFileName() { return fileStem + ".generated.h"; }
    public List<Property> properties() { return properties; }
    public List<MethodSignature> methods() { return methods; }
    public IdentifierMap identifiers() { return identifiers; }
    public List<Warning> warnings()   { return warnings; }
}
