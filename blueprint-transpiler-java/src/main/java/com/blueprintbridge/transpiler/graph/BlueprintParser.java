package com.blueprintbridge.transpiler.graph;

import com.blueprintbridge.transpiler.graph.RawBlueprint.RawGraph;
import com.blueprintbridge.transpiler.graph.RawBlueprint.RawNode;
import com.blueprintbridge.transpiler.graph.RawBlueprint.RawPin;
import com.blueprintbridge.transpiler.graph.RawBlueprint.RawVariable;
import com.blueprintbridge.transpiler.report.Severity;
import com.blueprintbridge.transpiler.report.Warning;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.*;

/**
 * Parses a Blueprint JSON export into a {@link BlueprintAsset}.
 *
 * Only an unreadable document or a missing ClassName is fatal. Each variable, graph, node
 * and pin is decoded on its own; one that cannot be decoded is dropped and reported as a
 * warning, so partially malformed exports still produce an asset.
 */
public class BlueprintParser {

    private static final Gson GSON = new Gson();
    private static final String DEFAULT_PARENT = "AActor";

    private final LinkValidator linkValidator = new LinkValidator();

    /**
     * @throws BlueprintParseException if the document is not a JSON object with a ClassName
     */
    public ParsedBlueprint parse(String document) {
        if (document == null || document.isBlank()) {
            throw new BlueprintParseException("Blueprint document is empty");
        }
        JsonElement root;
        try {
            root = JsonParser.parseString(document);
        } catch (JsonParseException e) {
            throw new BlueprintParseException("Blueprint document is not valid JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new BlueprintParseException("Blueprint document must be a JSON object");
        }
        JsonObject doc = root.getAsJsonObject();

        JsonElement classElement = doc.get("ClassName");
        if (classElement == null || !classElement.isJsonPrimitive() || classElement.getAsString().isBlank()) {
            throw new BlueprintParseException("Blueprint document has no ClassName");
        }
        String className = classElement.getAsString().trim();

        List<Warning> warnings = new ArrayList<>();
        String parentClass = optionalString(doc, "ParentClass", warnings);
        if (parentClass == null || parentClass.isBlank()) {
            parentClass = DEFAULT_PARENT;
        }

        List<Variable> variables = parseVariables(array(doc, "Variables", warnings), warnings);
        List<GraphDefinition> graphs = parseGraphs(doc, warnings);

        BlueprintAsset asset = new BlueprintAsset(className, parentClass.trim(), variables, graphs);
        for (GraphDefinition graph : graphs) {
            warnings.addAll(linkValidator.validate(graph));
        }
        return new ParsedBlueprint(asset, warnings);
    }

    // --- Variables ---

    private List<Variable> parseVariables(JsonArray rawVariables, List<Warning> warnings) {
        // Deduplicate: first occurrence wins
        Map<String, Variable> byName = new LinkedHashMap<>();
        for (int i = 0; i < rawVariables.size(); i++) {
            RawVariable raw;
            try {
                raw = GSON.fromJson(rawVariables.get(i), RawVariable.class);
            } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
                warnings.add(Warning.warning("variable #" + i + " could not be read and was skipped: " + e.getMessage()));
                continue;
            }
            if (raw == null || raw.varName == null || raw.varName.isBlank()) {
                warnings.add(Warning.warning("variable #" + i + " has no VarName and was skipped"));
                continue;
            }
            String name = raw.varName.trim();
            if (byName.containsKey(name)) {
                warnings.add(Warning.warning("duplicate variable ignored: " + name));
                continue;
            }
            String type = variableType(raw.varType);
            TypeTag tag = TypeTag.fromCategory(type);
            if (tag == null) {
                tag = looksLikeClassName(type) ? TypeTag.OBJECT : TypeTag.WILDCARD;
                if (tag == TypeTag.WILDCARD) {
                    warnings.add(Warning.info("variable " + name + " has unknown type '" + type + "'"));
                }
            }
            byName.put(name, new Variable(
                    name, type, tag,
                    PropertyFlag.fromExport(raw.propertyFlags),
                    blankToNull(raw.category),
                    blankToNull(raw.defaultValue),
                    blankToNull(raw.tooltip)));
        }
        return new ArrayList<>(byName.values());
    }

    private String variableType(JsonElement varType) {
        if (varType == null || varType.isJsonNull()) return "unknown";
        if (varType.isJsonPrimitive()) return varType.getAsString().trim();
        if (varType.isJsonObject()) {
            JsonElement category = varType.getAsJsonObject().get("PinCategory");
            if (category != null && category.isJsonPrimitive()) return category.getAsString().trim();
        }
        return "unknown";
    }

    // --- Graphs ---

    private List<GraphDefinition> parseGraphs(JsonObject doc, List<Warning> warnings) {
        Map<String, GraphDefinition> byName = new LinkedHashMap<>();
        JsonArray rawGraphs = array(doc, "Graphs", warnings);
        for (int i = 0; i < rawGraphs.size(); i++) {
            RawGraph raw;
            try {
                raw = GSON.fromJson(rawGraphs.get(i), RawGraph.class);
            } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
                warnings.add(Warning.warning("graph #" + i + " could not be read and was skipped: " + e.getMessage()));
                continue;
            }
            if (raw == null) continue;
            String name = raw.graphName == null || raw.graphName.isBlank() ? "Unnamed" : raw.graphName.trim();
            if (byName.containsKey(name)) {
                warnings.add(Warning.warning("duplicate graph ignored: " + name));
                continue;
            }
            List<JsonElement> rawNodes = raw.nodes != null ? raw.nodes : Collections.emptyList();
            byName.put(name, new GraphDefinition(name, GraphType.fromExport(raw.graphType),
                    parseNodes(name, rawNodes, warnings)));
        }

        // Legacy exports put the event graph's nodes at the top level
        boolean hasEventGraph = byName.values().stream().anyMatch(g -> g.graphType() == GraphType.EVENT);
        JsonArray legacyNodes = array(doc, "Nodes", warnings);
        if (!hasEventGraph && legacyNodes.size() > 0 && !byName.containsKey("EventGraph")) {
            List<JsonElement> rawNodes = new ArrayList<>();
            legacyNodes.forEach(rawNodes::add);
            byName.put("EventGraph", new GraphDefinition("EventGraph", GraphType.EVENT,
                    parseNodes("EventGraph", rawNodes, warnings)));
        }
        return new ArrayList<>(byName.values());
    }

    // --- Nodes and pins ---

    private List<Node> parseNodes(String graphName, List<JsonElement> rawNodes, List<Warning> warnings) {
        Map<String, Node> byId = new LinkedHashMap<>();
        for (int i = 0; i < rawNodes.size(); i++) {
            RawNode raw;
            try {
                raw = GSON.fromJson(rawNodes.get(i), RawNode.class);
            } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
                warnings.add(Warning.warning("node #" + i + " in " + graphName
                        + " could not be read and was skipped: " + e.getMessage()));
                continue;
            }
            if (raw == null) continue;

            String id = raw.nodeGuid;
            if (id == null || id.isBlank()) {
                id = graphName + "#" + i;
                warnings.add(Warning.atNode(Severity.WARNING, id,
                        "node #" + i + " in " + graphName + " has no NodeGuid; assigned id " + id));
            }
            if (byId.containsKey(id)) {
                warnings.add(Warning.atNode(Severity.WARNING, id, "duplicate node id ignored in " + graphName + ": " + id));
                continue;
            }

            String fullClass = raw.nodeClass != null ? raw.nodeClass : raw.nodeType != null ? raw.nodeType : "Unknown";
            String shortClass = shortClassName(fullClass);
            String member = blankToNull(raw.memberName);
            NodeKind kind = NodeKind.classify(shortClass, member != null ? member : raw.name);
            if (kind == NodeKind.UNSUPPORTED) {
                warnings.add(Warning.atNode(Severity.WARNING, id, "unsupported node class: " + shortClass));
            }

            List<JsonElement> rawPins = raw.pins != null ? raw.pins : Collections.emptyList();
            byId.put(id, new Node(
                    id,
                    kind,
                    shortClass,
                    raw.name != null && !raw.name.isBlank() ? raw.name : shortClass,
                    member,
                    blankToNull(raw.memberParent),
                    blankToNull(raw.nodeComment),
                    parsePins(id, rawPins, warnings),
                    position(id, "NodePosX", raw.nodePosX, warnings),
                    position(id, "NodePosY", raw.nodePosY, warnings)));
        }
        return new ArrayList<>(byId.values());
    }

    private List<Pin> parsePins(String nodeId, List<JsonElement> rawPins, List<Warning> warnings) {
        List<Pin> pins = new ArrayList<>();
        for (int i = 0; i < rawPins.size(); i++) {
            RawPin raw;
            try {
                raw = GSON.fromJson(rawPins.get(i), RawPin.class);
            } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
                warnings.add(Warning.atNode(Severity.WARNING, nodeId,
                        "pin #" + i + " on node " + nodeId + " could not be read and was skipped: " + e.getMessage()));
                continue;
            }
            if (raw == null) continue;

            String name = raw.pinName != null && !raw.pinName.isBlank() ? raw.pinName : "unnamed";
            String category = raw.pinType != null ? raw.pinType.pinCategory : null;
            String objectClass = raw.pinType != null ? blankToNull(raw.pinType.pinSubCategoryObject) : null;
            TypeTag tag = TypeTag.fromCategory(category);
            if (tag == null) {
                tag = objectClass != null ? TypeTag.OBJECT : TypeTag.WILDCARD;
                if (tag == TypeTag.WILDCARD) {
                    warnings.add(Warning.atNode(Severity.INFO, nodeId, "pin " + name + " on node " + nodeId
                            + " has unknown category '" + category + "'; treated as wildcard"));
                }
            }
            List<String> links = new ArrayList<>();
            if (raw.linkedTo != null) {
                for (String link : raw.linkedTo) {
                    if (link != null && !link.isBlank()) links.add(link.trim());
                }
            }
            pins.add(new Pin(name, PinDirection.fromExport(raw.direction), tag, blankToNull(category), objectClass,
                    links, blankToNull(raw.defaultValue)));
        }
        return pins;
    }

    // --- Helpers ---

    /** Editor coordinate; anything that is not a finite number reads as 0 with a warning. */
    private static double position(String nodeId, String key, JsonElement element, List<Warning> warnings) {
        if (element == null || element.isJsonNull()) return 0;
        double value;
        try {
            value = element.isJsonPrimitive() ? Double.parseDouble(element.getAsString().trim()) : Double.NaN;
        } catch (NumberFormatException e) {
            value = Double.NaN;
        }
        if (Double.isFinite(value)) return value;
        warnings.add(Warning.atNode(Severity.WARNING, nodeId,
                key + " of node " + nodeId + " is not a number (" + element + "); using 0"));
        return 0;
    }

    private static JsonArray array(JsonObject doc, String key, List<Warning> warnings) {
        JsonElement element = doc.get(key);
        if (element == null || element.isJsonNull()) return new JsonArray();
        if (!element.isJsonArray()) {
            warnings.add(Warning.warning(key + " is not an array and was ignored"));
            return new JsonArray();
        }
        return element.getAsJsonArray();
    }

    private static String optionalString(JsonObject doc, String key, List<Warning> warnings) {
        JsonElement element = doc.get(key);
        if (element == null || element.isJsonNull()) return null;
        if (!element.isJsonPrimitive()) {
            warnings.add(Warning.warning(key + " is not a string and was ignored"));
            return null;
        }
        return element.getAsString();
    }

    /** "/Script/BlueprintGraph.K2Node_Event" becomes "K2Node_Event". */
    static String shortClassName(String nodeClass) {
        String trimmed = nodeClass.trim();
        int dot = trimmed.lastIndexOf('.');
        return dot >= 0 ? trimmed.substring(dot + 1) : trimmed;
    }

    private static boolean looksLikeClassName(String type) {
        return type.length() > 1
                && "UAFT".indexOf(type.charAt(0)) >= 0
                && Character.isUpperCase(type.charAt(1));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
