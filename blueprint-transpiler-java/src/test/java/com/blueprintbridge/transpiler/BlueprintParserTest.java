package com.blueprintbridge.transpiler;

import com.blueprintbridge.transpiler.graph.*;
import com.blueprintbridge.transpiler.report.Severity;
import com.blueprintbridge.transpiler.report.Warning;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlueprintParserTest {

    private final BlueprintParser parser = new BlueprintParser();

    @Test
    void parsesClassVariablesAndGraphs() {
        String json = """
            {
              "ClassName": "BP_Door",
              "ParentClass": "AActor",
              "Variables": [
                { "VarName": "bOpen", "VarType": "bool", "PropertyFlags": ["CPF_Edit", "CPF_BlueprintVisible", "CPF_ExposeOnSpawn"], "DefaultValue": "true" },
                { "VarName": "Speed", "VarType": { "PinCategory": "real" }, "Category": "Motion", "Tooltip": "Units per second" }
              ],
              "Graphs": [
                { "GraphName": "EventGraph", "GraphType": "event", "Nodes": [
                  { "NodeGuid": "e1", "NodeClass": "/Script/BlueprintGraph.K2Node_Event", "MemberName": "BeginPlay",
                    "Pins": [ { "PinName": "then", "PinType": { "PinCategory": "exec" }, "Direction": "EGPD_Output" } ] }
                ] },
                { "GraphName": "Open", "GraphType": "FunctionGraph", "Nodes": [] }
              ]
            }
            """;

        ParsedBlueprint parsed = parser.parse(json);
        BlueprintAsset asset = parsed.asset();

        assertEquals("BP_Door", asset.className());
        assertEquals("AActor", asset.parentClass());
        assertEquals(2, asset.variables().size());

        Variable open = asset.variables().get(0);
        assertEquals(TypeTag.BOOL, open.typeTag());
        assertTrue(open.has(PropertyFlag.EDITABLE));
        assertTrue(open.has(PropertyFlag.EXPOSE_ON_SPAWN));
        assertFalse(open.has(PropertyFlag.READ_ONLY));
        assertEquals("true", open.defaultValue());

        Variable speed = asset.variables().get(1);
        assertEquals("real", speed.type());
        assertEquals(TypeTag.FLOAT, speed.typeTag());
        assertEquals("Motion", speed.category());
        assertEquals("Units per second", speed.tooltip());

        assertEquals(GraphType.EVENT, asset.graphs().get(0).graphType());
        assertEquals(GraphType.FUNCTION, asset.graphs().get(1).graphType());
        Node event = asset.graphs().get(0).nodes().get(0);
        assertEquals(NodeKind.EVENT, event.kind());
        assertEquals("K2Node_Event", event.rawClass());
        assertTrue(parsed.warnings().isEmpty(), "Unexpected warnings: " + parsed.warnings());
    }

    @Test
    void missingParentClassDefaultsToActor() {
        ParsedBlueprint parsed = parser.parse("{ \"ClassName\": \"BP_Empty\" }");
        assertEquals("AActor", parsed.asset().parentClass());
        assertTrue(parsed.asset().graphs().isEmpty());
    }

    @Test
    void invalidJsonThrowsParseException() {
        BlueprintParseException ex = assertThrows(BlueprintParseException.class,
                () -> parser.parse("{ \"ClassName\": "));
        assertNotNull(ex.getCause());
    }

    @Test
    void emptyDocumentThrowsParseException() {
        assertThrows(BlueprintParseException.class, () -> parser.parse("   "));
    }

    @Test
    void arrayRootThrowsParseException() {
        assertThrows(BlueprintParseException.class, () -> parser.parse("[1, 2, 3]"));
    }

    @Test
    void missingClassNameThrowsParseException() {
        BlueprintParseException ex = assertThrows(BlueprintParseException.class,
                () -> parser.parse("{ \"ParentClass\": \"AActor\" }"));
        assertTrue(ex.getMessage().contains("ClassName"));
    }

    @Test
    void unsupportedNodeClassIsKeptWithWarning() {
        String json = """
            { "ClassName": "BP_T", "Graphs": [ { "GraphName": "EventGraph", "Nodes": [
              { "NodeGuid": "t1", "NodeClass": "K2Node_Timeline", "Name": "Fade" }
            ] } ] }
            """;
        ParsedBlueprint parsed = parser.parse(json);

        Node node = parsed.asset().graphs().get(0).nodes().get(0);
        assertEquals(NodeKind.UNSUPPORTED, node.kind());
        assertEquals("K2Node_Timeline", node.rawClass());
        assertTrue(parsed.warnings().stream().anyMatch(w ->
                w.severity() == Severity.WARNING
                        && w.message().equals("unsupported node class: K2Node_Timeline")
                        && "t1".equals(w.nodeId())));
    }

    @Test
    void duplicateVariableKeepsFirstAndWarns() {
        String json = """
            { "ClassName": "BP_T", "Variables": [
              { "VarName": "Ammo", "VarType": "int" },
              { "VarName": "Ammo", "VarType": "float" }
            ] }
            """;
        ParsedBlueprint parsed = parser.parse(json);

        assertEquals(1, parsed.asset().variables().size());
        assertEquals(TypeTag.INT, parsed.asset().variables().get(0).typeTag());
        assertTrue(parsed.warnings().stream().anyMatch(w -> w.message().equals("duplicate variable ignored: Ammo")));
    }

    @Test
    void malformedNodeIsSkippedAndOthersSurvive() {
        String json = """
            { "ClassName": "BP_T", "Graphs": [ { "GraphName": "EventGraph", "Nodes": [
              { "NodeGuid": "a", "NodeClass": "K2Node_Event", "MemberName": "BeginPlay", "Pins": "not-an-array" },
              { "NodeGuid": "b", "NodeClass": "K2Node_Event", "MemberName": "Tick" }
            ] } ] }
            """;
        ParsedBlueprint parsed = parser.parse(json);

        List<Node> nodes = parsed.asset().graphs().get(0).nodes();
        assertEquals(1, nodes.size());
        assertEquals("b", nodes.get(0).id());
        assertTrue(parsed.warnings().stream().anyMatch(w -> w.message().startsWith("node #0 in EventGraph could not be read")));
    }

    @Test
    void missingNodeGuidGetsDeterministicId() {
        String json = """
            { "ClassName": "BP_T", "Graphs": [ { "GraphName": "EventGraph", "Nodes": [
              { "NodeClass": "K2Node_Event", "MemberName": "BeginPlay" }
            ] } ] }
            """;
        ParsedBlueprint first = parser.parse(json);
        ParsedBlueprint second = parser.parse(json);

        assertEquals("EventGraph#0", first.asset().graphs().get(0).nodes().get(0).id());
        assertEquals(first.asset().graphs().get(0).nodes(), second.asset().graphs().get(0).nodes());
        assertTrue(first.warnings().stream().anyMatch(w -> w.message().contains("has no NodeGuid")));
    }

    @Test
    void unknownPinCategoryBecomesWildcard() {
        String json = """
            { "ClassName": "BP_T", "Graphs": [ { "GraphName": "EventGraph", "Nodes": [
              { "NodeGuid": "c", "NodeClass": "K2Node_CallFunction", "MemberName": "Foo", "Pins": [
                { "PinName": "Mystery", "PinType": { "PinCategory": "gizmo" }, "Direction": "EGPD_Input" },
                { "PinName": "Mesh", "PinType": { "PinCategory": "softref", "PinSubCategoryObject": "/Script/Engine.StaticMesh" }, "Direction": "EGPD_Input" }
              ] }
            ] } ] }
            """;
        ParsedBlueprint parsed = parser.parse(json);

        List<Pin> pins = parsed.asset().graphs().get(0).nodes().get(0).pins();
        assertEquals(TypeTag.WILDCARD, pins.get(0).type());
        assertEquals(TypeTag.OBJECT, pins.get(1).type());
        assertEquals("/Script/Engine.StaticMesh", pins.get(1).objectClass());
        long infos = parsed.warnings().stream().filter(w -> w.severity() == Severity.INFO).count();
        assertEquals(1, infos);
    }

    @Test
    void pinDirectionAcceptsExportSpellings() {
        assertEquals(PinDirection.OUT, PinDirection.fromExport("EGPD_Output"));
        assertEquals(PinDirection.OUT, PinDirection.fromExport("out"));
        assertEquals(PinDirection.OUT, PinDirection.fromExport("Output"));
        assertEquals(PinDirection.IN, PinDirection.fromExport("EGPD_Input"));
        assertEquals(PinDirection.IN, PinDirection.fromExport(null));
    }

    @Test
    void legacyTopLevelNodesFormEventGraph() {
        String json = """
            { "ClassName": "BP_Old", "Nodes": [
              { "NodeGuid": "x", "NodeType": "K2Node_Event", "MemberName": "BeginPlay" }
            ] }
            """;
        BlueprintAsset asset = parser.parse(json).asset();

        assertEquals(1, asset.graphs().size());
        assertEquals("EventGraph", asset.graphs().get(0).graphName());
        assertEquals(GraphType.EVENT, asset.graphs().get(0).graphType());
        assertEquals(NodeKind.EVENT, asset.graphs().get(0).nodes().get(0).kind());
    }

    @Test
    void loopMacrosAreRecognizedAndOtherMacrosAreNot() {
        assertEquals(NodeKind.LOOP, NodeKind.classify("K2Node_MacroInstance", "ForEachLoop"));
        assertEquals(NodeKind.UNSUPPORTED, NodeKind.classify("K2Node_MacroInstance", "DoOnce"));
        assertEquals(NodeKind.SEQUENCE, NodeKind.classify("K2Node_ExecutionSequence", null));
        assertEquals(NodeKind.REROUTE, NodeKind.classify("K2Node_Knot", null));
    }

    @Test
    void countsNodesAndFunctions() {
        String json = """
            { "ClassName": "BP_T", "Graphs": [
              { "GraphName": "EventGraph", "GraphType": "event", "Nodes": [
                { "NodeGuid": "a", "NodeClass": "K2Node_Event", "MemberName": "BeginPlay" },
                { "NodeGuid": "b", "NodeClass": "K2Node_CustomEvent", "MemberName": "OnHit" }
              ] },
              { "GraphName": "Reload", "GraphType": "function", "Nodes": [
                { "NodeGuid": "c", "NodeClass": "K2Node_FunctionEntry" }
              ] }
            ] }
            """;
        BlueprintAsset asset = parser.parse(json).asset();

        assertEquals(3, asset.nodeCount());
        assertEquals(2, asset.functionCount());
    }

    @Test
    void warningsCarryNodeIdOnlyWhenNodeSpecific() {
        ParsedBlueprint parsed = parser.parse("""
            { "ClassName": "BP_T", "Variables": "oops" }
            """);
        Warning warning = parsed.warnings().get(0);
        assertEquals("Variables is not an array and was ignored", warning.message());
        assertNull(warning.nodeId());
    }

    @Test
    void nonNumericPositionIsAWarningAndReadsAsZero() {
        ParsedBlueprint parsed = parser.parse("""
            { "ClassName": "BP_T", "Graphs": [ { "GraphName": "EventGraph", "GraphType": "event", "Nodes": [
              { "NodeGuid": "e1", "NodeClass": "K2Node_Event", "MemberName": "BeginPlay",
                "NodePosX": "12px", "NodePosY": "-48", "Pins": [] },
              { "NodeGuid": "e2", "NodeClass": "K2Node_Event", "MemberName": "Tick",
                "NodePosX": { "x": 1 }, "NodePosY": 32.5, "Pins": [] }
            ] } ] }
            """);

        List<Node> nodes = parsed.asset().graphs().get(0).nodes();
        assertEquals(2, nodes.size());
        assertEquals(0, nodes.get(0).posX());
        assertEquals(-48, nodes.get(0).posY());
        assertEquals(0, nodes.get(1).posX());
        assertEquals(32.5, nodes.get(1).posY());

        List<Warning> positionWarnings = parsed.warnings().stream()
                .filter(w -> w.message().contains("is not a number"))
                .toList();
        assertEquals(2, positionWarnings.size());
        assertEquals("e1", positionWarnings.get(0).nodeId());
        assertTrue(positionWarnings.get(0).message().startsWith("NodePosX of node e1"));
    }
}
