package com.blueprintbridge.transpiler;

import com.blueprintbridge.transpiler.report.*;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultSerializerTest {

    private final ResultSerializer serializer = new ResultSerializer();

    @Test
    void transpileResultUsesComponentNamesAndLowercaseSeverities() {
        TranspileResult result = new TranspileResult("AThing", "AActor",
                "float Speed = 1.0f;", "#include \"Thing.h\"\n", 2, 0,
                List.of(Warning.atNode(Severity.WARNING, "n7", "unsupported node class: K2Node_Timeline")),
                "Thing.h", "Thing.cpp", List.of("CoreMinimal.h"), Map.of("Speed", "Speed"));

        String json = serializer.toJson(result);
        JsonObject root = JsonParser.parseString(json).getAsJsonObject();

        assertEquals("AThing", root.get("className").getAsString());
        assertEquals(2, root.get("nodeCount").getAsInt());
        assertEquals("warning", root.getAsJsonArray("warnings").get(0).getAsJsonObject().get("severity").getAsString());
        assertEquals("n7", root.getAsJsonArray("warnings").get(0).getAsJsonObject().get("nodeId").getAsString());
        assertEquals("Speed", root.getAsJsonObject("identifierMap").get("Speed").getAsString());
        assertTrue(json.contains("float Speed = 1.0f;"), "Code is not HTML-escaped");
    }

    @Test
    void diffResultUsesLowercaseEnumNames() {
        SemanticChange change = new SemanticChange("change-0", ChangeType.RENAME, ChangeScope.VARIABLE, "MoveSpeed",
                "Variable \"MovementSpeed\" in C++ matches \"MoveSpeed\" in Blueprint (name similarity 0.69)",
                "float MoveSpeed", "float MovementSpeed", ConflictLevel.COMPATIBLE,
                "Rename MovementSpeed to MoveSpeed and update callers");
        DiffResult result = DiffResult.of(List.of(change), "BP_Thing: 1 variables, 0 functions, 0 event nodes",
                "0 functions, 1 properties detected", List.of());

        JsonObject root = JsonParser.parseString(serializer.toJson(result)).getAsJsonObject();
        JsonObject first = root.getAsJsonArray("changes").get(0).getAsJsonObject();

        assertEquals("compatible", root.get("overallConflict").getAsString());
        assertEquals("rename", first.get("type").getAsString());
        assertEquals("variable", first.get("scope").getAsString());
        assertEquals("compatible", first.get("conflictLevel").getAsString());
        assertEquals("change-0", first.get("id").getAsString());
    }

    @Test
    void nullSidesAreOmitted() {
        SemanticChange added = new SemanticChange("change-0", ChangeType.ADD, ChangeScope.VARIABLE, "bIsDead",
                "Variable \"bIsDead\" exists in Blueprint but not in C++", "bool bIsDead", null,
                ConflictLevel.NONE, "Add UPROPERTY bool bIsDead in AThing");
        JsonObject root = JsonParser.parseString(serializer.toJson(
                DiffResult.of(List.of(added), "s", "c", List.of()))).getAsJsonObject();
        JsonObject first = root.getAsJsonArray("changes").get(0).getAsJsonObject();

        assertFalse(first.has("cppSide"));
        assertEquals("none", root.get("overallConflict").getAsString());
    }
}
