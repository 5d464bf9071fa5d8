package com.blueprintbridge.transpiler;

import com.blueprintbridge.transpiler.diff.DiffPolicy;
import com.blueprintbridge.transpiler.diff.DiffPolicyReader;
import com.blueprintbridge.transpiler.diff.SemanticDiffEngine;
import com.blueprintbridge.transpiler.emit.TranspileOptions;
import com.blueprintbridge.transpiler.graph.BlueprintAsset;
import com.blueprintbridge.transpiler.graph.BlueprintParser;
import com.blueprintbridge.transpiler.report.ChangeScope;
import com.blueprintbridge.transpiler.report.ChangeType;
import com.blueprintbridge.transpiler.report.ConflictLevel;
import com.blueprintbridge.transpiler.report.DiffResult;
import com.blueprintbridge.transpiler.report.SemanticChange;
import com.blueprintbridge.transpiler.symbols.SymbolExtractor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SemanticDiffEngineTest {

    private static BlueprintAsset asset(String variables, String graphs) {
        return new BlueprintParser().parse("{ \"ClassName\": \"BP_Thing\", \"ParentClass\": \"Actor\", "
                + "\"Variables\": [" + variables + "], \"Graphs\": [" + graphs + "] }").asset();
    }

    private static String variable(String name, String type) {
        return "{ \"VarName\": \"" + name + "\", \"VarType\": \"" + type + "\" }";
    }

    /** A function graph whose entry outputs the given pins; pins are JSON objects. */
    private static String function(String name, String entryPins, String resultPins) {
        String graph = "{ \"GraphName\": \"" + name + "\", \"GraphType\": \"function\", \"Nodes\": ["
                + "{ \"NodeGuid\": \"" + name + "_in\", \"NodeClass\": \"K2Node_FunctionEntry\", \"Pins\": [" + entryPins + "] }";
        if (resultPins != null) {
            graph += ", { \"NodeGuid\": \"" + name + "_out\", \"NodeClass\": \"K2Node_FunctionResult\", \"Pins\": ["
                    + resultPins + "] }";
        }
        return graph + "] }";
    }

    private static String pin(String name, String category, String direction, String defaultValue) {
        return "{ \"PinName\": \"" + name + "\", \"PinType\": { \"PinCategory\": \"" + category + "\" }, "
                + "\"Direction\": \"" + direction + "\""
                + (defaultValue != null ? ", \"DefaultValue\": \"" + defaultValue + "\"" : "") + " }";
    }

    private static String thing(String members) {
        return "class AThing : public AActor\n{\n\tGENERATED_BODY()\npublic:\n" + members + "\n};\n";
    }

    private static DiffResult diff(BlueprintAsset asset, String cpp) {
        return diff(asset, cpp, DiffPolicy.defaults());
    }

    private static DiffResult diff(BlueprintAsset asset, String cpp, DiffPolicy policy) {
        return new SemanticDiffEngine(policy, TranspileOptions.defaults())
                .diff(asset, new SymbolExtractor().extract(cpp));
    }

    private static SemanticChange only(DiffResult result) {
        assertEquals(1, result.changes().size(), "Changes: " + result.changes());
        return result.changes().get(0);
    }

    @Test
    void identicalDeclarationsProduceNoChanges() {
        DiffResult result = diff(asset(variable("Speed", "float"), ""),
                thing("\tUPROPERTY()\n\tfloat Speed;"));

        assertTrue(result.changes().isEmpty(), "Changes: " + result.changes());
        assertEquals(ConflictLevel.NONE, result.overallConflict());
        assertEquals("BP_Thing: 1 variables, 0 functions, 0 event nodes", result.blueprintSummary());
        assertEquals("0 functions, 1 properties detected", result.cppSummary());
    }

    @Test
    void wideningIsCompatibleAndNarrowingConflicts() {
        SemanticChange widened = only(diff(asset(variable("MaxHealth", "float"), ""),
                thing("\tUPROPERTY()\n\tint32 MaxHealth;")));
        assertEquals(ChangeType.MODIFY, widened.type());
        assertEquals(ConflictLevel.COMPATIBLE, widened.conflictLevel());
        assertEquals("Variable \"MaxHealth\": type widens from int32 to float", widened.description());
        assertEquals("float MaxHealth", widened.blueprintSide());
        assertEquals("int32 MaxHealth", widened.cppSide());

        SemanticChange narrowed = only(diff(asset(variable("MaxHealth", "int"), ""),
                thing("\tUPROPERTY()\n\tfloat MaxHealth;")));
        assertEquals(ConflictLevel.CONFLICT, narrowed.conflictLevel());
        assertEquals("Variable \"MaxHealth\": type changes from float to int32", narrowed.description());
    }

    @Test
    void wideningPolicyCanMakeWideningAConflict() {
        DiffPolicy strict = new DiffPolicyReader().fromJson("{ \"widening_compatible\": false }");
        SemanticChange change = only(diff(asset(variable("MaxHealth", "float"), ""),
                thing("\tUPROPERTY()\n\tint32 MaxHealth;"), strict));
        assertEquals(ConflictLevel.CONFLICT, change.conflictLevel());
    }

    @Test
    void sameWidthUnderAnotherSpellingIsCompatible() {
        SemanticChange change = only(diff(asset(variable("Kills", "int"), ""),
                thing("\tUPROPERTY()\n\tint Kills;")));
        assertEquals(ChangeType.MODIFY, change.type());
        assertEquals(ConflictLevel.COMPATIBLE, change.conflictLevel());
        assertEquals("Variable \"Kills\": type changes from int to int32", change.description());
    }

    @Test
    void widerSpellingOfTheSameTypeIsAWidening() {
        SemanticChange change = only(diff(asset(variable("Ratio", "double"), ""),
                thing("\tUPROPERTY()\n\tfloat Ratio;")));
        assertEquals(ConflictLevel.COMPATIBLE, change.conflictLevel());
        assertEquals("Variable \"Ratio\": type widens from float to double", change.description());

        DiffPolicy strict = new DiffPolicyReader().fromJson("{ \"widening_compatible\": false }");
        assertEquals(ConflictLevel.CONFLICT, only(diff(asset(variable("Ratio", "double"), ""),
                thing("\tUPROPERTY()\n\tfloat Ratio;"), strict)).conflictLevel());
    }

    @Test
    void narrowerSpellingOfTheSameTypeConflicts() {
        SemanticChange ratio = only(diff(asset(variable("Ratio", "float"), ""),
                thing("\tUPROPERTY()\n\tdouble Ratio;")));
        assertEquals(ChangeType.MODIFY, ratio.type());
        assertEquals(ConflictLevel.CONFLICT, ratio.conflictLevel());
        assertEquals("Variable \"Ratio\": type narrows from double to float", ratio.description());

        SemanticChange score = only(diff(asset(variable("Score", "int"), ""),
                thing("\tUPROPERTY()\n\tint64 Score;")));
        assertEquals(ConflictLevel.CONFLICT, score.conflictLevel());
        assertEquals("Variable \"Score\": type narrows from int64 to int32", score.description());
    }

    @Test
    void similarNamesWithSameTypeAreRenames() {
        SemanticChange change = only(diff(asset(variable("MoveSpeed", "float"), ""),
                thing("\tUPROPERTY()\n\tfloat MovementSpeed;")));
        assertEquals(ChangeType.RENAME, change.type());
        assertEquals(ChangeScope.VARIABLE, change.scope());
        assertEquals("MoveSpeed", change.name());
        assertEquals(ConflictLevel.COMPATIBLE, change.conflictLevel());
        assertEquals("Variable \"MovementSpeed\" in C++ matches \"MoveSpeed\" in Blueprint (name similarity 0.69)",
                change.description());
        assertEquals("float MoveSpeed", change.blueprintSide());
        assertEquals("float MovementSpeed", change.cppSide());
    }

    @Test
    void renameThresholdComesFromPolicy() {
        DiffPolicy strict = new DiffPolicyReader().fromJson("{ \"rename_similarity_threshold\": 0.8 }");
        DiffResult result = diff(asset(variable("MoveSpeed", "float"), ""),
                thing("\tUPROPERTY()\n\tfloat MovementSpeed;"), strict);

        assertEquals(List.of(ChangeType.ADD, ChangeType.REMOVE),
                result.changes().stream().map(SemanticChange::type).toList());
        assertEquals(ConflictLevel.CONFLICT, result.overallConflict());
    }

    @Test
    void differentTypesAreNeverRenames() {
        DiffResult result = diff(asset(variable("MoveSpeed", "float"), ""),
                thing("\tUPROPERTY()\n\tbool MovementSpeed;"));
        assertTrue(result.changes().stream().noneMatch(c -> c.type() == ChangeType.RENAME));
    }

    @Test
    void additionsAreHarmlessAndRemovalsConflict() {
        DiffResult result = diff(asset(variable("bIsDead", "bool"), ""),
                thing("\tUFUNCTION(BlueprintCallable)\n\tvoid Heal(float Amount);"));

        assertEquals(2, result.changes().size());
        SemanticChange added = result.changes().get(0);
        assertEquals("change-0", added.id());
        assertEquals(ChangeType.ADD, added.type());
        assertEquals(ConflictLevel.NONE, added.conflictLevel());
        assertEquals("Variable \"bIsDead\" exists in Blueprint but not in C++", added.description());
        assertNull(added.cppSide());
        assertEquals("Add UPROPERTY bool bIsDead in AThing", added.resolution());

        SemanticChange removed = result.changes().get(1);
        assertEquals("change-1", removed.id());
        assertEquals(ChangeType.REMOVE, removed.type());
        assertEquals(ChangeScope.FUNCTION, removed.scope());
        assertEquals(ConflictLevel.CONFLICT, removed.conflictLevel());
        assertNull(removed.blueprintSide());
        assertEquals("void Heal(float)", removed.cppSide());
        assertEquals(ConflictLevel.CONFLICT, result.overallConflict());
    }

    @Test
    void removalLevelComesFromPolicy() {
        DiffPolicy lenient = new DiffPolicyReader().fromJson("{ \"removal_conflict_level\": \"compatible\" }");
        SemanticChange removed = only(diff(asset("", ""),
                thing("\tUFUNCTION()\n\tvoid Heal(float Amount);"), lenient));
        assertEquals(ConflictLevel.COMPATIBLE, removed.conflictLevel());
    }

    @Test
    void memberDeclaredOnAnotherClassIsAMove() {
        String cpp = "class ABase : public AActor\n{\n\tUPROPERTY()\n\tfloat Speed;\n};\n" + thing("");
        SemanticChange moved = only(diff(asset(variable("Speed", "float"), ""), cpp));

        assertEquals(ChangeType.MOVE, moved.type());
        assertEquals(ConflictLevel.COMPATIBLE, moved.conflictLevel());
        assertEquals("AThing::float Speed", moved.blueprintSide());
        assertEquals("ABase::float Speed", moved.cppSide());
    }

    @Test
    void singleClassUnderAnotherNameIsAClassRename() {
        DiffResult result = diff(asset(variable("Speed", "float"), ""),
                "class AOldThing : public AActor\n{\n\tUPROPERTY()\n\tfloat Speed;\n};\n");

        SemanticChange rename = only(result);
        assertEquals(ChangeType.RENAME, rename.type());
        assertEquals(ChangeScope.CLASS, rename.scope());
        assertEquals("AThing", rename.name());
        assertEquals("class AOldThing", rename.cppSide());
        assertEquals(ConflictLevel.COMPATIBLE, rename.conflictLevel());
    }

    @Test
    void helperStructMembersAreNotBlueprintMembers() {
        String cpp = "USTRUCT(BlueprintType)\nstruct FPlayerStats\n{\n\tGENERATED_BODY()\n"
                + "\tUPROPERTY()\n\tint32 Kills = 0;\n};\n\n" + thing("\tUPROPERTY()\n\tfloat Speed;");

        DiffResult result = diff(asset(variable("Speed", "float"), ""), cpp);

        assertTrue(result.changes().isEmpty(), "Changes: " + result.changes());
        assertEquals(ConflictLevel.NONE, result.overallConflict());
        assertEquals("0 functions, 2 properties detected", result.cppSummary());
    }

    @Test
    void helperStructMemberWithABlueprintNameIsAMove() {
        String cpp = "struct FPlayerStats\n{\n\tUPROPERTY()\n\tint32 Kills = 0;\n};\n" + thing("");

        SemanticChange moved = only(diff(asset(variable("Kills", "int"), ""), cpp));

        assertEquals(ChangeType.MOVE, moved.type());
        assertEquals("FPlayerStats::int32 Kills", moved.cppSide());
    }

    @Test
    void helperStructDoesNotBlockAClassRename() {
        String cpp = "struct FPlayerStats\n{\n\tUPROPERTY()\n\tint32 Kills = 0;\n};\n"
                + "class AOldThing : public AActor\n{\n\tUPROPERTY()\n\tfloat Speed;\n};\n";

        SemanticChange rename = only(diff(asset(variable("Speed", "float"), ""), cpp));

        assertEquals(ChangeType.RENAME, rename.type());
        assertEquals(ChangeScope.CLASS, rename.scope());
        assertEquals("class AOldThing", rename.cppSide());
    }

    @Test
    void differentParentClassConflicts() {
        SemanticChange change = only(diff(asset("", ""), "class AThing : public APawn\n{\n};\n"));
        assertEquals(ChangeType.MODIFY, change.type());
        assertEquals(ChangeScope.CLASS, change.scope());
        assertEquals(ConflictLevel.CONFLICT, change.conflictLevel());
        assertEquals("Parent class differs: Blueprint extends AActor, C++ has APawn", change.description());
    }

    @Test
    void returnTypeChangeConflicts() {
        String graph = function("GetScore",
                pin("then", "exec", "EGPD_Output", null),
                pin("execute", "exec", "EGPD_Input", null) + ", " + pin("ReturnValue", "int", "EGPD_Input", null));
        SemanticChange change = only(diff(asset("", graph), thing("\tUFUNCTION()\n\tfloat GetScore();")));

        assertEquals(ChangeType.MODIFY, change.type());
        assertEquals(ConflictLevel.CONFLICT, change.conflictLevel());
        assertEquals("Function \"GetScore\": return type changes from float to int32", change.description());
    }

    @Test
    void addedOptionalParametersAreCompatible() {
        String graph = function("Fire",
                pin("Shots", "int", "EGPD_Output", null) + ", " + pin("bLoud", "bool", "EGPD_Output", "false"),
                null);
        BlueprintAsset asset = asset("", graph);

        SemanticChange change = only(diff(asset, thing("\tUFUNCTION()\n\tvoid Fire(int32 Shots);")));
        assertEquals(ConflictLevel.COMPATIBLE, change.conflictLevel());
        assertEquals("Function \"Fire\": adds 1 optional parameter(s)", change.description());

        DiffPolicy strict = new DiffPolicyReader().fromJson("{ \"optional_parameters_compatible\": false }");
        assertEquals(ConflictLevel.CONFLICT,
                only(diff(asset, thing("\tUFUNCTION()\n\tvoid Fire(int32 Shots);"), strict)).conflictLevel());
    }

    @Test
    void addedRequiredOrRemovedParametersConflict() {
        BlueprintAsset asset = asset("", function("Fire", pin("Shots", "int", "EGPD_Output", null), null));

        SemanticChange removed = only(diff(asset, thing("\tUFUNCTION()\n\tvoid Fire(int32 Shots, float Spread);")));
        assertEquals(ConflictLevel.CONFLICT, removed.conflictLevel());
        assertEquals("Function \"Fire\": removes 1 parameter(s)", removed.description());

        SemanticChange added = only(diff(asset, thing("\tUFUNCTION()\n\tvoid Fire();")));
        assertEquals(ConflictLevel.CONFLICT, added.conflictLevel());
        assertEquals("Function \"Fire\": adds 1 required parameter(s)", added.description());
    }

    @Test
    void resultDoesNotDependOnDeclarationOrder() {
        BlueprintAsset asset = asset(variable("A", "float") + ", " + variable("B", "int"), "");
        String first = thing("\tUPROPERTY()\n\tbool Zed;\n\tUPROPERTY()\n\tint32 A;\n\tUPROPERTY()\n\tFString Other;");
        String second = thing("\tUPROPERTY()\n\tFString Other;\n\tUPROPERTY()\n\tint32 A;\n\tUPROPERTY()\n\tbool Zed;");

        DiffResult a = diff(asset, first);
        DiffResult b = diff(asset, second);
        assertEquals(a.changes(), b.changes());
        assertEquals(a.overallConflict(), b.overallConflict());
    }

    @Test
    void reorderingBlueprintVariablesGivesTheSameChanges() {
        String cpp = thing("\tUPROPERTY()\n\tint32 A;\n\tUPROPERTY()\n\tbool Gone;");
        DiffResult a = diff(asset(variable("A", "float") + ", " + variable("B", "int"), ""), cpp);
        DiffResult b = diff(asset(variable("B", "int") + ", " + variable("A", "float"), ""), cpp);
        assertEquals(a.changes(), b.changes());
    }

    @Test
    void overallLevelIsTheHighestChangeLevel() {
        DiffResult result = diff(asset(variable("MaxHealth", "float") + ", " + variable("bReady", "bool"), ""),
                thing("\tUPROPERTY()\n\tint32 MaxHealth;"));
        assertEquals(ConflictLevel.COMPATIBLE, result.overallConflict());
        assertTrue(result.changes().stream().allMatch(c ->
                c.conflictLevel().ordinal() <= result.overallConflict().ordinal()));
    }

    @Test
    void unrecognizedSourceLowersConfidence() {
        DiffResult result = diff(asset(variable("Speed", "float"), ""), "int main() { return 0; }");
        assertEquals(1, result.warnings().stream()
                .filter(w -> w.message().equals("no declarations recognized in the source text"))
                .count(), "Warnings: " + result.warnings());
        assertEquals(ChangeType.ADD, only(result).type());
    }
}
