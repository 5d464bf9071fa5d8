package com.blueprintbridge.transpiler;

import com.blueprintbridge.transpiler.emit.CppTypes;
import com.blueprintbridge.transpiler.graph.TypeTag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CppTypesTest {

    @Test
    void mapsBlueprintTypeNames() {
        assertEquals("float", CppTypes.forBlueprintType("float"));
        assertEquals("float", CppTypes.forBlueprintType("real"));
        assertEquals("int32", CppTypes.forBlueprintType("int"));
        assertEquals("uint8", CppTypes.forBlueprintType("byte"));
        assertEquals("FString", CppTypes.forBlueprintType("string"));
        assertEquals("FName", CppTypes.forBlueprintType("name"));
        assertEquals("FLinearColor", CppTypes.forBlueprintType("color"));
        assertEquals("AActor*", CppTypes.forBlueprintType("actor"));
    }

    @Test
    void mapsContainersRecursively() {
        assertEquals("TArray<int32>", CppTypes.forBlueprintType("Array<int>"));
        assertEquals("TMap<FName, float>", CppTypes.forBlueprintType("Map<name, float>"));
        assertEquals("TSet<FString>", CppTypes.forBlueprintType("Set<string>"));
    }

    @Test
    void unknownTypesPassThrough() {
        assertEquals("UStaticMesh*", CppTypes.forBlueprintType("UStaticMesh*"));
        assertEquals("FHitResult", CppTypes.forBlueprintType("FHitResult"));
    }

    @Test
    void pinTypesUseCategoryAndObjectClass() {
        assertEquals("float", CppTypes.forPin(TypeTag.FLOAT, "real", null));
        assertEquals("FName", CppTypes.forPin(TypeTag.STRING, "name", null));
        assertEquals("UStaticMesh*", CppTypes.forPin(TypeTag.OBJECT, "object", "/Script/Engine.StaticMesh"));
        assertEquals("APlayerController*", CppTypes.forPin(TypeTag.OBJECT, "object", "/Script/Engine.PlayerController"));
        assertEquals("FVector", CppTypes.forPin(TypeTag.OBJECT, "struct", "/Script/CoreUObject.Vector"));
        assertEquals("auto", CppTypes.forPin(TypeTag.WILDCARD, "wildcard", null));
        assertEquals("int32", CppTypes.forPin(TypeTag.INT, null, null));
    }

    @Test
    void zeroValues() {
        assertEquals("false", CppTypes.zeroValue("bool"));
        assertEquals("0", CppTypes.zeroValue("int32"));
        assertEquals("0.0f", CppTypes.zeroValue("float"));
        assertEquals("nullptr", CppTypes.zeroValue("AActor*"));
        assertEquals("FVector()", CppTypes.zeroValue("FVector"));
    }

    @Test
    void literalsAreFormattedPerType() {
        assertEquals("100.0f", CppTypes.literal("100.0", "float"));
        assertEquals("3.0f", CppTypes.literal("3", "float"));
        assertEquals("Health - DamageAmount", CppTypes.literal("Health - DamageAmount", "float"));
        assertEquals("false", CppTypes.literal("False", "bool"));
        assertEquals("TEXT(\"Player Spawned!\")", CppTypes.literal("Player Spawned!", "FString"));
        assertEquals("TEXT(\"say \\\"hi\\\"\")", CppTypes.literal("say \"hi\"", "FString"));
        assertEquals("FText::FromString(TEXT(\"Hello\"))", CppTypes.literal("Hello", "FText"));
        assertEquals("42", CppTypes.literal(" 42 ", "int32"));
    }
}
