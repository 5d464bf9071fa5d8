package com.blueprintbridge.transpiler.emit;

import com.blueprintbridge.transpiler.emit.EventSignatures.EventSignature;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A method the emitted class declares. {@code graphName} and {@code entryNodeId} locate the
 * statement tree that becomes its body; {@code override} is set for engine events only.
 */
public record MethodSignature(
        Kind kind,
        String rawName,
        String name,
        String returnType,
        List<Param> params,
        String graphName,
        String entryNodeId,
        EventSignature override
) {
    public enum Kind { ENGINE_EVENT, FUNCTION, CUSTOM_EVENT }

    /** {@code defaultValue} is C++ literal text, or null for a required parameter. */
    public record Param(String type, String name, String defaultValue) {
        public boolean isOptional() { return defaultValue != null; }
    }

    public MethodSignature {
        params = List.copyOf(params);
    }

    public boolean returnsValue() {
        return !"void".equals(returnType);
    }

    /** "void TakeDamage(float DamageAmount)", with default arguments. */
    public String declaration() {
        return returnType + " " + name + "(" + parameters(true) + ")";
    }

    /** "void APlayerCharacter::TakeDamage(float DamageAmount)". */
    public String definition(String className) {
        return returnType + " " + className + "::" + name + "(" + parameters(false) + ")";
    }

    private String parameters(boolean withDefaults) {
        return params.stream()
                .map(p -> p.type() + " " + p.name() + (withDefaults && p.isOptional() ? " = " + p.defaultValue() : ""))
                .collect(Collectors.joining(", "));
    }
}
