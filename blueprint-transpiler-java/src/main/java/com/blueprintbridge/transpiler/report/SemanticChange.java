package com.blueprintbridge.transpiler.report;

/**
 * One divergence between the Blueprint graph and the existing C++.
 * {@code blueprintSide}, {@code cppSide} and {@code resolution} are null when not applicable.
 */
public record SemanticChange(
        String id,
        ChangeType type,
        ChangeScope scope,
        String name,
        String description,
        String blueprintSide,
        String cppSide,
        ConflictLevel conflictLevel,
        String resolution
) {
    public SemanticChange withId(String newId) {
        return new SemanticChange(newId, type, scope, name, description,
                blueprintSide, cppSide, conflictLevel, resolution);
    }
}
