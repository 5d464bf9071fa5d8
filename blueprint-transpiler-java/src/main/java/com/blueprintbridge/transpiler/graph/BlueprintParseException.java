package com.blueprintbridge.transpiler.graph;

/**
 * The document cannot be read as a Blueprint export at all: it is not JSON, not a JSON
 * object, or it has no ClassName. Every other defect is a warning on the parsed result.
 */
public class BlueprintParseException extends RuntimeException {
    public BlueprintParseException(String message) { super(message); }
    public BlueprintParseException(String message, Throwable cause) { super(message, cause); }
}
