package com.blueprintbridge.transpiler.report;

/**
 * A recoverable anomaly attached to a still-returned result.
 * {@code nodeId} is null when the warning is not tied to a single graph node.
 */
public record Warning(Severity severity, String message, String nodeId) {

    public static Warning info(String message)    { return new Warning(Severity.INFO, message, null); }
    public static Warning warning(String message) { return new Warning(Severity.WARNING, message, null); }
    public static Warning error(String message)   { return new Warning(Severity.ERROR, message, null); }

    public static Warning atNode(Severity severity, String nodeId, String message) {
        return new Warning(severity, message, nodeId);
    }
}
