package com.blueprintbridge.transpiler.graph;

import java.util.Locale;

public enum PinDirection {
    IN,
    OUT;

    /** "EGPD_Output", "output" and "out" are outputs; anything else is an input. */
    public static PinDirection fromExport(String raw) {
        if (raw == null) return IN;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "egpd_output", "output", "out" -> OUT;
            default -> IN;
        };
    }

    public PinDirection opposite() {
        return this == IN ? OUT : IN;
    }
}
