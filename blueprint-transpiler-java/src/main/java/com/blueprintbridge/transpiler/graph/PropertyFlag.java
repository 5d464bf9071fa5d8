package com.blueprintbridge.transpiler.graph;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Variable qualifiers recognized from the export's PropertyFlags. */
public enum PropertyFlag {
    EDITABLE,
    EXPOSE_ON_SPAWN,
    READ_ONLY,
    REPLICATED;

    public static Set<PropertyFlag> fromExport(List<String> rawFlags) {
        EnumSet<PropertyFlag> flags = EnumSet.noneOf(PropertyFlag.class);
        if (rawFlags == null) return flags;
        for (String raw : rawFlags) {
            if (raw == null) continue;
            switch (raw.trim()) {
                case "CPF_Edit", "EditAnywhere", "EditDefaultsOnly", "EditInstanceOnly" -> flags.add(EDITABLE);
                case "CPF_ExposeOnSpawn", "ExposeOnSpawn" -> flags.add(EXPOSE_ON_SPAWN);
                case "CPF_BlueprintReadOnly", "BlueprintReadOnly" -> flags.add(READ_ONLY);
                case "CPF_Net", "Replicated", "ReplicatedUsing" -> flags.add(REPLICATED);
                default -> { }
            }
        }
        return flags;
    }
}
