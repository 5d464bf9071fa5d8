package com.blueprintbridge.transpiler.graph;

import com.blueprintbridge.transpiler.report.Warning;
import java.util.List;

/** A parsed asset plus everything the parser had to skip or repair on the way. */
public record ParsedBlueprint(BlueprintAsset asset, List<Warning> warnings) {
    public ParsedBlueprint {
        warnings = List.copyOf(warnings);
    }
}
