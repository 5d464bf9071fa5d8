package com.blueprintbridge.transpiler.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Serializes transpile and diff results to the JSON shapes the presentation layer consumes.
 * Output is deterministic: component order is fixed and no wall-clock data is written.
 */
public class ResultSerializer {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    public String toJson(TranspileResult result) {
        return GSON.toJson(result);
    }

    public String toJson(DiffResult result) {
        return GSON.toJson(result);
    }
}
