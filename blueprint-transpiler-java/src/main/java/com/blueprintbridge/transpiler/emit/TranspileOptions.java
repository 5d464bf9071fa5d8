package com.blueprintbridge.transpiler.emit;

import java.util.Locale;

/**
 * Emitter options.
 *
 * @param apiMacro               export macro placed on the class declaration, e.g. "MYGAME_API"
 * @param rewriteBlueprintPrefix whether "BP_Foo" is emitted as "AFoo" (or "UFoo" for components)
 */
public record TranspileOptions(String apiMacro, boolean rewriteBlueprintPrefix) {

    public static final String DEFAULT_API_MACRO = "PROJECT_API";

    public TranspileOptions {
        if (apiMacro == null || apiMacro.isBlank()) apiMacro = DEFAULT_API_MACRO;
    }

    public static TranspileOptions defaults() {
        return new TranspileOptions(DEFAULT_API_MACRO, true);
    }

    /** Options for a game module: "MyGame" gives the "MYGAME_API" macro. */
    public static TranspileOptions forModule(String moduleName) {
        if (moduleName == null || moduleName.isBlank()) return defaults();
        return new TranspileOptions(IdentifierSanitizer.sanitize(moduleName).toUpperCase(Locale.ROOT) + "_API", true);
    }
}
