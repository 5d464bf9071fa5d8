package com.blueprintbridge.transpiler.emit;

import java.util.*;

/**
 * Raw Blueprint names to emitted identifiers for one class. Names are assigned in the order
 * they are registered; a name that sanitizes to an identifier already taken gets the first free
 * {@code _1}, {@code _2}, ... suffix. Variables, functions and events share one namespace.
 */
public final class IdentifierMap {

    public enum Kind { VARIABLE, FUNCTION, EVENT }

    private final Set<String> taken = new HashSet<>();
    private final Map<Kind, Map<String, String>> byKind = new EnumMap<>(Kind.class);
    private final Map<String, String> encounterOrder = new LinkedHashMap<>();

    public IdentifierMap() {
        for (Kind kind : Kind.values()) {
            byKind.put(kind, new LinkedHashMap<>());
        }
    }

    /** Takes an identifier without mapping a raw name to it (the class name, engine methods). */
    public void reserve(String identifier) {
        taken.add(identifier);
    }

    /**
     * Registers a raw name and returns its identifier. Registering the same raw name twice
     * under one kind returns the first identifier.
     */
    public String register(Kind kind, String raw) {
        Map<String, String> names = byKind.get(kind);
        String existing = names.get(raw);
        if (existing != null) return existing;
        String identifier = unique(IdentifierSanitizer.sanitize(raw));
        names.put(raw, identifier);
        encounterOrder.putIfAbsent(raw, identifier);
        return identifier;
    }

    /** Maps a raw name to a fixed identifier, e.g. an engine event alias to its C++ override name. */
    public void bind(Kind kind, String raw, String identifier) {
        byKind.get(kind).putIfAbsent(raw, identifier);
        encounterOrder.putIfAbsent(raw, identifier);
        taken.add(identifier);
    }

    public Optional<String> lookup(Kind kind, String raw) {
        return Optional.ofNullable(byKind.get(kind).get(raw));
    }

    /** The registered identifier, or the sanitized raw name for names outside this class. */
    public String resolve(Kind kind, String raw) {
        return lookup(kind, raw).orElseGet(() -> IdentifierSanitizer.sanitize(raw));
    }

    /** Raw name to identifier in encounter order; first registration wins across kinds. */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(encounterOrder);
    }

    private String unique(String base) {
        if (taken.add(base)) return base;
        for (int n = 1; ; n++) {
            String candidate = base + "_" + n;
            if (taken.add(candidate)) return candidate;
        }
    }
}
