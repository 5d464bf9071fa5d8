package com.blueprintbridge.transpiler.symbols;

/**
 * A class or struct declaration; {@code base} is null when it has no base class. Structs are
 * value helpers (USTRUCTs and the like) and never stand for a Blueprint class.
 */
public record ClassSymbol(String name, String base, boolean struct, int line) {
}
