package com.blueprintbridge.transpiler.emit;

/** Line-oriented text buffer with tab indentation. Lines end with '\n'. */
final class SourceWriter {

    private final StringBuilder out = new StringBuilder();
    private int depth;

    SourceWriter line(String text) {
        if (!text.isEmpty()) out.append("\t".repeat(depth)).append(text);
        out.append('\n');
        return this;
    }

    SourceWriter blank() {
        out.append('\n');
        return this;
    }

    /** An access specifier, one level left of the members it introduces. */
    SourceWriter label(String text) {
        out.append("\t".repeat(Math.max(0, depth - 1))).append(text).append('\n');
        return this;
    }

    SourceWriter open() {
        line("{");
        depth++;
        return this;
    }

    SourceWriter close(String closing) {
        depth--;
        return line(closing);
    }

    SourceWriter close() {
        return close("}");
    }

    String text() {
        return out.toString();
    }
}
