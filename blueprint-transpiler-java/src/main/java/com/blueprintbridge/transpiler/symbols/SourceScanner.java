package com.blueprintbridge.transpiler.symbols;

/**
 * Blanks out the parts of C++ text a declaration scanner must not see: comments, preprocessor
 * lines and the contents of string and character literals. The result has the same length and
 * the same line breaks as the input, so offsets and line numbers carry over.
 */
final class SourceScanner {

    private SourceScanner() {}

    static String clean(String text) {
        char[] out = text.toCharArray();
        int n = out.length;
        int i = 0;
        boolean lineStart = true;
        while (i < n) {
            char c = out[i];
            if (c == '/' && i + 1 < n && out[i + 1] == '/') {
                while (i < n && out[i] != '\n') out[i++] = ' ';
                continue;
            }
            if (c == '/' && i + 1 < n && out[i + 1] == '*') {
                out[i++] = ' ';
                out[i++] = ' ';
                while (i < n && !(out[i] == '*' && i + 1 < n && out[i + 1] == '/')) {
                    if (out[i] != '\n') out[i] = ' ';
                    i++;
                }
                if (i < n) {
                    out[i++] = ' ';
                    out[i++] = ' ';
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                i = blankLiteral(out, i, c);
                lineStart = false;
                continue;
            }
            if (c == '#' && lineStart) {
                // Directive, including backslash continuations
                while (i < n && out[i] != '\n') {
                    if (out[i] == '\\' && i + 1 < n && out[i + 1] == '\n') {
                        out[i] = ' ';
                        i += 2;
                        continue;
                    }
                    out[i++] = ' ';
                }
                continue;
            }
            if (c == '\n') {
                lineStart = true;
            } else if (!Character.isWhitespace(c)) {
                lineStart = false;
            }
            i++;
        }
        return new String(out);
    }

    /** Keeps the quotes, blanks what is between them; returns the index after the closing quote. */
    private static int blankLiteral(char[] out, int start, char quote) {
        int i = start + 1;
        while (i < out.length && out[i] != quote && out[i] != '\n') {
            if (out[i] == '\\' && i + 1 < out.length && out[i + 1] != '\n') {
                out[i++] = ' ';
            }
            out[i++] = ' ';
        }
        return i < out.length && out[i] == quote ? i + 1 : i;
    }
}
