package com.blueprintbridge.transpiler.symbols;

import com.blueprintbridge.transpiler.report.Warning;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shallow, pattern-based declaration extraction from C++ text. Not a parser: it tracks brace
 * nesting to know when it is directly inside a class body, and matches declaration-shaped text
 * between {@code ;}, {@code {} and {@code }}.
 *
 * Extracted: UPROPERTY member variables; member functions marked UFUNCTION or override
 * (constructors, destructors and operators are skipped); and out-of-line definitions
 * {@code Ret Class::Name(...)} for classes the text does not declare. Never throws; broken text
 * gives a partial table plus warnings.
 */
public class SymbolExtractor {

    private static final Pattern CLASS_HEAD = Pattern.compile(
            "(?:^|\\s)(class|struct)\\s+(?:[A-Z][A-Z0-9_]*_API\\s+)?([A-Za-z_]\\w*)(?:\\s+final)?\\s*"
                    + "(?::\\s*(?:virtual\\s+)?(?:public|protected|private)?\\s*(?:virtual\\s+)?([A-Za-z_][\\w:]*))?[^:;]*$");
    private static final Pattern ENUM = Pattern.compile("\\benum\\b");
    private static final Pattern NAMESPACE = Pattern.compile("^(?:namespace\\b.*|extern\\s+\"\\s*\")$");
    private static final Pattern OUT_OF_LINE = Pattern.compile(
            "^(.*?)\\b([A-Za-z_]\\w*)::(~?[A-Za-z_]\\w*)\\s*\\((.*)\\)[^()]*$");
    private static final Pattern ACCESS_LABEL = Pattern.compile("\\b(?:public|protected|private)\\s*:(?!:)");
    private static final Pattern MACRO_CALL = Pattern.compile("\\b([A-Z_][A-Z0-9_]+)\\s*\\(");
    private static final Pattern TRAILING_NAME = Pattern.compile("(~?[A-Za-z_]\\w*)$");
    private static final Pattern TYPED_NAME = Pattern.compile("^(.*?[\\s&*>])\\s*([A-Za-z_]\\w*)\\s*(\\[[^\\]]*\\])?$");
    private static final Pattern SPECIFIERS = Pattern.compile(
            "\\b(?:virtual|static|inline|FORCEINLINE|FORCENOINLINE|explicit|friend|constexpr|mutable|extern)\\b");
    private static final Pattern FUNCTION_TAIL = Pattern.compile("\\)\\s*(?:const|override|final|noexcept|&|\\s)*$");

    public SymbolTable extract(String sourceText) {
        String text = sourceText == null ? "" : sourceText;
        return new Scan(text).run();
    }

    private enum FrameType { CLASS, NAMESPACE, BODY, INIT, OTHER }

    private record Frame(FrameType type, String className, int line) {}

    private record Definition(String className, String declaration, int line) {}

    private static final class Scan {
        private final String raw;
        private final String code;
        private final int[] lineStarts;

        private final Deque<Frame> frames = new ArrayDeque<>();
        private final StringBuilder pending = new StringBuilder();
        private int pendingStart = -1;

        private final List<ClassSymbol> classes = new ArrayList<>();
        private final Map<String, CodeSymbol> symbols = new LinkedHashMap<>();
        private final List<Definition> outOfLine = new ArrayList<>();
        private final List<Warning> warnings = new ArrayList<>();

        Scan(String raw) {
            this.raw = raw;
            this.code = SourceScanner.clean(raw);
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < code.length(); i++) {
                if (code.charAt(i) == '\n') starts.add(i + 1);
            }
            this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        }

        SymbolTable run() {
            for (int i = 0; i < code.length(); i++) {
                char c = code.charAt(i);
                switch (c) {
                    case '{' -> onOpen(i);
                    case '}' -> onClose(i);
                    case ';' -> onSemicolon();
                    default -> append(c, i);
                }
            }
            finish();
            return new SymbolTable(classes, new ArrayList<>(symbols.values()), warnings, raw.isBlank());
        }

        private boolean collecting() {
            Frame top = frames.peek();
            return top == null || top.type() == FrameType.CLASS || top.type() == FrameType.NAMESPACE;
        }

        private void append(char c, int offset) {
            if (!collecting()) return;
            if (pending.length() == 0 && Character.isWhitespace(c)) return;
            if (pendingStart < 0) pendingStart = offset;
            pending.append(c);
        }

        private boolean inInitializer() {
            Frame top = frames.peek();
            return top != null && top.type() == FrameType.INIT;
        }

        private Frame enclosingClass() {
            Frame top = frames.peek();
            return top != null && top.type() == FrameType.CLASS ? top : null;
        }

        private void onOpen(int offset) {
            if (!collecting() || inInitializer()) {
                frames.push(new Frame(inInitializer() ? FrameType.INIT : FrameType.OTHER, null, lineOf(offset)));
                return;
            }
            int line = pendingLine(offset);
            String text = normalize(stripMacros(pending.toString(), null));
            Frame owner = enclosingClass();

            if (ENUM.matcher(text).find()) {
                push(FrameType.OTHER, null, line);
                return;
            }
            Matcher head = CLASS_HEAD.matcher(text);
            if (!text.contains("(") && head.find()) {
                String name = head.group(2);
                classes.add(new ClassSymbol(name, head.group(3), head.group(1).equals("struct"), line));
                push(FrameType.CLASS, name, line);
                return;
            }
            if (owner == null) {
                if (NAMESPACE.matcher(text).matches()) {
                    push(FrameType.NAMESPACE, null, line);
                    return;
                }
                Matcher def = OUT_OF_LINE.matcher(text);
                if (def.matches()) {
                    outOfLine.add(new Definition(def.group(2), text, line));
                }
                push(FrameType.BODY, null, line);
                return;
            }
            if (FUNCTION_TAIL.matcher(text).find() && balanced(text)) {
                // Inline member function definition
                member(owner.className(), pending.toString(), line);
                push(FrameType.BODY, null, line);
                return;
            }
            // Brace initializer; the declaration continues after the closing brace
            frames.push(new Frame(FrameType.INIT, null, line));
        }

        private void push(FrameType type, String className, int line) {
            frames.push(new Frame(type, className, line));
            resetPending();
        }

        private void onClose(int offset) {
            if (frames.isEmpty()) {
                warnings.add(Warning.warning("unbalanced braces: unexpected '}' at line " + lineOf(offset)));
                resetPending();
                return;
            }
            Frame closed = frames.pop();
            if (closed.type() != FrameType.INIT) {
                resetPending();
            }
        }

        private void onSemicolon() {
            if (inInitializer() || !collecting()) return;
            Frame owner = enclosingClass();
            if (owner != null && pending.length() > 0) {
                member(owner.className(), pending.toString(), pendingLine(pendingStart));
            }
            resetPending();
        }

        private void finish() {
            if (!frames.isEmpty()) {
                Frame open = frames.peekLast();
                warnings.add(Warning.warning("unbalanced braces: " + frames.size()
                        + " '{' without matching '}' (outermost at line " + open.line() + ")"));
            }
            if (pending.length() > 0 && !pending.toString().isBlank() && enclosingClass() != null) {
                warnings.add(Warning.warning("unterminated declaration at line " + pendingLine(pendingStart)));
            }

            Set<String> declared = new HashSet<>();
            classes.forEach(c -> declared.add(c.name()));
            for (Definition definition : outOfLine) {
                if (declared.contains(definition.className())) continue;
                CodeSymbol symbol = function(definition.className(), qualifiedToMember(definition),
                        definition.line(), true);
                if (symbol != null) add(symbol);
            }

            if (symbols.isEmpty() && !raw.isBlank()) {
                warnings.add(Warning.warning("no declarations recognized in the source text"));
            }
        }

        /** "void AFoo::Bar(int32 X)" becomes "void Bar(int32 X)". */
        private static String qualifiedToMember(Definition definition) {
            return definition.declaration().replaceFirst("\\b" + Pattern.quote(definition.className()) + "::", "");
        }

        // --- Member declarations ---

        private void member(String className, String declaration, int line) {
            Set<String> macros = new HashSet<>();
            String text = normalize(stripMacros(ACCESS_LABEL.matcher(declaration).replaceAll(" "), macros));
            if (text.isEmpty() || text.startsWith("using ") || text.startsWith("typedef ") || text.startsWith("friend ")) {
                return;
            }
            int paren = indexAtDepth(text, '(');
            int assign = indexAtDepth(text, '=');
            if (paren >= 0 && (assign < 0 || paren < assign)) {
                CodeSymbol symbol = function(className, text, line, macros.contains("UFUNCTION"));
                if (symbol != null) add(symbol);
            } else if (macros.contains("UPROPERTY")) {
                variables(className, text, line);
            }
        }

        private CodeSymbol function(String className, String text, int line, boolean annotated) {
            int open = indexAtDepth(text, '(');
            int close = matching(text, open);
            if (close < 0) {
                warnings.add(Warning.warning("unterminated declaration at line " + line));
                return null;
            }
            String head = SPECIFIERS.matcher(text.substring(0, open)).replaceAll(" ").trim();
            String tail = text.substring(close + 1);
            boolean override = tail.matches(".*\\boverride\\b.*");
            if (!annotated && !override) return null;
            if (head.contains("operator")) return null;

            Matcher m = TRAILING_NAME.matcher(head);
            if (!m.find()) return null;
            String name = m.group(1);
            String returnType = normalize(head.substring(0, m.start()));
            if (name.startsWith("~") || name.equals(className) || returnType.isEmpty()) return null;

            List<CodeSymbol.Param> params = new ArrayList<>();
            for (String part : splitTopLevel(text.substring(open + 1, close))) {
                String p = part.trim();
                if (p.isEmpty() || p.equals("void")) continue;
                int eq = indexAtDepth(p, '=');
                boolean optional = eq >= 0;
                if (optional) p = p.substring(0, eq).trim();
                Matcher typed = TYPED_NAME.matcher(p);
                String type = typed.matches() && !typed.group(1).isBlank() ? normalize(typed.group(1)) : p;
                params.add(new CodeSymbol.Param(ValueType.fromCppType(type), type, optional));
            }
            return new CodeSymbol(SymbolKind.FUNCTION, name, className, ValueType.fromCppType(returnType),
                    returnType, params, line);
        }

        private void variables(String className, String text, int line) {
            String declaration = text;
            int cut = firstOf(declaration, indexAtDepth(declaration, '='), indexAtDepth(declaration, '{'));
            if (cut >= 0) declaration = declaration.substring(0, cut);
            int bitfield = indexAtDepth(declaration, ':');
            if (bitfield >= 0 && !declaration.contains("::")) declaration = declaration.substring(0, bitfield);
            declaration = normalize(SPECIFIERS.matcher(declaration).replaceAll(" "));

            List<String> declarators = splitTopLevel(declaration);
            if (declarators.isEmpty()) return;
            Matcher first = TYPED_NAME.matcher(declarators.get(0).trim());
            if (!first.matches() || first.group(1).isBlank()) {
                warnings.add(Warning.info("UPROPERTY at line " + line + " has no recognizable declaration"));
                return;
            }
            String type = normalize(first.group(1));
            add(new CodeSymbol(SymbolKind.VARIABLE, first.group(2), className, ValueType.fromCppType(type),
                    type, List.of(), line));
            for (String extra : declarators.subList(1, declarators.size())) {
                String name = extra.trim().replaceAll("^[*&\\s]+", "");
                if (name.matches("[A-Za-z_]\\w*")) {
                    add(new CodeSymbol(SymbolKind.VARIABLE, name, className, ValueType.fromCppType(type),
                            type, List.of(), line));
                }
            }
        }

        private void add(CodeSymbol symbol) {
            String key = symbol.kind() + ":" + symbol.container() + "::" + symbol.name();
            if (symbols.containsKey(key)) {
                warnings.add(Warning.info("overload of " + symbol.container() + "::" + symbol.name()
                        + " at line " + symbol.line() + " ignored; the first declaration is compared"));
                return;
            }
            symbols.put(key, symbol);
        }

        // --- Text helpers ---

        private void resetPending() {
            pending.setLength(0);
            pendingStart = -1;
        }

        private int pendingLine(int fallbackOffset) {
            return lineOf(pendingStart >= 0 ? pendingStart : fallbackOffset);
        }

        private int lineOf(int offset) {
            int idx = Arrays.binarySearch(lineStarts, offset);
            return (idx >= 0 ? idx : -idx - 2) + 1;
        }

        /** Removes ALL_CAPS(...) macro invocations, collecting their names. */
        private static String stripMacros(String text, Set<String> names) {
            StringBuilder out = new StringBuilder();
            int from = 0;
            Matcher m = MACRO_CALL.matcher(text);
            while (m.find(from)) {
                int open = m.end() - 1;
                int close = matching(text, open);
                out.append(text, from, m.start()).append(' ');
                if (names != null) names.add(m.group(1));
                if (close < 0) {
                    from = text.length();
                    break;
                }
                from = close + 1;
            }
            out.append(text.substring(Math.min(from, text.length())));
            return out.toString();
        }

        private static int matching(String text, int open) {
            if (open < 0) return -1;
            int depth = 0;
            for (int i = open; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '(') depth++;
                else if (c == ')' && --depth == 0) return i;
            }
            return -1;
        }

        private static boolean balanced(String text) {
            int depth = 0;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '(') depth++;
                else if (c == ')') depth--;
            }
            return depth == 0;
        }

        /** Index of {@code target} outside parentheses and angle brackets, or -1. */
        private static int indexAtDepth(String text, char target) {
            int depth = 0;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == target && depth == 0) return i;
                if (c == '(' || c == '<') depth++;
                else if ((c == ')' || c == '>') && depth > 0) depth--;
            }
            return -1;
        }

        private static List<String> splitTopLevel(String text) {
            List<String> parts = new ArrayList<>();
            int depth = 0;
            int start = 0;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '(' || c == '<' || c == '{') depth++;
                else if ((c == ')' || c == '>' || c == '}') && depth > 0) depth--;
                else if (c == ',' && depth == 0) {
                    parts.add(text.substring(start, i));
                    start = i + 1;
                }
            }
            if (start < text.length() || !parts.isEmpty()) parts.add(text.substring(start));
            return parts;
        }

        private static int firstOf(String text, int a, int b) {
            if (a < 0) return b;
            if (b < 0) return a;
            return Math.min(a, b);
        }

        private static String normalize(String text) {
            return text.replaceAll("\\s+", " ").trim();
        }
    }
}
