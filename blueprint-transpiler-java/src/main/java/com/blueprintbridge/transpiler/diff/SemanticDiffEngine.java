package com.blueprintbridge.transpiler.diff;

import com.blueprintbridge.transpiler.emit.ClassLayout;
import com.blueprintbridge.transpiler.emit.TranspileOptions;
import com.blueprintbridge.transpiler.graph.BlueprintAsset;
import com.blueprintbridge.transpiler.graph.GraphType;
import com.blueprintbridge.transpiler.report.*;
import com.blueprintbridge.transpiler.symbols.ClassSymbol;
import com.blueprintbridge.transpiler.symbols.CodeSymbol;
import com.blueprintbridge.transpiler.symbols.SymbolKind;
import com.blueprintbridge.transpiler.symbols.SymbolTable;
import com.blueprintbridge.transpiler.symbols.ValueType;

import java.util.*;

/**
 * Compares the symbols a Blueprint would generate against symbols extracted from existing C++.
 *
 * Matching runs per kind: exact names first (same class preferred), then renames among the
 * leftovers with identical signatures and similar names, then additions and removals. The
 * graph is the new state and the C++ the old one, so a type that grows from the C++ side to
 * the graph side is a widening. Changes are sorted and numbered last, so the result does not
 * depend on declaration order.
 */
public class SemanticDiffEngine {

    private final DiffPolicy policy;
    private final TranspileOptions options;

    public SemanticDiffEngine(DiffPolicy policy, TranspileOptions options) {
        this.policy = policy;
        this.options = options;
    }

    public DiffResult diff(BlueprintAsset asset, SymbolTable existing) {
        ClassLayout layout = ClassLayout.plan(asset, options);
        List<SemanticChange> changes = new ArrayList<>();

        ClassSymbol counterpart = compareClass(layout, existing, changes);
        String home = counterpart != null ? counterpart.name() : layout.className();
        List<CodeSymbol> blueprint = BlueprintSymbols.of(layout);
        List<CodeSymbol> own = new ArrayList<>();
        List<CodeSymbol> elsewhere = new ArrayList<>();
        for (CodeSymbol symbol : existing.symbols()) {
            if (symbol.container().equals(home)) {
                own.add(rehome(symbol, layout.className()));
            } else {
                elsewhere.add(symbol);
            }
        }

        for (SymbolKind kind : SymbolKind.values()) {
            compareKind(kind,
                    blueprint.stream().filter(s -> s.kind() == kind).toList(),
                    own.stream().filter(s -> s.kind() == kind).toList(),
                    elsewhere.stream().filter(s -> s.kind() == kind).toList(),
                    changes);
        }

        return DiffResult.of(number(changes), blueprintSummary(asset), cppSummary(existing), existing.warnings());
    }

    // --- Class scope ---

    /**
     * Returns the C++ class that stands for the Blueprint class: the one with the same name,
     * or else the only non-struct class, reported as a rename. Null when neither exists.
     */
    private ClassSymbol compareClass(ClassLayout layout, SymbolTable existing, List<SemanticChange> changes) {
        List<ClassSymbol> classes = existing.classes();
        ClassSymbol match = classes.stream().filter(c -> c.name().equals(layout.className())).findFirst().orElse(null);
        if (match == null) {
            List<ClassSymbol> candidates = classes.stream().filter(c -> !c.struct()).toList();
            if (candidates.size() == 1) {
                match = candidates.get(0);
                changes.add(new SemanticChange(null, ChangeType.RENAME, ChangeScope.CLASS, layout.className(),
                        "Class " + match.name() + " in C++ corresponds to Blueprint class " + layout.className(),
                        "class " + layout.className(), "class " + match.name(),
                        ConflictLevel.COMPATIBLE, "Rename " + match.name() + " to " + layout.className()));
            }
        }
        if (match != null && !layout.parentClass().equals(match.base())) {
            String cppBase = match.base() != null ? match.base() : "no base class";
            changes.add(new SemanticChange(null, ChangeType.MODIFY, ChangeScope.CLASS, layout.className(),
                    "Parent class differs: Blueprint extends " + layout.parentClass() + ", C++ has " + cppBase,
                    "class " + layout.className() + " : public " + layout.parentClass(),
                    "class " + match.name() + (match.base() != null ? " : public " + match.base() : ""),
                    ConflictLevel.CONFLICT, "Change the base class of " + match.name() + " to " + layout.parentClass()));
        }
        return match;
    }

    private static CodeSymbol rehome(CodeSymbol symbol, String container) {
        return new CodeSymbol(symbol.kind(), symbol.name(), container, symbol.type(), symbol.typeText(),
                symbol.params(), symbol.line());
    }

    // --- Member scope ---

    /**
     * Members of the Blueprint's own class are matched, renamed, added and removed. Members of
     * other classes only take part when the Blueprint defines the same name, as a move.
     */
    private void compareKind(SymbolKind kind, List<CodeSymbol> blueprint, List<CodeSymbol> own,
                             List<CodeSymbol> elsewhere, List<SemanticChange> changes) {
        ChangeScope scope = kind == SymbolKind.VARIABLE ? ChangeScope.VARIABLE : ChangeScope.FUNCTION;
        Comparator<CodeSymbol> byName = Comparator.comparing(CodeSymbol::name).thenComparing(CodeSymbol::container);
        List<CodeSymbol> unmatchedCpp = new ArrayList<>(own);
        unmatchedCpp.sort(byName);
        List<CodeSymbol> unclaimedElsewhere = new ArrayList<>(elsewhere);
        unclaimedElsewhere.sort(byName);
        List<CodeSymbol> unmatchedBlueprint = new ArrayList<>();

        for (CodeSymbol bp : blueprint) {
            CodeSymbol counterpart = unmatchedCpp.stream()
                    .filter(c -> c.name().equals(bp.name()))
                    .findFirst()
                    .or(() -> unclaimedElsewhere.stream().filter(c -> c.name().equals(bp.name())).findFirst())
                    .orElse(null);
            if (counterpart == null) {
                unmatchedBlueprint.add(bp);
                continue;
            }
            unmatchedCpp.remove(counterpart);
            unclaimedElsewhere.remove(counterpart);
            SemanticChange change = compareMatched(scope, bp, counterpart);
            if (change != null) changes.add(change);
        }

        for (Pairing pair : renames(unmatchedBlueprint, unmatchedCpp)) {
            unmatchedBlueprint.remove(pair.blueprint());
            unmatchedCpp.remove(pair.cpp());
            changes.add(new SemanticChange(null, ChangeType.RENAME, scope, pair.blueprint().name(),
                    label(scope) + " \"" + pair.cpp().name() + "\" in C++ matches \"" + pair.blueprint().name()
                            + "\" in Blueprint (name similarity " + String.format(Locale.ROOT, "%.2f", pair.similarity()) + ")",
                    pair.blueprint().summary(), pair.cpp().summary(), ConflictLevel.COMPATIBLE,
                    "Rename " + pair.cpp().name() + " to " + pair.blueprint().name() + " and update callers"));
        }

        for (CodeSymbol bp : unmatchedBlueprint) {
            changes.add(new SemanticChange(null, ChangeType.ADD, scope, bp.name(),
                    label(scope) + " \"" + bp.name() + "\" exists in Blueprint but not in C++",
                    bp.summary(), null, ConflictLevel.NONE,
                    (kind == SymbolKind.VARIABLE ? "Add UPROPERTY " : "Declare UFUNCTION ") + bp.summary()
                            + " in " + bp.container()));
        }
        for (CodeSymbol c : unmatchedCpp) {
            changes.add(new SemanticChange(null, ChangeType.REMOVE, scope, c.name(),
                    label(scope) + " \"" + c.name() + "\" exists in C++ but not in Blueprint",
                    null, c.summary(), policy.getRemovalConflictLevel(),
                    "Remove " + c.name() + " from C++, or add it back to the Blueprint if it is still used"));
        }
    }

    private SemanticChange compareMatched(ChangeScope scope, CodeSymbol bp, CodeSymbol cpp) {
        List<String> reasons = new ArrayList<>();
        ConflictLevel level = ConflictLevel.NONE;

        if (scope == ChangeScope.VARIABLE) {
            level = level.max(compareType("type", cpp.type(), cpp.typeText(), bp.type(), bp.typeText(), reasons));
        } else {
            if (!canonical(bp.typeText()).equals(canonical(cpp.typeText()))) {
                reasons.add("return type changes from " + cpp.typeText() + " to " + bp.typeText());
                level = ConflictLevel.CONFLICT;
            }
            level = level.max(compareParams(bp.params(), cpp.params(), reasons));
        }

        boolean moved = !bp.container().equals(cpp.container());
        if (reasons.isEmpty()) {
            if (!moved) return null;
            return new SemanticChange(null, ChangeType.MOVE, scope, bp.name(),
                    label(scope) + " \"" + bp.name() + "\" is declared in " + cpp.container()
                            + " but the Blueprint defines it on " + bp.container(),
                    bp.container() + "::" + bp.summary(), cpp.container() + "::" + cpp.summary(),
                    ConflictLevel.COMPATIBLE, "Move the declaration to " + bp.container());
        }
        if (moved) {
            reasons.add("declared in " + cpp.container() + " instead of " + bp.container());
            level = level.max(ConflictLevel.COMPATIBLE);
        }
        return new SemanticChange(null, ChangeType.MODIFY, scope, bp.name(),
                label(scope) + " \"" + bp.name() + "\": " + String.join("; ", reasons),
                bp.summary(), cpp.summary(), level, "Update the C++ declaration to " + bp.summary());
    }

    private ConflictLevel compareParams(List<CodeSymbol.Param> bp, List<CodeSymbol.Param> cpp, List<String> reasons) {
        ConflictLevel level = ConflictLevel.NONE;
        int shared = Math.min(bp.size(), cpp.size());
        for (int i = 0; i < shared; i++) {
            level = level.max(compareType("parameter " + (i + 1) + " type", cpp.get(i).type(), cpp.get(i).typeText(),
                    bp.get(i).type(), bp.get(i).typeText(), reasons));
        }
        if (cpp.size() > bp.size()) {
            reasons.add("removes " + (cpp.size() - bp.size()) + " parameter(s)");
            level = ConflictLevel.CONFLICT;
        } else if (bp.size() > cpp.size()) {
            List<CodeSymbol.Param> added = bp.subList(cpp.size(), bp.size());
            boolean allOptional = added.stream().allMatch(CodeSymbol.Param::optional);
            if (allOptional && policy.isOptionalParametersCompatible()) {
                reasons.add("adds " + added.size() + " optional parameter(s)");
                level = level.max(ConflictLevel.COMPATIBLE);
            } else {
                reasons.add("adds " + added.size() + (allOptional ? " optional" : " required") + " parameter(s)");
                level = ConflictLevel.CONFLICT;
            }
        }
        return level;
    }

    /**
     * Within one coarse type, a wider spelling on the graph side is a widening and a narrower
     * one conflicts; equal widths (int and int32, FString and FName) are compatible. Across
     * types, bool &lt; int &lt; float widenings follow the policy and anything else conflicts.
     */
    private ConflictLevel compareType(String what, ValueType cppType, String cppText,
                                      ValueType bpType, String bpText,
                                      List<String> reasons) {
        if (canonical(cppText).equals(canonical(bpText))) return ConflictLevel.NONE;
        if (cppType == bpType) {
            int cppBits = ValueType.bitWidth(cppText);
            int bpBits = ValueType.bitWidth(bpText);
            if (cppBits > 0 && bpBits > 0 && bpBits < cppBits) {
                reasons.add(what + " narrows from " + cppText + " to " + bpText);
                return ConflictLevel.CONFLICT;
            }
            if (cppBits > 0 && bpBits > cppBits) {
                reasons.add(what + " widens from " + cppText + " to " + bpText);
                return policy.isWideningCompatible() ? ConflictLevel.COMPATIBLE : ConflictLevel.CONFLICT;
            }
            reasons.add(what + " changes from " + cppText + " to " + bpText);
            return ConflictLevel.COMPATIBLE;
        }
        if (cppType.widensTo(bpType)) {
            reasons.add(what + " widens from " + cppText + " to " + bpText);
            return policy.isWideningCompatible() ? ConflictLevel.COMPATIBLE : ConflictLevel.CONFLICT;
        }
        reasons.add(what + " changes from " + cppText + " to " + bpText);
        return ConflictLevel.CONFLICT;
    }

    // --- Renames ---

    private record Pairing(CodeSymbol blueprint, CodeSymbol cpp, double similarity) {}

    private List<Pairing> renames(List<CodeSymbol> blueprint, List<CodeSymbol> cpp) {
        List<Pairing> candidates = new ArrayList<>();
        for (CodeSymbol bp : blueprint) {
            for (CodeSymbol c : cpp) {
                if (!bp.sameSignature(c)) continue;
                double similarity = NameSimilarity.of(bp.name(), c.name());
                if (similarity >= policy.getRenameSimilarityThreshold()) {
                    candidates.add(new Pairing(bp, c, similarity));
                }
            }
        }
        candidates.sort(Comparator.comparingDouble(Pairing::similarity).reversed()
                .thenComparing(p -> p.blueprint().name())
                .thenComparing(p -> p.cpp().name())
                .thenComparing(p -> p.cpp().container()));

        List<Pairing> chosen = new ArrayList<>();
        Set<CodeSymbol> usedBlueprint = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<CodeSymbol> usedCpp = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Pairing p : candidates) {
            if (usedBlueprint.contains(p.blueprint()) || usedCpp.contains(p.cpp())) continue;
            usedBlueprint.add(p.blueprint());
            usedCpp.add(p.cpp());
            chosen.add(p);
        }
        return chosen;
    }

    // --- Output ---

    private static List<SemanticChange> number(List<SemanticChange> changes) {
        List<SemanticChange> sorted = new ArrayList<>(changes);
        sorted.sort(Comparator.comparing(SemanticChange::scope)
                .thenComparing(SemanticChange::name)
                .thenComparing(SemanticChange::type)
                .thenComparing(c -> c.cppSide() == null ? "" : c.cppSide()));
        List<SemanticChange> numbered = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            numbered.add(sorted.get(i).withId("change-" + i));
        }
        return numbered;
    }

    public static String blueprintSummary(BlueprintAsset asset) {
        int eventNodes = asset.graphsOfType(GraphType.EVENT).stream().mapToInt(g -> g.nodes().size()).sum();
        return asset.className() + ": " + asset.variables().size() + " variables, "
                + asset.graphsOfType(GraphType.FUNCTION).size() + " functions, " + eventNodes + " event nodes";
    }

    static String cppSummary(SymbolTable table) {
        return table.functions().size() + " functions, " + table.variables().size() + " properties detected";
    }

    private static String canonical(String typeText) {
        return typeText.replaceAll("\\s*([*&<>,])\\s*", "$1").trim();
    }

    private static String label(ChangeScope scope) {
        return scope == ChangeScope.VARIABLE ? "Variable" : "Function";
    }
}
