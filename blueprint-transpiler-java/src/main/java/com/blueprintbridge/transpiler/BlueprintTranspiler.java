package com.blueprintbridge.transpiler;

import com.blueprintbridge.transpiler.diff.DiffPolicy;
import com.blueprintbridge.transpiler.diff.SemanticDiffEngine;
import com.blueprintbridge.transpiler.emit.CodeEmitter;
import com.blueprintbridge.transpiler.emit.EmittedCode;
import com.blueprintbridge.transpiler.emit.TranspileOptions;
import com.blueprintbridge.transpiler.flow.ControlFlowResolver;
import com.blueprintbridge.transpiler.flow.StatementTree;
import com.blueprintbridge.transpiler.graph.BlueprintAsset;
import com.blueprintbridge.transpiler.graph.BlueprintParser;
import com.blueprintbridge.transpiler.graph.GraphDefinition;
import com.blueprintbridge.transpiler.graph.ParsedBlueprint;
import com.blueprintbridge.transpiler.report.DiffResult;
import com.blueprintbridge.transpiler.report.Severity;
import com.blueprintbridge.transpiler.report.TranspileResult;
import com.blueprintbridge.transpiler.report.Warning;
import com.blueprintbridge.transpiler.symbols.SymbolExtractor;
import com.blueprintbridge.transpiler.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for both pipelines.
 *
 *   transpile(document)             = emit(resolve(parse(document)))
 *   diff(document, existingSource)  = diff(parse(document), extract(existingSource))
 *
 * Instances hold only options and are safe to share between threads.
 */
public class BlueprintTranspiler {

    private final TranspileOptions options;
    private final DiffPolicy policy;

    public BlueprintTranspiler() {
        this(TranspileOptions.defaults(), DiffPolicy.defaults());
    }

    public BlueprintTranspiler(TranspileOptions options, DiffPolicy policy) {
        this.options = options;
        this.policy = policy;
    }

    /**
     * @throws com.blueprintbridge.transpiler.graph.BlueprintParseException when the document is not a Blueprint export
     */
    public TranspileResult transpile(String document) {
        ParsedBlueprint parsed = new BlueprintParser().parse(document);
        BlueprintAsset asset = parsed.asset();
        List<Warning> warnings = new ArrayList<>(parsed.warnings());

        // 1. Control flow, one tree per graph
        ControlFlowResolver resolver = new ControlFlowResolver();
        Map<String, StatementTree> trees = new LinkedHashMap<>();
        for (GraphDefinition graph : asset.graphs()) {
            StatementTree tree = resolver.resolve(graph);
            trees.put(graph.graphName(), tree);
            warnings.addAll(tree.warnings());
        }

        // 2. Emit
        EmittedCode code = new CodeEmitter(options).emit(asset, trees);
        warnings.addAll(code.warnings());

        logDropped(parsed.warnings());
        System.err.println("[blueprint-transpiler] Transpiled " + asset.className() + ": "
                + asset.nodeCount() + " nodes, " + asset.functionCount() + " functions, "
                + warnings.size() + " warnings");

        return new TranspileResult(code.className(), code.parentClass(), code.headerCode(), code.sourceCode(),
                asset.nodeCount(), asset.functionCount(), warnings, code.headerFileName(),
                code.sourceFileName(), code.includes(), code.identifierMap());
    }

    /**
     * Never throws for problems in {@code existingSource}; those come back as an analysis
     * error warning on an empty result.
     *
     * @throws com.blueprintbridge.transpiler.graph.BlueprintParseException when the document is not a Blueprint export
     */
    public DiffResult diff(String document, String existingSource) {
        ParsedBlueprint parsed = new BlueprintParser().parse(document);
        BlueprintAsset asset = parsed.asset();
        logDropped(parsed.warnings());

        if (existingSource == null || existingSource.isBlank()) {
            System.err.println("[blueprint-transpiler] Diff of " + asset.className() + " skipped: no existing source");
            return DiffResult.analysisFailure(SemanticDiffEngine.blueprintSummary(asset),
                    Warning.error("analysis error: existing source is empty"));
        }

        DiffResult result;
        try {
            SymbolTable table = new SymbolExtractor().extract(existingSource);
            result = new SemanticDiffEngine(policy, options).diff(asset, table);
        } catch (RuntimeException e) {
            System.err.println("[blueprint-transpiler] ERROR: analysis of existing source failed: " + e.getMessage());
            return DiffResult.analysisFailure(SemanticDiffEngine.blueprintSummary(asset),
                    Warning.error("analysis error: existing source could not be processed (" + e.getMessage() + ")"));
        }

        System.err.println("[blueprint-transpiler] Diffed " + asset.className() + ": "
                + result.changes().size() + " changes, overall " + result.overallConflict());
        return result;
    }

    private static void logDropped(List<Warning> parseWarnings) {
        for (Warning warning : parseWarnings) {
            if (warning.severity() != Severity.INFO) {
                System.err.println("[blueprint-transpiler] WARN: " + warning.message());
            }
        }
    }
}
