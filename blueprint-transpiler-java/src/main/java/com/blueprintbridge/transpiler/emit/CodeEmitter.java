package com.blueprintbridge.transpiler.emit;

import com.blueprintbridge.transpiler.emit.ClassLayout.Property;
import com.blueprintbridge.transpiler.flow.Block;
import com.blueprintbridge.transpiler.flow.Statement;
import com.blueprintbridge.transpiler.flow.StatementTree;
import com.blueprintbridge.transpiler.flow.StatementTree.EntryPoint;
import com.blueprintbridge.transpiler.graph.BlueprintAsset;
import com.blueprintbridge.transpiler.report.Warning;

import java.util.*;

/**
 * Writes the header and source of an Unreal C++ class from a parsed asset and the statement
 * trees of its graphs. Output depends only on its inputs, so emitting the same asset twice
 * gives byte-identical text.
 */
public class CodeEmitter {

    private final TranspileOptions options;

    public CodeEmitter(TranspileOptions options) {
        this.options = options;
    }

    /**
     * @param trees statement trees keyed by graph name; graphs without a tree get empty bodies
     */
    public EmittedCode emit(BlueprintAsset asset, Map<String, StatementTree> trees) {
        ClassLayout layout = ClassLayout.plan(asset, options);
        List<Warning> warnings = new ArrayList<>(layout.warnings());

        Set<String> sourceIncludes = new TreeSet<>();
        String source = writeSource(layout, trees, sourceIncludes, warnings);
        String header = writeHeader(layout, asset);

        List<String> includes = new ArrayList<>(layout.headerIncludes());
        includes.add(layout.headerFileName());
        includes.addAll(sourceIncludes);

        return new EmittedCode(layout.className(), layout.parentClass(), layout.headerFileName(),
                layout.sourceFileName(), header, source, includes, layout.identifiers().asMap(), warnings);
    }

    // --- Header ---

    private String writeHeader(ClassLayout layout, BlueprintAsset asset) {
        SourceWriter w = new SourceWriter();
        w.line("#pragma once").blank();
        for (String include : layout.headerIncludes()) {
            w.line("#include \"" + include + "\"");
        }
        w.blank();
        w.line("UCLASS()");
        w.line("class " + options.apiMacro() + " " + layout.className() + " : public " + layout.parentClass());
        w.open();
        w.line("GENERATED_BODY()").blank();
        w.label("public:");
        w.line(layout.className() + "();");

        for (Property property : layout.properties()) {
            w.blank();
            if (property.variable().tooltip() != null) {
                w.line("/** " + property.variable().tooltip().replace("*/", "* /") + " */");
            }
            w.line("UPROPERTY(" + property.specifiers() + ")");
            String initializer = property.initializer();
            w.line(property.cppType() + " " + property.name() + (initializer != null ? " = " + initializer : "") + ";");
        }

        for (MethodSignature method : layout.methodsOfKind(MethodSignature.Kind.FUNCTION)) {
            w.blank();
            w.line("UFUNCTION(BlueprintCallable, Category = \"" + asset.className() + "\")");
            w.line(method.declaration() + ";");
        }
        for (MethodSignature method : layout.methodsOfKind(MethodSignature.Kind.CUSTOM_EVENT)) {
            w.blank();
            w.line("UFUNCTION(BlueprintCallable, Category = \"Events\")");
            w.line(method.declaration() + ";");
        }

        List<MethodSignature> overrides = layout.methodsOfKind(MethodSignature.Kind.ENGINE_EVENT);
        if (!overrides.isEmpty()) {
            w.blank();
            w.label("protected:");
            for (MethodSignature method : overrides) {
                w.line("virtual " + method.declaration() + " override;");
            }
        }
        w.close("};");
        return w.text();
    }

    // --- Source ---

    private String writeSource(ClassLayout layout, Map<String, StatementTree> trees, Set<String> includes,
                               List<Warning> warnings) {
        SourceWriter body = new SourceWriter();
        String tick = layout.isComponent() ? "PrimaryComponentTick" : "PrimaryActorTick";
        body.line(layout.className() + "::" + layout.className() + "()");
        body.open();
        body.line(tick + ".bCanEverTick = " + layout.hasTick() + ";");
        body.close();

        for (MethodSignature method : layout.methods()) {
            body.blank();
            body.line(method.definition(layout.className()));
            body.open();
            if (method.override() != null) {
                body.line(method.override().superCall());
            }
            Block block = bodyOf(method, trees);
            new BodyEmitter(layout, method, body, includes, warnings).emit(block);
            if (method.returnsValue() && !endsWithReturn(block)) {
                body.line("return " + CppTypes.zeroValue(method.returnType()) + ";");
            }
            body.close();
        }

        SourceWriter w = new SourceWriter();
        w.line("#include \"" + layout.headerFileName() + "\"");
        for (String include : includes) {
            w.line("#include \"" + include + "\"");
        }
        w.blank();
        return w.text() + body.text();
    }

    private static Block bodyOf(MethodSignature method, Map<String, StatementTree> trees) {
        StatementTree tree = trees.get(method.graphName());
        if (tree == null || method.entryNodeId() == null) return Block.EMPTY;
        return tree.entry(method.entryNodeId()).map(EntryPoint::body).orElse(Block.EMPTY);
    }

    private static boolean endsWithReturn(Block block) {
        List<Statement> statements = block.statements();
        return !statements.isEmpty() && statements.get(statements.size() - 1) instanceof Statement.ReturnStatement;
    }
}
