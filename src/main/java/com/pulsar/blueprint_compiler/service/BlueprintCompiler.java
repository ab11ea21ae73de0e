package com.pulsar.blueprint_compiler.service;

import com.pulsar.blueprint_compiler.config.BlueprintCompilerProperties;
import com.pulsar.blueprint_compiler.engine.CodeGenerator;
import com.pulsar.blueprint_compiler.engine.CompilationEventPublisher;
import com.pulsar.blueprint_compiler.engine.DataResolver;
import com.pulsar.blueprint_compiler.engine.ExecutionRouter;
import com.pulsar.blueprint_compiler.engine.GenerationContext;
import com.pulsar.blueprint_compiler.engine.GraphValidator;
import com.pulsar.blueprint_compiler.engine.ProgramAssembler;
import com.pulsar.blueprint_compiler.exception.CompilationException;
import com.pulsar.blueprint_compiler.library.SubGraphExpander;
import com.pulsar.blueprint_compiler.model.compilation.CompilationPhase;
import com.pulsar.blueprint_compiler.model.compilation.CompilationResult;
import com.pulsar.blueprint_compiler.model.graph.GraphDescription;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.graph.PassthroughNodeTypes;
import com.pulsar.blueprint_compiler.model.metadata.NodeMetadata;
import com.pulsar.blueprint_compiler.registry.NodeMetadataRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Compiles a Blueprint graph to source text.
 *
 * Phases run in order and the first error ends the compilation:
 * expansion → metadata lookup → validation → routing → data resolution → generation → assembly.
 * The caller's graph is never modified; expansion works on a copy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlueprintCompiler {

    private final NodeMetadataRegistry metadataRegistry;
    private final SubGraphExpander expander;
    private final GraphValidator validator;
    private final CodeGenerator codeGenerator;
    private final ProgramAssembler assembler;
    private final CompilationEventPublisher eventPublisher;
    private final BlueprintCompilerProperties properties;

    public String compileToSource(GraphDescription graph) {
        return compile(graph).getSource();
    }

    public CompilationResult compile(GraphDescription source) {
        String compilationId = UUID.randomUUID().toString();
        List<String> diagnostics = new ArrayList<>();
        log.info("[COMPILER] Compilation {} started for graph '{}' ({} nodes)",
                compilationId, source.getMetadata().getName(), source.getNodeCount());

        // ── Expansion ─────────────────────────────────────────────────────────
        GraphDescription graph = runPhase(compilationId, CompilationPhase.EXPANSION, diagnostics, () -> {
            GraphDescription working = source.deepCopy();
            expander.expandAll(working, properties.getMaxExpansionDepth());
            return working;
        }, g -> g.getNodeCount() + " nodes after expansion");

        // ── Metadata ──────────────────────────────────────────────────────────
        Map<String, NodeMetadata> metadataByNode = runPhase(compilationId, CompilationPhase.METADATA, diagnostics,
                () -> lookUpMetadata(graph), m -> m.size() + " nodes resolved against the catalog");

        // ── Validation ────────────────────────────────────────────────────────
        runPhase(compilationId, CompilationPhase.VALIDATION, diagnostics, () -> {
            if (properties.isValidateConnections()) validator.validate(graph);
            return properties.isValidateConnections();
        }, checked -> checked ? graph.getConnections().size() + " connections checked" : "skipped");

        // ── Routing / resolution ──────────────────────────────────────────────
        ExecutionRouter router = runPhase(compilationId, CompilationPhase.ROUTING, diagnostics,
                () -> ExecutionRouter.build(graph), r -> r.size() + " execution routes");

        DataResolver resolver = runPhase(compilationId, CompilationPhase.RESOLUTION, diagnostics,
                () -> DataResolver.build(graph, metadataByNode, properties.getPureNodeStrategy()),
                r -> "pure evaluation order " + r.getPureEvaluationOrder());

        // ── Generation / assembly ─────────────────────────────────────────────
        GenerationContext ctx = codeGenerator.newContext(graph, metadataByNode, router, resolver, properties.indentUnit());

        List<String> functions = runPhase(compilationId, CompilationPhase.GENERATION, diagnostics,
                () -> assembler.generateEventFunctions(ctx), f -> f.size() + " event function(s)");

        String code = runPhase(compilationId, CompilationPhase.ASSEMBLY, diagnostics,
                () -> assembler.assemble(ctx, functions, properties.getPreamble()), c -> c.lines().count() + " lines");

        log.info("[COMPILER] Compilation {} complete", compilationId);
        return CompilationResult.builder()
                .compilationId(compilationId)
                .source(code)
                .eventCount(functions.size())
                .nodeCount(graph.getNodeCount())
                .diagnostics(Collections.unmodifiableList(diagnostics))
                .build();
    }

    private Map<String, NodeMetadata> lookUpMetadata(GraphDescription graph) {
        Map<String, NodeMetadata> metadataByNode = new LinkedHashMap<>();
        for (NodeInstance node : graph.getNodeList()) {
            if (PassthroughNodeTypes.isPassthrough(node.getNodeType())) continue;
            metadataByNode.put(node.getId(), metadataRegistry.require(node.getId(), node.getNodeType()));
        }
        return metadataByNode;
    }

    private <T> T runPhase(String compilationId, CompilationPhase phase, List<String> diagnostics,
                           Supplier<T> work, Function<T, String> summary) {
        diagnostics.add(eventPublisher.phaseStarted(compilationId, phase).toDiagnosticLine());
        try {
            T result = work.get();
            diagnostics.add(eventPublisher.phaseCompleted(compilationId, phase, summary.apply(result)).toDiagnosticLine());
            return result;
        } catch (CompilationException ex) {
            eventPublisher.phaseFailed(compilationId, phase, ex.getType() + ": " + ex.getMessage());
            log.error("[COMPILER] Compilation {} failed in {}: {} (node={}, pin={}, subgraph={})",
                    compilationId, phase, ex.getMessage(), ex.getNodeId(), ex.getPinName(), ex.getSubgraphId());
            throw ex;
        } catch (RuntimeException ex) {
            eventPublisher.phaseFailed(compilationId, phase, ex.getClass().getSimpleName() + ": " + ex.getMessage());
            log.error("[COMPILER] Compilation {} failed in {}", compilationId, phase, ex);
            throw ex;
        }
    }
}
