package com.pulsar.blueprint_compiler.engine;

import com.pulsar.blueprint_compiler.exception.CompilationException;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.metadata.NodeImport;
import com.pulsar.blueprint_compiler.model.metadata.NodeKind;
import com.pulsar.blueprint_compiler.model.metadata.NodeMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Glues the compilation unit together:
 * <pre>
 *   preamble
 *   use lines required by the node types in the graph (sorted)
 *
 *   pub fn begin_play() { ... }
 *
 *   pub fn main() { ... }
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProgramAssembler {

    private final CodeGenerator codeGenerator;

    /** One function per event node, in node order. Fails with NO_ENTRY_POINT when there are no events. */
    public List<String> generateEventFunctions(GenerationContext ctx) {
        List<NodeInstance> events = ctx.getGraph().getNodeList().stream()
                .filter(node -> isEvent(ctx.getMetadataByNode().get(node.getId())))
                .toList();
        if (events.isEmpty()) {
            throw CompilationException.noEntryPoint();
        }

        List<String> functions = new ArrayList<>();
        Map<String, Integer> nameCounts = new HashMap<>();
        for (NodeInstance event : events) {
            String baseName = DataResolver.sanitizeVarName(ctx.getMetadataByNode().get(event.getId()).callableName());
            int occurrence = nameCounts.merge(baseName, 1, Integer::sum);
            String functionName = occurrence == 1 ? baseName : baseName + "_" + occurrence;
            functions.add(codeGenerator.generateEventFunction(event, functionName, ctx));
        }
        return functions;
    }

    public String assemble(GenerationContext ctx, List<String> functions, List<String> preamble) {
        StringBuilder code = new StringBuilder();
        preamble.forEach(line -> code.append(line).append('\n'));
        for (String use : useLines(ctx, preamble)) {
            code.append(use).append('\n');
        }
        code.append('\n');
        functions.forEach(fn -> code.append(fn).append('\n'));

        log.info("[COMPILER] Assembled {} event function(s)", functions.size());
        return code.toString();
    }

    // Imports declared by the node types present, minus anything the preamble already has
    private static Set<String> useLines(GenerationContext ctx, List<String> preamble) {
        Set<String> already = new HashSet<>();
        preamble.forEach(line -> already.add(line.strip()));

        Set<String> uses = new TreeSet<>();
        for (NodeMetadata metadata : ctx.getMetadataByNode().values()) {
            for (NodeImport nodeImport : metadata.getImports()) {
                String line = nodeImport.toUseLine();
                if (!already.contains(line)) uses.add(line);
            }
        }
        return uses;
    }

    private static boolean isEvent(NodeMetadata metadata) {
        return metadata != null && metadata.getKind() == NodeKind.EVENT;
    }
}
