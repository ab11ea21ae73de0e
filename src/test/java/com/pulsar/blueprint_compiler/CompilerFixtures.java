package com.pulsar.blueprint_compiler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsar.blueprint_compiler.config.BlueprintCompilerProperties;
import com.pulsar.blueprint_compiler.engine.CodeGenerator;
import com.pulsar.blueprint_compiler.engine.CompilationEventPublisher;
import com.pulsar.blueprint_compiler.engine.GraphValidator;
import com.pulsar.blueprint_compiler.engine.ProgramAssembler;
import com.pulsar.blueprint_compiler.executor.ControlFlowNodeEmitter;
import com.pulsar.blueprint_compiler.executor.EventNodeEmitter;
import com.pulsar.blueprint_compiler.executor.FunctionNodeEmitter;
import com.pulsar.blueprint_compiler.executor.NodeEmitterRegistry;
import com.pulsar.blueprint_compiler.executor.PureNodeEmitter;
import com.pulsar.blueprint_compiler.library.LibraryManager;
import com.pulsar.blueprint_compiler.library.SubGraphExpander;
import com.pulsar.blueprint_compiler.registry.JsonNodeCatalogSource;
import com.pulsar.blueprint_compiler.registry.NodeMetadataRegistry;
import com.pulsar.blueprint_compiler.service.BlueprintCompiler;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

/**
 * Hand-wired compiler pieces for tests that do not need a Spring context.
 */
public final class CompilerFixtures {

    public static final String CATALOG = "classpath:blueprint/node-catalog.json";

    public static final String PREAMBLE =
            "// Auto-generated code from Pulsar Blueprint\n"
            + "// DO NOT EDIT - Changes will be overwritten\n"
            + "\n"
            + "use pulsar_std::*;\n";

    private CompilerFixtures() {
    }

    public static NodeMetadataRegistry catalog() {
        return new NodeMetadataRegistry(
                new JsonNodeCatalogSource(new DefaultResourceLoader(), new ObjectMapper(), List.of(CATALOG)));
    }

    public static CodeGenerator codeGenerator() {
        NodeEmitterRegistry emitters = new NodeEmitterRegistry(List.of(
                new PureNodeEmitter(), new FunctionNodeEmitter(), new ControlFlowNodeEmitter(), new EventNodeEmitter()));
        emitters.init();
        return new CodeGenerator(emitters);
    }

    public static BlueprintCompiler compiler() {
        return compiler(new LibraryManager(), new BlueprintCompilerProperties());
    }

    public static BlueprintCompiler compiler(LibraryManager libraries, BlueprintCompilerProperties properties) {
        CodeGenerator codeGenerator = codeGenerator();
        return new BlueprintCompiler(
                catalog(),
                new SubGraphExpander(libraries, properties.getMaxExpansionDepth()),
                new GraphValidator(),
                codeGenerator,
                new ProgramAssembler(codeGenerator),
                new CompilationEventPublisher(event -> { }),
                properties);
    }
}
