package com.pulsar.blueprint_compiler.executor;

import com.pulsar.blueprint_compiler.model.metadata.NodeKind;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Emitter per {@link NodeKind}, collected from every {@link NodeEmitter} bean. */
@Component
@RequiredArgsConstructor
public class NodeEmitterRegistry {

    private final List<NodeEmitter> emitters;
    private final Map<NodeKind, NodeEmitter> registry = new EnumMap<>(NodeKind.class);

    @PostConstruct
    public void init() {
        emitters.forEach(emitter -> registry.put(emitter.supportedKind(), emitter));
    }

    public NodeEmitter get(NodeKind kind) {
        NodeEmitter emitter = registry.get(kind);
        if (emitter == null) {
            throw new UnsupportedOperationException("No emitter registered for node kind: " + kind);
        }
        return emitter;
    }
}
