package com.pulsar.blueprint_compiler.registry;

import com.pulsar.blueprint_compiler.model.metadata.NodeMetadata;

import java.util.List;

/** Supplies the node definitions the registry is built from. Called once. */
@FunctionalInterface
public interface NodeCatalogSource {

    List<NodeMetadata> loadNodes();
}
