package com.pulsar.blueprint_compiler.model.metadata;

public record NodeParameter(String name, String type) {
}
