package com.pulsar.blueprint_compiler.model.graph;

public enum PinDirection {
    INPUT,
    OUTPUT
}
