package com.pulsar.blueprint_compiler.model.graph;

/** Canvas position. Carried through compilation but never affects the output. */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);

    public Position translate(Position offset) {
        return new Position(x + offset.x(), y + offset.y());
    }
}
