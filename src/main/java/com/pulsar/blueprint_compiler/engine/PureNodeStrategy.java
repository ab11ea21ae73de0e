package com.pulsar.blueprint_compiler.engine;

/** How a Pure node read by several data wires is realized. Both yield the same values. */
public enum PureNodeStrategy {
    // Re-emit the call expression at every use site
    INLINE,
    // Bind once at the top of each event function and read the temporary
    SHARED_TEMPORARIES
}
