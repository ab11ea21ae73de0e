package com.pulsar.blueprint_compiler.model.metadata;

import java.util.List;

/** A {@code use} line a node's code needs: {@code use crateName::{items};}. */
public record NodeImport(String crateName, List<String> items) {

    public NodeImport {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public String toUseLine() {
        if (items.isEmpty()) return "use " + crateName + ";";
        if (items.size() == 1) return "use " + crateName + "::" + items.get(0) + ";";
        return "use " + crateName + "::{" + String.join(", ", items) + "};";
    }
}
