package com.pulsar.blueprint_compiler.engine;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-path bookkeeping while walking an execution chain.
 *
 * The visited set is copied for every control-flow output, so siblings never see each other's
 * nodes but do see their ancestors'. Result temporaries are copied for outputs spliced inside a
 * nested block of the template and shared for outputs spliced at its top level, where later
 * statements are in the same scope. Shared Pure temporaries belong to the whole event function.
 */
public final class TraversalState {

    private final Set<String> visited;
    private final Map<String, String> results;
    private final Set<String> sharedTemporaries;

    private TraversalState(Set<String> visited, Map<String, String> results, Set<String> sharedTemporaries) {
        this.visited = visited;
        this.results = results;
        this.sharedTemporaries = sharedTemporaries;
    }

    public static TraversalState forFunction() {
        return new TraversalState(new HashSet<>(), new HashMap<>(), new LinkedHashSet<>());
    }

    public TraversalState branch() {
        return new TraversalState(new HashSet<>(visited), new HashMap<>(results), sharedTemporaries);
    }

    /** Own visited set; results recorded here stay visible to this state and its later outputs. */
    public TraversalState sameScope() {
        return new TraversalState(new HashSet<>(visited), results, sharedTemporaries);
    }

    /** @return false if the node was already on this path */
    public boolean markVisited(String nodeId) {
        return visited.add(nodeId);
    }

    public void recordResult(String nodeId, String variable) {
        results.put(nodeId, variable);
    }

    public Optional<String> result(String nodeId) {
        return Optional.ofNullable(results.get(nodeId));
    }

    public void useSharedTemporary(String nodeId) {
        sharedTemporaries.add(nodeId);
    }

    public Set<String> sharedTemporaries() {
        return sharedTemporaries;
    }
}
