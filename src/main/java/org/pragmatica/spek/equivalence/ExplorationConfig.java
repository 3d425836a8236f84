package org.pragmatica.spek.equivalence;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * State-space exploration and comparison options.
 *
 * @param maxStates      Upper bound on the states of one explored system
 * @param events         Interaction events offered at every quiescent state, besides the ones some task waits for;
 *                       kept sorted so exploration order does not depend on the caller's set
 * @param observeContent Tell states apart by their globals and live objects, not only by their labels
 * @param mode           Strong or weak bisimilarity
 */
public record ExplorationConfig(
    int maxStates,
    Set<String> events,
    boolean observeContent,
    EquivalenceMode mode
) {
    public static final ExplorationConfig DEFAULT = new ExplorationConfig(
        10_000,
        Set.of(),
        false,
        EquivalenceMode.WEAK
    );

    public ExplorationConfig {
        if (maxStates < 1) {
            throw new IllegalArgumentException("maxStates must be positive: " + maxStates);
        }
        if (events == null || mode == null) {
            throw new IllegalArgumentException("events and mode must not be null");
        }
        events = Collections.unmodifiableSet(new TreeSet<>(events));
    }

    public ExplorationConfig withMaxStates(int maxStates) {
        return new ExplorationConfig(maxStates, events, observeContent, mode);
    }

    public ExplorationConfig withEvents(Set<String> events) {
        return new ExplorationConfig(maxStates, events, observeContent, mode);
    }

    public ExplorationConfig withObserveContent(boolean observeContent) {
        return new ExplorationConfig(maxStates, events, observeContent, mode);
    }

    public ExplorationConfig withMode(EquivalenceMode mode) {
        return new ExplorationConfig(maxStates, events, observeContent, mode);
    }
}
