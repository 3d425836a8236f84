package org.pragmatica.spek.equivalence;

import io.vavr.control.Either;
import org.apache.log4j.Logger;
import org.pragmatica.spek.error.ExplorationLimitExceeded;
import org.pragmatica.spek.machine.Machine;
import org.pragmatica.spek.machine.MachineState;

import java.util.List;

/**
 * Decides whether two machine configurations behave the same for an observer of their transition labels.
 *
 * <pre>{@code
 * var checker = BisimilarityChecker.create(machine, ExplorationConfig.DEFAULT.withEvents(Set.of("click")));
 * checker.bisimilar(machine.load(first), machine.load(second))
 *        .fold(limit -> "undecided: " + limit.message(), same -> same ? "equivalent" : "different");
 * }</pre>
 */
public final class BisimilarityChecker {
    private static final Logger logger = Logger.getLogger(BisimilarityChecker.class);

    private final StateSpaceExplorer explorer;
    private final ExplorationConfig config;

    private BisimilarityChecker(StateSpaceExplorer explorer, ExplorationConfig config) {
        this.explorer = explorer;
        this.config = config;
    }

    public static BisimilarityChecker create(Machine machine, ExplorationConfig config) {
        return new BisimilarityChecker(StateSpaceExplorer.create(machine, config), config);
    }

    public static BisimilarityChecker create(Machine machine) {
        return create(machine, ExplorationConfig.DEFAULT);
    }

    public ExplorationConfig config() {
        return config;
    }

    /**
     * Explores both configurations over a shared event alphabet and compares their initial states under the
     * configured equivalence. A state space larger than {@link ExplorationConfig#maxStates()} leaves the question
     * undecided.
     */
    public Either<ExplorationLimitExceeded, Boolean> bisimilar(MachineState left, MachineState right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Machine states must not be null");
        }
        return explorer.exploreAll(List.of(left, right))
                       .map(systems -> bisimilar(systems.get(0), systems.get(1)));
    }

    /**
     * Compares the initial states of two already explored systems.
     */
    public boolean bisimilar(Lts left, Lts right) {
        var combined = Lts.union(left, right);
        var bisimulation = Bisimulation.of(combined, config.mode());
        var result = bisimulation.equivalent(left.initial(), right.initial() + left.size());
        logger.debug("Compared " + left.size() + " and " + right.size() + " state(s) in " + bisimulation.blockCount()
                     + " block(s): " + (result ? "bisimilar" : "distinguishable"));
        return result;
    }

    /**
     * Explores a configuration and merges its equivalent states.
     */
    public Either<ExplorationLimitExceeded, Lts> reduce(MachineState state) {
        return explorer.explore(state)
                       .map(this::reduce);
    }

    /**
     * Quotient of a transition system by its coarsest bisimulation.
     */
    public Lts reduce(Lts lts) {
        return Bisimulation.of(lts, config.mode())
                           .quotient(config.mode());
    }
}
