package org.pragmatica.spek.equivalence;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.apache.log4j.Logger;
import org.pragmatica.spek.error.ExplorationLimitExceeded;
import org.pragmatica.spek.machine.Machine;
import org.pragmatica.spek.machine.MachineState;
import org.pragmatica.spek.machine.StepResult;
import org.pragmatica.spek.machine.Stimulus;
import org.pragmatica.spek.machine.TransitionLabel;
import org.pragmatica.spek.printer.Printer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the labelled transition system reachable from machine states.
 *
 * <p>While some task is runnable, a state has exactly one successor: the next fragment of the head task. A
 * quiescent state offers one transition per interaction event in the alphabet and, when a task waits for a
 * deadline, one clock advance to the earliest deadline. The alphabet is the configured event set plus every
 * event some explored state waits for.
 *
 * <p>States are identified by their clock-relative printed form, so a system that repeats itself after time
 * passes has a finite state space.
 */
public final class StateSpaceExplorer {
    private static final Logger logger = Logger.getLogger(StateSpaceExplorer.class);

    private final Machine machine;
    private final ExplorationConfig config;

    private StateSpaceExplorer(Machine machine, ExplorationConfig config) {
        this.machine = machine;
        this.config = config;
    }

    public static StateSpaceExplorer create(Machine machine, ExplorationConfig config) {
        if (machine == null || config == null) {
            throw new IllegalArgumentException("Machine and exploration configuration must not be null");
        }
        return new StateSpaceExplorer(machine, config);
    }

    public Either<ExplorationLimitExceeded, Lts> explore(MachineState state) {
        return exploreAll(List.of(state)).map(systems -> systems.get(0));
    }

    /**
     * Explores several systems over a shared event alphabet. Each system gets its own transition system.
     */
    public Either<ExplorationLimitExceeded, List<Lts>> exploreAll(List<MachineState> states) {
        var alphabet = new LinkedHashSet<>(config.events());
        var explorations = new ArrayList<Exploration>();
        for (var state : states) {
            var exploration = new Exploration(alphabet);
            var outcome = exploration.run(state);
            if (outcome.isDefined()) {
                return Either.left(outcome.get());
            }
            explorations.add(exploration);
        }
        var result = new ArrayList<Lts>();
        for (var exploration : explorations) {
            result.add(exploration.complete(alphabet));
        }
        return Either.right(result);
    }

    private final class Exploration {
        private final Set<String> alphabet;
        private final Lts.Builder builder = new Lts.Builder();
        private final Map<String, Integer> known = new HashMap<>();
        private final List<Integer> quiescent = new ArrayList<>();
        private final ArrayDeque<Node> agenda = new ArrayDeque<>();

        private record Node(int id, MachineState state) {}

        private Exploration(Set<String> alphabet) {
            this.alphabet = alphabet;
        }

        private Option<ExplorationLimitExceeded> run(MachineState initial) {
            var start = intern(initial);
            if (start.isLeft()) {
                return Option.some(start.getLeft());
            }
            while (!agenda.isEmpty()) {
                var node = agenda.poll();
                var outcome = expand(node);
                if (outcome.isDefined()) {
                    return outcome;
                }
            }
            logger.debug("Explored " + builder.size() + " state(s)");
            return Option.none();
        }

        private Option<ExplorationLimitExceeded> expand(Node node) {
            var state = node.state();
            if (state.hasRunnable() || !state.pending().isEmpty()) {
                return follow(node.id(), machine.step(state, Option.none()));
            }
            quiescent.add(node.id());
            alphabet.addAll(state.waitedEvents());
            for (var event : new ArrayList<>(alphabet)) {
                var outcome = follow(node.id(), machine.step(state, Option.some(Stimulus.event(event))));
                if (outcome.isDefined()) {
                    return outcome;
                }
            }
            if (state.nextDeadline().isDefined()) {
                return follow(node.id(), machine.step(state, Option.some(Stimulus.advance())));
            }
            return Option.none();
        }

        /**
         * Adds the transition of one step. Several observable labels become a chain through intermediate states.
         */
        private Option<ExplorationLimitExceeded> follow(int source, StepResult result) {
            var target = intern(result.state());
            if (target.isLeft()) {
                return Option.some(target.getLeft());
            }
            var labels = result.observableLabels();
            if (labels.isEmpty()) {
                builder.addTransition(source, TransitionLabel.PRIVATE, target.get());
                return Option.none();
            }
            var current = source;
            for (int i = 0; i < labels.size() - 1; i++) {
                if (builder.size() >= config.maxStates()) {
                    return Option.some(limitExceeded());
                }
                var intermediate = builder.addState(builder.content(target.get()));
                builder.addTransition(current, labels.get(i), intermediate);
                current = intermediate;
            }
            builder.addTransition(current, labels.get(labels.size() - 1), target.get());
            return Option.none();
        }

        private Either<ExplorationLimitExceeded, Integer> intern(MachineState state) {
            var normal = normalise(state);
            var key = Printer.printRelative(normal);
            var existing = known.get(key);
            if (existing != null) {
                return Either.right(existing);
            }
            if (builder.size() >= config.maxStates()) {
                return Either.left(limitExceeded());
            }
            var id = builder.addState(config.observeContent() ? Printer.printContent(normal) : "");
            known.put(key, id);
            agenda.add(new Node(id, normal));
            return Either.right(id);
        }

        /**
         * Quiescent states are settled by the machine first, which releases unreachable objects.
         */
        private MachineState normalise(MachineState state) {
            if (state.isQuiescent()) {
                return machine.runUntilQuiescent(state).state();
            }
            return state;
        }

        private ExplorationLimitExceeded limitExceeded() {
            logger.warn("State space exploration stopped at " + builder.size() + " state(s)");
            return new ExplorationLimitExceeded(config.maxStates(), builder.size());
        }

        /**
         * Events that joined the alphabet after a quiescent state was expanded are consumed there without effect,
         * since nothing in that state waits for them.
         */
        private Lts complete(Set<String> alphabet) {
            for (var state : quiescent) {
                for (var event : alphabet) {
                    var label = new TransitionLabel.Event(event);
                    if (!builder.hasTransition(state, label)) {
                        builder.addTransition(state, label, state);
                    }
                }
            }
            return builder.build(0);
        }
    }
}
