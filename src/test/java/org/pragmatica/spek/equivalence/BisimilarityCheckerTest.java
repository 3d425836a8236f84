package org.pragmatica.spek.equivalence;

import org.junit.jupiter.api.Test;
import org.pragmatica.spek.Spek;
import org.pragmatica.spek.machine.Machine;
import org.pragmatica.spek.machine.MachineState;
import org.pragmatica.spek.machine.TransitionLabel;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class BisimilarityCheckerTest {

    private static final String ONCE = """
        await event "go"
        """;

    private static final String ONCE_WITH_BUSY_WORK = """
        await event "go"
        var i = 0
        while i < 3:
            i += 1
        """;

    private static final String TICKER = """
        while True:
            await delay 1
        """;

    private static final String DOUBLE_TICKER = """
        while True:
            await delay 1
            await delay 1
        """;

    private final Machine machine = Machine.create();

    private MachineState load(String source) {
        var program = Spek.compile(source);
        assertTrue(program.isRight(), () -> "Unexpected error: " + program.getLeft().message());
        return machine.load(program.get());
    }

    private boolean bisimilar(ExplorationConfig config, String left, String right) {
        var result = BisimilarityChecker.create(machine, config).bisimilar(load(left), load(right));
        assertTrue(result.isRight(), () -> "Undecided: " + result.getLeft().message());
        return result.get();
    }

    private boolean bisimilar(String left, String right) {
        return bisimilar(ExplorationConfig.DEFAULT, left, right);
    }

    @Test
    void bisimilar_isReflexive() {
        assertTrue(bisimilar(ONCE, ONCE));
        assertTrue(bisimilar(TICKER, TICKER));
    }

    @Test
    void bisimilar_isSymmetric() {
        assertEquals(bisimilar(ONCE, ONCE_WITH_BUSY_WORK), bisimilar(ONCE_WITH_BUSY_WORK, ONCE));
        assertEquals(bisimilar(TICKER, ONCE), bisimilar(ONCE, TICKER));
    }

    @Test
    void bisimilar_differentEvents_areDistinguished() {
        assertFalse(bisimilar("""
            await event "a"
            """, """
            await event "b"
            """));
    }

    @Test
    void bisimilar_differentDelays_areDistinguished() {
        assertFalse(bisimilar("""
            await delay 1
            await delay 1
            """, """
            await delay 2
            """));
    }

    @Test
    void bisimilar_weakMode_ignoresInternalSteps() {
        assertTrue(bisimilar(ONCE, ONCE_WITH_BUSY_WORK));
        assertTrue(bisimilar(TICKER, DOUBLE_TICKER));
    }

    @Test
    void bisimilar_strongMode_countsInternalSteps() {
        var strong = ExplorationConfig.DEFAULT.withMode(EquivalenceMode.STRONG);

        assertFalse(bisimilar(strong, ONCE, ONCE_WITH_BUSY_WORK));
        assertTrue(bisimilar(strong, ONCE, ONCE));
    }

    @Test
    void bisimilar_observedContent_tellsStatesApart() {
        var first = """
            var x = 0
            await event "go"
            x = 1
            """;
        var second = """
            var x = 0
            await event "go"
            x = 2
            """;

        assertTrue(bisimilar(first, second));
        assertFalse(bisimilar(ExplorationConfig.DEFAULT.withObserveContent(true), first, second));
    }

    @Test
    void bisimilar_configuredEvents_areOfferedEverywhere() {
        var config = ExplorationConfig.DEFAULT.withEvents(Set.of("noise"));

        assertTrue(bisimilar(config, ONCE, ONCE_WITH_BUSY_WORK));
        assertFalse(bisimilar(config, """
            await event "noise"
            """, ONCE));
    }

    @Test
    void bisimilar_unboundedStateSpace_isUndecided() {
        var config = ExplorationConfig.DEFAULT.withMaxStates(50).withObserveContent(true);
        var counter = """
            var n = 0
            while True:
                await delay 1
                n += 1
            """;

        var result = BisimilarityChecker.create(machine, config).bisimilar(load(counter), load(TICKER));

        assertTrue(result.isLeft());
        assertEquals(50, result.getLeft().limit());
        assertEquals(50, result.getLeft().explored());
    }

    @Test
    void bisimilar_rejectsNullStates() {
        var checker = BisimilarityChecker.create(machine);

        assertThrows(IllegalArgumentException.class, () -> checker.bisimilar(load(ONCE), (MachineState) null));
    }

    @Test
    void explore_periodicProgram_isFinite() {
        var explorer = StateSpaceExplorer.create(machine, ExplorationConfig.DEFAULT);

        var lts = explorer.explore(load(TICKER)).get();

        assertThat(lts.size()).isLessThan(10);
        assertThat(lts.labels()).contains(new TransitionLabel.TimeAdvance(1.0))
                                .doesNotContain(new TransitionLabel.TaskCompleted(1));
    }

    @Test
    void explore_sharesAlphabetBetweenSystems() {
        var explorer = StateSpaceExplorer.create(machine, ExplorationConfig.DEFAULT);

        var systems = explorer.exploreAll(List.of(load("var x = 1\n"), load(ONCE))).get();

        assertThat(systems.get(0).labels()).contains(new TransitionLabel.Event("go"),
                                                     new TransitionLabel.TaskCompleted(1));
        assertThat(systems.get(1).labels()).contains(new TransitionLabel.Event("go"));
    }

    @Test
    void explore_failingTask_isObservable() {
        var explorer = StateSpaceExplorer.create(machine, ExplorationConfig.DEFAULT);

        var lts = explorer.explore(load("""
            var xs = []
            var y = xs[0]
            """)).get();

        assertThat(lts.labels()).contains(new TransitionLabel.TaskFailed(1, "index 0 out of range for length 0"));
    }

    @Test
    void reduce_mergesEquivalentStates() {
        var checker = BisimilarityChecker.create(machine);
        var explored = StateSpaceExplorer.create(machine, ExplorationConfig.DEFAULT).explore(load(DOUBLE_TICKER)).get();

        var reduced = checker.reduce(explored);

        assertThat(reduced.size()).isLessThan(explored.size());
        assertTrue(checker.bisimilar(explored, reduced));
        assertThat(reduced.labels()).contains(new TransitionLabel.TimeAdvance(1.0));
    }

    @Test
    void bisimulation_strongMode_distinguishesBranchingTime() {
        // a.(b + c) against a.b + a.c
        var go = new TransitionLabel.Event("a");
        var b = new TransitionLabel.Event("b");
        var c = new TransitionLabel.Event("c");

        var left = new Lts.Builder();
        for (int i = 0; i < 4; i++) {
            left.addState("");
        }
        left.addTransition(0, go, 1);
        left.addTransition(1, b, 2);
        left.addTransition(1, c, 3);

        var right = new Lts.Builder();
        for (int i = 0; i < 5; i++) {
            right.addState("");
        }
        right.addTransition(0, go, 1);
        right.addTransition(0, go, 2);
        right.addTransition(1, b, 3);
        right.addTransition(2, c, 4);

        var checker = BisimilarityChecker.create(machine, ExplorationConfig.DEFAULT.withMode(EquivalenceMode.STRONG));
        assertFalse(checker.bisimilar(left.build(0), right.build(0)));
    }

    @Test
    void bisimulation_weakMode_absorbsLeadingPrivateStep() {
        var a = new TransitionLabel.Event("a");

        var delayed = new Lts.Builder();
        delayed.addState("");
        delayed.addState("");
        delayed.addState("");
        delayed.addTransition(0, TransitionLabel.PRIVATE, 1);
        delayed.addTransition(1, a, 2);

        var direct = new Lts.Builder();
        direct.addState("");
        direct.addState("");
        direct.addTransition(0, a, 1);

        var weak = Bisimulation.of(Lts.union(delayed.build(0), direct.build(0)), EquivalenceMode.WEAK);
        var strong = Bisimulation.of(Lts.union(delayed.build(0), direct.build(0)), EquivalenceMode.STRONG);

        assertTrue(weak.equivalent(0, 3));
        assertFalse(strong.equivalent(0, 3));
        assertEquals(2, weak.blockCount());
    }

    @Test
    void quotient_weakMode_dropsPrivateSelfLoops() {
        var builder = new Lts.Builder();
        builder.addState("");
        builder.addState("");
        builder.addTransition(0, TransitionLabel.PRIVATE, 1);
        builder.addTransition(1, TransitionLabel.PRIVATE, 0);
        builder.addTransition(1, new TransitionLabel.Event("a"), 1);

        var quotient = Bisimulation.of(builder.build(0), EquivalenceMode.WEAK).quotient(EquivalenceMode.WEAK);

        assertEquals(1, quotient.size());
        assertThat(quotient.transitions(0)).containsExactly(new Lts.Transition(new TransitionLabel.Event("a"), 0));
    }
}
