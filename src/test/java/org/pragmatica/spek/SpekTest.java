package org.pragmatica.spek;

import io.vavr.control.Option;
import org.junit.jupiter.api.Test;
import org.pragmatica.spek.equivalence.EquivalenceMode;
import org.pragmatica.spek.error.CompileError;
import org.pragmatica.spek.error.Stage;
import org.pragmatica.spek.machine.MachineConfig;
import org.pragmatica.spek.machine.Value;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SpekTest {

    private static final String BLINKER = """
        var visible = False
        while True:
            await delay 0.5
            visible = not visible
        """;

    @Test
    void compile_reportsFirstFailingStage() {
        assertEquals(Stage.LEX, Spek.compile("var x = $\n").getLeft().stage());
        assertEquals(Stage.PARSE, Spek.compile("var = 1\n").getLeft().stage());
        assertEquals(Stage.VALIDATION, Spek.compile("x = 1\n").getLeft().stage());
        assertTrue(Spek.compile(BLINKER).isRight());
    }

    @Test
    void compile_respectsSourceLengthLimit() {
        var config = Spek.builder()
                         .maxSourceLength(10)
                         .config();

        var result = Spek.compile(BLINKER, config);

        assertTrue(result.isLeft());
        assertEquals(Stage.LEX, result.getLeft().stage());
        assertThat(result.getLeft().message()).contains("maximum size");
    }

    @Test
    void validate_keepsParsedModule() {
        var validated = Spek.validate(BLINKER, SpekConfig.DEFAULT).get();

        assertThat(validated.module().statements()).hasSize(2);
    }

    @Test
    void load_runsThroughMachine() {
        var state = Spek.load(BLINKER, SpekConfig.DEFAULT).get();
        var machine = Spek.machine(SpekConfig.DEFAULT);

        state = machine.runUntilQuiescent(state).state();
        state = machine.advanceClock(state, Option.none()).state();

        assertEquals(Option.some(Value.TRUE), machine.observe(state).global("visible"));
        assertEquals(0.5, state.clock());
    }

    @Test
    void builder_collectsAllOptions() {
        var machine = new MachineConfig(20, 500, false);
        var config = Spek.builder()
                         .maxSourceLength(1000)
                         .machine(machine)
                         .maxStates(64)
                         .events(Set.of("tap", "advance"))
                         .observeContent(true)
                         .mode(EquivalenceMode.STRONG)
                         .config();

        assertEquals(1000, config.maxSourceLength());
        assertSame(machine, config.machine());
        assertEquals(64, config.exploration().maxStates());
        assertThat(config.exploration().events()).containsExactly("advance", "tap");
        assertTrue(config.exploration().observeContent());
        assertEquals(EquivalenceMode.STRONG, config.exploration().mode());
    }

    @Test
    void builder_defaultsMatchDefaultConfig() {
        assertEquals(SpekConfig.DEFAULT, Spek.builder().config());
    }

    @Test
    void builder_checker_comparesPrograms() {
        var builder = Spek.builder().maxStates(100);
        var checker = builder.checker();
        var machine = Spek.machine(builder.config());

        var slow = machine.load(builder.compile(BLINKER).get());
        var fast = machine.load(builder.compile(BLINKER.replace("0.5", "0.25")).get());

        assertEquals(100, checker.config().maxStates());
        assertTrue(checker.bisimilar(slow, slow).get());
        assertFalse(checker.bisimilar(slow, fast).get());
    }

    @Test
    void builder_maxNesting_limitsParser() {
        var source = """
            if True:
                if True:
                    var x = (1 + 2)
            """;

        assertTrue(Spek.compile(source).isRight());
        var result = Spek.builder().maxNesting(2).compile(source);
        assertTrue(result.isLeft());
        assertInstanceOf(CompileError.NestingLimitExceeded.class, result.getLeft());
        assertEquals(2, Spek.builder().maxNesting(2).config().maxNesting());
    }

    @Test
    void config_rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> Spek.builder().maxNesting(0).config());
        assertThrows(IllegalArgumentException.class, () -> Spek.builder().maxStates(0).config());
        assertThrows(IllegalArgumentException.class, () -> Spek.builder().machine(null).config());
        assertThrows(IllegalArgumentException.class, () -> new MachineConfig(0, 1, true));
    }
}
