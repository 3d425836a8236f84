package org.pragmatica.spek;

import io.vavr.control.Either;
import org.pragmatica.spek.equivalence.BisimilarityChecker;
import org.pragmatica.spek.equivalence.EquivalenceMode;
import org.pragmatica.spek.equivalence.ExplorationConfig;
import org.pragmatica.spek.error.CompileError;
import org.pragmatica.spek.lexer.Lexer;
import org.pragmatica.spek.machine.Machine;
import org.pragmatica.spek.machine.MachineConfig;
import org.pragmatica.spek.machine.MachineState;
import org.pragmatica.spek.program.MachineProgram;
import org.pragmatica.spek.program.Translator;
import org.pragmatica.spek.syntax.Parser;
import org.pragmatica.spek.syntax.SourceModule;
import org.pragmatica.spek.validation.ValidatedModule;
import org.pragmatica.spek.validation.Validator;

import java.util.Set;

/**
 * Entry point: compiles source text into a machine program and sets up machines and equivalence checks.
 *
 * <p>Example usage:
 * <pre>{@code
 * var program = Spek.compile("""
 *     var x = 0
 *     await delay 1
 *     x = 1
 *     """).get();
 *
 * var machine = Machine.create();
 * var state = machine.runUntilQuiescent(machine.load(program)).state();
 * state = machine.advanceClock(state, Option.none()).state();
 * }</pre>
 */
public final class Spek {
    private Spek() {}

    /**
     * Compile source text with the default configuration.
     */
    public static Either<CompileError, MachineProgram> compile(String source) {
        return compile(source, SpekConfig.DEFAULT);
    }

    /**
     * Compile source text: lex, parse, validate and translate. The first failing stage decides the error.
     */
    public static Either<CompileError, MachineProgram> compile(String source, SpekConfig config) {
        return validate(source, config).flatMap(Translator::translate);
    }

    /**
     * Parse source text without checking names or suspension rules.
     */
    public static Either<CompileError, SourceModule> parse(String source) {
        return parse(source, SpekConfig.DEFAULT);
    }

    public static Either<CompileError, SourceModule> parse(String source, SpekConfig config) {
        return Lexer.tokenize(source, config.maxSourceLength())
                    .flatMap(tokens -> Parser.parse(tokens, config.maxNesting()));
    }

    /**
     * Parse and validate source text, stopping before translation.
     */
    public static Either<CompileError, ValidatedModule> validate(String source, SpekConfig config) {
        return parse(source, config).flatMap(Validator::validate);
    }

    /**
     * Compile source text and load it into a fresh machine state.
     */
    public static Either<CompileError, MachineState> load(String source, SpekConfig config) {
        var machine = Machine.create(config.machine());
        return compile(source, config).map(machine::load);
    }

    public static Machine machine(SpekConfig config) {
        return Machine.create(config.machine());
    }

    public static BisimilarityChecker checker(SpekConfig config) {
        return BisimilarityChecker.create(machine(config), config.exploration());
    }

    /**
     * Create a builder for a custom configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxSourceLength = SpekConfig.DEFAULT.maxSourceLength();
        private int maxNesting = SpekConfig.DEFAULT.maxNesting();
        private MachineConfig machine = MachineConfig.DEFAULT;
        private int maxStates = ExplorationConfig.DEFAULT.maxStates();
        private Set<String> events = ExplorationConfig.DEFAULT.events();
        private boolean observeContent = ExplorationConfig.DEFAULT.observeContent();
        private EquivalenceMode mode = ExplorationConfig.DEFAULT.mode();

        private Builder() {}

        public Builder maxSourceLength(int maxSourceLength) {
            this.maxSourceLength = maxSourceLength;
            return this;
        }

        public Builder maxNesting(int maxNesting) {
            this.maxNesting = maxNesting;
            return this;
        }

        public Builder machine(MachineConfig machine) {
            this.machine = machine;
            return this;
        }

        public Builder maxStates(int maxStates) {
            this.maxStates = maxStates;
            return this;
        }

        public Builder events(Set<String> events) {
            this.events = events;
            return this;
        }

        public Builder observeContent(boolean observeContent) {
            this.observeContent = observeContent;
            return this;
        }

        public Builder mode(EquivalenceMode mode) {
            this.mode = mode;
            return this;
        }

        public SpekConfig config() {
            return new SpekConfig(maxSourceLength,
                                  maxNesting,
                                  machine,
                                  new ExplorationConfig(maxStates, events, observeContent, mode));
        }

        public Either<CompileError, MachineProgram> compile(String source) {
            return Spek.compile(source, config());
        }

        public BisimilarityChecker checker() {
            return Spek.checker(config());
        }
    }
}
