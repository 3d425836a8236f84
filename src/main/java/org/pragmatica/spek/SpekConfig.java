package org.pragmatica.spek;

import org.pragmatica.spek.equivalence.ExplorationConfig;
import org.pragmatica.spek.lexer.Lexer;
import org.pragmatica.spek.machine.MachineConfig;
import org.pragmatica.spek.syntax.Parser;

/**
 * Compiler, machine and exploration options.
 *
 * @param maxSourceLength Longest accepted source text, in characters
 * @param maxNesting      Deepest nesting of blocks and expressions the parser accepts
 * @param machine         Limits of the machine that runs compiled programs
 * @param exploration     State-space bound and equivalence used when comparing configurations
 */
public record SpekConfig(
    int maxSourceLength,
    int maxNesting,
    MachineConfig machine,
    ExplorationConfig exploration
) {
    public static final SpekConfig DEFAULT = new SpekConfig(
        Lexer.DEFAULT_MAX_INPUT_SIZE,
        Parser.DEFAULT_MAX_NESTING,
        MachineConfig.DEFAULT,
        ExplorationConfig.DEFAULT
    );

    public SpekConfig {
        if (maxSourceLength < 0) {
            throw new IllegalArgumentException("maxSourceLength must not be negative: " + maxSourceLength);
        }
        if (maxNesting < 1) {
            throw new IllegalArgumentException("maxNesting must be positive: " + maxNesting);
        }
        if (machine == null || exploration == null) {
            throw new IllegalArgumentException("Machine and exploration configuration must not be null");
        }
    }
}
