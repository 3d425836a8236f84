package org.pragmatica.spek.program;

import io.vavr.control.Option;

import java.util.List;

/**
 * Straight-line block of instructions closed by exactly one terminator; the unit of resumption.
 *
 * @param handler Where control continues when executing this fragment raises an exception
 */
public record Fragment(int index, List<Instruction> instructions, Terminator terminator, Option<Handler> handler) {
    public Fragment {
        instructions = List.copyOf(instructions);
    }

    /**
     * Exception handler of a fragment: the raised exception is stored to local {@code slot} and execution
     * continues at fragment {@code target} of the same unit.
     */
    public record Handler(int target, int slot) {}
}
