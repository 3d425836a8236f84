package org.pragmatica.spek.program;

import org.pragmatica.spek.tree.SourceSpan;

import java.util.List;

/**
 * Straight-line machine instruction. Instructions never transfer control; that is the job of the
 * {@link Terminator} closing their fragment.
 */
public sealed interface Instruction {

    SourceSpan span();

    record StoreLocal(SourceSpan span, int slot, Term value) implements Instruction {}

    record StoreGlobal(SourceSpan span, int slot, Term value) implements Instruction {}

    /**
     * Assignment to a module-level property; runs its setter.
     */
    record StoreProperty(SourceSpan span, String name, Term value) implements Instruction {}

    record StoreAttribute(SourceSpan span, Term target, String name, Term value) implements Instruction {}

    record StoreIndex(SourceSpan span, Term target, Term index, Term value) implements Instruction {}

    /**
     * Evaluate and discard.
     */
    record Evaluate(SourceSpan span, Term term) implements Instruction {}

    /**
     * Start a new task running {@code callee(arguments)}; the current task continues immediately.
     */
    record Spawn(SourceSpan span, Term callee, List<Term> arguments) implements Instruction {
        public Spawn {
            arguments = List.copyOf(arguments);
        }
    }
}
