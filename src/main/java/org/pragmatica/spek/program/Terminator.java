package org.pragmatica.spek.program;

import io.vavr.control.Option;
import org.pragmatica.spek.syntax.Statement.WaitKind;
import org.pragmatica.spek.tree.SourceSpan;

import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * The single control transfer that ends every fragment.
 */
public sealed interface Terminator {

    SourceSpan span();

    /**
     * Fragments control may continue at, in the same code unit.
     */
    List<Integer> successors();

    /**
     * Same terminator with every fragment index passed through {@code remap}.
     */
    Terminator remap(IntUnaryOperator remap);

    record Jump(SourceSpan span, int target) implements Terminator {
        @Override
        public List<Integer> successors() {
            return List.of(target);
        }

        @Override
        public Terminator remap(IntUnaryOperator remap) {
            return new Jump(span, remap.applyAsInt(target));
        }
    }

    record Branch(SourceSpan span, Term condition, int ifTrue, int ifFalse) implements Terminator {
        @Override
        public List<Integer> successors() {
            return List.of(ifTrue, ifFalse);
        }

        @Override
        public Terminator remap(IntUnaryOperator remap) {
            return new Branch(span, condition, remap.applyAsInt(ifTrue), remap.applyAsInt(ifFalse));
        }
    }

    /**
     * Yield until the wait condition holds, then continue at {@code resume} with the saved frame.
     */
    record Suspend(SourceSpan span, WaitKind kind, Term operand, int resume) implements Terminator {
        @Override
        public List<Integer> successors() {
            return List.of(resume);
        }

        @Override
        public Terminator remap(IntUnaryOperator remap) {
            return new Suspend(span, kind, operand, remap.applyAsInt(resume));
        }
    }

    /**
     * Raise the exception {@code exception} evaluates to; control continues at the handler of the fragment, or
     * leaves the unit.
     */
    record Raise(SourceSpan span, Term exception) implements Terminator {
        @Override
        public List<Integer> successors() {
            return List.of();
        }

        @Override
        public Terminator remap(IntUnaryOperator remap) {
            return this;
        }
    }

    record Return(SourceSpan span, Option<Term> value) implements Terminator {
        @Override
        public List<Integer> successors() {
            return List.of();
        }

        @Override
        public Terminator remap(IntUnaryOperator remap) {
            return this;
        }
    }
}
