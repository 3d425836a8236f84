package org.pragmatica.spek.program;

import org.pragmatica.spek.syntax.BinaryOperator;
import org.pragmatica.spek.syntax.UnaryOperator;

import java.util.List;

/**
 * Side-effect-free expression tree evaluated by the machine, with every name already resolved to a slot or a
 * program entity. Calls may still run code, but never suspend.
 */
public sealed interface Term {

    // === Constants ===

    record NoneConstant() implements Term {}

    record BoolConstant(boolean value) implements Term {}

    record IntConstant(long value) implements Term {}

    record RealConstant(double value) implements Term {}

    record StrConstant(String value) implements Term {}

    // === Resolved references ===

    /**
     * Frame slot of the executing code unit.
     */
    record Local(int slot, String name) implements Term {}

    /**
     * Module-level variable slot.
     */
    record Global(int slot, String name) implements Term {}

    record FunctionRef(String unit) implements Term {}

    record ClassRef(String name) implements Term {}

    record BuiltinRef(String name) implements Term {}

    /**
     * Read of a module-level property; runs its getter.
     */
    record PropertyRead(String name) implements Term {}

    // === Operations ===

    record Attribute(Term target, String name) implements Term {}

    record Index(Term target, Term index) implements Term {}

    record Call(Term callee, List<Term> arguments) implements Term {
        public Call {
            arguments = List.copyOf(arguments);
        }
    }

    record Unary(UnaryOperator operator, Term operand) implements Term {}

    /**
     * Binary operation; {@code and} and {@code or} evaluate the right operand only when needed.
     */
    record Binary(BinaryOperator operator, Term left, Term right) implements Term {}

    record MakeList(List<Term> elements) implements Term {
        public MakeList {
            elements = List.copyOf(elements);
        }
    }

    record MakeTuple(List<Term> elements) implements Term {
        public MakeTuple {
            elements = List.copyOf(elements);
        }
    }

    record MakeDict(List<Term> keys, List<Term> values) implements Term {
        public MakeDict {
            if (keys.size() != values.size()) {
                throw new IllegalArgumentException("Dictionary needs as many keys as values");
            }
            keys = List.copyOf(keys);
            values = List.copyOf(values);
        }
    }

    /**
     * The list a {@code for} loop walks: a list itself, the keys of a dictionary or the characters of a string.
     */
    record Sequence(Term iterable) implements Term {}
}
