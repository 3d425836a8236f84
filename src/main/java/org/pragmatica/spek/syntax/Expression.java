package org.pragmatica.spek.syntax;

import org.pragmatica.spek.tree.SourceSpan;

import java.util.List;

/**
 * Expression nodes of the spek syntax tree. Expressions never suspend; only statements do.
 */
public sealed interface Expression {

    /**
     * Source location of this expression.
     */
    SourceSpan span();

    // === Literals ===

    record NoneLiteral(SourceSpan span) implements Expression {}

    record BooleanLiteral(SourceSpan span, boolean value) implements Expression {}

    record IntegerLiteral(SourceSpan span, long value) implements Expression {}

    record FloatLiteral(SourceSpan span, double value) implements Expression {}

    record StringLiteral(SourceSpan span, String value) implements Expression {}

    // === References ===

    /**
     * Name reference: {@code x}, {@code self}, {@code len}.
     */
    record Name(SourceSpan span, String name) implements Expression {}

    /**
     * Attribute access: {@code target.name}
     */
    record Attribute(SourceSpan span, Expression target, String name) implements Expression {}

    /**
     * Index access: {@code target[index]}
     */
    record Index(SourceSpan span, Expression target, Expression index) implements Expression {}

    // === Operations ===

    /**
     * Call: {@code callee(arg, ...)}
     */
    record Call(SourceSpan span, Expression callee, List<Expression> arguments) implements Expression {
        public Call {
            arguments = List.copyOf(arguments);
        }
    }

    record Unary(SourceSpan span, UnaryOperator operator, Expression operand) implements Expression {}

    record Binary(SourceSpan span, BinaryOperator operator, Expression left, Expression right) implements Expression {}

    // === Collections ===

    /**
     * List construction: {@code [a, b, c]}
     */
    record ListDisplay(SourceSpan span, List<Expression> elements) implements Expression {
        public ListDisplay {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Tuple construction: {@code ()}, {@code (a,)}, {@code (a, b)}
     */
    record TupleDisplay(SourceSpan span, List<Expression> elements) implements Expression {
        public TupleDisplay {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Dictionary construction: {@code {k: v, ...}}
     */
    record DictDisplay(SourceSpan span, List<Entry> entries) implements Expression {
        public DictDisplay {
            entries = List.copyOf(entries);
        }
    }

    record Entry(Expression key, Expression value) {}
}
