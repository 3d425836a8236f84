package org.pragmatica.spek.syntax;

import io.vavr.control.Option;

/**
 * Binary operators with their binding strength (higher binds tighter). Level 3 belongs to the prefix
 * {@code not}, see {@link UnaryOperator}.
 */
public enum BinaryOperator {
    OR("or", 1),
    AND("and", 2),
    EQ("==", 4),
    NE("!=", 4),
    LT("<", 4),
    LE("<=", 4),
    GT(">", 4),
    GE(">=", 4),
    IN("in", 4),
    NOT_IN("not in", 4),
    IS("is", 4),
    IS_NOT("is not", 4),
    ADD("+", 5),
    SUB("-", 5),
    MUL("*", 6),
    DIV("/", 6),
    FLOOR_DIV("//", 6),
    MOD("%", 6);

    private static final int COMPARISON = 4;

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isComparison() {
        return precedence == COMPARISON;
    }

    public boolean isArithmetic() {
        return precedence > COMPARISON;
    }

    /**
     * Lowest and highest binding strength of any binary operator.
     */
    public static int loosest() {
        return OR.precedence;
    }

    public static int tightest() {
        return MUL.precedence;
    }

    public static Option<BinaryOperator> fromSymbol(String symbol) {
        for (var op : values()) {
            if (op.symbol.equals(symbol)) {
                return Option.some(op);
            }
        }
        return Option.none();
    }

    /**
     * Operator an augmented assignment ({@code +=}, {@code -=}, ...) stands for.
     */
    public static Option<BinaryOperator> fromAugmented(String symbol) {
        if (symbol.length() < 2 || !symbol.endsWith("=")) {
            return Option.none();
        }
        return fromSymbol(symbol.substring(0, symbol.length() - 1))
            .filter(BinaryOperator::isArithmetic);
    }
}
