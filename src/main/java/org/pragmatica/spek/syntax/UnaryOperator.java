package org.pragmatica.spek.syntax;

/**
 * Prefix operators. {@code not} binds looser than comparisons, {@code -} tighter than every binary operator.
 */
public enum UnaryOperator {
    NEGATE("-", 7),
    NOT("not", 3);

    private final String symbol;
    private final int precedence;

    UnaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }
}
