package org.pragmatica.spek.lexer;

import org.pragmatica.spek.tree.SourceSpan;

/**
 * Lexical tokens of spek source. Layout is explicit: {@link Newline} ends a logical line,
 * {@link Indent} and {@link Dedent} open and close indentation blocks.
 */
public sealed interface Token {
    SourceSpan span();

    // Names and literals
    record Identifier(SourceSpan span, String name) implements Token {}

    record Keyword(SourceSpan span, String word) implements Token {}

    record IntLiteral(SourceSpan span, long value) implements Token {}

    record FloatLiteral(SourceSpan span, double value) implements Token {}

    record StringLiteral(SourceSpan span, String value) implements Token {}

    // + - * / // % == != < <= > >= = += -= *= /= ( ) [ ] { } , : .
    record Operator(SourceSpan span, String symbol) implements Token {}

    // Layout
    record Newline(SourceSpan span) implements Token {}

    record Indent(SourceSpan span) implements Token {}

    record Dedent(SourceSpan span) implements Token {}

    record Eof(SourceSpan span) implements Token {}

    /**
     * Short human-readable description used in parse errors.
     */
    static String describe(Token token) {
        if (token instanceof Identifier id) {
            return "identifier '" + id.name() + "'";
        } else if (token instanceof Keyword kw) {
            return "keyword '" + kw.word() + "'";
        } else if (token instanceof IntLiteral || token instanceof FloatLiteral) {
            return "number";
        } else if (token instanceof StringLiteral) {
            return "string literal";
        } else if (token instanceof Operator op) {
            return "'" + op.symbol() + "'";
        } else if (token instanceof Newline) {
            return "end of line";
        } else if (token instanceof Indent) {
            return "indented block";
        } else if (token instanceof Dedent) {
            return "end of block";
        }
        return "end of input";
    }
}
