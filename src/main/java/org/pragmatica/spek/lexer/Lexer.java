package org.pragmatica.spek.lexer;

import io.vavr.control.Either;
import org.pragmatica.spek.error.CompileError;
import org.pragmatica.spek.error.CompileError.LexError;
import org.pragmatica.spek.tree.SourceLocation;
import org.pragmatica.spek.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Lexer for spek source text with a Python-like layout rule.
 */
public final class Lexer {
    public static final int DEFAULT_MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;
    private static final int TAB_WIDTH = 8;

    public static final Set<String> KEYWORDS = Set.of(
        "var", "def", "class", "prop", "get", "set", "return", "if", "elif", "else", "while", "for", "in",
        "break", "continue", "pass", "await", "async", "event", "delay", "delegate", "and", "or", "not", "is",
        "try", "except", "finally", "raise", "as",
        "True", "False", "None");

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
        "//", "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=");

    private static final String ONE_CHAR_OPERATORS = "+-*/%<>=()[]{},:.";

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int pos;
    private int line;
    private int column;
    private int bracketDepth;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.bracketDepth = 0;
        this.indents.push(0);
    }

    public static Either<CompileError, List<Token>> tokenize(String input) {
        return tokenize(input, DEFAULT_MAX_INPUT_SIZE);
    }

    public static Either<CompileError, List<Token>> tokenize(String input, int maxInputSize) {
        if (input.length() > maxInputSize) {
            return Either.left(new LexError(SourceLocation.START,
                                            "Source exceeds maximum size of " + maxInputSize + " characters"));
        }
        return new Lexer(input).tokenizeAll();
    }

    private Either<CompileError, List<Token>> tokenizeAll() {
        boolean atLineStart = true;
        while (!isAtEnd()) {
            if (atLineStart && bracketDepth == 0) {
                var layout = scanIndentation();
                if (layout.isLeft()) {
                    return Either.left(layout.getLeft());
                }
                atLineStart = false;
                continue;
            }
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else if (c == '#') {
                skipComment();
            } else if (c == '\n') {
                var start = currentLocation();
                advance();
                if (bracketDepth == 0) {
                    tokens.add(new Token.Newline(span(start)));
                    atLineStart = true;
                }
            } else {
                var token = nextToken();
                if (token.isLeft()) {
                    return Either.left(token.getLeft());
                }
                tokens.add(token.get());
            }
        }
        finishLayout();
        return Either.right(List.copyOf(tokens));
    }

    /**
     * Measure indentation of the current line and emit Indent/Dedent tokens.
     * Blank and comment-only lines are consumed without affecting layout.
     */
    private Either<LexError, Boolean> scanIndentation() {
        int width;
        while (true) {
            width = 0;
            while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
                width = peek() == '\t' ? (width / TAB_WIDTH + 1) * TAB_WIDTH : width + 1;
                advance();
            }
            if (isAtEnd()) {
                return Either.right(false);
            }
            char c = peek();
            if (c != '\n' && c != '#' && c != '\r') {
                break;
            }
            if (c == '#') {
                skipComment();
            }
            while (!isAtEnd() && peek() == '\r') {
                advance();
            }
            if (!isAtEnd() && peek() == '\n') {
                advance();
            }
        }
        var here = SourceSpan.at(currentLocation());
        if (width > indents.peek()) {
            indents.push(width);
            tokens.add(new Token.Indent(here));
            return Either.right(true);
        }
        while (width < indents.peek()) {
            indents.pop();
            tokens.add(new Token.Dedent(here));
        }
        if (width != indents.peek()) {
            return Either.left(new LexError(currentLocation().lineStart(),
                                            "Inconsistent indentation: column " + (width + 1)
                                            + " matches no enclosing block"));
        }
        return Either.right(true);
    }

    private void finishLayout() {
        var end = SourceSpan.at(currentLocation());
        if (!tokens.isEmpty() && !(tokens.get(tokens.size() - 1) instanceof Token.Newline)) {
            tokens.add(new Token.Newline(end));
        }
        while (indents.peek() > 0) {
            indents.pop();
            tokens.add(new Token.Dedent(end));
        }
        tokens.add(new Token.Eof(end));
    }

    private Either<LexError, Token> nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isIdentifierStart(c)) {
            return Either.right(scanWord(start));
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        if (c == '\'' || c == '"') {
            return scanStringLiteral(start);
        }
        return scanOperator(start);
    }

    private Token scanWord(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        var word = sb.toString();
        return KEYWORDS.contains(word)
               ? new Token.Keyword(span(start), word)
               : new Token.Identifier(span(start), word);
    }

    private Either<LexError, Token> scanNumber(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        boolean fractional = false;
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        if (!isAtEnd() && peek() == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
            fractional = true;
            sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }
        if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
            int lookahead = pos + 1;
            if (lookahead < input.length() && (input.charAt(lookahead) == '+' || input.charAt(lookahead) == '-')) {
                lookahead++;
            }
            if (lookahead < input.length() && isDigit(input.charAt(lookahead))) {
                fractional = true;
                while (pos < lookahead) {
                    sb.append(advance());
                }
                while (!isAtEnd() && isDigit(peek())) {
                    sb.append(advance());
                }
            }
        }
        if (!isAtEnd() && isIdentifierStart(peek())) {
            return Either.left(new LexError(currentLocation(), "Invalid numeric literal '" + sb + peek() + "'"));
        }
        var text = sb.toString();
        if (fractional) {
            return Either.right(new Token.FloatLiteral(span(start), Double.parseDouble(text)));
        }
        try {
            return Either.right(new Token.IntLiteral(span(start), Long.parseLong(text)));
        } catch (NumberFormatException e) {
            return Either.left(new LexError(start, "Integer literal out of range: " + text));
        }
    }

    private Either<LexError, Token> scanStringLiteral(SourceLocation start) {
        char quote = advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != quote && peek() != '\n') {
            if (peek() == '\\') {
                advance();
                if (isAtEnd() || peek() == '\n') {
                    break;
                }
                sb.append(scanEscapeSequence());
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd() || peek() != quote) {
            return Either.left(new LexError(start, "Unterminated string literal"));
        }
        advance();
        return Either.right(new Token.StringLiteral(span(start), sb.toString()));
    }

    private char scanEscapeSequence() {
        char c = advance();
        return switch (c) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case '0' -> '\0';
            default -> c;
        };
    }

    private Either<LexError, Token> scanOperator(SourceLocation start) {
        if (pos + 1 < input.length()) {
            var pair = input.substring(pos, pos + 2);
            if (TWO_CHAR_OPERATORS.contains(pair)) {
                advance();
                advance();
                return Either.right(new Token.Operator(span(start), pair));
            }
        }
        char c = peek();
        if (ONE_CHAR_OPERATORS.indexOf(c) < 0) {
            return Either.left(new LexError(start, "Unexpected character '" + c + "'"));
        }
        advance();
        switch (c) {
            case '(', '[', '{' -> bracketDepth++;
            case ')', ']', '}' -> {
                if (bracketDepth == 0) {
                    return Either.left(new LexError(start, "Unbalanced '" + c + "'"));
                }
                bracketDepth--;
            }
            default -> {
            }
        }
        return Either.right(new Token.Operator(span(start), String.valueOf(c)));
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
