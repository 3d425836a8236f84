package org.pragmatica.spek.syntax;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.spek.error.CompileError;
import org.pragmatica.spek.error.CompileError.NestingLimitExceeded;
import org.pragmatica.spek.error.CompileError.ParseError;
import org.pragmatica.spek.lexer.Lexer;
import org.pragmatica.spek.lexer.Token;
import org.pragmatica.spek.syntax.Statement.WaitKind;
import org.pragmatica.spek.tree.SourceLocation;
import org.pragmatica.spek.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for spek. Stops at the first error; no partial tree is returned.
 *
 * <p>Nesting is bounded: blocks, parenthesised and prefixed expressions and chains of binary operators or
 * postfix accesses each count as one level, and a tree deeper than the configured limit is rejected with
 * {@link NestingLimitExceeded}.
 */
public final class Parser {
    public static final int DEFAULT_MAX_NESTING = 200;

    private final List<Token> tokens;
    private final int maxNesting;
    private int pos;
    private int depth;

    private Parser(List<Token> tokens, int maxNesting) {
        this.tokens = tokens;
        this.maxNesting = maxNesting;
        this.pos = 0;
    }

    /**
     * Parse a token stream produced by {@link Lexer}.
     */
    public static Either<CompileError, SourceModule> parse(List<Token> tokens) {
        return parse(tokens, DEFAULT_MAX_NESTING);
    }

    public static Either<CompileError, SourceModule> parse(List<Token> tokens, int maxNesting) {
        if (tokens.isEmpty() || !(tokens.get(tokens.size() - 1) instanceof Token.Eof)) {
            throw new IllegalArgumentException("Token stream must end with Eof");
        }
        if (maxNesting < 1) {
            throw new IllegalArgumentException("Nesting limit must be positive: " + maxNesting);
        }
        return new Parser(tokens, maxNesting).parseModule();
    }

    /**
     * Tokenize and parse source text.
     */
    public static Either<CompileError, SourceModule> parse(String source) {
        return Lexer.tokenize(source)
                    .flatMap(Parser::parse);
    }

    private Either<CompileError, SourceModule> parseModule() {
        var start = peek().span().start();
        var statements = new ArrayList<Statement>();

        while (!isAtEnd()) {
            if (peek() instanceof Token.Newline) {
                advance();
                continue;
            }
            var statement = parseStatement();
            if (statement.isLeft()) {
                return propagate(statement);
            }
            statements.add(statement.get());
        }
        return Either.right(new SourceModule(SourceSpan.of(start, peek().span().end()), statements));
    }

    // === Statements ===

    private Either<CompileError, Statement> parseStatement() {
        var token = peek();
        if (!(token instanceof Token.Keyword keyword)) {
            return parseAssignmentOrExpression();
        }
        return switch (keyword.word()) {
            case "var" -> parseVar();
            case "def" -> parseFunction();
            case "class" -> parseClass();
            case "prop" -> parseProperty();
            case "if" -> parseIf();
            case "while" -> parseWhile();
            case "for" -> parseFor();
            case "try" -> parseTry();
            case "return" -> parseReturn();
            case "raise" -> parseRaise();
            case "break" -> endOfSimpleStatement(new Statement.Break(advance().span()));
            case "continue" -> endOfSimpleStatement(new Statement.Continue(advance().span()));
            case "pass" -> endOfSimpleStatement(new Statement.Pass(advance().span()));
            case "await" -> parseAwait();
            case "async" -> parseAsync();
            default -> parseAssignmentOrExpression();
        };
    }

    private Either<CompileError, Statement> parseVar() {
        var start = advance().span().start();
        var name = expectIdentifier("variable name");
        if (name.isLeft()) {
            return propagate(name);
        }
        Option<Expression> initializer = Option.none();
        if (isOperator("=")) {
            advance();
            var value = parseExpression();
            if (value.isLeft()) {
                return propagate(value);
            }
            initializer = Option.some(value.get());
        }
        return endOfSimpleStatement(new Statement.VarDeclaration(spanFrom(start), name.get().name(), initializer));
    }

    private Either<CompileError, Statement> parseFunction() {
        var start = advance().span().start();
        var name = expectIdentifier("function name");
        if (name.isLeft()) {
            return propagate(name);
        }
        var open = expectOperator("(");
        if (open.isLeft()) {
            return propagate(open);
        }
        var parameters = new ArrayList<Statement.Parameter>();
        while (!isOperator(")")) {
            if (!parameters.isEmpty()) {
                var comma = expectOperator(",");
                if (comma.isLeft()) {
                    return propagate(comma);
                }
                if (isOperator(")")) {
                    break;
                }
            }
            var parameter = expectIdentifier("parameter name");
            if (parameter.isLeft()) {
                return propagate(parameter);
            }
            parameters.add(new Statement.Parameter(parameter.get().span(), parameter.get().name()));
        }
        advance();
        var headerSpan = spanFrom(start);
        var body = parseBlock();
        if (body.isLeft()) {
            return propagate(body);
        }
        return Either.right(new Statement.FunctionDeclaration(headerSpan, name.get().name(), parameters, body.get()));
    }

    private Either<CompileError, Statement> parseClass() {
        var start = advance().span().start();
        var name = expectIdentifier("class name");
        if (name.isLeft()) {
            return propagate(name);
        }
        Option<String> superclass = Option.none();
        if (isOperator("(")) {
            advance();
            var parent = expectIdentifier("superclass name");
            if (parent.isLeft()) {
                return propagate(parent);
            }
            var close = expectOperator(")");
            if (close.isLeft()) {
                return propagate(close);
            }
            superclass = Option.some(parent.get().name());
        }
        var headerSpan = spanFrom(start);
        var open = openBlock();
        if (open.isLeft()) {
            return propagate(open);
        }
        var members = new ArrayList<Statement>();
        while (!(peek() instanceof Token.Dedent) && !isAtEnd()) {
            var member = parseClassMember();
            if (member.isLeft()) {
                return propagate(member);
            }
            members.add(member.get());
        }
        var close = closeBlock();
        if (close.isLeft()) {
            return propagate(close);
        }
        return Either.right(new Statement.ClassDeclaration(headerSpan, name.get().name(), superclass, members));
    }

    private Either<CompileError, Statement> parseClassMember() {
        if (isKeyword("var")) {
            return parseVar();
        }
        if (isKeyword("def")) {
            return parseFunction();
        }
        if (isKeyword("prop")) {
            return parseProperty();
        }
        if (isKeyword("pass")) {
            var token = advance();
            return endOfSimpleStatement(new Statement.Pass(token.span()));
        }
        if (isKeyword("delegate")) {
            var start = advance().span().start();
            var field = expectIdentifier("delegate field name");
            if (field.isLeft()) {
                return propagate(field);
            }
            return endOfSimpleStatement(new Statement.DelegateDeclaration(spanFrom(start), field.get().name()));
        }
        return unexpected("class member ('var', 'def', 'prop', 'delegate' or 'pass')");
    }

    private Either<CompileError, Statement> parseProperty() {
        var start = advance().span().start();
        var name = expectIdentifier("property name");
        if (name.isLeft()) {
            return propagate(name);
        }
        var headerSpan = spanFrom(start);
        var open = openBlock();
        if (open.isLeft()) {
            return propagate(open);
        }
        var get = expectKeyword("get");
        if (get.isLeft()) {
            return propagate(get);
        }
        var getter = parseBlock();
        if (getter.isLeft()) {
            return propagate(getter);
        }
        Option<Statement.Setter> setter = Option.none();
        if (isKeyword("set")) {
            var setStart = advance().span().start();
            var parameter = expectIdentifier("setter parameter name");
            if (parameter.isLeft()) {
                return propagate(parameter);
            }
            var setSpan = spanFrom(setStart);
            var body = parseBlock();
            if (body.isLeft()) {
                return propagate(body);
            }
            var param = new Statement.Parameter(parameter.get().span(), parameter.get().name());
            setter = Option.some(new Statement.Setter(setSpan, param, body.get()));
        }
        var close = closeBlock();
        if (close.isLeft()) {
            return propagate(close);
        }
        return Either.right(new Statement.PropertyDeclaration(headerSpan, name.get().name(), getter.get(), setter));
    }

    private Either<CompileError, Statement> parseIf() {
        var start = advance().span().start();
        var condition = parseExpression();
        if (condition.isLeft()) {
            return propagate(condition);
        }
        var headerSpan = spanFrom(start);
        var thenBranch = parseBlock();
        if (thenBranch.isLeft()) {
            return propagate(thenBranch);
        }
        List<Statement> elseBranch = List.of();
        if (isKeyword("elif")) {
            var chained = nested(this::parseIf);
            if (chained.isLeft()) {
                return chained;
            }
            elseBranch = List.of(chained.get());
        } else if (isKeyword("else")) {
            advance();
            var body = parseBlock();
            if (body.isLeft()) {
                return propagate(body);
            }
            elseBranch = body.get();
        }
        return Either.right(new Statement.If(headerSpan, condition.get(), thenBranch.get(), elseBranch));
    }

    private Either<CompileError, Statement> parseWhile() {
        var start = advance().span().start();
        var condition = parseExpression();
        if (condition.isLeft()) {
            return propagate(condition);
        }
        var headerSpan = spanFrom(start);
        var body = parseBlock();
        if (body.isLeft()) {
            return propagate(body);
        }
        return Either.right(new Statement.While(headerSpan, condition.get(), body.get()));
    }

    private Either<CompileError, Statement> parseFor() {
        var start = advance().span().start();
        var variable = expectIdentifier("loop variable");
        if (variable.isLeft()) {
            return propagate(variable);
        }
        var in = expectKeyword("in");
        if (in.isLeft()) {
            return propagate(in);
        }
        var iterable = parseExpression();
        if (iterable.isLeft()) {
            return propagate(iterable);
        }
        var headerSpan = spanFrom(start);
        var body = parseBlock();
        if (body.isLeft()) {
            return propagate(body);
        }
        var parameter = new Statement.Parameter(variable.get().span(), variable.get().name());
        return Either.right(new Statement.For(headerSpan, parameter, iterable.get(), body.get()));
    }

    private Either<CompileError, Statement> parseReturn() {
        var start = advance().span().start();
        if (peek() instanceof Token.Newline) {
            return endOfSimpleStatement(new Statement.Return(spanFrom(start), Option.none()));
        }
        var value = parseExpression();
        if (value.isLeft()) {
            return propagate(value);
        }
        return endOfSimpleStatement(new Statement.Return(spanFrom(start), Option.some(value.get())));
    }

    private Either<CompileError, Statement> parseTry() {
        var start = advance().span().start();
        var headerSpan = spanFrom(start);
        var body = parseBlock();
        if (body.isLeft()) {
            return propagate(body);
        }
        var handlers = new ArrayList<Statement.ExceptClause>();
        while (isKeyword("except")) {
            var handler = parseExceptClause();
            if (handler.isLeft()) {
                return propagate(handler);
            }
            handlers.add(handler.get());
        }
        Option<List<Statement>> finallyBody = Option.none();
        if (isKeyword("finally")) {
            advance();
            var block = parseBlock();
            if (block.isLeft()) {
                return propagate(block);
            }
            finallyBody = Option.some(block.get());
        }
        if (handlers.isEmpty() && finallyBody.isEmpty()) {
            return unexpected("'except' or 'finally'");
        }
        return Either.right(new Statement.Try(headerSpan, body.get(), handlers, finallyBody));
    }

    private Either<CompileError, Statement.ExceptClause> parseExceptClause() {
        var start = advance().span().start();
        Option<Expression> type = Option.none();
        Option<Statement.Parameter> name = Option.none();
        if (!isOperator(":")) {
            var expression = parseExpression();
            if (expression.isLeft()) {
                return propagate(expression);
            }
            type = Option.some(expression.get());
            if (isKeyword("as")) {
                advance();
                var identifier = expectIdentifier("exception variable name");
                if (identifier.isLeft()) {
                    return propagate(identifier);
                }
                name = Option.some(new Statement.Parameter(identifier.get().span(), identifier.get().name()));
            }
        }
        var headerSpan = spanFrom(start);
        var body = parseBlock();
        if (body.isLeft()) {
            return propagate(body);
        }
        return Either.right(new Statement.ExceptClause(headerSpan, type, name, body.get()));
    }

    private Either<CompileError, Statement> parseRaise() {
        var start = advance().span().start();
        if (peek() instanceof Token.Newline) {
            return endOfSimpleStatement(new Statement.Raise(spanFrom(start), Option.none()));
        }
        var exception = parseExpression();
        if (exception.isLeft()) {
            return propagate(exception);
        }
        return endOfSimpleStatement(new Statement.Raise(spanFrom(start), Option.some(exception.get())));
    }

    private Either<CompileError, Statement> parseAwait() {
        var start = advance().span().start();
        WaitKind kind;
        if (isKeyword("event")) {
            kind = WaitKind.EVENT;
        } else if (isKeyword("delay")) {
            kind = WaitKind.DELAY;
        } else {
            return unexpected("'event' or 'delay' after 'await'");
        }
        advance();
        var operand = parseExpression();
        if (operand.isLeft()) {
            return propagate(operand);
        }
        return endOfSimpleStatement(new Statement.Await(spanFrom(start), kind, operand.get()));
    }

    private Either<CompileError, Statement> parseAsync() {
        var start = advance().span().start();
        var callStart = peek();
        var expression = parseExpression();
        if (expression.isLeft()) {
            return propagate(expression);
        }
        if (!(expression.get() instanceof Expression.Call call)) {
            return Either.left(new ParseError(expression.get().span(),
                                              describeExpression(callStart),
                                              "call after 'async'"));
        }
        return endOfSimpleStatement(new Statement.Async(spanFrom(start), call));
    }

    private Either<CompileError, Statement> parseAssignmentOrExpression() {
        var start = peek().span().start();
        var expression = parseExpression();
        if (expression.isLeft()) {
            return propagate(expression);
        }
        var target = expression.get();
        if (!(peek() instanceof Token.Operator op) || !isAssignmentOperator(op.symbol())) {
            return endOfSimpleStatement(new Statement.ExpressionStatement(spanFrom(start), target));
        }
        if (!isAssignable(target)) {
            return Either.left(new ParseError(op.span(), "'" + op.symbol() + "'", "end of line after expression"));
        }
        advance();
        var value = parseExpression();
        if (value.isLeft()) {
            return propagate(value);
        }
        var assigned = value.get();
        if (!op.symbol().equals("=")) {
            var operator = BinaryOperator.fromAugmented(op.symbol()).get();
            assigned = new Expression.Binary(spanFrom(start), operator, target, assigned);
        }
        return endOfSimpleStatement(new Statement.Assignment(spanFrom(start), target, assigned));
    }

    private static boolean isAssignmentOperator(String symbol) {
        return symbol.equals("=") || BinaryOperator.fromAugmented(symbol).isDefined();
    }

    private static boolean isAssignable(Expression expression) {
        return expression instanceof Expression.Name
               || expression instanceof Expression.Attribute
               || expression instanceof Expression.Index;
    }

    private Either<CompileError, List<Statement>> parseBlock() {
        return nested(this::parseBlockBody);
    }

    private Either<CompileError, List<Statement>> parseBlockBody() {
        var open = openBlock();
        if (open.isLeft()) {
            return propagate(open);
        }
        var statements = new ArrayList<Statement>();
        while (!(peek() instanceof Token.Dedent) && !isAtEnd()) {
            var statement = parseStatement();
            if (statement.isLeft()) {
                return propagate(statement);
            }
            statements.add(statement.get());
        }
        var close = closeBlock();
        if (close.isLeft()) {
            return propagate(close);
        }
        return Either.right(statements);
    }

    private Either<CompileError, Token> openBlock() {
        var colon = expectOperator(":");
        if (colon.isLeft()) {
            return colon;
        }
        if (!(peek() instanceof Token.Newline)) {
            return unexpected("end of line after ':'");
        }
        advance();
        if (!(peek() instanceof Token.Indent)) {
            return unexpected("indented block");
        }
        return Either.right(advance());
    }

    private Either<CompileError, Token> closeBlock() {
        if (!(peek() instanceof Token.Dedent)) {
            return unexpected("end of block");
        }
        return Either.right(advance());
    }

    private Either<CompileError, Statement> endOfSimpleStatement(Statement statement) {
        if (!(peek() instanceof Token.Newline)) {
            return unexpected("end of line");
        }
        advance();
        return Either.right(statement);
    }

    // === Expressions ===

    private Either<CompileError, Expression> parseExpression() {
        return nested(() -> parseBinary(BinaryOperator.loosest()));
    }

    /**
     * Precedence climbing over binary operators; all binary operators are left-associative. The prefix
     * {@code not} has a level of its own between {@code and} and the comparisons.
     */
    private Either<CompileError, Expression> parseBinary(int minPrecedence) {
        if (minPrecedence > BinaryOperator.tightest()) {
            return parseUnary();
        }
        if (minPrecedence == UnaryOperator.NOT.precedence()) {
            return parseNot();
        }
        var start = peek().span().start();
        var left = parseBinary(minPrecedence + 1);
        if (left.isLeft()) {
            return left;
        }
        var result = left.get();
        var links = 0;
        while (true) {
            var operator = peekBinaryOperator();
            if (operator.isEmpty() || operator.get().precedence() != minPrecedence) {
                return Either.right(result);
            }
            if (depth + ++links > maxNesting) {
                return nestingLimit();
            }
            advance();
            if (operator.get() == BinaryOperator.NOT_IN || operator.get() == BinaryOperator.IS_NOT) {
                advance();
            }
            var right = parseBinary(minPrecedence + 1);
            if (right.isLeft()) {
                return right;
            }
            result = new Expression.Binary(spanFrom(start), operator.get(), result, right.get());
        }
    }

    private Option<BinaryOperator> peekBinaryOperator() {
        var token = peek();
        if (token instanceof Token.Operator op) {
            return BinaryOperator.fromSymbol(op.symbol());
        }
        if (!(token instanceof Token.Keyword kw)) {
            return Option.none();
        }
        return switch (kw.word()) {
            case "and" -> Option.some(BinaryOperator.AND);
            case "or" -> Option.some(BinaryOperator.OR);
            case "in" -> Option.some(BinaryOperator.IN);
            case "is" -> Option.some(isKeywordToken(peekNext(), "not") ? BinaryOperator.IS_NOT : BinaryOperator.IS);
            case "not" -> isKeywordToken(peekNext(), "in") ? Option.some(BinaryOperator.NOT_IN) : Option.<BinaryOperator>none();
            default -> Option.none();
        };
    }

    private Either<CompileError, Expression> parseNot() {
        if (!isKeyword("not")) {
            return parseBinary(UnaryOperator.NOT.precedence() + 1);
        }
        var start = advance().span().start();
        var operand = nested(this::parseNot);
        if (operand.isLeft()) {
            return operand;
        }
        return Either.right(new Expression.Unary(spanFrom(start), UnaryOperator.NOT, operand.get()));
    }

    private Either<CompileError, Expression> parseUnary() {
        if (!isOperator("-")) {
            return parsePostfix();
        }
        var start = advance().span().start();
        var operand = nested(this::parseUnary);
        if (operand.isLeft()) {
            return operand;
        }
        return Either.right(new Expression.Unary(spanFrom(start), UnaryOperator.NEGATE, operand.get()));
    }

    private Either<CompileError, Expression> parsePostfix() {
        var start = peek().span().start();
        var primary = parsePrimary();
        if (primary.isLeft()) {
            return primary;
        }
        var expression = primary.get();
        var links = 0;
        while (true) {
            if (!isOperator(".") && !isOperator("[") && !isOperator("(")) {
                return Either.right(expression);
            }
            if (depth + ++links > maxNesting) {
                return nestingLimit();
            }
            if (isOperator(".")) {
                advance();
                var name = expectIdentifier("attribute name");
                if (name.isLeft()) {
                    return propagate(name);
                }
                expression = new Expression.Attribute(spanFrom(start), expression, name.get().name());
            } else if (isOperator("[")) {
                advance();
                var index = parseExpression();
                if (index.isLeft()) {
                    return index;
                }
                var close = expectOperator("]");
                if (close.isLeft()) {
                    return propagate(close);
                }
                expression = new Expression.Index(spanFrom(start), expression, index.get());
            } else {
                advance();
                var arguments = parseSequence(")");
                if (arguments.isLeft()) {
                    return propagate(arguments);
                }
                expression = new Expression.Call(spanFrom(start), expression, arguments.get());
            }
        }
    }

    private Either<CompileError, Expression> parsePrimary() {
        var token = peek();
        var start = token.span().start();

        if (token instanceof Token.Identifier id) {
            advance();
            return Either.right(new Expression.Name(token.span(), id.name()));
        }
        if (token instanceof Token.IntLiteral literal) {
            advance();
            return Either.right(new Expression.IntegerLiteral(token.span(), literal.value()));
        }
        if (token instanceof Token.FloatLiteral literal) {
            advance();
            return Either.right(new Expression.FloatLiteral(token.span(), literal.value()));
        }
        if (token instanceof Token.StringLiteral literal) {
            advance();
            return Either.right(new Expression.StringLiteral(token.span(), literal.value()));
        }
        if (isKeyword("True") || isKeyword("False")) {
            advance();
            return Either.right(new Expression.BooleanLiteral(token.span(), isKeywordToken(token, "True")));
        }
        if (isKeyword("None")) {
            advance();
            return Either.right(new Expression.NoneLiteral(token.span()));
        }
        if (isOperator("(")) {
            advance();
            return parseParenthesised(start);
        }
        if (isOperator("[")) {
            advance();
            var elements = parseSequence("]");
            if (elements.isLeft()) {
                return propagate(elements);
            }
            return Either.right(new Expression.ListDisplay(spanFrom(start), elements.get()));
        }
        if (isOperator("{")) {
            advance();
            return parseDictDisplay(start);
        }
        return unexpected("expression");
    }

    /**
     * Grouping {@code (e)} or tuple display: {@code ()}, {@code (e,)}, {@code (e, f)}.
     */
    private Either<CompileError, Expression> parseParenthesised(SourceLocation start) {
        if (isOperator(")")) {
            advance();
            return Either.right(new Expression.TupleDisplay(spanFrom(start), List.of()));
        }
        var first = parseExpression();
        if (first.isLeft()) {
            return first;
        }
        if (!isOperator(",")) {
            var close = expectOperator(")");
            if (close.isLeft()) {
                return propagate(close);
            }
            return first;
        }
        advance();
        var rest = parseSequence(")");
        if (rest.isLeft()) {
            return propagate(rest);
        }
        var elements = new ArrayList<Expression>();
        elements.add(first.get());
        elements.addAll(rest.get());
        return Either.right(new Expression.TupleDisplay(spanFrom(start), elements));
    }

    private Either<CompileError, Expression> parseDictDisplay(SourceLocation start) {
        var entries = new ArrayList<Expression.Entry>();
        while (!isOperator("}")) {
            if (!entries.isEmpty()) {
                var comma = expectOperator(",");
                if (comma.isLeft()) {
                    return propagate(comma);
                }
                if (isOperator("}")) {
                    break;
                }
            }
            var key = parseExpression();
            if (key.isLeft()) {
                return key;
            }
            var colon = expectOperator(":");
            if (colon.isLeft()) {
                return propagate(colon);
            }
            var value = parseExpression();
            if (value.isLeft()) {
                return value;
            }
            entries.add(new Expression.Entry(key.get(), value.get()));
        }
        advance();
        return Either.right(new Expression.DictDisplay(spanFrom(start), entries));
    }

    /**
     * Comma-separated expressions up to (and including) the closing symbol; a trailing comma is allowed.
     */
    private Either<CompileError, List<Expression>> parseSequence(String closing) {
        var elements = new ArrayList<Expression>();
        while (!isOperator(closing)) {
            if (!elements.isEmpty()) {
                var comma = expectOperator(",");
                if (comma.isLeft()) {
                    return propagate(comma);
                }
                if (isOperator(closing)) {
                    break;
                }
            }
            var element = parseExpression();
            if (element.isLeft()) {
                return propagate(element);
            }
            elements.add(element.get());
        }
        advance();
        return Either.right(elements);
    }

    // === Token access ===

    private boolean isAtEnd() {
        return peek() instanceof Token.Eof;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekNext() {
        return tokens.get(Math.min(pos + 1, tokens.size() - 1));
    }

    private Token advance() {
        var token = peek();
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    private boolean isOperator(String symbol) {
        return peek() instanceof Token.Operator op && op.symbol().equals(symbol);
    }

    private boolean isKeyword(String word) {
        return isKeywordToken(peek(), word);
    }

    private static boolean isKeywordToken(Token token, String word) {
        return token instanceof Token.Keyword kw && kw.word().equals(word);
    }

    private Either<CompileError, Token> expectOperator(String symbol) {
        if (isOperator(symbol)) {
            return Either.right(advance());
        }
        return unexpected("'" + symbol + "'");
    }

    private Either<CompileError, Token> expectKeyword(String word) {
        if (isKeyword(word)) {
            return Either.right(advance());
        }
        return unexpected("'" + word + "'");
    }

    private Either<CompileError, Token.Identifier> expectIdentifier(String what) {
        if (peek() instanceof Token.Identifier id) {
            advance();
            return Either.right(id);
        }
        return unexpected(what);
    }

    private <T> Either<CompileError, T> unexpected(String expected) {
        var token = peek();
        return Either.left(new ParseError(token.span(), Token.describe(token), expected));
    }

    /**
     * Runs {@code parse} one nesting level deeper.
     */
    private <T> Either<CompileError, T> nested(Supplier<Either<CompileError, T>> parse) {
        if (depth >= maxNesting) {
            return nestingLimit();
        }
        depth++;
        try {
            return parse.get();
        } finally {
            depth--;
        }
    }

    private <T> Either<CompileError, T> nestingLimit() {
        return Either.left(new NestingLimitExceeded(peek().span(), maxNesting));
    }

    private static <T> Either<CompileError, T> propagate(Either<CompileError, ?> failed) {
        return Either.left(failed.getLeft());
    }

    private static String describeExpression(Token first) {
        return "expression starting with " + Token.describe(first);
    }

    /**
     * Span from the given start to the end of the last consumed token.
     */
    private SourceSpan spanFrom(SourceLocation start) {
        var end = pos > 0 ? tokens.get(pos - 1).span().end() : start;
        return SourceSpan.of(start, end);
    }
}
