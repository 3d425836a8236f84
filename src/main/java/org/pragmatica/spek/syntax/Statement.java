package org.pragmatica.spek.syntax;

import io.vavr.control.Option;
import org.pragmatica.spek.tree.SourceSpan;

import java.util.List;

/**
 * Statement and declaration nodes of the spek syntax tree. Every node owns its children.
 */
public sealed interface Statement {

    SourceSpan span();

    // === Declarations ===

    /**
     * Variable or field declaration: {@code var name [= initializer]}
     */
    record VarDeclaration(SourceSpan span, String name, Option<Expression> initializer) implements Statement {}

    /**
     * Function or method declaration: {@code def name(params): body}
     */
    record FunctionDeclaration(
    SourceSpan span,
    String name,
    List<Parameter> parameters,
    List<Statement> body) implements Statement {
        public FunctionDeclaration {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }
    }

    record Parameter(SourceSpan span, String name) {}

    /**
     * Class declaration: {@code class Name[(Super)]: members}.
     * Members are variable, function, property and delegate declarations.
     */
    record ClassDeclaration(
    SourceSpan span,
    String name,
    Option<String> superclass,
    List<Statement> members) implements Statement {
        public ClassDeclaration {
            members = List.copyOf(members);
        }
    }

    /**
     * Property declaration with a mandatory getter and an optional setter.
     */
    record PropertyDeclaration(
    SourceSpan span,
    String name,
    List<Statement> getter,
    Option<Setter> setter) implements Statement {
        public PropertyDeclaration {
            getter = List.copyOf(getter);
        }
    }

    /**
     * Setter clause: {@code set parameter: body}
     */
    record Setter(SourceSpan span, Parameter parameter, List<Statement> body) {
        public Setter {
            body = List.copyOf(body);
        }
    }

    /**
     * Delegation declaration inside a class body: unknown attributes are looked up on the value of {@code field}.
     */
    record DelegateDeclaration(SourceSpan span, String field) implements Statement {}

    // === Simple statements ===

    record Assignment(SourceSpan span, Expression target, Expression value) implements Statement {}

    record ExpressionStatement(SourceSpan span, Expression expression) implements Statement {}

    record Return(SourceSpan span, Option<Expression> value) implements Statement {}

    record Break(SourceSpan span) implements Statement {}

    record Continue(SourceSpan span) implements Statement {}

    record Pass(SourceSpan span) implements Statement {}

    // === Control flow ===

    /**
     * Conditional. An {@code elif} chain is represented as an else-branch holding a single nested {@code If}.
     */
    record If(
    SourceSpan span,
    Expression condition,
    List<Statement> thenBranch,
    List<Statement> elseBranch) implements Statement {
        public If {
            thenBranch = List.copyOf(thenBranch);
            elseBranch = List.copyOf(elseBranch);
        }
    }

    record While(SourceSpan span, Expression condition, List<Statement> body) implements Statement {
        public While {
            body = List.copyOf(body);
        }
    }

    record For(SourceSpan span, Parameter variable, Expression iterable, List<Statement> body) implements Statement {
        public For {
            body = List.copyOf(body);
        }
    }

    // === Exceptions ===

    /**
     * {@code try} with its {@code except} clauses, tried in order, and an optional {@code finally} block.
     * At least one of the two is present.
     */
    record Try(
    SourceSpan span,
    List<Statement> body,
    List<ExceptClause> handlers,
    Option<List<Statement>> finallyBody) implements Statement {
        public Try {
            body = List.copyOf(body);
            handlers = List.copyOf(handlers);
            finallyBody = finallyBody.map(List::copyOf);
        }
    }

    /**
     * {@code except [type [as name]]: body}; without a type the clause catches everything.
     */
    record ExceptClause(
    SourceSpan span,
    Option<Expression> type,
    Option<Parameter> name,
    List<Statement> body) {
        public ExceptClause {
            body = List.copyOf(body);
        }
    }

    /**
     * {@code raise [exception]}; without an operand re-raises the exception being handled.
     */
    record Raise(SourceSpan span, Option<Expression> exception) implements Statement {}

    // === Concurrency ===

    /**
     * Suspension: the running task yields until the condition holds.
     */
    record Await(SourceSpan span, WaitKind kind, Expression operand) implements Statement {}

    /**
     * Task spawn: starts {@code call} as a new task without waiting for it.
     */
    record Async(SourceSpan span, Expression.Call call) implements Statement {}

    /**
     * What an {@link Await} waits for.
     */
    enum WaitKind {
        /**
         * A named interaction event; the operand evaluates to the label.
         */
        EVENT("event"),
        /**
         * A span of virtual time; the operand evaluates to the delay.
         */
        DELAY("delay");

        private final String keyword;

        WaitKind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }
}
