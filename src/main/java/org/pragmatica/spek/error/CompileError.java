package org.pragmatica.spek.error;

import org.pragmatica.spek.tree.SourceLocation;
import org.pragmatica.spek.tree.SourceSpan;

import java.util.List;

/**
 * Failure of one compilation stage. Lexing, parsing and translation stop at the first problem;
 * validation reports everything it found in one {@link ValidationFailure}.
 */
public sealed interface CompileError extends SpekError {

    Stage stage();

    /**
     * Structured diagnostics describing this failure, never empty.
     */
    List<Diagnostic> diagnostics();

    /**
     * Invalid character, unterminated string literal or inconsistent indentation.
     */
    record LexError(
    SourceLocation location,
    String reason) implements CompileError {
        @Override
        public Stage stage() {
            return Stage.LEX;
        }

        @Override
        public String message() {
            return reason + " at " + location;
        }

        @Override
        public List<Diagnostic> diagnostics() {
            return List.of(Diagnostic.error(Stage.LEX, "E0100", reason, SourceSpan.at(location)));
        }
    }

    /**
     * Token that does not fit the grammar at this point.
     */
    record ParseError(
    SourceSpan span,
    String found,
    String expected) implements CompileError {
        @Override
        public Stage stage() {
            return Stage.PARSE;
        }

        public SourceLocation location() {
            return span.start();
        }

        @Override
        public String message() {
            return "Unexpected " + found + " at " + span.start() + ", expected " + expected;
        }

        @Override
        public List<Diagnostic> diagnostics() {
            return List.of(Diagnostic.error(Stage.PARSE, "E0200", "unexpected " + found, span)
                                     .withNote("expected " + expected));
        }
    }

    /**
     * Blocks or expressions nested deeper than the parser accepts.
     */
    record NestingLimitExceeded(
    SourceSpan span,
    int limit) implements CompileError {
        @Override
        public Stage stage() {
            return Stage.PARSE;
        }

        @Override
        public String message() {
            return "Nested too deeply at " + span.start() + ", the limit is " + limit + " levels";
        }

        @Override
        public List<Diagnostic> diagnostics() {
            return List.of(Diagnostic.error(Stage.PARSE, "E0201", "nested too deeply", span)
                                     .withNote("blocks and expressions may nest at most " + limit + " levels deep"));
        }
    }

    /**
     * All static semantic problems found in one validation pass.
     */
    record ValidationFailure(List<Diagnostic> diagnostics) implements CompileError {
        public ValidationFailure {
            if (diagnostics.isEmpty()) {
                throw new IllegalArgumentException("Validation failure requires at least one diagnostic");
            }
            diagnostics = List.copyOf(diagnostics);
        }

        @Override
        public Stage stage() {
            return Stage.VALIDATION;
        }

        @Override
        public String message() {
            var sb = new StringBuilder();
            sb.append(diagnostics.size()).append(diagnostics.size() == 1 ? " validation error" : " validation errors");
            for (var diagnostic : diagnostics) {
                sb.append("\n  ").append(diagnostic.formatSimple());
            }
            return sb.toString();
        }
    }

    /**
     * Validated construct the translator has no lowering for.
     */
    record TranslationError(
    SourceSpan span,
    String node,
    String reason) implements CompileError {
        @Override
        public Stage stage() {
            return Stage.TRANSLATION;
        }

        @Override
        public String message() {
            return "Cannot translate " + node + " at " + span.start() + ": " + reason;
        }

        @Override
        public List<Diagnostic> diagnostics() {
            return List.of(Diagnostic.error(Stage.TRANSLATION, "E0400", reason, span));
        }
    }
}
