package org.pragmatica.spek.syntax;

import org.pragmatica.spek.tree.SourceSpan;

import java.util.List;

/**
 * Root of the syntax tree: the statements of one source file, in order. Top-level statements form the script.
 */
public record SourceModule(SourceSpan span, List<Statement> statements) {
    public SourceModule {
        statements = List.copyOf(statements);
    }
}
