package org.pragmatica.spek.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.spek.Spek;
import org.pragmatica.spek.tree.SourceLocation;
import org.pragmatica.spek.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    @Test
    void format_underlinesSpan() {
        var diagnostic = Diagnostic.error(Stage.PARSE,
                                          "E0200",
                                          "bad",
                                          SourceSpan.of(SourceLocation.at(1, 5, 4), SourceLocation.at(1, 8, 7)));

        assertEquals("""
                     error[E0200]: bad
                       --> 1:5
                       |
                     1 | var abc = 1
                       |     ^^^
                       |
                     """, diagnostic.format("var abc = 1", null));
    }

    @Test
    void format_validationDiagnostic_showsFileLineAndHelp() {
        var source = """
            prop w:
                get:
                    return 1
            w = 3
            """;
        var error = Spek.compile(source).getLeft();

        var diagnostic = error.diagnostics().get(0);
        var text = diagnostic.format(source, "scene.spek");

        assertThat(text).startsWith("error[E0302]: property 'w' has no setter\n")
                        .contains("  --> scene.spek:4:1\n")
                        .contains("4 | w = 3\n")
                        .contains("= help: declare a 'set' clause");
        assertEquals("validation:4:1: error: property 'w' has no setter", diagnostic.formatSimple());
    }

    @Test
    void withHelp_addsPrefixedNote() {
        var diagnostic = Diagnostic.error(Stage.LEX, "oops", SourceSpan.NONE)
                                   .withNote("first")
                                   .withHelp("second");

        assertThat(diagnostic.notes()).containsExactly("first", "help: second");
        assertThat(diagnostic.format("", null)).startsWith("error: oops\n");
        assertNull(diagnostic.code());
    }

    @Test
    void compileErrors_describeThemselves() {
        var lex = Spek.compile("var s = \"open\n").getLeft();
        var parse = Spek.compile("var = 1\n").getLeft();
        var validation = Spek.compile("x = 1\ny = 2\n").getLeft();

        assertInstanceOf(CompileError.LexError.class, lex);
        assertThat(lex.diagnostics()).hasSize(1);
        assertEquals("E0200", parse.diagnostics().get(0).code());
        assertThat(parse.diagnostics().get(0).notes()).anyMatch(note -> note.startsWith("expected "));
        assertThat(validation.message()).startsWith("2 validation errors");
        assertThat(validation.diagnostics()).hasSize(2);
    }

    @Test
    void limitAndRuntimeErrors_haveMessages() {
        assertEquals("State space exploration exceeded the limit of 10 states (10 discovered)",
                     new ExplorationLimitExceeded(10, 10).message());
        assertEquals("division: division by zero at 3:7",
                     new RuntimeFailure(1, "division", "division by zero",
                                        SourceSpan.at(SourceLocation.at(3, 7, 20))).message());
    }
}
