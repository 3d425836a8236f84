package org.pragmatica.spek.error;

import org.pragmatica.spek.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured compiler diagnostic: stage, position and message, rendered Rust-style on demand.
 *
 * <p>Example output:
 * <pre>
 * error[E0302]: property 'colour' has no setter
 *   --> scene.spek:7:5
 *    |
 *  7 |     colour = 3
 *    |     ^^^^^^
 *    |
 *    = help: declare a 'set' clause or assign the backing field
 * </pre>
 *
 * @param stage    Pipeline stage that reported the problem
 * @param code     Optional error code (e.g., "E0302"), may be null
 * @param message  Primary message
 * @param span     Source span the message refers to
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
    Stage stage,
    String code,
    String message,
    SourceSpan span,
    List<String> notes
) {
    public Diagnostic {
        notes = List.copyOf(notes);
    }

    private static final String LEVEL = "error";

    public static Diagnostic error(Stage stage, String message, SourceSpan span) {
        return new Diagnostic(stage, null, message, span, List.of());
    }

    public static Diagnostic error(Stage stage, String code, String message, SourceSpan span) {
        return new Diagnostic(stage, code, message, span, List.of());
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(stage, code, message, span, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic against the source it was produced for.
     *
     * @param source   The source text
     * @param filename Optional filename for display, may be null
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append(LEVEL);
        if (code != null) {
            sb.append("[").append(code).append("]");
        }
        sb.append(": ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int firstLine = span.start().line();
        int lastLine = Math.max(firstLine, span.end().line());
        int gutterWidth = String.valueOf(lastLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        for (int lineNum = firstLine; lineNum <= lastLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) continue;

            var lineContent = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(underline(lineNum, lineContent))
              .append("\n");
        }
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    private String underline(int lineNum, String lineContent) {
        int startCol = span.start().line() == lineNum ? span.start().column() : 1;
        int endCol = span.end().line() == lineNum ? span.end().column() : lineContent.length() + 1;
        return " ".repeat(Math.max(0, startCol - 1)) + "^".repeat(Math.max(1, endCol - startCol));
    }

    /**
     * Single-line format: {@code stage:line:column: error: message}.
     */
    public String formatSimple() {
        var loc = span.start();
        return String.format("%s:%d:%d: %s: %s", stage.display(), loc.line(), loc.column(), LEVEL, message);
    }
}
