package org.pragmatica.scad.error;

import org.pragmatica.scad.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic reported either by the CST producer or while building the AST.
 *
 * <p>Example output of {@link #format(String, String)}:
 * <pre>
 * error[syntax]: missing ';'
 *   --> model.scad:3:12
 *    |
 *  3 | cube(10)
 *    |         ^
 *    |
 * </pre>
 *
 * @param severity Error severity level
 * @param code     Optional short code, {@code null} when absent
 * @param message  Primary message
 * @param span     Source span where the problem was found
 * @param notes    Additional notes or suggestions
 */
public record ParseError(Severity severity, String code, String message, SourceSpan span, List<String> notes) {

    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("info"),
        HINT("hint");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static ParseError error(String message, SourceSpan span) {
        return new ParseError(Severity.ERROR, null, message, span, List.of());
    }

    public static ParseError error(String code, String message, SourceSpan span) {
        return new ParseError(Severity.ERROR, code, message, span, List.of());
    }

    public static ParseError warning(String message, SourceSpan span) {
        return new ParseError(Severity.WARNING, null, message, span, List.of());
    }

    public ParseError withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new ParseError(severity, code, message, span, List.copyOf(newNotes));
    }

    public ParseError withHelp(String help) {
        return withNote("help: " + help);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Zero-based line of the start of the problem.
     */
    public int line() {
        return span.start().line();
    }

    /**
     * Zero-based column of the start of the problem.
     */
    public int column() {
        return span.start().column();
    }

    /**
     * Format in Rust style. Lines and columns are shown one-based.
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append(severity.display());
        if (code != null) {
            sb.append("[").append(code).append("]");
        }
        sb.append(": ").append(message).append("\n");

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(line() + 1).append(":").append(column() + 1).append("\n");

        int firstLine = span.start().line();
        int lastLine = span.end().line();
        int gutterWidth = String.valueOf(lastLine + 1).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        for (int lineNum = firstLine; lineNum <= lastLine && lineNum < lines.length; lineNum++) {
            var lineContent = lines[lineNum];
            sb.append(String.format("%" + gutterWidth + "d", lineNum + 1))
              .append(" | ")
              .append(lineContent)
              .append("\n");

            int startCol = lineNum == firstLine ? span.start().column() : 0;
            int endCol = lineNum == lastLine ? span.end().column() : lineContent.length();
            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(" ".repeat(startCol))
              .append("^".repeat(Math.max(1, endCol - startCol)))
              .append("\n");
        }
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple() {
        return String.format("%s:%d:%d: %s: %s", "input", line() + 1, column() + 1, severity.display(), message);
    }
}
