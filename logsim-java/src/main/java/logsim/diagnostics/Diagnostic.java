package logsim.diagnostics;

import logsim.lexer.Token;

import java.util.Comparator;

public record Diagnostic(DiagnosticKind kind, int line, int column, String message) {

    public static final Comparator<Diagnostic> BY_POSITION =
            Comparator.comparingInt(Diagnostic::line).thenComparingInt(Diagnostic::column);

    public static Diagnostic lexical(Token at, String message) {
        return new Diagnostic(DiagnosticKind.LEXICAL, at.line(), at.column(), message);
    }

    public static Diagnostic syntax(Token at, String message) {
        return new Diagnostic(DiagnosticKind.SYNTAX, at.line(), at.column(), message);
    }

    /** Points just past the end of {@code after}, for things that are missing rather than wrong. */
    public static Diagnostic syntaxAfter(Token after, String message) {
        return new Diagnostic(DiagnosticKind.SYNTAX, after.line(), after.column() + after.lexeme().length(), message);
    }

    public static Diagnostic semantic(Token at, String message) {
        return new Diagnostic(DiagnosticKind.SEMANTIC, at.line(), at.column(), message);
    }

    public String format() {
        return "[" + line + ":" + column + "] " + kind.label() + ": " + message;
    }

    /**
     * Formats the diagnostic followed by the offending source line and a caret under the column.
     * Falls back to {@link #format()} when the line is not part of {@code source}.
     */
    public String render(String source) {
        String[] lines = source.split("\r?\n", -1);
        if (line < 1 || line > lines.length) return format();

        String text = lines[line - 1];
        StringBuilder marker = new StringBuilder();
        for (int i = 1; i < column && i <= text.length(); i++) {
            marker.append(text.charAt(i - 1) == '\t' ? '\t' : ' ');
        }
        marker.append('^');
        return format() + System.lineSeparator() + text + System.lineSeparator() + marker;
    }

    @Override
    public String toString() { return format(); }
}
