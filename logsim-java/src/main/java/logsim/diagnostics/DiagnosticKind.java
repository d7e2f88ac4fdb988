package logsim.diagnostics;

public enum DiagnosticKind {
    LEXICAL("Lexical error"),
    SYNTAX("Syntax error"),
    SEMANTIC("Semantic error");

    private final String label;

    DiagnosticKind(String label) { this.label = label; }

    public String label() { return label; }
}
