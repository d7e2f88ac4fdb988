package logsim.lexer;

public enum TokenType {

    // literals
    IDENTIFIER,
    INT_LITERAL,

    // keywords
    DEVICES,
    CONNECTIONS,
    MONITORS,
    END,

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    COMMA, SEMICOLON,
    ASSIGN, DOT,

    ERROR,
    EOF
}
