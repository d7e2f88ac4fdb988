package logsim.lexer;

import java.util.*;

public class Lexer {

    private final String source;

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("DEVICES", TokenType.DEVICES),
            Map.entry("CONNECTIONS", TokenType.CONNECTIONS),
            Map.entry("MONITORS", TokenType.MONITORS),
            Map.entry("END", TokenType.END)
    );

    public Lexer(String source) {
        this.source = source;
    }

    public Token nextToken() {
        while (true) {
            skipWhitespace();
            if (isAtEnd()) return new Token(TokenType.EOF, "", line, col);

            int startLine = line;
            int startCol = col;
            char c = advance();

            switch (c) {
                case '(' -> { return token(TokenType.LPAREN, "(", startLine, startCol); }
                case ')' -> { return token(TokenType.RPAREN, ")", startLine, startCol); }
                case '{' -> { return token(TokenType.LBRACE, "{", startLine, startCol); }
                case '}' -> { return token(TokenType.RBRACE, "}", startLine, startCol); }
                case ',' -> { return token(TokenType.COMMA, ",", startLine, startCol); }
                case ';' -> { return token(TokenType.SEMICOLON, ";", startLine, startCol); }
                case '=' -> { return token(TokenType.ASSIGN, "=", startLine, startCol); }
                case '.' -> { return token(TokenType.DOT, ".", startLine, startCol); }

                case '#' -> skipLineComment();

                case '"' -> {
                    if (!skipBlockComment()) {
                        return token(TokenType.ERROR, "\"", startLine, startCol);
                    }
                }

                default -> {
                    if (isDigit(c)) return numberLiteral(c, startLine, startCol);
                    if (isAlpha(c)) return identifier(c, startLine, startCol);
                    return token(TokenType.ERROR, String.valueOf(c), startLine, startCol);
                }
            }
        }
    }

    /** Drains the remaining tokens, EOF included. */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token t;
        do {
            t = nextToken();
            tokens.add(t);
        } while (t.type() != TokenType.EOF);
        return tokens;
    }

    // ================= helpers =================

    private Token numberLiteral(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        return token(TokenType.INT_LITERAL, sb.toString(), line, col);
    }

    private Token identifier(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }

        String text = sb.toString();
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        return token(type, text, line, col);
    }

    // returns false when the closing quote is missing
    private boolean skipBlockComment() {
        while (!isAtEnd() && peek() != '"') advance();
        if (isAtEnd()) return false;
        advance(); // closing "
        return true;
    }

    private void skipLineComment() {
        while (!isAtEnd() && peek() != '\n') advance();
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) advance();
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static Token token(TokenType type, String lexeme, int line, int col) {
        return new Token(type, lexeme, line, col);
    }
}
