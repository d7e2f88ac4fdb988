package logsim.ast;

import logsim.lexer.Token;

public record Ident(int symbol, Token token) {
    public String text() { return token.lexeme(); }
}
