package logsim.parser;

import logsim.ast.Circuit;
import logsim.ast.ConnectionDecl;
import logsim.ast.DeviceDecl;
import logsim.ast.Ident;
import logsim.ast.MonitorDecl;
import logsim.ast.PinRef;
import logsim.devices.DeviceKind;
import logsim.diagnostics.Diagnostic;
import logsim.diagnostics.Diagnostics;
import logsim.diagnostics.Outcome;
import logsim.lexer.Lexer;
import logsim.lexer.Token;
import logsim.lexer.TokenType;
import logsim.sema.SymbolTable;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive-descent syntax pass over a circuit description.
 *
 * <p>Statement parsers return an {@link Outcome}. A failed statement is reported and the section loop
 * resynchronises at the next {@code ;}, {@code }}, section keyword or end of file, so one pass reports
 * every independent error. Range and reference checks are left to {@link logsim.sema.CircuitChecker}.
 */
public final class Parser {
    private static final Set<TokenType> STATEMENT_FOLLOW = EnumSet.of(
            TokenType.SEMICOLON, TokenType.RBRACE,
            TokenType.DEVICES, TokenType.CONNECTIONS, TokenType.MONITORS, TokenType.END,
            TokenType.EOF);

    private static final Set<TokenType> SECTION_KEYWORDS = EnumSet.of(
            TokenType.DEVICES, TokenType.CONNECTIONS, TokenType.MONITORS, TokenType.END);

    private final Lexer lexer;
    private final SymbolTable names;
    private final Diagnostics diagnostics;
    private final List<Token> buffer = new ArrayList<>();
    private Token previous;

    private final Set<Integer> brokenDevices = new LinkedHashSet<>();
    private final List<PinRef> abandonedTargets = new ArrayList<>();
    private boolean targetsKnown = true;

    public Parser(Lexer lexer, SymbolTable names, Diagnostics diagnostics) {
        this.lexer = lexer;
        this.names = names;
        this.diagnostics = diagnostics;
    }

    // ---------- entry ----------
    public Circuit parseCircuit() {
        List<DeviceDecl> devices = new ArrayList<>();
        List<ConnectionDecl> connections = new ArrayList<>();
        List<MonitorDecl> monitors = new ArrayList<>();

        if (check(TokenType.EOF)) {
            diagnostics.report(Diagnostic.syntax(peek(), "Circuit description is empty"));
        } else {
            parseSection(TokenType.DEVICES, this::parseDevice, devices);
            parseSection(TokenType.CONNECTIONS, this::parseConnection, connections);
            parseSection(TokenType.MONITORS, this::parseMonitor, monitors);
            parseEnd();
        }

        return new Circuit(devices, connections, monitors,
                Set.copyOf(brokenDevices), List.copyOf(abandonedTargets), targetsKnown);
    }

    // ---------- sections ----------
    private <T> void parseSection(TokenType keyword, Supplier<Outcome<T>> statement, List<T> into) {
        if (!openSection(keyword)) return;

        while (!check(TokenType.RBRACE) && !atSectionBoundary()) {
            Outcome<T> result = statement.get();
            if (result instanceof Outcome.Success<T> ok) {
                into.add(ok.value());
                expectTerminator();
            } else {
                diagnostics.report(((Outcome.Failure<T>) result).diagnostic());
                synchronize();
            }
        }

        if (!match(TokenType.RBRACE)) {
            diagnostics.report(unexpected(peek(), "Expected '}' to close the " + keyword + " section"));
        }
    }

    // returns false when the whole section is missing
    private boolean openSection(TokenType keyword) {
        skipStrayErrors();

        if (match(keyword)) {
            if (!match(TokenType.LBRACE)) {
                diagnostics.report(Diagnostic.syntaxAfter(previous, "Expected '{' after " + keyword));
            }
            return true;
        }

        Token at = peek();
        if (SECTION_KEYWORDS.contains(at.type()) || at.type() == TokenType.EOF) {
            diagnostics.report(unexpected(at, "Expected the " + keyword + " section"));
            return false;
        }

        diagnostics.report(unexpected(at, "Expected keyword " + keyword));
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LBRACE)) {
            // misspelt keyword
            advance();
            advance();
        } else {
            match(TokenType.LBRACE);
        }
        return true;
    }

    private void parseEnd() {
        skipStrayErrors();
        if (!match(TokenType.END)) {
            diagnostics.report(unexpected(peek(), "Expected END after the MONITORS section"));
        } else if (!check(TokenType.EOF)) {
            diagnostics.report(unexpected(peek(), "Unexpected text after END"));
        }
    }

    private void expectTerminator() {
        if (match(TokenType.SEMICOLON)) return;

        Token at = peek();
        if (at.type() == TokenType.ERROR) {
            diagnostics.report(unexpected(at, "Expected ';'"));
            synchronize();
            return;
        }
        diagnostics.report(Diagnostic.syntaxAfter(previous, "Expected ';' after statement"));
        // the next statement or the end of the section is already here
        if (at.type() == TokenType.IDENTIFIER || STATEMENT_FOLLOW.contains(at.type())) return;
        synchronize();
    }

    private void synchronize() {
        while (!STATEMENT_FOLLOW.contains(peek().type())) advance();
        match(TokenType.SEMICOLON);
    }

    private void skipStrayErrors() {
        while (check(TokenType.ERROR)) {
            diagnostics.report(unexpected(advance(), ""));
        }
    }

    // ---------- statements ----------
    private Outcome<DeviceDecl> parseDevice() {
        Token nameTok = peek();
        if (!check(TokenType.IDENTIFIER)) return fail(nameTok, "Expected a device name");
        advance();

        Ident name = ident(nameTok);
        Outcome<DeviceDecl> result = parseDeviceBody(name);
        if (!result.succeeded()) brokenDevices.add(name.symbol());
        return result;
    }

    private Outcome<DeviceDecl> parseDeviceBody(Ident name) {
        if (!match(TokenType.ASSIGN)) return fail(peek(), "Expected '=' after device name");

        Token kindTok = peek();
        if (!check(TokenType.IDENTIFIER)) return fail(kindTok, "Expected a device kind");
        DeviceKind kind = DeviceKind.lookup(kindTok.lexeme());
        if (kind == null) return fail(kindTok, "Unknown device kind");
        advance();

        List<Token> params = new ArrayList<>();
        if (match(TokenType.LPAREN)) {
            do {
                if (!check(TokenType.INT_LITERAL)) return fail(peek(), "Expected a number");
                params.add(advance());
            } while (match(TokenType.COMMA));
            if (!match(TokenType.RPAREN)) return fail(peek(), "Expected ')' after device parameters");
        }

        return Outcome.success(new DeviceDecl(name, kind, kindTok, params));
    }

    private Outcome<ConnectionDecl> parseConnection() {
        Outcome<PinRef> dst = parsePinRef("connection target");
        if (dst instanceof Outcome.Failure<PinRef> f) {
            targetsKnown = false;
            return Outcome.failure(f.diagnostic());
        }
        PinRef target = ((Outcome.Success<PinRef>) dst).value();

        if (!match(TokenType.ASSIGN)) {
            abandonedTargets.add(target);
            return fail(peek(), "Expected '=' after connection target");
        }

        Outcome<PinRef> src = parsePinRef("connection source");
        if (src instanceof Outcome.Failure<PinRef> f) {
            abandonedTargets.add(target);
            return Outcome.failure(f.diagnostic());
        }
        return Outcome.success(new ConnectionDecl(target, ((Outcome.Success<PinRef>) src).value()));
    }

    private Outcome<MonitorDecl> parseMonitor() {
        Outcome<PinRef> signal = parsePinRef("monitor");
        if (signal instanceof Outcome.Failure<PinRef> f) return Outcome.failure(f.diagnostic());
        return Outcome.success(new MonitorDecl(((Outcome.Success<PinRef>) signal).value()));
    }

    private Outcome<PinRef> parsePinRef(String what) {
        Token deviceTok = peek();
        if (!check(TokenType.IDENTIFIER)) return fail(deviceTok, "Expected a device name in " + what);
        advance();

        Ident pin = null;
        if (match(TokenType.DOT)) {
            Token pinTok = peek();
            if (!check(TokenType.IDENTIFIER)) return fail(pinTok, "Expected a pin name after '.'");
            advance();
            pin = ident(pinTok);
        }
        return Outcome.success(new PinRef(ident(deviceTok), pin));
    }

    // ---------- helpers ----------
    private Ident ident(Token t) {
        return new Ident(names.intern(t.lexeme()), t);
    }

    private <T> Outcome<T> fail(Token at, String msg) {
        return Outcome.failure(unexpected(at, msg));
    }

    // error tokens become lexical diagnostics whatever the parser was expecting
    private static Diagnostic unexpected(Token at, String msg) {
        return switch (at.type()) {
            case ERROR -> Diagnostic.lexical(at, "\"".equals(at.lexeme())
                    ? "Unterminated comment"
                    : "Unrecognised character '" + at.lexeme() + "'");
            case EOF -> Diagnostic.syntax(at, msg + ", found end of file");
            default -> Diagnostic.syntax(at, msg + ", found '" + at.lexeme() + "'");
        };
    }

    private boolean match(TokenType t) {
        if (check(t)) { advance(); return true; }
        return false;
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        return lookahead(1).type() == t;
    }

    private boolean atSectionBoundary() {
        TokenType t = peek().type();
        return SECTION_KEYWORDS.contains(t) || t == TokenType.EOF;
    }

    private Token advance() {
        Token t = peek();
        if (t.type() != TokenType.EOF) buffer.remove(0);
        previous = t;
        return t;
    }

    private Token peek() { return lookahead(0); }

    private Token lookahead(int k) {
        while (buffer.size() <= k) buffer.add(lexer.nextToken());
        return buffer.get(k);
    }
}
