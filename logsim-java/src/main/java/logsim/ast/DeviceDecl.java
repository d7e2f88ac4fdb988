package logsim.ast;

import logsim.devices.DeviceKind;
import logsim.lexer.Token;

import java.util.List;

public record DeviceDecl(
        Ident name,
        DeviceKind kind,
        Token kindToken,
        List<Token> params
) {}
