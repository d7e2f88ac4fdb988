package logsim.ast;

public record ConnectionDecl(PinRef destination, PinRef source) {}
