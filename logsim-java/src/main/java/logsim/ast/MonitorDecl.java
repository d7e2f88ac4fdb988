package logsim.ast;

public record MonitorDecl(PinRef signal) {}
