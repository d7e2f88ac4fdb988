package logsim.sema;

import logsim.ast.Circuit;
import logsim.ast.ConnectionDecl;
import logsim.ast.DeviceDecl;
import logsim.ast.Ident;
import logsim.ast.MonitorDecl;
import logsim.ast.PinRef;
import logsim.devices.Device;
import logsim.devices.DeviceKind;
import logsim.devices.DeviceTable;
import logsim.devices.Signal;
import logsim.diagnostics.Diagnostic;
import logsim.diagnostics.Diagnostics;
import logsim.diagnostics.Outcome;
import logsim.lexer.Token;
import logsim.monitor.MonitorException;
import logsim.monitor.Monitors;
import logsim.network.Network;
import logsim.network.SimulationConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Semantic pass: validates the declarations accepted by the parser and builds the device table,
 * the network wiring and the monitor set. Every problem becomes one diagnostic; references to
 * devices whose declaration already failed are not reported again.
 */
public final class CircuitChecker {

    public record Result(
            DeviceTable devices,
            Network network,
            Monitors monitors
    ) {}

    private final SymbolTable names;
    private final Diagnostics diagnostics;
    private final SimulationConfig config;

    private DeviceTable devices;
    private Network network;
    private Set<Integer> broken;
    private final Map<Integer, Token> declaredAt = new HashMap<>();

    public CircuitChecker(SymbolTable names, Diagnostics diagnostics, SimulationConfig config) {
        this.names = names;
        this.diagnostics = diagnostics;
        this.config = config;
    }

    public Result check(Circuit circuit) {
        devices = new DeviceTable(names);
        broken = new HashSet<>(circuit.brokenDevices());

        // 1) devices
        for (DeviceDecl d : circuit.devices()) {
            Outcome<Device> r = checkDevice(d);
            if (r instanceof Outcome.Failure<Device> f) {
                diagnostics.report(f.diagnostic());
                broken.add(d.name().symbol());
            } else {
                declaredAt.put(d.name().symbol(), d.name().token());
            }
        }

        // 2) connections
        network = new Network(devices, config);
        Set<Signal> attempted = new HashSet<>();
        for (PinRef target : circuit.abandonedTargets()) {
            if (target.pin() != null) attempted.add(new Signal(target.device().symbol(), target.pin().symbol()));
        }
        for (ConnectionDecl c : circuit.connections()) {
            if (involvesBroken(c.destination())) continue;
            Outcome<Signal> r = checkConnection(c, attempted);
            if (r instanceof Outcome.Failure<Signal> f) diagnostics.report(f.diagnostic());
        }

        // 3) inputs left without a driver
        if (circuit.targetsKnown()) {
            for (Signal open : network.unconnectedInputs()) {
                if (attempted.contains(open)) continue;
                diagnostics.report(Diagnostic.semantic(declaredAt.get(open.device()),
                        "Input '" + devices.signalName(open) + "' is not connected"));
            }
        }

        // 4) monitors
        Monitors monitors = new Monitors(devices);
        for (MonitorDecl m : circuit.monitors()) {
            PinRef ref = m.signal();
            if (involvesBroken(ref)) continue;
            if (!devices.contains(ref.device().symbol())) {
                diagnostics.report(undefined(ref.device()));
                continue;
            }
            try {
                monitors.add(ref.device().symbol(), pinOf(ref));
            } catch (MonitorException e) {
                Token at = ref.pin() != null ? ref.pin().token() : ref.device().token();
                diagnostics.report(Diagnostic.semantic(at, e.getMessage()));
            }
        }

        return new Result(devices, network, monitors);
    }

    // ---------- devices ----------
    private Outcome<Device> checkDevice(DeviceDecl d) {
        Ident name = d.name();
        if (devices.contains(name.symbol()) || broken.contains(name.symbol())) {
            return semantic(name.token(), "Device '" + name.text() + "' is already defined");
        }
        if (DeviceKind.lookup(name.text()) != null) {
            return semantic(name.token(), "'" + name.text() + "' is a device kind and cannot name a device");
        }

        List<Token> ps = d.params();
        Token at = ps.isEmpty() ? d.kindToken() : ps.get(0);
        int id = name.symbol();
        DeviceKind kind = d.kind();

        if (kind.hasConfigurableInputs()) {
            if (ps.size() != 1) return semantic(at, kind + " takes exactly one parameter, its number of inputs");
            int n = number(ps.get(0));
            if (n < 1 || n > DeviceKind.MAX_GATE_INPUTS) {
                return semantic(at, "Number of inputs must be between 1 and " + DeviceKind.MAX_GATE_INPUTS);
            }
            return Outcome.success(devices.makeGate(id, kind, n));
        }

        switch (kind) {
            case XOR, NOT -> {
                if (!ps.isEmpty()) return semantic(at, kind + " takes no parameters");
                return Outcome.success(devices.makeGate(id, kind, kind == DeviceKind.XOR ? 2 : 1));
            }
            case DTYPE -> {
                if (!ps.isEmpty()) return semantic(at, "DTYPE takes no parameters");
                return Outcome.success(devices.makeDType(id));
            }
            case SWITCH -> {
                if (ps.size() != 1) return semantic(at, "SWITCH takes exactly one parameter, its initial state");
                int s = number(ps.get(0));
                if (s != 0 && s != 1) return semantic(at, "Switch state must be 0 or 1");
                return Outcome.success(devices.makeSwitch(id, s == 1));
            }
            case CLOCK -> {
                if (ps.size() != 1) return semantic(at, "CLOCK takes exactly one parameter, its half period");
                int h = number(ps.get(0));
                if (h < 1) return semantic(at, "Clock half period must be a positive number of cycles");
                return Outcome.success(devices.makeClock(id, h));
            }
            case RC -> {
                if (ps.size() != 1) return semantic(at, "RC takes exactly one parameter, its period");
                int p = number(ps.get(0));
                if (p < 1) return semantic(at, "RC period must be a positive number of cycles");
                return Outcome.success(devices.makeRc(id, p));
            }
            case SIGGEN -> {
                if (ps.isEmpty()) return semantic(at, "SIGGEN needs a waveform of 0s and 1s");
                List<Boolean> wave = new ArrayList<>();
                for (Token t : ps) {
                    int b = number(t);
                    if (b != 0 && b != 1) return semantic(t, "Waveform values must be 0 or 1");
                    wave.add(b == 1);
                }
                return Outcome.success(devices.makeSignalGenerator(id, wave));
            }
            default -> throw new IllegalStateException("Unhandled device kind: " + kind);
        }
    }

    // ---------- connections ----------
    private Outcome<Signal> checkConnection(ConnectionDecl c, Set<Signal> attempted) {
        PinRef dstRef = c.destination();
        PinRef srcRef = c.source();

        Device dst = devices.get(dstRef.device().symbol());
        if (dst == null) return Outcome.failure(undefined(dstRef.device()));

        if (dstRef.pin() == null) {
            return semantic(dstRef.device().token(), "Connection target '" + dstRef.text() + "' must name an input pin");
        }
        Signal input = new Signal(dst.id(), dstRef.pin().symbol());
        if (!dst.hasInput(input.pin())) {
            if (dst.hasOutput(input.pin())) {
                return semantic(dstRef.pin().token(), "'" + dstRef.text() + "' is an output and cannot be driven");
            }
            return semantic(dstRef.pin().token(), "Device '" + dstRef.device().text() + "' has no input '" + dstRef.pin().text() + "'");
        }
        attempted.add(input);
        // the source's own declaration already has its diagnostic
        if (involvesBroken(srcRef)) return Outcome.success(input);

        Device src = devices.get(srcRef.device().symbol());
        if (src == null) return Outcome.failure(undefined(srcRef.device()));

        Signal output = new Signal(src.id(), pinOf(srcRef));
        if (!src.hasOutput(output.pin())) {
            if (srcRef.pin() == null) {
                return semantic(srcRef.device().token(), "Device '" + srcRef.text() + "' has several outputs; name Q or QBAR");
            }
            if (src.hasInput(output.pin())) {
                return semantic(srcRef.pin().token(), "'" + srcRef.text() + "' is an input and cannot drive a connection");
            }
            return semantic(srcRef.pin().token(), "Device '" + srcRef.device().text() + "' has no output '" + srcRef.pin().text() + "'");
        }

        if (network.isConnected(input)) {
            return semantic(dstRef.pin().token(), "Input '" + dstRef.text() + "' is already connected");
        }
        network.connect(output, input);
        return Outcome.success(input);
    }

    // ---------- helpers ----------
    // a failed redeclaration does not hide the device that was declared first
    private boolean involvesBroken(PinRef ref) {
        int id = ref.device().symbol();
        return broken.contains(id) && !devices.contains(id);
    }

    private static int pinOf(PinRef ref) {
        return ref.pin() == null ? Signal.NO_PIN : ref.pin().symbol();
    }

    private static Diagnostic undefined(Ident device) {
        return Diagnostic.semantic(device.token(), "Device '" + device.text() + "' is not defined");
    }

    private static <T> Outcome<T> semantic(Token at, String msg) {
        return Outcome.failure(Diagnostic.semantic(at, msg));
    }

    // out-of-range literals map to -1 so the range checks reject them
    private static int number(Token t) {
        try {
            return Integer.parseInt(t.lexeme());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
