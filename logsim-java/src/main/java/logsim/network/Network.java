package logsim.network;

import logsim.devices.Clock;
import logsim.devices.DType;
import logsim.devices.Device;
import logsim.devices.DeviceTable;
import logsim.devices.LogicGate;
import logsim.devices.RcTimer;
import logsim.devices.Signal;
import logsim.devices.SignalGenerator;
import logsim.devices.Switch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wiring of a circuit plus its running state.
 *
 * <p>A cycle runs in three phases:
 * <ol>
 *   <li>clocks advance their phase and toggle on reaching the half period;</li>
 *   <li>stateful devices: flip-flops and RC timers read their inputs as they stand after phase 1
 *       and update their outputs together, signal generators emit their next bit;</li>
 *   <li>switches take their setting, then gates run simultaneous passes until no output changes,
 *       bounded by {@link SimulationConfig#passLimit(int)}.</li>
 * </ol>
 * A switch flipped between cycles is therefore seen by flip-flops and RC timers one cycle after gates.
 * Each cycle is computed on a copy of the state and committed only when it settles.
 */
public final class Network {
    private static final Logger log = LoggerFactory.getLogger(Network.class);

    private final DeviceTable devices;
    private final SimulationConfig config;
    private final Map<Signal, Signal> drivers = new LinkedHashMap<>(); // input -> driving output

    private NetworkState state;
    private int cycle;

    public Network(DeviceTable devices, SimulationConfig config) {
        this.devices = devices;
        this.config = config;
        reset();
    }

    public DeviceTable devices() { return devices; }

    // ---------- wiring ----------

    public void connect(Signal source, Signal destination) {
        Device src = requireDevice(source.device());
        Device dst = requireDevice(destination.device());
        if (!src.hasOutput(source.pin())) {
            throw new IllegalArgumentException(devices.signalName(source) + " is not an output");
        }
        if (!dst.hasInput(destination.pin())) {
            throw new IllegalArgumentException(devices.signalName(destination) + " is not an input");
        }
        if (drivers.containsKey(destination)) {
            throw new IllegalArgumentException(devices.signalName(destination) + " is already connected");
        }
        drivers.put(destination, source);
    }

    public boolean isConnected(Signal input) { return drivers.containsKey(input); }

    /** The output driving {@code input}, or null when it is unconnected. */
    public Signal driverOf(Signal input) { return drivers.get(input); }

    public Map<Signal, Signal> connections() { return Collections.unmodifiableMap(drivers); }

    public List<Signal> unconnectedInputs() {
        List<Signal> open = new ArrayList<>();
        for (Device d : devices.all()) {
            for (int pin : d.inputs()) {
                Signal in = new Signal(d.id(), pin);
                if (!drivers.containsKey(in)) open.add(in);
            }
        }
        return open;
    }

    // ---------- state ----------

    public void reset() {
        NetworkState fresh = new NetworkState();
        for (Device d : devices.all()) {
            for (int pin : d.outputs()) fresh.signals.put(new Signal(d.id(), pin), false);
            if (d instanceof Switch s) {
                fresh.switches.put(s.id(), s.initialState());
                fresh.signals.put(Signal.of(s.id()), s.initialState());
            } else if (d instanceof DType ff) {
                fresh.signals.put(new Signal(ff.id(), ff.qbar()), true);
            }
        }
        state = fresh;
        cycle = 0;
    }

    public void setSwitch(int deviceId, boolean value) {
        if (!(devices.get(deviceId) instanceof Switch)) {
            throw new IllegalArgumentException("Not a switch: " + devices.names().resolve(deviceId));
        }
        state.switches.put(deviceId, value);
    }

    public boolean switchState(int deviceId) {
        Boolean v = state.switches.get(deviceId);
        if (v == null) throw new IllegalArgumentException("Not a switch: " + devices.names().resolve(deviceId));
        return v;
    }

    /** Number of cycles completed since the last reset. */
    public int cycle() { return cycle; }

    public boolean output(Signal output) {
        Boolean v = state.signals.get(output);
        if (v == null) throw new IllegalArgumentException("Unknown output: " + output);
        return v;
    }

    /** Value currently seen on {@code input}, i.e. the value of its driver. */
    public boolean inputValue(Signal input) {
        Signal src = drivers.get(input);
        if (src == null) throw new IllegalStateException("Input not connected: " + devices.signalName(input));
        return state.signal(src);
    }

    public Map<Signal, Boolean> getDeviceOutputs() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(state.signals));
    }

    // ---------- stepping ----------

    public void step(int cycles) throws OscillationException {
        step(cycles, CycleListener.NONE);
    }

    public void step(int cycles, CycleListener listener) throws OscillationException {
        if (cycles < 0) throw new IllegalArgumentException("cycles must be non-negative: " + cycles);
        List<Signal> open = unconnectedInputs();
        if (!open.isEmpty()) {
            throw new IllegalStateException("Unconnected input: " + devices.signalName(open.get(0)));
        }

        for (int i = 0; i < cycles; i++) {
            NetworkState next = state.copy();
            int passes = execute(next);
            state = next;
            log.debug("Cycle {} settled after {} passes", cycle, passes);
            int completed = cycle++;
            listener.cycleCompleted(completed, this);
        }
    }

    // returns the number of gate passes needed
    private int execute(NetworkState next) throws OscillationException {
        updateClocks(next);
        updateStateful(next);
        return settleGates(next);
    }

    private void updateClocks(NetworkState next) {
        for (Device d : devices.all()) {
            if (!(d instanceof Clock c)) continue;
            int phase = next.counter(c.id()) + 1;
            if (phase >= c.halfPeriod()) {
                Signal out = Signal.of(c.id());
                next.signals.put(out, !next.signal(out));
                phase = 0;
            }
            next.counters.put(c.id(), phase);
        }
    }

    private void updateStateful(NetworkState next) {
        // staged so that chained flip-flops see each other's pre-edge values
        Map<Signal, Boolean> staged = new LinkedHashMap<>();
        for (Device d : devices.all()) {
            if (d instanceof DType ff) {
                boolean clk = read(next, ff.id(), ff.clk());
                boolean rising = clk && !next.previousInput(ff.id());
                next.previousInputs.put(ff.id(), clk);

                boolean q = next.signal(new Signal(ff.id(), ff.q()));
                if (read(next, ff.id(), ff.clear())) q = false;
                else if (read(next, ff.id(), ff.set())) q = true;
                else if (rising) q = read(next, ff.id(), ff.data());

                staged.put(new Signal(ff.id(), ff.q()), q);
                staged.put(new Signal(ff.id(), ff.qbar()), !q);
            } else if (d instanceof RcTimer rc) {
                boolean in = read(next, rc.id(), rc.input());
                int remaining = next.counter(rc.id());
                if (in && !next.previousInput(rc.id())) remaining = rc.period();
                next.previousInputs.put(rc.id(), in);

                boolean out;
                if (remaining > 0) {
                    out = false;
                    remaining--;
                } else {
                    out = in;
                }
                next.counters.put(rc.id(), remaining);
                staged.put(Signal.of(rc.id()), out);
            } else if (d instanceof SignalGenerator g) {
                int position = next.counter(g.id());
                staged.put(Signal.of(g.id()), g.bitAt(position));
                next.counters.put(g.id(), (position + 1) % g.waveform().size());
            }
        }
        next.signals.putAll(staged);
    }

    private int settleGates(NetworkState next) throws OscillationException {
        for (Device d : devices.all()) {
            if (d instanceof Switch s) next.signals.put(Signal.of(s.id()), next.switches.get(s.id()));
        }

        int limit = config.passLimit(devices.size());
        Map<Signal, Boolean> changed = Map.of();

        for (int pass = 1; pass <= limit; pass++) {
            changed = new LinkedHashMap<>();
            for (Device d : devices.all()) {
                if (!(d instanceof LogicGate g)) continue;
                boolean[] in = new boolean[g.inputs().size()];
                for (int i = 0; i < in.length; i++) in[i] = read(next, g.id(), g.inputs().get(i));

                Signal out = Signal.of(g.id());
                boolean value = g.evaluate(in);
                if (value != next.signal(out)) changed.put(out, value);
            }
            if (changed.isEmpty()) return pass;
            next.signals.putAll(changed);
        }

        List<String> unstable = new ArrayList<>();
        for (Signal s : changed.keySet()) unstable.add(devices.signalName(s));
        log.warn("Cycle {} did not settle within {} passes; unstable: {}", cycle, limit, unstable);
        throw new OscillationException(cycle, unstable);
    }

    private boolean read(NetworkState s, int device, int pin) {
        return s.signal(drivers.get(new Signal(device, pin)));
    }

    private Device requireDevice(int id) {
        Device d = devices.get(id);
        if (d == null) throw new IllegalArgumentException("Unknown device id: " + id);
        return d;
    }
}
