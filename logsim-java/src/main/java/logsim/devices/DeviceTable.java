package logsim.devices;

import logsim.sema.SymbolTable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Devices of one circuit keyed by name ID, in declaration order.
 * Also owns the symbol IDs of the fixed pin names (I1..I16, DATA, SET, CLEAR, CLK, Q, QBAR).
 */
public final class DeviceTable {
    private final SymbolTable names;
    private final Map<Integer, Device> devices = new LinkedHashMap<>();

    private final List<Integer> gateInputs;
    public final int dataPin;
    public final int setPin;
    public final int clearPin;
    public final int clkPin;
    public final int qPin;
    public final int qbarPin;

    public DeviceTable(SymbolTable names) {
        this.names = names;
        List<String> inputNames = new ArrayList<>();
        for (int i = 1; i <= DeviceKind.MAX_GATE_INPUTS; i++) inputNames.add("I" + i);
        this.gateInputs = List.copyOf(names.internAll(inputNames));

        List<Integer> dtypePins = names.internAll(List.of("DATA", "SET", "CLEAR", "CLK", "Q", "QBAR"));
        this.dataPin = dtypePins.get(0);
        this.setPin = dtypePins.get(1);
        this.clearPin = dtypePins.get(2);
        this.clkPin = dtypePins.get(3);
        this.qPin = dtypePins.get(4);
        this.qbarPin = dtypePins.get(5);
    }

    public SymbolTable names() { return names; }

    // ---------- factories ----------

    public LogicGate makeGate(int id, DeviceKind kind, int inputCount) {
        if (inputCount < 1 || inputCount > DeviceKind.MAX_GATE_INPUTS) {
            throw new IllegalArgumentException("Gate input count out of range: " + inputCount);
        }
        return add(new LogicGate(id, kind, gateInputs.subList(0, inputCount)));
    }

    public Switch makeSwitch(int id, boolean initialState) {
        return add(new Switch(id, initialState));
    }

    public Clock makeClock(int id, int halfPeriod) {
        return add(new Clock(id, halfPeriod));
    }

    public DType makeDType(int id) {
        return add(new DType(id, dataPin, setPin, clearPin, clkPin, qPin, qbarPin));
    }

    public RcTimer makeRc(int id, int period) {
        return add(new RcTimer(id, period, gateInputs.get(0)));
    }

    public SignalGenerator makeSignalGenerator(int id, List<Boolean> waveform) {
        return add(new SignalGenerator(id, waveform));
    }

    private <D extends Device> D add(D device) {
        if (devices.containsKey(device.id())) {
            throw new IllegalArgumentException("Device already defined: " + names.resolve(device.id()));
        }
        devices.put(device.id(), device);
        return device;
    }

    // ---------- queries ----------

    public Device get(int id) { return devices.get(id); }

    public boolean contains(int id) { return devices.containsKey(id); }

    public Collection<Device> all() { return Collections.unmodifiableCollection(devices.values()); }

    public int size() { return devices.size(); }

    /** IDs of the devices of {@code kind}, in declaration order. */
    public List<Integer> find(DeviceKind kind) {
        List<Integer> ids = new ArrayList<>();
        for (Device d : devices.values()) {
            if (d.kind() == kind) ids.add(d.id());
        }
        return ids;
    }

    /** Every output of every device, in declaration order. */
    public List<Signal> outputSignals() {
        List<Signal> out = new ArrayList<>();
        for (Device d : devices.values()) {
            for (int pin : d.outputs()) out.add(new Signal(d.id(), pin));
        }
        return out;
    }

    /** {@code "name"} for an unnamed pin, {@code "name.PIN"} otherwise. */
    public String signalName(Signal s) {
        String device = names.resolve(s.device());
        if (s.isUnnamed()) return device;
        return device + "." + names.resolve(s.pin());
    }

    /**
     * Looks up a signal written as {@code "name"} or {@code "name.PIN"}.
     * Empty when either name was never interned.
     */
    public Optional<Signal> parseSignal(String text) {
        int dot = text.indexOf('.');
        String device = dot < 0 ? text : text.substring(0, dot);
        Integer deviceId = names.query(device);
        if (deviceId == null) return Optional.empty();
        if (dot < 0) return Optional.of(Signal.of(deviceId));

        Integer pinId = names.query(text.substring(dot + 1));
        if (pinId == null) return Optional.empty();
        return Optional.of(new Signal(deviceId, pinId));
    }
}
