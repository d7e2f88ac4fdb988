package logsim.monitor;

import logsim.devices.Device;
import logsim.devices.DeviceTable;
import logsim.devices.Signal;
import logsim.network.CycleListener;
import logsim.network.Network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Monitors implements CycleListener {

    /** Monitored and not-yet-monitored output names, for a signal picker. */
    public record SignalNames(List<String> monitored, List<String> unmonitored) {}

    private final DeviceTable devices;
    private final Map<Signal, List<Boolean>> traces = new LinkedHashMap<>();

    public Monitors(DeviceTable devices) {
        this.devices = devices;
    }

    public Signal add(int deviceId, int pinId) {
        Signal s = new Signal(deviceId, pinId);
        Device d = devices.get(deviceId);
        if (d == null) {
            throw new MonitorException("Device '" + nameOf(deviceId) + "' is not defined");
        }
        if (!d.hasOutput(pinId)) {
            if (s.isUnnamed()) {
                throw new MonitorException("Device '" + nameOf(deviceId) + "' has several outputs; name one of them");
            }
            throw new MonitorException("'" + devices.signalName(s) + "' is not an output");
        }
        if (traces.containsKey(s)) {
            throw new MonitorException("'" + devices.signalName(s) + "' is already monitored");
        }
        traces.put(s, new ArrayList<>());
        return s;
    }

    public void remove(int deviceId, int pinId) {
        Signal s = new Signal(deviceId, pinId);
        if (traces.remove(s) == null) {
            throw new MonitorException("'" + nameOf(s) + "' is not monitored");
        }
    }

    public boolean isMonitored(Signal s) { return traces.containsKey(s); }

    public List<Signal> list() { return List.copyOf(traces.keySet()); }

    public List<Boolean> trace(Signal s) {
        List<Boolean> t = traces.get(s);
        if (t == null) throw new MonitorException("'" + nameOf(s) + "' is not monitored");
        return Collections.unmodifiableList(t);
    }

    public Map<Signal, List<Boolean>> traces() {
        Map<Signal, List<Boolean>> copy = new LinkedHashMap<>();
        traces.forEach((s, t) -> copy.put(s, List.copyOf(t)));
        return Collections.unmodifiableMap(copy);
    }

    public void sample(Network network) {
        traces.forEach((s, t) -> t.add(network.output(s)));
    }

    @Override
    public void cycleCompleted(int cycle, Network network) {
        sample(network);
    }

    public void clearTraces() {
        traces.values().forEach(List::clear);
    }

    public SignalNames signalNames() {
        List<String> monitored = new ArrayList<>();
        List<String> unmonitored = new ArrayList<>();
        for (Signal s : devices.outputSignals()) {
            (traces.containsKey(s) ? monitored : unmonitored).add(devices.signalName(s));
        }
        return new SignalNames(monitored, unmonitored);
    }

    /** One line per monitor, {@code _} for low and {@code -} for high, names padded to a common width. */
    public String formatTraces() {
        int width = 0;
        for (Signal s : traces.keySet()) width = Math.max(width, devices.signalName(s).length());

        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Signal, List<Boolean>> e : traces.entrySet()) {
            String name = devices.signalName(e.getKey());
            sb.append(name).append(" ".repeat(width - name.length())).append(" : ");
            for (boolean b : e.getValue()) sb.append(b ? '-' : '_');
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }

    private String nameOf(Signal s) {
        if (s.device() < 0 || devices.names().resolve(s.device()) == null) return s.toString();
        return devices.signalName(s);
    }

    private String nameOf(int deviceId) {
        String n = deviceId >= 0 ? devices.names().resolve(deviceId) : null;
        return n != null ? n : "#" + deviceId;
    }
}
