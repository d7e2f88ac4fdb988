package logsim.session;

import logsim.devices.DeviceTable;
import logsim.devices.Signal;
import logsim.monitor.MonitorException;
import logsim.monitor.Monitors;
import logsim.network.Network;
import logsim.network.OscillationException;
import logsim.sema.SymbolTable;

public final class Simulation {
    private final SymbolTable names;
    private final DeviceTable devices;
    private final Network network;
    private final Monitors monitors;

    Simulation(SymbolTable names, DeviceTable devices, Network network, Monitors monitors) {
        this.names = names;
        this.devices = devices;
        this.network = network;
        this.monitors = monitors;
    }

    public SymbolTable names() { return names; }

    public DeviceTable devices() { return devices; }

    public Network network() { return network; }

    public Monitors monitors() { return monitors; }

    /** Back to cycle 0 with switch settings restored and empty traces. */
    public void reset() {
        network.reset();
        monitors.clearTraces();
    }

    /** Resets, then advances {@code cycles}. */
    public void run(int cycles) throws OscillationException {
        reset();
        advance(cycles);
    }

    /**
     * Advances {@code cycles} from the current state, sampling monitors after each one.
     * On oscillation the cycles completed before the failing one are kept.
     */
    public void advance(int cycles) throws OscillationException {
        network.step(cycles, monitors);
    }

    public void setSwitch(String name, boolean value) {
        Integer id = names.query(name);
        if (id == null || !devices.contains(id)) {
            throw new IllegalArgumentException("Device '" + name + "' is not defined");
        }
        network.setSwitch(id, value);
    }

    public Signal monitor(String signalName) {
        Signal s = signal(signalName);
        return monitors.add(s.device(), s.pin());
    }

    public void unmonitor(String signalName) {
        Signal s = signal(signalName);
        monitors.remove(s.device(), s.pin());
    }

    private Signal signal(String signalName) {
        return devices.parseSignal(signalName)
                .filter(s -> devices.contains(s.device()))
                .orElseThrow(() -> new MonitorException("Unknown signal '" + signalName + "'"));
    }
}
