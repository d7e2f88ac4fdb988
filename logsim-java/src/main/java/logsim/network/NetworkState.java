package logsim.network;

import logsim.devices.Signal;

import java.util.LinkedHashMap;
import java.util.Map;

final class NetworkState {
    final Map<Signal, Boolean> signals;
    final Map<Integer, Boolean> switches;
    final Map<Integer, Integer> counters;        // clock phase, RC countdown or generator position
    final Map<Integer, Boolean> previousInputs;  // last CLK of a flip-flop, last input of an RC timer

    NetworkState() {
        this(new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    private NetworkState(Map<Signal, Boolean> signals,
                         Map<Integer, Boolean> switches,
                         Map<Integer, Integer> counters,
                         Map<Integer, Boolean> previousInputs) {
        this.signals = signals;
        this.switches = switches;
        this.counters = counters;
        this.previousInputs = previousInputs;
    }

    NetworkState copy() {
        return new NetworkState(
                new LinkedHashMap<>(signals),
                new LinkedHashMap<>(switches),
                new LinkedHashMap<>(counters),
                new LinkedHashMap<>(previousInputs));
    }

    boolean signal(Signal s) {
        return signals.getOrDefault(s, false);
    }

    int counter(int device) {
        return counters.getOrDefault(device, 0);
    }

    boolean previousInput(int device) {
        return previousInputs.getOrDefault(device, false);
    }
}
