package logsim.network;

import java.util.List;

public class OscillationException extends SimulationException {
    private final int cycle;
    private final List<String> unstableSignals;

    public OscillationException(int cycle, List<String> unstableSignals) {
        super("Network oscillating at cycle " + cycle + ": " + String.join(", ", unstableSignals));
        this.cycle = cycle;
        this.unstableSignals = List.copyOf(unstableSignals);
    }

    /** Zero-based index of the cycle that failed. */
    public int cycle() { return cycle; }

    public List<String> unstableSignals() { return unstableSignals; }
}
