package logsim.network;

@FunctionalInterface
public interface CycleListener {

    CycleListener NONE = (cycle, network) -> {};

    /** Called after cycle {@code cycle} (zero-based) has been committed. */
    void cycleCompleted(int cycle, Network network);
}
