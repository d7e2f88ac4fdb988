package logsim.network;

public record SimulationConfig(
        int passesPerDevice,
        int minimumPasses
) {
    public SimulationConfig {
        if (passesPerDevice <= 0) throw new IllegalArgumentException("passesPerDevice must be positive");
        if (minimumPasses <= 0) throw new IllegalArgumentException("minimumPasses must be positive");
    }

    public static SimulationConfig defaults() {
        return new SimulationConfig(2, 10);
    }

    public int passLimit(int deviceCount) {
        return Math.max(minimumPasses, passesPerDevice * deviceCount);
    }
}
