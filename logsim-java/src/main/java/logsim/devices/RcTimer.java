package logsim.devices;

import java.util.List;

public record RcTimer(int id, int period, int input) implements Device {

    public RcTimer {
        if (period <= 0) throw new IllegalArgumentException("RC period must be positive: " + period);
    }

    @Override public DeviceKind kind() { return DeviceKind.RC; }

    @Override public List<Integer> inputs() { return List.of(input); }
}
