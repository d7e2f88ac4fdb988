package logsim.devices;

import java.util.List;

public record Clock(int id, int halfPeriod) implements Device {

    public Clock {
        if (halfPeriod <= 0) throw new IllegalArgumentException("Clock half period must be positive: " + halfPeriod);
    }

    @Override public DeviceKind kind() { return DeviceKind.CLOCK; }

    @Override public List<Integer> inputs() { return List.of(); }
}
