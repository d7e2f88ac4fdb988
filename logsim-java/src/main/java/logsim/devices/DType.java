package logsim.devices;

import java.util.List;

public record DType(int id, int data, int set, int clear, int clk, int q, int qbar) implements Device {

    @Override public DeviceKind kind() { return DeviceKind.DTYPE; }

    @Override public List<Integer> inputs() { return List.of(data, set, clear, clk); }

    @Override public List<Integer> outputs() { return List.of(q, qbar); }
}
