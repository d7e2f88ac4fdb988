package logsim.devices;

import java.util.List;

public record Switch(int id, boolean initialState) implements Device {

    @Override public DeviceKind kind() { return DeviceKind.SWITCH; }

    @Override public List<Integer> inputs() { return List.of(); }
}
