package logsim.devices;

import java.util.List;

/** Replays a literal waveform, one bit per cycle, starting over after the last bit. */
public record SignalGenerator(int id, List<Boolean> waveform) implements Device {

    public SignalGenerator {
        waveform = List.copyOf(waveform);
        if (waveform.isEmpty()) throw new IllegalArgumentException("Waveform must not be empty");
    }

    @Override public DeviceKind kind() { return DeviceKind.SIGGEN; }

    @Override public List<Integer> inputs() { return List.of(); }

    public boolean bitAt(int position) {
        return waveform.get(position % waveform.size());
    }
}
