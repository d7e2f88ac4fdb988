package logsim.devices;

public record Signal(int device, int pin) {
    public static final int NO_PIN = -1;

    public static Signal of(int device) { return new Signal(device, NO_PIN); }

    public boolean isUnnamed() { return pin == NO_PIN; }
}
