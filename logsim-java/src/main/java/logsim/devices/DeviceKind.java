package logsim.devices;

import java.util.Map;

public enum DeviceKind {
    SWITCH,
    CLOCK,
    AND,
    OR,
    NAND,
    NOR,
    XOR,
    NOT,
    DTYPE,
    RC,
    SIGGEN;

    public static final int MAX_GATE_INPUTS = 16;

    private static final Map<String, DeviceKind> byKeyword = Map.ofEntries(
            Map.entry("SWITCH", SWITCH),
            Map.entry("CLOCK", CLOCK),
            Map.entry("AND", AND),
            Map.entry("OR", OR),
            Map.entry("NAND", NAND),
            Map.entry("NOR", NOR),
            Map.entry("XOR", XOR),
            Map.entry("NOT", NOT),
            Map.entry("DTYPE", DTYPE),
            Map.entry("RC", RC),
            Map.entry("SIGGEN", SIGGEN)
    );

    /** Returns the kind spelled {@code word} in a description file, or null. */
    public static DeviceKind lookup(String word) {
        return byKeyword.get(word);
    }

    public boolean isGate() {
        return switch (this) {
            case AND, OR, NAND, NOR, XOR, NOT -> true;
            default -> false;
        };
    }

    /** Gates whose input count is given in the description. */
    public boolean hasConfigurableInputs() {
        return switch (this) {
            case AND, OR, NAND, NOR -> true;
            default -> false;
        };
    }
}
