package logsim.devices;

import java.util.List;

public record LogicGate(int id, DeviceKind kind, List<Integer> inputs) implements Device {

    public LogicGate {
        if (!kind.isGate()) throw new IllegalArgumentException("Not a gate kind: " + kind);
        inputs = List.copyOf(inputs);
        if (inputs.isEmpty() || inputs.size() > DeviceKind.MAX_GATE_INPUTS) {
            throw new IllegalArgumentException("Gate input count out of range: " + inputs.size());
        }
        if (kind == DeviceKind.XOR && inputs.size() != 2) throw new IllegalArgumentException("XOR takes two inputs");
        if (kind == DeviceKind.NOT && inputs.size() != 1) throw new IllegalArgumentException("NOT takes one input");
    }

    public boolean evaluate(boolean[] in) {
        return switch (kind) {
            case AND -> all(in);
            case NAND -> !all(in);
            case OR -> any(in);
            case NOR -> !any(in);
            case XOR -> in[0] != in[1];
            case NOT -> !in[0];
            default -> throw new IllegalStateException("Not a gate kind: " + kind);
        };
    }

    private static boolean all(boolean[] in) {
        for (boolean b : in) if (!b) return false;
        return true;
    }

    private static boolean any(boolean[] in) {
        for (boolean b : in) if (b) return true;
        return false;
    }
}
