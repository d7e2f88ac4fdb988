package logsim.devices;

import java.util.List;

public sealed interface Device permits LogicGate, Switch, Clock, DType, RcTimer, SignalGenerator {

    int id();

    DeviceKind kind();

    /** Input pin IDs in declaration order. */
    List<Integer> inputs();

    /** Output pin IDs; {@link Signal#NO_PIN} for a single unnamed output. */
    default List<Integer> outputs() { return List.of(Signal.NO_PIN); }

    default boolean hasInput(int pin) { return inputs().contains(pin); }

    default boolean hasOutput(int pin) { return outputs().contains(pin); }
}
