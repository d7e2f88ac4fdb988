package logsim.devices;

import logsim.sema.SymbolTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class DeviceTableTest {

    private SymbolTable names;
    private DeviceTable devices;

    @BeforeEach
    void setUp() {
        names = new SymbolTable();
        devices = new DeviceTable(names);
    }

    @Test
    void pin_names_are_interned_up_front() {
        assertNotNull(names.query("I1"));
        assertNotNull(names.query("I16"));
        assertNull(names.query("I17"));
        assertEquals((int) names.query("QBAR"), devices.qbarPin);
    }

    @Test
    void make_gate_uses_leading_input_pins() {
        var g = devices.makeGate(names.intern("g"), DeviceKind.NAND, 3);
        assertEquals(names.internAll(List.of("I1", "I2", "I3")), g.inputs());
        assertEquals(List.of(Signal.NO_PIN), g.outputs());
    }

    @Test
    void make_gate_rejects_bad_arity() {
        int id = names.intern("g");
        assertThrows(IllegalArgumentException.class, () -> devices.makeGate(id, DeviceKind.AND, 17));
        assertThrows(IllegalArgumentException.class, () -> devices.makeGate(id, DeviceKind.XOR, 3));
        assertThrows(IllegalArgumentException.class, () -> devices.makeGate(id, DeviceKind.SWITCH, 1));
        assertFalse(devices.contains(id));
    }

    @Test
    void dtype_pins() {
        var ff = devices.makeDType(names.intern("ff"));
        assertTrue(ff.hasInput(devices.clkPin));
        assertTrue(ff.hasOutput(devices.qPin));
        assertFalse(ff.hasOutput(Signal.NO_PIN));
    }

    @Test
    void rc_reads_first_input_pin() {
        var rc = devices.makeRc(names.intern("rc"), 4);
        assertEquals(List.of(names.query("I1")), rc.inputs());
    }

    @Test
    void duplicate_device_rejected() {
        int id = names.intern("a");
        devices.makeSwitch(id, false);
        assertThrows(IllegalArgumentException.class, () -> devices.makeClock(id, 2));
    }

    @Test
    void clock_and_generator_validate_parameters() {
        assertThrows(IllegalArgumentException.class, () -> devices.makeClock(names.intern("c"), 0));
        assertThrows(IllegalArgumentException.class, () -> devices.makeSignalGenerator(names.intern("s"), List.of()));
    }

    @Test
    void find_by_kind_in_declaration_order() {
        devices.makeSwitch(names.intern("b"), false);
        devices.makeClock(names.intern("clk"), 1);
        devices.makeSwitch(names.intern("a"), true);
        assertEquals(List.of(names.query("b"), names.query("a")), devices.find(DeviceKind.SWITCH));
        assertEquals(3, devices.size());
    }

    @Test
    void output_signals_and_names() {
        devices.makeSwitch(names.intern("sw"), false);
        devices.makeDType(names.intern("ff"));
        var outputs = devices.outputSignals();
        assertEquals(3, outputs.size());
        assertEquals("sw", devices.signalName(outputs.get(0)));
        assertEquals("ff.Q", devices.signalName(outputs.get(1)));
        assertEquals("ff.QBAR", devices.signalName(outputs.get(2)));
    }

    @Test
    void parse_signal() {
        int ff = names.intern("ff");
        devices.makeDType(ff);
        assertEquals(Optional.of(new Signal(ff, devices.qPin)), devices.parseSignal("ff.Q"));
        assertEquals(Optional.of(Signal.of(ff)), devices.parseSignal("ff"));
        assertEquals(Optional.empty(), devices.parseSignal("nobody"));
        assertEquals(Optional.empty(), devices.parseSignal("ff.NOPE"));
    }

    @Test
    void gate_evaluation() {
        var xor = devices.makeGate(names.intern("x"), DeviceKind.XOR, 2);
        assertTrue(xor.evaluate(new boolean[] {true, false}));
        assertFalse(xor.evaluate(new boolean[] {true, true}));
        var nor = devices.makeGate(names.intern("n"), DeviceKind.NOR, 3);
        assertTrue(nor.evaluate(new boolean[] {false, false, false}));
        assertFalse(nor.evaluate(new boolean[] {false, true, false}));
    }

    @Test
    void signal_generator_wraps() {
        var sg = devices.makeSignalGenerator(names.intern("sg"), List.of(true, false));
        assertTrue(sg.bitAt(0));
        assertFalse(sg.bitAt(1));
        assertTrue(sg.bitAt(4));
    }

    @Test
    void kind_lookup() {
        assertEquals(DeviceKind.SIGGEN, DeviceKind.lookup("SIGGEN"));
        assertNull(DeviceKind.lookup("and"));
        assertTrue(DeviceKind.NOT.isGate());
        assertFalse(DeviceKind.NOT.hasConfigurableInputs());
        assertTrue(DeviceKind.NOR.hasConfigurableInputs());
        assertFalse(DeviceKind.DTYPE.isGate());
    }
}
