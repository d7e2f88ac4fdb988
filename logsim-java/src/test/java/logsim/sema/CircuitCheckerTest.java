package logsim.sema;

import logsim.devices.DeviceKind;
import logsim.diagnostics.Diagnostic;
import logsim.diagnostics.DiagnosticKind;
import logsim.diagnostics.Diagnostics;
import logsim.lexer.Lexer;
import logsim.network.SimulationConfig;
import logsim.parser.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class CircuitCheckerTest {

    private record Checked(CircuitChecker.Result result, List<Diagnostic> diagnostics) {
        List<String> messages() {
            return diagnostics.stream().map(Diagnostic::message).toList();
        }
    }

    private static Checked check(String src) {
        var names = new SymbolTable();
        var diagnostics = new Diagnostics();
        var circuit = new Parser(new Lexer(src), names, diagnostics).parseCircuit();
        var result = new CircuitChecker(names, diagnostics, SimulationConfig.defaults()).check(circuit);
        return new Checked(result, diagnostics.items());
    }

    private static Checked check(String devices, String connections, String monitors) {
        return check("DEVICES {" + devices + "} CONNECTIONS {" + connections + "} MONITORS {" + monitors + "} END");
    }

    private static final String FLIP_FLOP = """
            d = SWITCH(1); s = SWITCH(0); c = SWITCH(0); clk = CLOCK(1); ff = DTYPE;
            """;
    private static final String FLIP_FLOP_WIRING = """
            ff.DATA = d; ff.SET = s; ff.CLEAR = c; ff.CLK = clk;
            """;

    @Test
    void check_valid_circuit_builds_everything() {
        var c = check("sw1 = SWITCH(0); sw2 = SWITCH(1); g = AND(2);",
                "g.I1 = sw1; g.I2 = sw2;",
                "g; sw1;");
        assertTrue(c.diagnostics().isEmpty(), c.diagnostics().toString());
        assertEquals(3, c.result().devices().size());
        assertEquals(2, c.result().network().connections().size());
        assertEquals(2, c.result().monitors().list().size());
        assertTrue(c.result().network().unconnectedInputs().isEmpty());
    }

    @Test
    void check_flip_flop_outputs() {
        var c = check(FLIP_FLOP + "n = NOT;", FLIP_FLOP_WIRING + "n.I1 = ff.QBAR;", "ff.Q; n;");
        assertTrue(c.diagnostics().isEmpty(), c.diagnostics().toString());
        var devices = c.result().devices();
        assertEquals(List.of(devices.names().query("ff")), devices.find(DeviceKind.DTYPE));
    }

    @Test
    void check_every_kind_accepted() {
        var c = check("""
                a = AND(1); o = OR(16); na = NAND(2); no = NOR(3); x = XOR; n = NOT;
                sw = SWITCH(1); cl = CLOCK(3); r = RC(4); sg = SIGGEN(1,0,1);
                """, """
                a.I1 = sw; o.I1 = sw; o.I2 = sw; o.I3 = sw; o.I4 = sw; o.I5 = sw; o.I6 = sw; o.I7 = sw;
                o.I8 = sw; o.I9 = sw; o.I10 = sw; o.I11 = sw; o.I12 = sw; o.I13 = sw; o.I14 = sw;
                o.I15 = sw; o.I16 = sw; na.I1 = cl; na.I2 = sg; no.I1 = a; no.I2 = o; no.I3 = na;
                x.I1 = no; x.I2 = r; n.I1 = x; r.I1 = sw;
                """, "n;");
        assertTrue(c.diagnostics().isEmpty(), c.diagnostics().toString());
        assertEquals(10, c.result().devices().size());
    }

    @Test
    void check_duplicate_device() {
        var c = check("a = SWITCH(0); a = SWITCH(1); n = NOT;", "n.I1 = a;", "a;");
        assertEquals(List.of("Device 'a' is already defined"), c.messages());
        var d = c.diagnostics().get(0);
        assertEquals(DiagnosticKind.SEMANTIC, d.kind());
        assertEquals(25, d.column());
        // the first declaration stays usable
        var input = c.result().devices().parseSignal("n.I1").orElseThrow();
        assertTrue(c.result().network().isConnected(input));
        assertEquals(1, c.result().monitors().list().size());
    }

    @Test
    void check_kind_word_cannot_name_device() {
        var c = check("AND = SWITCH(0);", "", "");
        assertEquals(List.of("'AND' is a device kind and cannot name a device"), c.messages());
    }

    static Stream<Arguments> badParameters() {
        return Stream.of(
                Arguments.of("g = AND(17);", "Number of inputs must be between 1 and 16"),
                Arguments.of("g = NOR(0);", "Number of inputs must be between 1 and 16"),
                Arguments.of("g = NAND;", "NAND takes exactly one parameter, its number of inputs"),
                Arguments.of("g = OR(1, 2);", "OR takes exactly one parameter, its number of inputs"),
                Arguments.of("g = XOR(2);", "XOR takes no parameters"),
                Arguments.of("g = NOT(1);", "NOT takes no parameters"),
                Arguments.of("g = DTYPE(1);", "DTYPE takes no parameters"),
                Arguments.of("g = SWITCH(2);", "Switch state must be 0 or 1"),
                Arguments.of("g = SWITCH;", "SWITCH takes exactly one parameter, its initial state"),
                Arguments.of("g = CLOCK(0);", "Clock half period must be a positive number of cycles"),
                Arguments.of("g = CLOCK(99999999999);", "Clock half period must be a positive number of cycles"),
                Arguments.of("g = CLOCK;", "CLOCK takes exactly one parameter, its half period"),
                Arguments.of("g = RC(0);", "RC period must be a positive number of cycles"),
                Arguments.of("g = RC;", "RC takes exactly one parameter, its period"),
                Arguments.of("g = SIGGEN;", "SIGGEN needs a waveform of 0s and 1s"),
                Arguments.of("g = SIGGEN(1, 0, 2);", "Waveform values must be 0 or 1")
        );
    }

    @ParameterizedTest
    @MethodSource("badParameters")
    void check_bad_device_parameters(String device, String message) {
        // references to the rejected device stay silent
        var c = check("sw = SWITCH(0); " + device, "g.I1 = sw;", "g;");
        assertEquals(List.of(message), c.messages());
        assertFalse(c.result().devices().contains(c.result().devices().names().query("g")));
    }

    @Test
    void check_bad_waveform_value_points_at_it() {
        var c = check("g = SIGGEN(1, 0, 2);", "", "");
        assertEquals(27, c.diagnostics().get(0).column());
    }

    @Test
    void check_undefined_source_device() {
        var c = check("n = NOT;", "n.I1 = nope;", "");
        assertEquals(List.of("Device 'nope' is not defined"), c.messages());
    }

    @Test
    void check_undefined_target_device() {
        var c = check("sw = SWITCH(0);", "nope.I1 = sw;", "");
        assertEquals(List.of("Device 'nope' is not defined"), c.messages());
    }

    @Test
    void check_target_must_name_pin() {
        var c = check("sw = SWITCH(0); n = NOT;", "n.I1 = sw; n = sw;", "");
        assertEquals(List.of("Connection target 'n' must name an input pin"), c.messages());
    }

    @Test
    void check_target_without_inputs() {
        var c = check("sw = SWITCH(0); n = NOT;", "n.I1 = sw; sw.I1 = n;", "");
        assertEquals(List.of("Device 'sw' has no input 'I1'"), c.messages());
    }

    @Test
    void check_gate_input_out_of_range() {
        var c = check("sw = SWITCH(0); g = AND(2);", "g.I1 = sw; g.I2 = sw; g.I3 = sw;", "");
        assertEquals(List.of("Device 'g' has no input 'I3'"), c.messages());
    }

    @Test
    void check_output_cannot_be_driven() {
        var c = check(FLIP_FLOP, FLIP_FLOP_WIRING + "ff.Q = d;", "");
        assertEquals(List.of("'ff.Q' is an output and cannot be driven"), c.messages());
    }

    @Test
    void check_input_cannot_drive() {
        var c = check("sw = SWITCH(0); g = AND(2);", "g.I1 = sw; g.I2 = g.I1;", "");
        assertEquals(List.of("'g.I1' is an input and cannot drive a connection"), c.messages());
    }

    @Test
    void check_flip_flop_source_needs_pin() {
        var c = check(FLIP_FLOP + "n = NOT;", FLIP_FLOP_WIRING + "n.I1 = ff;", "");
        assertEquals(List.of("Device 'ff' has several outputs; name Q or QBAR"), c.messages());
    }

    @Test
    void check_unknown_output_pin() {
        var c = check(FLIP_FLOP + "n = NOT;", FLIP_FLOP_WIRING + "n.I1 = ff.QQ;", "");
        assertEquals(List.of("Device 'ff' has no output 'QQ'"), c.messages());
    }

    @Test
    void check_input_driven_twice() {
        var c = check("a = SWITCH(0); b = SWITCH(1); n = NOT;", "n.I1 = a; n.I1 = b;", "");
        assertEquals(List.of("Input 'n.I1' is already connected"), c.messages());
    }

    @Test
    void check_unconnected_input_reported_at_declaration() {
        var c = check("sw = SWITCH(0);\n g = AND(2);", "g.I1 = sw;", "");
        assertEquals(List.of("Input 'g.I2' is not connected"), c.messages());
        var d = c.diagnostics().get(0);
        assertEquals(2, d.line());
        assertEquals(2, d.column());
    }

    @Test
    void check_unconnected_inputs_listed_per_pin() {
        var c = check(FLIP_FLOP, "ff.DATA = d; ff.CLK = clk;", "");
        assertEquals(List.of("Input 'ff.SET' is not connected", "Input 'ff.CLEAR' is not connected"), c.messages());
    }

    @Test
    void check_failed_connection_target_not_reported_unconnected() {
        var c = check("n = NOT;", "n.I1 = nope;", "");
        assertEquals(1, c.diagnostics().size());
    }

    @Test
    void check_syntax_failure_in_connection_suppresses_unconnected_check() {
        var c = check("n = NOT; m = NOT;", ". = x;", "");
        assertEquals(1, c.diagnostics().size());
        assertEquals(DiagnosticKind.SYNTAX, c.diagnostics().get(0).kind());
    }

    @Test
    void check_abandoned_connection_target_not_reported_unconnected() {
        var c = check("sw = SWITCH(0); n = NOT; m = NOT;", "n.I1 = ; m.I1 = sw;", "");
        assertEquals(1, c.diagnostics().size());
        assertEquals(DiagnosticKind.SYNTAX, c.diagnostics().get(0).kind());
    }

    @Test
    void check_broken_device_references_silent() {
        var c = check("sw = SWITCH(0); g = FROB(2);", "g.I1 = sw;", "g;");
        assertEquals(List.of("Unknown device kind, found 'FROB'"), c.messages());
    }

    @Test
    void check_rejected_source_device_leaves_target_silent() {
        var c = check("sw = SWITCH(0); b = AND(20); g = NOT;", "b.I1 = sw; g.I1 = b;", "g;");
        assertEquals(List.of("Number of inputs must be between 1 and 16"), c.messages());
        assertFalse(c.result().network().isConnected(c.result().devices().parseSignal("g.I1").orElseThrow()));
    }

    @Test
    void check_unparsed_source_device_leaves_target_silent() {
        var c = check("sw = SWITCH(0); b = FROB; g = NOT;", "g.I1 = b;", "g;");
        assertEquals(List.of("Unknown device kind, found 'FROB'"), c.messages());
    }

    @Test
    void check_target_errors_still_reported_with_rejected_source() {
        var c = check("b = CLOCK(0); n = NOT;", "n.I1 = b; nope.I1 = b; n.I2 = b;", "");
        assertEquals(List.of(
                "Clock half period must be a positive number of cycles",
                "Device 'nope' is not defined",
                "Device 'n' has no input 'I2'"
        ), c.messages());
    }

    @Test
    void check_monitor_undefined_device() {
        var c = check("sw = SWITCH(0);", "", "sw; nope;");
        assertEquals(List.of("Device 'nope' is not defined"), c.messages());
    }

    @Test
    void check_monitor_flip_flop_needs_pin() {
        var c = check(FLIP_FLOP, FLIP_FLOP_WIRING, "ff;");
        assertEquals(List.of("Device 'ff' has several outputs; name one of them"), c.messages());
    }

    @Test
    void check_monitor_input_pin() {
        var c = check("sw = SWITCH(0); n = NOT;", "n.I1 = sw;", "n.I1;");
        assertEquals(List.of("'n.I1' is not an output"), c.messages());
    }

    @Test
    void check_monitor_twice() {
        var c = check("sw = SWITCH(0);", "", "sw; sw;");
        assertEquals(List.of("'sw' is already monitored"), c.messages());
        assertEquals(1, c.result().monitors().list().size());
    }

    @Test
    void check_reports_every_independent_error() {
        var c = check("""
                sw = SWITCH(3);
                g = AND(2);
                g = OR(2);
                n = NOT;
                """, """
                g.I1 = n;
                g.I2 = missing;
                n.I1 = g.I1;
                """, """
                g; n.Q;
                """);
        assertEquals(List.of(
                "Switch state must be 0 or 1",
                "Device 'g' is already defined",
                "Device 'missing' is not defined",
                "'g.I1' is an input and cannot drive a connection",
                "'n.Q' is not an output"
        ), c.messages());
    }
}
