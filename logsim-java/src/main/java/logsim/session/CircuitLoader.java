package logsim.session;

import logsim.ast.Circuit;
import logsim.diagnostics.Diagnostic;
import logsim.diagnostics.Diagnostics;
import logsim.lexer.Lexer;
import logsim.network.SimulationConfig;
import logsim.parser.Parser;
import logsim.sema.CircuitChecker;
import logsim.sema.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class CircuitLoader {
    private static final Logger log = LoggerFactory.getLogger(CircuitLoader.class);

    /** {@code simulation} is null whenever {@code diagnostics} is not empty. */
    public record LoadResult(Simulation simulation, List<Diagnostic> diagnostics) {
        public boolean succeeded() { return simulation != null; }
    }

    private CircuitLoader() {}

    public static LoadResult load(Path file) throws IOException {
        return load(file, SimulationConfig.defaults());
    }

    public static LoadResult load(Path file, SimulationConfig config) throws IOException {
        log.info("Loading circuit {}", file);
        return load(Files.readString(file), config);
    }

    public static LoadResult load(String source) {
        return load(source, SimulationConfig.defaults());
    }

    public static LoadResult load(String source, SimulationConfig config) {
        SymbolTable names = new SymbolTable();
        Diagnostics diagnostics = new Diagnostics();

        Circuit circuit = new Parser(new Lexer(source), names, diagnostics).parseCircuit();
        CircuitChecker.Result checked = new CircuitChecker(names, diagnostics, config).check(circuit);

        if (diagnostics.hasErrors()) {
            log.info("Circuit rejected with {} error(s)", diagnostics.count());
            return new LoadResult(null, diagnostics.sorted());
        }

        log.info("Circuit loaded: {} devices, {} connections, {} monitors",
                checked.devices().size(),
                checked.network().connections().size(),
                checked.monitors().list().size());
        Simulation simulation = new Simulation(names, checked.devices(), checked.network(), checked.monitors());
        return new LoadResult(simulation, List.of());
    }
}
