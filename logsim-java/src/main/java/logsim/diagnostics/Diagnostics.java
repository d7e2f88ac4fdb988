package logsim.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Diagnostics {
    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    private final List<Diagnostic> items = new ArrayList<>();

    public void report(Diagnostic d) {
        log.debug("{}", d.format());
        items.add(d);
    }

    public boolean hasErrors() { return !items.isEmpty(); }

    public int count() { return items.size(); }

    public List<Diagnostic> items() { return Collections.unmodifiableList(items); }

    /** Returns the diagnostics ordered by source position; ties keep discovery order. */
    public List<Diagnostic> sorted() {
        List<Diagnostic> copy = new ArrayList<>(items);
        copy.sort(Diagnostic.BY_POSITION);
        return List.copyOf(copy);
    }
}
