package logsim.sema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class SymbolTable {
    private final List<String> strings = new ArrayList<>();
    private final Map<String, Integer> ids = new HashMap<>();

    public int intern(String text) {
        Objects.requireNonNull(text, "text");
        Integer id = ids.get(text);
        if (id != null) return id;
        int next = strings.size();
        strings.add(text);
        ids.put(text, next);
        return next;
    }

    public List<Integer> internAll(List<String> texts) {
        List<Integer> out = new ArrayList<>(texts.size());
        for (String t : texts) out.add(intern(t));
        return out;
    }

    /** Returns the ID of {@code text}, or null if it was never interned. */
    public Integer query(String text) {
        Objects.requireNonNull(text, "text");
        return ids.get(text);
    }

    /** Returns the string for {@code id}, or null if the ID is not allocated. */
    public String resolve(int id) {
        if (id < 0) throw new IllegalArgumentException("Symbol id must be non-negative: " + id);
        if (id >= strings.size()) return null;
        return strings.get(id);
    }

    public int size() { return strings.size(); }
}
