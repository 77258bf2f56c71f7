package build.tokenbuddy.permutation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

public final class ModifierInput {

    public static final String DEFAULT = "default";

    private final Map<String, Object> values;

    private ModifierInput(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ModifierInput empty() {
        return new ModifierInput(new LinkedHashMap<>());
    }

    public static ModifierInput of(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((name, value) -> copy.put(name, value instanceof List<?> list ? List.copyOf(list) : value));
        return new ModifierInput(copy);
    }

    public ModifierInput with(String modifier, String value) {
        Map<String, Object> values = new LinkedHashMap<>(this.values);
        values.put(modifier, value);
        return new ModifierInput(values);
    }

    public ModifierInput with(String modifier, List<String> value) {
        Map<String, Object> values = new LinkedHashMap<>(this.values);
        values.put(modifier, List.copyOf(value));
        return new ModifierInput(values);
    }

    public Map<String, Object> values() {
        return values;
    }

    public Object get(String modifier) {
        return values.get(modifier);
    }

    public boolean contains(String modifier) {
        return values.containsKey(modifier);
    }

    /**
     * Computes an identifier that does not depend on the order of assignment. Empty any-of selections
     * are omitted.
     */
    public String id() {
        String id = new TreeMap<>(values).entrySet().stream()
                .filter(entry -> !(entry.getValue() instanceof List<?> list && list.isEmpty()))
                .map(entry -> entry.getKey() + "-" + format(entry.getValue()))
                .collect(Collectors.joining("&"));
        return id.isEmpty() ? DEFAULT : id;
    }

    private static String format(Object value) {
        if (value instanceof List<?> list) {
            List<String> sorted = new ArrayList<>();
            list.forEach(element -> sorted.add(String.valueOf(element)));
            Collections.sort(sorted);
            return String.join(",", sorted);
        }
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object object) {
        return object instanceof ModifierInput input && values.equals(input.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
