package build.tokenbuddy.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Modifier(String name,
                       Constraint constraint,
                       List<String> options,
                       Map<String, List<String>> values,
                       List<String> defaultValue,
                       String description) {

    public enum Constraint {
        ONE_OF,
        ANY_OF
    }

    public Modifier {
        options = List.copyOf(options);
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        defaultValue = List.copyOf(defaultValue);
    }

    public boolean isOneOf() {
        return constraint == Constraint.ONE_OF;
    }

    public List<String> files(String option) {
        return values.getOrDefault(option, List.of());
    }

    public List<String> defaults() {
        if (!defaultValue.isEmpty() || constraint == Constraint.ANY_OF || options.isEmpty()) {
            return defaultValue;
        }
        return List.of(options.get(0));
    }
}
