package build.tokenbuddy.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record GenerateSpec(String output,
                           Map<String, Object> selections,
                           List<String> includeSets,
                           List<String> excludeSets,
                           List<String> includeModifiers,
                           List<String> excludeModifiers) {

    public static final String WILDCARD = "*";

    public GenerateSpec {
        selections = Collections.unmodifiableMap(new LinkedHashMap<>(selections));
        includeSets = List.copyOf(includeSets);
        excludeSets = List.copyOf(excludeSets);
        includeModifiers = List.copyOf(includeModifiers);
        excludeModifiers = List.copyOf(excludeModifiers);
    }

    public static GenerateSpec of(String output, Map<String, Object> selections) {
        return new GenerateSpec(output, selections, List.of(), List.of(), List.of(), List.of());
    }
}
