package build.tokenbuddy.manifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public record Manifest(String name,
                       String format,
                       String file,
                       List<TokenSet> sets,
                       Map<String, Modifier> modifiers,
                       List<GenerateSpec> generate,
                       Map<String, Object> virtualFiles) {

    public Manifest {
        sets = List.copyOf(sets);
        modifiers = Collections.unmodifiableMap(new LinkedHashMap<>(modifiers));
        generate = List.copyOf(generate);
        virtualFiles = Collections.unmodifiableMap(new LinkedHashMap<>(virtualFiles));
    }

    public Optional<Modifier> modifier(String name) {
        return Optional.ofNullable(modifiers.get(name));
    }

    public List<String> files() {
        Set<String> files = new LinkedHashSet<>();
        sets.forEach(set -> files.addAll(set.files()));
        modifiers.values().forEach(modifier -> modifier.options().forEach(option -> files.addAll(modifier.files(option))));
        modifiers.values().forEach(modifier -> modifier.values().keySet().stream()
                .filter(option -> !modifier.options().contains(option))
                .forEach(option -> files.addAll(modifier.files(option))));
        return new ArrayList<>(files);
    }
}
