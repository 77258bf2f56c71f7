package build.tokenbuddy.project;

import build.tokenbuddy.ast.TokenAst;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DiscoveryResult(Map<String, TokenAst> files,
                              List<String> dependencies,
                              List<String> errors,
                              List<String> warnings,
                              int rounds) {

    public DiscoveryResult {
        files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
        dependencies = List.copyOf(dependencies);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
