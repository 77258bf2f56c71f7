package build.tokenbuddy.project;

import build.tokenbuddy.ast.Token;
import build.tokenbuddy.ast.TokenAst;
import build.tokenbuddy.manifest.Manifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class Project {

    private final String basePath;
    private final Manifest manifest;
    private final Map<String, TokenAst> files;
    private final Map<String, List<CrossFileReference>> crossFileReferences;
    private final Map<String, Set<String>> dependencies;
    private final List<List<String>> fileCycles;

    public Project(String basePath,
                   Manifest manifest,
                   Map<String, TokenAst> files,
                   Map<String, List<CrossFileReference>> crossFileReferences,
                   Map<String, Set<String>> dependencies,
                   List<List<String>> fileCycles) {
        this.basePath = basePath;
        this.manifest = manifest;
        this.files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
        this.crossFileReferences = Collections.unmodifiableMap(new LinkedHashMap<>(crossFileReferences));
        this.dependencies = Collections.unmodifiableMap(new LinkedHashMap<>(dependencies));
        this.fileCycles = List.copyOf(fileCycles);
    }

    public static Project of(String basePath, Manifest manifest, Map<String, TokenAst> files) {
        return new Project(basePath, manifest, files, Map.of(), Map.of(), List.of());
    }

    public String basePath() {
        return basePath;
    }

    public Optional<Manifest> manifest() {
        return Optional.ofNullable(manifest);
    }

    public Map<String, TokenAst> files() {
        return files;
    }

    public Optional<TokenAst> file(String file) {
        return Optional.ofNullable(files.get(file));
    }

    public Map<String, List<CrossFileReference>> crossFileReferences() {
        return crossFileReferences;
    }

    public Map<String, Set<String>> dependencies() {
        return dependencies;
    }

    public List<List<String>> fileCycles() {
        return fileCycles;
    }

    public int tokenCount() {
        return files.values().stream().mapToInt(ast -> ast.tokens().size()).sum();
    }

    public int referencingTokenCount() {
        return (int) files.values().stream()
                .flatMap(ast -> ast.tokens().values().stream())
                .filter(Token::hasReference)
                .count();
    }

    public int crossFileReferenceCount() {
        return crossFileReferences.values().stream().mapToInt(List::size).sum();
    }

    // Files on a cycle are ordered by first encounter.
    public List<String> resolutionOrder() {
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String file : files.keySet()) {
            visit(file, visited, order);
        }
        return order;
    }

    private void visit(String file, Set<String> visited, List<String> order) {
        if (!visited.add(file)) {
            return;
        }
        for (String dependency : dependencies.getOrDefault(file, Set.of())) {
            if (files.containsKey(dependency)) {
                visit(dependency, visited, order);
            }
        }
        order.add(file);
    }

    static Map<String, Set<String>> toDependencies(Map<String, List<CrossFileReference>> references) {
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        references.forEach((file, values) -> {
            Set<String> targets = dependencies.computeIfAbsent(file, key -> new LinkedHashSet<>());
            values.forEach(reference -> targets.add(reference.toFile()));
        });
        return dependencies;
    }

    @Override
    public String toString() {
        return "Project{" + basePath + ", " + files.size() + " files}";
    }
}
