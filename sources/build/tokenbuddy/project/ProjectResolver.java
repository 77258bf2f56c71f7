package build.tokenbuddy.project;

import build.tokenbuddy.ast.CycleDetector;
import build.tokenbuddy.ast.Reference;
import build.tokenbuddy.ast.ReferenceNotation;
import build.tokenbuddy.ast.Token;
import build.tokenbuddy.ast.TokenAst;
import build.tokenbuddy.manifest.Manifest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ProjectResolver {

    public ProjectResolution resolve(String basePath, Manifest manifest, Map<String, TokenAst> files) {
        List<String> errors = new ArrayList<>(), warnings = new ArrayList<>();
        try {
            Map<String, List<CrossFileReference>> references = new LinkedHashMap<>();
            files.forEach((file, ast) -> {
                for (Reference reference : ast.references()) {
                    if (reference.isExternal()) {
                        references.computeIfAbsent(file, key -> new ArrayList<>())
                                .add(CrossFileReference.of(file, reference));
                    }
                }
            });
            Map<String, Set<String>> dependencies = Project.toDependencies(references);
            List<List<String>> fileCycles = CycleDetector.cycles(files.keySet(), file -> dependencies
                    .getOrDefault(file, Set.of())
                    .stream()
                    .filter(files::containsKey)
                    .toList());
            if (!fileCycles.isEmpty()) {
                warnings.add("Detected " + fileCycles.size() + " circular dependency cycles");
                fileCycles.forEach(cycle -> warnings.add("  Cycle: " + String.join(" -> ", cycle)));
            }
            references.values().forEach(values -> values.forEach(reference -> link(files, reference, errors)));
            detectCycles(files, references, errors);
            Project project = new Project(basePath, manifest, files, references, dependencies, fileCycles);
            warnings.add("Project contains " + project.tokenCount() + " tokens, "
                    + project.referencingTokenCount() + " with references");
            return new ProjectResolution(project, errors, warnings);
        } catch (RuntimeException e) {
            errors.add("Failed to resolve project: " + e.getMessage());
            return new ProjectResolution(Project.of(basePath, manifest, files), errors, warnings);
        }
    }

    private static void link(Map<String, TokenAst> files, CrossFileReference reference, List<String> errors) {
        Token token = files.get(reference.fromFile()).tokens().get(reference.fromToken());
        TokenAst target = files.get(reference.toFile());
        if (target == null) {
            String error = "Target file not found: " + reference.toFile();
            errors.add(reference.fromFile() + "#" + reference.fromToken() + ": " + error);
            token.reference().reject();
            token.invalidate(error);
        } else if (reference.toToken() == null) {
            token.reference().resolve(reference.toFile());
        } else if (!target.tokens().containsKey(reference.toToken())) {
            String error = "Target token not found: " + reference.toToken() + " in " + reference.toFile();
            errors.add(reference.fromFile() + "#" + reference.fromToken() + ": " + error);
            token.reference().reject();
            token.invalidate(error);
        } else {
            token.reference().resolve(reference.target());
            Token resolved = target.tokens().get(reference.toToken());
            if (ReferenceNotation.isReference(token.value()) && !resolved.hasReference()) {
                token.resolvedValue(resolved.value());
                if (token.resolvedType() == null) {
                    token.resolvedType(resolved.resolvedType());
                }
            }
        }
    }

    private static void detectCycles(Map<String, TokenAst> files,
                                     Map<String, List<CrossFileReference>> references,
                                     List<String> errors) {
        Map<String, Token> tokens = new LinkedHashMap<>();
        files.forEach((file, ast) -> ast.tokens().forEach((path, token) -> tokens.put(file + "#" + path, token)));
        Map<String, String> external = new LinkedHashMap<>();
        references.values().forEach(values -> values.forEach(reference -> {
            if (reference.toToken() != null && reference.fromFile() != null) {
                Token token = files.get(reference.fromFile()).tokens().get(reference.fromToken());
                if (token.reference().isValid()) {
                    external.put(reference.fromFile() + "#" + reference.fromToken(), reference.target());
                }
            }
        }));
        List<List<String>> cycles = CycleDetector.cycles(tokens.keySet(), node -> {
            String target = external.get(node);
            if (target != null) {
                return tokens.containsKey(target) ? List.of(target) : List.of();
            }
            Reference reference = tokens.get(node).reference();
            if (reference != null && reference.isFollowable()) {
                return List.of(node.substring(0, node.indexOf('#') + 1) + reference.resolvedPath());
            }
            return List.of();
        });
        for (List<String> cycle : cycles) {
            String error = "Part of circular reference: " + String.join(CycleDetector.SEPARATOR, cycle);
            errors.add(error);
            for (int index = 0; index < cycle.size() - 1; index++) {
                Token token = tokens.get(cycle.get(index));
                token.invalidate(error);
                token.reference().markCircular();
                token.referenceDepth(-1);
            }
        }
    }
}
