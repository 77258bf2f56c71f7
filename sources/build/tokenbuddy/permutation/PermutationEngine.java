package build.tokenbuddy.permutation;

import build.tokenbuddy.Json;
import build.tokenbuddy.ResolutionCallback;
import build.tokenbuddy.ast.ReferenceNotation;
import build.tokenbuddy.ast.Token;
import build.tokenbuddy.ast.TokenAnalysis;
import build.tokenbuddy.ast.TokenAst;
import build.tokenbuddy.manifest.GenerateSpec;
import build.tokenbuddy.manifest.Manifest;
import build.tokenbuddy.manifest.Modifier;
import build.tokenbuddy.manifest.TokenSet;
import build.tokenbuddy.merge.MergeConflictException;
import build.tokenbuddy.merge.TokenMerger;
import build.tokenbuddy.project.CrossFileReference;
import build.tokenbuddy.project.Project;
import build.tokenbuddy.source.TokenSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;

import static java.util.Objects.requireNonNull;

public class PermutationEngine {

    static final int MAX_ANY_OF_OPTIONS = 30;

    private final Project project;
    private final Manifest manifest;
    private final Executor executor;
    private final ResolutionCallback callback;
    private final ValidationPolicy policy;

    public PermutationEngine(Project project,
                             Executor executor,
                             ResolutionCallback callback,
                             ValidationPolicy policy) {
        this.project = requireNonNull(project, "project");
        manifest = project.manifest().orElseThrow(() -> new IllegalArgumentException(
                "Cannot compute permutations of a project without manifest"));
        this.executor = requireNonNull(executor, "executor");
        this.callback = requireNonNull(callback, "callback");
        this.policy = requireNonNull(policy, "policy");
    }

    public PermutationBatch generate() {
        return generate(manifest.generate().isEmpty() ? exhaustive() : directed());
    }

    public PermutationBatch generate(List<PermutationRequest> requests) {
        List<CompletableFuture<Permutation>> futures = new ArrayList<>(requests.size());
        for (PermutationRequest request : requests) {
            futures.add(CompletableFuture.supplyAsync(() -> resolve(request), executor));
        }
        List<Permutation> permutations = new ArrayList<>();
        Map<String, Throwable> failures = new LinkedHashMap<>();
        for (int index = 0; index < futures.size(); index++) {
            try {
                permutations.add(futures.get(index).join());
            } catch (CompletionException e) {
                failures.put(requests.get(index).name(),
                        e instanceof PermutationException || e.getCause() == null ? e : e.getCause());
            }
        }
        return new PermutationBatch(permutations, failures);
    }

    public List<PermutationRequest> exhaustive() {
        List<Map<String, Object>> combinations = new ArrayList<>();
        combinations.add(new LinkedHashMap<>());
        for (Modifier modifier : manifest.modifiers().values()) {
            List<Object> choices = new ArrayList<>();
            if (modifier.isOneOf()) {
                choices.addAll(modifier.options());
            } else if (modifier.options().size() > MAX_ANY_OF_OPTIONS) {
                throw new IllegalArgumentException("Cannot enumerate all subsets of any-of modifier "
                        + modifier.name() + " with " + modifier.options().size()
                        + " options, at most " + MAX_ANY_OF_OPTIONS + " are supported");
            } else {
                choices.addAll(subsets(modifier.options()));
            }
            combinations = expand(combinations, modifier.name(), choices);
        }
        List<PermutationRequest> requests = new ArrayList<>(combinations.size());
        combinations.forEach(combination -> requests.add(PermutationRequest.of(ModifierInput.of(combination))));
        return requests;
    }

    static List<List<String>> subsets(List<String> options) {
        List<List<String>> subsets = new ArrayList<>();
        for (int mask = 0; mask < 1 << options.size(); mask++) {
            List<String> subset = new ArrayList<>();
            for (int index = 0; index < options.size(); index++) {
                if ((mask & (1 << index)) != 0) {
                    subset.add(options.get(index));
                }
            }
            subsets.add(subset);
        }
        return subsets;
    }

    private static List<Map<String, Object>> expand(List<Map<String, Object>> combinations,
                                                    String modifier,
                                                    List<?> choices) {
        List<Map<String, Object>> expanded = new ArrayList<>(combinations.size() * choices.size());
        for (Map<String, Object> combination : combinations) {
            for (Object choice : choices) {
                Map<String, Object> next = new LinkedHashMap<>(combination);
                next.put(modifier, choice);
                expanded.add(next);
            }
        }
        return expanded;
    }

    public List<PermutationRequest> directed() {
        List<PermutationRequest> requests = new ArrayList<>();
        for (GenerateSpec spec : manifest.generate()) {
            requests.addAll(directed(spec));
        }
        return requests;
    }

    public List<PermutationRequest> directed(GenerateSpec spec) {
        Map<String, Object> pinned = new LinkedHashMap<>();
        List<String> expanding = new ArrayList<>(), included = new ArrayList<>();
        spec.selections().forEach((name, value) -> {
            Modifier modifier = manifest.modifiers().get(name);
            if (modifier != null && GenerateSpec.WILDCARD.equals(value)) {
                if (modifier.isOneOf()) {
                    expanding.add(name);
                } else {
                    pinned.put(name, modifier.options());
                }
            } else if (modifier != null && !modifier.isOneOf() && value instanceof String single) {
                pinned.put(name, List.of(single));
            } else {
                pinned.put(name, value);
            }
        });
        for (String entry : spec.includeModifiers()) {
            int colon = entry.indexOf(':');
            if (colon == -1) {
                included.add(entry);
                Modifier modifier = manifest.modifiers().get(entry);
                if (modifier != null && modifier.isOneOf()
                        && !pinned.containsKey(entry)
                        && !expanding.contains(entry)) {
                    expanding.add(entry);
                }
                continue;
            }
            String name = entry.substring(0, colon), value = entry.substring(colon + 1);
            included.add(name);
            Modifier modifier = manifest.modifiers().get(name);
            if (modifier != null && !modifier.isOneOf()) {
                List<String> values = new ArrayList<>();
                if (pinned.get(name) instanceof List<?> previous) {
                    previous.forEach(element -> values.add(String.valueOf(element)));
                }
                values.add(value);
                pinned.put(name, values);
            } else {
                pinned.putIfAbsent(name, value);
            }
        }
        Map<String, Object> base = new LinkedHashMap<>();
        for (Modifier modifier : manifest.modifiers().values()) {
            String name = modifier.name();
            if (expanding.contains(name) || !pinned.containsKey(name)
                    && !matches(name, included, spec.excludeModifiers(), spec.includeModifiers().isEmpty())) {
                continue;
            }
            if (pinned.containsKey(name)) {
                base.put(name, pinned.get(name));
            } else if (modifier.isOneOf()) {
                if (!modifier.defaults().isEmpty()) {
                    base.put(name, modifier.defaults().get(0));
                }
            } else {
                base.put(name, modifier.defaults());
            }
        }
        pinned.forEach((name, value) -> {
            if (!manifest.modifiers().containsKey(name)) {
                base.put(name, value);
            }
        });
        List<String> sets = manifest.sets().stream()
                .map(TokenSet::name)
                .filter(name -> matches(name, spec.includeSets(), spec.excludeSets(), spec.includeSets().isEmpty()))
                .toList();
        List<Map<String, Object>> combinations = new ArrayList<>();
        combinations.add(base);
        for (String name : expanding) {
            combinations = expand(combinations, name, manifest.modifiers().get(name).options());
        }
        List<PermutationRequest> requests = new ArrayList<>(combinations.size());
        for (Map<String, Object> combination : combinations) {
            List<String> suffix = new ArrayList<>();
            expanding.forEach(name -> suffix.add(String.valueOf(combination.get(name))));
            requests.add(new PermutationRequest(ModifierInput.of(combination), outputName(spec.output(), suffix), sets));
        }
        return requests;
    }

    static boolean matches(String name, List<String> include, List<String> exclude, boolean includeByDefault) {
        if (include.contains(GenerateSpec.WILDCARD) || include.contains(name)) {
            return true;
        } else if (exclude.contains(GenerateSpec.WILDCARD) || exclude.contains(name)) {
            return false;
        }
        return includeByDefault;
    }

    static String outputName(String output, List<String> suffix) {
        String base = output == null ? "output" : output;
        int separator = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
        int extension = base.lastIndexOf('.');
        if (extension > separator) {
            base = base.substring(0, extension);
        }
        return suffix.isEmpty() ? base + ".json" : base + "-" + String.join("-", suffix) + ".json";
    }

    public Permutation resolve(ModifierInput input) {
        return resolve(PermutationRequest.of(input));
    }

    public Permutation resolve(PermutationRequest request) {
        BiConsumer<String, Throwable> step = callback.step(request.name());
        try {
            Permutation permutation = doResolve(request);
            step.accept("RESOLVED", null);
            return permutation;
        } catch (PermutationException e) {
            step.accept(null, e);
            throw e;
        } catch (RuntimeException e) {
            PermutationException exception = new PermutationException(request.input().id(), e);
            step.accept(null, exception);
            throw exception;
        }
    }

    private Permutation doResolve(PermutationRequest request) {
        List<String> errors = new ArrayList<>(), warnings = new ArrayList<>();
        Map<String, Object> input = new LinkedHashMap<>();
        Map<String, List<String>> selected = new LinkedHashMap<>();
        request.input().values().forEach((name, value) -> {
            if (name.equals("output")) {
                return;
            }
            Modifier modifier = manifest.modifiers().get(name);
            if (modifier == null) {
                errors.add("Unknown modifier: " + name);
            } else if (modifier.isOneOf()) {
                if (!(value instanceof String option)) {
                    errors.add("Modifier " + name + " requires a single string value");
                } else if (!modifier.options().contains(option)) {
                    errors.add(invalidValue(modifier, option));
                } else {
                    input.put(name, option);
                    selected.put(name, List.of(option));
                }
            } else if (!(value instanceof List<?> options)) {
                errors.add("Modifier " + name + " requires an array of values");
            } else {
                List<String> accepted = new ArrayList<>();
                for (Object option : options) {
                    if (option instanceof String text && modifier.options().contains(text)) {
                        accepted.add(text);
                    } else {
                        errors.add(invalidValue(modifier, String.valueOf(option)));
                    }
                }
                input.put(name, accepted);
                selected.put(name, accepted);
            }
        });
        // Directed requests already assign defaults to the modifiers they include.
        for (Modifier modifier : manifest.modifiers().values()) {
            if (request.sets() == null
                    && modifier.isOneOf()
                    && !request.input().contains(modifier.name())
                    && !modifier.defaults().isEmpty()) {
                input.put(modifier.name(), modifier.defaults().get(0));
                selected.put(modifier.name(), modifier.defaults());
            }
        }
        String id = ModifierInput.of(input).id();
        if (!errors.isEmpty() && policy == ValidationPolicy.ABORT) {
            throw new PermutationException(id, String.join("; ", errors));
        }
        List<String> files = files(request.sets(), selected);
        List<Map<String, ?>> documents = new ArrayList<>();
        Map<String, String> origins = new HashMap<>();
        for (String file : files) {
            TokenAst ast = project.files().get(file);
            if (ast == null) {
                warnings.add("Skipped file that could not be loaded: " + file);
            } else if (!(ast.document() instanceof Map<?, ?>)) {
                warnings.add("Skipped file without token object: " + file);
            } else {
                documents.add(Json.asObject(ast.document()));
                ast.tokens().values().stream()
                        .filter(Token::hasReference)
                        .forEach(token -> origins.put(token.path(), file));
            }
        }
        Map<String, Object> tokens;
        try {
            tokens = TokenMerger.mergeAll(documents);
        } catch (MergeConflictException e) {
            throw new PermutationException(id, e);
        }
        TokenAst ast = TokenAnalysis.analyze(id, tokens);
        warnings.addAll(ast.warnings());
        int resolved = 0, unresolved = 0, crossFile = 0;
        for (Token token : ast.tokens().values()) {
            if (!token.hasReference()) {
                resolved++;
                continue;
            }
            token.errors().forEach(error -> errors.add(token.path() + ": " + error));
            Object value = substitute(token, ast, origins.get(token.path()), warnings);
            if (token.reference().isExternal()) {
                crossFile++;
            }
            if (value == null) {
                unresolved++;
            } else {
                Map<String, Object> node = node(tokens, token.path());
                if (node == null) {
                    warnings.add("Cannot locate token " + token.path() + " to substitute its value");
                    unresolved++;
                } else {
                    node.put("$value", value);
                    resolved++;
                }
            }
        }
        return new Permutation(id,
                input,
                files,
                tokens,
                request.output(),
                new PermutationMetadata(ast.tokens().size(), resolved, unresolved, crossFile, errors, warnings));
    }

    private static String invalidValue(Modifier modifier, String value) {
        return "Invalid value \"" + value + "\" for modifier " + modifier.name()
                + ". Valid options: " + String.join(", ", modifier.options());
    }

    private List<String> files(List<String> sets, Map<String, List<String>> selected) {
        Set<String> files = new LinkedHashSet<>();
        for (TokenSet set : manifest.sets()) {
            if (sets == null || sets.contains(set.name())) {
                set.files().forEach(file -> files.add(TokenSource.normalize(file)));
            }
        }
        for (Modifier modifier : manifest.modifiers().values()) {
            List<String> values = selected.get(modifier.name());
            if (values == null) {
                continue;
            }
            for (String option : modifier.options()) {
                if (values.contains(option)) {
                    modifier.files(option).forEach(file -> files.add(TokenSource.normalize(file)));
                }
            }
        }
        return new ArrayList<>(files);
    }

    private Object substitute(Token token, TokenAst ast, String origin, List<String> warnings) {
        if (!token.isValid()) {
            return null;
        } else if (ReferenceNotation.find(token.value()).size() > 1) {
            warnings.add("Token " + token.path() + " has multiple references and was left unresolved");
            return null;
        }
        Token target;
        if (token.reference().isExternal()) {
            // The last file that declares the reference defines its base directory.
            String file = origin == null
                    ? TokenSource.normalize(ReferenceNotation.file(token.reference().to()))
                    : CrossFileReference.resolveFile(origin, ReferenceNotation.file(token.reference().to()));
            String path = ReferenceNotation.fragment(token.reference().to());
            TokenAst other = project.files().get(file);
            target = other == null || path == null ? null : other.tokens().get(path);
            if (target == null) {
                warnings.add("Token " + token.path() + " references unavailable " + token.reference().to());
                return null;
            }
        } else {
            target = ast.tokens().get(token.reference().resolvedPath());
        }
        if (target.hasReference()) {
            warnings.add("Token " + token.path() + " references " + target.path()
                    + " which is itself a reference and was left unresolved");
            return null;
        }
        return replace(token.value(), target.value());
    }

    private static Object replace(Object value, Object replacement) {
        if (ReferenceNotation.isReference(value)) {
            return Json.copy(replacement);
        } else if (value instanceof Map<?, ?> map) {
            Map<String, Object> replaced = new LinkedHashMap<>();
            map.forEach((key, child) -> replaced.put(String.valueOf(key), replace(child, replacement)));
            return replaced;
        } else if (value instanceof List<?> list) {
            List<Object> replaced = new ArrayList<>(list.size());
            list.forEach(child -> replaced.add(replace(child, replacement)));
            return replaced;
        }
        return value;
    }

    private static Map<String, Object> node(Map<String, Object> tokens, String path) {
        Map<String, Object> node = tokens;
        for (String segment : path.split("\\.")) {
            node = Json.asObject(node.get(segment));
            if (node == null) {
                return null;
            }
        }
        return node;
    }
}
