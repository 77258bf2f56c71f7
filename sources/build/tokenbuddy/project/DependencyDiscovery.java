package build.tokenbuddy.project;

import build.tokenbuddy.Diagnostic;
import build.tokenbuddy.ResolutionCallback;
import build.tokenbuddy.ast.Reference;
import build.tokenbuddy.ast.TokenAnalysis;
import build.tokenbuddy.ast.TokenAst;
import build.tokenbuddy.manifest.Manifest;
import build.tokenbuddy.source.FileKind;
import build.tokenbuddy.source.SchemaValidator;
import build.tokenbuddy.source.TokenFileException;
import build.tokenbuddy.source.TokenSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;

import static java.util.Objects.requireNonNull;

public class DependencyDiscovery {

    public static final int UNBOUNDED = 0;

    private final TokenSource source;
    private final SchemaValidator validator;
    private final Executor executor;
    private final ResolutionCallback callback;

    public DependencyDiscovery(TokenSource source,
                               SchemaValidator validator,
                               Executor executor,
                               ResolutionCallback callback) {
        this.source = requireNonNull(source, "source");
        this.validator = requireNonNull(validator, "validator");
        this.executor = requireNonNull(executor, "executor");
        this.callback = requireNonNull(callback, "callback");
    }

    public DiscoveryResult discover(Manifest manifest, int maxRounds) {
        return discover(manifest.files(), maxRounds);
    }

    public DiscoveryResult discover(List<String> files, int maxRounds) {
        Set<String> required = new LinkedHashSet<>();
        files.forEach(file -> required.add(TokenSource.normalize(file)));
        Map<String, TokenAst> loaded = new LinkedHashMap<>();
        List<String> dependencies = new ArrayList<>(), errors = new ArrayList<>(), warnings = new ArrayList<>();
        Set<String> seen = new HashSet<>(required);
        List<String> queue = new ArrayList<>(required);
        int rounds = 0;
        while (!queue.isEmpty() && (maxRounds <= UNBOUNDED || rounds < maxRounds)) {
            rounds++;
            List<CompletableFuture<Loaded>> futures = new ArrayList<>(queue.size());
            for (String file : queue) {
                futures.add(CompletableFuture.supplyAsync(() -> load(file), executor));
            }
            List<String> next = new ArrayList<>();
            for (CompletableFuture<Loaded> future : futures) {
                Loaded result = future.join();
                if (result.failure() != null) {
                    if (required.contains(result.file())) {
                        errors.add("Failed to load required file " + result.file() + ": "
                                + result.failure().getMessage());
                    } else {
                        warnings.add("Failed to load referenced file " + result.file() + ": "
                                + result.failure().getMessage());
                    }
                    continue;
                }
                loaded.put(result.file(), result.ast());
                if (!required.contains(result.file())) {
                    dependencies.add(result.file());
                }
                for (Reference reference : result.ast().references()) {
                    if (reference.isExternal()) {
                        String target = CrossFileReference.of(result.file(), reference).toFile();
                        if (seen.add(target)) {
                            next.add(target);
                        }
                    }
                }
            }
            queue = next;
        }
        if (!queue.isEmpty()) {
            warnings.add("Dependency discovery hit maximum rounds (" + maxRounds
                    + "), may have missed some dependencies (remaining: " + queue.size() + ")");
        }
        return new DiscoveryResult(loaded, dependencies, errors, warnings, rounds);
    }

    private Loaded load(String file) {
        BiConsumer<String, Throwable> step = callback.step(file);
        try {
            Object document = source.read(file);
            FileKind kind = FileKind.detect(document);
            if (kind == FileKind.MANIFEST) {
                throw new TokenFileException(file,
                        TokenFileException.Kind.INVALID,
                        "Expected a token document but found a manifest: " + file);
            }
            List<Diagnostic> diagnostics = validator.validate(document, kind);
            if (!diagnostics.isEmpty()) {
                throw new TokenFileException(file,
                        TokenFileException.Kind.INVALID,
                        "Schema validation failed for " + file + ": " + diagnostics);
            }
            TokenAst ast = TokenAnalysis.analyze(file, document);
            step.accept("LOADED", null);
            return new Loaded(file, ast, null);
        } catch (TokenFileException e) {
            step.accept(null, e);
            return new Loaded(file, null, e);
        } catch (RuntimeException e) {
            step.accept(null, e);
            return new Loaded(file, null, new TokenFileException(file,
                    TokenFileException.Kind.INVALID,
                    "Failed to analyze " + file + ": " + e.getMessage(),
                    e));
        }
    }

    private record Loaded(String file, TokenAst ast, TokenFileException failure) {
    }
}
