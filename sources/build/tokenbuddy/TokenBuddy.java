package build.tokenbuddy;

import build.tokenbuddy.manifest.Manifest;
import build.tokenbuddy.manifest.ManifestException;
import build.tokenbuddy.manifest.ManifestFormats;
import build.tokenbuddy.permutation.PermutationBatch;
import build.tokenbuddy.permutation.PermutationEngine;
import build.tokenbuddy.project.DependencyDiscovery;
import build.tokenbuddy.project.DiscoveryResult;
import build.tokenbuddy.project.ProjectResolution;
import build.tokenbuddy.project.ProjectResolver;
import build.tokenbuddy.source.SchemaValidator;
import build.tokenbuddy.source.TokenFileException;
import build.tokenbuddy.source.TokenSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.function.BiConsumer;

import static java.util.Objects.requireNonNull;

public class TokenBuddy {

    private final Path root;
    private final TokenBuddyOptions options;
    private final ManifestFormats formats;
    private final SchemaValidator validator;
    private final ResolutionCallback callback;
    private final Executor executor;

    public TokenBuddy(Path root,
                      TokenBuddyOptions options,
                      ManifestFormats formats,
                      SchemaValidator validator,
                      ResolutionCallback callback) {
        this(root, options, formats, validator, callback, null);
    }

    private TokenBuddy(Path root,
                       TokenBuddyOptions options,
                       ManifestFormats formats,
                       SchemaValidator validator,
                       ResolutionCallback callback,
                       Executor executor) {
        this.root = requireNonNull(root, "root");
        this.options = requireNonNull(options, "options");
        this.formats = requireNonNull(formats, "formats");
        this.validator = requireNonNull(validator, "validator");
        this.callback = requireNonNull(callback, "callback");
        this.executor = executor;
    }

    public static TokenBuddy of(Path root) {
        return of(root, TokenBuddyOptions.defaults(), ResolutionCallback.printing(System.out));
    }

    public static TokenBuddy of(Path root, TokenBuddyOptions options, ResolutionCallback callback) {
        return new TokenBuddy(root, options, ManifestFormats.builtIn(), SchemaValidator.structural(), callback);
    }

    public static TokenBuddy of(Path root,
                                TokenBuddyOptions options,
                                ManifestFormats formats,
                                SchemaValidator validator,
                                ResolutionCallback callback,
                                Executor executor) {
        return new TokenBuddy(root, options, formats, validator, callback, requireNonNull(executor, "executor"));
    }

    public TokenBuddyResult run(String manifest) {
        if (executor != null) {
            return run(executor, manifest);
        }
        ExecutorService executorService = Executors.newFixedThreadPool(options.threads());
        try {
            return run(executorService, manifest);
        } finally {
            executorService.shutdown();
        }
    }

    public TokenBuddyResult run(Executor executor, String file) {
        BiConsumer<String, Throwable> completion = callback.step(file);
        try {
            TokenSource source = TokenSource.ofDirectory(root);
            Manifest manifest = load(source, file);
            DiscoveryResult discovery = new DependencyDiscovery(
                    source.prepend(TokenSource.ofDocuments(manifest.virtualFiles())),
                    options.validate() ? validator : SchemaValidator.none(),
                    executor,
                    callback).discover(manifest, options.maxRounds());
            ProjectResolution resolution = new ProjectResolver().resolve(root.toString(),
                    manifest,
                    discovery.files());
            PermutationBatch permutations = new PermutationEngine(resolution.project(),
                    executor,
                    callback,
                    options.policy()).generate();
            List<String> errors = new ArrayList<>(discovery.errors()), warnings = new ArrayList<>(discovery.warnings());
            errors.addAll(resolution.errors());
            warnings.addAll(resolution.warnings());
            permutations.failures().forEach((name, failure) -> errors.add(name + ": " + failure.getMessage()));
            completion.accept("COMPLETED", null);
            return new TokenBuddyResult(manifest, resolution.project(), permutations, errors, warnings);
        } catch (RuntimeException e) {
            completion.accept(null, e);
            throw e;
        }
    }

    private Manifest load(TokenSource source, String file) {
        Object document;
        try {
            document = source.read(file);
        } catch (TokenFileException e) {
            throw new ManifestException("Failed to load manifest " + file + ": " + e.getMessage(), e);
        }
        return formats.parse(document, file);
    }
}
