package build.tokenbuddy;

import build.tokenbuddy.permutation.ValidationPolicy;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

public record TokenBuddyOptions(int maxRounds, ValidationPolicy policy, boolean validate, int parallelism) {

    public static final String MAX_ROUNDS = "discovery.max-rounds",
            POLICY = "validation.policy",
            VALIDATE = "schema.validate",
            PARALLELISM = "parallelism";

    public TokenBuddyOptions {
        if (maxRounds < 0) {
            throw new IllegalArgumentException("Maximum rounds must not be negative: " + maxRounds);
        }
        if (policy == null) {
            throw new IllegalArgumentException("Validation policy must be set");
        }
        if (parallelism < 0) {
            throw new IllegalArgumentException("Parallelism must not be negative: " + parallelism);
        }
    }

    public static TokenBuddyOptions defaults() {
        return new TokenBuddyOptions(0, ValidationPolicy.CONTINUE, true, 0);
    }

    public static TokenBuddyOptions of(Properties properties) {
        TokenBuddyOptions defaults = defaults();
        String policy = properties.getProperty(POLICY), validate = properties.getProperty(VALIDATE);
        return new TokenBuddyOptions(toInt(properties, MAX_ROUNDS, defaults.maxRounds()),
                policy == null ? defaults.policy() : ValidationPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT)),
                validate == null ? defaults.validate() : Boolean.parseBoolean(validate.trim()),
                toInt(properties, PARALLELISM, defaults.parallelism()));
    }

    private static int toInt(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    public static TokenBuddyOptions load(Path file) throws IOException {
        Properties properties = new Properties();
        if (Files.exists(file)) {
            try (Reader reader = Files.newBufferedReader(file)) {
                properties.load(reader);
            }
        }
        return of(properties);
    }

    public int threads() {
        return parallelism == 0 ? Runtime.getRuntime().availableProcessors() : parallelism;
    }

    public TokenBuddyOptions withMaxRounds(int maxRounds) {
        return new TokenBuddyOptions(maxRounds, policy, validate, parallelism);
    }

    public TokenBuddyOptions withPolicy(ValidationPolicy policy) {
        return new TokenBuddyOptions(maxRounds, policy, validate, parallelism);
    }

    public TokenBuddyOptions withValidate(boolean validate) {
        return new TokenBuddyOptions(maxRounds, policy, validate, parallelism);
    }

    public TokenBuddyOptions withParallelism(int parallelism) {
        return new TokenBuddyOptions(maxRounds, policy, validate, parallelism);
    }
}
