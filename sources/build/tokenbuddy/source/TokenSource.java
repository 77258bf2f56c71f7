package build.tokenbuddy.source;

import build.tokenbuddy.Json;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.CharacterCodingException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Reads decoded JSON documents by their path relative to a project's base directory. Returned documents
 * might be shared and must not be modified.
 */
@FunctionalInterface
public interface TokenSource {

    Object read(String file) throws TokenFileException;

    default TokenSource prepend(TokenSource source) {
        return file -> {
            try {
                return source.read(file);
            } catch (TokenFileException e) {
                if (e.kind() != TokenFileException.Kind.NOT_FOUND) {
                    throw e;
                }
                return read(file);
            }
        };
    }

    default TokenSource cached() {
        ConcurrentMap<String, Optional<Object>> cache = new ConcurrentHashMap<>();
        return file -> {
            String key = normalize(file);
            Optional<Object> previous = cache.get(key);
            if (previous != null) {
                return previous.orElse(null);
            }
            Object document = read(file);
            Optional<Object> concurrent = cache.putIfAbsent(key, Optional.ofNullable(document));
            return concurrent == null ? document : concurrent.orElse(null);
        };
    }

    static TokenSource empty() {
        return file -> {
            throw new TokenFileException(file, TokenFileException.Kind.NOT_FOUND, "File not found: " + file);
        };
    }

    static TokenSource ofDocuments(Map<String, ?> documents) {
        return file -> {
            String key = normalize(file);
            if (!documents.containsKey(key)) {
                throw new TokenFileException(file, TokenFileException.Kind.NOT_FOUND, "File not found: " + file);
            }
            return documents.get(key);
        };
    }

    static TokenSource ofDirectory(Path base) {
        ConcurrentMap<Path, Optional<Object>> cache = new ConcurrentHashMap<>();
        return file -> {
            Path path = base.resolve(file).toAbsolutePath().normalize();
            Optional<Object> previous = cache.get(path);
            if (previous != null) {
                return previous.orElse(null);
            }
            Object document;
            try (Reader reader = Files.newBufferedReader(path)) {
                document = Json.parse(reader);
            } catch (NoSuchFileException e) {
                throw new TokenFileException(file, TokenFileException.Kind.NOT_FOUND, "File not found: " + file, e);
            } catch (AccessDeniedException e) {
                throw new TokenFileException(file,
                        TokenFileException.Kind.PERMISSION,
                        "Permission denied: " + file,
                        e);
            } catch (JsonParseException e) {
                if (e.getCause() instanceof CharacterCodingException) {
                    throw new TokenFileException(file,
                            TokenFileException.Kind.PARSE,
                            "Invalid UTF-8 in " + file + ": " + e.getCause().getMessage(),
                            e);
                }
                throw new TokenFileException(file,
                        TokenFileException.Kind.PARSE,
                        "Invalid JSON in " + file + ": " + e.getMessage(),
                        e);
            } catch (CharacterCodingException e) {
                throw new TokenFileException(file,
                        TokenFileException.Kind.PARSE,
                        "Invalid UTF-8 in " + file + ": " + e.getMessage(),
                        e);
            } catch (IOException e) {
                throw new TokenFileException(file,
                        TokenFileException.Kind.PERMISSION,
                        "Cannot read " + file + ": " + e.getMessage(),
                        e);
            }
            Optional<Object> concurrent = cache.putIfAbsent(path, Optional.ofNullable(document));
            return concurrent == null ? document : concurrent.orElse(null);
        };
    }

    static String normalize(String file) {
        String normalized = Path.of(file).normalize().toString().replace('\\', '/');
        return normalized.startsWith("./") ? normalized.substring(2) : normalized;
    }
}
