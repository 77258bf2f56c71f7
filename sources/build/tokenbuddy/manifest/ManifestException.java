package build.tokenbuddy.manifest;

import build.tokenbuddy.Diagnostic;

import java.util.List;

public class ManifestException extends RuntimeException {

    private final List<Diagnostic> diagnostics;

    public ManifestException(String message) {
        this(message, List.of());
    }

    public ManifestException(String message, List<Diagnostic> diagnostics) {
        super(diagnostics.isEmpty() ? message : message + ": " + diagnostics);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
        diagnostics = List.of();
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }
}
