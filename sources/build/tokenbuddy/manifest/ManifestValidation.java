package build.tokenbuddy.manifest;

import build.tokenbuddy.Diagnostic;

import java.util.List;

public record ManifestValidation(List<Diagnostic> errors, List<Diagnostic> warnings) {

    public ManifestValidation {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
