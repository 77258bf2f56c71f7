package build.tokenbuddy.project;

import java.util.List;

public record ProjectResolution(Project project, List<String> errors, List<String> warnings) {

    public ProjectResolution {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
