package build.tokenbuddy;

import build.tokenbuddy.manifest.Manifest;
import build.tokenbuddy.permutation.PermutationBatch;
import build.tokenbuddy.project.Project;

import java.util.List;

public record TokenBuddyResult(Manifest manifest,
                               Project project,
                               PermutationBatch permutations,
                               List<String> errors,
                               List<String> warnings) {

    public TokenBuddyResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
