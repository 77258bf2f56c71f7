package build.tokenbuddy.permutation;

import java.util.List;

public record PermutationMetadata(int totalTokens,
                                  int resolvedTokens,
                                  int unresolvedTokens,
                                  int crossFileReferences,
                                  List<String> errors,
                                  List<String> warnings) {

    public PermutationMetadata {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
