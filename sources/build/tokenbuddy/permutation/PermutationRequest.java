package build.tokenbuddy.permutation;

import java.util.List;

/**
 * A permutation to resolve. A {@code null} list of sets includes every set of the manifest.
 */
public record PermutationRequest(ModifierInput input, String output, List<String> sets) {

    public PermutationRequest {
        sets = sets == null ? null : List.copyOf(sets);
    }

    public static PermutationRequest of(ModifierInput input) {
        return new PermutationRequest(input, null, null);
    }

    public String name() {
        return output == null ? input.id() : output;
    }
}
