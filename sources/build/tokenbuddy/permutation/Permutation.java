package build.tokenbuddy.permutation;

import java.util.List;
import java.util.Map;

public record Permutation(String id,
                          Map<String, Object> input,
                          List<String> files,
                          Map<String, Object> tokens,
                          String output,
                          PermutationMetadata metadata) {

    public Permutation {
        files = List.copyOf(files);
    }
}
