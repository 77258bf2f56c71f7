package build.tokenbuddy.permutation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record PermutationBatch(List<Permutation> permutations, Map<String, Throwable> failures) {

    public PermutationBatch {
        permutations = List.copyOf(permutations);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
