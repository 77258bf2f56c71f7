package build.tokenbuddy.bundle;

import build.tokenbuddy.Json;
import build.tokenbuddy.permutation.Permutation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class Bundler {

    private final List<TokenTransform> transforms;

    public Bundler(List<TokenTransform> transforms) {
        this.transforms = List.copyOf(transforms);
    }

    public static Bundler of(TokenTransform... transforms) {
        return new Bundler(List.of(transforms));
    }

    public Bundle bundle(Permutation permutation) {
        Map<String, Object> tokens = Json.copyObject(permutation.tokens());
        for (TokenTransform transform : transforms) {
            try {
                tokens = transform.apply(tokens);
            } catch (RuntimeException e) {
                throw new TransformException(transform.name(), permutation.id(), e);
            }
            if (tokens == null) {
                throw new TransformException(transform.name(),
                        permutation.id(),
                        new IllegalStateException("Transform returned no tokens"));
            }
        }
        return new Bundle(permutation.id(), permutation.output(), permutation.files(), tokens);
    }

    public List<Bundle> bundle(List<Permutation> permutations) {
        List<Bundle> bundles = new ArrayList<>(permutations.size());
        for (Permutation permutation : permutations) {
            bundles.add(bundle(permutation));
        }
        return bundles;
    }
}
