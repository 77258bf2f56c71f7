package build.tokenbuddy.bundle;

import java.util.Map;
import java.util.function.UnaryOperator;

@FunctionalInterface
public interface TokenTransform {

    Map<String, Object> apply(Map<String, Object> tokens);

    default String name() {
        return getClass().getSimpleName();
    }

    static TokenTransform named(String name, UnaryOperator<Map<String, Object>> transform) {
        return new TokenTransform() {
            @Override
            public Map<String, Object> apply(Map<String, Object> tokens) {
                return transform.apply(tokens);
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
