package build.tokenbuddy.permutation;

import build.tokenbuddy.ast.Token;
import build.tokenbuddy.ast.TokenAstBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record TokenComparison(List<Difference> differences) {

    public TokenComparison {
        differences = List.copyOf(differences);
    }

    public static TokenComparison of(Permutation left, Permutation right) {
        return of(left.tokens(), right.tokens());
    }

    public static TokenComparison of(Map<String, Object> left, Map<String, Object> right) {
        Map<String, Token> before = TokenAstBuilder.build("left", left).tokens(),
                after = TokenAstBuilder.build("right", right).tokens();
        List<Difference> differences = new ArrayList<>();
        before.forEach((path, token) -> {
            Token other = after.get(path);
            if (other == null) {
                differences.add(new Difference(path, Kind.REMOVED, token.value(), null));
            } else if (!Objects.equals(token.value(), other.value())) {
                differences.add(new Difference(path, Kind.CHANGED, token.value(), other.value()));
            }
        });
        after.forEach((path, token) -> {
            if (!before.containsKey(path)) {
                differences.add(new Difference(path, Kind.ADDED, null, token.value()));
            }
        });
        return new TokenComparison(differences);
    }

    public List<String> added() {
        return paths(Kind.ADDED);
    }

    public List<String> removed() {
        return paths(Kind.REMOVED);
    }

    public List<String> changed() {
        return paths(Kind.CHANGED);
    }

    public boolean isEmpty() {
        return differences.isEmpty();
    }

    private List<String> paths(Kind kind) {
        return differences.stream().filter(difference -> difference.kind() == kind).map(Difference::path).toList();
    }

    public enum Kind {
        ADDED,
        REMOVED,
        CHANGED
    }

    public record Difference(String path, Kind kind, Object left, Object right) {
    }
}
