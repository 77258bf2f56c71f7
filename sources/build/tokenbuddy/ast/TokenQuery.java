package build.tokenbuddy.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

public final class TokenQuery {

    private TokenQuery() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static List<Token> filter(TokenAst ast, Predicate<Token> predicate) {
        List<Token> tokens = new ArrayList<>();
        for (Token token : ast.tokens().values()) {
            if (predicate.test(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public static List<Token> byType(TokenAst ast, String type) {
        return filter(ast, token -> Objects.equals(typeOf(token), type));
    }

    public static List<Token> underPath(TokenAst ast, String prefix) {
        return filter(ast, token -> prefix.isEmpty()
                || token.path().equals(prefix)
                || token.path().startsWith(prefix + "."));
    }

    public static List<Token> withReferences(TokenAst ast) {
        return filter(ast, Token::hasReference);
    }

    public static List<Token> unresolved(TokenAst ast) {
        return filter(ast, token -> !token.isValid());
    }

    public static Map<String, Integer> countByType(TokenAst ast) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Token token : ast.tokens().values()) {
            String type = typeOf(token);
            if (type != null) {
                counts.merge(type, 1, Integer::sum);
            }
        }
        return counts;
    }

    public static List<Token> dependencies(TokenAst ast, String path) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        Token origin = ast.tokens().get(path);
        if (origin != null) {
            queue.addAll(targets(ast, origin));
        }
        while (!queue.isEmpty()) {
            String current = queue.removeFirst();
            if (!current.equals(path) && visited.add(current)) {
                queue.addAll(targets(ast, ast.tokens().get(current)));
            }
        }
        List<Token> tokens = new ArrayList<>(visited.size());
        visited.forEach(current -> tokens.add(ast.tokens().get(current)));
        return tokens;
    }

    public static List<Token> dependents(TokenAst ast, String path) {
        return filter(ast, token -> targets(ast, token).contains(path));
    }

    public static List<Token> allDependents(TokenAst ast, String path) {
        Map<String, Token> dependents = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(path);
        while (!queue.isEmpty()) {
            for (Token dependent : dependents(ast, queue.removeFirst())) {
                if (!dependent.path().equals(path) && dependents.putIfAbsent(dependent.path(), dependent) == null) {
                    queue.add(dependent.path());
                }
            }
        }
        return new ArrayList<>(dependents.values());
    }

    private static String typeOf(Token token) {
        if (token.resolvedType() != null) {
            return token.resolvedType();
        }
        return token.declaredType() != null ? token.declaredType() : token.inheritedType();
    }

    private static List<String> targets(TokenAst ast, Token token) {
        List<String> targets = new ArrayList<>();
        for (String reference : ReferenceNotation.find(token.value())) {
            if (reference == null || ReferenceNotation.isExternal(reference)) {
                continue;
            }
            String target = ReferenceNotation.toPath(reference);
            if (ast.tokens().containsKey(target) && !targets.contains(target)) {
                targets.add(target);
            }
        }
        return targets;
    }
}
