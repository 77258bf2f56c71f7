package build.tokenbuddy.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

public final class CycleDetector {

    public static final String SEPARATOR = " → ";

    private CycleDetector() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static void detect(TokenAst ast) {
        List<List<String>> cycles = cycles(ast.tokens().keySet(), path -> {
            Reference reference = ast.tokens().get(path).reference();
            return reference != null && reference.isFollowable()
                    ? List.of(reference.resolvedPath())
                    : List.of();
        });
        for (List<String> cycle : cycles) {
            ast.cycles().add(cycle);
            String error = "Part of circular reference: " + String.join(SEPARATOR, cycle);
            for (int index = 0; index < cycle.size() - 1; index++) {
                Token token = ast.tokens().get(cycle.get(index));
                token.invalidate(error);
                token.reference().markCircular();
            }
        }
    }

    public static List<List<String>> cycles(Collection<String> nodes, Function<String, Collection<String>> edges) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String node : nodes) {
            if (!visited.contains(node)) {
                traverse(node, edges, visited, new ArrayList<>(), new HashSet<>(), cycles);
            }
        }
        return cycles;
    }

    private static void traverse(String node,
                                 Function<String, Collection<String>> edges,
                                 Set<String> visited,
                                 List<String> stack,
                                 Set<String> onStack,
                                 List<List<String>> cycles) {
        visited.add(node);
        stack.add(node);
        onStack.add(node);
        for (String next : edges.apply(node)) {
            if (onStack.contains(next)) {
                List<String> cycle = new ArrayList<>(stack.subList(stack.indexOf(next), stack.size()));
                cycle.add(next);
                cycles.add(cycle);
            } else if (!visited.contains(next)) {
                traverse(next, edges, visited, stack, onStack, cycles);
            }
        }
        stack.remove(stack.size() - 1);
        onStack.remove(node);
    }
}
