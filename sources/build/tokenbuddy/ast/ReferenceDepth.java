package build.tokenbuddy.ast;

import java.util.HashMap;
import java.util.Map;

public final class ReferenceDepth {

    static final int DEEP_CHAIN = 3;

    private ReferenceDepth() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static void compute(TokenAst ast) {
        Map<String, Integer> depths = new HashMap<>();
        for (Token token : ast.tokens().values()) {
            int depth = depthOf(ast, token, depths);
            token.referenceDepth(depth);
            if (depth > DEEP_CHAIN) {
                token.warn("Deep reference chain (" + depth + " levels)");
            }
        }
    }

    private static int depthOf(TokenAst ast, Token token, Map<String, Integer> depths) {
        Integer known = depths.get(token.path());
        if (known != null) {
            return known;
        }
        depths.put(token.path(), -1);
        int depth;
        if (!token.hasReference()) {
            depth = 0;
        } else if (token.reference().isFollowable()) {
            int target = depthOf(ast, ast.tokens().get(token.reference().resolvedPath()), depths);
            depth = target < 0 ? -1 : target + 1;
        } else {
            depth = -1;
        }
        depths.put(token.path(), depth);
        return depth;
    }
}
