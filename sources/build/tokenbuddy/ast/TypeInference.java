package build.tokenbuddy.ast;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public final class TypeInference {

    private static final Pattern COLOR = Pattern.compile("^#[0-9A-Fa-f]{6}([0-9A-Fa-f]{2})?$");
    private static final Pattern DIMENSION = Pattern.compile("^\\d+(\\.\\d+)?(px|rem|em|%)$");
    private static final Pattern DURATION = Pattern.compile("^\\d+(\\.\\d+)?ms$");

    private TypeInference() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static void infer(TokenAst ast) {
        Map<String, String> resolved = new HashMap<>();
        Set<String> visiting = new HashSet<>();
        for (Token token : ast.tokens().values()) {
            String type = typeOf(ast, token, resolved, visiting);
            if (type != null) {
                token.resolvedType(type);
                if (token.declaredType() == null) {
                    ast.typeInference().put(token.path(), type);
                }
            }
        }
    }

    private static String typeOf(TokenAst ast, Token token, Map<String, String> resolved, Set<String> visiting) {
        if (token.declaredType() != null) {
            return token.declaredType();
        } else if (resolved.containsKey(token.path())) {
            return resolved.get(token.path());
        } else if (!visiting.add(token.path())) {
            return null;
        }
        String type = token.inheritedType();
        if (type == null && token.hasReference() && token.reference().isFollowable()) {
            type = typeOf(ast, ast.tokens().get(token.reference().resolvedPath()), resolved, visiting);
        }
        if (type == null) {
            type = ofValue(token.value());
        }
        resolved.put(token.path(), type);
        return type;
    }

    public static String ofValue(Object value) {
        if (value instanceof String string) {
            if (COLOR.matcher(string).matches()) {
                return "color";
            } else if (DIMENSION.matcher(string).matches()) {
                return "dimension";
            } else if (DURATION.matcher(string).matches()) {
                return "duration";
            }
        } else if (value instanceof Number) {
            return "number";
        } else if (value instanceof Map<?, ?> map) {
            if (map.containsKey("colorSpace") && map.containsKey("components")) {
                return "color";
            } else if (map.containsKey("fontFamily") || map.containsKey("fontSize")) {
                return "typography";
            } else if (map.containsKey("color") && map.containsKey("offsetX") && map.containsKey("offsetY")) {
                return "shadow";
            } else if (map.containsKey("color") && map.containsKey("width") && map.containsKey("style")) {
                return "border";
            }
        }
        return null;
    }
}
