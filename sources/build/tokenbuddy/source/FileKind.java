package build.tokenbuddy.source;

import build.tokenbuddy.ast.NodeKind;

import java.util.List;
import java.util.Map;

public enum FileKind {

    TOKENS,
    MANIFEST,
    UNKNOWN;

    public static FileKind detect(Object document) {
        if (!(document instanceof Map<?, ?> map)) {
            return UNKNOWN;
        } else if (map.get("sets") instanceof List<?> || isModifiers(map.get("modifiers"))) {
            return MANIFEST;
        } else if (map.values().stream().anyMatch(value -> NodeKind.of(value) != NodeKind.NONE)) {
            return TOKENS;
        }
        return UNKNOWN;
    }

    public static boolean isModifiers(Object value) {
        return value instanceof Map<?, ?> modifiers && modifiers.values().stream().allMatch(modifier ->
                modifier instanceof Map<?, ?> declaration
                        && !declaration.containsKey("$value")
                        && (declaration.containsKey("oneOf") || declaration.containsKey("anyOf")));
    }
}
