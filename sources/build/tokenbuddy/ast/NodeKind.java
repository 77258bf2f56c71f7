package build.tokenbuddy.ast;

import java.util.Map;

public enum NodeKind {

    TOKEN,
    GROUP,
    NONE;

    public static NodeKind of(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return NONE;
        } else if (map.containsKey("$value")) {
            return TOKEN;
        }
        boolean children = map.keySet().stream().anyMatch(key -> !isReserved(String.valueOf(key)));
        if (map.containsKey("$type") && !children) {
            return TOKEN;
        }
        return children ? GROUP : NONE;
    }

    public static boolean isReserved(String key) {
        return key.startsWith("$");
    }
}
