package build.tokenbuddy.merge;

import build.tokenbuddy.Json;
import build.tokenbuddy.ast.NodeKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class TokenMerger {

    public static final Set<String> COMPOSITE_TYPES = Set.of("shadow",
            "typography",
            "border",
            "transition",
            "gradient",
            "strokeStyle");

    private TokenMerger() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static Map<String, Object> mergeAll(List<? extends Map<String, ?>> documents) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Map<String, ?> document : documents) {
            merged = merge(merged, document);
        }
        return merged;
    }

    public static Map<String, Object> merge(Map<String, ?> base, Map<String, ?> overlay) {
        if (overlay == null) {
            return Json.copyObject(base);
        }
        return mergeGroup("", base, overlay, null);
    }

    private static Object mergeNode(String path, Object base, Object overlay, String inheritedType) {
        if (overlay == null) {
            return Json.copy(base);
        } else if (base == null) {
            return Json.copy(overlay);
        }
        NodeKind left = NodeKind.of(base), right = NodeKind.of(overlay);
        if (left == NodeKind.TOKEN && right == NodeKind.GROUP || left == NodeKind.GROUP && right == NodeKind.TOKEN) {
            throw new MergeConflictException("Cannot merge " + describe(left) + " with " + describe(right),
                    path,
                    describe(left),
                    describe(right));
        } else if (left == NodeKind.TOKEN && right == NodeKind.TOKEN) {
            return mergeToken(path, Json.asObject(base), Json.asObject(overlay), inheritedType);
        } else if (base instanceof Map<?, ?> && overlay instanceof Map<?, ?>
                && left != NodeKind.TOKEN && right != NodeKind.TOKEN) {
            return mergeGroup(path, Json.asObject(base), Json.asObject(overlay), inheritedType);
        }
        return Json.copy(overlay);
    }

    private static Map<String, Object> mergeGroup(String path,
                                                  Map<String, ?> base,
                                                  Map<String, ?> overlay,
                                                  String inheritedType) {
        String left = text(base, "$type"), right = text(overlay, "$type");
        if (left != null && right != null && !left.equals(right)) {
            throw typeConflict(path, left, right);
        }
        String type = right != null ? right : left != null ? left : inheritedType;
        Map<String, Object> merged = Json.copyObject(base);
        overlay.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            if (NodeKind.isReserved(key)) {
                merged.put(key, key.equals("$extensions")
                        ? deepMerge(merged.get(key), value)
                        : Json.copy(value));
            } else {
                merged.put(key, mergeNode(path.isEmpty() ? key : path + "." + key, merged.get(key), value, type));
            }
        });
        return merged;
    }

    private static Map<String, Object> mergeToken(String path,
                                                  Map<String, ?> base,
                                                  Map<String, ?> overlay,
                                                  String inheritedType) {
        String left = text(base, "$type"), right = text(overlay, "$type");
        left = left == null ? inheritedType : left;
        right = right == null ? inheritedType : right;
        if (left != null && right != null && !left.equals(right)) {
            throw typeConflict(path, left, right);
        }
        String type = right != null ? right : left;
        Map<String, Object> merged = Json.copyObject(base);
        overlay.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            if (key.equals("$value") && type != null && COMPOSITE_TYPES.contains(type)) {
                merged.put(key, deepMerge(merged.get(key), value));
            } else if (key.equals("$extensions")) {
                merged.put(key, deepMerge(merged.get(key), value));
            } else {
                merged.put(key, Json.copy(value));
            }
        });
        return merged;
    }

    static Object deepMerge(Object base, Object overlay) {
        if (overlay == null) {
            return Json.copy(base);
        } else if (!(base instanceof Map<?, ?>) || !(overlay instanceof Map<?, ?>)) {
            return Json.copy(overlay);
        }
        Map<String, Object> merged = Json.copyObject(Json.asObject(base));
        Json.asObject(overlay).forEach((key, value) -> {
            if (value != null) {
                merged.put(key, deepMerge(merged.get(key), value));
            }
        });
        return merged;
    }

    private static MergeConflictException typeConflict(String path, String base, String overlay) {
        return new MergeConflictException("Type conflict: cannot merge token of type '"
                + base + "' with type '" + overlay + "'", path, base, overlay);
    }

    private static String describe(NodeKind kind) {
        return kind == NodeKind.TOKEN ? "token" : "group";
    }

    private static String text(Map<String, ?> node, String key) {
        return node.get(key) instanceof String value ? value : null;
    }
}
