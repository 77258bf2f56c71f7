package build.tokenbuddy.source;

import build.tokenbuddy.Diagnostic;
import build.tokenbuddy.ast.NodeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@FunctionalInterface
public interface SchemaValidator {

    List<Diagnostic> validate(Object document, FileKind kind);

    static SchemaValidator none() {
        return (document, kind) -> List.of();
    }

    static SchemaValidator structural() {
        return (document, kind) -> {
            List<Diagnostic> diagnostics = new ArrayList<>();
            if (!(document instanceof Map<?, ?> map)) {
                diagnostics.add(new Diagnostic("", "Document must be a JSON object"));
            } else if (kind != FileKind.MANIFEST) {
                validateGroup("", map, diagnostics);
            }
            return diagnostics;
        };
    }

    private static void validateGroup(String path, Map<?, ?> group, List<Diagnostic> diagnostics) {
        validateMetadata(path, group, diagnostics);
        group.forEach((key, value) -> {
            String name = String.valueOf(key);
            if (NodeKind.isReserved(name)) {
                return;
            }
            String child = path.isEmpty() ? name : path + "." + name;
            switch (NodeKind.of(value)) {
                case TOKEN -> {
                    Map<?, ?> token = (Map<?, ?>) value;
                    validateMetadata(child, token, diagnostics);
                    if (!token.containsKey("$value")) {
                        diagnostics.add(new Diagnostic(child, "Token is missing $value"));
                    }
                    if (token.containsKey("$extensions") && !(token.get("$extensions") instanceof Map<?, ?>)) {
                        diagnostics.add(new Diagnostic(child, "$extensions must be an object"));
                    }
                }
                case GROUP -> validateGroup(child, (Map<?, ?>) value, diagnostics);
                case NONE -> {
                }
            }
        });
    }

    private static void validateMetadata(String path, Map<?, ?> node, List<Diagnostic> diagnostics) {
        if (node.containsKey("$type") && !(node.get("$type") instanceof String)) {
            diagnostics.add(new Diagnostic(path, "$type must be a string"));
        }
        if (node.containsKey("$description") && !(node.get("$description") instanceof String)) {
            diagnostics.add(new Diagnostic(path, "$description must be a string"));
        }
    }
}
