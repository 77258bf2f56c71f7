package build.tokenbuddy.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TokenAstBuilder {

    private final String file;
    private final Map<String, Token> tokens = new LinkedHashMap<>();
    private final Map<String, Group> groups = new LinkedHashMap<>();
    private final List<Reference> references = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    private TokenAstBuilder(String file) {
        this.file = file;
    }

    public static TokenAst build(String file, Object document) {
        return new TokenAstBuilder(file).toAst(document);
    }

    private TokenAst toAst(Object document) {
        Group root;
        if (document instanceof Map<?, ?> map) {
            root = toGroup("", "", map, null);
        } else {
            root = new Group("", "", null, null);
            warnings.add("Document root is not an object");
        }
        return new TokenAst(file, document, root, tokens, groups, references, warnings);
    }

    private Group toGroup(String path, String name, Map<?, ?> node, String inheritedType) {
        String type = text(node, "$type");
        Group group = new Group(path, name, text(node, "$description"), type);
        String effectiveType = type == null ? inheritedType : type;
        for (Map.Entry<?, ?> entry : node.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (NodeKind.isReserved(key)) {
                continue;
            }
            String child = path.isEmpty() ? key : path + "." + key;
            if (tokens.containsKey(child) || groups.containsKey(child)) {
                warnings.add("Ignored duplicate path '" + child + "'");
                continue;
            }
            switch (NodeKind.of(entry.getValue())) {
                case TOKEN -> group.add(toToken(child, key, (Map<?, ?>) entry.getValue(), effectiveType));
                case GROUP -> {
                    Group nested = toGroup(child, key, (Map<?, ?>) entry.getValue(), effectiveType);
                    groups.put(child, nested);
                    group.add(nested);
                }
                case NONE -> warnings.add("Ignored node at '" + child + "' that is neither a token nor a group");
            }
        }
        return group;
    }

    private Token toToken(String path, String name, Map<?, ?> node, String inheritedType) {
        Map<String, Object> extensions = new LinkedHashMap<>();
        node.forEach((key, value) -> {
            String property = String.valueOf(key);
            if (NodeKind.isReserved(property)
                    && !property.equals("$value")
                    && !property.equals("$type")
                    && !property.equals("$description")) {
                extensions.put(property, value);
            }
        });
        Object value = node.get("$value");
        List<String> found = ReferenceNotation.find(value);
        Reference reference = null;
        if (!found.isEmpty()) {
            reference = new Reference(path, found.get(0));
            references.add(reference);
        }
        Token token = new Token(path,
                name,
                text(node, "$type"),
                inheritedType,
                value,
                text(node, "$description"),
                extensions,
                reference);
        tokens.put(path, token);
        return token;
    }

    private static String text(Map<?, ?> node, String key) {
        return node.get(key) instanceof String value ? value : null;
    }
}
