package build.tokenbuddy.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ReferenceNotation {

    public static final String REFERENCE = "$ref";

    private static final Pattern ALIAS = Pattern.compile("^\\{([^{}]+)}$");

    private ReferenceNotation() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static List<String> find(Object value) {
        List<String> references = new ArrayList<>();
        find(value, references);
        return references;
    }

    private static void find(Object value, List<String> references) {
        if (value instanceof Map<?, ?> map) {
            if (map.containsKey(REFERENCE)) {
                references.add(map.get(REFERENCE) instanceof String reference ? reference : null);
            } else {
                map.values().forEach(child -> find(child, references));
            }
        } else if (value instanceof List<?> list) {
            list.forEach(child -> find(child, references));
        } else if (value instanceof String string && ALIAS.matcher(string).matches()) {
            references.add(string);
        }
    }

    public static boolean isReference(Object value) {
        if (value instanceof Map<?, ?> map) {
            return map.containsKey(REFERENCE);
        } else {
            return value instanceof String string && ALIAS.matcher(string).matches();
        }
    }

    public static boolean isExternal(String reference) {
        if (ALIAS.matcher(reference).matches()) {
            return false;
        } else if (reference.contains(".json")) {
            return true;
        } else if (reference.startsWith("#")) {
            return false;
        }
        return reference.startsWith("./") || reference.startsWith("../");
    }

    public static String toPath(String reference) {
        Matcher alias = ALIAS.matcher(reference);
        if (alias.matches()) {
            return alias.group(1).trim();
        }
        String path = reference;
        if (path.startsWith("#")) {
            path = path.substring(1);
        }
        if (path.startsWith("/")) {
            path = path.substring(1);
        }
        if (path.endsWith("/$value")) {
            path = path.substring(0, path.length() - "/$value".length());
        } else if (path.equals("$value")) {
            path = "";
        }
        return path.replace('/', '.');
    }

    public static String file(String reference) {
        int index = reference.indexOf('#');
        return index == -1 ? reference : reference.substring(0, index);
    }

    public static String fragment(String reference) {
        int index = reference.indexOf('#');
        if (index == -1 || index == reference.length() - 1) {
            return null;
        }
        return toPath(reference.substring(index));
    }
}
