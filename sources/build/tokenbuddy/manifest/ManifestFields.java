package build.tokenbuddy.manifest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class ManifestFields {

    private ManifestFields() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    static String text(Map<?, ?> node, String key) {
        return node.get(key) instanceof String value ? value : null;
    }

    static List<String> texts(Object value) {
        List<String> texts = new ArrayList<>();
        if (value instanceof String text) {
            texts.add(text);
        } else if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element instanceof String text) {
                    texts.add(text);
                }
            }
        }
        return texts;
    }

    static boolean isTexts(Object value) {
        return value instanceof List<?> list && list.stream().allMatch(String.class::isInstance);
    }
}
