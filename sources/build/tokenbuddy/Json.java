package build.tokenbuddy;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;
import com.google.gson.ToNumberPolicy;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Json {

    private static final Gson GSON = new GsonBuilder()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .disableHtmlEscaping()
            .serializeNulls()
            .setPrettyPrinting()
            .create();

    private Json() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static Object parse(String text) {
        return copy(GSON.fromJson(text, Object.class));
    }

    public static Object parse(Reader reader) throws IOException {
        try {
            return copy(GSON.fromJson(reader, Object.class));
        } catch (JsonIOException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    public static String write(Object value) {
        return GSON.toJson(value);
    }

    public static void write(Object value, Writer writer) throws IOException {
        try {
            GSON.toJson(value, writer);
        } catch (JsonIOException e) {
            throw new IOException("Failed to write JSON", e);
        }
    }

    public static boolean isObject(Object value) {
        return value instanceof Map<?, ?>;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asObject(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    public static Object copy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, child) -> copy.put(String.valueOf(key), copy(child)));
            return copy;
        } else if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(child -> copy.add(copy(child)));
            return copy;
        } else {
            return value;
        }
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> copyObject(Map<String, ?> value) {
        return (Map<String, Object>) copy(value);
    }
}
