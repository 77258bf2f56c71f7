package build.tokenbuddy.bundle;

import java.util.List;
import java.util.Map;

public record Bundle(String id, String output, List<String> files, Map<String, Object> tokens) {

    public Bundle {
        files = List.copyOf(files);
    }

    public String fileName() {
        return output == null ? id + ".json" : output;
    }
}
