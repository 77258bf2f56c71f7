package build.tokenbuddy.manifest;

import java.util.List;

public record TokenSet(String name, List<String> files, String description) {

    public TokenSet {
        files = List.copyOf(files);
    }
}
