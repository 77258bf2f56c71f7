package build.tokenbuddy.bundle;

import build.tokenbuddy.Json;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

public class BundleWriter {

    private final Path folder;

    public BundleWriter(Path folder) {
        this.folder = folder;
    }

    public Path write(Bundle bundle) throws IOException {
        Path target = folder.resolve(bundle.fileName()).normalize();
        if (!target.startsWith(folder.normalize())) {
            throw new IOException("Bundle " + bundle.id() + " would be written outside of " + folder);
        }
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target)) {
            Json.write(bundle.tokens(), writer);
        }
        return target;
    }
}
