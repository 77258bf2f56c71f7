package build.tokenbuddy.project;

import build.tokenbuddy.ast.Reference;
import build.tokenbuddy.ast.ReferenceNotation;
import build.tokenbuddy.source.TokenSource;

import java.nio.file.Path;

public record CrossFileReference(String fromFile, String fromToken, String toFile, String toToken, String reference) {

    public static CrossFileReference of(String file, Reference reference) {
        return new CrossFileReference(file,
                reference.from(),
                resolveFile(file, ReferenceNotation.file(reference.to())),
                ReferenceNotation.fragment(reference.to()),
                reference.to());
    }

    public static String resolveFile(String from, String file) {
        Path parent = Path.of(from).getParent();
        return TokenSource.normalize((parent == null ? Path.of(file) : parent.resolve(file)).toString());
    }

    public String target() {
        return toToken == null ? toFile : toFile + "#" + toToken;
    }
}
