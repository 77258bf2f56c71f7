package build.tokenbuddy.merge;

public class MergeConflictException extends RuntimeException {

    private final String path, base, overlay;

    public MergeConflictException(String message, String path, String base, String overlay) {
        super(message + " at path: " + (path.isEmpty() ? "<root>" : path));
        this.path = path;
        this.base = base;
        this.overlay = overlay;
    }

    public String path() {
        return path;
    }

    public String base() {
        return base;
    }

    public String overlay() {
        return overlay;
    }
}
