package build.tokenbuddy.ast;

public final class Reference {

    private final String from, to;
    private final boolean external;

    private String resolvedPath;
    private boolean valid, circular;

    public Reference(String from, String to) {
        this.from = from;
        this.to = to;
        external = to != null && ReferenceNotation.isExternal(to);
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }

    public boolean isExternal() {
        return external;
    }

    public String resolvedPath() {
        return resolvedPath;
    }

    public boolean isValid() {
        return valid;
    }

    public boolean isCircular() {
        return circular;
    }

    public boolean isFollowable() {
        return valid && !circular && !external && resolvedPath != null;
    }

    public void resolve(String resolvedPath) {
        this.resolvedPath = resolvedPath;
        valid = true;
    }

    public void reject() {
        valid = false;
    }

    public void markCircular() {
        circular = true;
    }

    @Override
    public String toString() {
        return "Reference{" + from + " -> " + to + "}";
    }
}
