package build.tokenbuddy.bundle;

public class TransformException extends RuntimeException {

    private final String transform, permutation;

    public TransformException(String transform, String permutation, Throwable cause) {
        super("Transform '" + transform + "' failed for permutation '" + permutation + "': " + cause.getMessage(),
                cause);
        this.transform = transform;
        this.permutation = permutation;
    }

    public String transform() {
        return transform;
    }

    public String permutation() {
        return permutation;
    }
}
