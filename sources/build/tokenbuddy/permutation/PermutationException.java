package build.tokenbuddy.permutation;

import java.util.concurrent.CompletionException;

public class PermutationException extends CompletionException {

    private final String id;

    public PermutationException(String id, String message) {
        super("Failed to resolve permutation " + id + ": " + message);
        this.id = id;
    }

    public PermutationException(String id, Throwable cause) {
        super("Failed to resolve permutation " + id, cause);
        this.id = id;
    }

    public String id() {
        return id;
    }
}
