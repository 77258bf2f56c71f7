package build.tokenbuddy;

import java.io.PrintStream;
import java.util.concurrent.CompletionException;
import java.util.function.BiConsumer;

@FunctionalInterface
public interface ResolutionCallback {

    /**
     * Announces a step. The returned consumer is invoked once the step completes, either with a status label
     * such as {@code LOADED} or with the step's failure. A {@code null} label and failure denote a skipped step.
     */
    BiConsumer<String, Throwable> step(String identity);

    static ResolutionCallback nop() {
        return identity -> (status, throwable) -> {
        };
    }

    static ResolutionCallback printing(PrintStream out) {
        return identity -> {
            long started = System.nanoTime();
            return (status, throwable) -> {
                if (throwable != null) {
                    out.printf("[FAILED] %s: %s%n", identity, throwable instanceof CompletionException
                            && throwable.getCause() != null
                            ? throwable.getCause().getMessage()
                            : throwable.getMessage());
                } else if (status != null) {
                    double time = ((double) (System.nanoTime() - started) / 1_000_000) / 1_000;
                    out.printf("[%s] %s in %.2f seconds%n", status, identity, time);
                } else {
                    out.printf("[SKIPPED] %s%n", identity);
                }
            };
        };
    }
}
