package org.resmover.report;

import java.io.IOException;
import java.time.Duration;

/**
 * Receives human-readable progress of a move or remove run.
 * <p>
 * Messages are nested in frames; {@code depth} is the number of enclosing frames, so
 * implementations can indent without keeping state per frame.
 */
public interface ProgressReporter {

    /**
     * Severity of a progress message, used for highlighting.
     */
    enum Status {
        INFO,
        SUCCESS,
        NOTICE,
        FAILURE
    }

    /**
     * Body of a frame, receiving the depth for its own messages.
     *
     * @param <T> the body's result type.
     */
    @FunctionalInterface
    interface FrameBody<T> {
        T run(int depth) throws IOException;
    }

    void report(int depth, Status status, String message);

    void openFrame(int depth, String title);

    void closeFrame(int depth, Duration elapsed);

    default void report(int depth, String message) {
        report(depth, Status.INFO, message);
    }

    /**
     * Runs {@code body} inside a titled frame whose footer shows the elapsed time.
     * The frame is closed even if the body fails.
     */
    default <T> T frame(int depth, String title, FrameBody<T> body) throws IOException {
        openFrame(depth, title);
        long start = System.nanoTime();
        try {
            return body.run(depth + 1);
        } finally {
            closeFrame(depth, Duration.ofNanos(System.nanoTime() - start));
        }
    }
}
