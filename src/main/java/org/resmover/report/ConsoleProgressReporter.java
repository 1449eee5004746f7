package org.resmover.report;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints progress frames to a writer:
 * <pre>
 * ┏━(Round #1)━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
 * ┃ modules/checkout: Moved 3 matching resource(s).
 * ┗━(0.412s)━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
 * </pre>
 * Every message is also logged at DEBUG.
 */
public class ConsoleProgressReporter implements ProgressReporter {

    private static final Logger log = LoggerFactory.getLogger(ConsoleProgressReporter.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String RULE = "━";
    private static final String BAR = "┃ ";

    private final PrintWriter out;
    private final boolean color;
    private final int frameWidth;

    public ConsoleProgressReporter(PrintWriter out, boolean color, int frameWidth) {
        this.out = out;
        this.color = color;
        this.frameWidth = frameWidth;
    }

    @Override
    public void report(int depth, Status status, String message) {
        log.debug("{}", message);
        out.println(BAR.repeat(depth) + colorize(status, message));
        out.flush();
    }

    @Override
    public void openFrame(int depth, String title) {
        log.debug("Begin: {}", title);
        println(depth, "┏━(" + title + ")");
    }

    @Override
    public void closeFrame(int depth, Duration elapsed) {
        String seconds = String.format(Locale.ROOT, "%.3fs", elapsed.toMillis() / 1000.0);
        println(depth, "┗━(" + seconds + ")");
    }

    private void println(int depth, String header) {
        String prefix = BAR.repeat(depth);
        int fill = Math.max(0, frameWidth - prefix.length() - header.length());
        out.println(prefix + header + RULE.repeat(fill));
        out.flush();
    }

    private String colorize(Status status, String message) {
        if (!color) {
            return message;
        }
        return switch (status) {
            case SUCCESS -> ANSI_GREEN + message + ANSI_RESET;
            case NOTICE -> ANSI_YELLOW + message + ANSI_RESET;
            case FAILURE -> ANSI_RED + message + ANSI_RESET;
            default -> message;
        };
    }
}
