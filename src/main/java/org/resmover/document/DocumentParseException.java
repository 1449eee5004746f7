package org.resmover.document;

import java.io.IOException;

/**
 * Thrown when a resource file is not well-formed XML.
 */
public class DocumentParseException extends IOException {

    private final String source;
    private final int line;

    /**
     * @param source the file or logical name that failed to parse.
     * @param line   1-based line of the problem, or {@code -1} if unknown.
     * @param message description of the problem.
     * @param cause  the underlying parser error, may be {@code null}.
     */
    public DocumentParseException(String source, int line, String message, Throwable cause) {
        super(format(source, line, message), cause);
        this.source = source;
        this.line = line;
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    private static String format(String source, int line, String message) {
        return line > 0
            ? "Malformed XML in " + source + " (line " + line + "): " + message
            : "Malformed XML in " + source + ": " + message;
    }
}
