package org.resmover.document;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps character and entity references ({@code &apos;}, {@code &#160;}) spelled as written.
 * <p>
 * XML parsers resolve references to the characters they stand for, and unknown entities
 * such as {@code &nbsp;} are fatal. Before parsing, the leading {@code &} of every reference
 * is replaced by a marker; {@link #restore(String)} puts it back before text is written.
 */
public final class EscapeSequences {

    static final String START_MARKER = "__RESMOVER_ESCAPE_SEQUENCE_START__";

    private static final Pattern ESCAPE_SEQUENCE_PATTERN = Pattern.compile("&([\\w#]+;)");
    private static final String PROTECTED_REPLACEMENT = Matcher.quoteReplacement(START_MARKER) + "$1";

    private EscapeSequences() {
    }

    /**
     * @return {@code text} with every escape sequence's {@code &} replaced by the marker.
     */
    public static String protect(String text) {
        return ESCAPE_SEQUENCE_PATTERN.matcher(text).replaceAll(PROTECTED_REPLACEMENT);
    }

    /**
     * @return {@code text} with every marker replaced by {@code &}.
     */
    public static String restore(String text) {
        return text.replace(START_MARKER, "&");
    }
}
