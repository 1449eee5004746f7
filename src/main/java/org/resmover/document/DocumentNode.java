package org.resmover.document;

import java.util.Map;
import java.util.Objects;

/**
 * A direct child of a container document's root, kept as its exact source text.
 *
 * @param kind       what the text is.
 * @param text       the raw text, byte-for-byte as read (escape sequences protected).
 * @param tagName    element tag, or {@code null} for non-elements.
 * @param attributes start tag attributes of an element, empty for non-elements.
 */
public record DocumentNode(Kind kind, String text, String tagName, Map<String, String> attributes) {

    /**
     * Node categories the editor distinguishes.
     */
    public enum Kind {
        ELEMENT,
        COMMENT,
        /** Text consisting only of whitespace. */
        WHITESPACE,
        /** Text with non-whitespace content. */
        TEXT,
        /** Processing instructions and CDATA sections. */
        OTHER
    }

    public DocumentNode {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static DocumentNode element(String text, String tagName, Map<String, String> attributes) {
        return new DocumentNode(Kind.ELEMENT, text, tagName, attributes);
    }

    public static DocumentNode comment(String text) {
        return new DocumentNode(Kind.COMMENT, text, null, null);
    }

    /**
     * @return a {@link Kind#WHITESPACE} or {@link Kind#TEXT} node depending on content.
     */
    public static DocumentNode text(String text) {
        return new DocumentNode(text.isBlank() ? Kind.WHITESPACE : Kind.TEXT, text, null, null);
    }

    public static DocumentNode other(String text) {
        return new DocumentNode(Kind.OTHER, text, null, null);
    }

    public boolean isElement() {
        return kind == Kind.ELEMENT;
    }

    public boolean isComment() {
        return kind == Kind.COMMENT;
    }

    public boolean isWhitespace() {
        return kind == Kind.WHITESPACE;
    }

    /**
     * @return the attribute value, or {@code null}.
     */
    public String attribute(String name) {
        return attributes.get(name);
    }
}
