package org.resmover.document;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parses resource XML into a {@link ResourceDocument}.
 * <p>
 * Parsing happens in two passes. The JDK DOM parser checks that the text is well-formed
 * (an internal DOCTYPE subset is allowed, external DTDs and entities are never loaded);
 * a small tokenizer then splits the root element's
 * content into raw-text {@link DocumentNode}s so that nothing is re-serialized by an XML
 * library. Callers pass text that went through {@link EscapeSequences#protect(String)}.
 */
public class ResourceDocumentParser {

    private static final Logger log = LoggerFactory.getLogger(ResourceDocumentParser.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final String DOCTYPE_START = "<!DOCTYPE";

    private static final Pattern ATTRIBUTE_PATTERN =
        Pattern.compile("([\\w:.-]+)\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)')");

    private final DocumentBuilderFactory factory;

    public ResourceDocumentParser() {
        this.factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    /**
     * Parses a document.
     *
     * @param text       the protected document text.
     * @param sourceName file name used in error messages.
     * @return the parsed document.
     * @throws DocumentParseException if the text is not well-formed XML.
     */
    public ResourceDocument parse(String text, String sourceName) throws DocumentParseException {
        Element root = validate(text, sourceName);
        ResourceDocument document = new Tokenizer(text, sourceName).tokenize();

        if (!document.rootName().equals(root.getTagName())) {
            throw new DocumentParseException(sourceName, -1,
                "root element mismatch: " + root.getTagName() + " vs " + document.rootName(), null);
        }
        int expectedChildren = countChildElements(root);
        if (document.childElementCount() != expectedChildren) {
            throw new DocumentParseException(sourceName, -1,
                "expected " + expectedChildren + " child element(s) but found " + document.childElementCount(), null);
        }
        return document;
    }

    private Element validate(String text, String sourceName) throws DocumentParseException {
        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new StrictErrorHandler(sourceName));
            String content = !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
            return builder.parse(new InputSource(new StringReader(content))).getDocumentElement();
        } catch (SAXParseException e) {
            throw new DocumentParseException(sourceName, e.getLineNumber(), e.getMessage(), e);
        } catch (SAXException | IOException e) {
            throw new DocumentParseException(sourceName, -1, e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Failed to create XML parser", e);
        }
    }

    private static int countChildElements(Element root) {
        int count = 0;
        NodeList children = root.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i).getNodeType() == Node.ELEMENT_NODE) {
                count++;
            }
        }
        return count;
    }

    /**
     * Fails on errors instead of printing them to stderr.
     */
    private static final class StrictErrorHandler implements ErrorHandler {

        private final String sourceName;

        StrictErrorHandler(String sourceName) {
            this.sourceName = sourceName;
        }

        @Override
        public void warning(SAXParseException e) {
            log.debug("XML warning in {} (line {}): {}", sourceName, e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }

    private record StartTag(String name, Map<String, String> attributes, int end, boolean selfClosing) {
    }

    /**
     * Splits already validated text into prolog, root children and epilog.
     */
    private static final class Tokenizer {

        private final String text;
        private final String sourceName;

        Tokenizer(String text, String sourceName) {
            this.text = text;
            this.sourceName = sourceName;
        }

        ResourceDocument tokenize() throws DocumentParseException {
            int rootStart = findRootStart();
            StartTag root = readStartTag(rootStart);
            String prolog = text.substring(0, root.end());

            if (root.selfClosing()) {
                return new ResourceDocument(prolog, root.name(), List.of(), text.substring(root.end()), true);
            }

            List<DocumentNode> nodes = new ArrayList<>();
            int pos = root.end();
            while (true) {
                if (pos >= text.length()) {
                    throw error("unterminated root element <" + root.name() + ">");
                }
                if (text.charAt(pos) != '<') {
                    int next = require(text.indexOf('<', pos), "end of text content");
                    nodes.add(DocumentNode.text(text.substring(pos, next)));
                    pos = next;
                } else if (text.startsWith("<!--", pos)) {
                    int end = require(text.indexOf("-->", pos), "end of comment") + 3;
                    nodes.add(DocumentNode.comment(text.substring(pos, end)));
                    pos = end;
                } else if (text.startsWith("<![CDATA[", pos)) {
                    int end = require(text.indexOf("]]>", pos), "end of CDATA section") + 3;
                    nodes.add(DocumentNode.other(text.substring(pos, end)));
                    pos = end;
                } else if (text.startsWith("<?", pos)) {
                    int end = require(text.indexOf("?>", pos), "end of processing instruction") + 2;
                    nodes.add(DocumentNode.other(text.substring(pos, end)));
                    pos = end;
                } else if (text.startsWith("</", pos)) {
                    return new ResourceDocument(prolog, root.name(), nodes, text.substring(pos), false);
                } else {
                    StartTag tag = readStartTag(pos);
                    int end = tag.selfClosing() ? tag.end() : skipElementContent(tag.end());
                    nodes.add(DocumentNode.element(text.substring(pos, end), tag.name(), tag.attributes()));
                    pos = end;
                }
            }
        }

        private int findRootStart() throws DocumentParseException {
            int pos = 0;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (Character.isWhitespace(c) || c == '\uFEFF') {
                    pos++;
                } else if (text.startsWith("<?", pos)) {
                    pos = require(text.indexOf("?>", pos), "end of XML declaration") + 2;
                } else if (text.startsWith("<!--", pos)) {
                    pos = require(text.indexOf("-->", pos), "end of comment") + 3;
                } else if (text.startsWith(DOCTYPE_START, pos)) {
                    pos = skipDoctype(pos);
                } else if (c == '<') {
                    return pos;
                } else {
                    throw error("unexpected content before root element");
                }
            }
            throw error("no root element");
        }

        /**
         * Returns the index just past a DOCTYPE declaration starting at {@code pos}, skipping
         * quoted literals, comments and a bracketed internal subset.
         */
        private int skipDoctype(int pos) throws DocumentParseException {
            int depth = 0;
            char quote = 0;
            for (int i = pos + DOCTYPE_START.length(); i < text.length(); i++) {
                char c = text.charAt(i);
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    }
                } else if (depth > 0 && text.startsWith("<!--", i)) {
                    i = require(text.indexOf("-->", i), "end of comment") + 2;
                } else if (c == '"' || c == '\'') {
                    quote = c;
                } else if (c == '[') {
                    depth++;
                } else if (c == ']') {
                    depth--;
                } else if (c == '>' && depth == 0) {
                    return i + 1;
                }
            }
            throw error("unterminated DOCTYPE declaration");
        }

        /**
         * Returns the index just past the end tag matching an element whose start tag ends at {@code pos}.
         */
        private int skipElementContent(int pos) throws DocumentParseException {
            int depth = 1;
            while (true) {
                int next = require(text.indexOf('<', pos), "end tag");
                if (text.startsWith("<!--", next)) {
                    pos = require(text.indexOf("-->", next), "end of comment") + 3;
                } else if (text.startsWith("<![CDATA[", next)) {
                    pos = require(text.indexOf("]]>", next), "end of CDATA section") + 3;
                } else if (text.startsWith("<?", next)) {
                    pos = require(text.indexOf("?>", next), "end of processing instruction") + 2;
                } else if (text.startsWith("</", next)) {
                    pos = require(text.indexOf('>', next), "end tag") + 1;
                    depth--;
                    if (depth == 0) {
                        return pos;
                    }
                } else {
                    StartTag nested = readStartTag(next);
                    if (!nested.selfClosing()) {
                        depth++;
                    }
                    pos = nested.end();
                }
            }
        }

        private StartTag readStartTag(int pos) throws DocumentParseException {
            int i = pos + 1;
            while (i < text.length() && !isNameTerminator(text.charAt(i))) {
                i++;
            }
            String name = text.substring(pos + 1, i);

            char quote = 0;
            for (; i < text.length(); i++) {
                char c = text.charAt(i);
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    }
                } else if (c == '"' || c == '\'') {
                    quote = c;
                } else if (c == '>') {
                    break;
                }
            }
            if (i >= text.length()) {
                throw error("unterminated start tag <" + name);
            }

            boolean selfClosing = text.charAt(i - 1) == '/';
            int end = i + 1;
            return new StartTag(name, attributes(text.substring(pos + 1 + name.length(), end)), end, selfClosing);
        }

        private static boolean isNameTerminator(char c) {
            return Character.isWhitespace(c) || c == '/' || c == '>';
        }

        private static Map<String, String> attributes(String tagRest) {
            Map<String, String> attributes = new LinkedHashMap<>();
            Matcher matcher = ATTRIBUTE_PATTERN.matcher(tagRest);
            while (matcher.find()) {
                String value = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
                attributes.put(matcher.group(1), EscapeSequences.restore(value));
            }
            return attributes;
        }

        private int require(int index, String what) throws DocumentParseException {
            if (index < 0) {
                throw error("missing " + what);
            }
            return index;
        }

        private DocumentParseException error(String message) {
            return new DocumentParseException(sourceName, -1, message, null);
        }
    }
}
