package org.resmover.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An editable XML resource file, modeled as the text around the root element plus the
 * root's direct children as an ordered list of raw-text nodes.
 * <p>
 * Serializing an unmodified document yields exactly the text it was parsed from; edits
 * only ever add or remove whole nodes, so everything else keeps its original formatting.
 */
public class ResourceDocument {

    /** Root tag of a container document. */
    public static final String CONTAINER_ROOT = "resources";

    static final String EMPTY_CONTAINER_PROLOG =
        "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n"
            + "<resources xmlns:tools=\"http://schemas.android.com/tools\">";
    static final String EMPTY_CONTAINER_EPILOG = "</resources>\n";

    private String prolog;
    private final String rootName;
    private final List<DocumentNode> nodes;
    private String epilog;
    private boolean selfClosingRoot;

    /**
     * @param prolog          everything up to and including the root start tag.
     * @param rootName        the root tag name as written.
     * @param nodes           the root's direct children.
     * @param epilog          everything from the root end tag on (everything after the
     *                        start tag for a self-closing root).
     * @param selfClosingRoot whether the root was written as {@code <resources/>}.
     */
    ResourceDocument(String prolog, String rootName, List<DocumentNode> nodes, String epilog, boolean selfClosingRoot) {
        this.prolog = prolog;
        this.rootName = rootName;
        this.nodes = new ArrayList<>(nodes);
        this.epilog = epilog;
        this.selfClosingRoot = selfClosingRoot;
    }

    /**
     * @return a new container document with no children.
     */
    public static ResourceDocument emptyContainer() {
        return new ResourceDocument(EMPTY_CONTAINER_PROLOG, CONTAINER_ROOT,
            List.of(DocumentNode.text("\n")), EMPTY_CONTAINER_EPILOG, false);
    }

    public String rootName() {
        return rootName;
    }

    /**
     * A container document holds many resources under a {@code <resources>} root;
     * any other root makes the whole file a single standalone resource.
     */
    public boolean isContainer() {
        int colon = rootName.indexOf(':');
        String localName = colon >= 0 ? rootName.substring(colon + 1) : rootName;
        return CONTAINER_ROOT.equals(localName);
    }

    public List<DocumentNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<DocumentNode> elements() {
        List<DocumentNode> elements = new ArrayList<>();
        for (DocumentNode node : nodes) {
            if (node.isElement()) {
                elements.add(node);
            }
        }
        return elements;
    }

    public int childElementCount() {
        return elements().size();
    }

    /**
     * Detaches an element together with the indentation before it and, when that
     * indentation follows a comment, the comment and the indentation before the comment:
     * <pre>
     *   WHITESPACE   "\n    "
     *   COMMENT      "&lt;!-- Label on the checkout button --&gt;"
     *   WHITESPACE   "\n    "
     *   ELEMENT      "&lt;string name="checkout"&gt;Checkout&lt;/string&gt;"
     * </pre>
     * All four nodes are detached when the element is.
     *
     * @param element an element node of this document (matched by identity).
     * @return the detached nodes in document order, ending with the element.
     * @throws IllegalArgumentException if the node is not a child of this document.
     */
    public List<DocumentNode> detach(DocumentNode element) {
        int index = indexOf(element);
        if (index < 0) {
            throw new IllegalArgumentException("Node is not a child of this document: " + element.text());
        }

        int start = index;
        if (isWhitespaceAt(index - 1)) {
            start = index - 1;
            if (isCommentAt(index - 2)) {
                start = index - 2;
                if (isWhitespaceAt(index - 3)) {
                    start = index - 3;
                }
            }
        }

        List<DocumentNode> range = nodes.subList(start, index + 1);
        List<DocumentNode> detached = new ArrayList<>(range);
        range.clear();
        return detached;
    }

    /**
     * Appends nodes to the end of the root's content.
     */
    public void append(List<DocumentNode> content) {
        nodes.addAll(content);
    }

    /**
     * Replaces the leading run of whitespace nodes with a single newline plus indentation.
     */
    public void collapseLeadingWhitespace(String indentation) {
        while (!nodes.isEmpty() && nodes.get(0).isWhitespace()) {
            nodes.remove(0);
        }
        nodes.add(0, DocumentNode.text("\n" + indentation));
    }

    /**
     * Removes the trailing run of whitespace nodes.
     */
    public void dropTrailingWhitespace() {
        while (!nodes.isEmpty() && nodes.get(nodes.size() - 1).isWhitespace()) {
            nodes.remove(nodes.size() - 1);
        }
    }

    public void appendNewline() {
        nodes.add(DocumentNode.text("\n"));
    }

    /**
     * @return the document text (escape sequences still protected).
     */
    public String serialize() {
        if (selfClosingRoot && !nodes.isEmpty()) {
            expandSelfClosingRoot();
        }

        StringBuilder out = new StringBuilder(prolog);
        for (DocumentNode node : nodes) {
            out.append(node.text());
        }
        out.append(epilog);
        return out.toString();
    }

    private void expandSelfClosingRoot() {
        int slash = prolog.lastIndexOf('/');
        prolog = prolog.substring(0, slash) + prolog.substring(slash + 1);
        epilog = "</" + rootName + ">" + epilog;
        selfClosingRoot = false;
    }

    private int indexOf(DocumentNode node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    private boolean isWhitespaceAt(int index) {
        return index >= 0 && index < nodes.size() && nodes.get(index).isWhitespace();
    }

    private boolean isCommentAt(int index) {
        return index >= 0 && index < nodes.size() && nodes.get(index).isComment();
    }
}
