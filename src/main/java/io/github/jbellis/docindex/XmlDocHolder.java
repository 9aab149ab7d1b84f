package io.github.jbellis.docindex;

import io.github.jbellis.docindex.parse.MarkupFlavor;
import io.github.jbellis.docindex.query.NodeList;
import io.github.jbellis.docindex.util.DomUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.html.HTMLDocument;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;

/**
 * Wraps one parsed document and answers positional and identifier queries against it.
 *
 * <h3>Offsets</h3>
 * Every node gets a position in a linearization of the document: an element takes one unit,
 * a text run takes as many units as it has characters. Offsets follow document order and the
 * root element is at 0.
 * <p>
 * Element offsets are assigned lazily by a forward pre-order walk that resumes from wherever the
 * previous query stopped ({@link #lastVisited}/{@link #lastOffset}), and each element passed is
 * recorded in a side table. A scan over the whole document therefore costs O(n) in total, and
 * repeated queries for the same element are O(1).
 *
 * <h3>Identifiers</h3>
 * {@link #getElement(String)} resolves {@code #id} and {@code url#id} references through the
 * tree's own id lookup, then the HTML name lookup, then a private index of {@code id} and
 * {@code xml:id} attributes built on first use.
 * <p>
 * The tree itself is never modified. All cache state is guarded by the holder's monitor.
 */
public class XmlDocHolder {
    private static final Logger logger = LogManager.getLogger(XmlDocHolder.class);

    private static final Pattern REFERENCE = Pattern.compile("([^#]*)#(.+)$");

    private final @Nullable XmlDocStore store;
    private final String url;
    private final Document document;
    private final @Nullable MarkupFlavor flavor;

    private final Element root;
    private final @Nullable Element head;
    private final @Nullable Element body;
    private final @Nullable String lang;

    // Offset cache: every element the traversal has passed, plus the cursor it resumes from
    private final Map<Element, Integer> elementOffsets = new IdentityHashMap<>();
    private Node lastVisited;
    private int lastOffset = 1;
    private int totalOffset = -1;

    private @Nullable Map<String, Element> idIndex;

    /**
     * @param store    owning store, if any
     * @param url      URL the document was loaded from; {@code url#id} references must match it
     * @param document the parsed tree; it must have a document element
     * @param flavor   flavor the document was parsed as, or {@code null} when it came pre-parsed
     */
    public XmlDocHolder(@Nullable XmlDocStore store, String url, Document document, @Nullable MarkupFlavor flavor) {
        this.store = store;
        this.url = Objects.requireNonNull(url, "url");
        this.document = Objects.requireNonNull(document, "document");
        this.flavor = flavor;

        var documentElement = document.getDocumentElement();
        if (documentElement == null) {
            throw new IllegalArgumentException("Document for " + url + " has no root element");
        }
        this.root = documentElement;

        Element headElement = null;
        Element bodyElement = null;
        if (DomUtil.NS_XHTML.equals(DomUtil.namespace(root))) {
            for (var child : DomUtil.elementChildren(root)) {
                if (!DomUtil.NS_XHTML.equals(DomUtil.namespace(child))) {
                    continue;
                }
                switch (DomUtil.localName(child)) {
                    case "head" -> {
                        if (headElement == null) headElement = child;
                    }
                    case "body" -> {
                        if (bodyElement == null) bodyElement = child;
                    }
                    default -> { }
                }
            }
        }
        this.head = headElement;
        this.body = bodyElement;
        this.lang = resolveLang(root);

        this.lastVisited = root;
        elementOffsets.put(root, 0);
    }

    public @Nullable XmlDocStore getStore() {
        return store;
    }

    public String getUrl() {
        return url;
    }

    public Document getDocument() {
        return document;
    }

    public @Nullable MarkupFlavor getFlavor() {
        return flavor;
    }

    public Element getRoot() {
        return root;
    }

    /**
     * The XHTML {@code head} element, or null when the root is not in the XHTML namespace.
     */
    public @Nullable Element getHead() {
        return head;
    }

    /**
     * The XHTML {@code body} element, or null when the root is not in the XHTML namespace.
     */
    public @Nullable Element getBody() {
        return body;
    }

    /**
     * Root's {@code lang}, else {@code xml:lang}, else null.
     */
    public @Nullable String getLang() {
        return lang;
    }

    /**
     * A query list holding just the document node.
     */
    public NodeList doc() {
        return new NodeList(List.of(document));
    }

    /**
     * Offset of an element. Resumes the forward walk from the last visited node when the element
     * has not been reached yet, recording the offset of every element passed on the way.
     *
     * @throws OffsetTraversalException if the element is not reachable in document order, i.e. it
     *                                  is not part of this document
     */
    public synchronized int getElementOffset(Element element) {
        var cached = elementOffsets.get(element);
        if (cached != null) {
            return cached;
        }
        int offset = lastOffset;
        Node last = lastVisited;
        while (last != element) {
            Node next = last.getFirstChild();
            if (next == null) {
                while (true) {
                    next = last.getNextSibling();
                    if (next != null) {
                        break;
                    }
                    last = last.getParentNode();
                    if (last == null) {
                        throw new OffsetTraversalException("Element <" + element.getNodeName()
                                                           + "> is not reachable in " + url);
                    }
                }
            }
            last = next;
            if (DomUtil.isElement(next)) {
                elementOffsets.put((Element) next, offset);
                ++offset;
            } else {
                offset += DomUtil.textLength(next);
            }
        }
        logger.trace("Offset index for {} advanced to {}", url, offset);
        lastOffset = offset;
        lastVisited = element;
        return offset - 1;
    }

    /**
     * Offset of an arbitrary position.
     * <ul>
     *   <li>element, {@code after == false}: the element's own offset</li>
     *   <li>element, {@code after == true}: the offset just past the element's subtree</li>
     *   <li>any other node: the offset of character {@code offsetInNode} within it</li>
     * </ul>
     * The subtree end is found by walking backward from the deepest last descendant, summing text
     * lengths until an element boundary is hit.
     */
    public synchronized int getNodeOffset(Node node, int offsetInNode, boolean after) {
        if (offsetInNode < 0) {
            throw new IllegalArgumentException("offsetInNode must not be negative: " + offsetInNode);
        }
        int extraOffset = 0;
        Node current = node;
        if (DomUtil.isElement(current)) {
            if (!after) {
                return getElementOffset((Element) current);
            }
        } else {
            extraOffset = offsetInNode;
            var prev = current.getPreviousSibling();
            if (prev == null) {
                return getElementOffset(boundary(current.getParentNode())) + extraOffset + 1;
            }
            current = prev;
        }

        while (true) {
            while (current.getLastChild() != null) {
                current = current.getLastChild();
            }
            if (DomUtil.isElement(current)) {
                // childless element
                break;
            }
            extraOffset += DomUtil.textLength(current);
            var prev = current.getPreviousSibling();
            if (prev == null) {
                current = current.getParentNode();
                break;
            }
            current = prev;
        }
        return getElementOffset(boundary(current)) + extraOffset + 1;
    }

    /**
     * Length of the whole document in offset units, computed once.
     */
    public synchronized int getTotalOffset() {
        if (totalOffset < 0) {
            totalOffset = getNodeOffset(root, 0, true);
        }
        return totalOffset;
    }

    /**
     * Floor lookup: the last node whose offset does not exceed {@code offset}.
     * <p>
     * Descends from the root by binary search over element children, then scans the text that
     * follows the element found. Whitespace-only text right before the next element yields that
     * element instead. Never fails; the worst case is the element found by the descent.
     */
    public synchronized Node getNodeByOffset(int offset) {
        Element element = root;
        int elementOffset;
        while (true) {
            elementOffset = getElementOffset(element);
            if (elementOffset >= offset) {
                return element;
            }
            var children = DomUtil.elementChildren(element);
            int index = firstIndexMatching(children.size(), i -> getElementOffset(children.get(i)) > offset);
            if (index == 0) {
                break;
            }
            element = children.get(index - 1);
        }

        int nodeOffset = elementOffset + 1;
        Node current = element;
        Node next = current.getFirstChild() != null ? current.getFirstChild() : current.getNextSibling();
        Node lastGood = null;
        while (true) {
            if (next != null) {
                if (DomUtil.isElement(next)) {
                    break;
                }
                current = next;
                lastGood = current;
                nodeOffset += DomUtil.textLength(next);
                if (nodeOffset > offset && !DomUtil.isWhitespace(next)) {
                    break;
                }
            } else {
                current = current.getParentNode();
                if (current == null) {
                    break;
                }
            }
            next = current.getNextSibling();
        }
        if (next != null && lastGood != null && DomUtil.isWhitespace(lastGood)) {
            lastGood = next;
        }
        return lastGood != null ? lastGood : element;
    }

    /**
     * Resolves a {@code #id} or {@code url#id} reference. A reference without a fragment, or
     * naming a different document, resolves to nothing.
     */
    public Optional<Element> getElement(String reference) {
        var m = REFERENCE.matcher(reference);
        if (!m.find()) {
            return Optional.empty();
        }
        var referencedUrl = m.group(1);
        if (!referencedUrl.isEmpty() && !referencedUrl.equals(url)) {
            return Optional.empty();
        }
        return getElementById(m.group(2));
    }

    /**
     * Looks up an element by identifier: native id lookup, then HTML {@code name} lookup, then
     * the holder's own {@code id}/{@code xml:id} index.
     */
    public synchronized Optional<Element> getElementById(String id) {
        Element result = document.getElementById(id);
        if (result == null && document instanceof HTMLDocument htmlDocument) {
            var named = htmlDocument.getElementsByName(id);
            if (named.getLength() > 0) {
                result = (Element) named.item(0);
            }
        }
        if (result == null) {
            if (idIndex == null) {
                idIndex = buildIdIndex();
            }
            result = idIndex.get(id);
        }
        return Optional.ofNullable(result);
    }

    private Map<String, Element> buildIdIndex() {
        var index = new HashMap<String, Element>();
        for (Node n = root; n != null; n = nextInDocumentOrder(n)) {
            if (!DomUtil.isElement(n)) {
                continue;
            }
            var e = (Element) n;
            var id = DomUtil.attribute(e, "id");
            if (id != null && !id.isEmpty()) {
                index.putIfAbsent(id, e);
            }
            var xmlId = DomUtil.attributeNS(e, DomUtil.NS_XML, "id", "xml:id");
            if (xmlId != null && !xmlId.isEmpty()) {
                index.putIfAbsent(xmlId, e);
            }
        }
        logger.debug("Built id index for {} with {} entries", url, index.size());
        return index;
    }

    /**
     * Pre-order successor of {@code node} within the root element's subtree, or null at the end.
     */
    private @Nullable Node nextInDocumentOrder(Node node) {
        var first = node.getFirstChild();
        if (first != null) {
            return first;
        }
        for (Node n = node; n != null && n != root; n = n.getParentNode()) {
            var sibling = n.getNextSibling();
            if (sibling != null) {
                return sibling;
            }
        }
        return null;
    }

    /**
     * Smallest index in {@code [0, size)} for which {@code test} holds, or {@code size} if none.
     * {@code test} must be monotone: false for a prefix of the range and true for the rest.
     */
    static int firstIndexMatching(int size, IntPredicate test) {
        int low = 0;
        int high = size;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (test.test(mid)) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }

    private Element boundary(@Nullable Node node) {
        if (!DomUtil.isElement(node)) {
            throw new OffsetTraversalException("Position is not inside the root element of " + url);
        }
        return (Element) node;
    }

    private static @Nullable String resolveLang(Element root) {
        var lang = DomUtil.attribute(root, "lang");
        if (lang == null || lang.isEmpty()) {
            lang = DomUtil.attributeNS(root, DomUtil.NS_XML, "lang", "xml:lang");
        }
        return lang == null || lang.isEmpty() ? null : lang;
    }
}
