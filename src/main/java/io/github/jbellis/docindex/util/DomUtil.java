package io.github.jbellis.docindex.util;

import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Small helpers over the W3C DOM used by the offset index and the query layer.
 */
public final class DomUtil {

    public static final String NS_XHTML = "http://www.w3.org/1999/xhtml";
    public static final String NS_XML = "http://www.w3.org/XML/1998/namespace";
    public static final String NS_SVG = "http://www.w3.org/2000/svg";

    private static final Pattern WHITESPACE_ONLY = Pattern.compile("^\\s*$");

    private DomUtil() {
        // Utility class - prevent instantiation
    }

    public static boolean isElement(@Nullable Node node) {
        return node != null && node.getNodeType() == Node.ELEMENT_NODE;
    }

    /**
     * Number of offset units a non-element node occupies: the length of its text content,
     * or 0 for nodes that have none (doctype, notation).
     */
    public static int textLength(Node node) {
        var text = node.getTextContent();
        return text == null ? 0 : text.length();
    }

    /**
     * True for null, empty or whitespace-only text content.
     */
    public static boolean isWhitespace(Node node) {
        var text = node.getTextContent();
        return text == null || WHITESPACE_ONLY.matcher(text).matches();
    }

    /**
     * Local name of a node, falling back to the node name for trees built without namespace support.
     */
    public static String localName(Node node) {
        var local = node.getLocalName();
        if (local != null) {
            return local;
        }
        var name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    /**
     * Namespace URI of a node, with the empty string normalized to null.
     */
    public static @Nullable String namespace(Node node) {
        var ns = node.getNamespaceURI();
        return ns == null || ns.isEmpty() ? null : ns;
    }

    /**
     * Element children of {@code element} in document order.
     */
    public static List<Element> elementChildren(Element element) {
        var result = new ArrayList<Element>();
        for (Node c = element.getFirstChild(); c != null; c = c.getNextSibling()) {
            if (c.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) c);
            }
        }
        return result;
    }

    /**
     * Attribute value or null when the attribute is absent. {@link Element#getAttribute} returns
     * the empty string for both missing and empty attributes, which we need to tell apart.
     */
    public static @Nullable String attribute(Element element, String name) {
        var attr = element.getAttributeNode(name);
        return attr == null ? null : attr.getValue();
    }

    /**
     * Namespaced attribute lookup. Trees built by a non-namespace-aware parser keep prefixed
     * names as plain attributes, so {@code xml:id} is also looked up literally.
     */
    public static @Nullable String attributeNS(Element element, String namespace, String localName, String qualifiedName) {
        var attr = element.getAttributeNodeNS(namespace, localName);
        if (attr != null) {
            return attr.getValue();
        }
        return attribute(element, qualifiedName);
    }
}
