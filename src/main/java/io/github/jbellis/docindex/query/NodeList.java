package io.github.jbellis.docindex.query;

import io.github.jbellis.docindex.util.DomUtil;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Immutable list of nodes with declarative navigation: filter, step to children, extract values.
 * Purely structural; nothing is cached and offsets play no part.
 */
public final class NodeList {
    private final List<Node> nodes;

    public NodeList(List<? extends Node> nodes) {
        this.nodes = List.copyOf(nodes);
    }

    public List<Node> asList() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public NodeList filter(NodePredicate predicate) {
        var result = new ArrayList<Node>();
        for (var node : nodes) {
            if (predicate.check(node)) {
                result.add(node);
            }
        }
        return new NodeList(result);
    }

    /**
     * Builds a new list by letting {@code fn} emit any number of nodes for each node here.
     */
    public NodeList forEachNode(BiConsumer<Node, Consumer<Node>> fn) {
        var result = new ArrayList<Node>();
        for (var node : nodes) {
            fn.accept(node, result::add);
        }
        return new NodeList(result);
    }

    /**
     * One value per node, nulls included.
     */
    public <T> List<T> map(Function<Node, T> fn) {
        var result = new ArrayList<T>(nodes.size());
        for (var node : nodes) {
            result.add(fn.apply(node));
        }
        return result;
    }

    /**
     * One value per node, with null results dropped.
     */
    public <T> List<T> mapNonNull(Function<Node, T> fn) {
        var result = new ArrayList<T>();
        for (var node : nodes) {
            var value = fn.apply(node);
            if (value != null) {
                result.add(value);
            }
        }
        return result;
    }

    /**
     * Child elements with the given local name.
     */
    public NodeList child(String localName) {
        return forEachNode((node, add) -> {
            for (Node c = node.getFirstChild(); c != null; c = c.getNextSibling()) {
                if (DomUtil.isElement(c) && localName.equals(DomUtil.localName(c))) {
                    add.accept(c);
                }
            }
        });
    }

    public NodeList childElements() {
        return forEachNode((node, add) -> {
            for (Node c = node.getFirstChild(); c != null; c = c.getNextSibling()) {
                if (DomUtil.isElement(c)) {
                    add.accept(c);
                }
            }
        });
    }

    /**
     * Values of attribute {@code name} on the elements here; missing attributes are skipped.
     */
    public List<String> attribute(String name) {
        return mapNonNull(node -> DomUtil.isElement(node) ? DomUtil.attribute((Element) node, name) : null);
    }

    /**
     * Text content of each node. The document node has none and yields null.
     */
    public List<String> textContent() {
        return map(Node::getTextContent);
    }
}
