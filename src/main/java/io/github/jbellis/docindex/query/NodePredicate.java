package io.github.jbellis.docindex.query;

import io.github.jbellis.docindex.util.DomUtil;
import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Composable node test. Every {@code with*} method returns a new predicate that requires this
 * one and the added condition.
 */
public final class NodePredicate {

    /**
     * Matches every node; the usual starting point for composition.
     */
    public static final NodePredicate ANY = new NodePredicate(node -> true);

    private final Predicate<Node> test;

    public NodePredicate(Predicate<Node> test) {
        this.test = Objects.requireNonNull(test);
    }

    public boolean check(Node node) {
        return test.test(node);
    }

    /**
     * Also requires an element whose attribute {@code name} equals {@code value}.
     */
    public NodePredicate withAttribute(String name, String value) {
        return new NodePredicate(node -> check(node)
                && DomUtil.isElement(node)
                && value.equals(DomUtil.attribute((Element) node, name)));
    }

    /**
     * Also requires at least one child element with local name {@code name}.
     */
    public NodePredicate withChild(String name) {
        return withChild(name, null);
    }

    /**
     * Also requires at least one child element with local name {@code name} that satisfies
     * {@code childPredicate} (any such child when {@code null}).
     */
    public NodePredicate withChild(String name, @Nullable NodePredicate childPredicate) {
        return new NodePredicate(node -> {
            if (!check(node)) {
                return false;
            }
            var children = new NodeList(List.of(node)).child(name);
            if (childPredicate != null) {
                children = children.filter(childPredicate);
            }
            return children.size() > 0;
        });
    }
}
