package io.github.jbellis.docindex.query;

import io.github.jbellis.docindex.XmlDocHolder;
import io.github.jbellis.docindex.testutil.TestDocs;
import io.github.jbellis.docindex.util.DomUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Declarative navigation over a package-document-like tree.
 */
public class NodeListTest {

    private static final String PACKAGE = """
            <package version="3.0">
              <metadata><title>Moby Dick</title><language>en</language></metadata>
              <manifest>
                <item id="c1" href="chapter1.xhtml" media-type="application/xhtml+xml"/>
                <item id="css" href="style.css" media-type="text/css"/>
                <item id="c2" href="chapter2.xhtml" media-type="application/xhtml+xml" properties="nav"/>
              </manifest>
              <spine><itemref idref="c1"/><itemref idref="c2"/></spine>
            </package>""";

    private XmlDocHolder holder;

    @BeforeEach
    void setUp() {
        holder = TestDocs.holder(PACKAGE);
    }

    @Test
    public void testChildSteps() {
        var items = holder.doc().child("package").child("manifest").child("item");
        assertEquals(3, items.size());
        assertEquals(List.of("c1", "css", "c2"), items.attribute("id"));
    }

    @Test
    public void testFilterByAttribute() {
        var xhtml = holder.doc().child("package").child("manifest").child("item")
                          .filter(NodePredicate.ANY.withAttribute("media-type", "application/xhtml+xml"));
        assertEquals(List.of("chapter1.xhtml", "chapter2.xhtml"), xhtml.attribute("href"));
    }

    @Test
    public void testComposedPredicatesAreConjunctions() {
        var nav = NodePredicate.ANY
                .withAttribute("media-type", "application/xhtml+xml")
                .withAttribute("properties", "nav");
        var items = holder.doc().child("package").child("manifest").child("item").filter(nav);
        assertEquals(List.of("c2"), items.attribute("id"));
    }

    @Test
    public void testWithChild() {
        var sections = holder.doc().child("package").childElements();
        assertEquals(3, sections.size());

        var withItems = sections.filter(NodePredicate.ANY.withChild("item"));
        assertEquals(List.of("manifest"), withItems.map(DomUtil::localName));

        var cssOwner = sections.filter(NodePredicate.ANY.withChild("item", NodePredicate.ANY.withAttribute("id", "css")));
        assertEquals(1, cssOwner.size());
        var none = sections.filter(NodePredicate.ANY.withChild("item", NodePredicate.ANY.withAttribute("id", "nope")));
        assertEquals(0, none.size());
    }

    @Test
    public void testAttributeSkipsMissingValues() {
        var items = holder.doc().child("package").child("manifest").child("item");
        assertEquals(List.of("nav"), items.attribute("properties"));
    }

    @Test
    public void testTextContent() {
        var title = holder.doc().child("package").child("metadata").child("title");
        assertEquals(List.of("Moby Dick"), title.textContent());
    }

    @Test
    public void testMapKeepsNullsAndMapNonNullDropsThem() {
        var items = holder.doc().child("package").child("manifest").child("item");
        List<String> props = items.map(n -> DomUtil.attribute((Element) n, "properties"));
        assertEquals(Arrays.asList(null, null, "nav"), props);
        assertEquals(List.of("nav"), items.mapNonNull(n -> DomUtil.attribute((Element) n, "properties")));
    }

    @Test
    public void testForEachNodeCanEmitSeveralNodes() {
        var spine = holder.doc().child("package").child("spine");
        var refs = spine.forEachNode((node, add) -> {
            for (Node c = node.getFirstChild(); c != null; c = c.getNextSibling()) {
                add.accept(c);
                add.accept(c);
            }
        });
        assertEquals(4, refs.size());
    }

    @Test
    public void testPredicateOnNonElementNodes() {
        var text = holder.getDocument().createTextNode("loose");
        assertTrue(NodePredicate.ANY.check(text));
        assertFalse(NodePredicate.ANY.withAttribute("id", "x").check(text));
        assertFalse(NodePredicate.ANY.withChild("item").check(text));
    }

    @Test
    public void testEmptyList() {
        var empty = holder.doc().child("nothing");
        assertEquals(0, empty.size());
        assertEquals(0, empty.childElements().size());
        assertTrue(empty.attribute("id").isEmpty());
    }
}
