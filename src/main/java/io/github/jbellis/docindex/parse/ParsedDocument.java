package io.github.jbellis.docindex.parse;

import org.w3c.dom.Document;

/**
 * A tree produced by one successful parse attempt, together with the flavor it was parsed as.
 */
public record ParsedDocument(Document document, MarkupFlavor flavor) {
}
