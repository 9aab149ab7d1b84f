package io.github.jbellis.docindex.parse;

import io.github.jbellis.docindex.XmlDocHolder;
import io.github.jbellis.docindex.XmlDocStore;
import io.github.jbellis.docindex.fetch.FetchResponse;
import io.github.jbellis.docindex.util.DomUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides how a raw response should be parsed and drives the parse attempts.
 * <p>
 * Web content is often mislabeled, so parsing is a fixed sequence of attempts:
 * <ol>
 *   <li>the flavor from the declared content type or URL extension (generic XML when unknown)</li>
 *   <li>if the flavor was not declared by the response, a re-parse as HTML or SVG when the
 *       root tag says so</li>
 *   <li>a lenient HTML parse when nothing else produced a tree</li>
 * </ol>
 * A failed attempt is just an empty result; nothing here throws for bad input.
 */
public class ContentResolver {
    private static final Logger logger = LogManager.getLogger(ContentResolver.class);

    private static final Pattern EXTENSION = Pattern.compile("\\.([^./]+)$");

    private final MarkupParser parser;
    private final ResolverOptions options;

    public ContentResolver() {
        this(ResolverOptions.fromSystemProperties());
    }

    public ContentResolver(ResolverOptions options) {
        this(new MarkupParser(options), options);
    }

    public ContentResolver(MarkupParser parser, ResolverOptions options) {
        this.parser = Objects.requireNonNull(parser);
        this.options = Objects.requireNonNull(options);
    }

    /**
     * Infers the parse flavor of a response: an exactly matching declared media type first, then
     * any {@code +xml} media type as generic XML, then the URL's file extension.
     *
     * @return the flavor, or empty when neither the header nor the URL tells
     */
    public static Optional<MarkupFlavor> resolveContentType(FetchResponse response) {
        var declared = declaredFlavor(response);
        if (declared.isPresent()) {
            return declared;
        }
        return flavorFromUrl(response.url());
    }

    /**
     * Parses a response into a holder, trying flavors in turn. Never throws for unparseable input.
     *
     * @param store the store the resulting holder belongs to; may be {@code null}
     * @return the holder, or empty when no attempt produced a usable tree
     */
    public Optional<XmlDocHolder> parseXMLResource(FetchResponse response, @Nullable XmlDocStore store) {
        var url = response.url();
        if (response.document() != null) {
            logger.debug("Using natively parsed document for {}", url);
            return Optional.of(new XmlDocHolder(store, url, response.document(), null));
        }

        var text = response.responseText();
        if (text == null || text.isEmpty()) {
            logger.warn("No content to parse for {}", url);
            return Optional.empty();
        }

        var declared = declaredFlavor(response);
        var resolved = declared.isPresent() ? declared : flavorFromUrl(url);
        var parsed = attempt(response, text, resolved.orElse(MarkupFlavor.XML));

        if (parsed.isPresent() && declared.isEmpty() && options.sniffRoot()) {
            parsed = reparseByRootTag(response, text, parsed.get());
        }

        if (parsed.isEmpty() && options.htmlFallback()) {
            logger.debug("Falling back to HTML parsing for {}", url);
            parsed = parser.parse(text, MarkupFlavor.HTML, url);
        }

        if (parsed.isEmpty()) {
            logger.warn("Could not parse {} as any supported markup flavor", url);
            return Optional.empty();
        }
        var result = parsed.get();
        return Optional.of(new XmlDocHolder(store, url, result.document(), result.flavor()));
    }

    /**
     * A root of {@code html} without a namespace means the content really is HTML, and a root of
     * {@code svg} gets the SVG flavor. The re-parse result replaces the first one, even if empty.
     */
    private Optional<ParsedDocument> reparseByRootTag(FetchResponse response, String text, ParsedDocument first) {
        var url = response.url();
        var root = first.document().getDocumentElement();
        var rootName = DomUtil.localName(root).toLowerCase(Locale.ROOT);
        if (rootName.equals("html") && DomUtil.namespace(root) == null) {
            logger.debug("Root of {} is a namespace-less html element, re-parsing as HTML", url);
            return parser.parse(text, MarkupFlavor.HTML, url);
        }
        if (rootName.equals("svg") && first.flavor() != MarkupFlavor.SVG) {
            logger.debug("Root of {} is svg, re-parsing as SVG", url);
            return attempt(response, text, MarkupFlavor.SVG);
        }
        return Optional.of(first);
    }

    /**
     * XML flavors read undecoded bytes when the response has no text of its own, so the XML
     * parser picks the encoding. HTML always parses the decoded text.
     */
    private Optional<ParsedDocument> attempt(FetchResponse response, String text, MarkupFlavor flavor) {
        var body = response.body();
        if (flavor.isXml() && response.text() == null && body != null) {
            return parser.parse(body, response.declaredCharset(), flavor, response.url());
        }
        return parser.parse(text, flavor, response.url());
    }

    private static Optional<MarkupFlavor> declaredFlavor(FetchResponse response) {
        var mediaType = response.mediaType();
        if (mediaType == null) {
            return Optional.empty();
        }
        var exact = MarkupFlavor.forMediaType(mediaType);
        if (exact.isPresent()) {
            return exact;
        }
        if (mediaType.endsWith("+xml")) {
            return Optional.of(MarkupFlavor.XML);
        }
        return Optional.empty();
    }

    private static Optional<MarkupFlavor> flavorFromUrl(String url) {
        var path = url;
        int cut = indexOfAny(path, '#', '?');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        var m = EXTENSION.matcher(path);
        if (!m.find()) {
            return Optional.empty();
        }
        return MarkupFlavor.forExtension(m.group(1));
    }

    private static int indexOfAny(String s, char a, char b) {
        int ia = s.indexOf(a);
        int ib = s.indexOf(b);
        if (ia < 0) return ib;
        if (ib < 0) return ia;
        return Math.min(ia, ib);
    }
}
