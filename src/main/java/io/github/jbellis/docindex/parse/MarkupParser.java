package io.github.jbellis.docindex.parse;

import io.github.jbellis.docindex.util.DomUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.helper.W3CDom;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.Charset;
import java.util.Optional;

/**
 * Turns text into a W3C DOM tree for a given {@link MarkupFlavor}.
 * <p>
 * HTML goes through jsoup's lenient HTML5 parser and is converted with {@link W3CDom}, with the
 * root placed in the XHTML namespace. The XML flavors go through the JDK's namespace-aware
 * {@link DocumentBuilder}, where any well-formedness error fails the attempt. Raw bytes go to
 * that parser undecoded so it can honor byte order marks and encoding declarations.
 * <p>
 * Some parsers report errors as output rather than by failing, so a {@code parsererror} element
 * as the root or among the root's element children also counts as a failed attempt.
 */
public class MarkupParser {
    private static final Logger logger = LogManager.getLogger(MarkupParser.class);

    static final String PARSER_ERROR_TAG = "parsererror";

    private final DocumentBuilderFactory xmlFactory;

    public MarkupParser() {
        this(ResolverOptions.DEFAULTS);
    }

    public MarkupParser(ResolverOptions options) {
        this.xmlFactory = createXmlFactory(options.loadExternalDtd());
    }

    /**
     * Parses {@code text} as {@code flavor}.
     *
     * @param baseUri used as the system id / base URI of the result; may be {@code null}
     * @return the parsed tree, or empty if the parser failed or produced an error sentinel
     */
    public Optional<ParsedDocument> parse(String text, MarkupFlavor flavor, @Nullable String baseUri) {
        return attempt(flavor, baseUri, () -> flavor == MarkupFlavor.HTML
                ? parseHtml(text, baseUri)
                : parseXml(new InputSource(new StringReader(stripByteOrderMark(text))), baseUri));
    }

    /**
     * Parses raw bytes as one of the XML flavors. The XML parser detects the encoding from a byte
     * order mark or the encoding declaration unless {@code charset} is given.
     *
     * @param charset charset declared by the transport, or {@code null} to let the parser decide
     * @throws IllegalArgumentException if {@code flavor} is {@link MarkupFlavor#HTML}
     */
    public Optional<ParsedDocument> parse(byte[] body, @Nullable Charset charset, MarkupFlavor flavor,
                                          @Nullable String baseUri) {
        if (!flavor.isXml()) {
            throw new IllegalArgumentException("Raw bytes can only be parsed as XML, not " + flavor);
        }
        return attempt(flavor, baseUri, () -> {
            var source = new InputSource(new ByteArrayInputStream(body));
            if (charset != null) {
                source.setEncoding(charset.name());
            }
            return parseXml(source, baseUri);
        });
    }

    private Optional<ParsedDocument> attempt(MarkupFlavor flavor, @Nullable String baseUri, TreeBuilder builder) {
        Document document;
        try {
            document = builder.build();
        } catch (SAXException | IOException e) {
            logger.debug("Parsing {} as {} failed: {}", baseUri, flavor, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.debug("Parser crashed on {} as {}", baseUri, flavor, e);
            return Optional.empty();
        }

        if (isErrorDocument(document)) {
            logger.debug("Parsing {} as {} produced a {} element", baseUri, flavor, PARSER_ERROR_TAG);
            return Optional.empty();
        }
        logger.debug("Parsed {} as {}", baseUri, flavor);
        return Optional.of(new ParsedDocument(document, flavor));
    }

    /**
     * True when the tree has no root, or the parser signalled an error with a sentinel element.
     */
    static boolean isErrorDocument(Document document) {
        Element root = document.getDocumentElement();
        if (root == null) {
            return true;
        }
        if (PARSER_ERROR_TAG.equals(DomUtil.localName(root))) {
            return true;
        }
        for (var child : DomUtil.elementChildren(root)) {
            if (PARSER_ERROR_TAG.equals(DomUtil.localName(child))) {
                return true;
            }
        }
        return false;
    }

    private Document parseHtml(String text, @Nullable String baseUri) {
        var parsed = Jsoup.parse(text, baseUri == null ? "" : baseUri);
        var html = parsed.children().first();
        if (html != null && !html.hasAttr("xmlns")) {
            // the HTML namespace is implied by the HTML parser
            html.attr("xmlns", DomUtil.NS_XHTML);
        }
        return W3CDom.convert(parsed);
    }

    private Document parseXml(InputSource source, @Nullable String baseUri) throws SAXException, IOException {
        if (baseUri != null) {
            source.setSystemId(baseUri);
        }
        var builder = newXmlBuilder();
        builder.setErrorHandler(new FailingErrorHandler(baseUri));
        return builder.parse(source);
    }

    private static String stripByteOrderMark(String text) {
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    private synchronized DocumentBuilder newXmlBuilder() {
        try {
            return xmlFactory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is misconfigured", e);
        }
    }

    private static DocumentBuilderFactory createXmlFactory(boolean loadExternalDtd) {
        var factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setValidating(false);
        factory.setExpandEntityReferences(true);
        try {
            if (!loadExternalDtd) {
                factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
                factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
                factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
                factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            }
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support the required features", e);
        }
        return factory;
    }

    @FunctionalInterface
    private interface TreeBuilder {
        Document build() throws SAXException, IOException;
    }

    /**
     * Routes parser diagnostics to the log instead of stderr and turns every error into a failure.
     */
    private record FailingErrorHandler(@Nullable String systemId) implements ErrorHandler {
        @Override
        public void warning(SAXParseException e) {
            logger.debug("XML warning in {} at {}:{}: {}", systemId, e.getLineNumber(), e.getColumnNumber(), e.getMessage());
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
}
