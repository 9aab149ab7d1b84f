package io.github.jbellis.docindex.parse;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The markup flavors a raw payload can be parsed as. The flavor decides parser leniency
 * (HTML is lenient, everything else must be well-formed XML) and namespace defaults.
 */
public enum MarkupFlavor {
    HTML("text/html"),
    XML("application/xml", "text/xml"),
    XHTML("application/xhtml+xml"),
    SVG("image/svg+xml");

    private final String mediaType;
    private final List<String> aliases;

    MarkupFlavor(String mediaType, String... aliases) {
        this.mediaType = mediaType;
        this.aliases = List.of(aliases);
    }

    public boolean isXml() {
        return this != HTML;
    }

    /**
     * Exact match of a media-type essence (no parameters, lower case) against the supported flavors.
     */
    public static Optional<MarkupFlavor> forMediaType(String essence) {
        for (var flavor : values()) {
            if (flavor.mediaType.equals(essence) || flavor.aliases.contains(essence)) {
                return Optional.of(flavor);
            }
        }
        return Optional.empty();
    }

    /**
     * Flavor implied by a file extension (without the dot), if any.
     */
    public static Optional<MarkupFlavor> forExtension(String extension) {
        return switch (extension.toLowerCase(Locale.ROOT)) {
            case "html", "htm" -> Optional.of(HTML);
            case "xhtml", "xht" -> Optional.of(XHTML);
            case "svg", "svgz" -> Optional.of(SVG);
            case "opf", "xml" -> Optional.of(XML);
            default -> Optional.empty();
        };
    }
}
