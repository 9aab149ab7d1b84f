package io.github.jbellis.docindex.parse;

/**
 * Tunables for {@link ContentResolver} and {@link MarkupParser}.
 *
 * <h3>Configuration</h3>
 * {@link #fromSystemProperties()} reads:
 * <ul>
 *   <li>{@code docindex.parse.htmlFallback} - make a last lenient HTML attempt when every other
 *       flavor failed (default: true)</li>
 *   <li>{@code docindex.parse.sniffRoot} - re-parse as HTML/SVG based on the root tag when the
 *       flavor was not declared by the response (default: true)</li>
 *   <li>{@code docindex.parse.loadExternalDtd} - let the XML parser fetch external DTDs
 *       (default: false)</li>
 * </ul>
 *
 * Example: {@code -Ddocindex.parse.htmlFallback=false} to give up after the XML attempts
 */
public record ResolverOptions(boolean htmlFallback, boolean sniffRoot, boolean loadExternalDtd) {

    public static final ResolverOptions DEFAULTS = new ResolverOptions(true, true, false);

    public static ResolverOptions fromSystemProperties() {
        return new ResolverOptions(
                Boolean.parseBoolean(System.getProperty("docindex.parse.htmlFallback", "true")),
                Boolean.parseBoolean(System.getProperty("docindex.parse.sniffRoot", "true")),
                Boolean.parseBoolean(System.getProperty("docindex.parse.loadExternalDtd", "false")));
    }
}
