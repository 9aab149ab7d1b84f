package io.github.jbellis.docindex.fetch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Document;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * What the resource layer hands back for one URL: the canonical URL, the declared content type
 * (possibly absent or wrong), and the payload as text, raw bytes, or an already parsed tree.
 *
 * @param url         canonical resolved URL
 * @param contentType declared {@code Content-Type} header value, parameters included
 * @param text        payload as text, if the fetcher already decoded it
 * @param body        payload as raw bytes, decoded lazily by {@link #responseText()}
 * @param document    a tree the fetcher already parsed natively
 */
public record FetchResponse(String url,
                            @Nullable String contentType,
                            @Nullable String text,
                            @Nullable byte[] body,
                            @Nullable Document document) {
    private static final Logger logger = LogManager.getLogger(FetchResponse.class);

    public FetchResponse {
        Objects.requireNonNull(url, "url");
    }

    public static FetchResponse ofText(String url, @Nullable String contentType, String text) {
        return new FetchResponse(url, contentType, text, null, null);
    }

    public static FetchResponse ofBytes(String url, @Nullable String contentType, byte[] body) {
        return new FetchResponse(url, contentType, null, body, null);
    }

    public static FetchResponse ofDocument(String url, Document document) {
        return new FetchResponse(url, null, null, null, document);
    }

    /**
     * Media-type essence of the declared content type: parameters dropped, trimmed, lower case.
     * Null when no content type was declared.
     */
    public @Nullable String mediaType() {
        if (contentType == null) {
            return null;
        }
        int semi = contentType.indexOf(';');
        var essence = (semi >= 0 ? contentType.substring(0, semi) : contentType).trim().toLowerCase(Locale.ROOT);
        return essence.isEmpty() ? null : essence;
    }

    /**
     * The payload as text. Uses {@link #text()} when present, otherwise decodes {@link #body()}
     * with the declared {@code charset} parameter, then a byte order mark, then UTF-8.
     */
    public @Nullable String responseText() {
        if (text != null) {
            return text;
        }
        if (body == null) {
            return null;
        }
        var declared = declaredCharset();
        if (declared != null) {
            var decoded = new String(body, declared);
            // a declared charset does not consume a byte order mark
            return decoded.startsWith("\uFEFF") ? decoded.substring(1) : decoded;
        }
        if (startsWith(body, 0xEF, 0xBB, 0xBF)) {
            return new String(body, 3, body.length - 3, StandardCharsets.UTF_8);
        }
        if (startsWith(body, 0xFE, 0xFF) || startsWith(body, 0xFF, 0xFE)) {
            // UTF_16 consumes the BOM itself
            return new String(body, StandardCharsets.UTF_16);
        }
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * The charset named by the content type's {@code charset} parameter, or null when there is
     * none or the JVM does not support it.
     */
    public @Nullable Charset declaredCharset() {
        if (contentType == null) {
            return null;
        }
        for (var param : contentType.split(";")) {
            var kv = param.trim();
            if (kv.regionMatches(true, 0, "charset=", 0, 8)) {
                var name = kv.substring(8).trim().replace("\"", "");
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    logger.debug("Ignoring unsupported charset '{}' declared for {}", name, url);
                    return null;
                }
            }
        }
        return null;
    }

    private static boolean startsWith(byte[] bytes, int... prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((bytes[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
