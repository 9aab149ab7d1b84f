package io.github.jbellis.docindex.fetch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.zip.GZIPInputStream;

/**
 * Reads resources from the local file system. Accepts {@code file:} URLs and plain paths, the
 * latter resolved against a base directory. No content type is declared, so the parse flavor is
 * inferred from the file extension and the content.
 */
public class FileResourceFetcher implements ResourceFetcher {
    private static final Logger logger = LogManager.getLogger(FileResourceFetcher.class);

    private final Path baseDir;
    private final Executor executor;

    /**
     * @param baseDir  directory that relative paths are resolved against
     * @param executor runs the blocking file reads
     */
    public FileResourceFetcher(Path baseDir, Executor executor) {
        this.baseDir = Objects.requireNonNull(baseDir).toAbsolutePath().normalize();
        this.executor = Objects.requireNonNull(executor);
    }

    @Override
    public CompletableFuture<FetchResponse> fetch(String url) {
        return CompletableFuture.supplyAsync(() -> {
            var path = resolve(url);
            logger.debug("Reading {} from {}", url, path);
            try {
                var bytes = Files.readAllBytes(path);
                if (path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".svgz")) {
                    bytes = gunzip(bytes);
                }
                return FetchResponse.ofBytes(url, null, bytes);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, executor);
    }

    Path resolve(String url) {
        if (url.regionMatches(true, 0, "file:", 0, 5)) {
            return Path.of(URI.create(url));
        }
        return baseDir.resolve(url).normalize();
    }

    private static byte[] gunzip(byte[] compressed) throws IOException {
        try (var in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        }
    }
}
