package io.github.jbellis.docindex.fetch;

import io.github.jbellis.docindex.XmlDocStore;
import io.github.jbellis.docindex.parse.ContentResolver;
import io.github.jbellis.docindex.parse.MarkupFlavor;
import io.github.jbellis.docindex.parse.ResolverOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

public class FileResourceFetcherTest {

    private static final Executor DIRECT = Runnable::run;

    @TempDir
    Path tempDir;

    @Test
    void testReadsRelativePath() throws IOException {
        Files.writeString(tempDir.resolve("note.xml"), "<note/>");
        var fetcher = new FileResourceFetcher(tempDir, DIRECT);

        var response = fetcher.fetch("note.xml").join();
        assertEquals("note.xml", response.url());
        assertNull(response.contentType());
        assertEquals("<note/>", response.responseText());
    }

    @Test
    void testReadsFileUrl() throws IOException {
        var file = tempDir.resolve("page.html");
        Files.writeString(file, "<p>hi</p>");
        var fetcher = new FileResourceFetcher(tempDir, DIRECT);

        var url = file.toUri().toString();
        assertEquals("<p>hi</p>", fetcher.fetch(url).join().responseText());
    }

    @Test
    void testSvgzIsDecompressed() throws IOException {
        var svg = "<svg xmlns=\"http://www.w3.org/2000/svg\"/>";
        var compressed = new ByteArrayOutputStream();
        try (var gz = new GZIPOutputStream(compressed)) {
            gz.write(svg.getBytes(StandardCharsets.UTF_8));
        }
        Files.write(tempDir.resolve("icon.svgz"), compressed.toByteArray());

        var fetcher = new FileResourceFetcher(tempDir, DIRECT);
        assertEquals(svg, fetcher.fetch("icon.svgz").join().responseText());
    }

    @Test
    void testMissingFileFailsTheFuture() {
        var fetcher = new FileResourceFetcher(tempDir, DIRECT);
        var future = fetcher.fetch("nope.xml");

        var e = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(NoSuchFileException.class, e.getCause().getCause());
    }

    @Test
    void testStoreLoadsFromDisk() throws IOException {
        Files.writeString(tempDir.resolve("chapter.xhtml"), """
                <html xmlns="http://www.w3.org/1999/xhtml" xml:lang="de">
                  <head><title>Kapitel</title></head>
                  <body><h1 id="start">Anfang</h1></body>
                </html>""");
        var store = new XmlDocStore(new FileResourceFetcher(tempDir, DIRECT), new ContentResolver(ResolverOptions.DEFAULTS));

        var holder = store.load("chapter.xhtml").join().orElseThrow();
        assertEquals(MarkupFlavor.XHTML, holder.getFlavor());
        assertEquals("de", holder.getLang());
        assertEquals("h1", store.resolveElement("chapter.xhtml#start").orElseThrow().getLocalName());

        // a missing file is a fetch failure, reported as an empty result
        assertTrue(store.load("absent.xhtml").join().isEmpty());
    }
}
