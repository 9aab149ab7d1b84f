package io.github.jbellis.docindex;

import io.github.jbellis.docindex.fetch.FetchResponse;
import io.github.jbellis.docindex.fetch.ResourceFetcher;
import io.github.jbellis.docindex.parse.ContentResolver;
import io.github.jbellis.docindex.parse.MarkupFlavor;
import io.github.jbellis.docindex.parse.ResolverOptions;
import io.github.jbellis.docindex.testutil.TestDocs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

public class XmlDocStoreTest {

    /**
     * Hands out futures the test completes by hand, and records every fetch.
     */
    private static class ManualFetcher implements ResourceFetcher {
        final List<String> requested = new ArrayList<>();
        final List<CompletableFuture<FetchResponse>> futures = new ArrayList<>();

        @Override
        public synchronized CompletableFuture<FetchResponse> fetch(String url) {
            requested.add(url);
            var future = new CompletableFuture<FetchResponse>();
            futures.add(future);
            return future;
        }

        CompletableFuture<FetchResponse> last() {
            return futures.get(futures.size() - 1);
        }
    }

    private ManualFetcher fetcher;
    private XmlDocStore store;

    @BeforeEach
    void setUp() {
        fetcher = new ManualFetcher();
        store = new XmlDocStore(fetcher, new ContentResolver(ResolverOptions.DEFAULTS));
    }

    @Test
    public void testConcurrentLoadsShareOneFetch() {
        var first = store.load("book/ch1.xhtml");
        var second = store.load("book/ch1.xhtml#section2");

        assertSame(first, second);
        assertEquals(List.of("book/ch1.xhtml"), fetcher.requested);
        assertTrue(store.get("book/ch1.xhtml").isEmpty(), "Nothing is cached before the fetch completes");

        fetcher.last().complete(FetchResponse.ofText("book/ch1.xhtml", null,
                "<html xmlns=\"http://www.w3.org/1999/xhtml\"><body><p id=\"x\">Hi</p></body></html>"));

        var holder = first.join().orElseThrow();
        assertSame(holder, second.join().orElseThrow());
        assertEquals(MarkupFlavor.XHTML, holder.getFlavor());
        assertSame(store, holder.getStore());
        assertSame(holder, store.get("book/ch1.xhtml").orElseThrow());
    }

    @Test
    public void testLoadedDocumentsAreCached() {
        var first = store.load("a.xml");
        fetcher.last().complete(FetchResponse.ofText("a.xml", null, "<a/>"));
        var holder = first.join().orElseThrow();

        var again = store.load("a.xml");
        assertTrue(again.isDone());
        assertSame(holder, again.join().orElseThrow());
        assertEquals(1, fetcher.requested.size());
    }

    @Test
    public void testFailedFetchIsNotCached() {
        var first = store.load("missing.xml");
        fetcher.last().completeExceptionally(new IOException("404"));

        assertTrue(first.join().isEmpty());
        assertTrue(store.get("missing.xml").isEmpty());

        store.load("missing.xml");
        assertEquals(2, fetcher.requested.size(), "A failed fetch must be retried on the next load");
    }

    @Test
    public void testUnparseableDocumentIsCachedAsMiss() {
        var strict = new XmlDocStore(fetcher, new ContentResolver(new ResolverOptions(false, true, false)));
        var first = strict.load("bad");
        fetcher.last().complete(FetchResponse.ofText("bad", null, "<p>unclosed"));
        assertTrue(first.join().isEmpty());

        var again = strict.load("bad");
        assertTrue(again.join().isEmpty());
        assertEquals(1, fetcher.requested.size());
    }

    @Test
    public void testCancelledLoadCancelsFetchAndCachesNothing() {
        var load = store.load("slow.xml");
        var fetch = fetcher.last();

        assertTrue(load.cancel(true));
        assertTrue(fetch.isCancelled(), "Cancelling the load cancels the fetch");

        fetch.complete(FetchResponse.ofText("slow.xml", null, "<a/>"));
        assertTrue(store.get("slow.xml").isEmpty());

        var retry = store.load("slow.xml");
        assertNotSame(load, retry);
        assertEquals(2, fetcher.requested.size());
    }

    @Test
    public void testCancelledFetchCancelsLoad() {
        var load = store.load("slow.xml");
        fetcher.last().cancel(true);

        assertTrue(load.isCancelled());
        assertTrue(store.get("slow.xml").isEmpty());
    }

    @Test
    public void testSynchronousFetcher() {
        var sync = new XmlDocStore(url -> CompletableFuture.completedFuture(FetchResponse.ofText(url, null, "<a id='k'/>")));
        var holder = sync.load("now.xml").join().orElseThrow();

        assertSame(holder, sync.get("now.xml").orElseThrow());
        // the in-flight entry was cleaned up, so this is served from the cache
        assertTrue(sync.load("now.xml").isDone());
    }

    @Test
    public void testAddDocumentAndDelete() {
        var document = TestDocs.parseXml("<root><x id=\"target\"/></root>");
        var holder = store.addDocument("inline.xml", document);

        assertSame(holder, store.get("inline.xml").orElseThrow());
        assertSame(holder, store.load("inline.xml").join().orElseThrow());
        assertTrue(fetcher.requested.isEmpty());

        store.delete("inline.xml");
        assertTrue(store.get("inline.xml").isEmpty());
    }

    @Test
    public void testResolveElementAcrossDocuments() {
        store.addDocument("one.xml", TestDocs.parseXml("<root><x id=\"a\"/></root>"));
        store.addDocument("two.xml", TestDocs.parseXml("<root><y id=\"a\"/></root>"));

        assertEquals("x", store.resolveElement("one.xml#a").orElseThrow().getTagName());
        assertEquals("y", store.resolveElement("two.xml#a").orElseThrow().getTagName());
        assertTrue(store.resolveElement("three.xml#a").isEmpty());
        assertTrue(store.resolveElement("#a").isEmpty());
        assertTrue(store.resolveElement("one.xml").isEmpty());
    }
}
