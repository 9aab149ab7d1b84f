package io.github.jbellis.docindex;

import io.github.jbellis.docindex.fetch.ResourceFetcher;
import io.github.jbellis.docindex.parse.ContentResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads documents by URL and keeps one {@link XmlDocHolder} per URL.
 * <p>
 * Loads of the same URL share a single in-flight future, and both successful parses and
 * unparseable documents are cached. Failed fetches are not cached and can be retried. A holder
 * is built only after its fetch completes normally, and a cancelled load never reaches the
 * cache.
 */
public class XmlDocStore {
    private static final Logger logger = LogManager.getLogger(XmlDocStore.class);

    private final ResourceFetcher fetcher;
    private final ContentResolver resolver;

    /**
     * Finished loads by URL; an empty Optional records a document that could not be parsed.
     */
    private final ConcurrentHashMap<String, Optional<XmlDocHolder>> resources = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Optional<XmlDocHolder>>> inFlight = new ConcurrentHashMap<>();
    private final Object submissionLock = new Object();

    public XmlDocStore(ResourceFetcher fetcher) {
        this(fetcher, new ContentResolver());
    }

    public XmlDocStore(ResourceFetcher fetcher, ContentResolver resolver) {
        this.fetcher = Objects.requireNonNull(fetcher);
        this.resolver = Objects.requireNonNull(resolver);
    }

    /**
     * Loads the document at {@code url} (any fragment is ignored).
     * <p>
     * The returned future is shared with concurrent callers for the same URL; cancelling it
     * cancels the underlying fetch for all of them.
     *
     * @return a future completing with the holder, or empty when the resource could not be
     *         fetched or parsed
     */
    public CompletableFuture<Optional<XmlDocHolder>> load(String url) {
        var key = stripFragment(url);
        synchronized (submissionLock) {
            var cached = resources.get(key);
            if (cached != null) {
                logger.debug("Cache hit for {}", key);
                return CompletableFuture.completedFuture(cached);
            }
            var pending = inFlight.get(key);
            if (pending != null) {
                logger.debug("Joining in-flight load of {}", key);
                return pending;
            }

            var result = new CompletableFuture<Optional<XmlDocHolder>>();
            var fetch = fetcher.fetch(key);
            // registered before the fetch callback, which may run synchronously
            inFlight.put(key, result);
            result.whenComplete((holder, err) -> {
                inFlight.remove(key, result);
                if (result.isCancelled()) {
                    logger.debug("Load of {} cancelled", key);
                    fetch.cancel(true);
                }
            });

            fetch.whenComplete((response, err) -> {
                if (err != null) {
                    var cause = unwrap(err);
                    if (cause instanceof CancellationException) {
                        result.cancel(false);
                    } else {
                        logger.warn("Failed to fetch {}: {}", key, cause.toString());
                        result.complete(Optional.empty());
                    }
                    return;
                }
                Optional<XmlDocHolder> holder;
                try {
                    holder = resolver.parseXMLResource(response, this);
                } catch (RuntimeException e) {
                    logger.error("Unexpected failure while parsing {}", key, e);
                    result.completeExceptionally(e);
                    return;
                }
                synchronized (submissionLock) {
                    if (result.complete(holder)) {
                        resources.put(key, holder);
                    }
                }
            });
            return result;
        }
    }

    /**
     * The holder for {@code url}, if it has already been loaded successfully.
     */
    public Optional<XmlDocHolder> get(String url) {
        var cached = resources.get(stripFragment(url));
        return cached == null ? Optional.empty() : cached;
    }

    /**
     * Registers an already parsed document under {@code url}, replacing any cached entry.
     */
    public XmlDocHolder addDocument(String url, Document document) {
        var key = stripFragment(url);
        var holder = new XmlDocHolder(this, key, document, null);
        synchronized (submissionLock) {
            resources.put(key, Optional.of(holder));
        }
        return holder;
    }

    public void delete(String url) {
        synchronized (submissionLock) {
            resources.remove(stripFragment(url));
        }
    }

    /**
     * Resolves a {@code url#id} reference against the documents loaded so far.
     */
    public Optional<Element> resolveElement(String reference) {
        int hash = reference.indexOf('#');
        if (hash <= 0) {
            return Optional.empty();
        }
        return get(reference.substring(0, hash)).flatMap(holder -> holder.getElement(reference));
    }

    static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }

    private static Throwable unwrap(Throwable err) {
        var cause = err;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
