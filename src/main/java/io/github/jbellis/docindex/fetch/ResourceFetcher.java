package io.github.jbellis.docindex.fetch;

import java.util.concurrent.CompletableFuture;

/**
 * Supplies raw responses for URLs. Fetches are asynchronous and may be cancelled; a failed fetch
 * completes the future exceptionally.
 */
@FunctionalInterface
public interface ResourceFetcher {

    /**
     * @param url URL without fragment
     * @return a future completing with the response, or exceptionally when the resource cannot be read
     */
    CompletableFuture<FetchResponse> fetch(String url);
}
