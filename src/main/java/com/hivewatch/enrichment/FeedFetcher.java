package com.hivewatch.enrichment;

import reactor.core.publisher.Mono;

/**
 * Fetches the raw body of one threat-intelligence feed.
 */
public interface FeedFetcher {

    /**
     * @param url {@code http(s)://} or {@code file:} location of the feed
     * @return Mono emitting the feed body, or an error if it could not be fetched
     */
    Mono<String> fetch(String url);
}
