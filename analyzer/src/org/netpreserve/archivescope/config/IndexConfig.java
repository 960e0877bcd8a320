package org.netpreserve.archivescope.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.archivescope.util.DurationDeserializer;

import java.net.URI;
import java.time.Duration;

/**
 * @param baseUrl    CDX index server
 * @param timeout    per-request timeout
 * @param maxResults cap on the limit of a single query
 * @param pageSize   records per page when paging through a domain
 */
public record IndexConfig(
        URI baseUrl,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout,
        int maxResults,
        int pageSize
) {
}
