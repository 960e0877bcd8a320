package org.netpreserve.archivescope;

import org.netpreserve.archivescope.analysis.HrefLinkExtractor;
import org.netpreserve.archivescope.analysis.RuleBasedTechnologyDetector;
import org.netpreserve.archivescope.analysis.TagStrippingTextExtractor;
import org.netpreserve.archivescope.cache.CacheManager;
import org.netpreserve.archivescope.cache.RedisTier;
import org.netpreserve.archivescope.cache.RemoteTier;
import org.netpreserve.archivescope.config.AppConfig;
import org.netpreserve.archivescope.discovery.DiscoveryService;
import org.netpreserve.archivescope.fetch.PageFetcher;
import org.netpreserve.archivescope.index.IndexClient;
import org.netpreserve.archivescope.record.RecordParser;
import org.netpreserve.archivescope.report.AggregationEngine;
import org.netpreserve.archivescope.store.S3ObjectClient;
import org.netpreserve.archivescope.util.RequestGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;

/**
 * Builds and owns every component for one process. All remote requests, index and object
 * store alike, share one {@link RequestGate}.
 */
public class ArchiveContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ArchiveContext.class);
    private final AppConfig config;
    private final CacheManager cache;
    private final IndexClient index;
    private final S3ObjectClient store;
    private final RecordParser parser;
    private final PageFetcher fetcher;
    private final DiscoveryService discovery;
    private final AggregationEngine engine;

    public ArchiveContext(AppConfig config) throws IOException {
        this.config = config;
        var gate = new RequestGate(config.rateLimit().maxConcurrent(), config.rateLimit().requestsPerSecond());
        RemoteTier remote = null;
        if (config.redis().enabled()) {
            remote = new RedisTier(config.redis().url(), config.redis().keyPrefix(), config.redis().ttl());
        }
        this.cache = CacheManager.open(config.cache(), remote);
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(config.index().timeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.index = new IndexClient(httpClient, config.index().baseUrl(), gate, config.index().timeout(),
                config.index().maxResults(), config.index().pageSize());
        var storeConfig = config.store();
        this.store = new S3ObjectClient(S3ObjectClient.createClient(storeConfig.region(), storeConfig.endpoint(),
                storeConfig.anonymous(), storeConfig.timeout()), storeConfig.bucket(), gate, storeConfig.costPerGb());
        this.parser = new RecordParser();
        this.fetcher = new PageFetcher(index, store, parser, cache);
        this.discovery = new DiscoveryService(index, cache);
        this.engine = new AggregationEngine(index, fetcher, cache, RuleBasedTechnologyDetector.withBuiltInRules(),
                new HrefLinkExtractor(), new TagStrippingTextExtractor(), config.aggregation());
    }

    public AppConfig config() {
        return config;
    }

    public CacheManager cache() {
        return cache;
    }

    public S3ObjectClient store() {
        return store;
    }

    public PageFetcher fetcher() {
        return fetcher;
    }

    public DiscoveryService discovery() {
        return discovery;
    }

    public AggregationEngine engine() {
        return engine;
    }

    @Override
    public void close() {
        log.info("Transferred {} bytes from {} (estimated cost ${}), {} records with assumed status, {} skipped",
                store.bytesTransferred(), store.bucket(), String.format("%.4f", store.estimatedCostUsd()),
                parser.assumedStatusCount(), parser.skippedRecordCount());
        try {
            engine.close();
        } catch (Exception e) {
            log.error("Failed to close aggregation engine", e);
        }
        try {
            fetcher.close();
        } catch (Exception e) {
            log.error("Failed to close page fetcher", e);
        }
        try {
            store.close();
        } catch (Exception e) {
            log.error("Failed to close object store client", e);
        }
        try {
            cache.close();
        } catch (Exception e) {
            log.error("Failed to close cache", e);
        }
    }
}
