package org.netpreserve.archivescope.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.archivescope.util.DurationDeserializer;

import java.time.Duration;

/**
 * Report computation settings.
 *
 * @param concurrency         pages analysed at once
 * @param timelineConcurrency pages analysed at once while building a timeline
 * @param timelineSample      pages per snapshot inspected for technology changes
 * @param reportTtl           how long finished reports are cached
 * @param pagerankIterations  fixed number of PageRank iterations
 * @param damping             PageRank damping factor
 * @param hubPages            number of hub pages reported
 */
public record AggregationConfig(
        int concurrency,
        int timelineConcurrency,
        int timelineSample,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration reportTtl,
        int pagerankIterations,
        double damping,
        int hubPages
) {
}
