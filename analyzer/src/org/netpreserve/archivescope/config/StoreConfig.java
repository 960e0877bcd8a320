package org.netpreserve.archivescope.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.archivescope.util.DurationDeserializer;

import java.net.URI;
import java.time.Duration;

/**
 * Object store holding the segment files.
 *
 * @param bucket    bucket name
 * @param region    AWS region
 * @param endpoint  endpoint override for S3-compatible stores, null for AWS
 * @param anonymous use unsigned requests instead of the default credentials chain
 * @param timeout   per-call timeout
 * @param costPerGb egress price in USD per GiB used for cost estimates
 */
public record StoreConfig(
        String bucket,
        String region,
        URI endpoint,
        boolean anonymous,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout,
        double costPerGb
) {
}
