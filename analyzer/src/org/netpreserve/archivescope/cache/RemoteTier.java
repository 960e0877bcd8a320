package org.netpreserve.archivescope.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared cache tier reachable over the network. Failures are reported as
 * {@link RemoteTierException} and treated by the caller as a miss.
 */
public interface RemoteTier extends AutoCloseable {
    Optional<byte[]> get(String key) throws RemoteTierException;

    void set(String key, byte[] value, Duration ttl) throws RemoteTierException;

    void delete(String key) throws RemoteTierException;

    /**
     * Removes every key this tier wrote, leaving other keys on a shared server alone.
     */
    void clear() throws RemoteTierException;

    /**
     * How long a value read from this tier may be kept by faster tiers.
     */
    Duration defaultTtl();

    @Override
    void close();
}
