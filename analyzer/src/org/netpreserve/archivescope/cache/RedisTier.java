package org.netpreserve.archivescope.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Remote tier on a Redis server. All keys are namespaced by a prefix.
 */
public class RedisTier implements RemoteTier {
    private static final Logger log = LoggerFactory.getLogger(RedisTier.class);
    private final JedisPooled jedis;
    private final String prefix;
    private final Duration defaultTtl;

    public RedisTier(String url, String prefix, Duration defaultTtl) {
        this(new JedisPooled(URI.create(url)), prefix, defaultTtl);
        log.info("Using Redis cache tier at {}", URI.create(url).getHost());
    }

    RedisTier(JedisPooled jedis, String prefix, Duration defaultTtl) {
        this.jedis = jedis;
        this.prefix = prefix;
        this.defaultTtl = defaultTtl;
    }

    private byte[] key(String key) {
        return (prefix + key).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Optional<byte[]> get(String key) throws RemoteTierException {
        try {
            return Optional.ofNullable(jedis.get(key(key)));
        } catch (JedisException e) {
            throw new RemoteTierException("Redis GET failed", e);
        }
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) throws RemoteTierException {
        long seconds = Math.max(1, (ttl == null ? defaultTtl : ttl).toSeconds());
        try {
            jedis.setex(key(key), seconds, value);
        } catch (JedisException e) {
            throw new RemoteTierException("Redis SETEX failed", e);
        }
    }

    @Override
    public void delete(String key) throws RemoteTierException {
        try {
            jedis.del(key(key));
        } catch (JedisException e) {
            throw new RemoteTierException("Redis DEL failed", e);
        }
    }

    @Override
    public void clear() throws RemoteTierException {
        var params = new ScanParams().match(prefix + "*").count(500);
        String cursor = ScanParams.SCAN_POINTER_START;
        long deleted = 0;
        try {
            do {
                var result = jedis.scan(cursor, params);
                if (!result.getResult().isEmpty()) {
                    deleted += jedis.del(result.getResult().toArray(new String[0]));
                }
                cursor = result.getCursor();
            } while (!cursor.equals(ScanParams.SCAN_POINTER_START));
        } catch (JedisException e) {
            throw new RemoteTierException("Redis clear failed", e);
        }
        log.info("Cleared {} keys with prefix {}", deleted, prefix);
    }

    @Override
    public Duration defaultTtl() {
        return defaultTtl;
    }

    @Override
    public void close() {
        jedis.close();
    }
}
