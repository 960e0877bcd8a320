package org.netpreserve.archivescope.store;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.archivescope.util.RequestGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.*;
import java.net.URI;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import java.util.zip.GZIPInputStream;

/**
 * Reads archive segment files from an S3 bucket. Every request passes through the shared
 * {@link RequestGate} and the bytes received are counted for egress cost estimation.
 */
public class S3ObjectClient implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(S3ObjectClient.class);
    static final int CHUNK_SIZE = 64 * 1024;
    private static final int GZIP_PROBE_LIMIT = 16 * CHUNK_SIZE;
    private static final double BYTES_PER_GB = 1024.0 * 1024 * 1024;
    private final S3Client s3;
    private final String bucket;
    private final RequestGate gate;
    private final double costPerGb;
    private final AtomicLong bytesTransferred = new AtomicLong();

    public S3ObjectClient(S3Client s3, String bucket, RequestGate gate, double costPerGb) {
        this.s3 = s3;
        this.bucket = bucket;
        this.gate = gate;
        this.costPerGb = costPerGb;
    }

    public static S3Client createClient(String region, @Nullable URI endpoint, boolean anonymous, Duration timeout) {
        var builder = S3Client.builder()
                .region(Region.of(region))
                .overrideConfiguration(c -> c.apiCallTimeout(timeout))
                .credentialsProvider(anonymous ? AnonymousCredentialsProvider.create()
                        : DefaultCredentialsProvider.create());
        if (endpoint != null) {
            builder.endpointOverride(endpoint).forcePathStyle(true);
        }
        return builder.build();
    }

    public boolean exists(String key) {
        return probe(key).isPresent();
    }

    /**
     * Total object size as reported by a one-byte range read.
     */
    public OptionalLong size(String key) {
        var size = probe(key);
        return size.map(OptionalLong::of).orElseGet(OptionalLong::empty);
    }

    private Optional<Long> probe(String key) {
        var request = GetObjectRequest.builder().bucket(bucket).key(key).range("bytes=0-0").build();
        try (var permit = gate.acquire();
             ResponseInputStream<GetObjectResponse> in = s3.getObject(request)) {
            countBytes(in.readAllBytes().length);
            return Optional.of(totalSize(in.response()));
        } catch (S3Exception e) {
            if (isNotFound(e)) {
                log.debug("Probe of s3://{}/{} returned {}", bucket, key, e.statusCode());
                return Optional.empty();
            }
            if (e.statusCode() == 416) return Optional.of(0L); // range unsatisfiable: empty object
            throw new ObjectStoreException("S3 probe failed: s3://" + bucket + "/" + key, e);
        } catch (IOException e) {
            throw new ObjectStoreException("S3 probe failed: s3://" + bucket + "/" + key, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ObjectStoreException("Interrupted probing s3://" + bucket + "/" + key, e);
        }
    }

    static long totalSize(GetObjectResponse response) {
        String contentRange = response.contentRange();
        if (contentRange != null) {
            int slash = contentRange.lastIndexOf('/');
            if (slash >= 0 && !contentRange.endsWith("*")) {
                try {
                    return Long.parseLong(contentRange.substring(slash + 1).trim());
                } catch (NumberFormatException e) {
                    log.warn("Unparseable Content-Range: {}", contentRange);
                }
            }
        }
        Long contentLength = response.contentLength();
        if (contentLength == null) throw new ObjectStoreException("No size in response: " + contentRange);
        return contentLength;
    }

    /**
     * Downloads a whole object.
     *
     * @return the object's bytes or empty if it doesn't exist or access is denied
     */
    public Optional<byte[]> download(String key) {
        return get(GetObjectRequest.builder().bucket(bucket).key(key).build());
    }

    /**
     * Downloads the inclusive byte range {@code [start, end]} of an object.
     */
    public Optional<byte[]> downloadRange(String key, long start, long end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range " + start + "-" + end);
        }
        return get(GetObjectRequest.builder().bucket(bucket).key(key)
                .range("bytes=" + start + "-" + end).build());
    }

    private Optional<byte[]> get(GetObjectRequest request) {
        try (var permit = gate.acquire();
             ResponseInputStream<GetObjectResponse> in = s3.getObject(request)) {
            byte[] data = in.readAllBytes();
            countBytes(data.length);
            log.debug("Downloaded {} bytes from s3://{}/{} {}", data.length, bucket, request.key(),
                    request.range() == null ? "" : request.range());
            return Optional.of(data);
        } catch (S3Exception e) {
            if (isNotFound(e)) {
                log.warn("s3://{}/{} not available ({})", bucket, request.key(), e.statusCode());
                return Optional.empty();
            }
            throw new ObjectStoreException("S3 download failed: s3://" + bucket + "/" + request.key(), e);
        } catch (IOException e) {
            throw new ObjectStoreException("S3 download failed: s3://" + bucket + "/" + request.key(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ObjectStoreException("Interrupted downloading s3://" + bucket + "/" + request.key(), e);
        }
    }

    /**
     * Streams an object in chunks of up to 64 KiB, gunzipping it if it starts with the gzip
     * magic number. Concatenated gzip members are decompressed in sequence. If the first chunk
     * fails to inflate the raw bytes are streamed instead. The stream holds a request slot until
     * it is closed, so callers must close it.
     */
    public Stream<byte[]> streamDecompressed(String key) {
        RequestGate.Permit permit;
        try {
            permit = gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ObjectStoreException("Interrupted streaming s3://" + bucket + "/" + key, e);
        }
        InputStream in;
        try {
            var raw = s3.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build());
            in = openDecompressed(new BufferedInputStream(new CountingInputStream(raw), CHUNK_SIZE), key);
        } catch (S3Exception e) {
            permit.close();
            if (isNotFound(e)) {
                log.warn("s3://{}/{} not available ({})", bucket, key, e.statusCode());
                return Stream.empty();
            }
            throw new ObjectStoreException("S3 stream failed: s3://" + bucket + "/" + key, e);
        } catch (IOException e) {
            permit.close();
            throw new ObjectStoreException("S3 stream failed: s3://" + bucket + "/" + key, e);
        }
        var chunks = new ChunkIterator(in, key);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(chunks,
                        Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(() -> {
                    try {
                        in.close();
                    } catch (IOException e) {
                        log.warn("Error closing stream of s3://{}/{}", bucket, key, e);
                    } finally {
                        permit.close();
                    }
                });
    }

    private InputStream openDecompressed(BufferedInputStream in, String key) throws IOException {
        in.mark(GZIP_PROBE_LIMIT);
        int b1 = in.read();
        int b2 = in.read();
        in.reset();
        if (b1 != 0x1f || b2 != 0x8b) return in;
        GZIPInputStream gunzip;
        byte[] first;
        try {
            gunzip = new GZIPInputStream(in, CHUNK_SIZE);
            first = gunzip.readNBytes(CHUNK_SIZE);
        } catch (IOException e) {
            log.warn("s3://{}/{} has a gzip header but does not inflate ({}), streaming raw bytes",
                    bucket, key, e.getMessage());
            in.reset();
            return in;
        }
        return new SequenceInputStream(new ByteArrayInputStream(first), gunzip);
    }

    private static boolean isNotFound(S3Exception e) {
        return e.statusCode() == 403 || e.statusCode() == 404;
    }

    private void countBytes(long n) {
        bytesTransferred.addAndGet(n);
    }

    public long bytesTransferred() {
        return bytesTransferred.get();
    }

    public double estimatedCostUsd() {
        return bytesTransferred.get() / BYTES_PER_GB * costPerGb;
    }

    public void resetCostTracking() {
        bytesTransferred.set(0);
    }

    public String bucket() {
        return bucket;
    }

    @Override
    public void close() {
        s3.close();
    }

    private class CountingInputStream extends FilterInputStream {
        CountingInputStream(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            int b = super.read();
            if (b != -1) countBytes(1);
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int n = super.read(b, off, len);
            if (n > 0) countBytes(n);
            return n;
        }
    }

    private class ChunkIterator implements Iterator<byte[]> {
        private final InputStream in;
        private final String key;
        private byte[] next;
        private boolean eof;

        ChunkIterator(InputStream in, String key) {
            this.in = in;
            this.key = key;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !eof) {
                try {
                    byte[] chunk = in.readNBytes(CHUNK_SIZE);
                    if (chunk.length == 0) {
                        eof = true;
                    } else {
                        next = chunk;
                    }
                } catch (IOException e) {
                    throw new ObjectStoreException("Error reading s3://" + bucket + "/" + key, e);
                }
            }
            return next != null;
        }

        @Override
        public byte[] next() {
            if (!hasNext()) throw new NoSuchElementException();
            byte[] chunk = next;
            next = null;
            return chunk;
        }
    }
}
