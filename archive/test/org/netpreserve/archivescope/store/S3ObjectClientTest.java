package org.netpreserve.archivescope.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.netpreserve.archivescope.util.RequestGate;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class S3ObjectClientTest {
    @Mock private S3Client s3Client;
    private RequestGate gate;
    private S3ObjectClient client;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        gate = new RequestGate(2, 1000);
        client = new S3ObjectClient(s3Client, "commoncrawl", gate, 0.09);
    }

    private static ResponseInputStream<GetObjectResponse> response(GetObjectResponse response, byte[] data) {
        return new ResponseInputStream<>(response, new ByteArrayInputStream(data));
    }

    private static S3Exception s3Error(int status) {
        return (S3Exception) S3Exception.builder().statusCode(status).message("status " + status).build();
    }

    private static byte[] gzip(byte[]... members) throws IOException {
        var out = new ByteArrayOutputStream();
        for (byte[] member : members) {
            try (var gz = new GZIPOutputStream(out) {
                @Override
                public void close() throws IOException {
                    finish();
                }
            }) {
                gz.write(member);
            }
        }
        return out.toByteArray();
    }

    @Test
    public void testSizeParsesContentRange() {
        var probe = GetObjectResponse.builder().contentRange("bytes 0-0/987654321").contentLength(1L).build();
        when(s3Client.getObject(any(GetObjectRequest.class)))
                .thenReturn(response(probe, new byte[]{'W'}), response(probe, new byte[]{'W'}));

        assertEquals(987654321L, client.size("crawl-data/seg.warc.gz").orElseThrow());
        assertTrue(client.exists("crawl-data/seg.warc.gz"));

        var captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client, times(2)).getObject(captor.capture());
        assertEquals("bytes=0-0", captor.getValue().range());
        assertEquals("commoncrawl", captor.getValue().bucket());
        assertEquals(2, client.bytesTransferred());
    }

    @Test
    public void testExistsFalseOnForbiddenOrMissing() {
        when(s3Client.getObject(any(GetObjectRequest.class)))
                .thenThrow(s3Error(403))
                .thenThrow(NoSuchKeyException.builder().statusCode(404).message("nope").build());
        assertFalse(client.exists("a"));
        assertTrue(client.size("b").isEmpty());
    }

    @Test
    public void testSizeZeroForEmptyObject() {
        when(s3Client.getObject(any(GetObjectRequest.class))).thenThrow(s3Error(416));
        assertEquals(0L, client.size("empty").orElseThrow());
    }

    @Test
    public void testDownloadWrapsOtherFailures() {
        when(s3Client.getObject(any(GetObjectRequest.class))).thenThrow(s3Error(500));
        var e = assertThrows(ObjectStoreException.class, () -> client.download("broken"));
        assertTrue(e.getMessage().contains("s3://commoncrawl/broken"));
        assertEquals(0, gate.inFlight());
    }

    @Test
    public void testDownloadRangeSendsInclusiveRangeAndTracksCost() {
        byte[] data = new byte[1024];
        when(s3Client.getObject(any(GetObjectRequest.class))).thenReturn(response(
                GetObjectResponse.builder().build(), data));

        assertArrayEquals(data, client.downloadRange("seg", 100, 1123).orElseThrow());

        var captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObject(captor.capture());
        assertEquals("bytes=100-1123", captor.getValue().range());
        assertEquals(1024, client.bytesTransferred());
        assertEquals(1024 / (1024.0 * 1024 * 1024) * 0.09, client.estimatedCostUsd(), 1e-15);

        client.resetCostTracking();
        assertEquals(0, client.bytesTransferred());
        assertEquals(0.0, client.estimatedCostUsd());
    }

    @Test
    public void testDownloadRangeRejectsBackwardsRange() {
        assertThrows(IllegalArgumentException.class, () -> client.downloadRange("seg", 10, 5));
        verifyNoInteractions(s3Client);
    }

    @Test
    public void testDownloadMissingIsEmpty() {
        when(s3Client.getObject(any(GetObjectRequest.class))).thenThrow(s3Error(404));
        assertTrue(client.download("missing").isEmpty());
    }

    @Test
    public void testStreamDecompressedGunzipsConcatenatedMembersInChunks() throws IOException {
        byte[] first = new byte[100_000];
        byte[] second = new byte[50_000];
        for (int i = 0; i < first.length; i++) first[i] = (byte) i;
        for (int i = 0; i < second.length; i++) second[i] = (byte) (i * 7);
        byte[] compressed = gzip(first, second);
        when(s3Client.getObject(any(GetObjectRequest.class))).thenReturn(response(
                GetObjectResponse.builder().build(), compressed));

        List<byte[]> chunks;
        try (var stream = client.streamDecompressed("seg")) {
            assertEquals(1, gate.inFlight());
            chunks = stream.toList();
        }
        assertEquals(0, gate.inFlight());
        assertEquals(List.of(65536, 65536, 18928), chunks.stream().map(c -> c.length).toList());

        var joined = new ByteArrayOutputStream();
        chunks.forEach(joined::writeBytes);
        var expected = new ByteArrayOutputStream();
        expected.writeBytes(first);
        expected.writeBytes(second);
        assertArrayEquals(expected.toByteArray(), joined.toByteArray());
        assertEquals(compressed.length, client.bytesTransferred());
    }

    @Test
    public void testStreamDecompressedPassesThroughUncompressed() {
        byte[] plain = "WARC/1.0\r\n".getBytes();
        when(s3Client.getObject(any(GetObjectRequest.class))).thenReturn(response(
                GetObjectResponse.builder().build(), plain));
        try (var stream = client.streamDecompressed("plain")) {
            var chunks = stream.toList();
            assertEquals(1, chunks.size());
            assertArrayEquals(plain, chunks.get(0));
        }
    }

    @Test
    public void testStreamDecompressedFallsBackToRawWhenGzipIsCorrupt() {
        byte[] corrupt = {0x1f, (byte) 0x8b, 'W', 'A', 'R', 'C', '/', '1', '.', '0', '\r', '\n'};
        when(s3Client.getObject(any(GetObjectRequest.class))).thenReturn(response(
                GetObjectResponse.builder().build(), corrupt));
        try (var stream = client.streamDecompressed("corrupt")) {
            var chunks = stream.toList();
            assertEquals(1, chunks.size());
            assertArrayEquals(corrupt, chunks.get(0));
        }
        assertEquals(0, gate.inFlight());
        assertEquals(corrupt.length, client.bytesTransferred());
    }

    @Test
    public void testStreamDecompressedMissingIsEmptyAndReleasesSlot() {
        when(s3Client.getObject(any(GetObjectRequest.class))).thenThrow(s3Error(404));
        try (var stream = client.streamDecompressed("missing")) {
            assertEquals(0, stream.count());
        }
        assertEquals(0, gate.inFlight());
    }
}
