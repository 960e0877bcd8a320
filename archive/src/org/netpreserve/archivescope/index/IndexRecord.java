package org.netpreserve.archivescope.index;

/**
 * A pointer to one captured page. {@code (segmentFilename, offset, length)} addresses the
 * compressed record inside the object store.
 *
 * @param url              the captured URL
 * @param mimeType         MIME type reported by the index
 * @param statusCode       HTTP status of the capture
 * @param contentDigest    payload digest
 * @param captureTimestamp 14-digit capture timestamp (yyyyMMddHHmmss)
 * @param length           compressed record length in bytes
 * @param offset           byte offset of the record in the segment file
 * @param segmentFilename  object key of the segment file
 */
public record IndexRecord(
        String url,
        String mimeType,
        int statusCode,
        String contentDigest,
        String captureTimestamp,
        long length,
        long offset,
        String segmentFilename
) {
    /**
     * Inclusive byte range of the record, suitable for an HTTP Range header.
     */
    public long lastByte() {
        return offset + length - 1;
    }
}
