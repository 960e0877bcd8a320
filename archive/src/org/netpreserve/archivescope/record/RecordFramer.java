package org.netpreserve.archivescope.record;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Splits an uncompressed stream of concatenated WARC records into header and block byte
 * arrays. After a framing error it skips forward to the next line starting with
 * {@code WARC/}, so one damaged record doesn't take the rest of the segment with it.
 */
class RecordFramer {
    private static final Logger log = LoggerFactory.getLogger(RecordFramer.class);
    private static final int MAX_LINE_LENGTH = 64 * 1024;
    private final InputStream in;
    private long skippedLines;

    record Frame(byte[] header, byte[] block) {
    }

    RecordFramer(InputStream in) {
        this.in = in;
    }

    /**
     * @return the next frame or null at end of input
     */
    Frame next() throws IOException {
        while (true) {
            byte[] line = readLine();
            if (line == null) return null;
            if (isBlank(line)) continue;
            if (!startsWith(line, "WARC/")) {
                skippedLines++;
                continue;
            }

            var header = new ByteArrayOutputStream();
            header.write(line);
            long contentLength = -1;
            boolean complete = false;
            while ((line = readLine()) != null) {
                header.write(line);
                if (isBlank(line)) {
                    complete = true;
                    break;
                }
                String field = new String(line, StandardCharsets.UTF_8);
                int colon = field.indexOf(':');
                if (colon > 0 && field.substring(0, colon).trim().toLowerCase(Locale.ROOT).equals("content-length")) {
                    try {
                        contentLength = Long.parseLong(field.substring(colon + 1).trim());
                    } catch (NumberFormatException e) {
                        contentLength = -1;
                    }
                }
            }
            if (!complete) {
                log.warn("Truncated record header at end of segment");
                return null;
            }
            if (contentLength < 0 || contentLength > Integer.MAX_VALUE) {
                log.warn("Skipping record with missing or invalid Content-Length");
                continue;
            }
            byte[] block = in.readNBytes((int) contentLength);
            if (block.length < contentLength) {
                log.warn("Truncated record block: expected {} bytes, got {}", contentLength, block.length);
                return null;
            }
            if (skippedLines > 0) {
                log.debug("Resynchronised after skipping {} lines", skippedLines);
                skippedLines = 0;
            }
            return new Frame(header.toByteArray(), block);
        }
    }

    private byte[] readLine() throws IOException {
        var line = new ByteArrayOutputStream();
        while (true) {
            int b = in.read();
            if (b == -1) return line.size() == 0 ? null : line.toByteArray();
            line.write(b);
            if (b == '\n' || line.size() >= MAX_LINE_LENGTH) return line.toByteArray();
        }
    }

    private static boolean isBlank(byte[] line) {
        for (byte b : line) {
            if (b != '\r' && b != '\n') return false;
        }
        return true;
    }

    private static boolean startsWith(byte[] line, String prefix) {
        if (line.length < prefix.length()) return false;
        for (int i = 0; i < prefix.length(); i++) {
            if (line[i] != prefix.charAt(i)) return false;
        }
        return true;
    }
}
