package org.netpreserve.archivescope.util;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

public final class Gzip {
    private static final int BUFFER_SIZE = 64 * 1024;

    private Gzip() {
    }

    /**
     * Wraps the stream in a decompressor if it starts with the gzip magic number, otherwise
     * returns it unchanged. Concatenated gzip members are decompressed in sequence.
     */
    public static InputStream maybeGunzip(BufferedInputStream in) throws IOException {
        in.mark(2);
        int b1 = in.read();
        int b2 = in.read();
        in.reset();
        if (b1 == 0x1f && b2 == 0x8b) {
            return new GZIPInputStream(in, BUFFER_SIZE);
        }
        return in;
    }

    public static boolean isGzip(byte[] data) {
        return data.length >= 2 && (data[0] & 0xff) == 0x1f && (data[1] & 0xff) == 0x8b;
    }
}
