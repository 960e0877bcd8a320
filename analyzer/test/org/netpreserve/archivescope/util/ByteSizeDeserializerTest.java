package org.netpreserve.archivescope.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ByteSizeDeserializerTest {
    @Test
    public void parse() {
        assertEquals(100, ByteSizeDeserializer.parse("100"));
        assertEquals(2048, ByteSizeDeserializer.parse("2K"));
        assertEquals(512L * 1024 * 1024, ByteSizeDeserializer.parse("512MB"));
        assertEquals(50L * 1024 * 1024 * 1024, ByteSizeDeserializer.parse("50 GB"));
        assertEquals(1536L * 1024 * 1024, ByteSizeDeserializer.parse("1.5g"));
        assertEquals(1024L * 1024 * 1024 * 1024, ByteSizeDeserializer.parse("1TiB"));
        assertThrows(IllegalArgumentException.class, () -> ByteSizeDeserializer.parse("lots"));
        assertThrows(IllegalArgumentException.class, () -> ByteSizeDeserializer.parse("-5MB"));
    }
}
