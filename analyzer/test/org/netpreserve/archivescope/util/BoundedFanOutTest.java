package org.netpreserve.archivescope.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BoundedFanOutTest {

    @Test
    public void keepsInputOrderAndIsolatesFailures() {
        try (var fanOut = new BoundedFanOut("test")) {
            var batch = fanOut.<String>run(List.of("a", "boom", "b", "empty", "a", "c"), 3, key -> switch (key) {
                case "boom" -> throw new IllegalStateException("boom");
                case "empty" -> Optional.empty();
                default -> Optional.of(key.toUpperCase(Locale.ROOT));
            });

            assertEquals(List.of("a", "b", "c"), List.copyOf(batch.results().keySet()));
            assertEquals("B", batch.results().get("b"));
            assertEquals(5, batch.attempted());
            assertEquals(3, batch.succeeded());
            assertEquals(List.of("boom", "empty"), batch.failures());
        }
    }

    @Test
    public void neverExceedsWidth() {
        var inFlight = new AtomicInteger();
        var peak = new AtomicInteger();
        try (var fanOut = new BoundedFanOut("test")) {
            var keys = List.of("1", "2", "3", "4", "5", "6", "7", "8", "9", "10");
            var batch = fanOut.run(keys, 2, key -> {
                int now = inFlight.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(20);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                inFlight.decrementAndGet();
                return Optional.of(key);
            });
            assertEquals(10, batch.succeeded());
        }
        assertTrue(peak.get() <= 2, "peak " + peak.get());
    }

    @Test
    public void rejectsZeroWidth() {
        try (var fanOut = new BoundedFanOut("test")) {
            assertThrows(IllegalArgumentException.class, () -> fanOut.run(List.of("a"), 0, Optional::of));
        }
    }
}
