package org.netpreserve.archivescope.analysis;

/**
 * A detected technology, e.g. {@code ("WordPress", "cms")}.
 */
public record Technology(String name, String category) {
}
