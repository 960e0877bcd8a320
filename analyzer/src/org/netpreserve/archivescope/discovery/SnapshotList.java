package org.netpreserve.archivescope.discovery;

import org.netpreserve.archivescope.index.CrawlSnapshot;

import java.util.List;

public record SnapshotList(List<CrawlSnapshot> snapshots) {
}
