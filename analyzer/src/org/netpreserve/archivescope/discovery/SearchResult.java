package org.netpreserve.archivescope.discovery;

import org.netpreserve.archivescope.index.IndexRecord;
import org.netpreserve.archivescope.index.MatchType;

import java.util.List;

public record SearchResult(String query, String snapshotId, MatchType matchType, int count,
                           List<IndexRecord> records) {
}
