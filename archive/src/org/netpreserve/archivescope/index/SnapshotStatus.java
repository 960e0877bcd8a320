package org.netpreserve.archivescope.index;

public enum SnapshotStatus {
    ACTIVE, COMPLETE, PROCESSING, UNKNOWN
}
