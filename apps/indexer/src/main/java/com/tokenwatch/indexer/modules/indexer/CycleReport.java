package com.tokenwatch.indexer.modules.indexer;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Summary of one completed indexing cycle.
 */
@Value
@Builder
public class CycleReport {
    String trigger;
    Instant startedAt;
    Instant finishedAt;
    int rolledBack;
    long safeHead;
    long lastIndexedBlock;
    int chunksScanned;
    int inserted;
    int dropped;
    int evicted;
    Long lowestScannedBlock;

    public long getDurationMs() {
        return finishedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
