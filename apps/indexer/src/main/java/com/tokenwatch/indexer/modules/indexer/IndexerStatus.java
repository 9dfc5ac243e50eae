package com.tokenwatch.indexer.modules.indexer;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class IndexerStatus {
    boolean running;
    CycleReport lastReport;
    String lastError;
    Instant lastErrorAt;
    Long frontierBlock;
    String frontierHash;
    long storedCount;
}
