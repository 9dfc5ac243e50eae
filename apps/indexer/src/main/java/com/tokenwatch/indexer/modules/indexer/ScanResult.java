package com.tokenwatch.indexer.modules.indexer;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one backward scan.
 */
@Value
@Builder
public class ScanResult {
    long safeHead;
    long lastIndexedBlock;
    int chunksScanned;
    int inserted;
    int dropped;
    /**
     * Lowest block examined, null when nothing was scanned.
     */
    Long lowestScannedBlock;

    static ScanResult nothingToScan(long safeHead, long lastIndexedBlock) {
        return ScanResult.builder()
                .safeHead(safeHead)
                .lastIndexedBlock(lastIndexedBlock)
                .build();
    }
}
