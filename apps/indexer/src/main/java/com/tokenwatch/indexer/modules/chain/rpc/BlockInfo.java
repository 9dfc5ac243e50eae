package com.tokenwatch.indexer.modules.chain.rpc;

import lombok.Value;

import java.time.Instant;

/**
 * Block metadata needed to stamp and verify indexed transfers.
 */
@Value
public class BlockInfo {
    long number;
    String hash;
    Instant timestamp;
}
