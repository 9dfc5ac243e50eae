package com.tokenwatch.indexer.modules.transfers.model;

import lombok.Value;

/**
 * Highest stored block and the hash it was indexed with.
 */
@Value
public class Frontier {
    long blockNumber;
    String blockHash;
}
