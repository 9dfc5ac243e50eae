package com.tokenwatch.indexer.modules.transfers.events;

import lombok.Value;

/**
 * Transfer fields read from one log, before block metadata is attached.
 */
@Value
public class DecodedTransfer {
    String txHash;
    int logIndex;
    long blockNumber;
    String from;
    String to;
    String amount;
}
