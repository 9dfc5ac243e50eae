package com.tokenwatch.indexer.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Transfer as returned by the query endpoints.
 * {@code amount} is the raw integer, {@code formattedAmount} is scaled by the token decimals.
 */
@Value
@Builder
public class TransferPayload {
    Long id;
    String txHash;
    int logIndex;
    long block;
    String blockHash;
    String from;
    String to;
    String amount;
    String formattedAmount;
    Instant timestamp;
}
