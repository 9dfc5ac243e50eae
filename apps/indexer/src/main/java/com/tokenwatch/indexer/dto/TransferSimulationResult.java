package com.tokenwatch.indexer.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a simulated transfer. {@code success} is false when the node rejects the gas estimate,
 * for example because the sender's balance is too low.
 */
@Value
@Builder
public class TransferSimulationResult {
    boolean success;
    String message;
    String from;
    String to;
    String amount;
    UnsignedTransfer txData;
    String estimatedGas;
    String error;
}
