package com.tokenwatch.indexer.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Call to the token contract's {@code transfer(to, amount)} as it would be sent, but unsigned.
 */
@Value
@Builder
public class UnsignedTransfer {
    String from;
    /**
     * Token contract address.
     */
    String to;
    /**
     * ABI-encoded call data.
     */
    String data;
}
