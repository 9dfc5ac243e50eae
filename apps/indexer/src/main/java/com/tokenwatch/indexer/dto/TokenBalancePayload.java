package com.tokenwatch.indexer.dto;

import lombok.Builder;
import lombok.Value;

/**
 * On-chain token balance of one address.
 */
@Value
@Builder
public class TokenBalancePayload {
    String address;
    String balance;
    String rawBalance;
}
