package com.tokenwatch.indexer.modules.chain.rpc;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Raw event log as returned by eth_getLogs, before ABI decoding.
 * Numeric fields are null when the node omitted them.
 */
@Value
@Builder
public class ChainLog {
    String address;
    String transactionHash;
    Long logIndex;
    Long blockNumber;
    List<String> topics;
    String data;
}
