package com.tokenwatch.indexer.modules.chain.rpc;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a chain node.
 * Implementations make exactly one remote call per method and never retry.
 */
public interface ChainClient {

    /**
     * Latest block height (eth_blockNumber).
     */
    long headHeight();

    /**
     * Block hash and timestamp (eth_getBlockByNumber), empty when the node does not know the block.
     */
    Optional<BlockInfo> blockAt(long number);

    /**
     * Logs emitted by {@code contractAddress} with topic0 {@code eventTopic} in the inclusive range
     * (eth_getLogs).
     */
    List<ChainLog> logsInRange(String contractAddress, String eventTopic, long fromBlock, long toBlock);

    /**
     * ERC-20 {@code balanceOf(owner)} at the latest block (eth_call), in the token's smallest unit.
     */
    BigInteger tokenBalance(String contractAddress, String owner);

    /**
     * Gas the node expects the call to use (eth_estimateGas). Nothing is signed or broadcast.
     */
    BigInteger estimateGas(String from, String to, String data);
}
