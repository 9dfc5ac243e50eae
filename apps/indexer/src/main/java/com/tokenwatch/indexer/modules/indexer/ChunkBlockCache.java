package com.tokenwatch.indexer.modules.indexer;

import com.tokenwatch.indexer.modules.chain.rpc.BlockInfo;
import com.tokenwatch.indexer.modules.chain.rpc.ChainClient;
import com.tokenwatch.indexer.util.RetryPolicy;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Block hash/timestamp lookups for one chunk. Each block number is fetched at most once;
 * lookups for different blocks run concurrently on the given executor.
 * A new instance is used per chunk and dropped afterwards.
 */
class ChunkBlockCache {

    private final ChainClient chainClient;
    private final RetryPolicy retryPolicy;
    private final Executor executor;
    private final Map<Long, CompletableFuture<Optional<BlockInfo>>> lookups = new ConcurrentHashMap<>();

    ChunkBlockCache(ChainClient chainClient, RetryPolicy retryPolicy, Executor executor) {
        this.chainClient = chainClient;
        this.retryPolicy = retryPolicy;
        this.executor = executor;
    }

    CompletableFuture<Optional<BlockInfo>> lookup(long blockNumber) {
        return lookups.computeIfAbsent(blockNumber, number -> CompletableFuture.supplyAsync(
                () -> retryPolicy.execute("eth_getBlockByNumber(" + number + ")", () -> chainClient.blockAt(number)),
                executor));
    }
}
