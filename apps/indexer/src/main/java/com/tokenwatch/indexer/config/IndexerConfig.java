package com.tokenwatch.indexer.config;

import com.tokenwatch.indexer.modules.chain.rpc.ChainClient;
import com.tokenwatch.indexer.modules.chain.rpc.Web3jChainClient;
import com.tokenwatch.indexer.util.RetryPolicy;
import com.tokenwatch.indexer.util.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the indexing engine's collaborators from {@link IndexerProperties}.
 */
@Configuration
public class IndexerConfig {

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy rpcRetryPolicy(IndexerProperties properties, Sleeper sleeper) {
        IndexerProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialDelayMs(), retry.getJitterMs(), sleeper);
    }

    @Bean
    public ChainClient chainClient(Web3j web3j) {
        return new Web3jChainClient(web3j);
    }

    /**
     * Pool resolving block metadata for the logs of one chunk.
     */
    @Bean(name = "blockLookupExecutor", destroyMethod = "shutdownNow")
    public ExecutorService blockLookupExecutor(IndexerProperties properties) {
        return Executors.newFixedThreadPool(properties.getBlockLookupParallelism(), namedThreads("block-lookup"));
    }

    /**
     * Single thread running background cycles (startup and manual triggers).
     */
    @Bean(name = "cycleExecutor", destroyMethod = "shutdownNow")
    public ExecutorService cycleExecutor() {
        return Executors.newSingleThreadExecutor(namedThreads("indexer-cycle"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
