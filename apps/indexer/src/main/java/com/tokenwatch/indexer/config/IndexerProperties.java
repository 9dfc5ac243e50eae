package com.tokenwatch.indexer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Indexer configuration bound from {@code indexer.*} in {@code application.yaml}.
 *
 * <p>{@link #getMaxIndexerSize()} is used both as the retention cap and as the number of new
 * transfers one cycle tries to fetch.
 */
@Component
@ConfigurationProperties(prefix = "indexer")
public class IndexerProperties {

    /**
     * HTTP JSON-RPC endpoint of the chain node.
     */
    private String rpcUrl;

    /**
     * Token contract whose Transfer events are indexed (USDC on mainnet by default).
     */
    private String contractAddress = "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48";

    /**
     * Token decimals, only used to format amounts for readers.
     */
    private int tokenDecimals = 6;

    /**
     * Blocks per eth_getLogs window.
     */
    private int chunkSize = 5;

    /**
     * Maximum stored transfers, also the per-cycle fetch quota.
     */
    private int maxIndexerSize = 1000;

    /**
     * Blocks below the chain head considered final.
     */
    private int confirmations = 12;

    /**
     * Delay between two chunk fetches in milliseconds.
     */
    private long pacingDelayMs = 300;

    /**
     * Worker threads resolving block hash/timestamp inside one chunk.
     */
    private int blockLookupParallelism = 4;

    /**
     * Upper bound on rollback steps performed by one reorg check.
     */
    private int maxReorgDepth = 64;

    /**
     * Run one cycle as soon as the application is ready.
     */
    private boolean runOnStartup = true;

    private Retry retry = new Retry();

    private Schedule schedule = new Schedule();

    /**
     * Fail fast on settings the engine cannot run with.
     */
    public void validate() {
        if (rpcUrl == null || rpcUrl.isBlank()) {
            throw new IllegalArgumentException("indexer.rpc-url cannot be empty");
        }
        if (contractAddress == null || contractAddress.isBlank()) {
            throw new IllegalArgumentException("indexer.contract-address cannot be empty");
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("indexer.chunk-size must be positive");
        }
        if (maxIndexerSize <= 0) {
            throw new IllegalArgumentException("indexer.max-indexer-size must be positive");
        }
        if (confirmations < 0) {
            throw new IllegalArgumentException("indexer.confirmations cannot be negative");
        }
        if (blockLookupParallelism <= 0) {
            throw new IllegalArgumentException("indexer.block-lookup-parallelism must be positive");
        }
        if (maxReorgDepth <= 0) {
            throw new IllegalArgumentException("indexer.max-reorg-depth must be positive");
        }
        if (retry.getMaxAttempts() <= 0) {
            throw new IllegalArgumentException("indexer.retry.max-attempts must be positive");
        }
        if (retry.getInitialDelayMs() < 0 || retry.getJitterMs() < 0 || pacingDelayMs < 0) {
            throw new IllegalArgumentException("indexer delays cannot be negative");
        }
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public void setContractAddress(String contractAddress) {
        this.contractAddress = contractAddress;
    }

    public int getTokenDecimals() {
        return tokenDecimals;
    }

    public void setTokenDecimals(int tokenDecimals) {
        this.tokenDecimals = tokenDecimals;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getMaxIndexerSize() {
        return maxIndexerSize;
    }

    public void setMaxIndexerSize(int maxIndexerSize) {
        this.maxIndexerSize = maxIndexerSize;
    }

    public int getConfirmations() {
        return confirmations;
    }

    public void setConfirmations(int confirmations) {
        this.confirmations = confirmations;
    }

    public long getPacingDelayMs() {
        return pacingDelayMs;
    }

    public void setPacingDelayMs(long pacingDelayMs) {
        this.pacingDelayMs = pacingDelayMs;
    }

    public int getBlockLookupParallelism() {
        return blockLookupParallelism;
    }

    public void setBlockLookupParallelism(int blockLookupParallelism) {
        this.blockLookupParallelism = blockLookupParallelism;
    }

    public int getMaxReorgDepth() {
        return maxReorgDepth;
    }

    public void setMaxReorgDepth(int maxReorgDepth) {
        this.maxReorgDepth = maxReorgDepth;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    /**
     * Backoff settings applied to every RPC call.
     */
    public static class Retry {
        /**
         * Total attempts, the first call included.
         */
        private int maxAttempts = 6;
        private long initialDelayMs = 1000;
        /**
         * Upper bound of the uniform random delay added to each backoff.
         */
        private long jitterMs = 300;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public long getJitterMs() {
            return jitterMs;
        }

        public void setJitterMs(long jitterMs) {
            this.jitterMs = jitterMs;
        }
    }

    /**
     * Optional recurring trigger.
     */
    public static class Schedule {
        private boolean enabled = false;
        private long intervalMs = 60_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }
}
