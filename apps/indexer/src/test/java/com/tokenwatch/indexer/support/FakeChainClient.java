package com.tokenwatch.indexer.support;

import com.tokenwatch.indexer.modules.chain.rpc.BlockInfo;
import com.tokenwatch.indexer.modules.chain.rpc.ChainClient;
import com.tokenwatch.indexer.modules.chain.rpc.ChainLog;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable chain: a head height, canonical blocks and Transfer logs.
 * Records every log window and block lookup it serves.
 */
public class FakeChainClient implements ChainClient {

    private volatile long head;
    private final Map<Long, BlockInfo> blocks = new ConcurrentHashMap<>();
    private final List<ChainLog> logs = new CopyOnWriteArrayList<>();
    private final List<long[]> logWindows = new CopyOnWriteArrayList<>();
    private final Map<Long, AtomicInteger> blockLookups = new ConcurrentHashMap<>();
    private final Deque<RuntimeException> logFailures = new ArrayDeque<>();
    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
    private final List<String[]> gasEstimates = new CopyOnWriteArrayList<>();
    private volatile BigInteger gasEstimate = BigInteger.valueOf(65_000);
    private volatile RuntimeException gasFailure;

    public FakeChainClient head(long head) {
        this.head = head;
        return this;
    }

    /**
     * Canonical block with hash {@code 0x<fork>-<number>} for every number in [from, to].
     */
    public FakeChainClient blocks(long from, long to, String fork) {
        for (long n = from; n <= to; n++) {
            block(n, TransferLogs.blockHash(n, fork));
        }
        return this;
    }

    public FakeChainClient block(long number, String hash) {
        blocks.put(number, new BlockInfo(number, hash, Instant.ofEpochSecond(1_700_000_000L + number * 12)));
        return this;
    }

    public FakeChainClient removeBlock(long number) {
        blocks.remove(number);
        return this;
    }

    public FakeChainClient log(ChainLog log) {
        logs.add(log);
        return this;
    }

    /**
     * The next {@code times} eth_getLogs calls throw {@code failure}.
     */
    public synchronized FakeChainClient failLogCalls(int times, RuntimeException failure) {
        for (int i = 0; i < times; i++) {
            logFailures.add(failure);
        }
        return this;
    }

    public FakeChainClient balance(String owner, BigInteger amount) {
        balances.put(owner.toLowerCase(), amount);
        return this;
    }

    public FakeChainClient gasEstimate(BigInteger gas) {
        this.gasEstimate = gas;
        return this;
    }

    /**
     * Every eth_estimateGas call throws {@code failure}.
     */
    public FakeChainClient failGasEstimates(RuntimeException failure) {
        this.gasFailure = failure;
        return this;
    }

    @Override
    public long headHeight() {
        return head;
    }

    @Override
    public Optional<BlockInfo> blockAt(long number) {
        blockLookups.computeIfAbsent(number, n -> new AtomicInteger()).incrementAndGet();
        return Optional.ofNullable(blocks.get(number));
    }

    @Override
    public List<ChainLog> logsInRange(String contractAddress, String eventTopic, long fromBlock, long toBlock) {
        logWindows.add(new long[]{fromBlock, toBlock});
        synchronized (this) {
            if (!logFailures.isEmpty()) {
                throw logFailures.poll();
            }
        }
        List<ChainLog> result = new ArrayList<>();
        for (ChainLog log : logs) {
            if (log.getBlockNumber() != null && log.getBlockNumber() >= fromBlock && log.getBlockNumber() <= toBlock) {
                result.add(log);
            }
        }
        return result;
    }

    @Override
    public BigInteger tokenBalance(String contractAddress, String owner) {
        return balances.getOrDefault(owner.toLowerCase(), BigInteger.ZERO);
    }

    @Override
    public BigInteger estimateGas(String from, String to, String data) {
        gasEstimates.add(new String[]{from, to, data});
        if (gasFailure != null) {
            throw gasFailure;
        }
        return gasEstimate;
    }

    /**
     * (from, to, data) of every eth_estimateGas call.
     */
    public List<String[]> gasEstimates() {
        return gasEstimates;
    }

    public List<long[]> logWindows() {
        return logWindows;
    }

    public int lookupsOf(long blockNumber) {
        AtomicInteger count = blockLookups.get(blockNumber);
        return count != null ? count.get() : 0;
    }
}
