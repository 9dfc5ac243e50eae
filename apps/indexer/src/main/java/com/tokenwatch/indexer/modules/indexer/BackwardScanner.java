package com.tokenwatch.indexer.modules.indexer;

import com.tokenwatch.indexer.config.IndexerProperties;
import com.tokenwatch.indexer.modules.chain.rpc.BlockInfo;
import com.tokenwatch.indexer.modules.chain.rpc.ChainClient;
import com.tokenwatch.indexer.modules.chain.rpc.ChainLog;
import com.tokenwatch.indexer.modules.transfers.events.DecodedTransfer;
import com.tokenwatch.indexer.modules.transfers.events.TransferDecodingException;
import com.tokenwatch.indexer.modules.transfers.events.TransferEventDecoder;
import com.tokenwatch.indexer.modules.transfers.model.TransferRecord;
import com.tokenwatch.indexer.modules.transfers.store.EventStore;
import com.tokenwatch.indexer.util.RetryPolicy;
import com.tokenwatch.indexer.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Walks block windows backward from the safe head (chain head minus confirmations) down to the
 * last indexed block, inserting decoded transfers chunk by chunk until the per-cycle quota is met.
 *
 * <p>A chunk is written only after all of its logs are decoded, so a failed fetch never leaves a
 * half-written chunk. A log that fails to decode or whose block cannot be resolved is dropped on
 * its own.
 */
@Component
public class BackwardScanner {

    private static final Logger logger = LoggerFactory.getLogger(BackwardScanner.class);

    private final ChainClient chainClient;
    private final RetryPolicy retryPolicy;
    private final EventStore eventStore;
    private final TransferEventDecoder decoder;
    private final Executor blockLookupExecutor;
    private final Sleeper sleeper;
    private final IndexerProperties properties;

    public BackwardScanner(ChainClient chainClient,
                           RetryPolicy retryPolicy,
                           EventStore eventStore,
                           TransferEventDecoder decoder,
                           @Qualifier("blockLookupExecutor") Executor blockLookupExecutor,
                           Sleeper sleeper,
                           IndexerProperties properties) {
        this.chainClient = chainClient;
        this.retryPolicy = retryPolicy;
        this.eventStore = eventStore;
        this.decoder = decoder;
        this.blockLookupExecutor = blockLookupExecutor;
        this.sleeper = sleeper;
        this.properties = properties;
    }

    /**
     * Scan from the safe head down to {@code lastIndexedBlock + 1}.
     *
     * @param lastIndexedBlock highest block already stored, 0 for an empty store
     * @return what was scanned and inserted
     * @throws RuntimeException when a log fetch fails after all retries; earlier chunks stay committed
     */
    public ScanResult scan(long lastIndexedBlock) {
        int chunkSize = properties.getChunkSize();
        int quota = properties.getMaxIndexerSize();

        long head = retryPolicy.execute("eth_blockNumber", chainClient::headHeight);
        long safeHead = head - properties.getConfirmations();
        if (safeHead < lastIndexedBlock) {
            logger.info("Safe head {} is below last indexed block {}, nothing to scan", safeHead, lastIndexedBlock);
            return ScanResult.nothingToScan(safeHead, lastIndexedBlock);
        }

        long toBlock = safeHead;
        long fromBlock = Math.max(lastIndexedBlock + 1, toBlock - chunkSize + 1);
        int inserted = 0;
        int dropped = 0;
        int chunks = 0;
        Long lowest = null;

        while (inserted < quota && fromBlock <= toBlock) {
            if (chunks > 0) {
                pace();
            }
            logger.info("Fetching logs from block {} to {}", fromBlock, toBlock);

            long windowFrom = fromBlock;
            long windowTo = toBlock;
            List<ChainLog> logs = retryPolicy.execute(
                    "eth_getLogs[" + windowFrom + "-" + windowTo + "]",
                    () -> chainClient.logsInRange(properties.getContractAddress(),
                            TransferEventDecoder.TRANSFER_TOPIC, windowFrom, windowTo));

            List<TransferRecord> records = resolveChunk(logs);
            int droppedInChunk = logs.size() - records.size();
            int insertedInChunk = records.isEmpty() ? 0 : eventStore.insertManyIgnoringDuplicates(records);

            if (droppedInChunk > 0) {
                logger.warn("Dropped {} of {} log(s) in blocks {}-{}", droppedInChunk, logs.size(), fromBlock, toBlock);
            }
            logger.info("Inserted {} transfers for blocks {}-{}", insertedInChunk, fromBlock, toBlock);

            inserted += insertedInChunk;
            dropped += droppedInChunk;
            chunks++;
            lowest = fromBlock;

            toBlock = fromBlock - 1;
            fromBlock = Math.max(lastIndexedBlock + 1, toBlock - chunkSize + 1);
        }

        return ScanResult.builder()
                .safeHead(safeHead)
                .lastIndexedBlock(lastIndexedBlock)
                .chunksScanned(chunks)
                .inserted(inserted)
                .dropped(dropped)
                .lowestScannedBlock(lowest)
                .build();
    }

    /**
     * Decode every log of a chunk and attach its block metadata; failures drop single logs only.
     */
    List<TransferRecord> resolveChunk(List<ChainLog> logs) {
        ChunkBlockCache blockCache = new ChunkBlockCache(chainClient, retryPolicy, blockLookupExecutor);
        List<DecodedTransfer> decoded = new ArrayList<>(logs.size());
        List<CompletableFuture<Optional<BlockInfo>>> blocks = new ArrayList<>(logs.size());

        for (ChainLog log : logs) {
            try {
                DecodedTransfer transfer = decoder.decode(log);
                decoded.add(transfer);
                blocks.add(blockCache.lookup(transfer.getBlockNumber()));
            } catch (TransferDecodingException e) {
                logger.debug("Skipping invalid log: {}", e.getMessage());
            }
        }

        List<TransferRecord> records = new ArrayList<>(decoded.size());
        for (int i = 0; i < decoded.size(); i++) {
            DecodedTransfer transfer = decoded.get(i);
            try {
                Optional<BlockInfo> block = blocks.get(i).join();
                if (block.isEmpty()) {
                    logger.debug("Skipping log {}:{}, block {} not found",
                            transfer.getTxHash(), transfer.getLogIndex(), transfer.getBlockNumber());
                    continue;
                }
                records.add(decoder.toRecord(transfer, block.get()));
            } catch (CompletionException e) {
                logger.debug("Skipping log {}:{}, block {} lookup failed: {}",
                        transfer.getTxHash(), transfer.getLogIndex(), transfer.getBlockNumber(),
                        e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            }
        }
        return records;
    }

    private void pace() {
        try {
            sleeper.sleep(properties.getPacingDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted between chunk fetches", e);
        }
    }
}
