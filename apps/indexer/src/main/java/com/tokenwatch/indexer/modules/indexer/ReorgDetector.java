package com.tokenwatch.indexer.modules.indexer;

import com.tokenwatch.indexer.config.IndexerProperties;
import com.tokenwatch.indexer.modules.chain.rpc.BlockInfo;
import com.tokenwatch.indexer.modules.chain.rpc.ChainClient;
import com.tokenwatch.indexer.modules.transfers.model.Frontier;
import com.tokenwatch.indexer.modules.transfers.store.EventStore;
import com.tokenwatch.indexer.util.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Checks that the stored frontier block is still canonical and rolls the store back if not.
 *
 * <p>After a rollback the new frontier is checked again, so a reorg deeper than one indexed block
 * is unwound in the same call. When {@code indexer.max-reorg-depth} rollbacks are not enough the
 * cycle is aborted; the deletions already made stay committed and the next cycle resumes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReorgDetector {

    private final ChainClient chainClient;
    private final RetryPolicy retryPolicy;
    private final EventStore eventStore;
    private final IndexerProperties properties;

    /**
     * @return number of records deleted by rollbacks (0 when the frontier is canonical or the store is empty)
     */
    public int rollbackIfReorganized() {
        int deleted = 0;

        for (int step = 0; step < properties.getMaxReorgDepth(); step++) {
            Optional<Frontier> frontier = eventStore.findHighestBlock();
            if (frontier.isEmpty()) {
                return deleted;
            }

            long blockNumber = frontier.get().getBlockNumber();
            String storedHash = frontier.get().getBlockHash();
            Optional<BlockInfo> chainBlock = retryPolicy.execute(
                    "eth_getBlockByNumber(" + blockNumber + ")",
                    () -> chainClient.blockAt(blockNumber));

            if (chainBlock.isPresent() && chainBlock.get().getHash().equalsIgnoreCase(storedHash)) {
                return deleted;
            }

            log.warn("Reorg detected at block {} (stored hash {}, chain hash {}), rolling back...",
                    blockNumber, storedHash, chainBlock.map(BlockInfo::getHash).orElse("<missing>"));
            int removed = eventStore.deleteWhereBlockAtLeast(blockNumber);
            deleted += removed;
            log.warn("Rolled back {} transfer(s) at or above block {}", removed, blockNumber);
        }

        throw new IllegalStateException("Frontier still diverges after " + properties.getMaxReorgDepth()
                + " rollback step(s); aborting cycle");
    }
}
