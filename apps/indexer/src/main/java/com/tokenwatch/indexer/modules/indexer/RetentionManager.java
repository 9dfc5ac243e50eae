package com.tokenwatch.indexer.modules.indexer;

import com.tokenwatch.indexer.config.IndexerProperties;
import com.tokenwatch.indexer.modules.transfers.store.EventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Trims the store to {@code indexer.max-indexer-size}, lowest blocks first.
 * Must run after the scan's inserts are committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionManager {

    private final EventStore eventStore;
    private final IndexerProperties properties;

    /**
     * @return number of evicted records
     */
    public int enforceCap() {
        int cap = properties.getMaxIndexerSize();
        long excess = eventStore.count() - cap;
        if (excess <= 0) {
            return 0;
        }

        log.info("Deleting {} old transfers to maintain the {}-record limit.", excess, cap);
        List<Long> ids = eventStore.findOldest((int) Math.min(excess, Integer.MAX_VALUE));
        return eventStore.deleteByIds(ids);
    }
}
