package com.tokenwatch.indexer.modules.transfers.store;

import com.tokenwatch.indexer.modules.transfers.model.Frontier;
import com.tokenwatch.indexer.modules.transfers.model.TransferRecord;

import java.util.List;
import java.util.Optional;

/**
 * Persistent collection of transfers keyed by (txHash, logIndex).
 * Every operation is atomic on its own.
 */
public interface EventStore {

    Optional<Frontier> findHighestBlock();

    /**
     * Insert the records, skipping any whose natural key is already stored or repeated in the batch.
     *
     * @return number of rows actually inserted
     */
    int insertManyIgnoringDuplicates(List<TransferRecord> records);

    long count();

    /**
     * Ids of the {@code n} lowest-block records, ties broken by id.
     */
    List<Long> findOldest(int n);

    int deleteByIds(List<Long> ids);

    int deleteWhereBlockAtLeast(long threshold);
}
