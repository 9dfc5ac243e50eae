package com.tokenwatch.indexer.modules.transfers.store;

import com.tokenwatch.indexer.modules.transfers.model.Frontier;
import com.tokenwatch.indexer.modules.transfers.model.TransferRecord;
import com.tokenwatch.indexer.repository.TransferRecordRepository;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link EventStore} over Spring Data JPA.
 * Implements idempotency check based on txHash + logIndex; the unique constraint on the table
 * backs it up.
 */
@Component
public class JpaEventStore implements EventStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaEventStore.class);

    private final TransferRecordRepository repository;
    private final Tracer tracer;

    public JpaEventStore(TransferRecordRepository repository, Tracer tracer) {
        this.repository = repository;
        this.tracer = tracer;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Frontier> findHighestBlock() {
        return repository.findFirstByOrderByBlockNumberDescIdDesc()
                .map(t -> new Frontier(t.getBlockNumber(), t.getBlockHash()));
    }

    @Override
    @Transactional
    public int insertManyIgnoringDuplicates(List<TransferRecord> records) {
        Span span = tracer.spanBuilder("JpaEventStore.insertManyIgnoringDuplicates")
                .setAttribute("event.count", records != null ? records.size() : 0)
                .startSpan();
        try {
            if (records == null || records.isEmpty()) {
                return 0;
            }

            Map<String, TransferRecord> byKey = new LinkedHashMap<>();
            for (TransferRecord record : records) {
                byKey.putIfAbsent(record.naturalKey(), record);
            }

            Set<String> txHashes = byKey.values().stream()
                    .map(TransferRecord::getTxHash)
                    .collect(Collectors.toSet());
            Set<String> existingKeys = repository.findByTxHashIn(txHashes).stream()
                    .map(TransferRecord::naturalKey)
                    .collect(Collectors.toSet());

            List<TransferRecord> fresh = byKey.values().stream()
                    .filter(record -> !existingKeys.contains(record.naturalKey()))
                    .toList();
            repository.saveAll(fresh);

            logger.debug("Batch insert: {} / {} records new", fresh.size(), records.size());
            return fresh.size();
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long count() {
        return repository.count();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Long> findOldest(int n) {
        if (n <= 0) {
            return List.of();
        }
        return repository.findOldestIds(PageRequest.of(0, n));
    }

    @Override
    @Transactional
    public int deleteByIds(List<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        int deleted = repository.deleteByIds(ids);
        logger.debug("Deleted {} of {} requested transfer id(s)", deleted, ids.size());
        return deleted;
    }

    @Override
    @Transactional
    public int deleteWhereBlockAtLeast(long threshold) {
        Span span = tracer.spanBuilder("JpaEventStore.deleteWhereBlockAtLeast")
                .setAttribute("block.threshold", threshold)
                .startSpan();
        try {
            return repository.deleteByBlockNumberAtLeast(threshold);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
