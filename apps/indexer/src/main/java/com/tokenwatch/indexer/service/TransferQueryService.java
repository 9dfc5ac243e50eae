package com.tokenwatch.indexer.service;

import com.tokenwatch.indexer.config.IndexerProperties;
import com.tokenwatch.indexer.dto.TransferPayload;
import com.tokenwatch.indexer.modules.transfers.model.TransferRecord;
import com.tokenwatch.indexer.repository.TransferRecordRepository;
import com.tokenwatch.indexer.util.Addresses;
import com.tokenwatch.indexer.util.TokenAmounts;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;

/**
 * Read-only access to indexed transfers, newest block first.
 * Sees only committed data; never drives the indexing engine.
 */
@Service
@Transactional(readOnly = true)
public class TransferQueryService {

    private static final Logger logger = LoggerFactory.getLogger(TransferQueryService.class);

    public static final int MAX_LIMIT = 1000;
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("blockNumber"), Sort.Order.desc("logIndex"));

    private final TransferRecordRepository repository;
    private final IndexerProperties properties;
    private final Tracer tracer;

    public TransferQueryService(TransferRecordRepository repository, IndexerProperties properties, Tracer tracer) {
        this.repository = repository;
        this.properties = properties;
        this.tracer = tracer;
    }

    /**
     * Recent transfers, optionally filtered by sender and/or recipient.
     *
     * @param from  sender address or null
     * @param to    recipient address or null
     * @param limit maximum rows, 1..{@value #MAX_LIMIT}
     */
    public List<TransferPayload> findRecent(String from, String to, int limit) {
        Span span = tracer.spanBuilder("TransferQueryService.findRecent")
                .setAttribute("limit", limit)
                .startSpan();
        try {
            Pageable page = page(limit);
            String sender = Addresses.normalizeOptional(from, "from");
            String recipient = Addresses.normalizeOptional(to, "to");

            List<TransferRecord> rows;
            if (sender != null && recipient != null) {
                rows = repository.findByFromAddressAndToAddress(sender, recipient, page);
            } else if (sender != null) {
                rows = repository.findByFromAddress(sender, page);
            } else if (recipient != null) {
                rows = repository.findByToAddress(recipient, page);
            } else {
                rows = repository.findAll(page).getContent();
            }
            logger.debug("findRecent from={} to={} limit={} -> {} row(s)", sender, recipient, limit, rows.size());
            return rows.stream().map(this::toPayload).toList();
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Transfers sent or received by the address.
     */
    public List<TransferPayload> findHistory(String address, int limit) {
        Span span = tracer.spanBuilder("TransferQueryService.findHistory")
                .setAttribute("limit", limit)
                .startSpan();
        try {
            String participant = Addresses.normalize(address, "address");
            return repository.findByParticipant(participant, page(limit)).stream()
                    .map(this::toPayload)
                    .toList();
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    TransferPayload toPayload(TransferRecord record) {
        return TransferPayload.builder()
                .id(record.getId())
                .txHash(record.getTxHash())
                .logIndex(record.getLogIndex())
                .block(record.getBlockNumber())
                .blockHash(record.getBlockHash())
                .from(record.getFromAddress())
                .to(record.getToAddress())
                .amount(record.getAmount())
                .formattedAmount(TokenAmounts.format(new BigInteger(record.getAmount()), properties.getTokenDecimals()))
                .timestamp(record.getBlockTimestamp())
                .build();
    }

    private static Pageable page(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return PageRequest.of(0, limit, NEWEST_FIRST);
    }
}
