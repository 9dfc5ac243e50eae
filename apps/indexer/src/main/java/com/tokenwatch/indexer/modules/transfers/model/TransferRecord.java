package com.tokenwatch.indexer.modules.transfers.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Indexed token transfer mapped to the transfers table.
 * Rows are only ever inserted or deleted, never updated.
 */
@Entity
@Table(name = "transfers",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_transfers_tx_hash_log_index",
                columnNames = {"tx_hash", "log_index"}),
        indexes = {
                @Index(name = "idx_transfers_from", columnList = "from_address"),
                @Index(name = "idx_transfers_to", columnList = "to_address"),
                @Index(name = "idx_transfers_block", columnList = "block_number")
        })
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class TransferRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tx_hash", nullable = false, length = 66)
    private String txHash;

    @Column(name = "log_index", nullable = false)
    private Integer logIndex;

    @Column(name = "block_number", nullable = false)
    private Long blockNumber;

    @Column(name = "block_hash", nullable = false, length = 66)
    private String blockHash;

    @Column(name = "from_address", nullable = false, length = 42)
    private String fromAddress;

    @Column(name = "to_address", nullable = false, length = 42)
    private String toAddress;

    /**
     * Raw integer amount in the token's smallest unit, kept as text to avoid precision loss.
     */
    @Column(name = "amount", nullable = false, length = 78)
    private String amount;

    @Column(name = "block_timestamp", nullable = false)
    private Instant blockTimestamp;

    /**
     * Natural key used for idempotency checks (txHash + logIndex).
     */
    public String naturalKey() {
        return txHash + ":" + logIndex;
    }
}
