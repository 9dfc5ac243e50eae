package com.tokenwatch.indexer.repository;

import com.tokenwatch.indexer.modules.transfers.model.TransferRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for indexed transfers
 */
@Repository
public interface TransferRecordRepository extends JpaRepository<TransferRecord, Long> {

    /**
     * Highest-block record (frontier)
     */
    Optional<TransferRecord> findFirstByOrderByBlockNumberDescIdDesc();

    /**
     * Candidates for the natural-key duplicate check
     */
    List<TransferRecord> findByTxHashIn(Collection<String> txHashes);

    /**
     * Ids of the lowest-block records, ties broken by id
     */
    @Query("SELECT t.id FROM TransferRecord t ORDER BY t.blockNumber ASC, t.id ASC")
    List<Long> findOldestIds(Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TransferRecord t WHERE t.blockNumber >= :threshold")
    int deleteByBlockNumberAtLeast(@Param("threshold") long threshold);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TransferRecord t WHERE t.id IN :ids")
    int deleteByIds(@Param("ids") Collection<Long> ids);

    List<TransferRecord> findByFromAddress(String fromAddress, Pageable pageable);

    List<TransferRecord> findByToAddress(String toAddress, Pageable pageable);

    List<TransferRecord> findByFromAddressAndToAddress(String fromAddress, String toAddress, Pageable pageable);

    @Query("SELECT t FROM TransferRecord t WHERE t.fromAddress = :address OR t.toAddress = :address")
    List<TransferRecord> findByParticipant(@Param("address") String address, Pageable pageable);
}
