package com.financeforge.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for ledger events. Only inserts and reads are ever issued.
 */
@Repository
public interface LedgerEventRepository extends JpaRepository<LedgerEvent, Long> {

    List<LedgerEvent> findByAccountIdOrderBySequenceAsc(String accountId);

    List<LedgerEvent> findByAccountIdAndOccurredAtLessThanEqualOrderBySequenceAsc(String accountId, Instant upTo);

    List<LedgerEvent> findByAccountIdAndSequenceGreaterThanOrderBySequenceAsc(String accountId, long afterSequence);

    List<LedgerEvent> findByAccountIdAndSequenceGreaterThanAndOccurredAtLessThanEqualOrderBySequenceAsc(
        String accountId, long afterSequence, Instant upTo);

    Optional<LedgerEvent> findFirstByAccountIdOrderBySequenceDesc(String accountId);

    Optional<LedgerEvent> findByIdempotencyKey(String idempotencyKey);

    List<LedgerEvent> findByCausationIdOrderByIdAsc(String causationId);

    List<LedgerEvent> findByIdLessThanEqualOrderByIdAsc(Long highWaterMark);

    @Query("select distinct e.accountId from LedgerEvent e order by e.accountId")
    List<String> findDistinctAccountIds();

    @Query("select max(e.id) from LedgerEvent e")
    Optional<Long> findMaxId();
}
