package com.alyaman.ledger.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.JournalEntry;
import com.alyaman.ledger.domain.ReversalLink;

/** Reversal relationships between journal entries. */
@Repository
public interface ReversalLinkRepository extends JpaRepository<ReversalLink, Long> {

  /** Find the reversal link where this entry was reversed. */
  Optional<ReversalLink> findByOriginalEntry(JournalEntry originalEntry);

  boolean existsByOriginalEntry(JournalEntry originalEntry);
}
