package com.alyaman.ledger.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.JournalEntry;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntry, Long> {

  Optional<JournalEntry> findByReference(String reference);

  @Query(
      "SELECT je FROM JournalEntry je WHERE je.entryDate BETWEEN :startDate AND :endDate "
          + "ORDER BY je.entryDate, je.id")
  List<JournalEntry> findByDateRange(
      @Param("startDate") LocalDate startDate, @Param("endDate") LocalDate endDate);
}
