package com.alyaman.ledger.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.ExpenseEntry;

@Repository
public interface ExpenseEntryRepository extends JpaRepository<ExpenseEntry, Long> {

  Optional<ExpenseEntry> findByReference(String reference);
}
