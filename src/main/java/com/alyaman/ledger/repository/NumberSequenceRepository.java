package com.alyaman.ledger.repository;

import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.NumberSequence;

@Repository
public interface NumberSequenceRepository extends JpaRepository<NumberSequence, Long> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT s FROM NumberSequence s WHERE s.key = :key")
  Optional<NumberSequence> findByKeyForUpdate(@Param("key") String key);
}
