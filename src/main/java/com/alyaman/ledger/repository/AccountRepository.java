package com.alyaman.ledger.repository;

import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.Account;

@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {

  Optional<Account> findByCode(String code);

  boolean existsByCode(String code);

  List<Account> findAllByOrderByCodeAsc();

  List<Account> findByParentOrderByCode(Account parent);

  @Query("SELECT a.id FROM Account a WHERE a.parent.id = :parentId ORDER BY a.code")
  List<Long> findChildIds(@Param("parentId") Long parentId);

  // Serializes balance recomputes for the same account
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT a FROM Account a WHERE a.id = :id")
  Optional<Account> findByIdForUpdate(@Param("id") Long id);
}
