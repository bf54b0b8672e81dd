package com.alyaman.ledger.repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.alyaman.ledger.domain.CostCenter;
import com.alyaman.ledger.domain.Transaction;

/**
 * Read side of the transaction log. Every aggregate counts only transactions whose journal entry
 * is posted; drafts never affect balances or reports.
 */
@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM Transaction t " +
           "WHERE t.account.id = :accountId AND t.debit = true AND t.journalEntry.posted = true")
    BigDecimal sumPostedDebitsByAccount(@Param("accountId") Long accountId);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM Transaction t " +
           "WHERE t.account.id = :accountId AND t.debit = false AND t.journalEntry.posted = true")
    BigDecimal sumPostedCreditsByAccount(@Param("accountId") Long accountId);

    @Query("SELECT t FROM Transaction t JOIN FETCH t.journalEntry je " +
           "WHERE t.account.id IN :accountIds AND je.posted = true " +
           "ORDER BY je.entryDate, je.id, t.id")
    List<Transaction> findPostedByAccountIds(@Param("accountIds") Collection<Long> accountIds);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM Transaction t " +
           "WHERE t.costCenter = :costCenter AND t.debit = :debit AND t.journalEntry.posted = true " +
           "AND t.journalEntry.entryDate BETWEEN :startDate AND :endDate")
    BigDecimal sumByCostCenterAndDateRange(
            @Param("costCenter") CostCenter costCenter,
            @Param("debit") boolean debit,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM Transaction t " +
           "WHERE t.costCenter = :costCenter AND t.debit = :debit AND t.journalEntry.posted = true " +
           "AND t.account.code IN :accountCodes " +
           "AND t.journalEntry.entryDate BETWEEN :startDate AND :endDate")
    BigDecimal sumByCostCenterAndAccountCodesAndDateRange(
            @Param("costCenter") CostCenter costCenter,
            @Param("debit") boolean debit,
            @Param("accountCodes") Collection<String> accountCodes,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM Transaction t " +
           "WHERE t.costCenter = :costCenter AND t.debit = :debit AND t.journalEntry.posted = true " +
           "AND t.journalEntry.entryDate < :beforeDate")
    BigDecimal sumByCostCenterBefore(
            @Param("costCenter") CostCenter costCenter,
            @Param("debit") boolean debit,
            @Param("beforeDate") LocalDate beforeDate);
}
