package com.alyaman.ledger.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.alyaman.ledger.domain.Account;
import com.alyaman.ledger.domain.JournalEntry;
import com.alyaman.ledger.domain.Transaction;
import com.alyaman.ledger.repository.AccountRepository;
import com.alyaman.ledger.repository.TransactionRepository;
import com.alyaman.ledger.service.BalanceCalculator.StatementLine;

@ExtendWith(MockitoExtension.class)
class BalanceCalculatorTest {

  @Mock private AccountRepository accountRepository;

  @Mock private TransactionRepository transactionRepository;

  private BalanceCalculator balanceCalculator;

  @BeforeEach
  void setUp() {
    balanceCalculator = new BalanceCalculator(accountRepository, transactionRepository);
  }

  @Test
  void netBalance_forAsset_isDebitsMinusCredits() {
    Account cash = account(1L, "121", Account.AccountType.ASSET);
    stubTotals(1L, "300.00", "100.00");

    assertEquals(0, new BigDecimal("200.00").compareTo(balanceCalculator.netBalance(cash)));
  }

  @Test
  void netBalance_forRevenue_isCreditsMinusDebits() {
    Account revenue = account(2L, "4101", Account.AccountType.REVENUE);
    stubTotals(2L, "100.00", "300.00");

    assertEquals(0, new BigDecimal("200.00").compareTo(balanceCalculator.netBalance(revenue)));
  }

  @Test
  void netBalance_forLiabilityWithMoreDebits_isNegative() {
    Account dues = account(3L, "22-001", Account.AccountType.LIABILITY);
    stubTotals(3L, "500.00", "200.00");

    assertEquals(0, new BigDecimal("-300.00").compareTo(balanceCalculator.netBalance(dues)));
  }

  @Test
  void netBalance_forEquity_isCreditsMinusDebits() {
    Account capital = account(4L, "31", Account.AccountType.EQUITY);
    stubTotals(4L, "250.00", "1000.00");

    assertEquals(0, new BigDecimal("750.00").compareTo(balanceCalculator.netBalance(capital)));
  }

  @Test
  void netBalance_forExpense_isDebitsMinusCredits() {
    Account rent = account(5L, "52", Account.AccountType.EXPENSE);
    stubTotals(5L, "900.00", "150.00");

    assertEquals(0, new BigDecimal("750.00").compareTo(balanceCalculator.netBalance(rent)));
  }

  @Test
  void rollupBalance_sumsThreeLevels() {
    // Arrange
    Account root = account(1L, "12", Account.AccountType.ASSET);
    Account child = account(2L, "1251", Account.AccountType.ASSET);
    Account grandchild = account(3L, "1251-007", Account.AccountType.ASSET);

    stubTotals(1L, "10.00", "0");
    stubTotals(2L, "0", "0");
    stubTotals(3L, "1800.00", "300.00");
    when(accountRepository.findByParentOrderByCode(root)).thenReturn(List.of(child));
    when(accountRepository.findByParentOrderByCode(child)).thenReturn(List.of(grandchild));
    when(accountRepository.findByParentOrderByCode(grandchild)).thenReturn(List.of());

    // Act
    BigDecimal rollup = balanceCalculator.rollupBalance(root);

    // Assert
    assertEquals(0, new BigDecimal("1510.00").compareTo(rollup));
  }

  @Test
  void rollupBalance_whenParentCycle_countsEachAccountOnce() {
    // Arrange
    Account first = account(1L, "A", Account.AccountType.ASSET);
    Account second = account(2L, "B", Account.AccountType.ASSET);

    stubTotals(1L, "100.00", "0");
    stubTotals(2L, "50.00", "0");
    when(accountRepository.findByParentOrderByCode(first)).thenReturn(List.of(second));
    when(accountRepository.findByParentOrderByCode(second)).thenReturn(List.of(first));

    // Act
    BigDecimal rollup = balanceCalculator.rollupBalance(first);

    // Assert
    assertEquals(0, new BigDecimal("150.00").compareTo(rollup));
  }

  @Test
  void subtreeAccountIds_whenCycle_terminatesWithParentsFirst() {
    // Arrange
    Account root = account(1L, "A", Account.AccountType.ASSET);
    when(accountRepository.findChildIds(1L)).thenReturn(List.of(2L));
    when(accountRepository.findChildIds(2L)).thenReturn(List.of(3L, 1L));
    when(accountRepository.findChildIds(3L)).thenReturn(List.of());

    // Act
    Set<Long> ids = balanceCalculator.subtreeAccountIds(root);

    // Assert
    assertEquals(List.of(1L, 2L, 3L), List.copyOf(ids));
  }

  @Test
  void accountStatement_keepsRunningBalanceInNaturalSign() {
    // Arrange
    Account receivable = account(5L, "1251-001", Account.AccountType.ASSET);
    Account deferred = account(6L, "21001-001", Account.AccountType.LIABILITY);

    JournalEntry accrual =
        new JournalEntry("JE-000001", LocalDate.of(2024, 3, 1), "Accrual", JournalEntry.EntryType.ENROLLMENT);
    Transaction debit = new Transaction(receivable, new BigDecimal("1800.00"), true, "Enrollment", null);
    accrual.addTransaction(debit);
    accrual.addTransaction(new Transaction(deferred, new BigDecimal("1800.00"), false, "Deferred", null));

    JournalEntry payment =
        new JournalEntry("JE-000002", LocalDate.of(2024, 3, 5), "Payment", JournalEntry.EntryType.PAYMENT);
    Transaction credit = new Transaction(receivable, new BigDecimal("600.00"), false, "Paid", null);
    payment.addTransaction(credit);

    when(transactionRepository.findPostedByAccountIds(List.of(5L))).thenReturn(List.of(debit, credit));

    // Act
    List<StatementLine> lines = balanceCalculator.accountStatement(receivable);

    // Assert
    assertEquals(2, lines.size());
    assertEquals("JE-000001", lines.get(0).reference());
    assertEquals(0, new BigDecimal("1800.00").compareTo(lines.get(0).runningBalance()));
    assertEquals(0, new BigDecimal("1200.00").compareTo(lines.get(1).runningBalance()));
    assertEquals(LocalDate.of(2024, 3, 5), lines.get(1).date());
  }

  @Test
  void transactionsWithDescendants_queriesWholeSubtree() {
    // Arrange
    Account parent = account(1L, "1251", Account.AccountType.ASSET);
    Account child = account(2L, "1251-001", Account.AccountType.ASSET);
    Transaction charge = new Transaction(child, new BigDecimal("1800.00"), true, "Enrollment", null);
    when(accountRepository.findChildIds(1L)).thenReturn(List.of(2L));
    when(accountRepository.findChildIds(2L)).thenReturn(List.of());
    when(transactionRepository.findPostedByAccountIds(Set.of(1L, 2L))).thenReturn(List.of(charge));

    // Act
    List<Transaction> transactions = balanceCalculator.transactionsWithDescendants(parent);

    // Assert
    assertEquals(List.of(charge), transactions);
  }

  private void stubTotals(Long accountId, String debits, String credits) {
    when(transactionRepository.sumPostedDebitsByAccount(accountId)).thenReturn(new BigDecimal(debits));
    when(transactionRepository.sumPostedCreditsByAccount(accountId)).thenReturn(new BigDecimal(credits));
  }

  private static Account account(Long id, String code, Account.AccountType type) {
    Account account = new Account(code, code, type);
    account.setId(id);
    return account;
  }
}
