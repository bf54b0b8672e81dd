package com.alyaman.ledger.service;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.alyaman.ledger.config.AccountPurpose;
import com.alyaman.ledger.config.OwnedAccountKind;
import com.alyaman.ledger.domain.Account;
import com.alyaman.ledger.domain.Course;
import com.alyaman.ledger.domain.Employee;
import com.alyaman.ledger.domain.Student;
import com.alyaman.ledger.domain.Teacher;
import com.alyaman.ledger.domain.User;
import com.alyaman.ledger.repository.AccountRepository;
import com.alyaman.ledger.service.ChartOfAccounts.AccountBlueprint;
import com.alyaman.ledger.service.exception.MissingAccountException;

/**
 * Chart of accounts registry. Accounts are created lazily by code and never deleted; their cached
 * balance is written only by {@link #recalculateTree(Account)} and {@link #rebuildAll()}.
 */
@Service
@Transactional
public class AccountService {

  private static final Logger log = LoggerFactory.getLogger(AccountService.class);

  private final AccountRepository accountRepository;
  private final BalanceCalculator balanceCalculator;
  private final ChartOfAccounts chartOfAccounts;
  private final AuditService auditService;

  public AccountService(
      AccountRepository accountRepository,
      BalanceCalculator balanceCalculator,
      ChartOfAccounts chartOfAccounts,
      AuditService auditService) {
    this.accountRepository = accountRepository;
    this.balanceCalculator = balanceCalculator;
    this.chartOfAccounts = chartOfAccounts;
    this.auditService = auditService;
  }

  public record CourseAccounts(Account deferredRevenue, Account revenue) {}

  public record TeacherAccounts(Account salaryExpense, Account dues, Account advances) {}

  public record EmployeeAccounts(Account salaryExpense, Account advances) {}

  public Account createAccount(String code, String name, Account.AccountType type) {
    return createAccount(code, name, type, null, null);
  }

  /**
   * Creates a new account with optional parent and audit logging.
   *
   * @param code account code
   * @param name account name
   * @param type account type
   * @param parent optional parent account
   * @param actor the user creating the account (for audit logging)
   * @return the created account
   * @throws IllegalArgumentException if code already exists, or the parent's ancestor chain loops
   *     back on itself
   */
  public Account createAccount(
      String code, String name, Account.AccountType type, Account parent, User actor) {
    if (accountRepository.existsByCode(code)) {
      throw new IllegalArgumentException("Account code already exists: " + code);
    }
    Account account = new Account(code, name, type);
    if (parent != null) {
      requireAcyclicAncestors(parent);
      account.setParent(parent);
    }
    account = accountRepository.save(account);

    auditService.logEvent(
        actor,
        "ACCOUNT_CREATED",
        "Account",
        account.getId(),
        "Created account: " + code + " - " + name);

    return account;
  }

  private static void requireAcyclicAncestors(Account parent) {
    Set<String> seen = new HashSet<>();
    for (Account current = parent; current != null; current = current.getParent()) {
      if (!seen.add(current.getCode())) {
        throw new IllegalArgumentException(
            "Parent account " + parent.getCode() + " has a cycle in its ancestors at " + current.getCode());
      }
    }
  }

  /**
   * Returns the account with the blueprint's code, creating it (and its parent first) when missing.
   * An existing account is returned as is, even if its name differs from the blueprint.
   */
  public Account ensure(AccountBlueprint blueprint) {
    Optional<Account> existing = accountRepository.findByCode(blueprint.code());
    if (existing.isPresent()) {
      log.debug("Account {} found", blueprint.code());
      return existing.get();
    }
    Account parent = blueprint.parent() != null ? ensure(blueprint.parent()) : null;
    Account account = new Account(blueprint.code(), blueprint.name(), blueprint.type());
    account.setLocalizedName(blueprint.localizedName());
    account.setParent(parent);
    account = accountRepository.save(account);
    log.debug("Account {} created under {}", blueprint.code(), blueprint.parentCode());

    auditService.logEvent(
        null,
        "ACCOUNT_CREATED",
        "Account",
        account.getId(),
        "Created account: " + blueprint.code() + " - " + blueprint.name());
    return account;
  }

  public Account wellKnown(AccountPurpose purpose) {
    return ensure(chartOfAccounts.wellKnown(purpose));
  }

  public Account studentReceivable(Student student) {
    if (student == null || student.getId() == null) {
      throw new MissingAccountException("No student receivable account: receipt has no student");
    }
    return ensure(
        chartOfAccounts.owned(
            OwnedAccountKind.STUDENT_RECEIVABLE, student.getId(), student.getFullName()));
  }

  /** Creates the deferred revenue and revenue accounts of a course together. */
  public CourseAccounts ensureCourseAccounts(Course course) {
    Account deferred =
        ensure(
            chartOfAccounts.owned(
                OwnedAccountKind.COURSE_DEFERRED_REVENUE, course.getId(), course.getName()));
    Account revenue =
        ensure(
            chartOfAccounts.owned(
                OwnedAccountKind.COURSE_REVENUE, course.getId(), course.getName()));
    return new CourseAccounts(deferred, revenue);
  }

  public TeacherAccounts ensureStaffAccounts(Teacher teacher) {
    long id = teacher.getId();
    String name = teacher.getFullName();
    return new TeacherAccounts(
        ensure(chartOfAccounts.owned(OwnedAccountKind.TEACHER_SALARY, id, name)),
        ensure(chartOfAccounts.owned(OwnedAccountKind.TEACHER_DUES, id, name)),
        ensure(chartOfAccounts.owned(OwnedAccountKind.TEACHER_ADVANCE, id, name)));
  }

  public EmployeeAccounts ensureStaffAccounts(Employee employee) {
    long id = employee.getId();
    String name = employee.getFullName();
    return new EmployeeAccounts(
        ensure(chartOfAccounts.owned(OwnedAccountKind.EMPLOYEE_SALARY, id, name)),
        ensure(chartOfAccounts.owned(OwnedAccountKind.EMPLOYEE_ADVANCE, id, name)));
  }

  /** Creates every shared account that does not exist yet. Returns how many were created. */
  public int seedWellKnownAccounts() {
    int created = 0;
    for (AccountPurpose purpose : AccountPurpose.values()) {
      AccountBlueprint blueprint = chartOfAccounts.wellKnown(purpose);
      if (!accountRepository.existsByCode(blueprint.code())) {
        ensure(blueprint);
        created++;
      }
    }
    return created;
  }

  @Transactional(readOnly = true)
  public Optional<Account> findByCode(String code) {
    return accountRepository.findByCode(code);
  }

  @Transactional(readOnly = true)
  public List<Account> findChildren(Account parent) {
    return accountRepository.findByParentOrderByCode(parent);
  }

  public Account deactivate(Account account, User actor) {
    account.setActive(false);
    account = accountRepository.save(account);
    auditService.logEvent(
        actor,
        "ACCOUNT_DEACTIVATED",
        "Account",
        account.getId(),
        "Deactivated account: " + account.getCode());
    return account;
  }

  /**
   * Recomputes the cached balance of the account and every descendant, children first. Each
   * account is locked while its balance is written, so concurrent recomputes of the same account
   * run one after the other and both land on the value derived from the committed log.
   */
  public void recalculateTree(Account account) {
    recalculateTree(account.getId(), new HashSet<>());
  }

  private void recalculateTree(Long accountId, Set<Long> visited) {
    if (!visited.add(accountId)) {
      log.warn("Cycle in account tree at account id {}, skipping revisit", accountId);
      return;
    }
    for (Long childId : accountRepository.findChildIds(accountId)) {
      recalculateTree(childId, visited);
    }
    Account locked =
        accountRepository
            .findByIdForUpdate(accountId)
            .orElseThrow(() -> new MissingAccountException("Account not found: " + accountId));
    locked.updateCachedBalance(balanceCalculator.netBalance(locked));
  }

  /** Recomputes the cached balance of every account from the transaction log. */
  public int rebuildAll() {
    List<Account> accounts = accountRepository.findAllByOrderByCodeAsc();
    for (Account account : accounts) {
      Account locked =
          accountRepository
              .findByIdForUpdate(account.getId())
              .orElseThrow(
                  () -> new MissingAccountException("Account not found: " + account.getId()));
      locked.updateCachedBalance(balanceCalculator.netBalance(locked));
    }
    log.info("Rebuilt cached balances for {} accounts", accounts.size());
    return accounts.size();
  }
}
