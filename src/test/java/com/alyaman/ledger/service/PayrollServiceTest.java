package com.alyaman.ledger.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.alyaman.ledger.config.AccountPurpose;
import com.alyaman.ledger.domain.*;
import com.alyaman.ledger.domain.SalaryPosting.PayeeType;
import com.alyaman.ledger.domain.SalaryPosting.Purpose;
import com.alyaman.ledger.repository.AdvanceRepository;
import com.alyaman.ledger.repository.EmployeeRepository;
import com.alyaman.ledger.repository.ExpenseEntryRepository;
import com.alyaman.ledger.repository.SalaryPostingRepository;
import com.alyaman.ledger.repository.TeacherAttendanceRepository;
import com.alyaman.ledger.repository.TeacherRepository;
import com.alyaman.ledger.service.AccountService.EmployeeAccounts;
import com.alyaman.ledger.service.AccountService.TeacherAccounts;
import com.alyaman.ledger.service.NumberSequenceService.DocumentType;
import com.alyaman.ledger.service.PostingService.PostingLine;
import com.alyaman.ledger.service.exception.NotPostedException;
import com.alyaman.ledger.service.exception.NothingToPostException;

/**
 * Unit tests for PayrollService: salary calculation, accrual and payment with advance deductions.
 */
@ExtendWith(MockitoExtension.class)
class PayrollServiceTest {

  private static final YearMonth MAY = YearMonth.of(2024, 5);
  private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

  @Mock private TeacherRepository teacherRepository;

  @Mock private EmployeeRepository employeeRepository;

  @Mock private TeacherAttendanceRepository attendanceRepository;

  @Mock private AdvanceRepository advanceRepository;

  @Mock private SalaryPostingRepository salaryPostingRepository;

  @Mock private ExpenseEntryRepository expenseRepository;

  @Mock private NumberSequenceService numberSequenceService;

  @Mock private AccountService accountService;

  @Mock private PostingService postingService;

  @Mock private AuditService auditService;

  @Captor private ArgumentCaptor<List<PostingLine>> linesCaptor;

  private PayrollService payrollService;

  private Teacher teacher;
  private Account salaryExpense;
  private Account dues;
  private Account teacherAdvances;
  private Account cash;
  private User user;

  @BeforeEach
  void setUp() {
    payrollService =
        new PayrollService(
            teacherRepository,
            employeeRepository,
            attendanceRepository,
            advanceRepository,
            salaryPostingRepository,
            expenseRepository,
            numberSequenceService,
            accountService,
            postingService,
            auditService,
            Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC));

    teacher = new Teacher("Omar Nasser", Teacher.SalaryType.HOURLY);
    teacher.setId(5L);
    teacher.setHourlyRate(new BigDecimal("100.00"));

    salaryExpense = new Account("501-005", "Salary Expense - Omar Nasser", Account.AccountType.EXPENSE);
    dues = new Account("22-005", "Teacher Dues - Omar Nasser", Account.AccountType.LIABILITY);
    teacherAdvances = new Account("1242-005", "Teacher Advance - Omar Nasser", Account.AccountType.ASSET);
    cash = new Account("121", "Cash", Account.AccountType.ASSET);

    user = new User("payroll", "Payroll Clerk");
  }

  @Test
  void registerEmployee_savesThenCreatesSalaryAndAdvanceAccounts() {
    // Arrange
    Employee employee = new Employee("Rana Haddad", new BigDecimal("1500.00"));
    when(employeeRepository.save(employee)).thenAnswer(inv -> {
      employee.setId(9L);
      return employee;
    });

    // Act
    Employee saved = payrollService.registerEmployee(employee, user);

    // Assert
    assertEquals(9L, saved.getId());
    verify(accountService).ensureStaffAccounts(employee);
    verify(auditService).logEvent(eq(user), eq("EMPLOYEE_REGISTERED"), eq("Employee"), eq(9L), any());
  }

  @Test
  void calculateMonthlySalary_forHourlyTeacher_multipliesSessionsByRate() {
    // Arrange
    stubSessions(40L);

    // Act
    BigDecimal salary = payrollService.calculateMonthlySalary(teacher, MAY);

    // Assert
    assertEquals(0, new BigDecimal("4000.00").compareTo(salary));
  }

  @Test
  void calculateMonthlySalary_forMixedTeacher_addsMonthlyAndHourlyParts() {
    // Arrange
    teacher.setSalaryType(Teacher.SalaryType.MIXED);
    teacher.setHourlyRate(new BigDecimal("50.00"));
    teacher.setMonthlySalary(new BigDecimal("1000.00"));
    stubSessions(10L);

    // Act & Assert
    assertEquals(0, new BigDecimal("1500.00").compareTo(payrollService.calculateMonthlySalary(teacher, MAY)));
  }

  @Test
  void calculateMonthlySalary_forMonthlyTeacher_ignoresAttendance() {
    teacher.setSalaryType(Teacher.SalaryType.MONTHLY);
    teacher.setMonthlySalary(new BigDecimal("3200.00"));

    assertEquals(0, new BigDecimal("3200.00").compareTo(payrollService.calculateMonthlySalary(teacher, MAY)));
    verifyNoInteractions(attendanceRepository);
  }

  @Test
  void calculateNetSalary_deductsAdvancesOfTheMonth() {
    // Arrange
    stubSessions(40L);
    stubTeacherAdvances(advance("ADV-000001", "500.00"));

    // Act & Assert
    assertEquals(0, new BigDecimal("3500.00").compareTo(payrollService.calculateNetSalary(teacher, MAY)));
  }

  @Test
  void postTeacherSalaryAccrual_debitsExpenseAndCreditsDues() {
    // Arrange
    stubSessions(40L);
    stubNoPosting(PayeeType.TEACHER, 5L, Purpose.ACCRUAL);
    when(accountService.ensureStaffAccounts(teacher))
        .thenReturn(new TeacherAccounts(salaryExpense, dues, teacherAdvances));
    JournalEntry entry = entry("JE-000010");
    when(postingService.createAndPost(
            eq(TODAY), any(), eq(JournalEntry.EntryType.SALARY), linesCaptor.capture(), eq(user)))
        .thenReturn(entry);

    // Act
    JournalEntry result = payrollService.postTeacherSalaryAccrual(teacher, MAY, user);

    // Assert
    assertSame(entry, result);
    List<PostingLine> lines = linesCaptor.getValue();
    assertEquals(2, lines.size());
    assertLine(lines.get(0), salaryExpense, true, "4000.00");
    assertLine(lines.get(1), dues, false, "4000.00");

    ArgumentCaptor<SalaryPosting> postingCaptor = ArgumentCaptor.forClass(SalaryPosting.class);
    verify(salaryPostingRepository).save(postingCaptor.capture());
    assertEquals(MAY, postingCaptor.getValue().getPeriod());
    assertEquals(Purpose.ACCRUAL, postingCaptor.getValue().getPurpose());
  }

  @Test
  void postTeacherSalaryAccrual_whenAlreadyAccrued_returnsExistingEntry() {
    // Arrange
    JournalEntry existing = entry("JE-000009");
    when(salaryPostingRepository.findByPayeeTypeAndPayeeIdAndPeriodYearAndPeriodMonthAndPurpose(
            PayeeType.TEACHER, 5L, 2024, 5, Purpose.ACCRUAL))
        .thenReturn(Optional.of(new SalaryPosting(PayeeType.TEACHER, 5L, MAY, Purpose.ACCRUAL, existing)));

    // Act
    JournalEntry result = payrollService.postTeacherSalaryAccrual(teacher, MAY, user);

    // Assert
    assertSame(existing, result);
    verifyNoInteractions(postingService, attendanceRepository);
  }

  @Test
  void postTeacherSalaryAccrual_whenNoSessions_throwsNothingToPost() {
    // Arrange
    stubSessions(0L);
    stubNoPosting(PayeeType.TEACHER, 5L, Purpose.ACCRUAL);

    // Act & Assert
    assertThrows(
        NothingToPostException.class, () -> payrollService.postTeacherSalaryAccrual(teacher, MAY, user));
    verifyNoInteractions(postingService);
  }

  @Test
  void postTeacherSalaryPayment_deductsAdvanceAndMarksItRepaid() {
    // Arrange
    Advance advance = advance("ADV-000001", "500.00");
    stubNoPosting(PayeeType.TEACHER, 5L, Purpose.PAYMENT);
    stubAccrual("4000.00");
    stubTeacherAdvances(advance);
    when(accountService.ensureStaffAccounts(teacher))
        .thenReturn(new TeacherAccounts(salaryExpense, dues, teacherAdvances));
    when(accountService.wellKnown(AccountPurpose.CASH)).thenReturn(cash);
    JournalEntry entry = entry("JE-000011");
    when(postingService.createAndPost(
            eq(TODAY), any(), eq(JournalEntry.EntryType.SALARY), linesCaptor.capture(), eq(user)))
        .thenReturn(entry);

    // Act
    payrollService.postTeacherSalaryPayment(teacher, MAY, user);

    // Assert
    List<PostingLine> lines = linesCaptor.getValue();
    assertEquals(3, lines.size());
    assertLine(lines.get(0), dues, true, "4000.00");
    assertLine(lines.get(1), cash, false, "3500.00");
    assertLine(lines.get(2), teacherAdvances, false, "500.00");

    assertTrue(advance.isRepaid());
    assertEquals(0, new BigDecimal("500.00").compareTo(advance.getRepaidAmount()));
    assertEquals(TODAY, advance.getRepaymentDate());
    verify(advanceRepository).save(advance);
  }

  @Test
  void postTeacherSalaryPayment_recordsSalaryExpenseLinkedToThePayment() {
    // Arrange
    stubNoPosting(PayeeType.TEACHER, 5L, Purpose.PAYMENT);
    stubAccrual("4000.00");
    stubTeacherAdvances(advance("ADV-000005", "500.00"));
    when(accountService.ensureStaffAccounts(teacher))
        .thenReturn(new TeacherAccounts(salaryExpense, dues, teacherAdvances));
    when(accountService.wellKnown(AccountPurpose.CASH)).thenReturn(cash);
    JournalEntry payment = entry("JE-000014");
    when(postingService.createAndPost(any(), any(), any(), any(), any())).thenReturn(payment);
    when(numberSequenceService.nextReference(DocumentType.EXPENSE)).thenReturn("EX-000007");

    // Act
    payrollService.postTeacherSalaryPayment(teacher, MAY, user);

    // Assert
    ArgumentCaptor<ExpenseEntry> expenseCaptor = ArgumentCaptor.forClass(ExpenseEntry.class);
    verify(expenseRepository).save(expenseCaptor.capture());
    ExpenseEntry expense = expenseCaptor.getValue();
    assertEquals("EX-000007", expense.getReference());
    assertEquals("Teacher salary - Omar Nasser (2024-05)", expense.getDescription());
    assertEquals(0, new BigDecimal("4000.00").compareTo(expense.getAmount()));
    assertEquals(salaryExpense, expense.getAccount());
    assertEquals(PaymentMethod.CASH, expense.getPaymentMethod());
    assertEquals("Gross: 4000.00, Advances: 500.00, Net: 3500.00", expense.getNotes());
    assertSame(payment, expense.getJournalEntry());
    assertNull(expense.getCostCenter());
    assertEquals(user, expense.getCreatedBy());
  }

  @Test
  void postTeacherSalaryPayment_paysAccruedAmountEvenAfterLaterAttendance() {
    // Arrange
    stubNoPosting(PayeeType.TEACHER, 5L, Purpose.PAYMENT);
    stubAccrual("1000.00");
    stubTeacherAdvances();
    when(accountService.ensureStaffAccounts(teacher))
        .thenReturn(new TeacherAccounts(salaryExpense, dues, teacherAdvances));
    when(accountService.wellKnown(AccountPurpose.CASH)).thenReturn(cash);
    when(postingService.createAndPost(any(), any(), any(), linesCaptor.capture(), any()))
        .thenReturn(entry("JE-000015"));

    // Act
    payrollService.postTeacherSalaryPayment(teacher, MAY, user);

    // Assert
    List<PostingLine> lines = linesCaptor.getValue();
    assertEquals(2, lines.size());
    assertLine(lines.get(0), dues, true, "1000.00");
    assertLine(lines.get(1), cash, false, "1000.00");
    verifyNoInteractions(attendanceRepository);
  }

  @Test
  void postTeacherSalaryPayment_whenNotAccrued_throwsNotPosted() {
    // Arrange
    stubNoPosting(PayeeType.TEACHER, 5L, Purpose.PAYMENT);
    stubNoPosting(PayeeType.TEACHER, 5L, Purpose.ACCRUAL);

    // Act & Assert
    assertThrows(
        NotPostedException.class, () -> payrollService.postTeacherSalaryPayment(teacher, MAY, user));
    verifyNoInteractions(postingService, advanceRepository, expenseRepository);
  }

  @Test
  void postTeacherSalaryPayment_leavesUnpostedAdvanceOutstanding() {
    // Arrange
    Advance posted = advance("ADV-000006", "200.00");
    Advance unposted = Advance.forTeacher(
        "ADV-000007", teacher, LocalDate.of(2024, 5, 12), new BigDecimal("300.00"), "Not yet paid out");
    stubNoPosting(PayeeType.TEACHER, 5L, Purpose.PAYMENT);
    stubAccrual("1000.00");
    stubTeacherAdvances(posted, unposted);
    when(accountService.ensureStaffAccounts(teacher))
        .thenReturn(new TeacherAccounts(salaryExpense, dues, teacherAdvances));
    when(accountService.wellKnown(AccountPurpose.CASH)).thenReturn(cash);
    when(postingService.createAndPost(any(), any(), any(), linesCaptor.capture(), any()))
        .thenReturn(entry("JE-000016"));

    // Act
    payrollService.postTeacherSalaryPayment(teacher, MAY, user);

    // Assert
    List<PostingLine> lines = linesCaptor.getValue();
    assertLine(lines.get(1), cash, false, "800.00");
    assertLine(lines.get(2), teacherAdvances, false, "200.00");
    assertTrue(posted.isRepaid());
    assertFalse(unposted.isRepaid());
    assertEquals(0, new BigDecimal("300.00").compareTo(unposted.getOutstandingAmount()));
    verify(advanceRepository, never()).save(unposted);
  }

  @Test
  void postTeacherSalaryPayment_whenAdvancesExceedGross_capsDeductionAtGross() {
    // Arrange
    Advance advance = advance("ADV-000002", "5000.00");
    stubNoPosting(PayeeType.TEACHER, 5L, Purpose.PAYMENT);
    stubAccrual("4000.00");
    stubTeacherAdvances(advance);
    when(accountService.ensureStaffAccounts(teacher))
        .thenReturn(new TeacherAccounts(salaryExpense, dues, teacherAdvances));
    when(accountService.wellKnown(AccountPurpose.CASH)).thenReturn(cash);
    when(postingService.createAndPost(any(), any(), any(), linesCaptor.capture(), any()))
        .thenReturn(entry("JE-000012"));

    // Act
    payrollService.postTeacherSalaryPayment(teacher, MAY, user);

    // Assert
    List<PostingLine> lines = linesCaptor.getValue();
    assertEquals(2, lines.size());
    assertLine(lines.get(0), dues, true, "4000.00");
    assertLine(lines.get(1), teacherAdvances, false, "4000.00");
    assertFalse(advance.isRepaid());
    assertEquals(0, new BigDecimal("1000.00").compareTo(advance.getOutstandingAmount()));
  }

  @Test
  void postEmployeeSalaryPayment_settlesOldestAdvancesFirst() {
    // Arrange
    Employee employee = new Employee("Rana Aziz", new BigDecimal("2000.00"));
    employee.setId(8L);
    Account employeeSalary = new Account("502-008", "Salary Expense - Rana Aziz", Account.AccountType.EXPENSE);
    Account employeeAdvances = new Account("1241-008", "Employee Advance - Rana Aziz", Account.AccountType.ASSET);
    Advance older = posted(Advance.forEmployee("ADV-000003", employee, LocalDate.of(2024, 3, 1), new BigDecimal("200.00"), null));
    Advance newer = posted(Advance.forEmployee("ADV-000004", employee, LocalDate.of(2024, 5, 2), new BigDecimal("500.00"), null));

    stubNoPosting(PayeeType.EMPLOYEE, 8L, Purpose.PAYMENT);
    when(accountService.ensureStaffAccounts(employee))
        .thenReturn(new EmployeeAccounts(employeeSalary, employeeAdvances));
    when(accountService.wellKnown(AccountPurpose.CASH)).thenReturn(cash);
    when(postingService.createAndPost(any(), any(), any(), linesCaptor.capture(), any()))
        .thenReturn(entry("JE-000013"));
    when(advanceRepository.findByEmployeeAndRepaidFalseOrderByDateAscIdAsc(employee))
        .thenReturn(List.of(older, newer));

    // Act
    payrollService.postEmployeeSalaryPayment(employee, MAY, new BigDecimal("300.00"), user);

    // Assert
    List<PostingLine> lines = linesCaptor.getValue();
    assertLine(lines.get(0), employeeSalary, true, "2000.00");
    assertLine(lines.get(1), cash, false, "1700.00");
    assertLine(lines.get(2), employeeAdvances, false, "300.00");
    assertTrue(older.isRepaid());
    assertFalse(newer.isRepaid());
    assertEquals(0, new BigDecimal("400.00").compareTo(newer.getOutstandingAmount()));
    verify(salaryPostingRepository).save(any(SalaryPosting.class));
  }

  @Test
  void postEmployeeSalaryPayment_capsManualDeductionAtPostedAdvances() {
    // Arrange
    Employee employee = new Employee("Rana Aziz", new BigDecimal("2000.00"));
    employee.setId(8L);
    Account employeeSalary = new Account("502-008", "Salary Expense - Rana Aziz", Account.AccountType.EXPENSE);
    Account employeeAdvances = new Account("1241-008", "Employee Advance - Rana Aziz", Account.AccountType.ASSET);
    Advance unposted = Advance.forEmployee("ADV-000008", employee, LocalDate.of(2024, 5, 2), new BigDecimal("500.00"), null);

    stubNoPosting(PayeeType.EMPLOYEE, 8L, Purpose.PAYMENT);
    when(accountService.ensureStaffAccounts(employee))
        .thenReturn(new EmployeeAccounts(employeeSalary, employeeAdvances));
    when(accountService.wellKnown(AccountPurpose.CASH)).thenReturn(cash);
    when(postingService.createAndPost(any(), any(), any(), linesCaptor.capture(), any()))
        .thenReturn(entry("JE-000017"));
    when(advanceRepository.findByEmployeeAndRepaidFalseOrderByDateAscIdAsc(employee))
        .thenReturn(List.of(unposted));

    // Act
    payrollService.postEmployeeSalaryPayment(employee, MAY, new BigDecimal("300.00"), user);

    // Assert
    List<PostingLine> lines = linesCaptor.getValue();
    assertEquals(2, lines.size());
    assertLine(lines.get(0), employeeSalary, true, "2000.00");
    assertLine(lines.get(1), cash, false, "2000.00");
    assertFalse(unposted.isRepaid());
  }

  @Test
  void postEmployeeSalaryPayment_whenNoSalary_throwsNothingToPost() {
    // Arrange
    Employee employee = new Employee("Unpaid Volunteer", BigDecimal.ZERO);
    employee.setId(9L);
    stubNoPosting(PayeeType.EMPLOYEE, 9L, Purpose.PAYMENT);

    // Act & Assert
    assertThrows(
        NothingToPostException.class,
        () -> payrollService.postEmployeeSalaryPayment(employee, MAY, null, user));
  }

  @Test
  void isSalaryPaid_readsPaymentMarker() {
    // Arrange
    when(salaryPostingRepository.findByPayeeTypeAndPayeeIdAndPeriodYearAndPeriodMonthAndPurpose(
            PayeeType.TEACHER, 5L, 2024, 5, Purpose.PAYMENT))
        .thenReturn(Optional.of(new SalaryPosting(PayeeType.TEACHER, 5L, MAY, Purpose.PAYMENT, entry("JE-1"))));

    // Act & Assert
    assertTrue(payrollService.isSalaryPaid(teacher, MAY));
  }

  private void stubSessions(long sessions) {
    when(attendanceRepository.sumSessions(teacher, MAY.atDay(1), MAY.atEndOfMonth())).thenReturn(sessions);
  }

  private void stubTeacherAdvances(Advance... advances) {
    when(advanceRepository.findUnrepaidByTeacherAndDateRange(teacher, MAY.atDay(1), MAY.atEndOfMonth()))
        .thenReturn(List.of(advances));
  }

  private void stubAccrual(String gross) {
    JournalEntry accrual = entry("JE-000001");
    accrual.setTotalAmount(new BigDecimal(gross));
    when(salaryPostingRepository.findByPayeeTypeAndPayeeIdAndPeriodYearAndPeriodMonthAndPurpose(
            PayeeType.TEACHER, 5L, 2024, 5, Purpose.ACCRUAL))
        .thenReturn(Optional.of(new SalaryPosting(PayeeType.TEACHER, 5L, MAY, Purpose.ACCRUAL, accrual)));
  }

  private void stubNoPosting(PayeeType payeeType, Long payeeId, Purpose purpose) {
    when(salaryPostingRepository.findByPayeeTypeAndPayeeIdAndPeriodYearAndPeriodMonthAndPurpose(
            payeeType, payeeId, 2024, 5, purpose))
        .thenReturn(Optional.empty());
  }

  private Advance advance(String reference, String amount) {
    return posted(Advance.forTeacher(reference, teacher, LocalDate.of(2024, 5, 10), new BigDecimal(amount), "Rent"));
  }

  private Advance posted(Advance advance) {
    advance.setJournalEntry(entry("JE-" + advance.getReference()));
    return advance;
  }

  private JournalEntry entry(String reference) {
    return new JournalEntry(reference, TODAY, "Salary", JournalEntry.EntryType.SALARY);
  }

  private static void assertLine(PostingLine line, Account account, boolean debit, String amount) {
    assertEquals(account, line.account());
    assertEquals(debit, line.debit());
    assertEquals(0, new BigDecimal(amount).compareTo(line.amount()));
  }
}
