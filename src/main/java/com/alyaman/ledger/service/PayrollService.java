package com.alyaman.ledger.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.alyaman.ledger.config.AccountPurpose;
import com.alyaman.ledger.domain.Account;
import com.alyaman.ledger.domain.Advance;
import com.alyaman.ledger.domain.Employee;
import com.alyaman.ledger.domain.ExpenseEntry;
import com.alyaman.ledger.domain.JournalEntry;
import com.alyaman.ledger.domain.PaymentMethod;
import com.alyaman.ledger.domain.SalaryPosting;
import com.alyaman.ledger.domain.SalaryPosting.PayeeType;
import com.alyaman.ledger.domain.SalaryPosting.Purpose;
import com.alyaman.ledger.domain.Teacher;
import com.alyaman.ledger.domain.TeacherAttendance;
import com.alyaman.ledger.domain.User;
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
 * Monthly salaries for teachers and employees.
 *
 * Teachers: accrual DR salary expense / CR teacher dues, then payment DR teacher dues (accrued
 * gross) / CR cash (net) / CR teacher advances (deducted advances). Each teacher payment also
 * leaves an expense record pointing at its entry.
 * Employees: a single payment DR salary expense (gross) / CR cash (net) / CR employee advances.
 *
 * Each payee is accrued and paid at most once per month; a {@link SalaryPosting} row per
 * (payee, month, purpose) enforces this. Only posted advances are ever deducted.
 */
@Service
@Transactional
public class PayrollService {

    private static final Logger log = LoggerFactory.getLogger(PayrollService.class);

    private final TeacherRepository teacherRepository;
    private final EmployeeRepository employeeRepository;
    private final TeacherAttendanceRepository attendanceRepository;
    private final AdvanceRepository advanceRepository;
    private final SalaryPostingRepository salaryPostingRepository;
    private final ExpenseEntryRepository expenseRepository;
    private final NumberSequenceService numberSequenceService;
    private final AccountService accountService;
    private final PostingService postingService;
    private final AuditService auditService;
    private final Clock clock;

    public PayrollService(TeacherRepository teacherRepository,
                          EmployeeRepository employeeRepository,
                          TeacherAttendanceRepository attendanceRepository,
                          AdvanceRepository advanceRepository,
                          SalaryPostingRepository salaryPostingRepository,
                          ExpenseEntryRepository expenseRepository,
                          NumberSequenceService numberSequenceService,
                          AccountService accountService,
                          PostingService postingService,
                          AuditService auditService,
                          Clock clock) {
        this.teacherRepository = teacherRepository;
        this.employeeRepository = employeeRepository;
        this.attendanceRepository = attendanceRepository;
        this.advanceRepository = advanceRepository;
        this.salaryPostingRepository = salaryPostingRepository;
        this.expenseRepository = expenseRepository;
        this.numberSequenceService = numberSequenceService;
        this.accountService = accountService;
        this.postingService = postingService;
        this.auditService = auditService;
        this.clock = clock;
    }

    public record SalaryBreakdown(
        YearMonth period,
        BigDecimal gross,
        BigDecimal advances,
        BigDecimal net
    ) {}

    /**
     * Saves a new teacher and creates their salary, dues and advance accounts.
     */
    public Teacher registerTeacher(Teacher teacher, User actor) {
        teacher = teacherRepository.save(teacher);
        accountService.ensureStaffAccounts(teacher);
        auditService.logEvent(actor, "TEACHER_REGISTERED", "Teacher", teacher.getId(),
            "Registered teacher " + teacher.getFullName());
        return teacher;
    }

    /**
     * Saves a new employee and creates their salary and advance accounts.
     */
    public Employee registerEmployee(Employee employee, User actor) {
        employee = employeeRepository.save(employee);
        accountService.ensureStaffAccounts(employee);
        auditService.logEvent(actor, "EMPLOYEE_REGISTERED", "Employee", employee.getId(),
            "Registered employee " + employee.getFullName());
        return employee;
    }

    public TeacherAttendance recordAttendance(Teacher teacher, LocalDate date, int sessions) {
        return attendanceRepository.save(new TeacherAttendance(teacher, date, sessions));
    }

    @Transactional(readOnly = true)
    public long sessionCount(Teacher teacher, YearMonth period) {
        return attendanceRepository.sumSessions(teacher, period.atDay(1), period.atEndOfMonth());
    }

    /**
     * Gross salary for the month: sessions x hourly rate (HOURLY), the monthly salary (MONTHLY),
     * or both added together (MIXED).
     */
    @Transactional(readOnly = true)
    public BigDecimal calculateMonthlySalary(Teacher teacher, YearMonth period) {
        BigDecimal hourlyRate = orZero(teacher.getHourlyRate());
        BigDecimal monthly = orZero(teacher.getMonthlySalary());
        return switch (teacher.getSalaryType()) {
            case HOURLY -> hourlyRate.multiply(BigDecimal.valueOf(sessionCount(teacher, period)));
            case MONTHLY -> monthly;
            case MIXED -> monthly.add(hourlyRate.multiply(BigDecimal.valueOf(sessionCount(teacher, period))));
        };
    }

    /**
     * Outstanding amount of the teacher's posted, unrepaid advances dated within the month.
     */
    @Transactional(readOnly = true)
    public BigDecimal totalAdvances(Teacher teacher, YearMonth period) {
        return totalOutstanding(periodAdvances(teacher, period));
    }

    @Transactional(readOnly = true)
    public BigDecimal calculateNetSalary(Teacher teacher, YearMonth period) {
        return salaryBreakdown(teacher, period).net();
    }

    @Transactional(readOnly = true)
    public SalaryBreakdown salaryBreakdown(Teacher teacher, YearMonth period) {
        BigDecimal gross = calculateMonthlySalary(teacher, period);
        BigDecimal advances = totalAdvances(teacher, period);
        return new SalaryBreakdown(period, gross, advances, nonNegative(gross.subtract(advances)));
    }

    @Transactional(readOnly = true)
    public boolean isSalaryPaid(Teacher teacher, YearMonth period) {
        return findPosting(PayeeType.TEACHER, teacher.getId(), period, Purpose.PAYMENT).isPresent();
    }

    @Transactional(readOnly = true)
    public boolean isSalaryPaid(Employee employee, YearMonth period) {
        return findPosting(PayeeType.EMPLOYEE, employee.getId(), period, Purpose.PAYMENT).isPresent();
    }

    /**
     * Accrues the teacher's gross salary for the month. Returns the existing accrual if the month
     * was already accrued.
     *
     * @throws NothingToPostException if no salary is calculated for the month
     */
    public JournalEntry postTeacherSalaryAccrual(Teacher teacher, YearMonth period, User actor) {
        Optional<SalaryPosting> existing =
            findPosting(PayeeType.TEACHER, teacher.getId(), period, Purpose.ACCRUAL);
        if (existing.isPresent()) {
            log.debug("Salary for teacher {} already accrued for {}", teacher.getId(), period);
            return existing.get().getJournalEntry();
        }

        BigDecimal gross = calculateMonthlySalary(teacher, period);
        if (gross.signum() <= 0) {
            throw new NothingToPostException(
                "No salary calculated for " + teacher.getFullName() + " in " + period);
        }

        TeacherAccounts accounts = accountService.ensureStaffAccounts(teacher);
        JournalEntry entry = postingService.createAndPost(
            LocalDate.now(clock),
            "Teacher salary accrual - " + teacher.getFullName() + " (" + period + ")",
            JournalEntry.EntryType.SALARY,
            List.of(
                PostingLine.debit(accounts.salaryExpense(), gross, "Salary expense - " + teacher.getFullName()),
                PostingLine.credit(accounts.dues(), gross, "Salary payable - " + teacher.getFullName())
            ),
            actor
        );
        salaryPostingRepository.save(
            new SalaryPosting(PayeeType.TEACHER, teacher.getId(), period, Purpose.ACCRUAL, entry));

        auditService.logEvent(actor, "SALARY_ACCRUED", "Teacher", teacher.getId(),
            "Accrued salary " + gross + " for " + period);
        log.info("Accrued salary for teacher {} ({}) with {}", teacher.getId(), period, entry.getReference());
        return entry;
    }

    /**
     * Pays the salary accrued for the month, deducting the month's posted, unrepaid advances. The
     * amount paid is the accrual's total, so attendance recorded after the accrual does not change
     * it. The deduction never exceeds that amount; deducted advances are marked repaid, oldest
     * first. Returns the existing payment if the month was already paid.
     *
     * @throws NotPostedException if the month's salary has not been accrued
     */
    public JournalEntry postTeacherSalaryPayment(Teacher teacher, YearMonth period, User actor) {
        Optional<SalaryPosting> existing =
            findPosting(PayeeType.TEACHER, teacher.getId(), period, Purpose.PAYMENT);
        if (existing.isPresent()) {
            log.debug("Salary for teacher {} already paid for {}", teacher.getId(), period);
            return existing.get().getJournalEntry();
        }

        SalaryPosting accrual =
            findPosting(PayeeType.TEACHER, teacher.getId(), period, Purpose.ACCRUAL)
                .orElseThrow(() -> new NotPostedException(period.toString(),
                    "Salary for " + teacher.getFullName() + " in " + period + " has not been accrued"));
        BigDecimal gross = accrual.getJournalEntry().getTotalAmount();
        List<Advance> advances = periodAdvances(teacher, period);
        BigDecimal deduction = totalOutstanding(advances).min(gross);
        BigDecimal net = gross.subtract(deduction);

        TeacherAccounts accounts = accountService.ensureStaffAccounts(teacher);
        Account cash = accountService.wellKnown(AccountPurpose.CASH);
        String name = teacher.getFullName();

        List<PostingLine> lines = new ArrayList<>();
        lines.add(PostingLine.debit(accounts.dues(), gross, "Salary payment - " + name));
        if (net.signum() > 0) {
            lines.add(PostingLine.credit(cash, net, "Cash payment - " + name));
        }
        if (deduction.signum() > 0) {
            lines.add(PostingLine.credit(accounts.advances(), deduction, "Advance deduction - " + name));
        }

        JournalEntry entry = postingService.createAndPost(
            LocalDate.now(clock),
            "Teacher salary payment - " + name + " (" + period + ")",
            JournalEntry.EntryType.SALARY,
            lines,
            actor
        );
        settleAdvances(advances, deduction);
        salaryPostingRepository.save(
            new SalaryPosting(PayeeType.TEACHER, teacher.getId(), period, Purpose.PAYMENT, entry));
        recordSalaryExpense(teacher, period, accounts.salaryExpense(), gross, deduction, net, entry, actor);

        auditService.logEvent(actor, "SALARY_PAID", "Teacher", teacher.getId(),
            "Paid salary for " + period + ": gross " + gross + ", advances " + deduction + ", net " + net);
        log.info("Paid salary for teacher {} ({}) with {}", teacher.getId(), period, entry.getReference());
        return entry;
    }

    /**
     * Pays an employee's monthly salary, deducting a manually entered advance amount capped at
     * the gross salary and at what the employee's posted advances still owe. The deduction
     * settles those advances, oldest first.
     * Returns the existing payment if the month was already paid.
     *
     * @throws NothingToPostException if the employee has no salary
     */
    public JournalEntry postEmployeeSalaryPayment(Employee employee, YearMonth period,
                                                  BigDecimal manualAdvanceAmount, User actor) {
        Optional<SalaryPosting> existing =
            findPosting(PayeeType.EMPLOYEE, employee.getId(), period, Purpose.PAYMENT);
        if (existing.isPresent()) {
            log.debug("Salary for employee {} already paid for {}", employee.getId(), period);
            return existing.get().getJournalEntry();
        }

        BigDecimal gross = orZero(employee.getSalary());
        if (gross.signum() <= 0) {
            throw new NothingToPostException("No salary set for " + employee.getFullName());
        }
        List<Advance> advances =
            postedOnly(advanceRepository.findByEmployeeAndRepaidFalseOrderByDateAscIdAsc(employee));
        BigDecimal deduction =
            nonNegative(orZero(manualAdvanceAmount)).min(gross).min(totalOutstanding(advances));
        BigDecimal net = gross.subtract(deduction);

        EmployeeAccounts accounts = accountService.ensureStaffAccounts(employee);
        Account cash = accountService.wellKnown(AccountPurpose.CASH);
        String name = employee.getFullName();

        List<PostingLine> lines = new ArrayList<>();
        lines.add(PostingLine.debit(accounts.salaryExpense(), gross, "Salary expense - " + name));
        if (net.signum() > 0) {
            lines.add(PostingLine.credit(cash, net, "Cash payment - " + name));
        }
        if (deduction.signum() > 0) {
            lines.add(PostingLine.credit(accounts.advances(), deduction, "Advance deduction - " + name));
        }

        JournalEntry entry = postingService.createAndPost(
            LocalDate.now(clock),
            "Employee salary - " + name + " (" + period + ")",
            JournalEntry.EntryType.SALARY,
            lines,
            actor
        );
        settleAdvances(advances, deduction);
        salaryPostingRepository.save(
            new SalaryPosting(PayeeType.EMPLOYEE, employee.getId(), period, Purpose.PAYMENT, entry));

        auditService.logEvent(actor, "SALARY_PAID", "Employee", employee.getId(),
            "Paid salary for " + period + ": gross " + gross + ", advances " + deduction + ", net " + net);
        log.info("Paid salary for employee {} ({}) with {}", employee.getId(), period, entry.getReference());
        return entry;
    }

    private List<Advance> periodAdvances(Teacher teacher, YearMonth period) {
        return postedOnly(advanceRepository.findUnrepaidByTeacherAndDateRange(
            teacher, period.atDay(1), period.atEndOfMonth()));
    }

    // An advance that was never paid out has nothing on its account to settle
    private static List<Advance> postedOnly(List<Advance> advances) {
        return advances.stream().filter(Advance::isPosted).toList();
    }

    private void recordSalaryExpense(Teacher teacher, YearMonth period, Account salaryExpense,
                                     BigDecimal gross, BigDecimal deduction, BigDecimal net,
                                     JournalEntry entry, User actor) {
        ExpenseEntry expense = new ExpenseEntry(
            numberSequenceService.nextReference(DocumentType.EXPENSE),
            entry.getEntryDate(),
            "Teacher salary - " + teacher.getFullName() + " (" + period + ")",
            gross,
            salaryExpense,
            PaymentMethod.CASH
        );
        expense.setNotes("Gross: " + gross + ", Advances: " + deduction + ", Net: " + net);
        expense.setJournalEntry(entry);
        expense.setCreatedBy(actor);
        expenseRepository.save(expense);
    }

    private void settleAdvances(List<Advance> advances, BigDecimal amount) {
        BigDecimal remaining = amount;
        LocalDate today = LocalDate.now(clock);
        for (Advance advance : advances) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal applied = advance.getOutstandingAmount().min(remaining);
            if (applied.signum() > 0) {
                advance.recordRepayment(applied, today);
                advanceRepository.save(advance);
                remaining = remaining.subtract(applied);
            }
        }
    }

    private Optional<SalaryPosting> findPosting(PayeeType payeeType, Long payeeId, YearMonth period,
                                                Purpose purpose) {
        return salaryPostingRepository.findByPayeeTypeAndPayeeIdAndPeriodYearAndPeriodMonthAndPurpose(
            payeeType, payeeId, period.getYear(), period.getMonthValue(), purpose);
    }

    private static BigDecimal totalOutstanding(List<Advance> advances) {
        return advances.stream()
            .map(Advance::getOutstandingAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        return value.signum() > 0 ? value : BigDecimal.ZERO;
    }
}
