package com.alyaman.ledger.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.alyaman.ledger.config.AccountPurpose;
import com.alyaman.ledger.domain.Account;
import com.alyaman.ledger.domain.Course;
import com.alyaman.ledger.domain.JournalEntry;
import com.alyaman.ledger.domain.PaymentMethod;
import com.alyaman.ledger.domain.Student;
import com.alyaman.ledger.domain.StudentEnrollment;
import com.alyaman.ledger.domain.StudentReceipt;
import com.alyaman.ledger.domain.User;
import com.alyaman.ledger.repository.StudentEnrollmentRepository;
import com.alyaman.ledger.repository.StudentReceiptRepository;
import com.alyaman.ledger.repository.StudentRepository;
import com.alyaman.ledger.service.NumberSequenceService.DocumentType;
import com.alyaman.ledger.service.PostingService.PostingLine;

/**
 * Student side of the ledger.
 *
 * Key workflows:
 * 1. Enroll → accrual entry: DR student receivable / CR course deferred revenue
 * 2. Receipt → payment entry: DR cash or bank / CR student receivable
 * 3. Withdraw → refund entry: DR student receivable / CR cash, plus reversal of the accrual
 *
 * Posting is idempotent per document: a document that already has an entry returns it.
 */
@Service
@Transactional
public class StudentAccountingService {

    private static final Logger log = LoggerFactory.getLogger(StudentAccountingService.class);

    private final StudentRepository studentRepository;
    private final StudentEnrollmentRepository enrollmentRepository;
    private final StudentReceiptRepository receiptRepository;
    private final AccountService accountService;
    private final ChartOfAccounts chartOfAccounts;
    private final PostingService postingService;
    private final NumberSequenceService numberSequenceService;
    private final AuditService auditService;
    private final Clock clock;

    public StudentAccountingService(StudentRepository studentRepository,
                                    StudentEnrollmentRepository enrollmentRepository,
                                    StudentReceiptRepository receiptRepository,
                                    AccountService accountService,
                                    ChartOfAccounts chartOfAccounts,
                                    PostingService postingService,
                                    NumberSequenceService numberSequenceService,
                                    AuditService auditService,
                                    Clock clock) {
        this.studentRepository = studentRepository;
        this.enrollmentRepository = enrollmentRepository;
        this.receiptRepository = receiptRepository;
        this.accountService = accountService;
        this.chartOfAccounts = chartOfAccounts;
        this.postingService = postingService;
        this.numberSequenceService = numberSequenceService;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Result of a withdrawal. Either entry may be null when there was nothing to refund or no
     * accrual to reverse.
     */
    public record WithdrawalResult(
        StudentEnrollment enrollment,
        BigDecimal refundAmount,
        JournalEntry refundEntry,
        JournalEntry accrualReversal
    ) {}

    /**
     * Registers a student and creates their receivable account.
     */
    public Student registerStudent(String studentNumber, String fullName, User actor) {
        Student student = studentRepository.save(new Student(studentNumber, fullName));
        accountService.studentReceivable(student);

        auditService.logEvent(actor, "STUDENT_REGISTERED", "Student", student.getId(),
            "Registered student " + studentNumber + " - " + fullName);
        return student;
    }

    /**
     * Enrolls a student at the course price, copying the student's standing discounts.
     *
     * @throws IllegalStateException if the student is already enrolled in the course
     */
    public StudentEnrollment createEnrollment(Student student, Course course, LocalDate enrollmentDate,
                                              PaymentMethod paymentMethod) {
        if (enrollmentRepository.findByStudentAndCourse(student, course).isPresent()) {
            throw new IllegalStateException(
                "Student " + student.getStudentNumber() + " is already enrolled in " + course.getName());
        }
        StudentEnrollment enrollment =
            new StudentEnrollment(student, course, enrollmentDate, course.getPrice());
        enrollment.setDiscountPercent(student.getDiscountPercent());
        enrollment.setDiscountAmount(student.getDiscountAmount());
        enrollment.setPaymentMethod(paymentMethod);
        return enrollmentRepository.save(enrollment);
    }

    /**
     * Books the enrollment's net amount as a receivable against the course's deferred revenue.
     *
     * @return the accrual entry, the existing one if already posted, or empty when the net amount
     *     is zero
     */
    public Optional<JournalEntry> postEnrollmentAccrual(StudentEnrollment enrollment, User actor) {
        if (enrollment.getEnrollmentJournalEntry() != null) {
            log.debug("Enrollment {} already accrued", enrollment.getId());
            return Optional.of(enrollment.getEnrollmentJournalEntry());
        }

        BigDecimal netAmount = enrollment.getNetAmount();
        if (netAmount.signum() <= 0) {
            return Optional.empty();
        }

        Student student = enrollment.getStudent();
        Course course = enrollment.getCourse();
        Account receivable = accountService.studentReceivable(student);
        Account deferred = accountService.ensureCourseAccounts(course).deferredRevenue();

        JournalEntry entry = postingService.createAndPost(
            enrollment.getEnrollmentDate(),
            "Student enrollment - " + student.getFullName() + " in " + course.getName(),
            JournalEntry.EntryType.ENROLLMENT,
            List.of(
                PostingLine.debit(receivable, netAmount, "Enrollment - " + student.getFullName()),
                PostingLine.credit(deferred, netAmount, "Deferred revenue - " + course.getName())
            ),
            actor
        );

        enrollment.setEnrollmentJournalEntry(entry);
        enrollmentRepository.save(enrollment);

        auditService.logEvent(actor, "ENROLLMENT_ACCRUED", "StudentEnrollment", enrollment.getId(),
            "Accrued " + netAmount + " for " + student.getFullName() + " in " + course.getName());
        log.info("Accrued enrollment {} with {}", enrollment.getId(), entry.getReference());

        return Optional.of(entry);
    }

    /**
     * Creates a receipt numbered SR-NNNNNN, applied to the enrollment when one is given.
     */
    public StudentReceipt createReceipt(Student student, StudentEnrollment enrollment, LocalDate date,
                                        BigDecimal paidAmount, PaymentMethod paymentMethod, User actor) {
        String receiptNumber = numberSequenceService.nextReference(DocumentType.STUDENT_RECEIPT);
        StudentReceipt receipt = new StudentReceipt(receiptNumber, date, student, paidAmount);
        receipt.setPaymentMethod(paymentMethod);
        receipt.setCreatedBy(actor);
        if (enrollment != null) {
            receipt.applyTo(enrollment);
        }
        return receiptRepository.save(receipt);
    }

    /**
     * Posts a receipt: DR cash (or bank) / CR the student's receivable.
     *
     * @return the payment entry, the existing one if already posted, or empty when nothing was paid
     * @throws com.alyaman.ledger.service.exception.MissingAccountException if the receipt has no
     *     student
     */
    public Optional<JournalEntry> postStudentPayment(StudentReceipt receipt, User actor) {
        if (receipt.getJournalEntry() != null) {
            log.debug("Receipt {} already posted", receipt.getReceiptNumber());
            return Optional.of(receipt.getJournalEntry());
        }

        BigDecimal paidAmount = receipt.getPaidAmount();
        if (paidAmount == null || paidAmount.signum() <= 0) {
            return Optional.empty();
        }

        Account receivable = accountService.studentReceivable(receipt.getStudent());
        Account cash = accountService.ensure(chartOfAccounts.paymentAccount(receipt.getPaymentMethod()));
        String studentName = receipt.getStudent().getFullName();
        String courseName = receipt.getCourse() != null ? receipt.getCourse().getName() : "";

        JournalEntry entry = postingService.createAndPost(
            receipt.getDate(),
            "Student payment - " + studentName + " for " + courseName,
            JournalEntry.EntryType.PAYMENT,
            List.of(
                PostingLine.debit(cash, paidAmount, "Cash received - " + studentName),
                PostingLine.credit(receivable, paidAmount, "Payment received - " + courseName)
            ),
            actor
        );

        receipt.setJournalEntry(entry);
        receiptRepository.save(receipt);

        auditService.logEvent(actor, "RECEIPT_POSTED", "StudentReceipt", receipt.getId(),
            "Posted receipt " + receipt.getReceiptNumber() + " for " + paidAmount);
        log.info("Posted receipt {} with {}", receipt.getReceiptNumber(), entry.getReference());

        return Optional.of(entry);
    }

    /**
     * Withdraws a student from a course. The refund defaults to, and is capped at, the amount
     * paid so far. The refund is posted as DR student receivable / CR cash; the accrual entry is
     * then reversed, which clears both the receivable and the deferred revenue.
     *
     * @param refundAmount amount to refund, or null for a full refund
     */
    public WithdrawalResult withdrawEnrollment(StudentEnrollment enrollment, BigDecimal refundAmount,
                                               User actor) {
        if (enrollment.isCompleted()) {
            throw new IllegalStateException("Enrollment " + enrollment.getId() + " is already closed");
        }

        BigDecimal paid = enrollment.getAmountPaid();
        BigDecimal refund = refundAmount == null ? paid : refundAmount.min(paid);
        if (refund.signum() < 0) {
            throw new IllegalArgumentException("Refund amount cannot be negative: " + refundAmount);
        }

        LocalDate today = LocalDate.now(clock);
        Student student = enrollment.getStudent();
        Course course = enrollment.getCourse();

        JournalEntry refundEntry = null;
        if (refund.signum() > 0) {
            Account receivable = accountService.studentReceivable(student);
            Account cash = accountService.wellKnown(AccountPurpose.CASH);
            refundEntry = postingService.createAndPost(
                today,
                "Refund on withdrawal - " + student.getFullName() + " from " + course.getName(),
                JournalEntry.EntryType.ADJUSTMENT,
                List.of(
                    PostingLine.debit(receivable, refund, "Refund - " + student.getFullName()),
                    PostingLine.credit(cash, refund, "Cash refund - " + course.getName())
                ),
                actor
            );
        }

        JournalEntry accrualReversal = null;
        JournalEntry accrual = enrollment.getEnrollmentJournalEntry();
        if (accrual != null && accrual.isPosted() && !postingService.isReversed(accrual)) {
            accrualReversal = postingService.reverse(accrual, actor,
                "Withdrawal - " + student.getFullName() + " from " + course.getName());
        }

        enrollment.markCompleted(today);
        enrollmentRepository.save(enrollment);

        auditService.logEvent(actor, "ENROLLMENT_WITHDRAWN", "StudentEnrollment", enrollment.getId(),
            "Withdrew " + student.getFullName() + " from " + course.getName() + ", refund " + refund);
        log.info("Withdrew enrollment {} with refund {}", enrollment.getId(), refund);

        return new WithdrawalResult(enrollment, refund, refundEntry, accrualReversal);
    }
}
