package com.alyaman.ledger.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.alyaman.ledger.config.AccountPurpose;
import com.alyaman.ledger.domain.Account;
import com.alyaman.ledger.domain.Advance;
import com.alyaman.ledger.domain.Employee;
import com.alyaman.ledger.domain.JournalEntry;
import com.alyaman.ledger.domain.Teacher;
import com.alyaman.ledger.domain.User;
import com.alyaman.ledger.repository.AdvanceRepository;
import com.alyaman.ledger.service.NumberSequenceService.DocumentType;
import com.alyaman.ledger.service.PostingService.PostingLine;
import com.alyaman.ledger.service.exception.NotPostedException;
import com.alyaman.ledger.service.exception.NothingToPostException;

/**
 * Salary advances to teachers and employees.
 *
 * Posting an advance: DR the payee's advance account / CR cash.
 * Repaying in cash: DR cash / CR the payee's advance account.
 * Advances deducted from salary are settled by {@link PayrollService}.
 */
@Service
@Transactional
public class AdvanceService {

    private static final Logger log = LoggerFactory.getLogger(AdvanceService.class);

    private final AdvanceRepository advanceRepository;
    private final AccountService accountService;
    private final PostingService postingService;
    private final NumberSequenceService numberSequenceService;
    private final AuditService auditService;
    private final Clock clock;

    public AdvanceService(AdvanceRepository advanceRepository,
                          AccountService accountService,
                          PostingService postingService,
                          NumberSequenceService numberSequenceService,
                          AuditService auditService,
                          Clock clock) {
        this.advanceRepository = advanceRepository;
        this.accountService = accountService;
        this.postingService = postingService;
        this.numberSequenceService = numberSequenceService;
        this.auditService = auditService;
        this.clock = clock;
    }

    public Advance createTeacherAdvance(Teacher teacher, LocalDate date, BigDecimal amount,
                                        String purpose, User actor) {
        String reference = numberSequenceService.nextReference(DocumentType.ADVANCE);
        Advance advance = Advance.forTeacher(reference, teacher, date, amount, purpose);
        advance.setCreatedBy(actor);
        return advanceRepository.save(advance);
    }

    public Advance createEmployeeAdvance(Employee employee, LocalDate date, BigDecimal amount,
                                         String purpose, User actor) {
        String reference = numberSequenceService.nextReference(DocumentType.ADVANCE);
        Advance advance = Advance.forEmployee(reference, employee, date, amount, purpose);
        advance.setCreatedBy(actor);
        return advanceRepository.save(advance);
    }

    /**
     * Posts the advance: DR advance account / CR cash. Returns the existing entry if the advance
     * was already posted.
     */
    public JournalEntry postAdvance(Advance advance, User actor) {
        if (advance.getJournalEntry() != null) {
            log.debug("Advance {} already posted", advance.getReference());
            return advance.getJournalEntry();
        }

        Account advanceAccount = advanceAccountOf(advance);
        Account cash = accountService.wellKnown(AccountPurpose.CASH);
        String payee = advance.getPayeeName();
        String kind = advance.isTeacherAdvance() ? "Teacher" : "Employee";

        JournalEntry entry = postingService.createAndPost(
            advance.getDate(),
            kind + " advance - " + payee,
            JournalEntry.EntryType.ADVANCE,
            List.of(
                PostingLine.debit(advanceAccount, advance.getAmount(), "Advance - " + payee),
                PostingLine.credit(cash, advance.getAmount(), "Cash advance payment")
            ),
            actor
        );

        advance.setJournalEntry(entry);
        advanceRepository.save(advance);

        auditService.logEvent(actor, "ADVANCE_POSTED", "Advance", advance.getId(),
            "Posted advance " + advance.getReference() + " to " + payee + " for " + advance.getAmount());
        log.info("Posted advance {} with {}", advance.getReference(), entry.getReference());

        return entry;
    }

    /**
     * Records a cash repayment, capped at the outstanding amount: DR cash / CR advance account.
     *
     * @throws NotPostedException if the advance was never posted
     * @throws NothingToPostException if nothing is outstanding or the amount is not positive
     */
    public JournalEntry repayAdvance(Advance advance, BigDecimal amount, User actor) {
        if (!advance.isPosted()) {
            throw new NotPostedException(advance.getReference(),
                "Advance " + advance.getReference() + " has not been posted");
        }
        BigDecimal outstanding = advance.getOutstandingAmount();
        if (outstanding.signum() == 0) {
            throw new NothingToPostException("Advance " + advance.getReference() + " is fully repaid");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new NothingToPostException("Repayment amount must be positive, got " + amount);
        }
        BigDecimal repayment = amount.min(outstanding);

        Account advanceAccount = advanceAccountOf(advance);
        Account cash = accountService.wellKnown(AccountPurpose.CASH);
        LocalDate today = LocalDate.now(clock);

        JournalEntry entry = postingService.createAndPost(
            today,
            "Advance repayment - " + advance.getPayeeName() + " (" + advance.getReference() + ")",
            JournalEntry.EntryType.ADVANCE,
            List.of(
                PostingLine.debit(cash, repayment, "Cash repayment - " + advance.getPayeeName()),
                PostingLine.credit(advanceAccount, repayment, "Advance repaid - " + advance.getReference())
            ),
            actor
        );

        advance.recordRepayment(repayment, today);
        advanceRepository.save(advance);

        auditService.logEvent(actor, "ADVANCE_REPAID", "Advance", advance.getId(),
            "Repaid " + repayment + " on advance " + advance.getReference());

        return entry;
    }

    private Account advanceAccountOf(Advance advance) {
        if (advance.isTeacherAdvance()) {
            return accountService.ensureStaffAccounts(advance.getTeacher()).advances();
        }
        return accountService.ensureStaffAccounts(advance.getEmployee()).advances();
    }
}
