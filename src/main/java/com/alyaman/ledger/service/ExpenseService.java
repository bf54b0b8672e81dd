package com.alyaman.ledger.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.alyaman.ledger.domain.Account;
import com.alyaman.ledger.domain.CostCenter;
import com.alyaman.ledger.domain.ExpenseEntry;
import com.alyaman.ledger.domain.JournalEntry;
import com.alyaman.ledger.domain.PaymentMethod;
import com.alyaman.ledger.domain.User;
import com.alyaman.ledger.repository.ExpenseEntryRepository;
import com.alyaman.ledger.service.NumberSequenceService.DocumentType;
import com.alyaman.ledger.service.PostingService.PostingLine;

/**
 * Operating expenses. Posting debits the expense account and credits cash or bank; both lines
 * carry the expense's cost center so departmental reports pick them up.
 */
@Service
@Transactional
public class ExpenseService {

    private static final Logger log = LoggerFactory.getLogger(ExpenseService.class);

    private final ExpenseEntryRepository expenseRepository;
    private final AccountService accountService;
    private final ChartOfAccounts chartOfAccounts;
    private final PostingService postingService;
    private final NumberSequenceService numberSequenceService;
    private final AuditService auditService;

    public ExpenseService(ExpenseEntryRepository expenseRepository,
                          AccountService accountService,
                          ChartOfAccounts chartOfAccounts,
                          PostingService postingService,
                          NumberSequenceService numberSequenceService,
                          AuditService auditService) {
        this.expenseRepository = expenseRepository;
        this.accountService = accountService;
        this.chartOfAccounts = chartOfAccounts;
        this.postingService = postingService;
        this.numberSequenceService = numberSequenceService;
        this.auditService = auditService;
    }

    /**
     * Records an expense numbered EX-NNNNNN. Nothing is posted until {@link #postExpense}.
     */
    public ExpenseEntry createExpense(LocalDate date, String description, BigDecimal amount,
                                      Account expenseAccount, PaymentMethod paymentMethod,
                                      CostCenter costCenter, User actor) {
        String reference = numberSequenceService.nextReference(DocumentType.EXPENSE);
        ExpenseEntry expense =
            new ExpenseEntry(reference, date, description, amount, expenseAccount, paymentMethod);
        expense.setCostCenter(costCenter);
        expense.setCreatedBy(actor);
        return expenseRepository.save(expense);
    }

    /**
     * Posts the expense: DR expense account / CR cash (CASH) or bank (BANK, CARD, TRANSFER).
     * Returns the existing entry if the expense was already posted.
     */
    public JournalEntry postExpense(ExpenseEntry expense, User actor) {
        if (expense.getJournalEntry() != null) {
            log.debug("Expense {} already posted", expense.getReference());
            return expense.getJournalEntry();
        }

        Account paymentAccount =
            accountService.ensure(chartOfAccounts.paymentAccount(expense.getPaymentMethod()));
        CostCenter costCenter = expense.getCostCenter();

        JournalEntry entry = postingService.createAndPost(
            expense.getDate(),
            "Expense - " + expense.getDescription(),
            JournalEntry.EntryType.EXPENSE,
            List.of(
                PostingLine.debit(expense.getAccount(), expense.getAmount(), expense.getDescription())
                    .withCostCenter(costCenter),
                PostingLine.credit(paymentAccount, expense.getAmount(),
                        "Payment - " + expense.getPaymentMethod())
                    .withCostCenter(costCenter)
            ),
            actor
        );

        expense.setJournalEntry(entry);
        expenseRepository.save(expense);

        auditService.logEvent(actor, "EXPENSE_POSTED", "ExpenseEntry", expense.getId(),
            "Posted expense " + expense.getReference() + " for " + expense.getAmount());
        log.info("Posted expense {} with {}", expense.getReference(), entry.getReference());

        return entry;
    }
}
