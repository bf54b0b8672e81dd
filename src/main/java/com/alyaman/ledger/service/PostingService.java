package com.alyaman.ledger.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.alyaman.ledger.domain.Account;
import com.alyaman.ledger.domain.CostCenter;
import com.alyaman.ledger.domain.JournalEntry;
import com.alyaman.ledger.domain.ReversalLink;
import com.alyaman.ledger.domain.Transaction;
import com.alyaman.ledger.domain.User;
import com.alyaman.ledger.repository.JournalEntryRepository;
import com.alyaman.ledger.repository.ReversalLinkRepository;
import com.alyaman.ledger.service.NumberSequenceService.DocumentType;
import com.alyaman.ledger.service.exception.AlreadyPostedException;
import com.alyaman.ledger.service.exception.AlreadyReversedException;
import com.alyaman.ledger.service.exception.InvalidAmountException;
import com.alyaman.ledger.service.exception.NotPostedException;
import com.alyaman.ledger.service.exception.UnbalancedEntryException;

/**
 * Service responsible for creating and posting journal entries.
 * Ensures all accounting rules are enforced:
 * - An entry has at least two transactions
 * - Debits must equal credits before posting
 * - Posted entries are immutable; corrections are reversing entries
 * - Cached account balances change only as a consequence of posting
 */
@Service
@Transactional
public class PostingService {

    private static final Logger log = LoggerFactory.getLogger(PostingService.class);

    private final JournalEntryRepository journalEntryRepository;
    private final ReversalLinkRepository reversalLinkRepository;
    private final NumberSequenceService numberSequenceService;
    private final AccountService accountService;
    private final ChartOfAccounts chartOfAccounts;
    private final AuditService auditService;
    private final Clock clock;

    public PostingService(JournalEntryRepository journalEntryRepository,
                          ReversalLinkRepository reversalLinkRepository,
                          NumberSequenceService numberSequenceService,
                          AccountService accountService,
                          ChartOfAccounts chartOfAccounts,
                          AuditService auditService,
                          Clock clock) {
        this.journalEntryRepository = journalEntryRepository;
        this.reversalLinkRepository = reversalLinkRepository;
        this.numberSequenceService = numberSequenceService;
        this.accountService = accountService;
        this.chartOfAccounts = chartOfAccounts;
        this.auditService = auditService;
        this.clock = clock;
    }

    private static final BigDecimal MINIMUM_AMOUNT = new BigDecimal("0.01");

    /**
     * One debit or credit line of an entry being built. The amount must be at least 0.01 with no
     * more than two decimal places.
     */
    public record PostingLine(
        Account account,
        BigDecimal amount,
        boolean debit,
        String description,
        CostCenter costCenter
    ) {
        public PostingLine {
            if (account == null) {
                throw new IllegalArgumentException("Posting line needs an account");
            }
            if (amount == null || amount.compareTo(MINIMUM_AMOUNT) < 0
                || amount.stripTrailingZeros().scale() > 2) {
                throw new InvalidAmountException(amount);
            }
        }

        public static PostingLine debit(Account account, BigDecimal amount, String description) {
            return new PostingLine(account, amount, true, description, null);
        }

        public static PostingLine credit(Account account, BigDecimal amount, String description) {
            return new PostingLine(account, amount, false, description, null);
        }

        public PostingLine withCostCenter(CostCenter costCenter) {
            return new PostingLine(account, amount, debit, description, costCenter);
        }
    }

    /**
     * Builds and saves an unposted entry. Account balances are not touched.
     *
     * @throws IllegalArgumentException if fewer than two lines are given
     */
    public JournalEntry createDraft(LocalDate date, String description, JournalEntry.EntryType type,
                                    List<PostingLine> lines, User actor) {
        if (lines == null || lines.size() < 2) {
            throw new IllegalArgumentException("A journal entry needs at least two transactions");
        }

        String reference = numberSequenceService.nextReference(DocumentType.JOURNAL_ENTRY);
        JournalEntry entry = new JournalEntry(reference, date, description, type);
        entry.setCreatedBy(actor);
        for (PostingLine line : lines) {
            entry.addTransaction(new Transaction(
                line.account(),
                line.amount(),
                line.debit(),
                line.description(),
                line.costCenter()
            ));
        }
        entry.setTotalAmount(entry.getTotalDebits());
        return journalEntryRepository.save(entry);
    }

    /**
     * Posts an entry: validates the balance, marks it posted and recomputes the cached balance of
     * every account it touches.
     *
     * @throws AlreadyPostedException if the entry is already posted
     * @throws UnbalancedEntryException if debits and credits differ beyond the tolerance
     */
    public JournalEntry post(JournalEntry entry, User actor) {
        if (entry.isPosted()) {
            throw new AlreadyPostedException(entry.getReference());
        }
        if (entry.getTransactions().size() < 2) {
            throw new IllegalStateException(
                "Journal entry " + entry.getReference() + " has fewer than two transactions");
        }
        if (!entry.isBalanced(chartOfAccounts.balanceTolerance())) {
            throw new UnbalancedEntryException(
                entry.getReference(), entry.getTotalDebits(), entry.getTotalCredits());
        }

        entry.markPosted(actor, Instant.now(clock));
        entry = journalEntryRepository.save(entry);

        // Distinct accounts, first-touched order
        Map<Long, Account> touched = new LinkedHashMap<>();
        for (Transaction tx : entry.getTransactions()) {
            touched.putIfAbsent(tx.getAccount().getId(), tx.getAccount());
        }
        for (Account account : touched.values()) {
            accountService.recalculateTree(account);
        }

        auditService.logEvent(
            actor,
            "ENTRY_POSTED",
            "JournalEntry",
            entry.getId(),
            "Posted journal entry: " + entry.getReference() + " - " + entry.getDescription(),
            Map.of(
                "type", entry.getEntryType().name(),
                "amount", entry.getTotalAmount(),
                "accounts", touched.size()
            )
        );
        log.info("Posted {} ({}) for {}", entry.getReference(), entry.getEntryType(),
            entry.getTotalAmount());

        return entry;
    }

    /**
     * Creates and posts an entry in one step, as the domain workflows do.
     */
    public JournalEntry createAndPost(LocalDate date, String description, JournalEntry.EntryType type,
                                      List<PostingLine> lines, User actor) {
        return post(createDraft(date, description, type, lines, actor), actor);
    }

    /**
     * Creates a reversal entry for a posted entry, dated today. The reversal inverts all
     * debit/credit directions and is posted immediately. An entry can be reversed once; a
     * reversal can itself be reversed.
     *
     * @throws NotPostedException if the entry is not posted
     * @throws AlreadyReversedException if the entry already has a reversal
     */
    public JournalEntry reverse(JournalEntry original, User actor, String description) {
        if (!original.isPosted()) {
            throw new NotPostedException(original.getReference());
        }
        Optional<ReversalLink> existing = reversalLinkRepository.findByOriginalEntry(original);
        if (existing.isPresent()) {
            throw new AlreadyReversedException(
                original.getReference(), existing.get().getReversingEntry().getReference());
        }

        List<PostingLine> flipped = original.getTransactions().stream()
            .map(tx -> new PostingLine(
                tx.getAccount(),
                tx.getAmount(),
                !tx.isDebit(),
                "Reversal: " + (tx.getDescription() != null ? tx.getDescription() : ""),
                tx.getCostCenter()))
            .toList();

        String reversalDescription = description != null && !description.isBlank()
            ? description
            : "Reversal of " + original.getReference();
        JournalEntry reversal = createDraft(
            LocalDate.now(clock), reversalDescription, JournalEntry.EntryType.ADJUSTMENT, flipped, actor);
        reversal = post(reversal, actor);

        reversalLinkRepository.save(new ReversalLink(original, reversal, actor, description));

        auditService.logEvent(
            actor,
            "ENTRY_REVERSED",
            "JournalEntry",
            original.getId(),
            "Reversed journal entry " + original.getReference() + " with " + reversal.getReference()
        );
        log.info("Reversed {} with {}", original.getReference(), reversal.getReference());

        return reversal;
    }

    @Transactional(readOnly = true)
    public Optional<JournalEntry> findByReference(String reference) {
        return journalEntryRepository.findByReference(reference);
    }

    @Transactional(readOnly = true)
    public boolean isReversed(JournalEntry entry) {
        return reversalLinkRepository.existsByOriginalEntry(entry);
    }
}
