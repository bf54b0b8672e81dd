package com.alyaman.ledger.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.alyaman.ledger.domain.Account;
import com.alyaman.ledger.domain.Transaction;
import com.alyaman.ledger.repository.AccountRepository;
import com.alyaman.ledger.repository.TransactionRepository;

/**
 * Derives balances from the posted transaction log. Nothing here writes; the cached balance on
 * {@link Account} is maintained by {@link AccountService}.
 *
 * <p>Sign convention: ASSET and EXPENSE accounts report debits minus credits, LIABILITY, EQUITY
 * and REVENUE accounts report credits minus debits.
 *
 * <p>Tree walks carry a set of visited account ids. A parent cycle therefore ends the walk at the
 * first revisited node, which contributes zero.
 */
@Service
@Transactional(readOnly = true)
public class BalanceCalculator {

    private static final Logger log = LoggerFactory.getLogger(BalanceCalculator.class);

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;

    public BalanceCalculator(AccountRepository accountRepository,
                             TransactionRepository transactionRepository) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
    }

    public record StatementLine(
        LocalDate date,
        String reference,
        String description,
        BigDecimal debit,
        BigDecimal credit,
        BigDecimal runningBalance
    ) {}

    public BigDecimal debitTotal(Account account) {
        return transactionRepository.sumPostedDebitsByAccount(account.getId());
    }

    public BigDecimal creditTotal(Account account) {
        return transactionRepository.sumPostedCreditsByAccount(account.getId());
    }

    public BigDecimal netBalance(Account account) {
        return signed(account.getType(), debitTotal(account), creditTotal(account));
    }

    /**
     * Net balance of the account plus the rollup balance of every descendant.
     */
    public BigDecimal rollupBalance(Account account) {
        return rollup(account, new HashSet<>());
    }

    private BigDecimal rollup(Account account, Set<Long> visited) {
        if (!visited.add(account.getId())) {
            log.warn("Cycle in account tree at {}, skipping revisit", account.getCode());
            return BigDecimal.ZERO;
        }
        BigDecimal total = netBalance(account);
        for (Account child : accountRepository.findByParentOrderByCode(account)) {
            total = total.add(rollup(child, visited));
        }
        return total;
    }

    /**
     * Ids of the account and all its descendants, parents before children.
     */
    public Set<Long> subtreeAccountIds(Account account) {
        Set<Long> visited = new LinkedHashSet<>();
        collectSubtree(account.getId(), visited);
        return visited;
    }

    private void collectSubtree(Long accountId, Set<Long> visited) {
        if (!visited.add(accountId)) {
            log.warn("Cycle in account tree at account id {}, skipping revisit", accountId);
            return;
        }
        for (Long childId : accountRepository.findChildIds(accountId)) {
            collectSubtree(childId, visited);
        }
    }

    /**
     * Posted movements on one account in date order with a running balance in the account's
     * natural sign.
     */
    public List<StatementLine> accountStatement(Account account) {
        List<StatementLine> lines = new ArrayList<>();
        BigDecimal running = BigDecimal.ZERO;
        for (Transaction tx : transactionRepository.findPostedByAccountIds(List.of(account.getId()))) {
            running = running.add(
                signed(account.getType(), tx.getDebitAmount(), tx.getCreditAmount()));
            lines.add(new StatementLine(
                tx.getJournalEntry().getEntryDate(),
                tx.getJournalEntry().getReference(),
                tx.getDescription(),
                tx.getDebitAmount(),
                tx.getCreditAmount(),
                running
            ));
        }
        return lines;
    }

    /**
     * All posted transactions on the account or any descendant.
     */
    public List<Transaction> transactionsWithDescendants(Account account) {
        return transactionRepository.findPostedByAccountIds(subtreeAccountIds(account));
    }

    static BigDecimal signed(Account.AccountType type, BigDecimal debits, BigDecimal credits) {
        return type.isDebitNormal() ? debits.subtract(credits) : credits.subtract(debits);
    }
}
