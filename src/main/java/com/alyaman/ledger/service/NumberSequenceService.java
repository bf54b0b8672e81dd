package com.alyaman.ledger.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import com.alyaman.ledger.domain.NumberSequence;
import com.alyaman.ledger.repository.NumberSequenceRepository;

/**
 * Allocates document numbers from per-key counters. Each allocation locks the counter row and
 * commits in its own transaction, so concurrent callers never see the same value and the lock is
 * not held for the rest of the caller's work.
 */
@Service
public class NumberSequenceService {

    private static final Logger log = LoggerFactory.getLogger(NumberSequenceService.class);

    public enum DocumentType {
        JOURNAL_ENTRY("journal_entry", "JE"),
        STUDENT_RECEIPT("student_receipt", "SR"),
        EXPENSE("expense", "EX"),
        ADVANCE("advance", "ADV");

        private final String key;
        private final String prefix;

        DocumentType(String key, String prefix) {
            this.key = key;
            this.prefix = prefix;
        }

        public String getKey() {
            return key;
        }

        public String getPrefix() {
            return prefix;
        }
    }

    private final NumberSequenceRepository sequenceRepository;
    private final TransactionTemplate requiresNew;

    public NumberSequenceService(NumberSequenceRepository sequenceRepository,
                                 PlatformTransactionManager transactionManager) {
        this.sequenceRepository = sequenceRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Increments the counter for the key and returns the new value, starting at 1. The counter row
     * is created on first use.
     */
    public long nextValue(String key) {
        try {
            return requiresNew.execute(status -> incrementOrCreate(key));
        } catch (DataIntegrityViolationException e) {
            // Another caller created the counter first; it exists now
            log.warn("Concurrent creation of sequence '{}', retrying", key);
            return requiresNew.execute(status -> increment(key));
        }
    }

    /**
     * Formats the next number for a document type, e.g. JE-000042.
     */
    public String nextReference(DocumentType type) {
        String reference = String.format("%s-%06d", type.getPrefix(), nextValue(type.getKey()));
        log.debug("Allocated reference {}", reference);
        return reference;
    }

    private long incrementOrCreate(String key) {
        NumberSequence sequence = sequenceRepository.findByKeyForUpdate(key)
            .orElseGet(() -> sequenceRepository.saveAndFlush(new NumberSequence(key)));
        long value = sequence.increment();
        sequenceRepository.save(sequence);
        return value;
    }

    private long increment(String key) {
        NumberSequence sequence = sequenceRepository.findByKeyForUpdate(key)
            .orElseThrow(() -> new IllegalStateException("Sequence not found after retry: " + key));
        long value = sequence.increment();
        sequenceRepository.save(sequence);
        return value;
    }
}
