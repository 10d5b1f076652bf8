package com.printdesk.jobcore.numbering;

import com.printdesk.jobcore.error.SequenceConflictException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Runs a sequence-allocating unit of work in its own transaction and retries
 * the whole transaction when it loses a race.
 *
 * The allocators lock before they read (SELECT FOR UPDATE on the counter row
 * or the job row), so in the normal case a concurrent caller simply waits.
 * A retry is only needed when the database gives up instead:
 * <ul>
 *   <li>lock timeout or deadlock victim ({@link ConcurrencyFailureException}),</li>
 *   <li>unique violation on (job_id, version), master_seq or base_job_id, or
 *       two first-ever inserts of the counter row
 *       ({@link DataIntegrityViolationException} naming one of those keys),</li>
 *   <li>an explicit {@link SequenceConflictException} from inside the work.</li>
 * </ul>
 * Each attempt starts from scratch: nothing from a failed attempt is committed,
 * so no sequence value is ever skipped or reused.
 *
 * Any other integrity violation (NOT NULL, value too long, foreign key) is
 * the caller's fault and is rethrown on the first attempt.
 *
 * Must not be called from inside an existing transaction; the retry would be
 * meaningless once the outer transaction is marked rollback-only.
 */
@Component
public class SequenceTransactions {

    private static final Logger log = LoggerFactory.getLogger(SequenceTransactions.class);

    /**
     * Unique keys whose violation means another transaction took the same
     * sequence value. Matched case-insensitively against the exception chain.
     * The counter row's primary key has no fixed name across PostgreSQL and
     * H2, so any key violation naming the master_sequence table counts.
     */
    static final List<String> SEQUENCE_KEYS = List.of(
            "uq_change_order_job_version",
            "uq_change_order_no",
            "uq_job_master_seq",
            "uq_job_base_job_id");

    private final TransactionTemplate tx;
    private final MeterRegistry       meterRegistry;
    private final int                 maxAttempts;

    public SequenceTransactions(
            PlatformTransactionManager transactionManager,
            MeterRegistry meterRegistry,
            @Value("${printdesk.change-orders.max-attempts:3}") int maxAttempts) {
        this.tx            = new TransactionTemplate(transactionManager);
        this.meterRegistry = meterRegistry;
        this.maxAttempts   = Math.max(1, maxAttempts);
    }

    /**
     * @param sequence name used in logs and metrics ("master" or "change-order")
     * @param work     the allocation plus the insert that consumes the value
     * @throws SequenceConflictException when every attempt lost the race
     */
    public <T> T execute(String sequence, Supplier<T> work) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            RuntimeException last = null;
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                try {
                    return tx.execute(status -> work.get());
                } catch (DataIntegrityViolationException e) {
                    if (!isSequenceClash(e)) {
                        throw e;
                    }
                    last = e;
                    conflict(sequence, attempt, e);
                } catch (ConcurrencyFailureException | SequenceConflictException e) {
                    last = e;
                    conflict(sequence, attempt, e);
                }
            }
            throw new SequenceConflictException(sequence,
                    "Could not allocate from sequence '" + sequence + "' after " + maxAttempts
                            + " attempts; retry the request", last);
        } finally {
            sample.stop(meterRegistry.timer("printdesk.allocation.duration", "sequence", sequence));
        }
    }

    private void conflict(String sequence, int attempt, RuntimeException e) {
        meterRegistry.counter("printdesk.sequence.conflicts", "sequence", sequence).increment();
        log.warn("Sequence '{}' conflict on attempt {}/{}: {}",
                sequence, attempt, maxAttempts, e.getMessage());
    }

    static boolean isSequenceClash(DataIntegrityViolationException e) {
        for (Throwable t = e; t != null; t = t.getCause() == t ? null : t.getCause()) {
            String message = t.getMessage();
            if (message == null) continue;
            String lower = message.toLowerCase(Locale.ROOT).replace("\"", "");
            for (String key : SEQUENCE_KEYS) {
                if (lower.contains(key)) return true;
            }
            if (lower.contains("master_sequence")
                    && (lower.contains("primary") || lower.contains("pkey")
                        || lower.contains("unique") || lower.contains("duplicate"))) {
                return true;
            }
        }
        return false;
    }
}
