package com.printdesk.jobcore.numbering;

import com.printdesk.jobcore.error.InvalidRequestException;
import com.printdesk.jobcore.model.MasterSequence;
import com.printdesk.jobcore.repository.MasterSequenceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Allocates {baseJobId, masterSeq, jobTypeCode} for a new job.
 *
 * One global counter row backs every type code, so masterSeq alone is unique
 * and baseJobId is unique because it embeds it. The counter row is locked with
 * SELECT FOR UPDATE and incremented in the caller's transaction; the caller
 * must insert the Job before that transaction commits. If the transaction
 * rolls back, so does the increment, hence no gaps from failed creations.
 */
@Component
public class JobIdentifierAllocator {

    private static final Logger log = LoggerFactory.getLogger(JobIdentifierAllocator.class);

    private final MasterSequenceRepository sequenceRepo;
    private final JobIdFormat              format;
    private final long                     seqStart;

    public JobIdentifierAllocator(
            MasterSequenceRepository sequenceRepo,
            JobIdFormat format,
            @Value("${printdesk.job-id.seq-start:0}") long seqStart) {
        this.sequenceRepo = sequenceRepo;
        this.format       = format;
        this.seqStart     = seqStart;
    }

    /**
     * Draw the next master sequence value and build the identifiers.
     *
     * The first call ever creates the counter row at {@code seqStart}; if two
     * first calls race, one insert fails on the primary key and its
     * transaction is retried by {@link SequenceTransactions}.
     *
     * @throws InvalidRequestException if the type code is not of the form [A-Z]+[0-9]*
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public JobIdentifiers allocate(String jobTypeCode) {
        if (!JobIdFormat.isValidTypeCode(jobTypeCode)) {
            throw new InvalidRequestException(
                    "jobTypeCode must be upper-case letters optionally followed by digits, got '"
                            + jobTypeCode + "'");
        }

        long seq = sequenceRepo.findByIdForUpdate(MasterSequence.MASTER_ID)
                .map(MasterSequence::next)
                .orElseGet(this::initialiseCounter);

        JobIdentifiers ids = new JobIdentifiers(format.baseJobId(jobTypeCode, seq), seq, jobTypeCode);
        log.debug("Allocated masterSeq {} -> {}", seq, ids.baseJobId());
        return ids;
    }

    private long initialiseCounter() {
        MasterSequence counter = new MasterSequence(MasterSequence.MASTER_ID, seqStart);
        long first = counter.next();
        sequenceRepo.saveAndFlush(counter);   // flush now so a racing insert fails inside this attempt
        log.info("Initialised master sequence at {}", first);
        return first;
    }
}
