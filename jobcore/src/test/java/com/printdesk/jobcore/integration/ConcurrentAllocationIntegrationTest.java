package com.printdesk.jobcore.integration;

import com.printdesk.jobcore.changeorder.ChangeOrderDraft;
import com.printdesk.jobcore.changeorder.ChangeOrderService;
import com.printdesk.jobcore.component.JobClassification;
import com.printdesk.jobcore.model.ChangeOrder;
import com.printdesk.jobcore.model.Job;
import com.printdesk.jobcore.repository.ChangeOrderRepository;
import com.printdesk.jobcore.service.CreateJobCommand;
import com.printdesk.jobcore.service.JobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Many threads allocating from the same sequence at once. Every caller
 * blocks on the row lock until the previous holder commits, so all of them
 * succeed and the values come out unique and contiguous.
 */
@SpringBootTest
@ActiveProfiles("test")
@Tag("integration")
class ConcurrentAllocationIntegrationTest {

    private static final int THREADS = 8;

    @Autowired JobService            jobService;
    @Autowired ChangeOrderService    changeOrderService;
    @Autowired ChangeOrderRepository changeOrderRepo;
    @Autowired JdbcTemplate          jdbc;

    @BeforeEach
    void cleanDatabase() {
        IntegrationDatabase.clean(jdbc);
    }

    @Test
    void createChangeOrder_concurrentCallers_uniqueContiguousVersions() throws Exception {
        Job job = jobService.createJob(CreateJobCommand.of("Spring catalog", JobClassification.UNCLASSIFIED));

        List<Integer> versions = runConcurrently(() -> changeOrderService
                .create(job.getId(), ChangeOrderDraft.of("concurrent edit", null))
                .getVersion());

        assertThat(versions).containsExactlyInAnyOrderElementsOf(rangeClosed(THREADS));
        assertThat(changeOrderRepo.findByJobIdOrderByVersionDesc(job.getId()))
                .extracting(ChangeOrder::getVersion)
                .containsExactlyElementsOf(rangeClosed(THREADS).stream().sorted((a, b) -> b - a).toList());
    }

    @Test
    void createJob_concurrentCallers_uniqueContiguousMasterSeq() throws Exception {
        // The counter row exists from here on; the threads only contend for its lock.
        jobService.createJob(CreateJobCommand.of("seed", JobClassification.UNCLASSIFIED));

        List<Long> seqs = runConcurrently(() -> jobService
                .createJob(CreateJobCommand.of("concurrent job", JobClassification.UNCLASSIFIED))
                .getMasterSeq());

        assertThat(seqs).containsExactlyInAnyOrderElementsOf(
                IntStream.rangeClosed(2, THREADS + 1).mapToObj(i -> (long) i).toList());
        assertThat(jdbc.queryForObject("SELECT COUNT(DISTINCT base_job_id) FROM job", Long.class))
                .isEqualTo(THREADS + 1L);
    }

    @Test
    void createJob_concurrentFirstCallers_counterRowCreatedOnce() throws Exception {
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM master_sequence", Long.class)).isZero();

        List<Long> seqs = runConcurrently(() -> jobService
                .createJob(CreateJobCommand.of("first job", JobClassification.UNCLASSIFIED))
                .getMasterSeq());

        assertThat(seqs).containsExactlyInAnyOrderElementsOf(
                IntStream.rangeClosed(1, THREADS).mapToObj(i -> (long) i).toList());
        assertThat(jdbc.queryForObject("SELECT current_value FROM master_sequence", Long.class))
                .isEqualTo((long) THREADS);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private <T> List<T> runConcurrently(Supplier<T> work) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done  = new CountDownLatch(THREADS);
        Queue<T> results = new ConcurrentLinkedQueue<>();
        Queue<Throwable> failures = new ConcurrentLinkedQueue<>();

        for (int i = 0; i < THREADS; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    results.add(work.get());
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(60, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(failures).isEmpty();
        return List.copyOf(results);
    }

    private static List<Integer> rangeClosed(int n) {
        return IntStream.rangeClosed(1, n).boxed().toList();
    }
}
