package com.skillq;

import com.fasterxml.jackson.databind.JsonNode;
import com.skillq.executor.SkillExecutor;
import com.skillq.skill.ProgressUpdate;
import com.skillq.skill.SkillConfig;
import com.skillq.skill.SkillError;
import com.skillq.skill.SkillRegistry;
import com.skillq.skill.SkillResult;
import com.skillq.subject.EquipmentType;
import com.skillq.subject.HaulRecord;
import com.skillq.subject.HaulRecordRepository;
import com.skillq.subject.Invoice;
import com.skillq.subject.InvoiceRepository;
import com.skillq.subject.Project;
import com.skillq.subject.ProjectRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(classes = TestApplication.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public class SkillQIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:17-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void registerPgProperties(DynamicPropertyRegistry registry) {
        registry.add("testcontainers.postgresql.host", postgres::getHost);
        registry.add("testcontainers.postgresql.port", postgres::getFirstMappedPort);
        registry.add("testcontainers.postgresql.database", postgres::getDatabaseName);
        registry.add("testcontainers.postgresql.username", postgres::getUsername);
        registry.add("testcontainers.postgresql.password", postgres::getPassword);
    }

    @Autowired
    JobClient jobClient;

    @Autowired
    JobStore jobStore;

    @Autowired
    JobRepository jobRepository;

    @Autowired
    SkillExecutor skillExecutor;

    @Autowired
    SkillRegistry skillRegistry;

    @Autowired
    ProjectRepository projectRepository;

    @Autowired
    InvoiceRepository invoiceRepository;

    @Autowired
    HaulRecordRepository haulRecordRepository;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanUp() {
        jdbcTemplate.update("DELETE FROM skillq_jobs");
    }

    @Test
    void shouldClaimInPriorityOrder() {
        for (int priority : new int[] { 5, 1, 7, 3 }) {
            insertPending(UUID.randomUUID(), priority);
        }

        List<Integer> claimed = new ArrayList<>();
        Optional<Job> next;
        while ((next = jobStore.claimNext("worker-a")).isPresent()) {
            claimed.add(next.get().getPriority());
        }

        assertEquals(List.of(1, 3, 5, 7), claimed);
    }

    @Test
    void shouldClaimOldestFirstWithinSamePriority() {
        OffsetDateTime base = OffsetDateTime.now().minusHours(1);
        Job third = insertPending(UUID.randomUUID(), 5, base.plusSeconds(2));
        Job first = insertPending(UUID.randomUUID(), 5, base);
        Job oldestButLeastUrgent = insertPending(UUID.randomUUID(), 7, base.minusMinutes(10));
        Job second = insertPending(UUID.randomUUID(), 5, base.plusSeconds(1));
        Job mostUrgent = insertPending(UUID.randomUUID(), 3, base.plusSeconds(5));

        List<UUID> claimed = new ArrayList<>();
        Optional<Job> next;
        while ((next = jobStore.claimNext("worker-a")).isPresent()) {
            claimed.add(next.get().getId());
        }

        assertEquals(List.of(mostUrgent.getId(), first.getId(), second.getId(), third.getId(),
                oldestButLeastUrgent.getId()), claimed);
    }

    @Test
    void shouldNeverHandTheSameJobToTwoWorkers() throws Exception {
        int jobs = 40;
        for (int i = 0; i < jobs; i++) {
            insertPending(UUID.randomUUID(), 5);
        }

        int workers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        ConcurrentLinkedQueue<UUID> claimed = new ConcurrentLinkedQueue<>();
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int w = 0; w < workers; w++) {
                String workerId = "worker-" + w;
                pool.submit(() -> {
                    start.await();
                    Optional<Job> job;
                    while ((job = jobStore.claimNext(workerId)).isPresent()) {
                        claimed.add(job.get().getId());
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(60, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        Set<UUID> unique = ConcurrentHashMap.newKeySet();
        unique.addAll(claimed);
        assertEquals(claimed.size(), unique.size());
        assertEquals(jobs, unique.size());
    }

    @Test
    void shouldSkipJobsWaitingForRetry() {
        Job waiting = insertPending(UUID.randomUUID(), 1);
        waiting.setRetryAfter(OffsetDateTime.now().plusMinutes(10));
        jobRepository.save(waiting);
        Job ready = insertPending(UUID.randomUUID(), 5);

        assertEquals(ready.getId(), jobStore.claimNext("worker-a").orElseThrow().getId());
        assertTrue(jobStore.claimNext("worker-a").isEmpty());
    }

    @Test
    void shouldRunOneJobPerSubjectAtATime() {
        UUID subject = UUID.randomUUID();
        Job first = insertPending(subject, 3);
        Job second = insertPending(subject, 5);

        Job claimed = jobStore.claimNext("worker-a").orElseThrow();
        assertEquals(first.getId(), claimed.getId());
        assertTrue(jobStore.claimNext("worker-b").isEmpty());

        jobStore.complete(first.getId(), claimed.getWorkerId(), SkillResult.success(Map.of("ok", true), null));
        assertEquals(second.getId(), jobStore.claimNext("worker-b").orElseThrow().getId());
    }

    @Test
    void shouldScheduleRetryAndKeepErrorLog() {
        Job job = insertPending(UUID.randomUUID(), 5);
        String owner = jobStore.claimNext("worker-a").orElseThrow().getWorkerId();

        JobStore.FailureOutcome outcome = jobStore.fail(job.getId(), owner,
                new SkillError("provider timeout", "EXECUTION_ERROR", Map.of(), true), null);

        Job stored = jobRepository.findById(job.getId()).orElseThrow();
        assertEquals(JobStore.FailureOutcome.RETRY_SCHEDULED, outcome);
        assertEquals(JobStatus.PENDING, stored.getStatus());
        assertEquals(1, stored.getRetryCount());
        assertTrue(stored.getRetryAfter().isAfter(OffsetDateTime.now()));
        assertEquals("EXECUTION_ERROR", stored.getRetryErrorLog().get(0).get("code").asText());
    }

    @Test
    void shouldDiscardResultOfCancelledJob() {
        Job job = insertPending(UUID.randomUUID(), 5);
        String owner = jobStore.claimNext("worker-a").orElseThrow().getWorkerId();

        jobClient.cancel(job.getId());

        assertFalse(jobStore.complete(job.getId(), owner, SkillResult.success("late", null)));
        assertEquals(JobStatus.CANCELLED, jobRepository.findById(job.getId()).orElseThrow().getStatus());
    }

    @Test
    void shouldRejectStaleClaimAfterJobWasRequeuedAndReclaimed() {
        Job job = insertPending(UUID.randomUUID(), 5);
        String staleOwner = jobStore.claimNext("worker-a").orElseThrow().getWorkerId();
        jdbcTemplate.update("UPDATE skillq_jobs SET status = 'PENDING', worker_id = NULL, claimed_at = NULL "
                + "WHERE id = ?", job.getId());
        String currentOwner = jobStore.claimNext("worker-a").orElseThrow().getWorkerId();

        assertFalse(jobStore.updateProgress(job.getId(), staleOwner, ProgressUpdate.of(50, "stale")));
        assertFalse(jobStore.complete(job.getId(), staleOwner, SkillResult.success("stale", null)));
        assertTrue(jobStore.updateProgress(job.getId(), currentOwner, ProgressUpdate.of(50, "current")));

        Job stored = jobRepository.findById(job.getId()).orElseThrow();
        assertEquals(JobStatus.PROCESSING, stored.getStatus());
        assertEquals(currentOwner, stored.getWorkerId());
        assertEquals("current", stored.getCurrentStep());
    }

    @Test
    void shouldKeepCancelledStatus() {
        Job job = insertPending(UUID.randomUUID(), 5);
        jobClient.cancel(job.getId());

        assertTrue(jobStore.claimNext("worker-a").isEmpty());
        assertEquals(JobStatus.CANCELLED, jobRepository.findById(job.getId()).orElseThrow().getStatus());
    }

    @Test
    void shouldLoadSeededSkillConfiguration() {
        SkillConfig config = skillRegistry.getConfig("wastewise-analytics");

        assertEquals(14.49, config.conversionRates().compactorYpd());
        assertEquals(6.0, config.thresholds().compactorTons());
    }

    @Test
    void shouldRunCompleteAnalysisEndToEnd() {
        UUID actor = UUID.randomUUID();
        Project project = projectRepository.save(
                new Project(UUID.randomUUID(), actor, "Harbor View", 200, EquipmentType.COMPACTOR));
        LocalDate month = LocalDate.of(2024, 1, 31);
        for (int i = 0; i < 3; i++) {
            Invoice invoice = new Invoice(UUID.randomUUID(), project.getId(), month.plusMonths(i), "WM",
                    new BigDecimal("5000.00"), new BigDecimal("40"), 4);
            invoiceRepository.save(invoice);
        }
        for (int i = 0; i < 4; i++) {
            haulRecordRepository.save(new HaulRecord(UUID.randomUUID(), project.getId(),
                    LocalDate.of(2024, 1, 1).plusWeeks(i), new BigDecimal("5.0")));
        }

        Job submitted = jobClient.submit("complete_analysis", project.getId(), actor, null);
        assertEquals(3, submitted.getPriority());

        Job claimed = jobStore.claimNext("worker-a").orElseThrow();
        SkillResult<?> result = skillExecutor.execute(claimed, claimed.getWorkerId());
        assertTrue(result.success());
        assertTrue(jobStore.complete(claimed.getId(), claimed.getWorkerId(), result));

        Job stored = jobRepository.findById(submitted.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, stored.getStatus());
        assertEquals(100, stored.getProgressPercent());
        JsonNode recommendations = stored.getResult().get("recommendations");
        assertEquals("compactor_monitors", recommendations.get(0).get("type").asText());
    }

    private Job insertPending(UUID subjectId, int priority) {
        return insertPending(subjectId, priority, OffsetDateTime.now());
    }

    private Job insertPending(UUID subjectId, int priority, OffsetDateTime createdAt) {
        Job job = new Job(UUID.randomUUID(), JobType.INVOICE_EXTRACTION, subjectId, UUID.randomUUID(), null, 3,
                priority);
        job.setCreatedAt(createdAt);
        job.setUpdatedAt(createdAt);
        return jobRepository.saveAndFlush(job);
    }
}
