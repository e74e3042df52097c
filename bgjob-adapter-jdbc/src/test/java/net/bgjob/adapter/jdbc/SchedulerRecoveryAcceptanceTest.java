package net.bgjob.adapter.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import net.bgjob.adapter.jdbc.repo.JdbcJobStore;
import net.bgjob.core.maintenance.LeaseMaintenanceService;
import net.bgjob.core.model.Job;
import net.bgjob.core.model.JobStatus;
import net.bgjob.core.model.JobType;
import net.bgjob.core.model.NewJob;
import net.bgjob.core.model.ProcessResult;
import net.bgjob.core.service.Dispatcher;
import net.bgjob.core.service.JobProcessor;
import net.bgjob.core.service.JobQueue;
import net.bgjob.core.service.JobScheduler;
import net.bgjob.core.service.JobService;
import net.bgjob.core.service.ProcessorRegistry;
import net.bgjob.core.service.RetryPolicy;
import net.bgjob.core.service.SchedulerSettings;
import net.bgjob.core.spi.Clock;
import net.bgjob.core.spi.TxRunner;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 실제 DB 위에서 스케줄러 전체 흐름: 재기동 시 stale lease 회수, 동시성 상한
 */
class SchedulerRecoveryAcceptanceTest extends TestSupport {

    TxRunner tx;
    JdbcJobStore store;
    ProcessorRegistry registry;
    JobQueue queue;
    JobService jobs;
    JobScheduler scheduler;

    final AtomicInteger running = new AtomicInteger();
    final AtomicInteger peak = new AtomicInteger();

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        store = new JdbcJobStore(OM, Clock.system());
    }

    @BeforeEach
    void setUp() throws Exception {
        deleteAll(tx);
        registry = new ProcessorRegistry();
        queue = new JobQueue();
        jobs = new JobService(store, tx, queue, OM, Clock.system());
        registry.register(new JobProcessor() {
            @Override public JobType type() { return JobType.PATH_CORRECTION; }

            @Override
            public ProcessResult process(JsonNode payload) throws Exception {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(30);
                } finally {
                    running.decrementAndGet();
                }
                return ProcessResult.success("corrected " + payload.path("path").asText());
            }
        });
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) scheduler.stop();
    }

    private JobScheduler start(int limit) {
        var settings = SchedulerSettings.builder()
                .concurrencyLimit(limit)
                .pollingInterval(Duration.ofMillis(20))
                .dbPollInterval(Duration.ofMillis(50))
                .staleJobTimeout(Duration.ofSeconds(600))
                .shutdownGrace(Duration.ofSeconds(5))
                .build();
        var dispatcher = new Dispatcher(registry, store, tx, RetryPolicy.fixed(0));
        var maintenance = new LeaseMaintenanceService(store, tx, Clock.system(), settings.staleJobTimeout());
        scheduler = new JobScheduler(settings, store, tx, queue, dispatcher, maintenance);
        scheduler.start();
        return scheduler;
    }

    private JobStatus status(String id) throws Exception {
        return tx.required(() -> store.getJob(id)).map(Job::status).orElseThrow();
    }

    @Test
    void restart_reclaims_leases_left_by_a_crashed_worker() throws Exception {
        Instant crashed = Instant.now().minusSeconds(700);
        for (String id : List.of("orphan-1", "orphan-2")) {
            var j = new Job(id, "s", JobType.PATH_CORRECTION.code(),
                    OM.createObjectNode().put("jobId", id).put("path", "src/" + id), 0,
                    JobStatus.ACKNOWLEDGED_BY_WORKER, "Queued", null, null, null, null,
                    OM.createObjectNode(), 0, crashed, crashed, null, null);
            tx.required(() -> { store.insert(j); return null; });
        }

        start(3);

        Awaitility.await().atMost(Duration.ofSeconds(10))
                .until(() -> status("orphan-1") == JobStatus.COMPLETED && status("orphan-2") == JobStatus.COMPLETED);
        var done = tx.required(() -> store.getJob("orphan-1")).orElseThrow();
        assertThat(done.response()).isEqualTo("corrected src/orphan-1");
        assertThat(done.progressPercentage()).isEqualTo(100);
        assertThat(done.startedAt()).isNotNull();
        assertThat(done.finishedAt()).isNotNull();
    }

    @Test
    void concurrency_limit_holds_against_the_database() throws Exception {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            var payload = OM.createObjectNode().put("path", "file-" + i);
            ids.add(jobs.enqueue(NewJob.of("s", JobType.PATH_CORRECTION, payload)).id());
        }

        start(3);

        Awaitility.await().atMost(Duration.ofSeconds(20))
                .until(() -> tx.required(store::listActiveJobs).isEmpty());
        for (String id : ids) assertThat(status(id)).isEqualTo(JobStatus.COMPLETED);
        assertThat(peak.get()).isLessThanOrEqualTo(3);
        assertThat(scheduler.stats().completed()).isEqualTo(10);
    }
}
