package net.bgjob.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import net.bgjob.core.error.JobValidationException;
import net.bgjob.core.model.Job;
import net.bgjob.core.model.JobStatus;
import net.bgjob.core.model.JobStatusUpdate;
import net.bgjob.core.model.JobType;
import net.bgjob.core.model.ProcessResult;
import net.bgjob.core.model.QueuedJob;
import net.bgjob.core.service.DispatchResult.Outcome;
import net.bgjob.core.support.DirectTxRunner;
import net.bgjob.core.support.InMemoryJobStore;
import net.bgjob.core.support.Jobs;
import net.bgjob.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DispatcherTest {
    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    MutableClock clock;
    InMemoryJobStore store;
    DirectTxRunner tx;
    ProcessorRegistry registry;
    Dispatcher dispatcher;
    JobUpdater updater;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryJobStore(clock);
        tx = new DirectTxRunner();
        registry = new ProcessorRegistry();
        dispatcher = new Dispatcher(registry, store, tx, RetryPolicy.fixed(2));
        updater = new JobUpdater(store, tx);
    }

    private QueuedJob claimed(String id, JobType type, int retryCount) {
        Job row = Jobs.row(id, "s-1", type.code(), Jobs.payloadFor(id), 0, JobStatus.ACKNOWLEDGED_BY_WORKER, retryCount, T0, T0);
        store.put(row);
        return QueuedJob.from(row);
    }

    private void register(JobType type, ThrowingProcessor body) {
        registry.register(new JobProcessor() {
            @Override public JobType type() { return type; }
            @Override public ProcessResult process(JsonNode payload) throws Exception { return body.apply(payload); }
        });
    }

    @FunctionalInterface
    interface ThrowingProcessor {
        ProcessResult apply(JsonNode payload) throws Exception;
    }

    @Test
    void success_marks_completed_with_response() {
        register(JobType.REGEX_GENERATION, p -> ProcessResult.success("ok", Jobs.MAPPER.getNodeFactory().textNode("^a+$")));
        var job = claimed("j1", JobType.REGEX_GENERATION, 0);

        var r = dispatcher.dispatch(job);

        assertEquals(Outcome.COMPLETED, r.outcome());
        Job row = store.row("j1");
        assertEquals(JobStatus.COMPLETED, row.status());
        assertEquals("^a+$", row.response());
        assertEquals(100, row.progressPercentage());
        assertNotNull(row.startedAt());
        assertNotNull(row.finishedAt());
    }

    @Test
    void processor_sees_running_status_and_jobId_back_reference() {
        AtomicInteger calls = new AtomicInteger();
        register(JobType.TEXT_IMPROVEMENT, p -> {
            calls.incrementAndGet();
            String id = p.get("jobId").asText();
            assertEquals(JobStatus.RUNNING, store.row(id).status());
            updater.markStreaming(id, JobStatus.GENERATING_STREAM, "streaming", 40);
            return ProcessResult.success("done");
        });

        dispatcher.dispatch(claimed("j2", JobType.TEXT_IMPROVEMENT, 0));

        assertEquals(1, calls.get());
        assertEquals(JobStatus.COMPLETED, store.row("j2").status());
        assertEquals("streaming", store.row("j2").subStatusMessage());
    }

    @Test
    void unknown_type_fails_without_retry() {
        var job = claimed("j3", JobType.PATH_FINDER, 0);

        var r = dispatcher.dispatch(job);

        assertEquals(Outcome.FAILED, r.outcome());
        Job row = store.row("j3");
        assertEquals(JobStatus.FAILED, row.status());
        assertEquals(0, row.retryCount());
        assertTrue(row.errorMessage().contains("path_finder"), row.errorMessage());
    }

    @Test
    void thrown_exception_with_retries_left_requeues_and_increments_retryCount() {
        register(JobType.GENERIC_LLM_STREAM, p -> { throw new IOException("upstream 503"); });
        var job = claimed("j4", JobType.GENERIC_LLM_STREAM, 0);

        var r = dispatcher.dispatch(job);

        assertEquals(Outcome.RETRY_SCHEDULED, r.outcome());
        Job row = store.row("j4");
        assertEquals(JobStatus.QUEUED, row.status());
        assertEquals(1, row.retryCount());
        assertEquals("upstream 503", row.errorMessage());
    }

    @Test
    void false_result_is_treated_as_recoverable_failure() {
        register(JobType.GENERIC_LLM_STREAM, p -> ProcessResult.failure("rate limited"));

        var r = dispatcher.dispatch(claimed("j5", JobType.GENERIC_LLM_STREAM, 1));

        assertEquals(Outcome.RETRY_SCHEDULED, r.outcome());
        assertEquals(2, store.row("j5").retryCount());
    }

    @Test
    void exhausted_retries_end_in_failed_with_last_error() {
        register(JobType.GENERIC_LLM_STREAM, p -> { throw new IllegalStateException("still broken"); });

        var r = dispatcher.dispatch(claimed("j6", JobType.GENERIC_LLM_STREAM, 2));

        assertEquals(Outcome.FAILED, r.outcome());
        Job row = store.row("j6");
        assertEquals(JobStatus.FAILED, row.status());
        assertEquals(2, row.retryCount());
        assertEquals("still broken", row.errorMessage());
    }

    @Test
    void validation_error_is_never_retried() {
        register(JobType.VOICE_TRANSCRIPTION, p -> { throw new JobValidationException("audio file missing"); });

        var r = dispatcher.dispatch(claimed("j7", JobType.VOICE_TRANSCRIPTION, 0));

        assertEquals(Outcome.FAILED, r.outcome());
        assertEquals(JobStatus.FAILED, store.row("j7").status());
        assertEquals(0, store.row("j7").retryCount());
    }

    @Test
    void cancel_during_processing_is_not_overwritten() {
        register(JobType.TEXT_IMPROVEMENT, p -> {
            new JobService(store, tx, new JobQueue(), Jobs.MAPPER, clock).cancelJob(p.get("jobId").asText(), "user canceled");
            return ProcessResult.success("late result");
        });

        var r = dispatcher.dispatch(claimed("j8", JobType.TEXT_IMPROVEMENT, 0));

        assertEquals(Outcome.CANCELED, r.outcome());
        Job row = store.row("j8");
        assertEquals(JobStatus.CANCELED, row.status());
        assertNull(row.response());
    }

    @Test
    void failure_after_cancel_does_not_requeue() {
        register(JobType.TEXT_IMPROVEMENT, p -> {
            store.cancelSessionJobs("s-1", "session closed");
            throw new IOException("connection aborted");
        });

        var r = dispatcher.dispatch(claimed("j9", JobType.TEXT_IMPROVEMENT, 0));

        assertEquals(Outcome.CANCELED, r.outcome());
        assertEquals(JobStatus.CANCELED, store.row("j9").status());
        assertEquals(0, store.row("j9").retryCount());
    }

    @Test
    void processor_finalized_itself_is_reported_as_is() {
        register(JobType.IMPLEMENTATION_PLAN, p -> {
            updater.completeByTag(p.get("jobId").asText(), "<plan/>", null);
            return ProcessResult.success("plan ready");
        });

        var r = dispatcher.dispatch(claimed("j10", JobType.IMPLEMENTATION_PLAN, 0));

        assertEquals(Outcome.COMPLETED, r.outcome());
        assertEquals(JobStatus.COMPLETED_BY_TAG, store.row("j10").status());
        assertEquals("<plan/>", store.row("j10").response());
    }

    @Test
    void lost_lease_skips_execution() {
        AtomicInteger calls = new AtomicInteger();
        register(JobType.REGEX_GENERATION, p -> { calls.incrementAndGet(); return ProcessResult.success("x"); });
        var job = claimed("j11", JobType.REGEX_GENERATION, 0);
        // stale reset → 다른 워커가 다시 가져가 실행 중
        store.put(Jobs.row("j11", "s-1", "regex_generation", Jobs.payloadFor("j11"), 0, JobStatus.RUNNING, 0, T0, T0));

        var r = dispatcher.dispatch(job);

        assertEquals(Outcome.SKIPPED, r.outcome());
        assertEquals(0, calls.get());
        assertEquals(JobStatus.RUNNING, store.row("j11").status());
    }

    @Test
    void store_error_is_captured_as_result() {
        register(JobType.REGEX_GENERATION, p -> ProcessResult.success("x"));
        var broken = new Dispatcher(registry, store, new DirectTxRunner() {
            @Override public <T> T required(java.util.concurrent.Callable<T> body) throws Exception {
                throw new java.sql.SQLException("connection refused");
            }
        }, RetryPolicy.fixed(2));

        var r = assertDoesNotThrow(() -> broken.dispatch(claimed("j12", JobType.REGEX_GENERATION, 0)));

        assertEquals(Outcome.ERROR, r.outcome());
        assertEquals("connection refused", r.message());
    }

    @Test
    void failed_result_write_falls_back_to_failed_instead_of_staying_running() {
        var rejecting = new InMemoryJobStore(clock) {
            @Override public synchronized boolean updateJobStatus(JobStatusUpdate u) {
                if (u.status() == JobStatus.COMPLETED) {
                    throw new IllegalStateException("Value too long for column \"STATUS_MESSAGE\"");
                }
                return super.updateJobStatus(u);
            }
        };
        store = rejecting;
        register(JobType.IMPLEMENTATION_PLAN, p -> ProcessResult.success("plan"));
        var d = new Dispatcher(registry, rejecting, tx, RetryPolicy.fixed(2));

        var r = d.dispatch(claimed("j13", JobType.IMPLEMENTATION_PLAN, 0));

        assertEquals(Outcome.FAILED, r.outcome());
        Job row = rejecting.row("j13");
        assertEquals(JobStatus.FAILED, row.status(), "job must not stay running");
        assertTrue(row.errorMessage().startsWith("Result could not be recorded: Value too long"), row.errorMessage());
        assertEquals(0, row.retryCount(), "write failure is not retried");
    }

    @Test
    void completed_status_message_is_fixed_and_result_text_goes_to_response() {
        String longText = "y".repeat(5000);
        register(JobType.TEXT_IMPROVEMENT, p -> ProcessResult.success(longText));

        dispatcher.dispatch(claimed("j14", JobType.TEXT_IMPROVEMENT, 0));

        Job row = store.row("j14");
        assertEquals("Completed", row.statusMessage());
        assertEquals(longText, row.response());
    }
}
