package net.bgjob.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import net.bgjob.core.error.UnknownJobTypeException;
import net.bgjob.core.model.Job;
import net.bgjob.core.model.JobStatus;
import net.bgjob.core.model.JobStatusUpdate;
import net.bgjob.core.model.ProcessResult;
import net.bgjob.core.model.QueuedJob;
import net.bgjob.core.service.DispatchResult.Outcome;
import net.bgjob.core.spi.JobStore;
import net.bgjob.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 작업 한 건을 실행하고 재시도 정책을 적용한다.
 * <p>
 * 진행 중 상태 갱신은 Processor 책임이고, 여기서는 Processor가 터미널 상태에 도달하지 못한 경우의
 * 마무리(완료/실패/재시도)만 담당한다. 예외는 밖으로 던지지 않고 {@link DispatchResult}로 돌려준다.
 */
public final class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final ProcessorRegistry registry;
    private final JobStore store;
    private final TxRunner tx;
    private final RetryPolicy retry;

    public Dispatcher(ProcessorRegistry registry, JobStore store, TxRunner tx, RetryPolicy retry) {
        this.registry = registry;
        this.store = store;
        this.tx = tx;
        this.retry = retry;
    }

    public DispatchResult dispatch(QueuedJob job) {
        try {
            return doDispatch(job);
        } catch (Exception e) {
            log.error("Dispatch of job {} aborted by store error", job.id(), e);
            return new DispatchResult(job.id(), Outcome.ERROR, messageOf(e));
        }
    }

    private DispatchResult doDispatch(QueuedJob job) throws Exception {
        var processor = registry.getProcessor(job.type());
        if (processor.isEmpty()) {
            var err = new UnknownJobTypeException(job.type());
            log.error("Job {} failed: {}", job.id(), err.getMessage());
            boolean applied = update(JobStatusUpdate.of(job.id(), JobStatus.FAILED)
                    .message("Failed")
                    .error(err.getMessage()));
            return applied ? new DispatchResult(job.id(), Outcome.FAILED, err.getMessage()) : resolveConflict(job);
        }

        // lease(acknowledged_by_worker)를 쥐고 있을 때만 running으로 진입
        boolean started = update(JobStatusUpdate.of(job.id(), JobStatus.RUNNING)
                .expecting(JobStatus.ACKNOWLEDGED_BY_WORKER)
                .message("Processing " + job.type().code()));
        if (!started) {
            log.info("Job {} is no longer leased to this worker, skipping", job.id());
            return resolveConflict(job);
        }

        log.debug("Job {} started: type={} attempt={}", job.id(), job.type().code(), job.retryCount() + 1);
        ProcessResult result;
        try {
            result = processor.get().process(job.payload());
            if (result == null) result = ProcessResult.failure("Processor returned no result");
        } catch (Exception e) {
            result = ProcessResult.failure(messageOf(e), e);
        }

        try {
            return result.success() ? finishSuccess(job, result) : finishFailure(job, result);
        } catch (Exception e) {
            return failAfterWriteError(job, e);
        }
    }

    private DispatchResult finishSuccess(QueuedJob job, ProcessResult result) throws Exception {
        boolean applied = update(JobStatusUpdate.of(job.id(), JobStatus.COMPLETED)
                .message("Completed")
                .response(responseOf(result))
                .progressPct(100));
        if (!applied) return resolveConflict(job);
        log.debug("Job {} completed", job.id());
        return new DispatchResult(job.id(), Outcome.COMPLETED, result.message());
    }

    private DispatchResult finishFailure(QueuedJob job, ProcessResult result) throws Exception {
        String error = result.message();
        if (error == null && result.error() != null) error = messageOf(result.error());
        if (error == null) error = "Processor reported failure";

        int max = retry.maxRetries(job.type());
        if (retry.shouldRetry(job.type(), job.retryCount(), result.error())) {
            int next = job.retryCount() + 1;
            boolean applied = update(JobStatusUpdate.of(job.id(), JobStatus.QUEUED)
                    .retryCount(next)
                    .message("Retry scheduled (" + next + "/" + max + ")")
                    .error(error));
            if (!applied) return resolveConflict(job);
            log.warn("Job {} failed (attempt {}), retry scheduled: {}", job.id(), next, error, result.error());
            return new DispatchResult(job.id(), Outcome.RETRY_SCHEDULED, error);
        }

        boolean applied = update(JobStatusUpdate.of(job.id(), JobStatus.FAILED)
                .message("Failed")
                .error(error));
        if (!applied) return resolveConflict(job);
        if (retry.isRecoverable(result.error())) {
            log.error("Job {} failed after {} attempts: {}", job.id(), job.retryCount() + 1, error, result.error());
        } else {
            log.error("Job {} failed with non-recoverable error: {}", job.id(), error, result.error());
        }
        return new DispatchResult(job.id(), Outcome.FAILED, error);
    }

    /** 결과 기록이 실패하면 짧은 오류로 failed 기록을 한 번 더 시도한다. running에 남지 않게 */
    private DispatchResult failAfterWriteError(QueuedJob job, Exception cause) throws Exception {
        log.error("Could not record result of job {}, marking it failed", job.id(), cause);
        String error = "Result could not be recorded: " + abbreviate(messageOf(cause), 500);
        boolean applied = update(JobStatusUpdate.of(job.id(), JobStatus.FAILED)
                .message("Failed")
                .error(error));
        if (!applied) return resolveConflict(job);
        return new DispatchResult(job.id(), Outcome.FAILED, error);
    }

    /** 조건부 갱신이 거절된 경우: 현재 행 상태로 결과를 판단 (취소됐거나 Processor가 이미 마무리함) */
    private DispatchResult resolveConflict(QueuedJob job) throws Exception {
        Job current = tx.required(() -> store.getJob(job.id())).orElse(null);
        if (current == null) {
            return new DispatchResult(job.id(), Outcome.SKIPPED, "job row not found");
        }
        return switch (current.status()) {
            case CANCELED -> new DispatchResult(job.id(), Outcome.CANCELED, current.errorMessage());
            case COMPLETED, COMPLETED_BY_TAG -> new DispatchResult(job.id(), Outcome.COMPLETED, current.statusMessage());
            case FAILED -> new DispatchResult(job.id(), Outcome.FAILED, current.errorMessage());
            default -> new DispatchResult(job.id(), Outcome.SKIPPED, "status is " + current.status().code());
        };
    }

    private boolean update(JobStatusUpdate u) throws Exception {
        return tx.required(() -> store.updateJobStatus(u));
    }

    private static String responseOf(ProcessResult result) {
        JsonNode data = result.data();
        if (data == null || data.isNull()) return result.message();
        return data.isTextual() ? data.asText() : data.toString();
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    static String messageOf(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
