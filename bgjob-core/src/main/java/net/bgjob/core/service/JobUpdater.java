package net.bgjob.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import net.bgjob.core.model.Job;
import net.bgjob.core.model.JobStatus;
import net.bgjob.core.model.JobStatusUpdate;
import net.bgjob.core.spi.JobStore;
import net.bgjob.core.spi.TxRunner;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Processor가 자기 작업 행을 갱신할 때 쓰는 API.
 * 모든 메서드는 갱신이 실제로 적용됐는지를 반환한다. 이미 터미널(특히 canceled)인 행은 바뀌지 않으므로
 * false가 오면 Processor는 후속 작업을 멈추면 된다.
 */
public final class JobUpdater {
    private static final Set<JobStatus> STREAMING =
            EnumSet.of(JobStatus.PREPARING_INPUT, JobStatus.GENERATING_STREAM, JobStatus.PROCESSING_STREAM, JobStatus.RUNNING);

    private final JobStore store;
    private final TxRunner tx;

    public JobUpdater(JobStore store, TxRunner tx) {
        this.store = store;
        this.tx = tx;
    }

    /** 스트리밍 하위 상태로 전환 */
    public boolean markStreaming(String jobId, JobStatus subState, String subStatus, Integer progressPct) throws Exception {
        if (!STREAMING.contains(subState)) {
            throw new IllegalArgumentException("Not a streaming sub-state: " + subState);
        }
        return apply(JobStatusUpdate.of(jobId, subState).subMessage(subStatus).progressPct(progressPct));
    }

    /** 상태는 유지하고 메시지/진행률만 갱신 */
    public boolean reportProgress(String jobId, String message, Integer progressPct) throws Exception {
        return apply(JobStatusUpdate.progress(jobId).message(message).progressPct(progressPct));
    }

    public boolean mergeMetadata(String jobId, JsonNode metadata) throws Exception {
        return apply(JobStatusUpdate.progress(jobId).metadata(metadata));
    }

    public boolean complete(String jobId, String response, JsonNode metadata) throws Exception {
        return apply(JobStatusUpdate.of(jobId, JobStatus.COMPLETED)
                .message("Completed").response(response).metadata(metadata).progressPct(100));
    }

    /** 응답 안의 종료 태그를 만나 조기 완료된 경우 */
    public boolean completeByTag(String jobId, String response, JsonNode metadata) throws Exception {
        return apply(JobStatusUpdate.of(jobId, JobStatus.COMPLETED_BY_TAG)
                .message("Completed by tag").response(response).metadata(metadata).progressPct(100));
    }

    public boolean fail(String jobId, String errorMessage) throws Exception {
        return apply(JobStatusUpdate.of(jobId, JobStatus.FAILED).message("Failed").error(errorMessage));
    }

    public boolean isCanceled(String jobId) throws Exception {
        return current(jobId).map(j -> j.status() == JobStatus.CANCELED).orElse(false);
    }

    public Optional<Job> current(String jobId) throws Exception {
        return tx.required(() -> store.getJob(jobId));
    }

    private boolean apply(JobStatusUpdate u) throws Exception {
        return tx.required(() -> store.updateJobStatus(u));
    }
}
