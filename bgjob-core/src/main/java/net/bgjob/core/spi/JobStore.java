package net.bgjob.core.spi;

import net.bgjob.core.model.Job;
import net.bgjob.core.model.JobStatusUpdate;

import java.util.List;
import java.util.Optional;

/**
 * 작업 테이블에 대한 영속 계약. 모든 메서드는 {@link TxRunner} 안에서 호출된다.
 */
public interface JobStore {

    /** 새 작업 행 저장 (보통 status=queued) */
    void insert(Job job) throws Exception;

    /**
     * queued 상태 작업을 최대 {@code limit}건 선점하여 acknowledged_by_worker로 전환하고 전환된 행을 돌려준다.
     * 우선순위 내림차순, 생성순. 전환은 행 단위 조건부 UPDATE(WHERE STATUS='queued')로 원자적이어야 한다.
     */
    List<Job> claimQueuedJobs(int limit) throws Exception;

    /**
     * 부분 갱신. updatedAt은 항상 갱신된다.
     * 터미널 행이거나 expectedStatus가 맞지 않으면 아무 것도 바꾸지 않고 false.
     */
    boolean updateJobStatus(JobStatusUpdate update) throws Exception;

    /** acknowledged_by_worker 상태로 updatedAt이 threshold보다 오래된 행을 queued로 되돌린다. */
    int resetStaleAcknowledged(long thresholdSeconds) throws Exception;

    Optional<Job> getJob(String id) throws Exception;

    /** 비터미널 작업 전체 (생성순) */
    List<Job> listActiveJobs() throws Exception;

    /** 세션의 비터미널 작업을 모두 canceled로 */
    int cancelSessionJobs(String sessionId, String reason) throws Exception;
}
