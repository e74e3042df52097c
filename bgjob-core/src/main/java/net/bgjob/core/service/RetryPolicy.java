package net.bgjob.core.service;

import net.bgjob.core.error.JobValidationException;
import net.bgjob.core.error.UnknownJobTypeException;
import net.bgjob.core.model.JobType;

import java.util.Map;

public interface RetryPolicy {

    /** 종류별 재시도 상한. 총 실행 횟수는 최대 maxRetries + 1 */
    int maxRetries(JobType type);

    /** 검증 실패/Processor 없음은 재시도 대상이 아니다 (cause 체인까지 확인) */
    default boolean isRecoverable(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof JobValidationException || t instanceof UnknownJobTypeException) return false;
            if (t.getCause() == t) break;
        }
        return true;
    }

    default boolean shouldRetry(JobType type, int retryCount, Throwable error) {
        return isRecoverable(error) && retryCount < maxRetries(type);
    }

    /** 모든 종류에 같은 상한 */
    static RetryPolicy fixed(int maxRetries) {
        return new PerTypeRetryPolicy(maxRetries, Map.of());
    }

    /** JobType 기본값 사용, overrides가 있으면 우선 */
    static RetryPolicy perType(Map<JobType, Integer> overrides) {
        return new PerTypeRetryPolicy(null, overrides);
    }

    /** defaultMax가 null이면 JobType 기본값 */
    static RetryPolicy of(Integer defaultMax, Map<JobType, Integer> overrides) {
        return new PerTypeRetryPolicy(defaultMax, overrides);
    }
}
