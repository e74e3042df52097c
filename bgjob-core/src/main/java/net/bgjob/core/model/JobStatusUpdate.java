package net.bgjob.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 부분 갱신 명령. null 필드는 건드리지 않는다.
 * <ul>
 *   <li>터미널 상태의 행에는 절대 적용되지 않는다.</li>
 *   <li>{@code expectedStatus}가 있으면 현재 상태가 일치할 때만 적용된다.</li>
 *   <li>{@code metadata}는 기존 문서에 얕게 병합된다.</li>
 * </ul>
 */
public record JobStatusUpdate(
        String id,
        JobStatus status,
        JobStatus expectedStatus,
        String statusMessage,
        String subStatusMessage,
        String errorMessage,
        Integer progressPercentage,
        JsonNode metadata,
        Integer retryCount,
        String response
) {
    public JobStatusUpdate {
        if (id == null) throw new IllegalArgumentException("id is required");
        if (progressPercentage != null && (progressPercentage < 0 || progressPercentage > 100)) {
            throw new IllegalArgumentException("progressPercentage must be within 0..100: " + progressPercentage);
        }
    }

    public static JobStatusUpdate of(String id, JobStatus status) {
        return new JobStatusUpdate(id, status, null, null, null, null, null, null, null, null);
    }

    /** 상태는 그대로 두고 진행 정보만 바꿀 때 */
    public static JobStatusUpdate progress(String id) {
        return of(id, null);
    }

    public JobStatusUpdate expecting(JobStatus expected) {
        return new JobStatusUpdate(id, status, expected, statusMessage, subStatusMessage, errorMessage,
                progressPercentage, metadata, retryCount, response);
    }

    public JobStatusUpdate message(String msg) {
        return new JobStatusUpdate(id, status, expectedStatus, msg, subStatusMessage, errorMessage,
                progressPercentage, metadata, retryCount, response);
    }

    public JobStatusUpdate subMessage(String msg) {
        return new JobStatusUpdate(id, status, expectedStatus, statusMessage, msg, errorMessage,
                progressPercentage, metadata, retryCount, response);
    }

    public JobStatusUpdate error(String err) {
        return new JobStatusUpdate(id, status, expectedStatus, statusMessage, subStatusMessage, err,
                progressPercentage, metadata, retryCount, response);
    }

    public JobStatusUpdate progressPct(Integer pct) {
        return new JobStatusUpdate(id, status, expectedStatus, statusMessage, subStatusMessage, errorMessage,
                pct, metadata, retryCount, response);
    }

    public JobStatusUpdate metadata(JsonNode md) {
        return new JobStatusUpdate(id, status, expectedStatus, statusMessage, subStatusMessage, errorMessage,
                progressPercentage, md, retryCount, response);
    }

    public JobStatusUpdate retryCount(Integer n) {
        return new JobStatusUpdate(id, status, expectedStatus, statusMessage, subStatusMessage, errorMessage,
                progressPercentage, metadata, n, response);
    }

    public JobStatusUpdate response(String r) {
        return new JobStatusUpdate(id, status, expectedStatus, statusMessage, subStatusMessage, errorMessage,
                progressPercentage, metadata, retryCount, r);
    }
}
