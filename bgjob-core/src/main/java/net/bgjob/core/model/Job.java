package net.bgjob.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Optional;

/**
 * 저장소의 작업 한 건. {@code typeCode}는 저장된 원문 그대로이며,
 * 알 수 없는 코드일 수도 있다 (그 경우 {@link #type()}이 비어 있음).
 */
public record Job(
        String id,
        String sessionId,
        String typeCode,
        JsonNode payload,
        int priority,
        JobStatus status,
        String statusMessage,
        String subStatusMessage,
        Integer progressPercentage,
        String response,
        String errorMessage,
        JsonNode metadata,
        int retryCount,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant finishedAt
) {
    public Optional<JobType> type() { return JobType.fromCode(typeCode); }

    public boolean isTerminal() { return status != null && status.isTerminal(); }
}
