package net.bgjob.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/** 등록 요청. id와 상태는 {@code JobService}가 채운다. */
public record NewJob(String sessionId, JobType type, JsonNode payload, int priority) {

    public static NewJob of(String sessionId, JobType type, JsonNode payload) {
        return new NewJob(sessionId, type, payload, JobPriority.NORMAL);
    }

    public NewJob withPriority(int p) { return new NewJob(sessionId, type, payload, p); }
}
