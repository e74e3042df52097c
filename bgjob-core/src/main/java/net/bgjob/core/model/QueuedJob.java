package net.bgjob.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import net.bgjob.core.error.MalformedJobException;

/**
 * 클레임된 작업의 메모리 내 사본. 디스패치 전까지만 살아 있으며 그 자체로는 영속되지 않는다.
 */
public record QueuedJob(String id, String sessionId, JobType type, JsonNode payload, int priority, int retryCount) {

    /** payload 안에 들어 있는 작업 id 역참조 필드 */
    public static final String JOB_ID_FIELD = "jobId";

    /**
     * 클레임된 행을 검증해 큐 항목으로 만든다.
     *
     * @throws MalformedJobException type/payload가 없거나 해석할 수 없는 경우
     */
    public static QueuedJob from(Job job) {
        if (job.id() == null || job.id().isBlank()) {
            throw new MalformedJobException(job.id(), "job id is missing");
        }
        if (job.typeCode() == null || job.typeCode().isBlank()) {
            throw new MalformedJobException(job.id(), "job type is missing");
        }
        JobType type = job.type().orElseThrow(() ->
                new MalformedJobException(job.id(), "unknown job type '" + job.typeCode() + "'"));
        JsonNode payload = job.payload();
        if (payload == null || payload.isNull() || payload.isMissingNode() || !payload.isObject()) {
            throw new MalformedJobException(job.id(), "payload is missing or not a JSON object");
        }
        JsonNode ref = payload.get(JOB_ID_FIELD);
        if (ref != null && !ref.isNull() && !job.id().equals(ref.asText())) {
            throw new MalformedJobException(job.id(), "payload jobId '" + ref.asText() + "' does not match row id");
        }
        return new QueuedJob(job.id(), job.sessionId(), type, payload, job.priority(), job.retryCount());
    }
}
