package net.bgjob.core.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.bgjob.core.error.JobValidationException;
import net.bgjob.core.model.Job;
import net.bgjob.core.model.JobStatus;
import net.bgjob.core.model.JobStatusUpdate;
import net.bgjob.core.model.NewJob;
import net.bgjob.core.model.QueuedJob;
import net.bgjob.core.spi.Clock;
import net.bgjob.core.spi.JobStore;
import net.bgjob.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 등록/조회/취소 진입점. 등록은 항상 저장소를 거치며(queued 행 생성) 메모리 큐에 직접 넣는 경로는 없다.
 */
public final class JobService {
    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobStore store;
    private final TxRunner tx;
    private final JobQueue queue;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JobService(JobStore store, TxRunner tx, JobQueue queue, ObjectMapper mapper, Clock clock) {
        this.store = store;
        this.tx = tx;
        this.queue = queue;
        this.mapper = mapper;
        this.clock = clock;
    }

    public Job enqueue(NewJob req) throws Exception {
        if (req == null || req.type() == null) {
            throw new JobValidationException("job type is required");
        }
        if (req.payload() != null && !req.payload().isNull() && !req.payload().isObject()) {
            throw new JobValidationException("payload must be a JSON object");
        }

        String id = UUID.randomUUID().toString();
        ObjectNode payload = (req.payload() == null || req.payload().isNull())
                ? mapper.createObjectNode()
                : ((ObjectNode) req.payload()).deepCopy();
        payload.put(QueuedJob.JOB_ID_FIELD, id);

        var now = clock.now();
        var job = new Job(id, req.sessionId(), req.type().code(), payload, req.priority(),
                JobStatus.QUEUED, "Queued", null, null, null, null,
                mapper.createObjectNode(), 0, now, now, null, null);
        tx.required(() -> { store.insert(job); return null; });

        log.debug("Job enqueued: id={} type={} priority={} session={}", id, req.type().code(), req.priority(), req.sessionId());
        return job;
    }

    public Optional<Job> getJob(String id) throws Exception {
        return tx.required(() -> store.getJob(id));
    }

    public List<Job> listActiveJobs() throws Exception {
        return tx.required(store::listActiveJobs);
    }

    /** 취소 표시. 이미 터미널이면 false. 메모리 큐에서 대기 중이면 함께 뺀다 */
    public boolean cancelJob(String id, String reason) throws Exception {
        boolean canceled = tx.required(() -> store.updateJobStatus(
                JobStatusUpdate.of(id, JobStatus.CANCELED).message("Canceled").error(reason)));
        if (queue.remove(id)) {
            log.debug("Canceled job {} removed from in-memory queue", id);
        }
        if (canceled) log.info("Job {} canceled: {}", id, reason);
        return canceled;
    }

    public int cancelSessionJobs(String sessionId, String reason) throws Exception {
        int n = tx.required(() -> store.cancelSessionJobs(sessionId, reason));
        int removed = queue.removeSession(sessionId).size();
        log.info("Session {} jobs canceled: rows={} dequeued={}", sessionId, n, removed);
        return n;
    }
}
