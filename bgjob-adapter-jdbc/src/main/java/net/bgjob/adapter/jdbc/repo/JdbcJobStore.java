package net.bgjob.adapter.jdbc.repo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.bgjob.adapter.jdbc.JdbcUtil;
import net.bgjob.adapter.jdbc.TxContext;
import net.bgjob.adapter.jdbc.mapper.RowMappers;
import net.bgjob.core.model.Job;
import net.bgjob.core.model.JobStatus;
import net.bgjob.core.model.JobStatusUpdate;
import net.bgjob.core.spi.Clock;
import net.bgjob.core.spi.JobStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * TB_BACKGROUND_JOB 기반 JobStore. 모든 쿼리는 TxContext 커넥션으로 실행된다.
 * 시각은 DB CURRENT_TIMESTAMP 대신 주입된 Clock 값을 파라미터로 넘긴다 (H2/Oracle 공통 SQL).
 */
public final class JdbcJobStore implements JobStore {

    private static final String TERMINAL_CODES = JobStatus.terminal().stream()
            .map(s -> "'" + s.code() + "'")
            .collect(Collectors.joining(",", "(", ")"));

    /** STATUS_MESSAGE / SUB_STATUS_MESSAGE 컬럼 폭 */
    static final int MESSAGE_MAX_CHARS = 1000;

    private final ObjectMapper om;
    private final Clock clock;

    public JdbcJobStore(ObjectMapper om, Clock clock) {
        this.om = om;
        this.clock = clock;
    }

    private Connection mustConn() {
        Connection c = TxContext.get();
        if (c == null) throw new IllegalStateException("TxContext required");
        return c;
    }

    @Override
    public void insert(Job job) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_BACKGROUND_JOB (
                ID, SESSION_ID, JOB_TYPE, PAYLOAD, PRIORITY, STATUS,
                STATUS_MESSAGE, SUB_STATUS_MESSAGE, PROGRESS_PCT, RESPONSE, ERROR_MESSAGE, METADATA,
                RETRY_COUNT, CREATED_AT, UPDATED_AT, STARTED_AT, FINISHED_AT
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """)) {
            ps.setString(1, job.id());
            ps.setString(2, job.sessionId());
            ps.setString(3, job.typeCode());
            ps.setString(4, RowMappers.writeJson(om, job.payload()));
            ps.setInt(5, job.priority());
            ps.setString(6, job.status().code());
            ps.setString(7, clip(job.statusMessage()));
            ps.setString(8, clip(job.subStatusMessage()));
            JdbcUtil.setNullableInt(ps, 9, job.progressPercentage());
            ps.setString(10, job.response());
            ps.setString(11, job.errorMessage());
            ps.setString(12, RowMappers.writeJson(om, job.metadata()));
            ps.setInt(13, job.retryCount());
            ps.setTimestamp(14, JdbcUtil.ts(job.createdAt()));
            ps.setTimestamp(15, JdbcUtil.ts(job.updatedAt()));
            ps.setTimestamp(16, JdbcUtil.ts(job.startedAt()));
            ps.setTimestamp(17, JdbcUtil.ts(job.finishedAt()));
            ps.executeUpdate();
        }
    }

    @Override
    public List<Job> claimQueuedJobs(int limit) throws Exception {
        if (limit <= 0) return List.of();
        Connection c = mustConn();

        // 1) 후보 픽업 (우선순위 ↓, 생성순 ↑)
        var candidates = new ArrayList<String>();
        try (var ps = c.prepareStatement("""
            SELECT ID
              FROM TB_BACKGROUND_JOB
             WHERE STATUS = ?
             ORDER BY PRIORITY DESC, CREATED_AT ASC, ID ASC
        """)) {
            ps.setMaxRows(limit);
            ps.setString(1, JobStatus.QUEUED.code());
            try (var rs = ps.executeQuery()) {
                while (rs.next()) candidates.add(rs.getString(1));
            }
        }
        if (candidates.isEmpty()) return List.of();

        // 2) 행 단위 조건부 전환: 다른 클레이머가 먼저 가져간 행은 0건 갱신
        var claimed = new ArrayList<String>();
        Timestamp now = JdbcUtil.ts(clock.now());
        try (var up = c.prepareStatement("""
            UPDATE TB_BACKGROUND_JOB
               SET STATUS = ?,
                   UPDATED_AT = ?
             WHERE ID = ?
               AND STATUS = ?
        """)) {
            for (String id : candidates) {
                up.setString(1, JobStatus.ACKNOWLEDGED_BY_WORKER.code());
                up.setTimestamp(2, now);
                up.setString(3, id);
                up.setString(4, JobStatus.QUEUED.code());
                if (up.executeUpdate() == 1) claimed.add(id);
            }
        }

        // 3) 로우 반환
        var out = new ArrayList<Job>(claimed.size());
        for (String id : claimed) {
            findById(c, id).ifPresent(out::add);
        }
        return out;
    }

    @Override
    public boolean updateJobStatus(JobStatusUpdate u) throws Exception {
        Connection c = mustConn();

        String mergedMetadata = null;
        if (u.metadata() != null && !u.metadata().isNull()) {
            var current = lockMetadata(c, u.id());
            if (current.isEmpty()) return false;
            mergedMetadata = RowMappers.writeJson(om, merge(current.get(), u.metadata()));
        }

        var set = new StringBuilder("UPDATE TB_BACKGROUND_JOB SET UPDATED_AT = ?");
        var args = new ArrayList<Object>();
        Timestamp now = JdbcUtil.ts(clock.now());
        args.add(now);

        if (u.status() != null) {
            set.append(", STATUS = ?");
            args.add(u.status().code());
            if (u.status().isInProgress()) {
                set.append(", STARTED_AT = COALESCE(STARTED_AT, ?)");
                args.add(now);
            }
            if (u.status().isTerminal()) {
                set.append(", FINISHED_AT = ?");
                args.add(now);
            }
        }
        appendIfPresent(set, args, "STATUS_MESSAGE", clip(u.statusMessage()));
        appendIfPresent(set, args, "SUB_STATUS_MESSAGE", clip(u.subStatusMessage()));
        appendIfPresent(set, args, "ERROR_MESSAGE", u.errorMessage());
        appendIfPresent(set, args, "PROGRESS_PCT", u.progressPercentage());
        appendIfPresent(set, args, "METADATA", mergedMetadata);
        appendIfPresent(set, args, "RETRY_COUNT", u.retryCount());
        appendIfPresent(set, args, "RESPONSE", u.response());

        set.append(" WHERE ID = ? AND STATUS NOT IN ").append(TERMINAL_CODES);
        args.add(u.id());
        if (u.expectedStatus() != null) {
            set.append(" AND STATUS = ?");
            args.add(u.expectedStatus().code());
        }

        try (var ps = c.prepareStatement(set.toString())) {
            for (int i = 0; i < args.size(); i++) {
                Object v = args.get(i);
                if (v instanceof Timestamp t) ps.setTimestamp(i + 1, t);
                else if (v instanceof Integer n) ps.setInt(i + 1, n);
                else ps.setString(i + 1, (String) v);
            }
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public int resetStaleAcknowledged(long thresholdSeconds) throws Exception {
        var now = clock.now();
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_BACKGROUND_JOB
               SET STATUS = ?,
                   UPDATED_AT = ?
             WHERE STATUS = ?
               AND UPDATED_AT < ?
        """)) {
            ps.setString(1, JobStatus.QUEUED.code());
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setString(3, JobStatus.ACKNOWLEDGED_BY_WORKER.code());
            ps.setTimestamp(4, JdbcUtil.ts(now.minusSeconds(thresholdSeconds)));
            return ps.executeUpdate();
        }
    }

    @Override
    public Optional<Job> getJob(String id) throws Exception {
        return findById(mustConn(), id);
    }

    @Override
    public List<Job> listActiveJobs() throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_BACKGROUND_JOB WHERE STATUS NOT IN " + TERMINAL_CODES + " ORDER BY CREATED_AT, ID")) {
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<Job>();
                while (rs.next()) out.add(RowMappers.toJob(rs, om));
                return out;
            }
        }
    }

    @Override
    public int cancelSessionJobs(String sessionId, String reason) throws Exception {
        Timestamp now = JdbcUtil.ts(clock.now());
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_BACKGROUND_JOB
               SET STATUS = ?,
                   STATUS_MESSAGE = 'Canceled',
                   ERROR_MESSAGE = ?,
                   UPDATED_AT = ?,
                   FINISHED_AT = ?
             WHERE SESSION_ID = ?
               AND STATUS NOT IN\s""" + TERMINAL_CODES)) {
            ps.setString(1, JobStatus.CANCELED.code());
            ps.setString(2, reason);
            ps.setTimestamp(3, now);
            ps.setTimestamp(4, now);
            ps.setString(5, sessionId);
            return ps.executeUpdate();
        }
    }

    // --- helpers ---

    private Optional<Job> findById(Connection c, String id) throws Exception {
        try (var ps = c.prepareStatement("SELECT * FROM TB_BACKGROUND_JOB WHERE ID = ?")) {
            ps.setString(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs, om)) : Optional.empty();
            }
        }
    }

    /** 비터미널 행의 METADATA를 잠그고 읽는다. 행이 없거나 터미널이면 empty */
    private Optional<JsonNode> lockMetadata(Connection c, String id) throws Exception {
        try (var ps = c.prepareStatement(
                "SELECT METADATA FROM TB_BACKGROUND_JOB WHERE ID = ? AND STATUS NOT IN " + TERMINAL_CODES + " FOR UPDATE")) {
            ps.setString(1, id);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                JsonNode md = om.readTree(Optional.ofNullable(rs.getString(1)).orElse("{}"));
                return Optional.of(md);
            }
        }
    }

    private JsonNode merge(JsonNode current, JsonNode patch) {
        if (!patch.isObject()) return patch;
        ObjectNode merged = current.isObject() ? ((ObjectNode) current).deepCopy() : om.createObjectNode();
        merged.setAll((ObjectNode) patch);
        return merged;
    }

    /** 상태 메시지는 표시용이라 컬럼 폭에서 자른다. 전문은 RESPONSE/ERROR_MESSAGE(CLOB)에 남는다 */
    static String clip(String text) {
        if (text == null || text.length() <= MESSAGE_MAX_CHARS) return text;
        return text.substring(0, MESSAGE_MAX_CHARS - 3) + "...";
    }

    private static void appendIfPresent(StringBuilder sql, List<Object> args, String column, Object value) {
        if (value == null) return;
        sql.append(", ").append(column).append(" = ?");
        args.add(value);
    }
}
