package net.bgjob.adapter.jdbc.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.bgjob.adapter.jdbc.JdbcUtil;
import net.bgjob.core.model.Job;
import net.bgjob.core.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private static final Logger log = LoggerFactory.getLogger(RowMappers.class);

    private RowMappers() {}

    // --- TB_BACKGROUND_JOB ---
    public static Job toJob(ResultSet rs, ObjectMapper om) throws SQLException {
        String id = rs.getString("ID");
        return new Job(
                id,
                rs.getString("SESSION_ID"),
                rs.getString("JOB_TYPE"),
                readJson(om, id, "PAYLOAD", rs.getString("PAYLOAD")),
                rs.getInt("PRIORITY"),
                JobStatus.from(rs.getString("STATUS")),
                rs.getString("STATUS_MESSAGE"),
                rs.getString("SUB_STATUS_MESSAGE"),
                JdbcUtil.getNullableInt(rs, "PROGRESS_PCT"),
                rs.getString("RESPONSE"),
                rs.getString("ERROR_MESSAGE"),
                readJson(om, id, "METADATA", rs.getString("METADATA")),
                rs.getInt("RETRY_COUNT"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("STARTED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("FINISHED_AT"))
        );
    }

    /** 해석 불가한 JSON은 null로 돌려준다. payload가 null이면 클레임 시 malformed로 처리됨 */
    static JsonNode readJson(ObjectMapper om, String id, String column, String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return om.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable {} JSON on job {}: {}", column, id, e.getOriginalMessage());
            return null;
        }
    }

    public static String writeJson(ObjectMapper om, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        try {
            return om.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON serialization failed", e);
        }
    }
}
