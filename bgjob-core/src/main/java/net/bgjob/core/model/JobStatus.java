package net.bgjob.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 작업 상태 머신.
 * <pre>
 * queued → acknowledged_by_worker → {preparing_input → generating_stream → processing_stream}* → running
 *        → {completed | completed_by_tag | failed | canceled}
 * </pre>
 * 터미널 상태는 다시 비터미널로 돌아가지 않는다.
 */
public enum JobStatus {
    QUEUED("queued"),
    ACKNOWLEDGED_BY_WORKER("acknowledged_by_worker"),
    PREPARING_INPUT("preparing_input"),
    GENERATING_STREAM("generating_stream"),
    PROCESSING_STREAM("processing_stream"),
    RUNNING("running"),
    COMPLETED("completed"),
    COMPLETED_BY_TAG("completed_by_tag"),
    FAILED("failed"),
    CANCELED("canceled");

    private static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, COMPLETED_BY_TAG, FAILED, CANCELED);
    private static final Set<JobStatus> IN_PROGRESS =
            EnumSet.of(PREPARING_INPUT, GENERATING_STREAM, PROCESSING_STREAM, RUNNING);

    private final String code;

    JobStatus(String code) { this.code = code; }

    public String code() { return code; }

    public boolean isTerminal() { return TERMINAL.contains(this); }

    /** 워커가 실제로 처리 중인 상태 (lease 이후 단계) */
    public boolean isInProgress() { return IN_PROGRESS.contains(this); }

    public static Set<JobStatus> terminal() { return EnumSet.copyOf(TERMINAL); }

    public static JobStatus from(String s) {
        if (s == null) throw new IllegalArgumentException("status code is null");
        for (JobStatus st : values()) {
            if (st.code.equalsIgnoreCase(s) || st.name().equalsIgnoreCase(s)) return st;
        }
        throw new IllegalArgumentException("Unknown job status: " + s);
    }
}
