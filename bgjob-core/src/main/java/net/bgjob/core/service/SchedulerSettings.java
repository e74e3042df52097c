package net.bgjob.core.service;

import java.time.Duration;

/**
 * 스케줄러 설정.
 *
 * @param concurrencyLimit   동시에 실행 가능한 작업 수 (워커 스레드 수)
 * @param pollingInterval    메모리 큐 소비 주기
 * @param dbPollInterval     저장소 클레임 주기 (pollingInterval보다 거칠게)
 * @param jobTimeout         작업당 상한. 초과 시 로그만 남긴다
 * @param staleJobTimeout    acknowledged_by_worker lease 유효 시간
 * @param staleSweepInterval stale lease 주기 점검 간격
 * @param shutdownGrace      종료 시 실행 중 작업을 기다리는 시간
 * @param debugMode          틱 단위 로그를 INFO로 올림
 */
public record SchedulerSettings(
        int concurrencyLimit,
        Duration pollingInterval,
        Duration dbPollInterval,
        Duration jobTimeout,
        Duration staleJobTimeout,
        Duration staleSweepInterval,
        Duration shutdownGrace,
        boolean debugMode
) {
    public static final int DEFAULT_CONCURRENCY_LIMIT = 5;
    public static final Duration DEFAULT_POLLING_INTERVAL = Duration.ofMillis(200);
    public static final Duration DEFAULT_DB_POLL_INTERVAL = Duration.ofMillis(5000);
    public static final Duration DEFAULT_JOB_TIMEOUT = Duration.ofMinutes(30);
    public static final Duration DEFAULT_STALE_JOB_TIMEOUT = Duration.ofSeconds(600);
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(30);

    public SchedulerSettings {
        if (concurrencyLimit < 1) throw new IllegalArgumentException("concurrencyLimit must be >= 1");
        requirePositive("pollingInterval", pollingInterval);
        requirePositive("dbPollInterval", dbPollInterval);
        requirePositive("jobTimeout", jobTimeout);
        requirePositive("staleJobTimeout", staleJobTimeout);
        if (staleJobTimeout.toSeconds() < 1) throw new IllegalArgumentException("staleJobTimeout must be at least 1s");
        if (staleSweepInterval == null) staleSweepInterval = staleJobTimeout;
        requirePositive("staleSweepInterval", staleSweepInterval);
        if (shutdownGrace == null || shutdownGrace.isNegative()) shutdownGrace = DEFAULT_SHUTDOWN_GRACE;
    }

    public static SchedulerSettings defaults() {
        return builder().build();
    }

    public static Builder builder() { return new Builder(); }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive");
    }

    public static final class Builder {
        private int concurrencyLimit = DEFAULT_CONCURRENCY_LIMIT;
        private Duration pollingInterval = DEFAULT_POLLING_INTERVAL;
        private Duration dbPollInterval = DEFAULT_DB_POLL_INTERVAL;
        private Duration jobTimeout = DEFAULT_JOB_TIMEOUT;
        private Duration staleJobTimeout = DEFAULT_STALE_JOB_TIMEOUT;
        private Duration staleSweepInterval;
        private Duration shutdownGrace = DEFAULT_SHUTDOWN_GRACE;
        private boolean debugMode;

        private Builder() {}

        public Builder concurrencyLimit(int v) { this.concurrencyLimit = v; return this; }
        public Builder pollingInterval(Duration v) { this.pollingInterval = v; return this; }
        public Builder dbPollInterval(Duration v) { this.dbPollInterval = v; return this; }
        public Builder jobTimeout(Duration v) { this.jobTimeout = v; return this; }
        public Builder staleJobTimeout(Duration v) { this.staleJobTimeout = v; return this; }
        public Builder staleSweepInterval(Duration v) { this.staleSweepInterval = v; return this; }
        public Builder shutdownGrace(Duration v) { this.shutdownGrace = v; return this; }
        public Builder debugMode(boolean v) { this.debugMode = v; return this; }

        public SchedulerSettings build() {
            return new SchedulerSettings(concurrencyLimit, pollingInterval, dbPollInterval, jobTimeout,
                    staleJobTimeout, staleSweepInterval, shutdownGrace, debugMode);
        }
    }
}
