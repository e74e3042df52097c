package net.bgjob.bootstrap.props;

import net.bgjob.core.model.JobType;
import net.bgjob.core.service.SchedulerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@ConfigurationProperties("bgjob")
public class BgJobProperties {
    private Scheduler scheduler = new Scheduler();
    private Retry retry = new Retry();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int concurrencyLimit = SchedulerSettings.DEFAULT_CONCURRENCY_LIMIT;
        private Duration pollingInterval = SchedulerSettings.DEFAULT_POLLING_INTERVAL;
        private Duration dbPollInterval = SchedulerSettings.DEFAULT_DB_POLL_INTERVAL;
        private Duration jobTimeout = SchedulerSettings.DEFAULT_JOB_TIMEOUT;
        private Duration staleJobTimeout = SchedulerSettings.DEFAULT_STALE_JOB_TIMEOUT;
        private Duration staleSweepInterval;   // 비우면 staleJobTimeout
        private Duration shutdownGrace = SchedulerSettings.DEFAULT_SHUTDOWN_GRACE;
        private boolean debugMode = false;

        public SchedulerSettings toSettings() {
            return SchedulerSettings.builder()
                    .concurrencyLimit(concurrencyLimit)
                    .pollingInterval(pollingInterval)
                    .dbPollInterval(dbPollInterval)
                    .jobTimeout(jobTimeout)
                    .staleJobTimeout(staleJobTimeout)
                    .staleSweepInterval(staleSweepInterval)
                    .shutdownGrace(shutdownGrace)
                    .debugMode(debugMode)
                    .build();
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getConcurrencyLimit() {
            return concurrencyLimit;
        }

        public void setConcurrencyLimit(int concurrencyLimit) {
            this.concurrencyLimit = concurrencyLimit;
        }

        public Duration getPollingInterval() {
            return pollingInterval;
        }

        public void setPollingInterval(Duration pollingInterval) {
            this.pollingInterval = pollingInterval;
        }

        public Duration getDbPollInterval() {
            return dbPollInterval;
        }

        public void setDbPollInterval(Duration dbPollInterval) {
            this.dbPollInterval = dbPollInterval;
        }

        public Duration getJobTimeout() {
            return jobTimeout;
        }

        public void setJobTimeout(Duration jobTimeout) {
            this.jobTimeout = jobTimeout;
        }

        public Duration getStaleJobTimeout() {
            return staleJobTimeout;
        }

        public void setStaleJobTimeout(Duration staleJobTimeout) {
            this.staleJobTimeout = staleJobTimeout;
        }

        public Duration getStaleSweepInterval() {
            return staleSweepInterval;
        }

        public void setStaleSweepInterval(Duration staleSweepInterval) {
            this.staleSweepInterval = staleSweepInterval;
        }

        public Duration getShutdownGrace() {
            return shutdownGrace;
        }

        public void setShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
        }

        public boolean isDebugMode() {
            return debugMode;
        }

        public void setDebugMode(boolean debugMode) {
            this.debugMode = debugMode;
        }
    }

    public static class Retry {
        /** 모든 종류 공통 상한. null이면 JobType별 기본값 */
        private Integer defaultMaxRetries;
        private Map<JobType, Integer> perType = new EnumMap<>(JobType.class); // ← 가변

        public Integer getDefaultMaxRetries() {
            return defaultMaxRetries;
        }

        public void setDefaultMaxRetries(Integer defaultMaxRetries) {
            this.defaultMaxRetries = defaultMaxRetries;
        }

        public Map<JobType, Integer> getPerType() {
            return perType;
        }

        public void setPerType(Map<JobType, Integer> perType) {
            this.perType = perType;
        }
    }
}
