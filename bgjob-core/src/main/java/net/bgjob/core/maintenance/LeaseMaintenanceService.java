package net.bgjob.core.maintenance;

import net.bgjob.core.spi.Clock;
import net.bgjob.core.spi.JobStore;
import net.bgjob.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * lease 점검 루틴.
 * - acknowledged_by_worker 로 staleJobTimeout 이상 머문 작업을 queued로 되돌림 (죽은 워커가 잡아둔 작업 회수)
 * 스케줄러가 기동 직후 첫 폴링 전에 한 번, 이후 주기적으로 호출한다.
 */
public final class LeaseMaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(LeaseMaintenanceService.class);

    private final JobStore store;
    private final TxRunner tx;
    private final Clock clock;
    private final Duration staleJobTimeout;

    public LeaseMaintenanceService(JobStore store, TxRunner tx, Clock clock, Duration staleJobTimeout) {
        if (staleJobTimeout == null || staleJobTimeout.toSeconds() < 1) {
            throw new IllegalArgumentException("staleJobTimeout must be at least 1s");
        }
        this.store = store;
        this.tx = tx;
        this.clock = clock;
        this.staleJobTimeout = staleJobTimeout;
    }

    public MaintenanceReport runOnce() throws Exception {
        MaintenanceReport r = new MaintenanceReport();
        r.timestamp = clock.now();
        r.staleThresholdSeconds = staleJobTimeout.toSeconds();
        r.resetStaleLeases = tx.requiresNew(() -> store.resetStaleAcknowledged(r.staleThresholdSeconds));
        if (r.resetStaleLeases > 0) {
            log.warn("Reset {} stale acknowledged job(s) back to queued (older than {}s)",
                    r.resetStaleLeases, r.staleThresholdSeconds);
        }
        return r;
    }

    public Duration staleJobTimeout() { return staleJobTimeout; }

    public static final class MaintenanceReport {
        public Instant timestamp;
        public long staleThresholdSeconds;
        public int resetStaleLeases;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", staleThresholdSeconds=" + staleThresholdSeconds +
                    ", resetStaleLeases=" + resetStaleLeases +
                    '}';
        }
    }
}
