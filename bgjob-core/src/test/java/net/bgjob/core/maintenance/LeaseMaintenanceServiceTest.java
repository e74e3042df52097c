package net.bgjob.core.maintenance;

import net.bgjob.core.model.JobStatus;
import net.bgjob.core.support.DirectTxRunner;
import net.bgjob.core.support.InMemoryJobStore;
import net.bgjob.core.support.Jobs;
import net.bgjob.core.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LeaseMaintenanceServiceTest {
    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    @Test
    void resets_only_leases_older_than_threshold_once() throws Exception {
        var clock = new MutableClock(T0);
        var store = new InMemoryJobStore(clock);
        store.put(Jobs.row("old", "s", "regex_generation", Jobs.payloadFor("old"), 0,
                JobStatus.ACKNOWLEDGED_BY_WORKER, 0, T0.minusSeconds(900), T0.minusSeconds(601)));
        store.put(Jobs.row("young", "s", "regex_generation", Jobs.payloadFor("young"), 0,
                JobStatus.ACKNOWLEDGED_BY_WORKER, 0, T0.minusSeconds(900), T0.minusSeconds(599)));
        store.put(Jobs.row("running", "s", "regex_generation", Jobs.payloadFor("running"), 0,
                JobStatus.RUNNING, 0, T0.minusSeconds(900), T0.minusSeconds(900)));

        var svc = new LeaseMaintenanceService(store, new DirectTxRunner(), clock, Duration.ofSeconds(600));

        var first = svc.runOnce();
        assertEquals(1, first.resetStaleLeases);
        assertEquals(600, first.staleThresholdSeconds);
        assertEquals(T0, first.timestamp);
        assertEquals(JobStatus.QUEUED, store.row("old").status());
        assertEquals(JobStatus.ACKNOWLEDGED_BY_WORKER, store.row("young").status());
        assertEquals(JobStatus.RUNNING, store.row("running").status(), "running jobs are not leases");

        assertEquals(0, svc.runOnce().resetStaleLeases, "already reset within this window");

        clock.advance(Duration.ofSeconds(2));
        assertEquals(1, svc.runOnce().resetStaleLeases);
        assertEquals(JobStatus.QUEUED, store.row("young").status());
    }

    @Test
    void rejects_sub_second_threshold() {
        var clock = new MutableClock(T0);
        assertThrows(IllegalArgumentException.class, () ->
                new LeaseMaintenanceService(new InMemoryJobStore(clock), new DirectTxRunner(), clock, Duration.ofMillis(10)));
    }
}
