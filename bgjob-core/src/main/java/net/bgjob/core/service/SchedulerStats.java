package net.bgjob.core.service;

public record SchedulerStats(
        JobScheduler.State state,
        int concurrencyLimit,
        int activeWorkers,
        int peakActiveWorkers,
        int queueSize,
        long claimed,
        long malformed,
        long dispatched,
        long completed,
        long failed,
        long retried,
        long canceled,
        long timedOut,
        long storeErrors
) {}
