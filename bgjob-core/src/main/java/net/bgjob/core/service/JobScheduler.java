package net.bgjob.core.service;

import net.bgjob.core.error.MalformedJobException;
import net.bgjob.core.maintenance.LeaseMaintenanceService;
import net.bgjob.core.model.Job;
import net.bgjob.core.model.JobStatus;
import net.bgjob.core.model.JobStatusUpdate;
import net.bgjob.core.model.QueuedJob;
import net.bgjob.core.spi.JobStore;
import net.bgjob.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 워커 풀 제어 루프.
 * <p>
 * 제어 스레드 하나가 틱마다 (1) dbPollInterval이 지났으면 저장소에서 queued 작업을 클레임해 메모리 큐에 넣고
 * (2) 여유 워커 수만큼 큐에서 꺼내 워커 풀에 넘긴다. 작업이 끝나면 워커가 제어 스레드에 소비를 다시 요청하므로
 * 다음 틱을 기다리지 않고 빈 슬롯이 채워진다.
 * <p>
 * 클레임 수는 {@code concurrencyLimit - activeWorkers - queueSize}로 제한되어, 메모리에 쌓인 lease가
 * stale 판정 전에 소비된다. 기동 시에는 첫 폴링 전에 stale lease를 먼저 회수한다.
 * <p>
 * jobTimeout 초과는 로그만 남긴다. 돌아오지 않는 Processor는 재시작 전까지 워커 슬롯을 차지한다.
 */
public final class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    public enum State { NEW, RUNNING, PAUSED, STOPPED }

    private final SchedulerSettings settings;
    private final JobStore store;
    private final TxRunner tx;
    private final JobQueue queue;
    private final Dispatcher dispatcher;
    private final LeaseMaintenanceService maintenance;

    private final ScheduledThreadPoolExecutor control;
    private final ThreadPoolExecutor workers;

    private final AtomicInteger activeWorkers = new AtomicInteger();
    private final AtomicInteger peakActiveWorkers = new AtomicInteger();
    /** 실행 중 작업 id → 시작 시각(nanoTime) */
    private final Map<String, Long> inFlight = new ConcurrentHashMap<>();
    private volatile State state = State.NEW;
    // 제어 스레드 전용
    private long lastDbPollNanos;

    private final AtomicLong claimed = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();
    private final AtomicLong dispatched = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong canceled = new AtomicLong();
    private final AtomicLong timedOut = new AtomicLong();
    private final AtomicLong storeErrors = new AtomicLong();

    public JobScheduler(SchedulerSettings settings,
                        JobStore store,
                        TxRunner tx,
                        JobQueue queue,
                        Dispatcher dispatcher,
                        LeaseMaintenanceService maintenance) {
        this.settings = settings;
        this.store = store;
        this.tx = tx;
        this.queue = queue;
        this.dispatcher = dispatcher;
        this.maintenance = maintenance;

        this.control = new ScheduledThreadPoolExecutor(1, named("bgjob-scheduler", true));
        this.control.setRemoveOnCancelPolicy(true);
        this.control.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

        int n = settings.concurrencyLimit();
        this.workers = new ThreadPoolExecutor(n, n, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), named("bgjob-worker", false));
    }

    // ------------------------------------------------------------------ lifecycle

    /** stale lease 회수 → 즉시 1회 폴링 → 주기 타이머 시작 */
    public synchronized void start() {
        if (state != State.NEW) {
            throw new IllegalStateException("Scheduler cannot be started from state " + state);
        }
        try {
            var report = maintenance.runOnce();
            log.info("Startup lease recovery: {}", report);
        } catch (Exception e) {
            storeErrors.incrementAndGet();
            log.error("Startup stale lease reset failed, the periodic sweep will retry", e);
        }

        state = State.RUNNING;
        long pollMs = settings.pollingInterval().toMillis();
        long sweepMs = settings.staleSweepInterval().toMillis();
        control.execute(() -> tick(true));
        control.scheduleWithFixedDelay(() -> tick(false), pollMs, pollMs, TimeUnit.MILLISECONDS);
        control.scheduleWithFixedDelay(this::sweepStaleLeases, sweepMs, sweepMs, TimeUnit.MILLISECONDS);

        log.info("Scheduler started: concurrencyLimit={} pollingInterval={} dbPollInterval={} jobTimeout={} staleJobTimeout={}",
                settings.concurrencyLimit(), settings.pollingInterval(), settings.dbPollInterval(),
                settings.jobTimeout(), settings.staleJobTimeout());
    }

    /** 새 클레임/디스패치 중단. 실행 중 작업은 계속 진행된다 */
    public synchronized void pause() {
        if (state != State.RUNNING) {
            log.debug("pause() ignored in state {}", state);
            return;
        }
        state = State.PAUSED;
        log.info("Scheduler paused (active={}, queued={})", activeWorkers.get(), queue.size());
    }

    public synchronized void resume() {
        if (state != State.PAUSED) {
            log.debug("resume() ignored in state {}", state);
            return;
        }
        state = State.RUNNING;
        submitControl(() -> tick(true));
        log.info("Scheduler resumed");
    }

    /**
     * 정지. 메모리 큐에 남은 작업은 queued로 반납하고(lease 만료를 기다리지 않도록),
     * 실행 중 작업은 shutdownGrace 동안 기다린 뒤 인터럽트한다.
     */
    public synchronized void stop() {
        if (state == State.STOPPED) return;
        state = State.STOPPED;

        control.shutdown();
        try {
            if (!control.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Scheduler control thread did not stop within 5s");
                control.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            control.shutdownNow();
        }

        int released = releaseQueuedLeases();

        workers.shutdown();
        Duration grace = settings.shutdownGrace();
        try {
            if (!workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} job(s) still running after {}, interrupting workers: {}",
                        activeWorkers.get(), grace, inFlight.keySet());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Scheduler stopped: released={} stats={}", released, stats());
    }

    public State state() { return state; }

    public int activeWorkers() { return activeWorkers.get(); }

    public SchedulerSettings settings() { return settings; }

    public SchedulerStats stats() {
        return new SchedulerStats(state, settings.concurrencyLimit(), activeWorkers.get(), peakActiveWorkers.get(),
                queue.size(), claimed.get(), malformed.get(), dispatched.get(), completed.get(), failed.get(),
                retried.get(), canceled.get(), timedOut.get(), storeErrors.get());
    }

    // ------------------------------------------------------------------ control loop

    private void tick(boolean forceDbPoll) {
        if (state != State.RUNNING) return;
        try {
            long now = System.nanoTime();
            if (forceDbPoll || now - lastDbPollNanos >= settings.dbPollInterval().toNanos()) {
                lastDbPollNanos = now;
                fetchFromStore();
            }
            drain();
        } catch (RuntimeException e) {
            // 주기 작업이 예외로 끝나면 이후 실행이 취소되므로 여기서 끊는다
            log.error("Scheduler tick failed", e);
        }
    }

    private void fetchFromStore() {
        int capacity = settings.concurrencyLimit() - activeWorkers.get() - queue.size();
        if (capacity <= 0) {
            trace("DB poll skipped: no free capacity (active={}, queued={})", activeWorkers.get(), queue.size());
            return;
        }

        List<Job> rows;
        try {
            rows = tx.requiresNew(() -> store.claimQueuedJobs(capacity));
        } catch (Exception e) {
            storeErrors.incrementAndGet();
            log.error("Failed to claim queued jobs, retrying on next poll", e);
            return;
        }

        for (Job row : rows) {
            claimed.incrementAndGet();
            try {
                queue.enqueue(QueuedJob.from(row));
            } catch (MalformedJobException e) {
                malformed.incrementAndGet();
                markMalformed(row, e);
            }
        }
        trace("DB poll: claimed={} capacity={} queued={} active={}",
                rows.size(), capacity, queue.size(), activeWorkers.get());
    }

    private void markMalformed(Job row, MalformedJobException e) {
        log.error("{}; marking failed", e.getMessage());
        if (row.id() == null) return;
        try {
            tx.required(() -> store.updateJobStatus(JobStatusUpdate.of(row.id(), JobStatus.FAILED)
                    .message("Failed")
                    .error(e.getMessage())));
        } catch (Exception ex) {
            storeErrors.incrementAndGet();
            log.error("Failed to mark malformed job {} as failed", row.id(), ex);
        }
    }

    private void drain() {
        while (state == State.RUNNING && activeWorkers.get() < settings.concurrencyLimit()) {
            var next = queue.dequeue();
            if (next.isEmpty()) return;
            launch(next.get());
        }
    }

    private void launch(QueuedJob job) {
        int active = activeWorkers.incrementAndGet();
        peakActiveWorkers.accumulateAndGet(active, Math::max);
        inFlight.put(job.id(), System.nanoTime());

        ScheduledFuture<?> timeout = control.schedule(() -> onTimeout(job),
                settings.jobTimeout().toMillis(), TimeUnit.MILLISECONDS);
        try {
            workers.execute(() -> runJob(job, timeout));
            dispatched.incrementAndGet();
            trace("Dispatched job {} (type={}, priority={}, active={})",
                    job.id(), job.type().code(), job.priority(), active);
        } catch (RejectedExecutionException e) {
            timeout.cancel(false);
            inFlight.remove(job.id());
            activeWorkers.decrementAndGet();
            queue.enqueue(job);
            log.warn("Worker pool rejected job {}, returned to queue", job.id());
        }
    }

    private void runJob(QueuedJob job, ScheduledFuture<?> timeout) {
        try {
            record(dispatcher.dispatch(job));
        } catch (RuntimeException e) {
            log.error("Unhandled error while dispatching job {}", job.id(), e);
        } finally {
            inFlight.remove(job.id());
            timeout.cancel(false);
            activeWorkers.decrementAndGet();
            submitControl(this::drainSafely);
        }
    }

    private void record(DispatchResult r) {
        switch (r.outcome()) {
            case COMPLETED -> completed.incrementAndGet();
            case FAILED -> failed.incrementAndGet();
            case RETRY_SCHEDULED -> retried.incrementAndGet();
            case CANCELED -> canceled.incrementAndGet();
            case ERROR -> storeErrors.incrementAndGet();
            case SKIPPED -> { }
        }
        trace("Job {} finished: {}", r.jobId(), r.outcome());
    }

    private void drainSafely() {
        if (state != State.RUNNING) return;
        try {
            drain();
        } catch (RuntimeException e) {
            log.error("Queue drain failed", e);
        }
    }

    private void onTimeout(QueuedJob job) {
        Long startedNanos = inFlight.get(job.id());
        if (startedNanos == null) return;
        timedOut.incrementAndGet();
        log.warn("Job {} (type={}) exceeded timeout {} and is still running; worker slot stays occupied until it returns",
                job.id(), job.type().code(), settings.jobTimeout());
    }

    /** 일시정지 중에는 건너뛴다. 메모리 큐가 쥐고 있는 lease가 재클레임되지 않도록 */
    private void sweepStaleLeases() {
        if (state != State.RUNNING) return;
        try {
            var report = maintenance.runOnce();
            trace("Stale lease sweep: {}", report);
        } catch (Exception e) {
            storeErrors.incrementAndGet();
            log.error("Stale lease sweep failed", e);
        }
    }

    private int releaseQueuedLeases() {
        int released = 0;
        for (QueuedJob job : queue.drain()) {
            try {
                boolean ok = tx.required(() -> store.updateJobStatus(JobStatusUpdate.of(job.id(), JobStatus.QUEUED)
                        .expecting(JobStatus.ACKNOWLEDGED_BY_WORKER)
                        .message("Released on scheduler shutdown")));
                if (ok) released++;
            } catch (Exception e) {
                storeErrors.incrementAndGet();
                log.error("Failed to release lease of job {}, stale lease reset will recover it", job.id(), e);
            }
        }
        return released;
    }

    private void submitControl(Runnable r) {
        if (state != State.RUNNING) return;
        try {
            control.execute(r);
        } catch (RejectedExecutionException e) {
            log.debug("Control executor is shut down, dropping task");
        }
    }

    private void trace(String format, Object... args) {
        if (settings.debugMode()) log.info(format, args);
        else log.debug(format, args);
    }

    private static ThreadFactory named(String prefix, boolean daemon) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(daemon);
            return t;
        };
    }
}
