package net.bgjob.integration.spring.sched;

import net.bgjob.core.service.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * 컨텍스트 기동이 끝난 뒤(Flyway 마이그레이션, Processor 등록 이후) 스케줄러를 시작하고
 * 종료 시 queued 복귀 처리와 함께 멈춘다.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLifecycle.class);

    /** 웹 서버 등 다른 라이프사이클 빈보다 늦게 시작하고 먼저 멈춘다 */
    public static final int PHASE = Integer.MAX_VALUE - 1000;

    private final JobScheduler scheduler;
    private volatile boolean running;

    public SchedulerLifecycle(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /** 한 번 멈춘 스케줄러는 다시 시작할 수 없다. 컨텍스트 재시작 시에는 경고만 남긴다 */
    @Override
    public void start() {
        if (scheduler.state() == JobScheduler.State.STOPPED) {
            log.warn("Background job scheduler was stopped and cannot be restarted; restart the application to resume polling");
            return;
        }
        log.info("Starting background job scheduler: {}", scheduler.settings());
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        if (!running) return;
        scheduler.stop();
        running = false;
        log.info("Background job scheduler stopped: {}", scheduler.stats());
    }

    @Override
    public boolean isRunning() { return running; }

    @Override
    public int getPhase() { return PHASE; }
}
