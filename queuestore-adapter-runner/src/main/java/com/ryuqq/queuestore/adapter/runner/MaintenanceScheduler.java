package com.ryuqq.queuestore.adapter.runner;

import com.ryuqq.queuestore.application.runtime.MaintenanceTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 유지보수 작업 주기 실행기.
 *
 * <p>단일 스레드 {@link ScheduledExecutorService}에서 {@link MaintenanceTask}를 고정 지연
 * 간격으로 실행합니다. 한 번의 실행이 실패해도 로깅 후 다음 실행은 예정대로 진행됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * IdleQueueReaperConfig config = new IdleQueueReaperConfig();
 * MaintenanceScheduler scheduler = new MaintenanceScheduler(
 *     new IdleQueueReaper(storage, config), config.scanIntervalMs());
 * scheduler.start();
 * ...
 * scheduler.shutdown();
 * </pre>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public final class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 10000;

    private final MaintenanceTask task;
    private final long intervalMs;
    private final ScheduledExecutorService scheduler;

    private boolean started;

    /**
     * 생성자.
     *
     * @param task 주기적으로 실행할 작업
     * @param intervalMs 실행 종료 후 다음 실행까지의 지연 (밀리초, 양수)
     * @throws IllegalArgumentException task가 null이거나 intervalMs가 양수가 아닌 경우
     */
    public MaintenanceScheduler(MaintenanceTask task, long intervalMs) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive (current: " + intervalMs + ")");
        }
        this.task = task;
        this.intervalMs = intervalMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "queuestore-maintenance");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 주기 실행 시작. 첫 실행은 intervalMs 후입니다.
     *
     * @throws IllegalStateException 이미 시작되었거나 종료된 경우
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Maintenance scheduler already started");
        }
        if (scheduler.isShutdown()) {
            throw new IllegalStateException("Maintenance scheduler is shut down");
        }
        scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        started = true;
        log.info("Maintenance scheduler started (task: {}, intervalMs: {})",
            task.getClass().getSimpleName(), intervalMs);
    }

    /**
     * Graceful shutdown.
     *
     * <p>진행 중인 실행이 끝나기를 기다리고, 제한 시간을 넘기면 강제 종료합니다.</p>
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        scheduler.shutdown();
        if (!scheduler.awaitTermination(DEFAULT_SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
            log.warn("Maintenance task did not finish within {}ms, forcing shutdown", DEFAULT_SHUTDOWN_TIMEOUT_MS);
            scheduler.shutdownNow();
        }
        log.info("Maintenance scheduler stopped");
    }

    public boolean isShutdown() {
        return scheduler.isShutdown();
    }

    /**
     * 한 번 실행. 예외가 ScheduledExecutorService로 새면 이후 실행이 취소되므로 여기서 잡습니다.
     */
    void runOnce() {
        try {
            task.scan();
        } catch (Exception e) {
            log.error("Maintenance task {} failed, next run continues as scheduled",
                task.getClass().getSimpleName(), e);
        }
    }
}
