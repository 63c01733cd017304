package com.mouse.scanner.tasks;

import com.mouse.scanner.manager.ScanOrchestrator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Triggers a scan cycle every {@code scanner.scan-interval-seconds}.
 * <p>
 * The cycle runs on its own thread and the scheduler thread returns at once, so the next slot fires on
 * time. If the previous cycle is still running at that point the orchestrator skips the new one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scanner.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class ScanScheduler {

    private final ScanOrchestrator scanOrchestrator;

    private final AtomicInteger threadCounter = new AtomicInteger();
    private ExecutorService cycleExecutor;

    @PostConstruct
    public void init() {
        cycleExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "scan-cycle-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Scheduled(fixedRateString = "${scanner.scan-interval-seconds:300}",
            initialDelayString = "${scanner.initial-delay-seconds:5}",
            timeUnit = TimeUnit.SECONDS)
    public void scheduledScan() {
        try {
            cycleExecutor.execute(this::runCycle);
        } catch (RejectedExecutionException e) {
            log.warn("Scan cycle not started, scheduler is shutting down");
        }
    }

    private void runCycle() {
        try {
            scanOrchestrator.runCycle();
        } catch (Exception e) {
            log.error("Scheduled scan cycle failed", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (cycleExecutor == null) {
            return;
        }
        cycleExecutor.shutdown();
        try {
            if (!cycleExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cycleExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cycleExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
