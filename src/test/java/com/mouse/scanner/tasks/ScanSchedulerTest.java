package com.mouse.scanner.tasks;

import com.mouse.scanner.manager.ScanOrchestrator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScanSchedulerTest {

    @Mock
    private ScanOrchestrator scanOrchestrator;

    @InjectMocks
    private ScanScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler.init();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void scheduledScan_runsOneCycle() {
        when(scanOrchestrator.runCycle()).thenReturn(Optional.empty());

        scheduler.scheduledScan();

        verify(scanOrchestrator, timeout(2000)).runCycle();
    }

    @Test
    void scheduledScan_unexpectedFailure_nextSlotStillRuns() {
        when(scanOrchestrator.runCycle())
                .thenThrow(new IllegalStateException("executor rejected"))
                .thenReturn(Optional.empty());

        assertThatCode(scheduler::scheduledScan).doesNotThrowAnyException();
        verify(scanOrchestrator, timeout(2000)).runCycle();
        scheduler.scheduledScan();

        verify(scanOrchestrator, timeout(2000).times(2)).runCycle();
    }

    @Test
    void scheduledScan_previousCycleStillRunning_returnsWithoutWaiting() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(scanOrchestrator.runCycle())
                .thenAnswer(inv -> {
                    entered.countDown();
                    release.await(5, TimeUnit.SECONDS);
                    return Optional.empty();
                })
                .thenReturn(Optional.empty());

        try {
            scheduler.scheduledScan();
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            scheduler.scheduledScan();

            verify(scanOrchestrator, timeout(2000).times(2)).runCycle();
        } finally {
            release.countDown();
        }
    }

    @Test
    void scheduledScan_afterShutdown_doesNotThrow() {
        scheduler.shutdown();

        assertThatCode(scheduler::scheduledScan).doesNotThrowAnyException();
        verifyNoInteractions(scanOrchestrator);
    }
}
