package com.ijp.lifecycle.posting.service;

import com.ijp.lifecycle.config.LifecycleProperties;
import com.ijp.lifecycle.posting.persistence.PostingJdbcRepository;
import com.ijp.lifecycle.posting.persistence.SweepLockRepository;
import com.ijp.lifecycle.posting.persistence.SweepRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SweepStartupRunnerTest {
    private static final Instant NOW = Instant.parse("2026-05-04T06:00:00Z");

    @Mock
    private PostingJdbcRepository postingRepository;
    @Mock
    private SweepRunRepository runRepository;
    @Mock
    private SweepLockRepository lockRepository;
    @Mock
    private ExpirySweeper sweeper;

    private LifecycleProperties properties;
    private SweepStartupRunner runner;

    @BeforeEach
    void setUp() {
        properties = new LifecycleProperties();
        properties.getSweeper().setRunOnStartup(false);
        runner = new SweepStartupRunner(
            postingRepository,
            runRepository,
            lockRepository,
            sweeper,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void staleRunsAreAbortedWhenNoInstanceHoldsTheLease() {
        when(postingRepository.isDbReachable()).thenReturn(true);
        when(lockRepository.isHeld("expiry-sweep", NOW)).thenReturn(false);

        runner.run(null);

        verify(runRepository).abortStaleRuns(NOW.minusSeconds(900), NOW);
        verifyNoInteractions(sweeper);
    }

    @Test
    void runOfAnotherLiveInstanceIsLeftRunning() {
        when(postingRepository.isDbReachable()).thenReturn(true);
        when(lockRepository.isHeld("expiry-sweep", NOW)).thenReturn(true);

        runner.run(null);

        verify(runRepository, never()).abortStaleRuns(any(), any());
    }

    @Test
    void unreachableDatabaseSkipsStartupWork() {
        when(postingRepository.isDbReachable()).thenThrow(new IllegalStateException("connection refused"));

        runner.run(null);

        verifyNoInteractions(runRepository, lockRepository, sweeper);
    }
}
