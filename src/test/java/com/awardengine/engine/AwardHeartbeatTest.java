package com.awardengine.engine;

import com.awardengine.contract.MetricId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.config.IntervalTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AwardHeartbeatTest {

    @Mock
    private AwardEngine engine;

    @Mock
    private ObjectProvider<GlobalProgressSource> progressSources;

    @Mock
    private GlobalProgressSource progressStorage;

    private AwardHeartbeat heartbeat;

    @BeforeEach
    void setUp() {
        AwardEngineProperties properties = new AwardEngineProperties(
            new AwardEngineProperties.Heartbeat(true, Duration.ofSeconds(6), Duration.ofSeconds(2)));
        heartbeat = new AwardHeartbeat(engine, progressSources, properties);
    }

    @Test
    void tick_refreshesGlobalsBeforeEvaluating() {
        Map<MetricId, Integer> totals = Map.of(MetricId.LEVELS_COMPLETED_COUNT, 36);
        when(progressSources.orderedStream()).thenReturn(Stream.of(progressStorage));
        when(progressStorage.globalTotals()).thenReturn(totals);
        when(engine.evaluateAndFire()).thenReturn(List.of("GameProgress01"));

        heartbeat.tick();

        InOrder order = inOrder(engine);
        order.verify(engine).refreshGlobalMetrics(totals);
        order.verify(engine).evaluateAndFire();
    }

    @Test
    void tick_evaluatesEvenWhenRefreshFails() {
        when(progressSources.orderedStream()).thenReturn(Stream.of(progressStorage));
        when(progressStorage.globalTotals()).thenThrow(new IllegalStateException("storage offline"));
        when(engine.evaluateAndFire()).thenReturn(List.of());

        assertDoesNotThrow(heartbeat::tick);

        verify(engine, never()).refreshGlobalMetrics(any());
        verify(engine).evaluateAndFire();
    }

    @Test
    void tick_survivesFailingEvaluation() {
        when(progressSources.orderedStream()).thenReturn(Stream.empty());
        when(engine.evaluateAndFire()).thenThrow(new IllegalStateException("sink unavailable"));

        assertDoesNotThrow(heartbeat::tick);
        verify(engine).evaluateAndFire();
    }

    @Test
    void configureTasks_registersFixedDelayWithInitialDelay() {
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        heartbeat.configureTasks(registrar);

        List<IntervalTask> tasks = registrar.getFixedDelayTaskList();
        assertEquals(1, tasks.size());
        assertEquals(Duration.ofSeconds(2), tasks.get(0).getIntervalDuration());
        assertEquals(Duration.ofSeconds(6), tasks.get(0).getInitialDelayDuration());
    }

    @Test
    void heartbeatSettings_rejectNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class,
            () -> new AwardEngineProperties.Heartbeat(true, Duration.ofSeconds(6), Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> new AwardEngineProperties.Heartbeat(true, Duration.ofSeconds(-1), Duration.ofSeconds(2)));
    }
}
