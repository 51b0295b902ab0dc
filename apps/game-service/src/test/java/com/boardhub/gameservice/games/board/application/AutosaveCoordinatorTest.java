package com.boardhub.gameservice.games.board.application;

import com.boardhub.gameservice.games.board.domain.dto.SnapshotInfo;
import com.boardhub.gameservice.games.board.domain.dto.SnapshotKind;
import com.boardhub.gameservice.games.board.service.BoardGameService;
import com.boardhub.gameservice.serializer.gate.CommandSerializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AutosaveCoordinatorTest {

    @Mock
    private BoardGameService service;
    @Mock
    private CommandSerializer serializer;
    @Mock
    private ScheduledThreadPoolExecutor scheduler;

    @Test
    void busySessionsAreSkippedAndFailuresIsolated() {
        AutosaveCoordinator coordinator = new AutosaveCoordinator(service, serializer, scheduler, 300);
        when(service.activeSessionIds()).thenReturn(new LinkedHashSet<>(List.of("idle", "busy", "broken")));
        when(service.autosave("idle")).thenReturn(Optional.of(new SnapshotInfo("auto-1", SnapshotKind.AUTO, 1, 1, 2, 1L)));
        when(serializer.tryWithLock(eq("idle"), any())).thenAnswer(inv -> {
            Supplier<?> op = inv.getArgument(1);
            return Optional.ofNullable(op.get());
        });
        when(serializer.tryWithLock(eq("busy"), any())).thenReturn(Optional.empty());
        when(serializer.tryWithLock(eq("broken"), any())).thenThrow(new IllegalStateException("boom"));

        assertThat(coordinator.saveAll()).isEqualTo(1);
        verify(service, never()).autosave("busy");
    }

    @Test
    void scheduleFollowsTheConfiguredInterval() {
        new AutosaveCoordinator(service, serializer, scheduler, 60).onReady();

        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(60L), eq(60L), eq(TimeUnit.SECONDS));
    }

    @Test
    void nonPositiveIntervalDisablesTheSchedule() {
        new AutosaveCoordinator(service, serializer, scheduler, 0).onReady();

        verify(scheduler, never()).scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any());
    }
}
