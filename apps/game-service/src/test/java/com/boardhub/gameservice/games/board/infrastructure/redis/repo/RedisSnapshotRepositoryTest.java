package com.boardhub.gameservice.games.board.infrastructure.redis.repo;

import com.boardhub.gameservice.games.board.domain.dto.SessionSnapshot;
import com.boardhub.gameservice.games.board.domain.dto.SnapshotInfo;
import com.boardhub.gameservice.games.board.domain.dto.SnapshotKind;
import com.boardhub.gameservice.games.board.infrastructure.redis.RedisKeys;
import com.boardhub.gameservice.infrastructure.redis.RedisOps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisSnapshotRepositoryTest {

    private static final String SESSION = "c1";
    private static final Duration TTL = Duration.ofHours(720);

    @Mock
    private RedisOps ops;

    private RedisSnapshotRepository repository;

    @BeforeEach
    void setUp() {
        repository = new RedisSnapshotRepository(ops, 5, 720);
    }

    @Test
    void autosavesRotateThroughAFixedNumberOfSlots() {
        when(ops.incrBy(RedisKeys.autoGeneration(SESSION), 1)).thenReturn(1L, 2L, 3L, 4L, 5L, 6L, 7L);

        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            ids.add(repository.saveAuto(snapshot(3)).getSnapshotId());
        }

        assertThat(ids).containsExactly("auto-1", "auto-2", "auto-3", "auto-4", "auto-5", "auto-1", "auto-2");
        verify(ops, times(2)).setEx(eq(RedisKeys.snapshot(SESSION, "auto-1")), any(), eq(TTL));
    }

    @Test
    void manualSavesAreNumberedAndIndexed() {
        when(ops.incrBy(RedisKeys.manualSequence(SESSION), 1)).thenReturn(1L, 2L);

        SnapshotInfo first = repository.saveManual(snapshot(4));
        SnapshotInfo second = repository.saveManual(snapshot(5));

        assertThat(first.getSnapshotId()).isEqualTo("manual-1");
        assertThat(second.getSnapshotId()).isEqualTo("manual-2");
        assertThat(second.getKind()).isEqualTo(SnapshotKind.MANUAL);
        assertThat(second.getTurnCount()).isEqualTo(5);
        verify(ops).hSet(RedisKeys.snapshotIndex(SESSION), "manual-2", second);
        verify(ops).expire(RedisKeys.manualSequence(SESSION), TTL);
    }

    @Test
    void missingCounterFailsTheSave() {
        assertThatThrownBy(() -> repository.saveManual(snapshot(1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("unavailable");
    }

    @Test
    void listIsNewestFirstAndSkipsMalformedEntries() {
        Map<String, Object> index = new LinkedHashMap<>();
        index.put("auto-1", new SnapshotInfo("auto-1", SnapshotKind.AUTO, 1, 2, 2, 1_000L));
        index.put("manual-1", new SnapshotInfo("manual-1", SnapshotKind.MANUAL, 1, 3, 2, 3_000L));
        index.put("auto-2", "garbage");
        when(ops.hGetAll(RedisKeys.snapshotIndex(SESSION))).thenReturn(index);

        assertThat(repository.list(SESSION)).extracting(SnapshotInfo::getSnapshotId)
                .containsExactly("manual-1", "auto-1");
    }

    @Test
    void loadReturnsEmptyWhenAbsent() {
        SessionSnapshot stored = snapshot(2);
        when(ops.get(RedisKeys.snapshot(SESSION, "auto-3"), SessionSnapshot.class)).thenReturn(stored);
        when(ops.get(RedisKeys.snapshot(SESSION, "auto-4"), SessionSnapshot.class)).thenReturn(null);

        assertThat(repository.load(SESSION, "auto-3")).containsSame(stored);
        assertThat(repository.load(SESSION, "auto-4")).isEmpty();
    }

    @Test
    void deleteAllRemovesSnapshotsIndexAndCounters() {
        Map<String, Object> index = new LinkedHashMap<>();
        index.put("auto-1", new SnapshotInfo());
        index.put("manual-1", new SnapshotInfo());
        when(ops.hGetAll(RedisKeys.snapshotIndex(SESSION))).thenReturn(index);

        repository.deleteAll(SESSION);

        verify(ops).del(
                RedisKeys.snapshot(SESSION, "auto-1"),
                RedisKeys.snapshot(SESSION, "manual-1"),
                RedisKeys.snapshotIndex(SESSION),
                RedisKeys.autoGeneration(SESSION),
                RedisKeys.manualSequence(SESSION));
    }

    @Test
    void slotCountMustBePositive() {
        assertThatThrownBy(() -> new RedisSnapshotRepository(ops, 0, 720))
                .isInstanceOf(IllegalStateException.class);
    }

    private static SessionSnapshot snapshot(int turn) {
        SessionSnapshot s = new SessionSnapshot();
        s.setSessionId(SESSION);
        s.setGameType("snakes_ladders");
        s.setTurnCount(turn);
        return s;
    }
}
