package com.boardhub.gameservice.games.board.infrastructure.redis.repo;

import com.boardhub.gameservice.games.board.domain.dto.SessionSnapshot;
import com.boardhub.gameservice.games.board.domain.dto.SnapshotInfo;
import com.boardhub.gameservice.games.board.domain.dto.SnapshotKind;
import com.boardhub.gameservice.games.board.domain.repository.SnapshotRepository;
import com.boardhub.gameservice.games.board.infrastructure.redis.RedisKeys;
import com.boardhub.gameservice.infrastructure.redis.RedisOps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * RedisSnapshotRepository
 * -------------------------------------------------------
 * 会话存档的 Redis 实现。
 * - 存档本体：JSON，带 TTL；
 * - 索引：Hash（snapshotId -> SnapshotInfo），随每次写入续期；
 * - 计数器：纯字符串自增键。
 */
@Slf4j
@Repository
public class RedisSnapshotRepository implements SnapshotRepository {

    private final RedisOps ops;
    private final int autosaveSlots;
    private final Duration ttl;

    public RedisSnapshotRepository(RedisOps ops,
                                   @Value("${boardhub.persistence.autosave-slots:5}") int autosaveSlots,
                                   @Value("${boardhub.persistence.ttl-hours:720}") long ttlHours) {
        if (autosaveSlots < 1) {
            throw new IllegalStateException("boardhub.persistence.autosave-slots must be positive");
        }
        this.ops = ops;
        this.autosaveSlots = autosaveSlots;
        this.ttl = Duration.ofHours(ttlHours);
    }

    @Override
    public SnapshotInfo saveAuto(SessionSnapshot snapshot) {
        String sessionId = snapshot.getSessionId();
        long generation = next(RedisKeys.autoGeneration(sessionId));
        long slot = (generation - 1) % autosaveSlots;
        return write(snapshot, SnapshotKind.AUTO, generation, SnapshotKind.AUTO.idFor(slot + 1));
    }

    @Override
    public SnapshotInfo saveManual(SessionSnapshot snapshot) {
        long number = next(RedisKeys.manualSequence(snapshot.getSessionId()));
        return write(snapshot, SnapshotKind.MANUAL, number, SnapshotKind.MANUAL.idFor(number));
    }

    @Override
    public Optional<SessionSnapshot> load(String sessionId, String snapshotId) {
        return Optional.ofNullable(ops.get(RedisKeys.snapshot(sessionId, snapshotId), SessionSnapshot.class));
    }

    @Override
    public List<SnapshotInfo> list(String sessionId) {
        List<SnapshotInfo> out = new ArrayList<>();
        ops.hGetAll(RedisKeys.snapshotIndex(sessionId)).forEach((id, v) -> {
            if (v instanceof SnapshotInfo info) {
                out.add(info);
            } else {
                log.warn("Ignoring malformed snapshot index entry {} for session {}", id, sessionId);
            }
        });
        out.sort(Comparator.comparingLong(SnapshotInfo::getSavedAt).reversed());
        return out;
    }

    @Override
    public void deleteAll(String sessionId) {
        List<String> keys = new ArrayList<>();
        ops.hGetAll(RedisKeys.snapshotIndex(sessionId)).keySet()
                .forEach(id -> keys.add(RedisKeys.snapshot(sessionId, id)));
        keys.add(RedisKeys.snapshotIndex(sessionId));
        keys.add(RedisKeys.autoGeneration(sessionId));
        keys.add(RedisKeys.manualSequence(sessionId));
        Long removed = ops.del(keys.toArray(String[]::new));
        log.info("Deleted snapshots of session {} (keys removed={})", sessionId, removed);
    }

    private SnapshotInfo write(SessionSnapshot snapshot, SnapshotKind kind, long generation, String snapshotId) {
        String sessionId = snapshot.getSessionId();
        snapshot.setKind(kind);
        snapshot.setGeneration(generation);
        snapshot.setSnapshotId(snapshotId);
        if (snapshot.getSavedAt() == 0) {
            snapshot.setSavedAt(System.currentTimeMillis());
        }
        SnapshotInfo info = SnapshotInfo.of(snapshot);
        ops.setEx(RedisKeys.snapshot(sessionId, snapshotId), snapshot, ttl);
        ops.hSet(RedisKeys.snapshotIndex(sessionId), snapshotId, info);
        ops.expire(RedisKeys.snapshotIndex(sessionId), ttl);
        log.debug("Saved snapshot {} for session {} (generation={})", snapshotId, sessionId, generation);
        return info;
    }

    private long next(String counterKey) {
        Long value = ops.incrBy(counterKey, 1);
        if (value == null) {
            throw new IllegalStateException("Redis counter " + counterKey + " unavailable");
        }
        ops.expire(counterKey, ttl);
        return value;
    }
}
