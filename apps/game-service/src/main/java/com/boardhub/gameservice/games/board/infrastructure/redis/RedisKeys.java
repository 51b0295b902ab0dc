package com.boardhub.gameservice.games.board.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "boardhub:";

    private RedisKeys() {}

    // ---- 单个存档 ----
    public static String snapshot(String sessionId, String snapshotId) {
        return PFX + "session:" + sessionId + ":snapshot:" + snapshotId;
    }

    // ---- 存档索引：snapshotId -> SnapshotInfo ----
    public static String snapshotIndex(String sessionId) {
        return PFX + "session:" + sessionId + ":snapshots";
    }

    // ---- 自动存档代数（轮换槽位 = (代数 - 1) % 槽位数） ----
    public static String autoGeneration(String sessionId) {
        return PFX + "session:" + sessionId + ":auto:gen";
    }

    // ---- 手动存档编号 ----
    public static String manualSequence(String sessionId) {
        return PFX + "session:" + sessionId + ":manual:seq";
    }
}
