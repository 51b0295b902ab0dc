package com.boardhub.gameservice.games.board.domain.dto;

/**
 * 存档类型。AUTO 轮换覆盖固定数量的槽位；MANUAL 单调编号，永不覆盖。
 */
public enum SnapshotKind {
    AUTO("auto"),
    MANUAL("manual");

    private final String prefix;

    SnapshotKind(String prefix) {
        this.prefix = prefix;
    }

    /** 存档 id，如 auto-3 / manual-12 */
    public String idFor(long number) {
        return prefix + "-" + number;
    }

    public static SnapshotKind fromId(String snapshotId) {
        for (SnapshotKind k : values()) {
            if (snapshotId != null && snapshotId.startsWith(k.prefix + "-")) return k;
        }
        throw new IllegalArgumentException("Unknown snapshot id: " + snapshotId);
    }
}
