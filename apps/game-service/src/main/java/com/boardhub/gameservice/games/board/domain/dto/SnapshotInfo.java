package com.boardhub.gameservice.games.board.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 存档列表中的一项（不含完整数据）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotInfo {
    private String snapshotId;
    private SnapshotKind kind;
    private long generation;
    private int turnCount;
    private int participantCount;
    private long savedAt;

    public static SnapshotInfo of(SessionSnapshot s) {
        return new SnapshotInfo(s.getSnapshotId(), s.getKind(), s.getGeneration(),
                s.getTurnCount(), s.getParticipants().size(), s.getSavedAt());
    }
}
