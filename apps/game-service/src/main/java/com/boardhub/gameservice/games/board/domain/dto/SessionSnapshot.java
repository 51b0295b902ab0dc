package com.boardhub.gameservice.games.board.domain.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SessionSnapshot
 * -------------------------------------------------------
 * 一局游戏的完整存档（用于 Redis 持久化与加载）。
 * - ruleData 以游戏类型为键，值是规则插件导出的弱类型数据；
 * - 加载时一律经过清洗，不信任存档内容。
 * -------------------------------------------------------
 */
@Data
@NoArgsConstructor
public class SessionSnapshot {
    /** 存档 id（auto-N / manual-N） */
    private String snapshotId;
    private SnapshotKind kind;
    /** 自动存档为轮换代数，手动存档为编号 */
    private long generation;
    /** 保存时间（毫秒） */
    private long savedAt;

    private String sessionId;
    private String gameType;
    private String operatorId;
    private int turnCount;
    private boolean started;
    private boolean paused;
    private boolean ended;
    /** 按序号排列 */
    private List<ParticipantRecord> participants = new ArrayList<>();
    /** 已分配过的最大序号 */
    private int lastSequence;
    private Map<String, Map<String, Object>> ruleData = new LinkedHashMap<>();
}
