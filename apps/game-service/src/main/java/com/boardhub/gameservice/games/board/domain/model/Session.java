package com.boardhub.gameservice.games.board.domain.model;

import com.boardhub.gameservice.engine.core.RuleData;
import lombok.Getter;
import lombok.Setter;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一局进行中的游戏（一个频道一局）。
 * 只允许在该会话的锁内修改；锁由 CommandSerializer 管理。
 */
@Getter
public class Session {

    private final String id;
    private final String gameType;
    @Setter private String operatorId;
    @Setter private SessionPhase phase = SessionPhase.NOT_STARTED;
    /** 回合计数，从 1 开始；一轮所有可行动者都行动后 +1 */
    @Setter private int turnCount = 1;
    /** 已分配过的最大序号 */
    private int lastSequence;
    // 插入顺序即加入顺序
    private final Map<String, Participant> participants = new LinkedHashMap<>();
    /** 规则插件私有数据 */
    @Setter private RuleData ruleData;
    /** 回合结算失败，下次掷骰前重试；不入存档 */
    @Setter private boolean cycleClosePending;

    public Session(String id, String gameType, String operatorId) {
        this.id = id;
        this.gameType = gameType;
        this.operatorId = operatorId;
    }

    public Optional<Participant> find(String participantId) {
        return Optional.ofNullable(participants.get(participantId));
    }

    public Participant require(String participantId) {
        Participant p = participants.get(participantId);
        if (p == null) {
            throw new IllegalArgumentException("Unknown participant: " + participantId);
        }
        return p;
    }

    /** 新参与者：分配下一个序号 */
    public Participant addParticipant(String participantId) {
        if (participants.containsKey(participantId)) {
            throw new IllegalStateException("Participant already present: " + participantId);
        }
        Participant p = new Participant(participantId, ++lastSequence);
        participants.put(participantId, p);
        return p;
    }

    /** 从存档恢复：沿用存档中的序号 */
    public Participant restoreParticipant(String participantId, int sequence) {
        Participant p = new Participant(participantId, sequence);
        participants.put(participantId, p);
        lastSequence = Math.max(lastSequence, sequence);
        return p;
    }

    public void restoreLastSequence(int value) {
        lastSequence = Math.max(lastSequence, value);
    }

    public List<Participant> bySequence() {
        return participants.values().stream()
                .sorted(Comparator.comparingInt(Participant::getSequence))
                .toList();
    }

    public boolean isOperator(String userId) {
        return operatorId != null && operatorId.equals(userId);
    }

    public boolean isStarted() { return phase != SessionPhase.NOT_STARTED; }
    public boolean isPaused()  { return phase == SessionPhase.PAUSED; }
    public boolean isEnded()   { return phase == SessionPhase.ENDED; }
}
