package com.boardhub.gameservice.games.board.domain.dto;

import com.boardhub.gameservice.engine.core.RuleEngine;
import com.boardhub.gameservice.games.board.domain.model.Participant;
import com.boardhub.gameservice.games.board.domain.model.Session;
import com.boardhub.gameservice.games.board.domain.model.SessionPhase;
import com.boardhub.gameservice.games.board.domain.rule.BoardGrid;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Session 与 SessionSnapshot 相互转换工具
 * 用于 Redis 存档与加载；加载时的每一处修正都写入 warnings。
 */
public final class SessionSnapshotConverter {

    private SessionSnapshotConverter() {
    }

    /** 从 Session 转为存档（kind/generation/snapshotId 由仓储填写） */
    public static SessionSnapshot toSnapshot(Session session, RuleEngine rules) {
        SessionSnapshot s = new SessionSnapshot();
        s.setSessionId(session.getId());
        s.setGameType(session.getGameType());
        s.setOperatorId(session.getOperatorId());
        s.setTurnCount(session.getTurnCount());
        s.setStarted(session.isStarted());
        s.setPaused(session.isPaused());
        s.setEnded(session.isEnded());
        s.setLastSequence(session.getLastSequence());
        for (Participant p : session.bySequence()) {
            s.getParticipants().add(new ParticipantRecord(p.getId(), p.getRole(), p.getCoordinate(), p.getSequence(),
                    p.getDisplay().getBackground(), p.getDisplay().getOutfit(), p.getSwappedWith()));
        }
        Map<String, Map<String, Object>> ruleData = new LinkedHashMap<>();
        ruleData.put(session.getGameType(), rules.exportData(session));
        s.setRuleData(ruleData);
        s.setSavedAt(System.currentTimeMillis());
        return s;
    }

    /**
     * 从存档还原 Session。
     * @param snapshot 存档
     * @param rules    该游戏类型的规则
     * @param warnings 清洗过程中的修正记录
     */
    public static Session restore(SessionSnapshot snapshot, RuleEngine rules, List<String> warnings) {
        Session session = new Session(snapshot.getSessionId(), rules.gameType(), snapshot.getOperatorId());
        session.setTurnCount(Math.max(1, snapshot.getTurnCount()));
        if (snapshot.getTurnCount() < 1) {
            warnings.add("turnCount " + snapshot.getTurnCount() + " reset to 1");
        }
        session.setPhase(phaseOf(snapshot));

        BoardGrid grid = rules.grid();
        Set<Integer> usedSequences = new HashSet<>();
        List<ParticipantRecord> unnumbered = new ArrayList<>();
        List<ParticipantRecord> records = snapshot.getParticipants() == null ? List.of() : snapshot.getParticipants();
        for (ParticipantRecord r : records) {
            String id = r == null ? null : StringUtils.trimToNull(r.getId());
            if (id == null) {
                warnings.add("participants: entry without id removed");
                continue;
            }
            if (session.getParticipants().containsKey(id)) {
                warnings.add("participants: duplicate " + id + " removed");
                continue;
            }
            Integer seq = r.getSequence();
            if (seq == null || seq < 1 || !usedSequences.add(seq)) {
                warnings.add("participants: invalid or duplicate sequence for " + id + ", renumbered");
                unnumbered.add(r);
                continue;
            }
            fill(session.restoreParticipant(id, seq), r, grid, warnings);
        }
        session.restoreLastSequence(snapshot.getLastSequence());
        for (ParticipantRecord r : unnumbered) {
            String id = r.getId().trim();
            fill(session.restoreParticipant(id, session.getLastSequence() + 1), r, grid, warnings);
        }
        // 交换对象必须存在，否则视为未交换
        for (Participant p : session.getParticipants().values()) {
            if (!session.getParticipants().containsKey(p.getSwappedWith())) {
                warnings.add("participants: " + p.getId() + " linked to unknown " + p.getSwappedWith() + ", link reset");
                p.setSwappedWith(p.getId());
            }
        }

        Map<String, Object> raw = snapshot.getRuleData() == null ? null : snapshot.getRuleData().get(rules.gameType());
        if (raw == null) {
            warnings.add("ruleData for " + rules.gameType() + " missing, rebuilt from participants");
        }
        session.setRuleData(rules.importData(session, raw, warnings));
        return session;
    }

    private static void fill(Participant p, ParticipantRecord r, BoardGrid grid, List<String> warnings) {
        p.setRole(StringUtils.trimToNull(r.getRole()));
        p.getDisplay().setBackground(StringUtils.trimToNull(r.getBackground()));
        p.getDisplay().setOutfit(StringUtils.trimToNull(r.getOutfit()));
        if (r.getCoordinate() != null) {
            Optional<String> coord = grid.normalize(r.getCoordinate());
            if (coord.isEmpty()) {
                warnings.add("participants: invalid coordinate " + r.getCoordinate() + " for " + p.getId() + " dropped");
            }
            p.setCoordinate(coord.orElse(null));
        }
        String link = StringUtils.trimToNull(r.getSwappedWith());
        p.setSwappedWith(link == null ? p.getId() : link);
    }

    private static SessionPhase phaseOf(SessionSnapshot s) {
        if (s.isEnded()) return SessionPhase.ENDED;
        if (!s.isStarted()) return SessionPhase.NOT_STARTED;
        return s.isPaused() ? SessionPhase.PAUSED : SessionPhase.ACTIVE;
    }
}
