package com.boardhub.gameservice.games.board.service.impl;

import com.boardhub.gameservice.engine.core.Eligibility;
import com.boardhub.gameservice.engine.core.MoveOutcome;
import com.boardhub.gameservice.engine.core.RuleEngine;
import com.boardhub.gameservice.engine.core.RuleEngineException;
import com.boardhub.gameservice.engine.core.RuleEngineRegistry;
import com.boardhub.gameservice.engine.core.WinCheck;
import com.boardhub.gameservice.games.board.domain.dto.SessionSnapshot;
import com.boardhub.gameservice.games.board.domain.dto.SessionSnapshotConverter;
import com.boardhub.gameservice.games.board.domain.dto.SnapshotInfo;
import com.boardhub.gameservice.games.board.domain.dto.SnapshotKind;
import com.boardhub.gameservice.games.board.domain.model.Participant;
import com.boardhub.gameservice.games.board.domain.model.Session;
import com.boardhub.gameservice.games.board.domain.model.SessionPhase;
import com.boardhub.gameservice.games.board.domain.model.SessionView;
import com.boardhub.gameservice.games.board.domain.repository.SnapshotRepository;
import com.boardhub.gameservice.games.board.domain.rule.SwapCoordinator;
import com.boardhub.gameservice.games.board.domain.rule.SwapPair;
import com.boardhub.gameservice.games.board.render.BoardRenderer;
import com.boardhub.gameservice.games.board.render.RenderContext;
import com.boardhub.gameservice.games.board.render.RenderedBoard;
import com.boardhub.gameservice.games.board.service.ActionResult;
import com.boardhub.gameservice.games.board.service.BoardGameService;
import com.boardhub.gameservice.platform.character.CharacterPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.boardhub.gameservice.games.board.domain.constants.GameMessages.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class BoardGameServiceImpl implements BoardGameService {

    // ====== 内存会话表（频道 id -> 会话） ======
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    private final RuleEngineRegistry registry;
    private final SwapCoordinator swapCoordinator;
    private final CharacterPool characterPool;
    private final SnapshotRepository snapshotRepository;
    private final BoardRenderer renderer;

    /** 未指定类型时开的游戏 */
    @Value("${boardhub.default-game:snakes_ladders}")
    private String defaultGameType = "snakes_ladders";

    // ==================== 生命周期 ====================

    @Override
    public ActionResult start(String channelId, String actorId, String gameType) {
        Session existing = sessions.get(channelId);
        if (existing != null && !existing.isEnded()) {
            return ActionResult.rejected(format(GAME_ALREADY_RUNNING, existing.getGameType()));
        }
        String type = StringUtils.defaultIfBlank(gameType, defaultGameType);
        Optional<RuleEngine> found = registry.find(type);
        if (found.isEmpty()) {
            return ActionResult.rejected(format(UNKNOWN_GAME_TYPE, type, String.join(", ", registry.types())));
        }
        if (existing != null) {
            // 上一局已自动结束但没有 !end，先清理
            sessions.remove(channelId);
            deleteSnapshotsQuietly(channelId);
        }
        RuleEngine rules = found.get();
        Session session = new Session(channelId, rules.gameType(), actorId);
        session.setRuleData(rules.newData());
        sessions.put(channelId, session);
        log.info("Session created: channel={} type={} operator={}", channelId, rules.gameType(), actorId);
        return ActionResult.ok(format(GAME_CREATED, rules.gameType()));
    }

    @Override
    public ActionResult begin(String channelId, String actorId) {
        return operatorAction(channelId, actorId, "begin", (session, rules) -> {
            if (session.isStarted()) {
                return ActionResult.rejected(session.isEnded() ? GAME_ALREADY_ENDED : GAME_ALREADY_STARTED);
            }
            session.setPhase(SessionPhase.ACTIVE);
            log.info("Session begun: channel={} participants={}", channelId, session.getParticipants().size());
            String roster = callRules(rules, "begin", () -> rules.describeParticipants(session));
            return ActionResult.board(format(GAME_BEGUN, session.getTurnCount()) + "\n" + roster);
        });
    }

    @Override
    public ActionResult end(String channelId, String actorId) {
        return operatorAction(channelId, actorId, "end", (session, rules) -> {
            sessions.remove(channelId);
            deleteSnapshotsQuietly(channelId);
            log.info("Session ended by operator: channel={} turn={}", channelId, session.getTurnCount());
            return ActionResult.ok(GAME_ENDED);
        });
    }

    @Override
    public ActionResult pause(String channelId, String actorId) {
        return operatorAction(channelId, actorId, "pause", (session, rules) -> {
            if (session.getPhase() != SessionPhase.ACTIVE) {
                return ActionResult.rejected(phaseRejection(session));
            }
            session.setPhase(SessionPhase.PAUSED);
            return ActionResult.ok(GAME_PAUSED);
        });
    }

    @Override
    public ActionResult resume(String channelId, String actorId) {
        return operatorAction(channelId, actorId, "resume", (session, rules) -> {
            if (!session.isPaused()) {
                return ActionResult.rejected(GAME_NOT_PAUSED);
            }
            session.setPhase(SessionPhase.ACTIVE);
            return ActionResult.ok(GAME_RESUMED);
        });
    }

    // ==================== 参与者 ====================

    @Override
    public ActionResult join(String channelId, String actorId, String participantId, String role) {
        return operatorAction(channelId, actorId, "join", (session, rules) -> {
            if (session.isEnded()) {
                return ActionResult.rejected(GAME_ALREADY_ENDED);
            }
            Optional<Participant> present = session.find(participantId);
            if (present.isPresent()) {
                Participant p = present.get();
                if (!callRules(rules, "join", () -> rules.isForfeited(session, participantId))) {
                    return ActionResult.rejected(format(ALREADY_IN_GAME, mention(participantId)));
                }
                callRules(rules, "rejoin", () -> {
                    rules.onParticipantRejoined(session, p);
                    return null;
                });
                log.info("Participant rejoined: channel={} id={} seq={}", channelId, participantId, p.getSequence());
                return ActionResult.board(format(PLAYER_REJOINED, mention(participantId), p.getSequence(), p.getCoordinate()), participantId);
            }
            String canonicalRole = null;
            if (StringUtils.isNotBlank(role)) {
                Optional<String> resolved = characterPool.resolve(role);
                if (resolved.isEmpty()) {
                    return ActionResult.rejected(format(UNKNOWN_CHARACTER, role));
                }
                canonicalRole = resolved.get();
            }
            Participant p = session.addParticipant(participantId);
            String assigned = canonicalRole;
            callRules(rules, "join", () -> {
                rules.onParticipantAdded(session, p);
                if (assigned != null) {
                    p.setRole(assigned);
                    rules.onRoleAssigned(session, p, null);
                }
                return null;
            });
            log.info("Participant joined: channel={} id={} seq={} role={}", channelId, participantId, p.getSequence(), assigned);
            return ActionResult.board(format(PLAYER_JOINED, mention(participantId), p.getSequence()), participantId);
        });
    }

    @Override
    public ActionResult forfeit(String channelId, String actorId, String participantId) {
        return guarded(channelId, "forfeit", (session, rules) -> {
            String target = StringUtils.defaultIfBlank(participantId, actorId);
            if (!target.equals(actorId) && !session.isOperator(actorId)) {
                return ActionResult.rejected(ONLY_OPERATOR);
            }
            Optional<Participant> p = session.find(target);
            if (p.isEmpty()) {
                return ActionResult.rejected(format(NOT_IN_GAME, mention(target)));
            }
            if (callRules(rules, "forfeit", () -> rules.isForfeited(session, target))) {
                return ActionResult.rejected(format(ALREADY_FORFEITED, mention(target)));
            }
            callRules(rules, "forfeit", () -> {
                rules.forfeit(session, target);
                return null;
            });
            log.info("Participant forfeited: channel={} id={}", channelId, target);
            StringBuilder msg = new StringBuilder(format(PLAYER_FORFEITED, mention(target), p.get().getSequence()));
            List<String> notices = new ArrayList<>();
            if (session.getPhase() == SessionPhase.ACTIVE) {
                settleAfterChange(session, rules, "forfeit", msg, notices);
            }
            return withNotices(ActionResult.board(msg.toString()), notices);
        });
    }

    @Override
    public ActionResult assignRole(String channelId, String actorId, String participantId, String role) {
        return operatorAction(channelId, actorId, "assign", (session, rules) -> {
            Optional<Participant> p = session.find(participantId);
            if (p.isEmpty()) {
                return ActionResult.rejected(format(NOT_IN_GAME, mention(participantId)));
            }
            Optional<String> resolved = characterPool.resolve(role);
            if (resolved.isEmpty()) {
                return ActionResult.rejected(format(UNKNOWN_CHARACTER, role));
            }
            Participant participant = p.get();
            String previous = participant.getRole();
            participant.setRole(resolved.get());
            callRules(rules, "assign", () -> {
                rules.onRoleAssigned(session, participant, previous);
                return null;
            });
            return ActionResult.board(format(ROLE_ASSIGNED, mention(participantId), resolved.get()), participantId);
        });
    }

    @Override
    public ActionResult swap(String channelId, String actorId, String firstId, String secondId, boolean permanent) {
        return operatorAction(channelId, actorId, permanent ? "pswap" : "swap", (session, rules) -> {
            if (firstId.equals(secondId)) {
                return ActionResult.rejected(format(SWAP_SELF, mention(firstId)));
            }
            for (String id : List.of(firstId, secondId)) {
                if (session.find(id).isEmpty()) {
                    return ActionResult.rejected(format(NOT_IN_GAME, mention(id)));
                }
            }
            swapCoordinator.exchange(session, firstId, secondId, permanent,
                    p -> syncCoordinate(session, rules, p));
            return ActionResult.board(format(permanent ? ROLES_SWAPPED_PERMANENT : ROLES_SWAPPED,
                    mention(firstId), mention(secondId)));
        });
    }

    @Override
    public ActionResult unswap(String channelId, String actorId, String participantId) {
        return operatorAction(channelId, actorId, "unswap", (session, rules) -> {
            if (session.find(participantId).isEmpty()) {
                return ActionResult.rejected(format(NOT_IN_GAME, mention(participantId)));
            }
            List<SwapPair> chain = swapCoordinator.buildChain(session, participantId);
            if (chain.isEmpty()) {
                return ActionResult.rejected(format(NOT_SWAPPED, mention(participantId)));
            }
            swapCoordinator.revertChain(session, chain, p -> syncCoordinate(session, rules, p));
            return ActionResult.board(format(SWAP_REVERTED, chain.size()), participantId);
        });
    }

    @Override
    public ActionResult moveToken(String channelId, String actorId, String participantId, String coordinate) {
        return operatorAction(channelId, actorId, "move", (session, rules) -> {
            if (session.isEnded()) {
                return ActionResult.rejected(GAME_ALREADY_ENDED);
            }
            Optional<Participant> p = session.find(participantId);
            if (p.isEmpty()) {
                return ActionResult.rejected(format(NOT_IN_GAME, mention(participantId)));
            }
            Optional<String> invalid = callRules(rules, "move", () -> rules.validatePlacement(session, coordinate));
            if (invalid.isPresent()) {
                return ActionResult.rejected(invalid.get());
            }
            StringBuilder msg = new StringBuilder(callRules(rules, "move",
                    () -> rules.placeAt(session, p.get(), coordinate)));
            List<String> notices = new ArrayList<>();
            if (session.getPhase() == SessionPhase.ACTIVE) {
                settleAfterChange(session, rules, "move", msg, notices);
            }
            return withNotices(ActionResult.board(msg.toString(), participantId), notices);
        });
    }

    // ==================== 掷骰 ====================

    @Override
    public ActionResult act(String channelId, String actorId, String participantId, Integer forcedRoll) {
        return guarded(channelId, "roll", (session, rules) -> {
            if (session.getPhase() != SessionPhase.ACTIVE) {
                return ActionResult.rejected(phaseRejection(session));
            }
            String target = StringUtils.defaultIfBlank(participantId, actorId);
            if ((!target.equals(actorId) || forcedRoll != null) && !session.isOperator(actorId)) {
                return ActionResult.rejected(ACT_FOR_OTHERS);
            }
            Optional<Participant> found = session.find(target);
            if (found.isEmpty()) {
                return ActionResult.rejected(format(NOT_IN_GAME, mention(target)));
            }
            int sides = rules.dieSides();
            if (forcedRoll != null && (forcedRoll < 1 || forcedRoll > sides)) {
                return ActionResult.rejected(format(FORCED_ROLL_RANGE, sides));
            }
            StringBuilder msg = new StringBuilder();
            List<String> notices = new ArrayList<>();
            if (session.isCycleClosePending()) {
                closeCycle(session, rules, msg, notices);
                if (session.isCycleClosePending()) {
                    return withNotices(ActionResult.rejected(format(RULE_FAILURE, rules.gameType(), "roll")), notices);
                }
            }
            Eligibility eligibility = callRules(rules, "roll", () -> rules.checkEligibility(session, target));
            if (!eligibility.allowed()) {
                if (msg.length() == 0) {
                    return ActionResult.rejected(eligibility.reason());
                }
                // 补结算已经改变了回合，结算本身要发出去
                return ActionResult.board(msg.append("\n\n").append(eligibility.reason()).toString().strip());
            }
            int roll = forcedRoll != null ? forcedRoll : ThreadLocalRandom.current().nextInt(1, sides + 1);
            Participant p = found.get();
            MoveOutcome outcome = callRules(rules, "roll", () -> rules.resolveMove(session, p, roll));

            // 到这里移动已生效，后续结算失败只通知房主，不回滚
            if (msg.length() > 0) {
                msg.append("\n\n");
            }
            msg.append(outcome.message());
            if (outcome.gameEnded()) {
                finish(session, rules);
            } else if (outcome.cycleComplete()) {
                closeCycle(session, rules, msg, notices);
            }
            return withNotices(ActionResult.board(msg.toString().strip(), target), notices);
        });
    }

    @Override
    public ActionResult listParticipants(String channelId) {
        return guarded(channelId, "list", (session, rules) ->
                ActionResult.ok(callRules(rules, "list", () -> rules.describeParticipants(session))));
    }

    @Override
    public ActionResult setDisplay(String channelId, String actorId, String participantId, DisplayField field, String value) {
        return operatorAction(channelId, actorId, "display", (session, rules) -> {
            Optional<Participant> p = session.find(participantId);
            if (p.isEmpty()) {
                return ActionResult.rejected(format(NOT_IN_GAME, mention(participantId)));
            }
            String v = StringUtils.trimToNull(value);
            if (field == DisplayField.BACKGROUND) {
                p.get().getDisplay().setBackground(v);
            } else {
                p.get().getDisplay().setOutfit(v);
            }
            return ActionResult.board(format(DISPLAY_UPDATED, field.name().toLowerCase(), mention(participantId)), participantId);
        });
    }

    // ==================== 存档 ====================

    @Override
    public ActionResult save(String channelId, String actorId) {
        return operatorAction(channelId, actorId, "save", (session, rules) -> {
            SessionSnapshot snapshot = callRules(rules, "save", () -> SessionSnapshotConverter.toSnapshot(session, rules));
            try {
                SnapshotInfo info = snapshotRepository.saveManual(snapshot);
                log.info("Manual save: channel={} id={}", channelId, info.getSnapshotId());
                return ActionResult.ok(format(SAVED, info.getSnapshotId()));
            } catch (RuntimeException e) {
                log.warn("Manual save failed: channel={}", channelId, e);
                return ActionResult.rejected(SAVE_FAILED);
            }
        });
    }

    @Override
    public ActionResult listSnapshots(String channelId, String actorId) {
        return operatorAction(channelId, actorId, "saves", (session, rules) -> {
            List<SnapshotInfo> infos;
            try {
                infos = snapshotRepository.list(channelId);
            } catch (RuntimeException e) {
                log.warn("Listing snapshots failed: channel={}", channelId, e);
                return ActionResult.rejected(format(LOAD_FAILED, "the snapshot list"));
            }
            if (infos.isEmpty()) {
                return ActionResult.ok(NO_SNAPSHOTS);
            }
            String lines = infos.stream()
                    .map(i -> format(SNAPSHOT_LINE, i.getSnapshotId(), i.getKind().name().toLowerCase(),
                            i.getTurnCount(), i.getParticipantCount(), Instant.ofEpochMilli(i.getSavedAt())))
                    .collect(Collectors.joining("\n"));
            return ActionResult.ok(lines);
        });
    }

    @Override
    public ActionResult load(String channelId, String actorId, String snapshotId) {
        return operatorAction(channelId, actorId, "load", (current, currentRules) -> {
            String id = StringUtils.trimToEmpty(snapshotId).toLowerCase();
            try {
                SnapshotKind.fromId(id);
            } catch (IllegalArgumentException e) {
                return ActionResult.rejected(format(SNAPSHOT_NOT_FOUND, snapshotId));
            }
            Optional<SessionSnapshot> stored;
            try {
                stored = snapshotRepository.load(channelId, id);
            } catch (RuntimeException e) {
                log.warn("Loading snapshot failed: channel={} id={}", channelId, id, e);
                return ActionResult.rejected(format(LOAD_FAILED, id));
            }
            if (stored.isEmpty()) {
                return ActionResult.rejected(format(SNAPSHOT_NOT_FOUND, id));
            }
            SessionSnapshot snapshot = stored.get();
            Optional<RuleEngine> engine = registry.find(snapshot.getGameType());
            if (engine.isEmpty()) {
                return ActionResult.rejected(format(SNAPSHOT_TYPE_UNSUPPORTED, id, snapshot.getGameType()));
            }
            RuleEngine rules = engine.get();
            snapshot.setSessionId(channelId);
            if (StringUtils.isBlank(snapshot.getOperatorId())) {
                snapshot.setOperatorId(actorId);
            }
            List<String> warnings = new ArrayList<>();
            Session restored = callRules(rules, "load", () -> SessionSnapshotConverter.restore(snapshot, rules, warnings));
            sessions.put(channelId, restored);
            log.info("Snapshot loaded: channel={} id={} participants={} warnings={}",
                    channelId, id, restored.getParticipants().size(), warnings.size());
            ActionResult result = ActionResult.board(format(LOADED, id, restored.getTurnCount()));
            if (!warnings.isEmpty()) {
                warnings.forEach(w -> log.warn("Snapshot {} of channel {} sanitized: {}", id, channelId, w));
                result = result.withOperatorNotice(format(SNAPSHOT_REPAIRED, id, warnings.size(), String.join("\n", warnings)));
            }
            return result;
        });
    }

    @Override
    public Optional<SnapshotInfo> autosave(String channelId) {
        Session session = sessions.get(channelId);
        if (session == null) return Optional.empty();
        Optional<RuleEngine> rules = registry.find(session.getGameType());
        return rules.flatMap(r -> autosaveQuietly(session, r));
    }

    // ==================== 查询 ====================

    @Override
    public Optional<RenderedBoard> render(String channelId, RenderContext context) {
        Session session = sessions.get(channelId);
        if (session == null) return Optional.empty();
        RuleEngine rules = registry.require(session.getGameType());
        return Optional.of(renderer.render(session, rules.grid(), context));
    }

    @Override
    public SessionView view(String channelId) {
        Session session = sessions.get(channelId);
        if (session == null) {
            throw new NoSuchElementException("No session for channel " + channelId);
        }
        RuleEngine rules = registry.require(session.getGameType());
        List<SessionView.ParticipantView> participants = session.bySequence().stream()
                .map(p -> new SessionView.ParticipantView(p.getId(), p.getSequence(), p.getRole(), p.getCoordinate(),
                        p.getDisplay().getBackground(), p.getDisplay().getOutfit(), p.getSwappedWith(),
                        rules.isForfeited(session, p.getId())))
                .toList();
        return new SessionView(session.getId(), session.getGameType(), session.getOperatorId(), session.getPhase(),
                session.getTurnCount(), participants, rules.describeParticipants(session));
    }

    @Override
    public List<SnapshotInfo> snapshots(String channelId) {
        return snapshotRepository.list(channelId);
    }

    @Override
    public Set<String> activeSessionIds() {
        return sessions.values().stream()
                .filter(s -> s.isStarted() && !s.isEnded())
                .map(Session::getId)
                .collect(Collectors.toSet());
    }

    @Override
    public boolean hasSession(String channelId) {
        return sessions.containsKey(channelId);
    }

    @Override
    public Optional<String> operatorOf(String channelId) {
        return Optional.ofNullable(sessions.get(channelId)).map(Session::getOperatorId);
    }

    // ==================== 内部 ====================

    private interface SessionAction {
        ActionResult apply(Session session, RuleEngine rules);
    }

    /** 需要会话存在的操作；插件异常转成提示 */
    private ActionResult guarded(String channelId, String action, SessionAction body) {
        Session session = sessions.get(channelId);
        if (session == null) {
            return ActionResult.rejected(NO_GAME);
        }
        RuleEngine rules = registry.require(session.getGameType());
        try {
            return body.apply(session, rules);
        } catch (RuleEngineException e) {
            logRuleFailure(channelId, e);
            return ActionResult.rejected(format(RULE_FAILURE, e.getGameType(), action))
                    .withOperatorNotice(operatorNotice(e));
        }
    }

    /** 仅房主可执行的操作 */
    private ActionResult operatorAction(String channelId, String actorId, String action, SessionAction body) {
        return guarded(channelId, action, (session, rules) -> session.isOperator(actorId)
                ? body.apply(session, rules)
                : ActionResult.rejected(ONLY_OPERATOR));
    }

    private static <T> T callRules(RuleEngine rules, String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (RuleEngineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RuleEngineException(rules.gameType(), action, e);
        }
    }

    private static void syncCoordinate(Session session, RuleEngine rules, Participant p) {
        callRules(rules, "swap", () -> {
            rules.onCoordinateChanged(session, p);
            return null;
        });
    }

    /** 弃权/手动移动之后：可能终局，也可能本轮已全部行动完 */
    private void settleAfterChange(Session session, RuleEngine rules, String action, StringBuilder msg,
                                   List<String> notices) {
        Optional<WinCheck> checked = followUp(session, rules, action, () -> rules.checkWin(session), notices);
        if (checked.isEmpty()) {
            return;
        }
        WinCheck win = checked.get();
        if (win.message() != null) {
            msg.append('\n').append(win.message());
        }
        if (win.gameEnded()) {
            finish(session, rules);
            return;
        }
        boolean complete = session.isCycleClosePending()
                || followUp(session, rules, action, () -> rules.isCycleComplete(session), notices).orElse(false);
        if (complete) {
            closeCycle(session, rules, msg, notices);
        }
    }

    /** 回合结算；插件失败时挂起，下次掷骰前重试 */
    private void closeCycle(Session session, RuleEngine rules, StringBuilder msg, List<String> notices) {
        Optional<String> summary = followUp(session, rules, "turn summary", () -> rules.advanceCycle(session), notices);
        session.setCycleClosePending(summary.isEmpty());
        if (summary.isPresent()) {
            if (msg.length() > 0) {
                msg.append("\n\n");
            }
            msg.append(summary.get());
            autosaveQuietly(session, rules);
        } else {
            log.warn("Turn summary deferred: channel={} turn={}", session.getId(), session.getTurnCount());
        }
    }

    /** 主操作已生效后的后续步骤：失败只记录并通知房主 */
    private <T> Optional<T> followUp(Session session, RuleEngine rules, String action, Supplier<T> call,
                                     List<String> notices) {
        try {
            return Optional.ofNullable(callRules(rules, action, call));
        } catch (RuleEngineException e) {
            logRuleFailure(session.getId(), e);
            notices.add(operatorNotice(e));
            return Optional.empty();
        }
    }

    private static void logRuleFailure(String channelId, RuleEngineException e) {
        log.error("Rule engine failure: channel={} type={} action={}", channelId, e.getGameType(), e.getAction(), e.getCause());
    }

    private static String operatorNotice(RuleEngineException e) {
        return format(RULE_FAILURE_OPERATOR, e.getGameType(), e.getAction(), String.valueOf(e.getCause().getMessage()));
    }

    private static ActionResult withNotices(ActionResult result, List<String> notices) {
        return notices.isEmpty() ? result : result.withOperatorNotice(String.join("\n", notices));
    }

    /** 自动终局：会话保留到 !end，只是不再接受行动 */
    private void finish(Session session, RuleEngine rules) {
        session.setPhase(SessionPhase.ENDED);
        log.info("Game over: channel={} turn={}", session.getId(), session.getTurnCount());
        autosaveQuietly(session, rules);
    }

    private Optional<SnapshotInfo> autosaveQuietly(Session session, RuleEngine rules) {
        try {
            SnapshotInfo info = snapshotRepository.saveAuto(SessionSnapshotConverter.toSnapshot(session, rules));
            log.debug("Autosaved channel={} as {}", session.getId(), info.getSnapshotId());
            return Optional.of(info);
        } catch (RuntimeException e) {
            log.warn("Autosave failed: channel={}", session.getId(), e);
            return Optional.empty();
        }
    }

    private void deleteSnapshotsQuietly(String channelId) {
        try {
            snapshotRepository.deleteAll(channelId);
        } catch (RuntimeException e) {
            log.warn("Deleting snapshots failed: channel={}", channelId, e);
        }
    }

    private static String phaseRejection(Session session) {
        return switch (session.getPhase()) {
            case NOT_STARTED -> GAME_NOT_STARTED;
            case PAUSED -> GAME_PAUSED;
            case ENDED -> GAME_ALREADY_ENDED;
            case ACTIVE -> GAME_ALREADY_STARTED;
        };
    }

    private static String mention(String userId) {
        return "<@" + userId + ">";
    }
}
