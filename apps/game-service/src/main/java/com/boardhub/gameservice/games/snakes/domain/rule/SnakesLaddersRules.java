package com.boardhub.gameservice.games.snakes.domain.rule;

import com.boardhub.gameservice.engine.core.Eligibility;
import com.boardhub.gameservice.engine.core.MoveOutcome;
import com.boardhub.gameservice.engine.core.MoveOutcome.Redirect;
import com.boardhub.gameservice.engine.core.RuleData;
import com.boardhub.gameservice.engine.core.RuleEngine;
import com.boardhub.gameservice.engine.core.WinCheck;
import com.boardhub.gameservice.games.board.application.SnapshotSanitizer;
import com.boardhub.gameservice.games.board.domain.model.Participant;
import com.boardhub.gameservice.games.board.domain.model.Session;
import com.boardhub.gameservice.games.board.domain.model.SessionPhase;
import com.boardhub.gameservice.games.board.domain.rule.BoardGrid;
import com.boardhub.gameservice.games.snakes.config.SnakesLaddersProperties;
import com.boardhub.gameservice.games.snakes.domain.model.SnakesLaddersData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 蛇梯棋规则。
 *
 * 轮次：按 turnOrder 顺序，跳过弃权/本轮已掷/已到终点的人，第一个剩下的人才能掷骰。
 * 移动：new = min(cur + roll, goal)；落在蛇头/梯底时重定向一次（不连锁）。
 * 胜负：任何人首次到达终点时记下“当前回合数”（回合数推进之前），弃权者也一样；
 *      所有参与者（含弃权者）都到达终点时终局，胜者 = 记录回合数最小且未弃权的那批人（同回合并列）。
 * 弃权：只从胜者资格中移除，仍保留在回合顺序与棋盘上。
 */
@Slf4j
@Component
public class SnakesLaddersRules implements RuleEngine {

    private final SnakesLaddersProperties props;
    private final BoardGrid grid;

    public SnakesLaddersRules(SnakesLaddersProperties props) {
        props.validate();
        this.props = props;
        this.grid = new BoardGrid(props.getRows(), props.getCols());
    }

    @Override
    public String gameType() {
        return SnakesLaddersData.TYPE;
    }

    @Override
    public RuleData newData() {
        return new SnakesLaddersData();
    }

    @Override
    public BoardGrid grid() {
        return grid;
    }

    @Override
    public int dieSides() {
        return props.getDieSides();
    }

    // ==================== 参与者生命周期 ====================

    @Override
    public void onParticipantAdded(Session session, Participant participant) {
        SnakesLaddersData data = data(session);
        String id = participant.getId();
        if (!data.getTiles().containsKey(id)) {
            data.getTiles().put(id, props.getStartingTile());
        }
        participant.setCoordinate(coordinateOf(data.getTiles().get(id)));
        data.getTransformationCounts().putIfAbsent(id, 0);
        // 新人按序号追加；已存在则保持原位置，开局后不重排
        if (!data.getTurnOrder().contains(id)) {
            data.getTurnOrder().add(id);
        }
        log.debug("onParticipantAdded: session={} id={} seq={} tile={}",
                session.getId(), id, participant.getSequence(), data.getTiles().get(id));
    }

    @Override
    public void onParticipantRejoined(Session session, Participant participant) {
        SnakesLaddersData data = data(session);
        String id = participant.getId();
        data.getForfeited().remove(id);
        int tile = data.tileOf(id, props.getStartingTile());
        data.getTiles().put(id, tile);
        participant.setCoordinate(coordinateOf(tile));
        if (!data.getTurnOrder().contains(id)) {
            data.getTurnOrder().add(id);
        }
        // 弃权前已到达终点的，恢复胜者资格
        if (data.getGoalReachedTurn().containsKey(id) && !data.isGameEnded()) {
            data.getWinners().add(id);
        }
        log.debug("onParticipantRejoined: session={} id={} tile={}", session.getId(), id, tile);
    }

    @Override
    public void onRoleAssigned(Session session, Participant participant, String previousRole) {
        SnakesLaddersData data = data(session);
        String id = participant.getId();
        if (data.getOriginalRoles().get(id) == null) {
            data.getOriginalRoles().put(id, participant.getRole());
        } else if (previousRole != null) {
            data.getTransformationCounts().merge(id, 1, Integer::sum);
        }
    }

    @Override
    public void onCoordinateChanged(Session session, Participant participant) {
        OptionalInt tile = grid.alphanumericToTile(participant.getCoordinate());
        if (tile.isPresent()) {
            data(session).getTiles().put(participant.getId(), Math.min(tile.getAsInt(), props.getGoalTile()));
        }
    }

    @Override
    public boolean isForfeited(Session session, String participantId) {
        return data(session).getForfeited().contains(participantId);
    }

    @Override
    public void forfeit(Session session, String participantId) {
        SnakesLaddersData data = data(session);
        data.getForfeited().add(participantId);
        data.getWinners().remove(participantId);
        log.debug("forfeit: session={} id={} keptTile={}", session.getId(), participantId, data.getTiles().get(participantId));
    }

    // ==================== 轮次 ====================

    @Override
    public Eligibility checkEligibility(Session session, String participantId) {
        SnakesLaddersData data = data(session);
        int goal = props.getGoalTile();
        if (data.getWinners().contains(participantId)) {
            return Eligibility.denied(null, "🎉 You've already won! You cannot roll anymore. The game continues for other players.");
        }
        if (data.getForfeited().contains(participantId)) {
            return Eligibility.denied(null, "😔 You've forfeited! You cannot roll anymore. The game continues for other players.");
        }
        if (data.tileOf(participantId, props.getStartingTile()) >= goal) {
            return Eligibility.denied(null, "🎉 You've reached the goal (tile " + goal + ")! You cannot roll anymore.");
        }
        if (data.getActedThisCycle().contains(participantId)) {
            return Eligibility.denied(null, "You've already rolled this turn! Wait for the turn summary.");
        }
        String next = nextEligible(session);
        if (next == null) {
            return Eligibility.denied(null, "All players have rolled! The turn summary is on its way.");
        }
        if (!next.equals(participantId)) {
            Participant waiting = session.getParticipants().get(next);
            return Eligibility.denied(next, "It's not your turn yet! Waiting for Player "
                    + waiting.getSequence() + " (" + waiting.displayName() + ") to roll.");
        }
        return Eligibility.allowed(participantId);
    }

    /** 回合顺序中下一个可行动的参与者；没有返回 null */
    String nextEligible(Session session) {
        SnakesLaddersData data = data(session);
        for (String id : data.getTurnOrder()) {
            if (!session.getParticipants().containsKey(id)) continue;
            if (isEligible(data, id)) return id;
        }
        return null;
    }

    private boolean isEligible(SnakesLaddersData data, String id) {
        return !data.getActedThisCycle().contains(id)
                && !data.getForfeited().contains(id)
                && data.tileOf(id, props.getStartingTile()) < props.getGoalTile();
    }

    @Override
    public boolean isCycleComplete(Session session) {
        SnakesLaddersData data = data(session);
        // 本轮仍“在场”的人：未弃权、未到终点；为空也算完成
        return data.getTurnOrder().stream()
                .filter(id -> session.getParticipants().containsKey(id))
                .filter(id -> !data.getForfeited().contains(id))
                .filter(id -> data.tileOf(id, props.getStartingTile()) < props.getGoalTile())
                .allMatch(id -> data.getActedThisCycle().contains(id));
    }

    @Override
    public String advanceCycle(Session session) {
        SnakesLaddersData data = data(session);
        String summary = leaderboard(session);
        data.getActedThisCycle().clear();
        session.setTurnCount(session.getTurnCount() + 1);
        log.debug("advanceCycle: session={} nextTurn={}", session.getId(), session.getTurnCount());
        return summary + "\n\n**Turn " + session.getTurnCount() + " begins.**";
    }

    // ==================== 移动 ====================

    @Override
    public MoveOutcome resolveMove(Session session, Participant participant, int roll) {
        SnakesLaddersData data = data(session);
        String id = participant.getId();
        int goal = props.getGoalTile();
        int from = data.tileOf(id, props.getStartingTile());
        int landed = Math.min(from + roll, goal);

        List<String> lines = new ArrayList<>();
        lines.add("🎲 " + participant.displayName() + " rolled a " + roll + ". Moved from tile " + from + " to tile " + landed + ".");

        int finalTile = landed;
        Redirect redirect = Redirect.NONE;
        Integer snakeTail = props.getSnakes().get(landed);
        Integer ladderTop = props.getLadders().get(landed);
        if (snakeTail != null) {
            finalTile = snakeTail;
            redirect = Redirect.HAZARD;
            lines.add("🐍 Snake! Slid down from tile " + landed + " to tile " + finalTile + ".");
        } else if (ladderTop != null) {
            finalTile = ladderTop;
            redirect = Redirect.SHORTCUT;
            lines.add("🪜 Ladder! Climbed up from tile " + landed + " to tile " + finalTile + ".");
        }
        log.debug("resolveMove: session={} id={} from={} roll={} landed={} final={} redirect={}",
                session.getId(), id, from, roll, landed, finalTile, redirect);

        data.getTiles().put(id, finalTile);
        participant.setCoordinate(coordinateOf(finalTile));
        if (finalTile > 1 && finalTile < goal) {
            TileColorInfo.describe(finalTile, props).ifPresent(lines::add);
        }

        data.getActedThisCycle().add(id);
        boolean cycleComplete = isCycleComplete(session);
        WinCheck win = checkWin(session);
        if (win.message() != null) {
            lines.add(win.message());
        }
        return new MoveOutcome(from, landed, finalTile, redirect, String.join("\n", lines), cycleComplete, win);
    }

    @Override
    public WinCheck checkWin(Session session) {
        SnakesLaddersData data = data(session);
        int goal = props.getGoalTile();
        int currentTurn = session.getTurnCount();

        // 到达终点即记录回合数，弃权者也记录；只有未弃权者进入胜者集合
        List<String> newlyFinished = new ArrayList<>();
        for (Map.Entry<String, Integer> e : data.getTiles().entrySet()) {
            String id = e.getKey();
            if (e.getValue() < goal) continue;
            if (!data.getGoalReachedTurn().containsKey(id)) {
                data.getGoalReachedTurn().put(id, currentTurn);
                newlyFinished.add(id);
                log.info("Player {} reached goal on turn {} (session={})", id, currentTurn, session.getId());
            }
            if (!data.getForfeited().contains(id)) {
                data.getWinners().add(id);
            }
        }

        // 终局条件覆盖所有参与者：停在终点之前的弃权者同样阻止终局
        List<String> everyone = data.getTurnOrder().stream()
                .filter(id -> session.getParticipants().containsKey(id))
                .toList();
        boolean allAtEnd = !everyone.isEmpty()
                && everyone.stream().allMatch(id -> data.tileOf(id, props.getStartingTile()) >= goal);

        if (allAtEnd) {
            if (data.isGameEnded()) {
                return new WinCheck(newlyFinished, List.copyOf(data.getWinners()), true, null);
            }
            data.setGameEnded(true);
            int earliest = everyone.stream()
                    .map(id -> data.getGoalReachedTurn().getOrDefault(id, currentTurn))
                    .min(Integer::compare)
                    .orElse(currentTurn);
            List<String> finalWinners = everyone.stream()
                    .filter(id -> !data.getForfeited().contains(id))
                    .filter(id -> data.getGoalReachedTurn().getOrDefault(id, currentTurn) == earliest)
                    .toList();
            data.getWinners().clear();
            data.getWinners().addAll(finalWinners);
            return new WinCheck(newlyFinished, finalWinners, true, gameOverMessage(session, finalWinners, earliest));
        }

        List<String> announced = newlyFinished.stream().filter(id -> !data.getForfeited().contains(id)).toList();
        if (!announced.isEmpty()) {
            String names = announced.stream().map(id -> mention(session, id)).collect(Collectors.joining(", "));
            String msg = announced.size() == 1
                    ? "🎉 " + names + " reached the goal (tile " + goal + ") on turn " + currentTurn + "! They cannot roll anymore, but the game continues for others."
                    : "🎉 **WINNERS!** " + names + " have all reached tile " + goal + " on turn " + currentTurn + "! They cannot roll anymore, but the game continues for others.";
            return new WinCheck(newlyFinished, List.copyOf(data.getWinners()), false, msg);
        }
        return WinCheck.none(List.copyOf(data.getWinners()));
    }

    private String gameOverMessage(Session session, List<String> winners, int earliest) {
        SnakesLaddersData data = data(session);
        String mentions = winners.stream()
                .map(id -> mention(session, id) + " (Turn " + data.getGoalReachedTurn().get(id) + ")")
                .collect(Collectors.joining(", "));
        StringBuilder sb = new StringBuilder("🎉 **GAME OVER!** 🎉\n");
        if (winners.isEmpty()) {
            sb.append("**No winner:** the earliest arrival on turn ").append(earliest).append(" had forfeited.\n");
        } else if (winners.size() == 1) {
            sb.append("**🏆 WINNER:** ").append(mentions).append('\n');
        } else {
            sb.append("**🏆 WINNERS (Tied on Turn ").append(earliest).append("):** ").append(mentions).append('\n');
        }
        sb.append("**All players have reached the end!**\n**Final Results:**");
        for (Participant p : session.bySequence()) {
            int tile = data.tileOf(p.getId(), props.getStartingTile());
            sb.append('\n').append(mention(session, p.getId())).append(", Tile ").append(tile);
            if (data.getForfeited().contains(p.getId())) {
                sb.append(", **FORFEIT/QUIT**");
            } else {
                sb.append(", Turn ").append(data.getGoalReachedTurn().getOrDefault(p.getId(), session.getTurnCount()));
            }
        }
        return sb.toString();
    }

    // ==================== 房主手动移动 ====================

    @Override
    public Optional<String> validatePlacement(Session session, String coordinate) {
        OptionalInt tile = grid.alphanumericToTile(coordinate);
        if (tile.isEmpty()) {
            return Optional.of("Invalid coordinate: " + coordinate);
        }
        if (tile.getAsInt() > props.getGoalTile()) {
            return Optional.of("Position " + coordinate + " (tile " + tile.getAsInt() + ") is out of bounds (1-" + props.getGoalTile() + ")");
        }
        return Optional.empty();
    }

    @Override
    public String placeAt(Session session, Participant participant, String coordinate) {
        int tile = grid.alphanumericToTile(coordinate).orElseThrow(
                () -> new IllegalArgumentException("Invalid coordinate: " + coordinate));
        data(session).getTiles().put(participant.getId(), tile);
        participant.setCoordinate(coordinateOf(tile));
        return participant.displayName() + " moved to " + participant.getCoordinate() + " (tile " + tile + ").";
    }

    // ==================== 展示 ====================

    @Override
    public String describeParticipants(Session session) {
        SnakesLaddersData data = data(session);
        if (session.getParticipants().isEmpty()) {
            return "No players in game.";
        }
        StringBuilder sb = new StringBuilder("**Players (turn ").append(session.getTurnCount()).append("):**");
        for (Participant p : session.bySequence()) {
            sb.append('\n').append(line(session, data, p));
        }
        String next = nextEligible(session);
        if (next != null && session.getPhase() == SessionPhase.ACTIVE) {
            sb.append("\nNext to roll: ").append(mention(session, next));
        }
        return sb.toString();
    }

    /** 回合小结：按格号降序 */
    String leaderboard(Session session) {
        SnakesLaddersData data = data(session);
        List<Participant> ranked = session.getParticipants().values().stream()
                .sorted(Comparator.<Participant>comparingInt(p -> data.tileOf(p.getId(), props.getStartingTile()))
                        .reversed()
                        .thenComparingInt(Participant::getSequence))
                .toList();
        StringBuilder sb = new StringBuilder("**Turn ").append(session.getTurnCount()).append(" Complete!**\n\n**Leaderboard:**");
        String[] medals = {"🥇", "🥈", "🥉"};
        for (int i = 0; i < ranked.size(); i++) {
            String rank = i < medals.length ? medals[i] : (i + 1) + ".";
            sb.append('\n').append(rank).append(' ').append(line(session, data, ranked.get(i)));
        }
        return sb.toString();
    }

    private String line(Session session, SnakesLaddersData data, Participant p) {
        StringBuilder sb = new StringBuilder()
                .append("Player ").append(p.getSequence())
                .append(" / ").append(p.getRole() != null ? p.getRole() : "unassigned")
                .append(" / <@").append(p.getId()).append(">")
                .append(": Tile ").append(data.tileOf(p.getId(), props.getStartingTile()));
        if (p.getCoordinate() != null) sb.append(" (").append(p.getCoordinate()).append(')');
        if (data.getWinners().contains(p.getId())) sb.append(" 🏆 WINNER");
        if (data.getForfeited().contains(p.getId())) sb.append(" FORFEIT/QUIT");
        return sb.toString();
    }

    // ==================== 存档 ====================

    @Override
    public Map<String, Object> exportData(Session session) {
        SnakesLaddersData data = data(session);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tiles", new LinkedHashMap<>(data.getTiles()));
        out.put("turnOrder", new ArrayList<>(data.getTurnOrder()));
        out.put("forfeited", new ArrayList<>(data.getForfeited()));
        out.put("acted", new ArrayList<>(data.getActedThisCycle()));
        out.put("winners", new ArrayList<>(data.getWinners()));
        out.put("goalReachedTurn", new LinkedHashMap<>(data.getGoalReachedTurn()));
        out.put("transformationCounts", new LinkedHashMap<>(data.getTransformationCounts()));
        out.put("originalRoles", new LinkedHashMap<>(data.getOriginalRoles()));
        out.put("gameEnded", data.isGameEnded());
        return out;
    }

    @Override
    public RuleData importData(Session session, Map<String, Object> raw, List<String> warnings) {
        Map<String, Object> src = raw == null ? Map.of() : raw;
        Set<String> known = session.getParticipants().keySet();
        SnakesLaddersData data = new SnakesLaddersData();

        SnapshotSanitizer.intMap(src.get("tiles"), known, "tiles", warnings).forEach((id, tile) -> {
            if (tile < 1 || tile > props.getGoalTile()) {
                warnings.add("tiles: " + id + " at out-of-range tile " + tile + " clamped");
                tile = Math.max(1, Math.min(tile, props.getGoalTile()));
            }
            data.getTiles().put(id, tile);
        });
        data.getTurnOrder().addAll(SnapshotSanitizer.idList(src.get("turnOrder"), known, "turnOrder", warnings));
        data.getForfeited().addAll(SnapshotSanitizer.idList(src.get("forfeited"), known, "forfeited", warnings));
        data.getActedThisCycle().addAll(SnapshotSanitizer.idList(src.get("acted"), known, "acted", warnings));
        data.getWinners().addAll(SnapshotSanitizer.idList(src.get("winners"), known, "winners", warnings));
        data.getGoalReachedTurn().putAll(SnapshotSanitizer.intMap(src.get("goalReachedTurn"), known, "goalReachedTurn", warnings));
        data.getTransformationCounts().putAll(SnapshotSanitizer.intMap(src.get("transformationCounts"), known, "transformationCounts", warnings));
        data.getOriginalRoles().putAll(SnapshotSanitizer.stringMap(src.get("originalRoles"), known, "originalRoles", warnings));
        data.setGameEnded(SnapshotSanitizer.bool(src.get("gameEnded")));

        boolean rebuilt = data.getTurnOrder().isEmpty() && !known.isEmpty();
        if (rebuilt) {
            warnings.add("turnOrder was empty although the game has " + known.size() + " participant(s); rebuilt from join order");
        }
        // turnOrder 必须覆盖所有分配过序号的参与者
        for (Participant p : session.bySequence()) {
            if (!data.getTurnOrder().contains(p.getId())) {
                data.getTurnOrder().add(p.getId());
                if (!rebuilt) {
                    warnings.add("turnOrder: missing " + p.getId() + " appended");
                }
            }
            if (!data.getTiles().containsKey(p.getId())) {
                OptionalInt fromCoord = grid.alphanumericToTile(p.getCoordinate());
                int tile = fromCoord.isPresent() ? Math.min(fromCoord.getAsInt(), props.getGoalTile()) : props.getStartingTile();
                data.getTiles().put(p.getId(), tile);
                warnings.add("tiles: missing tile for " + p.getId() + " restored as " + tile);
            }
            p.setCoordinate(coordinateOf(data.getTiles().get(p.getId())));
        }
        // 胜者必须已到终点且未弃权
        data.getWinners().removeIf(id -> {
            if (data.getForfeited().contains(id)) {
                warnings.add("winners: " + id + " has forfeited, dropped");
                return true;
            }
            if (data.tileOf(id, props.getStartingTile()) < props.getGoalTile()) {
                warnings.add("winners: " + id + " has not reached the goal, dropped");
                return true;
            }
            return false;
        });
        return data;
    }

    // ==================== 工具 ====================

    private String coordinateOf(int tile) {
        return grid.tileToAlphanumeric(tile).orElse(null);
    }

    private static String mention(Session session, String id) {
        Participant p = session.getParticipants().get(id);
        return p == null ? "<@" + id + ">" : "<@" + id + "> (" + p.displayName() + " - Player " + p.getSequence() + ")";
    }

    private static SnakesLaddersData data(Session session) {
        if (session.getRuleData() instanceof SnakesLaddersData d) {
            return d;
        }
        throw new IllegalStateException("Session " + session.getId() + " does not carry snakes & ladders data");
    }
}
