package com.boardhub.gameservice.games.snakes.domain.rule;

import com.boardhub.gameservice.engine.core.Eligibility;
import com.boardhub.gameservice.engine.core.MoveOutcome;
import com.boardhub.gameservice.engine.core.MoveOutcome.Redirect;
import com.boardhub.gameservice.engine.core.WinCheck;
import com.boardhub.gameservice.games.board.domain.model.Participant;
import com.boardhub.gameservice.games.board.domain.model.Session;
import com.boardhub.gameservice.games.snakes.SnakesLaddersTestSupport;
import com.boardhub.gameservice.games.snakes.config.SnakesLaddersProperties;
import com.boardhub.gameservice.games.snakes.domain.model.SnakesLaddersData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.boardhub.gameservice.games.snakes.SnakesLaddersTestSupport.activeSession;
import static com.boardhub.gameservice.games.snakes.SnakesLaddersTestSupport.placeOnTile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnakesLaddersRulesTest {

    private SnakesLaddersRules rules;

    @BeforeEach
    void setUp() {
        rules = SnakesLaddersTestSupport.rules();
    }

    private static SnakesLaddersData data(Session session) {
        return (SnakesLaddersData) session.getRuleData();
    }

    @Nested
    class Moves {

        @Test
        void snakeRedirectIsNamedInTheMessage() {
            Session session = activeSession(rules, "a");
            placeOnTile(rules, session, "a", 10);

            MoveOutcome outcome = rules.resolveMove(session, session.require("a"), 6);

            assertThat(outcome.landedTile()).isEqualTo(16);
            assertThat(outcome.finalTile()).isEqualTo(6);
            assertThat(outcome.redirect()).isEqualTo(Redirect.HAZARD);
            assertThat(outcome.message()).contains("Snake").contains("16").contains("6");
            assertThat(session.require("a").getCoordinate()).isEqualTo("F1");
            assertThat(data(session).getTiles()).containsEntry("a", 6);
        }

        @Test
        void ladderClimbsUp() {
            Session session = activeSession(rules, "a");

            MoveOutcome outcome = rules.resolveMove(session, session.require("a"), 3);

            assertThat(outcome.redirect()).isEqualTo(Redirect.SHORTCUT);
            assertThat(outcome.finalTile()).isEqualTo(14);
            assertThat(outcome.message()).contains("Ladder");
        }

        @Test
        void colouredTileAddsAnInfoLine() {
            Session session = activeSession(rules, "a");

            MoveOutcome outcome = rules.resolveMove(session, session.require("a"), 6);

            assertThat(outcome.finalTile()).isEqualTo(7);
            assertThat(outcome.message()).contains("Landed on a Yellow tile - The operator may give you a new outfit.");
        }

        @Test
        void overshootIsClampedToTheGoal() {
            Session session = activeSession(rules, "a", "b");
            placeOnTile(rules, session, "a", 97);

            MoveOutcome outcome = rules.resolveMove(session, session.require("a"), 6);

            assertThat(outcome.landedTile()).isEqualTo(100);
            assertThat(outcome.win().newlyFinished()).containsExactly("a");
            assertThat(outcome.gameEnded()).isFalse();
        }
    }

    @Nested
    class Turns {

        @Test
        void onlyTheNextInTurnOrderMayRoll() {
            Session session = activeSession(rules, "a", "b");

            Eligibility forB = rules.checkEligibility(session, "b");
            assertThat(forB.allowed()).isFalse();
            assertThat(forB.nextParticipantId()).isEqualTo("a");
            assertThat(forB.reason()).contains("Waiting for Player 1");

            assertThat(rules.checkEligibility(session, "a").allowed()).isTrue();
            rules.resolveMove(session, session.require("a"), 2);

            assertThat(rules.checkEligibility(session, "a").reason()).contains("already rolled");
            assertThat(rules.checkEligibility(session, "b").allowed()).isTrue();
        }

        @Test
        void cycleCompletesWhenEveryoneHasActed() {
            Session session = activeSession(rules, "a", "b");

            MoveOutcome first = rules.resolveMove(session, session.require("a"), 2);
            MoveOutcome second = rules.resolveMove(session, session.require("b"), 2);

            assertThat(first.cycleComplete()).isFalse();
            assertThat(second.cycleComplete()).isTrue();

            String summary = rules.advanceCycle(session);
            assertThat(summary).contains("Turn 1 Complete!").contains("Leaderboard").contains("Turn 2 begins.");
            assertThat(session.getTurnCount()).isEqualTo(2);
            assertThat(data(session).getActedThisCycle()).isEmpty();
            assertThat(rules.checkEligibility(session, "a").allowed()).isTrue();
        }
    }

    @Nested
    class Winners {

        @Test
        void arrivalsOnTheSameTurnAreCoWinners() {
            Session session = activeSession(rules, "a", "b");
            placeOnTile(rules, session, "a", 98);
            placeOnTile(rules, session, "b", 97);

            MoveOutcome first = rules.resolveMove(session, session.require("a"), 2);
            assertThat(first.gameEnded()).isFalse();
            assertThat(first.message()).contains("reached the goal");

            MoveOutcome second = rules.resolveMove(session, session.require("b"), 5);

            assertThat(second.gameEnded()).isTrue();
            assertThat(second.win().winners()).containsExactlyInAnyOrder("a", "b");
            assertThat(second.message()).contains("WINNERS (Tied on Turn 1)");
            assertThat(data(session).getGoalReachedTurn()).containsEntry("a", 1).containsEntry("b", 1);
        }

        @Test
        void laterArrivalDoesNotWin() {
            Session session = activeSession(rules, "a", "b", "c");
            placeOnTile(rules, session, "a", 98);
            placeOnTile(rules, session, "b", 98);
            placeOnTile(rules, session, "c", 98);

            rules.resolveMove(session, session.require("a"), 2);
            rules.resolveMove(session, session.require("b"), 2);
            MoveOutcome cLags = rules.resolveMove(session, session.require("c"), 1);
            assertThat(cLags.cycleComplete()).isTrue();
            rules.advanceCycle(session);

            MoveOutcome cFinishes = rules.resolveMove(session, session.require("c"), 1);

            assertThat(cFinishes.gameEnded()).isTrue();
            assertThat(cFinishes.win().winners()).containsExactlyInAnyOrder("a", "b");
            assertThat(data(session).getGoalReachedTurn()).containsEntry("c", 2);
            assertThat(data(session).getWinners()).doesNotContain("c");
        }

        @Test
        void forfeitedParticipantBelowTheGoalBlocksTheEnd() {
            Session session = activeSession(rules, "a", "b");
            rules.forfeit(session, "b");
            placeOnTile(rules, session, "a", 98);

            MoveOutcome outcome = rules.resolveMove(session, session.require("a"), 2);

            assertThat(outcome.gameEnded()).isFalse();
            assertThat(data(session).getGoalReachedTurn()).containsEntry("a", 1);
            assertThat(data(session).getWinners()).containsExactly("a");
            assertThat(data(session).getTiles()).containsEntry("b", 1);
        }

        @Test
        void forfeitedParticipantAtTheGoalIsStampedButNeverWins() {
            Session session = activeSession(rules, "a", "b");
            rules.forfeit(session, "b");
            placeOnTile(rules, session, "b", 100);

            WinCheck check = rules.checkWin(session);

            assertThat(check.gameEnded()).isFalse();
            assertThat(data(session).getGoalReachedTurn()).containsEntry("b", 1);
            assertThat(data(session).getWinners()).doesNotContain("b");

            placeOnTile(rules, session, "a", 98);
            MoveOutcome outcome = rules.resolveMove(session, session.require("a"), 2);

            assertThat(outcome.gameEnded()).isTrue();
            assertThat(outcome.win().winners()).containsExactly("a");
            assertThat(outcome.message()).contains("FORFEIT/QUIT");
        }

        @Test
        void earliestArrivalThatForfeitedLeavesNoWinner() {
            Session session = activeSession(rules, "a", "b");
            placeOnTile(rules, session, "b", 100);
            rules.checkWin(session);
            rules.forfeit(session, "b");
            session.setTurnCount(3);
            placeOnTile(rules, session, "a", 98);

            MoveOutcome outcome = rules.resolveMove(session, session.require("a"), 2);

            assertThat(outcome.gameEnded()).isTrue();
            assertThat(outcome.win().winners()).isEmpty();
            assertThat(data(session).getGoalReachedTurn()).containsEntry("a", 3).containsEntry("b", 1);
            assertThat(outcome.message()).contains("No winner");
        }

        @Test
        void nobodyWinsWhileEveryoneHasForfeited() {
            Session session = activeSession(rules, "a");
            rules.forfeit(session, "a");

            WinCheck check = rules.checkWin(session);

            assertThat(check.gameEnded()).isFalse();
            assertThat(check.winners()).isEmpty();
        }
    }

    @Nested
    class Forfeits {

        @Test
        void forfeitKeepsTurnOrderAndPosition() {
            Session session = activeSession(rules, "a", "b", "c");
            placeOnTile(rules, session, "b", 42);

            rules.forfeit(session, "b");

            assertThat(data(session).getTurnOrder()).containsExactly("a", "b", "c");
            assertThat(data(session).getTiles()).containsEntry("b", 42);
            assertThat(rules.isForfeited(session, "b")).isTrue();

            rules.resolveMove(session, session.require("a"), 1);
            assertThat(rules.nextEligible(session)).isEqualTo("c");
            assertThat(rules.checkEligibility(session, "b").reason()).contains("forfeited");
        }

        @Test
        void rejoinRestoresLastKnownPosition() {
            Session session = activeSession(rules, "a", "b");
            placeOnTile(rules, session, "b", 42);
            rules.forfeit(session, "b");

            Participant b = session.require("b");
            b.setCoordinate(null);
            rules.onParticipantRejoined(session, b);

            assertThat(rules.isForfeited(session, "b")).isFalse();
            assertThat(b.getSequence()).isEqualTo(2);
            assertThat(b.getCoordinate()).isEqualTo(rules.grid().tileToAlphanumeric(42).orElseThrow());
        }
    }

    @Test
    void placementOutsideTheBoardIsRejected() {
        Session session = activeSession(rules, "a");

        assertThat(rules.validatePlacement(session, "K1"))
                .hasValueSatisfying(reason -> assertThat(reason).contains("Invalid coordinate"));
        assertThat(rules.validatePlacement(session, "C7")).isEmpty();
    }

    @Test
    void placementBeyondTheGoalIsRejected() {
        SnakesLaddersProperties props = SnakesLaddersTestSupport.props();
        props.setGoalTile(50);
        SnakesLaddersRules shortGame = new SnakesLaddersRules(props);
        Session session = activeSession(shortGame, "a");

        assertThat(shortGame.validatePlacement(session, "A10"))
                .hasValueSatisfying(reason -> assertThat(reason).contains("out of bounds (1-50)"));
    }

    @Test
    void roleReassignmentsAreCountedPerIdentity() {
        Session session = activeSession(rules, "a");
        Participant a = session.require("a");

        a.setRole("Alice");
        rules.onRoleAssigned(session, a, null);
        a.setRole("Bob");
        rules.onRoleAssigned(session, a, "Alice");

        assertThat(data(session).getOriginalRoles()).containsEntry("a", "Alice");
        assertThat(data(session).getTransformationCounts()).containsEntry("a", 1);
    }

    @Test
    void inconsistentConfigurationFailsFast() {
        SnakesLaddersProperties props = SnakesLaddersTestSupport.props();
        props.getSnakes().put(30, 40);

        assertThatThrownBy(() -> new SnakesLaddersRules(props))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("snake 30->40");
    }

    @Nested
    class Import {

        @Test
        void dirtyDataIsSanitized() {
            Session session = activeSession(rules, "a", "b");
            Map<String, Object> raw = new LinkedHashMap<>();
            Map<String, Object> tiles = new LinkedHashMap<>();
            tiles.put("a", "12");
            tiles.put("b", 500);
            tiles.put("ghost", 3);
            raw.put("tiles", tiles);
            raw.put("turnOrder", List.of());
            raw.put("forfeited", List.of("b", "b", "ghost"));
            raw.put("winners", "not-a-list");
            List<String> warnings = new ArrayList<>();

            SnakesLaddersData data = (SnakesLaddersData) rules.importData(session, raw, warnings);

            assertThat(data.getTiles()).containsEntry("a", 12).containsEntry("b", 100).doesNotContainKey("ghost");
            assertThat(data.getTurnOrder()).containsExactly("a", "b");
            assertThat(data.getForfeited()).containsExactly("b");
            assertThat(data.getWinners()).isEmpty();
            assertThat(session.require("a").getCoordinate()).isEqualTo(rules.grid().tileToAlphanumeric(12).orElseThrow());
            assertThat(warnings)
                    .anyMatch(w -> w.contains("turnOrder was empty"))
                    .anyMatch(w -> w.contains("ghost"))
                    .anyMatch(w -> w.contains("clamped"))
                    .anyMatch(w -> w.contains("duplicate b"))
                    .anyMatch(w -> w.contains("winners: expected a list"));
        }

        @Test
        void winnersMustHaveReachedTheGoalWithoutForfeiting() {
            Session session = activeSession(rules, "a", "b", "c");
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("tiles", Map.of("a", 100, "b", 100, "c", 5));
            raw.put("turnOrder", List.of("a", "b", "c"));
            raw.put("forfeited", List.of("b"));
            raw.put("winners", List.of("a", "b", "c"));
            List<String> warnings = new ArrayList<>();

            SnakesLaddersData data = (SnakesLaddersData) rules.importData(session, raw, warnings);

            assertThat(data.getWinners()).containsExactly("a");
            assertThat(warnings)
                    .contains("winners: b has forfeited, dropped")
                    .contains("winners: c has not reached the goal, dropped");
        }

        @Test
        void missingDataIsRebuiltFromCoordinates() {
            Session session = activeSession(rules, "a");
            session.require("a").setCoordinate("C7");
            List<String> warnings = new ArrayList<>();

            SnakesLaddersData data = (SnakesLaddersData) rules.importData(session, null, warnings);

            assertThat(data.getTiles()).containsEntry("a", 63);
            assertThat(data.getTurnOrder()).containsExactly("a");
            assertThat(warnings).isNotEmpty();
        }

        @Test
        void exportedDataImportsCleanly() {
            Session session = activeSession(rules, "a", "b");
            rules.resolveMove(session, session.require("a"), 2);
            rules.forfeit(session, "b");
            List<String> warnings = new ArrayList<>();

            SnakesLaddersData data = (SnakesLaddersData) rules.importData(session, rules.exportData(session), warnings);

            assertThat(warnings).isEmpty();
            assertThat(data.getTiles()).containsEntry("a", 3).containsEntry("b", 1);
            assertThat(data.getActedThisCycle()).containsExactly("a");
            assertThat(data.getForfeited()).containsExactly("b");
        }
    }
}
