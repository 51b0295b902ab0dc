package com.boardhub.gameservice.games.board.domain.constants;

/**
 * 棋盘游戏相关的消息常量
 * 统一管理所有发到频道/私信里的提示文本，避免硬编码
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 会话生命周期 ==========

    public static final String NO_GAME = "No game is running in this channel.";

    public static final String GAME_ALREADY_RUNNING = "A %s game is already running in this channel.";

    public static final String UNKNOWN_GAME_TYPE = "Unknown game type: %s. Available: %s";

    public static final String GAME_CREATED = "New %s game created. Add players with !join, then !begin.";

    public static final String GAME_BEGUN = "The game has begun! Turn %d.";

    public static final String GAME_NOT_STARTED = "The game has not started yet.";

    public static final String GAME_ALREADY_STARTED = "The game has already started.";

    public static final String GAME_PAUSED = "The game is paused.";

    public static final String GAME_RESUMED = "The game has resumed.";

    public static final String GAME_NOT_PAUSED = "The game is not paused.";

    public static final String GAME_ALREADY_ENDED = "The game is over.";

    public static final String GAME_ENDED = "Game ended by the operator.";

    public static final String ONLY_OPERATOR = "Only the game operator can do that.";

    // ========== 参与者 ==========

    public static final String PLAYER_JOINED = "%s joined as Player %d.";

    public static final String PLAYER_REJOINED = "%s re-joined as Player %d at %s.";

    public static final String ALREADY_IN_GAME = "%s is already in the game.";

    public static final String NOT_IN_GAME = "%s is not in the game.";

    public static final String ACT_FOR_OTHERS = "Only the game operator can roll for another player or force a roll.";

    public static final String FORCED_ROLL_RANGE = "A forced roll must be between 1 and %d.";

    public static final String PLAYER_FORFEITED = "%s (Player %d) forfeited. Their position is kept.";

    public static final String ALREADY_FORFEITED = "%s has already forfeited.";

    public static final String ROLE_ASSIGNED = "%s is now %s.";

    public static final String UNKNOWN_CHARACTER = "Unknown character: %s";

    public static final String ROLES_SWAPPED = "%s and %s swapped places.";

    public static final String ROLES_SWAPPED_PERMANENT = "%s and %s swapped places permanently.";

    public static final String NOT_SWAPPED = "%s is not currently swapped.";

    public static final String SWAP_SELF = "Cannot swap %s with themselves.";

    public static final String SWAP_REVERTED = "Swap reverted (%d exchange(s) undone).";

    public static final String DISPLAY_UPDATED = "Updated %s for %s.";

    // ========== 存档 ==========

    public static final String SAVED = "Game saved as %s.";

    public static final String SNAPSHOT_NOT_FOUND = "No snapshot named %s.";

    public static final String LOADED = "Loaded %s (turn %d).";

    public static final String NO_SNAPSHOTS = "No snapshots saved for this game.";

    public static final String SNAPSHOT_LINE = "%s - %s, turn %d, %d player(s), saved %s";

    public static final String SNAPSHOT_TYPE_UNSUPPORTED = "Snapshot %s is for game type %s, which is not available.";

    public static final String SNAPSHOT_REPAIRED = "Snapshot %s was repaired while loading (%d issue(s)):\n%s";

    public static final String SAVE_FAILED = "Could not save the game, storage is unavailable.";

    public static final String LOAD_FAILED = "Could not load %s, storage is unavailable.";

    // ========== 错误 ==========

    public static final String RULE_FAILURE = "Something went wrong in the %s rules while handling %s.";

    public static final String RULE_FAILURE_OPERATOR = "Rule engine %s failed during %s: %s. Check the game with !list before continuing.";

    public static String format(String template, Object... args) {
        return String.format(template, args);
    }
}
