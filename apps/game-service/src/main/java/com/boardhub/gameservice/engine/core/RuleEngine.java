package com.boardhub.gameservice.engine.core;

import com.boardhub.gameservice.games.board.domain.model.Participant;
import com.boardhub.gameservice.games.board.domain.model.Session;
import com.boardhub.gameservice.games.board.domain.rule.BoardGrid;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 规则引擎（每种游戏一个实现，按会话的 gameType 选择）。
 * 作用：
 * - 把“谁能走、怎么走、谁赢了”收敛到同一个接口，服务层不关心具体游戏；
 * - 所有方法都在会话锁内被调用，可直接修改 Session 与 RuleData；
 * - 实现抛出的 RuntimeException 由调用方捕获并按“插件异常”处理，不会中断会话。
 */
public interface RuleEngine {

    /** 游戏类型标识，如 snakes_ladders */
    String gameType();

    /** 新会话的空数据 */
    RuleData newData();

    BoardGrid grid();

    /** 骰子面数 */
    int dieSides();

    /** 新参与者加入（首次）：初始化位置并追加到回合顺序 */
    void onParticipantAdded(Session session, Participant participant);

    /** 弃权者重新加入：清除弃权标记，恢复保留的位置 */
    void onParticipantRejoined(Session session, Participant participant);

    void onRoleAssigned(Session session, Participant participant, String previousRole);

    /** 坐标被外部改变（交换/撤销交换）后同步规则内的位置 */
    void onCoordinateChanged(Session session, Participant participant);

    boolean isForfeited(Session session, String participantId);

    void forfeit(Session session, String participantId);

    Eligibility checkEligibility(Session session, String participantId);

    MoveOutcome resolveMove(Session session, Participant participant, int roll);

    WinCheck checkWin(Session session);

    boolean isCycleComplete(Session session);

    /** 结束本轮：回合数 +1，清空本轮已行动集合，返回回合小结 */
    String advanceCycle(Session session);

    /** 校验房主手动移动的目标坐标，合法返回 empty，否则返回原因 */
    Optional<String> validatePlacement(Session session, String coordinate);

    /** 房主手动放置到坐标（已校验） */
    String placeAt(Session session, Participant participant, String coordinate);

    String describeParticipants(Session session);

    /** 导出为与具体类型无关的 Map，用于存档 */
    Map<String, Object> exportData(Session session);

    /** 从存档恢复；脏数据被清洗，清洗过程写入 warnings */
    RuleData importData(Session session, Map<String, Object> raw, List<String> warnings);
}
