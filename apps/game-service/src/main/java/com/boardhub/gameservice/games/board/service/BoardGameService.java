package com.boardhub.gameservice.games.board.service;

import com.boardhub.gameservice.games.board.domain.dto.SnapshotInfo;
import com.boardhub.gameservice.games.board.domain.model.SessionView;
import com.boardhub.gameservice.games.board.render.RenderContext;
import com.boardhub.gameservice.games.board.render.RenderedBoard;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 棋盘游戏服务。
 * 所有变更方法都必须在该频道的会话锁内调用（见 CommandSerializer）；
 * channelId 即会话 id，actorId 为发起命令的用户。
 */
public interface BoardGameService {

    enum DisplayField { BACKGROUND, OUTFIT }

    /** 新建会话（未开始），发起人成为房主；gameType 为空时用默认类型 */
    ActionResult start(String channelId, String actorId, String gameType);

    /** 未开始 → 进行中 */
    ActionResult begin(String channelId, String actorId);

    /** 结束并删除会话及其全部存档 */
    ActionResult end(String channelId, String actorId);

    ActionResult pause(String channelId, String actorId);

    ActionResult resume(String channelId, String actorId);

    /** 加入；已弃权的参与者重新加入时保留原序号与位置 */
    ActionResult join(String channelId, String actorId, String participantId, String role);

    /** 弃权：房主可让任何人弃权，参与者可以自己弃权 */
    ActionResult forfeit(String channelId, String actorId, String participantId);

    ActionResult assignRole(String channelId, String actorId, String participantId, String role);

    ActionResult swap(String channelId, String actorId, String firstId, String secondId, boolean permanent);

    /** 撤销以该参与者为起点的整条交换链 */
    ActionResult unswap(String channelId, String actorId, String participantId);

    /** 房主手动把棋子放到坐标 */
    ActionResult moveToken(String channelId, String actorId, String participantId, String coordinate);

    /**
     * 掷骰行动。
     * @param participantId 为空表示发起人自己
     * @param forcedRoll    房主指定点数，可空
     */
    ActionResult act(String channelId, String actorId, String participantId, Integer forcedRoll);

    ActionResult listParticipants(String channelId);

    ActionResult setDisplay(String channelId, String actorId, String participantId, DisplayField field, String value);

    ActionResult save(String channelId, String actorId);

    ActionResult listSnapshots(String channelId, String actorId);

    ActionResult load(String channelId, String actorId, String snapshotId);

    /** 自动存档；失败只记日志 */
    Optional<SnapshotInfo> autosave(String channelId);

    Optional<RenderedBoard> render(String channelId, RenderContext context);

    /** @throws java.util.NoSuchElementException 会话不存在 */
    SessionView view(String channelId);

    List<SnapshotInfo> snapshots(String channelId);

    /** 已开始且未结束的会话 */
    Set<String> activeSessionIds();

    boolean hasSession(String channelId);

    Optional<String> operatorOf(String channelId);
}
