package com.boardhub.gameservice.games.board.domain.repository;

import com.boardhub.gameservice.games.board.domain.dto.SessionSnapshot;
import com.boardhub.gameservice.games.board.domain.dto.SnapshotInfo;

import java.util.List;
import java.util.Optional;

/**
 * SnapshotRepository
 * ----------------------------------------
 * 会话存档仓储接口
 * - 自动存档：固定数量槽位，最旧的先被覆盖；
 * - 手动存档：单调编号，永不覆盖；
 * - 当前实现基于 Redis。
 * ----------------------------------------
 */
public interface SnapshotRepository {

    /**
     * 写入一个自动存档（填写 kind / generation / snapshotId）
     * @return 写入的存档概要
     */
    SnapshotInfo saveAuto(SessionSnapshot snapshot);

    /**
     * 写入一个手动存档（填写 kind / generation / snapshotId）
     */
    SnapshotInfo saveManual(SessionSnapshot snapshot);

    Optional<SessionSnapshot> load(String sessionId, String snapshotId);

    /** 按保存时间倒序 */
    List<SnapshotInfo> list(String sessionId);

    /** 删除该会话的全部存档与计数器 */
    void deleteAll(String sessionId);
}
