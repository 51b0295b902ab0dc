package com.boardhub.gameservice.games.board.domain.model;

public enum SessionPhase {

    NOT_STARTED, // 已创建，可加人/分配角色，不能掷骰
    ACTIVE,      // 进行中（唯一允许移动的阶段）
    PAUSED,      // 暂停（可由房主恢复）
    ENDED        // 已结束（终态）
}
