package com.boardhub.gameservice.games.board.domain.model;

import lombok.Getter;
import lombok.Setter;

/**
 * 会话内的参与者（玩家）。
 * - id / sequence 属于身份，永不交换、永不重排；
 * - role / coordinate / display 属于当前“穿着”的角色，可被交换；
 * - swappedWith：最近一次可逆交换的对方 id，指向自己表示“未交换”。
 */
@Getter
@Setter
public class Participant {

    private final String id;
    /** 首次加入时分配的序号（1 起），永不复用 */
    private final int sequence;

    private String role;
    /** 棋盘坐标（字母+数字，如 A1） */
    private String coordinate;
    private DisplayMeta display = new DisplayMeta();
    private String swappedWith;

    public Participant(String id, int sequence) {
        this.id = id;
        this.sequence = sequence;
        this.swappedWith = id;
    }

    public boolean isSwapped() {
        return swappedWith != null && !swappedWith.equals(id);
    }

    /** 展示名：有角色用角色名，否则 "Player N" */
    public String displayName() {
        return role != null ? role : "Player " + sequence;
    }
}
