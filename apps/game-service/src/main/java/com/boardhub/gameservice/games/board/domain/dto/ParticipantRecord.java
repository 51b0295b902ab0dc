package com.boardhub.gameservice.games.board.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 存档中的参与者。序号用 Integer，脏数据可能缺失。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantRecord {
    private String id;
    private String role;
    /** 坐标，如 "B7" */
    private String coordinate;
    private Integer sequence;
    private String background;
    private String outfit;
    /** 交换对象 id，等于自己表示未交换 */
    private String swappedWith;
}
