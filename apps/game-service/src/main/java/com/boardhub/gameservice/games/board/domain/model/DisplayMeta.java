package com.boardhub.gameservice.games.board.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 展示层元数据：背景与服装。
 * 跟随“角色”走（交换时一起交换），与参与者身份无关。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DisplayMeta {
    private String background;
    private String outfit;

    public DisplayMeta copy() {
        return new DisplayMeta(background, outfit);
    }
}
