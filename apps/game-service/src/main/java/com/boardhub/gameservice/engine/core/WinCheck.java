package com.boardhub.gameservice.engine.core;

import java.util.List;

/**
 * 胜负判定结果。
 *
 * @param newlyFinished 本次判定中首次到达终点的参与者
 * @param winners       当前胜者集合（终局时为最终胜者）
 * @param gameEnded     是否终局
 * @param message       说明文本，无变化时为 null
 */
public record WinCheck(List<String> newlyFinished, List<String> winners, boolean gameEnded, String message) {

    public static WinCheck none(List<String> winners) {
        return new WinCheck(List.of(), winners, false, null);
    }
}
