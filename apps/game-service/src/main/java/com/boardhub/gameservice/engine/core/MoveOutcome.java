package com.boardhub.gameservice.engine.core;

/**
 * 一次移动的结算结果。
 *
 * @param fromTile      起点
 * @param landedTile    掷骰落点（已按终点截断）
 * @param finalTile     重定向后的最终格
 * @param redirect      触发的重定向（无则 NONE）
 * @param message       面向频道的说明文本（需点明重定向）
 * @param cycleComplete 本轮是否已全部行动完
 * @param win           胜负判定
 */
public record MoveOutcome(int fromTile,
                          int landedTile,
                          int finalTile,
                          Redirect redirect,
                          String message,
                          boolean cycleComplete,
                          WinCheck win) {

    public enum Redirect { NONE, HAZARD, SHORTCUT }

    public boolean gameEnded() {
        return win != null && win.gameEnded();
    }
}
