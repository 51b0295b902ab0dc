package com.boardhub.gameservice.games.board.domain.rule;

/** 一次角色交换：first 与 second 互换了角色 */
public record SwapPair(String first, String second) {
}
