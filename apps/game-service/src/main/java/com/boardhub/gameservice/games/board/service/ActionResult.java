package com.boardhub.gameservice.games.board.service;

/**
 * 一次操作的结果。
 * - accepted=false：拒绝，没有任何状态变化，只提示发起人；
 * - boardChanged：需要重新渲染棋盘；
 * - operatorNotice：额外发给房主的提示（如插件异常、存档修复记录），可空。
 */
public record ActionResult(boolean accepted,
                           String message,
                           boolean boardChanged,
                           String highlightParticipantId,
                           String operatorNotice) {

    public static ActionResult rejected(String message) {
        return new ActionResult(false, message, false, null, null);
    }

    public static ActionResult ok(String message) {
        return new ActionResult(true, message, false, null, null);
    }

    public static ActionResult board(String message) {
        return new ActionResult(true, message, true, null, null);
    }

    public static ActionResult board(String message, String highlightParticipantId) {
        return new ActionResult(true, message, true, highlightParticipantId, null);
    }

    public ActionResult withOperatorNotice(String notice) {
        return new ActionResult(accepted, message, boardChanged, highlightParticipantId, notice);
    }
}
