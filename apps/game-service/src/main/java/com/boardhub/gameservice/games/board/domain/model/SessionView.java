package com.boardhub.gameservice.games.board.domain.model;

import java.util.List;

/**
 * 会话的只读视图（HTTP 查询用）。
 */
public record SessionView(String sessionId,
                          String gameType,
                          String operatorId,
                          SessionPhase phase,
                          int turnCount,
                          List<ParticipantView> participants,
                          String summary) {

    public record ParticipantView(String id,
                                  int sequence,
                                  String role,
                                  String coordinate,
                                  String background,
                                  String outfit,
                                  String swappedWith,
                                  boolean forfeited) {
    }
}
