package com.boardhub.gameservice.engine.core;

/**
 * 行动资格判定结果。
 * allowed=false 是正常的否定结果（轮次不对/已行动/已完赛），不是异常。
 */
public record Eligibility(boolean allowed, String nextParticipantId, String reason) {

    public static Eligibility allowed(String participantId) {
        return new Eligibility(true, participantId, null);
    }

    public static Eligibility denied(String nextParticipantId, String reason) {
        return new Eligibility(false, nextParticipantId, reason);
    }
}
