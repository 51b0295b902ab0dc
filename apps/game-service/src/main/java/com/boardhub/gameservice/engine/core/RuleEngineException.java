package com.boardhub.gameservice.engine.core;

/**
 * 规则插件在执行某个动作时抛出的异常（包装原始异常）。
 */
public class RuleEngineException extends RuntimeException {

    private final String gameType;
    private final String action;

    public RuleEngineException(String gameType, String action, Throwable cause) {
        super("Rule engine " + gameType + " failed during " + action + ": " + cause.getMessage(), cause);
        this.gameType = gameType;
        this.action = action;
    }

    public String getGameType() {
        return gameType;
    }

    public String getAction() {
        return action;
    }
}
