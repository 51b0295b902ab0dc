package com.boardhub.gameservice.engine.core;

/**
 * 规则插件私有的会话数据（每种游戏一个具体类型）。
 * - Serializer / 持久化层不理解其内容，只按 gameType 交给对应 RuleEngine 导入导出；
 * - 取代“往会话对象上动态挂属性”的做法。
 */
public interface RuleData {

    String gameType();
}
