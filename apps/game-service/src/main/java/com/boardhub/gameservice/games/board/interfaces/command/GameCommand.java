package com.boardhub.gameservice.games.board.interfaces.command;

import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * 解析后的文本命令：动词（小写，不含前缀）+ 参数（提及已还原为用户 id）。
 */
public record GameCommand(String verb, List<String> args) {

    public GameCommand {
        args = List.copyOf(args);
    }

    /** 第 i 个参数，不存在返回 null */
    public String arg(int i) {
        return i < args.size() ? args.get(i) : null;
    }

    /** 第 i 个参数，不存在则抛出带用法提示的 IllegalArgumentException */
    public String require(int i, String usage) {
        String v = arg(i);
        if (StringUtils.isBlank(v)) {
            throw new IllegalArgumentException("Usage: " + usage);
        }
        return v;
    }

    /** 从第 i 个参数开始的剩余文本（空格拼接），没有返回 null */
    public String rest(int i) {
        return i < args.size() ? String.join(" ", args.subList(i, args.size())) : null;
    }
}
