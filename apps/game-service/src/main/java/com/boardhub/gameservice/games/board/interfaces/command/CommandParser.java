package com.boardhub.gameservice.games.board.interfaces.command;

import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 文本命令解析：以前缀开头的消息才是命令，其余是普通聊天。
 * 提及写法 <@id> / <@!id> 还原为 id。
 */
@Component
public class CommandParser {

    private static final Pattern MENTION = Pattern.compile("^<@!?([^>]+)>$");

    private final String prefix;

    public CommandParser(@Value("${boardhub.command.prefix:!}") String prefix) {
        if (StringUtils.isBlank(prefix)) {
            throw new IllegalStateException("boardhub.command.prefix must not be blank");
        }
        this.prefix = prefix.trim();
    }

    public String prefix() {
        return prefix;
    }

    public Optional<GameCommand> parse(String text) {
        String body = StringUtils.trimToEmpty(text);
        if (!body.startsWith(prefix)) {
            return Optional.empty();
        }
        String[] tokens = StringUtils.split(body.substring(prefix.length()));
        if (tokens.length == 0) {
            return Optional.empty();
        }
        List<String> args = new ArrayList<>(tokens.length - 1);
        for (int i = 1; i < tokens.length; i++) {
            args.add(unmention(tokens[i]));
        }
        return Optional.of(new GameCommand(tokens[0].toLowerCase(), args));
    }

    private static String unmention(String token) {
        Matcher m = MENTION.matcher(token);
        return m.matches() ? m.group(1) : token;
    }
}
