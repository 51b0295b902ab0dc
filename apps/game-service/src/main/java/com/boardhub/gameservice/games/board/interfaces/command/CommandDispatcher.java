package com.boardhub.gameservice.games.board.interfaces.command;

import com.boardhub.gameservice.games.board.render.RenderContext;
import com.boardhub.gameservice.games.board.service.ActionResult;
import com.boardhub.gameservice.games.board.service.BoardGameService;
import com.boardhub.gameservice.games.board.service.BoardGameService.DisplayField;
import com.boardhub.gameservice.platform.transport.ChatTransport;
import com.boardhub.gameservice.platform.transport.OutboundMessage;
import com.boardhub.gameservice.serializer.event.InboundEvent;
import com.boardhub.gameservice.serializer.gate.CommandSerializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.boardhub.gameservice.games.board.domain.constants.GameMessages.NO_GAME;

/**
 * CommandDispatcher
 * -------------------------------------------------
 * 频道消息的统一分发入口（正常到达与重放走同一条路径）。
 *
 * 流程：
 *  1) 经 CommandSerializer 申请会话锁；会话忙时事件被拦截排队，这里直接返回；
 *  2) 持锁期间：解析命令 → 调用服务 → 发布结果（含棋盘渲染）；
 *  3) 释放锁后由串行器按到达顺序重放排队事件，重放时 replayed=true。
 *
 * 重放的普通聊天消息会代作者重新发出，因为原消息在排队时已被撤回。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandDispatcher {

    static final String HELP = String.join("\n",
            "**Commands**",
            "!start [type] - create a game (you become the operator)",
            "!begin - start play",
            "!join <player> [role] / !forfeit <player> / !quit",
            "!assign <player> <role>",
            "!swap <a> <b> / !pswap <a> <b> / !unswap <player>",
            "!move <player> <coordinate>",
            "!roll [player] [value]",
            "!bg <player> [background] / !outfit <player> [outfit]",
            "!list / !board [background]",
            "!pause / !resume / !end",
            "!save / !saves / !load <snapshot>");

    private final CommandSerializer serializer;
    private final CommandParser parser;
    private final BoardGameService service;
    private final ChatTransport transport;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        serializer.setReplayHandler(event -> dispatch(event, true));
        log.info("Command dispatcher registered as replay handler (prefix '{}')", parser.prefix());
    }

    /**
     * @return 命令的结果；普通聊天、被排队或被丢弃的事件返回 empty
     */
    public Optional<ActionResult> dispatch(InboundEvent event, boolean replayed) {
        return serializer.submit(event, replayed, () -> handle(event, replayed));
    }

    private ActionResult handle(InboundEvent event, boolean replayed) {
        Optional<GameCommand> parsed = parser.parse(event.text());
        if (parsed.isEmpty()) {
            if (replayed) {
                transport.send(event.channelId(), OutboundMessage.repost(event));
            }
            return null;
        }
        GameCommand cmd = parsed.get();
        log.debug("Dispatching {} from {} on {} (replayed={})", cmd.verb(), event.authorId(), event.channelId(), replayed);
        ActionResult result;
        try {
            result = route(event, cmd);
        } catch (IllegalArgumentException e) {
            result = ActionResult.rejected(e.getMessage());
        }
        publish(event, result, RenderContext.highlight(result.highlightParticipantId()));
        return result;
    }

    private ActionResult route(InboundEvent event, GameCommand cmd) {
        String ch = event.channelId();
        String me = event.authorId();
        return switch (cmd.verb()) {
            case "start" -> service.start(ch, me, cmd.arg(0));
            case "begin" -> service.begin(ch, me);
            case "end" -> service.end(ch, me);
            case "pause" -> service.pause(ch, me);
            case "resume" -> service.resume(ch, me);
            case "join" -> service.join(ch, me, cmd.require(0, "!join <player> [role]"), cmd.rest(1));
            case "forfeit" -> service.forfeit(ch, me, cmd.require(0, "!forfeit <player>"));
            case "quit" -> service.forfeit(ch, me, me);
            case "assign" -> {
                String usage = "!assign <player> <role>";
                cmd.require(1, usage);
                yield service.assignRole(ch, me, cmd.require(0, usage), cmd.rest(1));
            }
            case "swap" -> service.swap(ch, me, cmd.require(0, "!swap <a> <b>"), cmd.require(1, "!swap <a> <b>"), false);
            case "pswap" -> service.swap(ch, me, cmd.require(0, "!pswap <a> <b>"), cmd.require(1, "!pswap <a> <b>"), true);
            case "unswap" -> service.unswap(ch, me, cmd.require(0, "!unswap <player>"));
            case "move" -> service.moveToken(ch, me, cmd.require(0, "!move <player> <coordinate>"),
                    cmd.require(1, "!move <player> <coordinate>"));
            case "roll" -> roll(event, cmd);
            case "list" -> service.listParticipants(ch);
            case "bg" -> service.setDisplay(ch, me, cmd.require(0, "!bg <player> [background]"), DisplayField.BACKGROUND, cmd.rest(1));
            case "outfit" -> service.setDisplay(ch, me, cmd.require(0, "!outfit <player> [outfit]"), DisplayField.OUTFIT, cmd.rest(1));
            case "board" -> showBoard(event, cmd.rest(0));
            case "save" -> service.save(ch, me);
            case "saves" -> service.listSnapshots(ch, me);
            case "load" -> service.load(ch, me, cmd.require(0, "!load <snapshot>"));
            case "help" -> ActionResult.ok(HELP);
            default -> ActionResult.rejected("Unknown command " + parser.prefix() + cmd.verb() + ". Try " + parser.prefix() + "help.");
        };
    }

    /** !roll / !roll 5 / !roll <player> / !roll <player> 5 */
    private ActionResult roll(InboundEvent event, GameCommand cmd) {
        String participant = null;
        Integer forced = null;
        String first = cmd.arg(0);
        String second = cmd.arg(1);
        if (first != null && second == null && StringUtils.isNumeric(first) && first.length() <= 6) {
            forced = parseRoll(first);
        } else {
            participant = first;
            if (second != null) {
                forced = parseRoll(second);
            }
        }
        return service.act(event.channelId(), event.authorId(), participant, forced);
    }

    private static Integer parseRoll(String raw) {
        if (!StringUtils.isNumeric(raw) || raw.length() > 6) {
            throw new IllegalArgumentException("Not a valid roll: " + raw);
        }
        return Integer.valueOf(raw);
    }

    /** 渲染时带一次性的背景覆盖，不修改会话 */
    private ActionResult showBoard(InboundEvent event, String background) {
        if (!service.hasSession(event.channelId())) {
            return ActionResult.rejected(NO_GAME);
        }
        service.render(event.channelId(), new RenderContext(StringUtils.trimToNull(background), null))
                .ifPresent(board -> transport.send(event.channelId(),
                        OutboundMessage.system("Current board").withAttachment(board.toAttachment())));
        return ActionResult.ok(null);
    }

    private void publish(InboundEvent event, ActionResult result, RenderContext context) {
        String channelId = event.channelId();
        if (!result.accepted()) {
            transport.notifyUser(channelId, event.authorId(), result.message());
        } else if (result.message() != null) {
            OutboundMessage text = OutboundMessage.system(result.message());
            OutboundMessage out = result.boardChanged()
                    ? service.render(channelId, context).map(board -> text.withAttachment(board.toAttachment())).orElse(text)
                    : text;
            transport.send(channelId, out);
        }
        if (result.operatorNotice() != null) {
            String operator = service.operatorOf(channelId).orElse(event.authorId());
            transport.notifyUser(channelId, operator, result.operatorNotice());
        }
    }
}
