package com.boardhub.gameservice.games.board.interfaces.ws;

import com.boardhub.gameservice.games.board.interfaces.command.CommandDispatcher;
import com.boardhub.gameservice.games.board.interfaces.ws.dto.BoardMessages.AttachmentPayload;
import com.boardhub.gameservice.games.board.interfaces.ws.dto.BoardMessages.PostMessageCmd;
import com.boardhub.gameservice.platform.transport.ChatTransport;
import com.boardhub.gameservice.platform.transport.OutboundMessage;
import com.boardhub.gameservice.serializer.event.Attachment;
import com.boardhub.gameservice.serializer.event.InboundEvent;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * 频道消息 WebSocket 控制器
 * ----------------------------------------
 * 路径：/app/board.message
 * 流程：
 *   1. 把消息原样广播到频道（和普通聊天一样先出现）；
 *   2. 交给 CommandDispatcher；会话忙时该消息会被撤回并排队，稍后重放。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class BoardWsController {

    private final CommandDispatcher dispatcher;
    private final ChatTransport transport;
    private final Validator validator;

    @MessageMapping("/board.message")
    public void post(PostMessageCmd cmd, SimpMessageHeaderAccessor sha) {
        Principal user = sha.getUser();
        if (user == null) {
            log.warn("Rejected message without user, session={}", sha.getSessionId());
            return;
        }
        Set<ConstraintViolation<PostMessageCmd>> violations = validator.validate(cmd);
        if (!violations.isEmpty()) {
            String reason = violations.iterator().next().getMessage();
            transport.notifyUser(StringUtils.defaultString(cmd.getChannelId()), user.getName(), reason);
            return;
        }
        InboundEvent event = toEvent(cmd, user.getName());
        try {
            transport.send(event.channelId(), OutboundMessage.echo(event));
            dispatcher.dispatch(event, false);
        } catch (Exception e) {
            log.error("Handling message {} on channel {} failed", event.messageId(), event.channelId(), e);
            transport.notifyUser(event.channelId(), event.authorId(), "Something went wrong: " + e.getMessage());
        }
    }

    private static InboundEvent toEvent(PostMessageCmd cmd, String userId) {
        List<Attachment> attachments = cmd.getAttachments() == null ? List.of() : cmd.getAttachments().stream()
                .map(BoardWsController::toAttachment)
                .toList();
        String messageId = StringUtils.defaultIfBlank(cmd.getMessageId(), UUID.randomUUID().toString());
        return new InboundEvent(messageId, cmd.getChannelId().trim(), userId, cmd.getText(), attachments,
                StringUtils.trimToNull(cmd.getReplyTo()), Instant.now());
    }

    private static Attachment toAttachment(AttachmentPayload a) {
        String source = StringUtils.isNotBlank(a.getUrl()) ? a.getUrl().trim() : a.getData();
        return Attachment.remote(StringUtils.defaultIfBlank(a.getFileName(), "attachment"), a.getContentType(), source);
    }
}
