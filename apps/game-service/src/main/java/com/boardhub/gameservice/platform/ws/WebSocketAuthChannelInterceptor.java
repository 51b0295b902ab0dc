package com.boardhub.gameservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * WebSocket STOMP 身份拦截器
 *
 * 在 STOMP CONNECT 阶段读取 user-id 头并设置用户身份，供后续消息处理使用。
 * 鉴权由上游聊天平台完成，这里只负责把身份带进来。
 * 缺少 user-id 时不设置用户，后续发送会因缺少用户而被拒绝。
 */
@Slf4j
@Component
public class WebSocketAuthChannelInterceptor implements ChannelInterceptor {

    static final String USER_HEADER = "user-id";

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null) {
            accessor = StompHeaderAccessor.wrap(message);
        }
        if (StompCommand.CONNECT.equals(accessor.getCommand())) {
            String userId = StringUtils.trimToNull(firstHeader(accessor, USER_HEADER));
            if (userId != null) {
                accessor.setUser(new ChannelUser(userId));
            } else {
                log.debug("STOMP CONNECT without {} header, session={}", USER_HEADER, accessor.getSessionId());
            }
        }
        return message;
    }

    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> vals = accessor.getNativeHeader(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }
}
