package com.boardhub.gameservice.platform.ws;

import java.security.Principal;

/**
 * STOMP 会话中的用户身份，name 即聊天用户 id。
 */
public record ChannelUser(String userId) implements Principal {

    @Override
    public String getName() {
        return userId;
    }
}
