package com.boardhub.gameservice.serializer;

import com.boardhub.gameservice.platform.transport.ChatTransport;
import com.boardhub.gameservice.serializer.gate.CommandSerializer;
import com.boardhub.gameservice.serializer.gate.CommandSerializerImpl;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * SerializerAutoConfig
 * ---------------------------------------
 * 会话串行器的装配：只把传输层注入到通用串行器中，不涉及任何游戏规则。
 * 重放入口由命令分发器在启动完成后通过 setReplayHandler 注册。
 */
@Configuration
public class SerializerAutoConfig {

    /**
     * @param chatTransport 用于撤回被拦截的消息、读取附件、提示作者
     */
    @Bean
    public CommandSerializer commandSerializer(ChatTransport chatTransport) {
        return new CommandSerializerImpl(chatTransport);
    }
}
