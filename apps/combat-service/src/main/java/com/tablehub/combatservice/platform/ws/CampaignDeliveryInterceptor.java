package com.tablehub.combatservice.platform.ws;

import com.tablehub.combatservice.platform.config.CombatProperties;
import com.tablehub.combatservice.platform.connection.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.stereotype.Component;

/**
 * 出站投递拦截器（clientOutboundChannel）：分组主题的每条 MESSAGE 在发给某个连接之前，
 * 再按 ConnectionRegistry 核对一次该连接当前是否仍是分组成员。
 *
 * broker 里的订阅不会因为 leave / 重新 join 而消失：
 * DM 重新以玩家身份加入后，之前订阅的 dm 主题在这里被拦下；离开战役后 all 主题同理。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CampaignDeliveryInterceptor implements ChannelInterceptor {

    private final ConnectionRegistry registry;
    private final CombatProperties properties;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        MessageHeaders headers = message.getHeaders();
        if (SimpMessageHeaderAccessor.getMessageType(headers) != SimpMessageType.MESSAGE) {
            return message;
        }
        CampaignTopic topic = CampaignTopic.parse(properties.getTopicPrefix(),
                SimpMessageHeaderAccessor.getDestination(headers));
        if (topic == null) {
            return message;
        }
        String sessionId = SimpMessageHeaderAccessor.getSessionId(headers);
        if (topic.audience() == null || !registry.isMember(sessionId, topic.campaignId(), topic.audience())) {
            log.debug("丢弃投递：连接已不在分组中 session={} campaign={} audience={}",
                    sessionId, topic.campaignId(), topic.audience());
            return null;
        }
        return message;
    }
}
