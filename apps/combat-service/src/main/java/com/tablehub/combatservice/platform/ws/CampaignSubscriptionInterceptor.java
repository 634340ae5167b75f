package com.tablehub.combatservice.platform.ws;

import com.tablehub.combatservice.platform.config.CombatProperties;
import com.tablehub.combatservice.platform.connection.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.stereotype.Component;

/**
 * 订阅拦截器：分组主题只允许该分组的成员订阅。
 *
 * 例如 /topic/campaign.c1.dm 只有在 ConnectionRegistry 中登记为 c1 的 DM 的连接才能订阅；
 * 不满足时丢弃该 SUBSCRIBE 帧（返回 null），其余帧直接放行。
 * 订阅之后成员关系的变化（离开、换角色）由 CampaignDeliveryInterceptor 在投递时把关。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CampaignSubscriptionInterceptor implements ChannelInterceptor {

    private final ConnectionRegistry registry;
    private final CombatProperties properties;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(message);
        if (!StompCommand.SUBSCRIBE.equals(accessor.getCommand())) {
            return message;
        }
        String destination = accessor.getDestination();
        CampaignTopic topic = CampaignTopic.parse(properties.getTopicPrefix(), destination);
        if (topic == null) {
            return message;
        }
        if (topic.audience() == null) {
            log.warn("拒绝订阅：无法识别的分组主题 session={} dest={}", accessor.getSessionId(), destination);
            return null;
        }
        if (!registry.isMember(accessor.getSessionId(), topic.campaignId(), topic.audience())) {
            log.warn("拒绝订阅：不是分组成员 session={} campaign={} audience={}",
                    accessor.getSessionId(), topic.campaignId(), topic.audience());
            return null;
        }
        return message;
    }
}
