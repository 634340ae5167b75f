package com.tablehub.combatservice.platform.notify;

import com.tablehub.combatservice.platform.config.CombatProperties;
import com.tablehub.combatservice.platform.transport.Envelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 基于 STOMP 简单代理的分组推送：分组 campaign.{id}.dm 对应主题 /topic/campaign.{id}.dm
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompHubTransport implements HubTransport {

    private final SimpMessagingTemplate messagingTemplate;
    private final CombatProperties properties;

    @Override
    public void sendToGroup(String group, Envelope<?> envelope) {
        String destination = properties.getTopicPrefix() + group;
        try {
            messagingTemplate.convertAndSend(destination, envelope);
        } catch (Exception e) {
            // 尽力投递：状态已经提交，客户端下次拉取快照即可恢复
            log.warn("推送失败 dest={} event={} seq={}", destination, envelope.getEvent(), envelope.getSeq(), e);
        }
    }
}
