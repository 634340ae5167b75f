package com.tablehub.combatservice.platform.ws;

import com.tablehub.combatservice.platform.connection.CampaignPresenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * 监听 STOMP 连接 / 断开事件。
 * 连接建立时只记录日志（真正加入战役要等客户端发 /app/campaign.join）；
 * 断开时从注册表移除，必要时通知 DM。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSessionManager {

    private final CampaignPresenceService presence;

    @EventListener
    public void handleSessionConnect(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        log.debug("WebSocket 连接建立 session={}", accessor.getSessionId());
    }

    /**
     * 断开检测基于传输层连接关闭：正常关闭、强制关闭、网络中断都会触发。
     */
    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId == null) {
            log.warn("收到 SessionDisconnectEvent 但缺少 sessionId");
            return;
        }
        presence.leave(sessionId).ifPresentOrElse(
                rec -> log.info("连接断开 session={} campaign={} user={}", sessionId, rec.campaignId(), rec.userId()),
                () -> log.debug("连接断开 session={}（未加入任何战役）", sessionId));
    }
}
