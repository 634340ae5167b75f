package com.tablehub.combatservice.platform.ws;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocket + STOMP 配置
 * ----------------------------------------
 *   - /ws        : 连接端点（原生 WebSocket 与 SockJS 回退）
 *   - /app/...   : 客户端发送（如 /app/combat.command）
 *   - /topic/... : 分组广播（/topic/campaign.{id}.dm | players | all）
 *   - /user/queue/... : 点对点回执（命令结果、完整快照）
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    private final CampaignSubscriptionInterceptor subscriptionInterceptor;
    private final CampaignDeliveryInterceptor deliveryInterceptor;

    public WebSocketStompConfig(CampaignSubscriptionInterceptor subscriptionInterceptor,
                                CampaignDeliveryInterceptor deliveryInterceptor) {
        this.subscriptionInterceptor = subscriptionInterceptor;
        this.deliveryInterceptor = deliveryInterceptor;
    }

    /**
     * 心跳调度器。使用独立 bean 名，避免与 Spring 自动配置的调度器冲突。
     */
    @Bean(name = "wsHeartbeatTaskScheduler")
    public TaskScheduler wsHeartbeatTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ws-heartbeat-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*");
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*")
                .withSockJS();
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        // 心跳 [客户端间隔, 服务端间隔]，断线能更快被发现
        registry.enableSimpleBroker("/topic", "/queue")
                .setHeartbeatValue(new long[]{10000, 10000})
                .setTaskScheduler(wsHeartbeatTaskScheduler());
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(subscriptionInterceptor);
    }

    /**
     * 出站：分组消息投递前按当前成员关系再过滤一次
     */
    @Override
    public void configureClientOutboundChannel(ChannelRegistration registration) {
        registration.interceptors(deliveryInterceptor);
    }
}
