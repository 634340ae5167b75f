package com.tablehub.combatservice.platform.ws;

import com.tablehub.combatservice.platform.config.CombatProperties;
import com.tablehub.combatservice.platform.connection.ConnectionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;

import static org.assertj.core.api.Assertions.assertThat;

class CampaignSubscriptionInterceptorTest {

    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final CampaignSubscriptionInterceptor interceptor =
            new CampaignSubscriptionInterceptor(registry, new CombatProperties());

    @BeforeEach
    void setUp() {
        registry.join("s-dm", "c.1", "u-dm", "DM", null, true);
        registry.join("s-p1", "c.1", "u1", "Alice", "thorin", false);
    }

    private static Message<byte[]> frame(StompCommand command, String session, String destination) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(command);
        accessor.setSessionId(session);
        accessor.setDestination(destination);
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }

    @Test
    void membersMaySubscribeToTheirGroups() {
        assertThat(interceptor.preSend(frame(StompCommand.SUBSCRIBE, "s-dm", "/topic/campaign.c.1.dm"), null))
                .isNotNull();
        assertThat(interceptor.preSend(frame(StompCommand.SUBSCRIBE, "s-p1", "/topic/campaign.c.1.all"), null))
                .isNotNull();
    }

    @Test
    void playersCannotSubscribeToDmGroup() {
        assertThat(interceptor.preSend(frame(StompCommand.SUBSCRIBE, "s-p1", "/topic/campaign.c.1.dm"), null))
                .isNull();
        assertThat(interceptor.preSend(frame(StompCommand.SUBSCRIBE, "s-x", "/topic/campaign.c.1.players"), null))
                .isNull();
        assertThat(interceptor.preSend(frame(StompCommand.SUBSCRIBE, "s-p1", "/topic/campaign.c.1.everyone"), null))
                .isNull();
    }

    @Test
    void otherFramesPassThrough() {
        assertThat(interceptor.preSend(frame(StompCommand.SEND, "s-x", "/app/combat.command"), null)).isNotNull();
        assertThat(interceptor.preSend(frame(StompCommand.SUBSCRIBE, "s-x", "/user/queue/combat.result"), null))
                .isNotNull();
    }
}
