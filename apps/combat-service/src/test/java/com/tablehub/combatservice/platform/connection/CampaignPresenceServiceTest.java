package com.tablehub.combatservice.platform.connection;

import com.tablehub.combatservice.platform.notify.HubPayloads.PlayerConnectionPayload;
import com.tablehub.combatservice.platform.notify.NotificationRouter;
import com.tablehub.combatservice.support.RecordingHubTransport;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CampaignPresenceServiceTest {

    private final RecordingHubTransport transport = new RecordingHubTransport();
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final CampaignPresenceService presence =
            new CampaignPresenceService(registry, new NotificationRouter(transport));

    @Test
    void playerWithCharacterNotifiesDmOnJoinAndLeave() {
        presence.join("s1", "c1", "u1", "Alice", "thorin", false);
        presence.leave("s1");

        assertThat(transport.events()).containsExactly("PlayerConnected", "PlayerDisconnected");
        assertThat(transport.sent()).allMatch(s -> s.group().equals("campaign.c1.dm"));
        PlayerConnectionPayload left = (PlayerConnectionPayload) transport.sent().get(1).envelope().getPayload();
        assertThat(left.isOnline()).isFalse();
        assertThat(left.characterId()).isEqualTo("thorin");
    }

    @Test
    void dmAndSpectatorsDoNotTriggerNotices() {
        presence.join("s-dm", "c1", "u-dm", "DM", null, true);
        presence.join("s-watch", "c1", "u2", "Bob", null, false);
        presence.leave("s-dm");
        presence.leave("s-watch");
        presence.leave("unknown");

        assertThat(transport.sent()).isEmpty();
    }
}
