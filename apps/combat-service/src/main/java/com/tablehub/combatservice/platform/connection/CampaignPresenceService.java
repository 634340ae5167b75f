package com.tablehub.combatservice.platform.connection;

import com.tablehub.combatservice.platform.notify.HubPayloads.PlayerConnectionPayload;
import com.tablehub.combatservice.platform.notify.NotificationRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 加入 / 离开战役房间：更新 ConnectionRegistry，并在玩家（控制角色的）上下线时通知 DM。
 * 显式 leave 与连接断开走同一条路径。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignPresenceService {

    private final ConnectionRegistry registry;
    private final NotificationRouter router;

    public ConnectionRecord join(String connectionId, String campaignId, String userId, String userName,
                                 String characterId, boolean isDm) {
        // 同一连接重复 join（换战役）时，旧战役的 DM 也要收到下线通知
        leave(connectionId);
        ConnectionRecord rec = registry.join(connectionId, campaignId, userId, userName, characterId, isDm);
        if (rec.controlsCharacter()) {
            router.playerConnected(campaignId, payload(rec, true));
        }
        return rec;
    }

    public Optional<ConnectionRecord> leave(String connectionId) {
        Optional<ConnectionRecord> removed = registry.leave(connectionId);
        removed.filter(ConnectionRecord::controlsCharacter)
                .ifPresent(rec -> router.playerDisconnected(rec.campaignId(), payload(rec, false)));
        return removed;
    }

    private static PlayerConnectionPayload payload(ConnectionRecord rec, boolean online) {
        return new PlayerConnectionPayload(rec.userId(), rec.userName(), rec.characterId(), online);
    }
}
