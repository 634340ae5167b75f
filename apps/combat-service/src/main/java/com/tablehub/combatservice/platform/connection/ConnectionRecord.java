package com.tablehub.combatservice.platform.connection;

/**
 * 一条在线连接（STOMP session）的元数据。只存在于内存，重连后 connectionId 会变。
 */
public record ConnectionRecord(
        String connectionId,
        String campaignId,
        String userId,
        String userName,
        String characterId,
        boolean isDm,
        long connectedAt
) {

    public Audience roleAudience() {
        return isDm ? Audience.DM : Audience.PLAYERS;
    }

    public boolean controlsCharacter() {
        return !isDm && characterId != null && !characterId.isBlank();
    }
}
