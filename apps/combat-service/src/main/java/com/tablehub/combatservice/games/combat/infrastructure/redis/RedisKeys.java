package com.tablehub.combatservice.games.combat.infrastructure.redis;

/**
 * 集中管理 Redis Key 的拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "tablehub:";

    private RedisKeys() {}

    /** 角色名册：Hash，field = 角色 id，value = CharacterRecord */
    public static String roster(String campaignId) {
        return PFX + "campaign:" + campaignId + ":roster";
    }

    /** 当前遭遇战：String，value = Encounter */
    public static String encounter(String campaignId) {
        return PFX + "campaign:" + campaignId + ":encounter";
    }

    /** 叙事日志：List，按时间追加，value = NarrativeLogEntry */
    public static String narrativeLog(String campaignId) {
        return PFX + "campaign:" + campaignId + ":log";
    }
}
