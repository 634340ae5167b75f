package com.tablehub.combatservice.platform.connection;

/**
 * 战役房间内的三个受众分组：dm、players、all（= dm ∪ players）。
 * 分组名形如 campaign.{campaignId}.dm
 */
public enum Audience {
    DM("dm"),
    PLAYERS("players"),
    ALL("all");

    private final String suffix;

    Audience(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    public String groupOf(String campaignId) {
        return "campaign." + campaignId + "." + suffix;
    }

    public static Audience fromSuffix(String s) {
        for (Audience a : values()) {
            if (a.suffix.equals(s)) {
                return a;
            }
        }
        return null;
    }
}
