package com.tablehub.combatservice.platform.ws;

import com.tablehub.combatservice.platform.connection.Audience;

/**
 * 战役分组主题 {prefix}campaign.{campaignId}.{dm|players|all} 的解析结果。
 *
 * @param audience 分组后缀无法识别时为 null
 */
record CampaignTopic(String campaignId, Audience audience) {

    /**
     * @return 不是战役分组主题时返回 null
     */
    static CampaignTopic parse(String topicPrefix, String destination) {
        String prefix = topicPrefix + "campaign.";
        if (destination == null || !destination.startsWith(prefix)) {
            return null;
        }
        String rest = destination.substring(prefix.length());
        int dot = rest.lastIndexOf('.');
        if (dot <= 0) {
            return new CampaignTopic(rest, null);
        }
        return new CampaignTopic(rest.substring(0, dot), Audience.fromSuffix(rest.substring(dot + 1)));
    }
}
