package com.tablehub.combatservice.platform.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * combat-service 配置（前缀 combat）。
 */
@Component
@ConfigurationProperties(prefix = "combat")
public class CombatProperties {

    /**
     * 遭遇战与名册 key 的过期时间，每次写入时续期。
     */
    private Duration stateTtl = Duration.ofHours(48);

    /**
     * 等待进入战役串行区的最长时间；超时视为取消，不会写入任何数据。
     */
    private Duration operationTimeout = Duration.ofSeconds(5);

    /**
     * 分组主题前缀，分组 campaign.{id}.all 对应 /topic/campaign.{id}.all
     */
    private String topicPrefix = "/topic/";

    /** 叙事日志每个战役保留的最大条数 */
    private int narrativeLogLimit = 200;

    public Duration getStateTtl() {
        return stateTtl;
    }

    public void setStateTtl(Duration stateTtl) {
        this.stateTtl = stateTtl;
    }

    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    public void setOperationTimeout(Duration operationTimeout) {
        this.operationTimeout = operationTimeout;
    }

    public String getTopicPrefix() {
        return topicPrefix;
    }

    public void setTopicPrefix(String topicPrefix) {
        this.topicPrefix = topicPrefix;
    }

    public int getNarrativeLogLimit() {
        return narrativeLogLimit;
    }

    public void setNarrativeLogLimit(int narrativeLogLimit) {
        this.narrativeLogLimit = narrativeLogLimit;
    }
}
