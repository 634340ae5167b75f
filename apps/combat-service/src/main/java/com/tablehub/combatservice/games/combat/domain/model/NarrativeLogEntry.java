package com.tablehub.combatservice.games.combat.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 叙事日志条目：模型在重要事件之后记录，用于之后的对话恢复上下文。
 * importance 取值 minor / standard / critical。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NarrativeLogEntry {

    public static final String MINOR = "minor";
    public static final String STANDARD = "standard";
    public static final String CRITICAL = "critical";

    private String id;
    private String entry;
    private String importance;
    private long createdAt;
}
