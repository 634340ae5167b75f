package com.tablehub.combatservice.games.combat.interfaces.ws.dto;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WebSocket 消息对象定义（客户端 -> 服务端）
 * ----------------------------------------
 * 通过 /app/... 发送；服务端的推送统一使用 Envelope。
 */
public class CampaignMessages {

    /**
     * 加入战役房间。
     * 身份信息由上游认证后直接放在消息里，这里不再校验。
     */
    @Data
    public static class JoinCmd {
        private String campaignId;
        private String userId;
        private String userName;
        private String characterId; // 可空；DM 或旁观者没有角色
        private boolean dm;
    }

    /** 只带 campaignId 的简单命令（leave / resume） */
    @Data
    public static class SimpleCmd {
        private String campaignId;
    }

    /**
     * 战斗命令：name 为工具名（如 apply_damage），arguments 为 snake_case 参数。
     */
    @Data
    public static class CommandCmd {
        private String campaignId;
        private String name;
        private Map<String, Object> arguments = new LinkedHashMap<>();
    }

    /** 玩家提交的选项 */
    @Data
    public static class ChoiceCmd {
        private String campaignId;
        private String choice;
    }
}
