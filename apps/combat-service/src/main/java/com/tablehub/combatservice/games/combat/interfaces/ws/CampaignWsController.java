package com.tablehub.combatservice.games.combat.interfaces.ws;

import com.tablehub.combatservice.games.combat.application.command.CommandDispatcher;
import com.tablehub.combatservice.games.combat.application.command.CommandResult;
import com.tablehub.combatservice.games.combat.domain.error.CombatErrorCode;
import com.tablehub.combatservice.games.combat.domain.model.CharacterRecord;
import com.tablehub.combatservice.games.combat.domain.repository.RosterRepository;
import com.tablehub.combatservice.games.combat.interfaces.ws.dto.CampaignMessages.ChoiceCmd;
import com.tablehub.combatservice.games.combat.interfaces.ws.dto.CampaignMessages.CommandCmd;
import com.tablehub.combatservice.games.combat.interfaces.ws.dto.CampaignMessages.JoinCmd;
import com.tablehub.combatservice.games.combat.interfaces.ws.dto.CampaignMessages.SimpleCmd;
import com.tablehub.combatservice.platform.connection.CampaignPresenceService;
import com.tablehub.combatservice.platform.connection.ConnectionRecord;
import com.tablehub.combatservice.platform.connection.ConnectionRegistry;
import com.tablehub.combatservice.platform.notify.HubPayloads.PlayerChoicePayload;
import com.tablehub.combatservice.platform.notify.NotificationRouter;
import com.tablehub.combatservice.platform.transport.Envelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

import java.util.Objects;
import java.util.Optional;

/**
 * 战役 WebSocket 控制器
 * ----------------------------------------
 * 负责接收前端通过 STOMP 发送的指令（/app/campaign.* 与 /app/combat.command）。
 *
 *   1. join / leave：登记或移除连接，玩家上下线通知 DM
 *   2. combat.command：DM 界面的战斗命令，结果点对点回执到 /user/queue/combat.result
 *   3. campaign.choice：玩家提交选项，只推给 DM
 *
 * 权限：DM 可以发任何命令；玩家只能为自己控制的角色记录濒死检定。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class CampaignWsController {

    private static final String DEATH_SAVE_TOOL = "record_death_save";

    private final CampaignPresenceService presence;
    private final ConnectionRegistry registry;
    private final CommandDispatcher dispatcher;
    private final NotificationRouter router;
    private final RosterRepository rosterRepository;

    @MessageMapping("/campaign.join")
    @SendToUser("/queue/campaign.joined")
    public ConnectionRecord join(JoinCmd cmd, @Header("simpSessionId") String sessionId) {
        return presence.join(sessionId, cmd.getCampaignId(), cmd.getUserId(), cmd.getUserName(),
                cmd.getCharacterId(), cmd.isDm());
    }

    @MessageMapping("/campaign.leave")
    public void leave(SimpleCmd cmd, @Header("simpSessionId") String sessionId) {
        Optional<ConnectionRecord> rec = registry.find(sessionId);
        if (rec.isPresent() && !rec.get().campaignId().equals(cmd.getCampaignId())) {
            log.warn("忽略 leave：连接不在该战役 session={} campaign={}", sessionId, cmd.getCampaignId());
            return;
        }
        presence.leave(sessionId);
    }

    /**
     * 处理战斗命令。
     * 路径：/app/combat.command
     * 失败同样以 CommandResult 返回，不抛到 STOMP 错误帧。
     */
    @MessageMapping("/combat.command")
    @SendToUser("/queue/combat.result")
    public CommandResult command(CommandCmd cmd, @Header("simpSessionId") String sessionId) {
        Optional<ConnectionRecord> rec = registry.find(sessionId)
                .filter(r -> r.campaignId().equals(cmd.getCampaignId()));
        if (rec.isEmpty()) {
            return CommandResult.failure(cmd.getName(), CombatErrorCode.NOT_PERMITTED, "join the campaign first");
        }
        if (!permitted(rec.get(), cmd)) {
            log.info("命令被拒绝（权限）session={} user={} command={}", sessionId, rec.get().userId(), cmd.getName());
            return CommandResult.failure(cmd.getName(), CombatErrorCode.NOT_PERMITTED,
                    "players may only record death saves for their own character");
        }
        return dispatcher.dispatchToolCall(cmd.getCampaignId(), cmd.getName(), cmd.getArguments());
    }

    /**
     * 玩家提交选项 → PlayerChoiceSubmitted（只推给 DM）。
     */
    @MessageMapping("/campaign.choice")
    public void choice(ChoiceCmd cmd, @Header("simpSessionId") String sessionId) {
        ConnectionRecord rec = registry.find(sessionId)
                .filter(r -> r.campaignId().equals(cmd.getCampaignId()))
                .orElse(null);
        if (rec == null || StringUtils.isBlank(cmd.getChoice())) {
            log.warn("忽略无效的选项提交 session={} campaign={}", sessionId, cmd.getCampaignId());
            return;
        }
        String characterName = null;
        if (rec.characterId() != null) {
            characterName = rosterRepository.find(rec.campaignId(), rec.characterId())
                    .map(CharacterRecord::getName)
                    .orElse(null);
        }
        router.playerChoiceSubmitted(rec.campaignId(), new PlayerChoicePayload(rec.userId(), rec.characterId(),
                StringUtils.defaultIfBlank(characterName, rec.userName()), cmd.getChoice().trim(),
                System.currentTimeMillis()));
    }

    /** join 参数不合法等：回执到当前会话，不影响其他连接 */
    @MessageExceptionHandler(IllegalArgumentException.class)
    @SendToUser("/queue/errors")
    public Envelope<String> onBadRequest(IllegalArgumentException e) {
        log.info("WS 请求被拒绝: {}", e.getMessage());
        return Envelope.error(null, e.getMessage());
    }

    static boolean permitted(ConnectionRecord rec, CommandCmd cmd) {
        if (rec.isDm()) {
            return true;
        }
        if (!DEATH_SAVE_TOOL.equals(cmd.getName()) || rec.characterId() == null || cmd.getArguments() == null) {
            return false;
        }
        return Objects.equals(rec.characterId(), String.valueOf(cmd.getArguments().get("character_id")));
    }
}
