package com.tablehub.combatservice.games.combat.interfaces.ws;

import com.tablehub.combatservice.games.combat.domain.dto.CampaignSnapshot;
import com.tablehub.combatservice.games.combat.domain.error.CombatException;
import com.tablehub.combatservice.games.combat.interfaces.ws.dto.CampaignMessages.SimpleCmd;
import com.tablehub.combatservice.games.combat.service.CombatEngine;
import com.tablehub.combatservice.platform.transport.Envelope;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

/**
 * 断线重连 / 刷新后的恢复端点：
 * 返回遭遇战 + 名册的完整快照，客户端整体替换本地状态（错过的事件不补发）。
 */
@Controller
@RequiredArgsConstructor
public class CampaignResumeController {

    private final CombatEngine engine;

    @MessageMapping("/campaign.resume")
    @SendToUser("/queue/campaign.full")
    public Envelope<CampaignSnapshot> onResume(SimpleCmd cmd) {
        CampaignSnapshot s = engine.snapshot(cmd.getCampaignId());
        long seq = s.combat() == null ? 0L : s.combat().version();
        return Envelope.state(s.campaignId(), s, seq);
    }

    @MessageExceptionHandler(CombatException.class)
    @SendToUser("/queue/errors")
    public Envelope<String> onError(CombatException e) {
        return Envelope.error(null, e.getCode().name() + ": " + e.getMessage());
    }
}
