package com.tablehub.combatservice.games.combat.interfaces.http;

import com.tablehub.combatservice.games.combat.application.command.CommandDispatcher;
import com.tablehub.combatservice.games.combat.application.command.CommandResult;
import com.tablehub.combatservice.games.combat.domain.dto.CampaignSnapshot;
import com.tablehub.combatservice.games.combat.domain.error.CombatErrorCode;
import com.tablehub.combatservice.games.combat.domain.model.NarrativeLogEntry;
import com.tablehub.combatservice.games.combat.domain.repository.NarrativeLogRepository;
import com.tablehub.combatservice.games.combat.service.CombatEngine;
import com.tablehub.combatservice.platform.connection.ConnectionRecord;
import com.tablehub.combatservice.platform.connection.ConnectionRegistry;
import com.tablehub.combatservice.platform.notify.HubPayloads.CombatStatePayload;
import com.tablehub.web.common.ApiResponse;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 战役 http 接口：查询战斗状态 / 快照 / 在线玩家 / 叙事日志，以及模型工具调用入口。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/campaigns/{campaignId}")
public class CampaignRestController {

    private final CombatEngine engine;
    private final CommandDispatcher dispatcher;
    private final ConnectionRegistry registry;
    private final NarrativeLogRepository narrativeLog;

    /** 当前遭遇战；未在战斗中时 data 为 null */
    @GetMapping("/combat")
    public ResponseEntity<ApiResponse<CombatStatePayload>> combat(@PathVariable String campaignId) {
        return ResponseEntity.ok(ApiResponse.success(engine.getCombatState(campaignId).orElse(null)));
    }

    @GetMapping("/snapshot")
    public ResponseEntity<ApiResponse<CampaignSnapshot>> snapshot(@PathVariable String campaignId) {
        return ResponseEntity.ok(ApiResponse.success(engine.snapshot(campaignId)));
    }

    /**
     * 模型工具调用。领域失败按错误码映射 HTTP 状态，结果体仍然是 CommandResult。
     */
    @PostMapping("/tool-calls")
    public ResponseEntity<ApiResponse<CommandResult>> toolCall(@PathVariable String campaignId,
                                                               @RequestBody ToolCallRequest req) {
        if (StringUtils.isBlank(req.getName())) {
            throw new IllegalArgumentException("tool name is required");
        }
        CommandResult result = dispatcher.dispatchToolCall(campaignId, req.getName(), req.getArguments());
        if (result.success()) {
            return ResponseEntity.ok(ApiResponse.success(result));
        }
        CombatErrorCode code = result.code();
        ApiResponse<CommandResult> body = new ApiResponse<>(code.httpStatus(), result.message(),
                result.errorCode(), result.retryable(), result);
        return ResponseEntity.status(code.httpStatus()).body(body);
    }

    @GetMapping("/connections")
    public ResponseEntity<ApiResponse<List<ConnectionRecord>>> connections(@PathVariable String campaignId) {
        return ResponseEntity.ok(ApiResponse.success(registry.connectedPlayers(campaignId)));
    }

    /** 最近的叙事日志，旧的在前；limit 取 1..200 */
    @GetMapping("/log")
    public ResponseEntity<ApiResponse<List<NarrativeLogEntry>>> recentLog(@PathVariable String campaignId,
                                                                          @RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > 200) {
            throw new IllegalArgumentException("limit must be between 1 and 200");
        }
        return ResponseEntity.ok(ApiResponse.success(narrativeLog.recent(campaignId, limit)));
    }

    @Data
    public static class ToolCallRequest {
        private String name;
        private Map<String, Object> arguments = new LinkedHashMap<>();
    }
}
