package com.tablehub.combatservice.games.combat.interfaces.http;

import com.tablehub.combatservice.common.WebExceptionAdvice;
import com.tablehub.combatservice.games.combat.application.command.CommandDispatcher;
import com.tablehub.combatservice.games.combat.application.command.CommandResult;
import com.tablehub.combatservice.games.combat.domain.error.CombatErrorCode;
import com.tablehub.combatservice.games.combat.domain.error.CombatException;
import com.tablehub.combatservice.games.combat.domain.model.NarrativeLogEntry;
import com.tablehub.combatservice.games.combat.domain.repository.NarrativeLogRepository;
import com.tablehub.combatservice.games.combat.service.CombatEngine;
import com.tablehub.combatservice.platform.connection.ConnectionRegistry;
import com.tablehub.combatservice.platform.notify.HubPayloads.CombatStatePayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CampaignRestControllerTest {

    private final CombatEngine engine = mock(CombatEngine.class);
    private final CommandDispatcher dispatcher = mock(CommandDispatcher.class);
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final NarrativeLogRepository narrativeLog = mock(NarrativeLogRepository.class);
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new CampaignRestController(engine, dispatcher, registry, narrativeLog))
                .setControllerAdvice(new WebExceptionAdvice())
                .build();
    }

    @Test
    void combatStateIsWrapped() throws Exception {
        when(engine.getCombatState("c1")).thenReturn(Optional.of(
                new CombatStatePayload("e1", true, 2, List.of(), 0, null, 5)));

        mvc.perform(get("/api/campaigns/c1/combat"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.roundNumber").value(2));
    }

    @Test
    void failedToolCallMapsErrorCodeToStatus() throws Exception {
        when(dispatcher.dispatchToolCall(eq("c1"), eq("advance_turn"), anyMap()))
                .thenReturn(CommandResult.failure("advance_turn", CombatErrorCode.NO_ACTIVE_COMBAT, "no active combat"));

        mvc.perform(post("/api/campaigns/c1/tool-calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"advance_turn\",\"arguments\":{}}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("NO_ACTIVE_COMBAT"))
                .andExpect(jsonPath("$.retryable").value(false))
                .andExpect(jsonPath("$.data.success").value(false));
    }

    @Test
    void successfulToolCallReturnsResult() throws Exception {
        when(dispatcher.dispatchToolCall(eq("c1"), eq("apply_damage"), anyMap()))
                .thenReturn(CommandResult.ok("apply_damage", Map.of("currentHp", 3)));

        mvc.perform(post("/api/campaigns/c1/tool-calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"apply_damage\",\"arguments\":{\"combatant_id\":\"goblin\",\"amount\":4}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.data.currentHp").value(3));
    }

    @Test
    void missingToolNameIsBadRequest() throws Exception {
        mvc.perform(post("/api/campaigns/c1/tool-calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"arguments\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));
    }

    @Test
    void cancelledSnapshotSurfacesThroughAdvice() throws Exception {
        when(engine.snapshot("c1")).thenThrow(new CombatException(CombatErrorCode.CANCELLED, "busy"));

        mvc.perform(get("/api/campaigns/c1/snapshot"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("CANCELLED"));
    }

    @Test
    void connectionsListsOnlinePlayers() throws Exception {
        registry.join("s-dm", "c1", "u-dm", "DM", null, true);
        registry.join("s-p1", "c1", "u1", "Alice", "thorin", false);

        mvc.perform(get("/api/campaigns/c1/connections"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].characterId").value("thorin"));
    }

    @Test
    void narrativeLogReturnsRecentEntries() throws Exception {
        when(narrativeLog.recent("c1", 2)).thenReturn(List.of(
                NarrativeLogEntry.builder().id("l1").entry("Crossed the river").importance("standard").build()));

        mvc.perform(get("/api/campaigns/c1/log").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].entry").value("Crossed the river"));
        mvc.perform(get("/api/campaigns/c1/log").param("limit", "0"))
                .andExpect(status().isBadRequest());
    }
}
