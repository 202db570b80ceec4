package com.strategymonitor.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.strategymonitor.alarm.AlarmStateMachine;
import com.strategymonitor.api.controller.StrategyController;
import com.strategymonitor.config.ApiResponseAdvice;
import com.strategymonitor.core.engine.LegSpec;
import com.strategymonitor.core.engine.StrategyMonitorEngine;
import com.strategymonitor.domain.enums.AlarmState;
import com.strategymonitor.domain.enums.LegSide;
import com.strategymonitor.domain.enums.StrategyStatus;
import com.strategymonitor.domain.enums.TargetCondition;
import com.strategymonitor.domain.model.StrategySnapshot;
import com.strategymonitor.exception.EngineStoppedException;
import com.strategymonitor.exception.GlobalExceptionHandler;
import com.strategymonitor.exception.ResourceNotFoundException;
import com.strategymonitor.exception.UnrecognizedStrategyException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for StrategyController.
 *
 * <p>Verifies: response envelope, leg defaults on create, validation errors (400),
 * unknown ids (404), unrecognized descriptions (422) and edits after shutdown (503).
 */
class StrategyControllerTest {

    private MockMvc mockMvc;

    @Mock
    private StrategyMonitorEngine strategyMonitorEngine;

    @Mock
    private AlarmStateMachine alarmStateMachine;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        StrategyController controller = new StrategyController(strategyMonitorEngine, alarmStateMachine);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void createStrategy_defaultsLegQuantityAndWrapsResponse() throws Exception {
        when(strategyMonitorEngine.createStrategy(eq("H6 fly"), any(), any(), anyList()))
                .thenReturn(snapshot("S1", "H6 fly", null));

        mockMvc.perform(post("/api/strategies")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"name":"H6 fly","targetPrice":0,"targetCondition":"BELOW","legs":[{"ticker":"sfrh6c 96.5","side":"SHORT"}]}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.error").doesNotExist())
                .andExpect(jsonPath("$.data.id").value("S1"))
                .andExpect(jsonPath("$.data.priceComplete").value(false));

        ArgumentCaptor<List<LegSpec>> legs = ArgumentCaptor.forClass(List.class);
        verify(strategyMonitorEngine).createStrategy(eq("H6 fly"), any(), eq(TargetCondition.BELOW), legs.capture());
        assertThat(legs.getValue())
                .containsExactly(new LegSpec("sfrh6c 96.5", LegSide.SHORT, 1));
    }

    @Test
    void createStrategy_blankName_returns400() throws Exception {
        mockMvc.perform(post("/api/strategies")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"name":""}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.data").doesNotExist())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.name").exists())
                .andExpect(jsonPath("$.error.path").value("/api/strategies"));
    }

    @Test
    void createLeg_zeroQuantity_returns400() throws Exception {
        mockMvc.perform(post("/api/strategies/S1/legs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"ticker":"SFRH6C 96.5 COMDTY","quantity":0}
                        """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getStrategy_includesAlarmStateAndPrice() throws Exception {
        when(strategyMonitorEngine.getStrategy("S1")).thenReturn(snapshot("S1", "H6 fly", new BigDecimal("-0.95")));
        when(alarmStateMachine.state("S1")).thenReturn(AlarmState.ARMED);

        mockMvc.perform(get("/api/strategies/S1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.price").value(-0.95))
                .andExpect(jsonPath("$.data.priceComplete").value(true))
                .andExpect(jsonPath("$.data.alarmState").value("ARMED"));
    }

    @Test
    void getStrategy_unknown_returns404() throws Exception {
        when(strategyMonitorEngine.getStrategy("nope")).thenThrow(new ResourceNotFoundException("Strategy", "nope"));

        mockMvc.perform(get("/api/strategies/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void parse_unrecognized_returns422() throws Exception {
        when(strategyMonitorEngine.createStrategyFromDescription(eq("blah"), isNull(), isNull()))
                .thenThrow(new UnrecognizedStrategyException("blah", "no underlying and expiry code found"));

        mockMvc.perform(post("/api/strategies/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"description":"blah"}
                        """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("UNRECOGNIZED_STRATEGY"))
                .andExpect(jsonPath("$.error.retryable").value(false))
                .andExpect(jsonPath("$.error.details.description").value("blah"))
                .andExpect(jsonPath("$.error.details.reason").value("no underlying and expiry code found"));
    }

    @Test
    void updateStatus_afterShutdown_returns503() throws Exception {
        when(strategyMonitorEngine.updateStatus("S1", StrategyStatus.DONE))
                .thenThrow(new EngineStoppedException("updateStatus"));

        mockMvc.perform(put("/api/strategies/S1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"status":"DONE"}
                        """))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "5"))
                .andExpect(jsonPath("$.error.code").value("ENGINE_STOPPED"))
                .andExpect(jsonPath("$.error.retryable").value(true))
                .andExpect(jsonPath("$.error.details.operation").value("updateStatus"));
    }

    @Test
    void createStrategy_malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/api/strategies").contentType(MediaType.APPLICATION_JSON).content("{\"name\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.error.details").doesNotExist());
    }

    @Test
    void removeStrategy_returnsConfirmation() throws Exception {
        mockMvc.perform(delete("/api/strategies/S1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.strategyId").value("S1"));

        verify(strategyMonitorEngine).removeStrategy("S1");
    }

    @Test
    void continueAlarm_rearms() throws Exception {
        when(strategyMonitorEngine.continueAlarm("S1")).thenReturn(snapshot("S1", "H6 fly", null));

        mockMvc.perform(post("/api/strategies/S1/continue")).andExpect(status().isOk());

        verify(strategyMonitorEngine).continueAlarm("S1");
    }

    private static StrategySnapshot snapshot(String id, String name, BigDecimal price) {
        Instant now = Instant.parse("2026-03-02T10:00:00Z");
        return new StrategySnapshot(
                id, name, List.of(), BigDecimal.ZERO, TargetCondition.BELOW, StrategyStatus.ACTIVE, price, now, now);
    }
}
