package com.strategymonitor.api.controller;

import com.strategymonitor.alarm.AlarmStateMachine;
import com.strategymonitor.api.dto.request.CreateStrategyRequest;
import com.strategymonitor.api.dto.request.LegRequest;
import com.strategymonitor.api.dto.request.ParseStrategyRequest;
import com.strategymonitor.api.dto.request.RenameStrategyRequest;
import com.strategymonitor.api.dto.request.UpdateLegRequest;
import com.strategymonitor.api.dto.request.UpdateLegTickerRequest;
import com.strategymonitor.api.dto.request.UpdateStatusRequest;
import com.strategymonitor.api.dto.request.UpdateTargetRequest;
import com.strategymonitor.api.dto.response.LegResponse;
import com.strategymonitor.api.dto.response.StrategyResponse;
import com.strategymonitor.core.engine.LegSpec;
import com.strategymonitor.core.engine.StrategyMonitorEngine;
import com.strategymonitor.domain.model.StrategySnapshot;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for strategy and leg editing.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/strategies -- list strategies</li>
 *   <li>GET /api/strategies/{id} -- one strategy</li>
 *   <li>POST /api/strategies -- create, optionally with legs</li>
 *   <li>POST /api/strategies/parse -- create from a free-text description</li>
 *   <li>PUT /api/strategies/{id}/name -- rename</li>
 *   <li>PUT /api/strategies/{id}/target -- set target price and condition</li>
 *   <li>PUT /api/strategies/{id}/status -- ACTIVE / DONE / CANCELLED</li>
 *   <li>POST /api/strategies/{id}/continue -- re-arm the alarm after it fired</li>
 *   <li>DELETE /api/strategies/{id} -- remove</li>
 *   <li>POST /api/strategies/{id}/legs -- add a leg</li>
 *   <li>PUT /api/strategies/{id}/legs/{legId}/ticker -- change or clear a leg's ticker</li>
 *   <li>PUT /api/strategies/{id}/legs/{legId} -- change side / quantity</li>
 *   <li>DELETE /api/strategies/{id}/legs/{legId} -- remove a leg</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/strategies")
public class StrategyController {

    private static final Logger log = LoggerFactory.getLogger(StrategyController.class);

    private final StrategyMonitorEngine strategyMonitorEngine;
    private final AlarmStateMachine alarmStateMachine;

    public StrategyController(StrategyMonitorEngine strategyMonitorEngine, AlarmStateMachine alarmStateMachine) {
        this.strategyMonitorEngine = strategyMonitorEngine;
        this.alarmStateMachine = alarmStateMachine;
    }

    @GetMapping
    public ResponseEntity<List<StrategyResponse>> listStrategies() {
        List<StrategyResponse> strategies = strategyMonitorEngine.listStrategies().stream()
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(strategies);
    }

    @GetMapping("/{id}")
    public ResponseEntity<StrategyResponse> getStrategy(@PathVariable String id) {
        return ResponseEntity.ok(toResponse(strategyMonitorEngine.getStrategy(id)));
    }

    @PostMapping
    public ResponseEntity<StrategyResponse> createStrategy(@Valid @RequestBody CreateStrategyRequest request) {
        List<LegSpec> legs = request.getLegs() == null
                ? List.of()
                : request.getLegs().stream().map(this::toLegSpec).toList();
        log.info("Creating strategy: name={}, legs={}", request.getName(), legs.size());
        StrategySnapshot created = strategyMonitorEngine.createStrategy(
                request.getName(), request.getTargetPrice(), request.getTargetCondition(), legs);
        return ResponseEntity.ok(toResponse(created));
    }

    /**
     * Creates a strategy from trader shorthand. Unrecognized shapes are rejected with
     * 422 UNRECOGNIZED_STRATEGY instead of guessing leg signs.
     */
    @PostMapping("/parse")
    public ResponseEntity<StrategyResponse> createFromDescription(@Valid @RequestBody ParseStrategyRequest request) {
        log.info("Creating strategy from description: {}", request.getDescription());
        StrategySnapshot created = strategyMonitorEngine.createStrategyFromDescription(
                request.getDescription(), request.getTargetPrice(), request.getTargetCondition());
        return ResponseEntity.ok(toResponse(created));
    }

    @PutMapping("/{id}/name")
    public ResponseEntity<StrategyResponse> rename(
            @PathVariable String id, @Valid @RequestBody RenameStrategyRequest request) {
        return ResponseEntity.ok(toResponse(strategyMonitorEngine.renameStrategy(id, request.getName())));
    }

    @PutMapping("/{id}/target")
    public ResponseEntity<StrategyResponse> updateTarget(
            @PathVariable String id, @RequestBody UpdateTargetRequest request) {
        StrategySnapshot updated =
                strategyMonitorEngine.updateTarget(id, request.getTargetPrice(), request.getTargetCondition());
        return ResponseEntity.ok(toResponse(updated));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<StrategyResponse> updateStatus(
            @PathVariable String id, @Valid @RequestBody UpdateStatusRequest request) {
        return ResponseEntity.ok(toResponse(strategyMonitorEngine.updateStatus(id, request.getStatus())));
    }

    @PostMapping("/{id}/continue")
    public ResponseEntity<StrategyResponse> continueAlarm(@PathVariable String id) {
        return ResponseEntity.ok(toResponse(strategyMonitorEngine.continueAlarm(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> removeStrategy(@PathVariable String id) {
        strategyMonitorEngine.removeStrategy(id);
        return ResponseEntity.ok(Map.of("strategyId", id, "message", "Strategy removed"));
    }

    // ---- Legs ----

    @PostMapping("/{id}/legs")
    public ResponseEntity<LegResponse> createLeg(@PathVariable String id, @Valid @RequestBody LegRequest request) {
        return ResponseEntity.ok(LegResponse.from(strategyMonitorEngine.createLeg(id, toLegSpec(request))));
    }

    @PutMapping("/{id}/legs/{legId}/ticker")
    public ResponseEntity<StrategyResponse> updateLegTicker(
            @PathVariable String id, @PathVariable String legId, @RequestBody UpdateLegTickerRequest request) {
        return ResponseEntity.ok(toResponse(strategyMonitorEngine.updateLegTicker(id, legId, request.getTicker())));
    }

    @PutMapping("/{id}/legs/{legId}")
    public ResponseEntity<StrategyResponse> updateLeg(
            @PathVariable String id, @PathVariable String legId, @Valid @RequestBody UpdateLegRequest request) {
        StrategySnapshot updated =
                strategyMonitorEngine.updateLeg(id, legId, request.getSide(), request.getQuantity());
        return ResponseEntity.ok(toResponse(updated));
    }

    @DeleteMapping("/{id}/legs/{legId}")
    public ResponseEntity<StrategyResponse> removeLeg(@PathVariable String id, @PathVariable String legId) {
        return ResponseEntity.ok(toResponse(strategyMonitorEngine.removeLeg(id, legId)));
    }

    private LegSpec toLegSpec(LegRequest request) {
        int quantity = request.getQuantity() != null ? request.getQuantity() : 1;
        return new LegSpec(request.getTicker(), request.getSide(), quantity);
    }

    private StrategyResponse toResponse(StrategySnapshot snapshot) {
        return StrategyResponse.from(snapshot, alarmStateMachine.state(snapshot.id()));
    }
}
