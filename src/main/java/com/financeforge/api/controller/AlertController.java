package com.financeforge.api.controller;

import com.financeforge.alerts.Alert;
import com.financeforge.alerts.AlertEngine;
import com.financeforge.alerts.AlertRule;
import com.financeforge.optimization.OptimizationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for evaluating alerts and listing the registered alert rules.
 */
@RestController
@RequestMapping("/api/v1/alerts")
@RequiredArgsConstructor
@Tag(name = "Alerts", description = "Alert evaluation")
public class AlertController {

    private final OptimizationService optimizationService;
    private final AlertEngine alertEngine;

    @GetMapping
    @Operation(summary = "Evaluate every alert rule over the latest balances")
    public ResponseEntity<List<Alert>> evaluateAlerts(@RequestParam(required = false) BigDecimal annualIncome) {
        return ResponseEntity.ok(optimizationService.evaluateAlerts(annualIncome));
    }

    @GetMapping("/rules")
    @Operation(summary = "List registered alert rules")
    public ResponseEntity<List<Map<String, String>>> getRules() {
        List<Map<String, String>> rules = alertEngine.getRules().stream()
            .map(AlertController::describe)
            .toList();
        return ResponseEntity.ok(rules);
    }

    private static Map<String, String> describe(AlertRule rule) {
        Map<String, String> description = new LinkedHashMap<>();
        description.put("kind", rule.getKind());
        description.put("severity", rule.getSeverity().name());
        description.put("scope", rule.getScope().name());
        description.put("messageTemplate", rule.getMessageTemplate());
        return description;
    }
}
