package com.financeforge.api.controller;

import com.financeforge.phase.PhaseAssessment;
import com.financeforge.phase.PhaseService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

/**
 * REST API for classifying the portfolio's financial phase.
 */
@RestController
@RequestMapping("/api/v1/phase")
@RequiredArgsConstructor
@Tag(name = "Phase", description = "Financial phase classification")
public class PhaseController {

    private final PhaseService phaseService;

    @GetMapping
    @Operation(summary = "Classify the portfolio for the given annual income")
    public ResponseEntity<PhaseAssessment> classifyPhase(@RequestParam BigDecimal annualIncome) {
        return ResponseEntity.ok(phaseService.assess(annualIncome));
    }
}
