package com.financeforge.optimization;

import com.financeforge.accounts.AccountService;
import com.financeforge.alerts.Alert;
import com.financeforge.alerts.AlertContext;
import com.financeforge.alerts.AlertEngine;
import com.financeforge.phase.PhaseAssessment;
import com.financeforge.phase.PhaseService;
import com.financeforge.projection.AccountPosition;
import com.financeforge.projection.ProjectionBuilder;
import com.financeforge.projection.Snapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Read-only analysis over the latest snapshot. Nothing here appends to the ledger;
 * applying an opportunity goes through the ledger's transfer command.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OptimizationService {

    private final ProjectionBuilder projectionBuilder;
    private final AccountService accountService;
    private final ArbitrageAnalyzer arbitrageAnalyzer;
    private final AvalancheAllocator avalancheAllocator;
    private final PhaseService phaseService;
    private final AlertEngine alertEngine;
    private final Clock clock;

    /**
     * @param availableFunds monthly payment budget, or null to skip allocation
     * @param annualIncome   income, or null to skip phase classification
     */
    public OptimizationReport requestOptimization(BigDecimal availableFunds, BigDecimal annualIncome) {
        Instant now = clock.instant();
        Snapshot snapshot = projectionBuilder.snapshot(null);
        List<AccountPosition> positions = AccountPosition.of(accountService.getAccounts(), snapshot);
        LocalDate today = LocalDate.now(clock);

        List<OptimizationOpportunity> opportunities = arbitrageAnalyzer.findOpportunities(positions, today);
        AllocationPlan allocation = availableFunds != null
            ? avalancheAllocator.allocate(positions, availableFunds)
            : null;
        PhaseAssessment phase = annualIncome != null
            ? phaseService.assess(positions, annualIncome)
            : null;

        List<Alert> alerts = alertEngine.evaluate(AlertContext.builder()
            .snapshot(snapshot)
            .positions(positions)
            .opportunities(opportunities)
            .phase(phase)
            .evaluationDate(today)
            .build());

        log.info("Optimization over {} accounts: {} opportunities, {} alerts",
            positions.size(), opportunities.size(), alerts.size());
        return OptimizationReport.builder()
            .generatedAt(now)
            .opportunities(opportunities)
            .allocation(allocation)
            .phase(phase)
            .alerts(alerts)
            .build();
    }

    public List<OptimizationOpportunity> findOpportunities() {
        List<AccountPosition> positions = positions();
        return arbitrageAnalyzer.findOpportunities(positions, LocalDate.now(clock));
    }

    public AllocationPlan allocate(BigDecimal availableFunds) {
        return avalancheAllocator.allocate(positions(), availableFunds);
    }

    /**
     * Alerts from one evaluation cycle; the phase is included only when income is given.
     */
    public List<Alert> evaluateAlerts(BigDecimal annualIncome) {
        return requestOptimization(null, annualIncome).getAlerts();
    }

    public List<AccountPosition> positions() {
        return AccountPosition.of(accountService.getAccounts(), projectionBuilder.snapshot(null));
    }
}
