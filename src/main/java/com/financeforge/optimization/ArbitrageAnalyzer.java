package com.financeforge.optimization;

import com.financeforge.common.Amounts;
import com.financeforge.projection.AccountPosition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds interest-rate arbitrage between accounts.
 *
 * For every source with a balance and every destination with a lower rate and
 * room under its limit, the transfer is the smaller of the source balance and the
 * destination's room. Savings use simple interest on the transferred amount:
 * monthly = amount * (r_s - r_d) / 12, annual = monthly * 12.
 */
@Component
@Slf4j
public class ArbitrageAnalyzer {

    private static final BigDecimal MONTHS = BigDecimal.valueOf(12);
    private static final int WORKING_SCALE = 10;

    private static final Comparator<OptimizationOpportunity> RANKING =
        Comparator.comparing(OptimizationOpportunity::getAnnualSavings).reversed()
            .thenComparingDouble(OptimizationOpportunity::getRiskScore)
            .thenComparing(OptimizationOpportunity::getFromAccountId)
            .thenComparing(OptimizationOpportunity::getToAccountId);

    private final RiskModel riskModel;
    private final BigDecimal significanceThreshold;

    public ArbitrageAnalyzer(RiskModel riskModel,
                             @Value("${financeforge.optimization.significance-threshold:100.00}") BigDecimal significanceThreshold) {
        this.riskModel = riskModel;
        this.significanceThreshold = significanceThreshold;
    }

    public List<OptimizationOpportunity> findOpportunities(List<AccountPosition> positions, LocalDate evaluationDate) {
        List<OptimizationOpportunity> opportunities = new ArrayList<>();

        for (AccountPosition source : positions) {
            if (!source.hasBalance()) {
                continue;
            }
            for (AccountPosition destination : positions) {
                if (destination == source || !destination.getAccount().hasCreditLimit()) {
                    continue;
                }
                if (source.getApr().compareTo(destination.getApr()) <= 0) {
                    continue;
                }
                BigDecimal capacity = destination.availableCapacity();
                if (capacity.signum() <= 0) {
                    continue;
                }

                BigDecimal transfer = Amounts.min(source.getBalance(), capacity);
                TransferCandidate candidate = new TransferCandidate(source, destination, transfer, evaluationDate);
                BigDecimal monthly = transfer.multiply(candidate.getRateDifferential())
                    .divide(MONTHS, WORKING_SCALE, RoundingMode.HALF_UP);
                BigDecimal annual = Amounts.round(monthly.multiply(MONTHS));

                if (annual.compareTo(significanceThreshold) < 0) {
                    log.debug("Skipping {} -> {}: annual savings {} below threshold {}",
                        source.getAccountId(), destination.getAccountId(), annual, significanceThreshold);
                    continue;
                }

                opportunities.add(OptimizationOpportunity.builder()
                    .fromAccountId(source.getAccountId())
                    .toAccountId(destination.getAccountId())
                    .transferAmount(transfer)
                    .rateDifferential(candidate.getRateDifferential())
                    .monthlySavings(Amounts.round(monthly))
                    .annualSavings(annual)
                    .riskScore(riskModel.score(candidate))
                    .riskFactors(riskModel.breakdown(candidate))
                    .build());
            }
        }

        opportunities.sort(RANKING);
        log.info("Found {} arbitrage opportunities across {} accounts", opportunities.size(), positions.size());
        return opportunities;
    }
}
