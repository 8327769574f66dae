package com.financeforge.optimization;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted sum over the registered risk factors.
 *
 * The score is divided by the total weight, so it stays in [0,1] even when the
 * configured weights do not add up to exactly 1.
 */
@Component
@Slf4j
public class RiskModel {

    private final List<RiskFactor> factors;
    private final double totalWeight;

    public RiskModel(List<RiskFactor> factors) {
        this.factors = List.copyOf(factors);
        this.totalWeight = factors.stream().mapToDouble(RiskFactor::getWeight).sum();
        if (this.totalWeight <= 0.0) {
            throw new IllegalStateException("Risk factor weights must add up to a positive total");
        }
        if (Math.abs(totalWeight - 1.0) > 1e-9) {
            log.warn("Risk factor weights add up to {}, scores will be rescaled", totalWeight);
        }
        log.debug("Risk model factors: {}", factors.stream().map(RiskFactor::getName).toList());
    }

    public Map<String, Double> breakdown(TransferCandidate candidate) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (RiskFactor factor : factors) {
            values.put(factor.getName(), round(factor.normalize(candidate)));
        }
        return values;
    }

    public double score(TransferCandidate candidate) {
        double weighted = 0.0;
        for (RiskFactor factor : factors) {
            weighted += factor.getWeight() * factor.normalize(candidate);
        }
        return round(Math.max(0.0, Math.min(1.0, weighted / totalWeight)));
    }

    public List<RiskFactor> getFactors() {
        return factors;
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
