package com.financeforge.optimization;

import lombok.Value;

import java.util.function.ToDoubleFunction;

/**
 * One weighted input to an opportunity's risk score.
 * The normalizer maps a candidate to [0,1]; values outside are clamped.
 */
@Value
public class RiskFactor {
    String name;
    double weight;
    ToDoubleFunction<TransferCandidate> normalizer;

    public double normalize(TransferCandidate candidate) {
        double value = normalizer.applyAsDouble(candidate);
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
