package com.financeforge.optimization;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.temporal.ChronoUnit;

/**
 * Default risk factors for balance-transfer opportunities.
 * Additional factors are added by declaring further {@link RiskFactor} beans.
 */
@Configuration
public class RiskFactorCatalog {

    public static final String RATE_DIFFERENTIAL = "rateDifferential";
    public static final String BALANCE_EXPOSURE = "balanceExposure";
    public static final String LIMIT_PROXIMITY = "limitProximity";
    public static final String PROMO_EXPIRY = "promoExpiry";

    /**
     * Thin spreads carry more risk: fees or a rate change can erase them.
     */
    @Bean
    public RiskFactor rateDifferentialFactor(
            @Value("${financeforge.optimization.risk.rate-differential.weight:0.4}") double weight,
            @Value("${financeforge.optimization.risk.rate-differential.cap:0.30}") double cap) {
        return rateDifferential(weight, cap);
    }

    @Bean
    public RiskFactor balanceExposureFactor(
            @Value("${financeforge.optimization.risk.balance-exposure.weight:0.2}") double weight,
            @Value("${financeforge.optimization.risk.balance-exposure.cap:50000}") double cap) {
        return balanceExposure(weight, cap);
    }

    @Bean
    public RiskFactor limitProximityFactor(
            @Value("${financeforge.optimization.risk.limit-proximity.weight:0.3}") double weight) {
        return limitProximity(weight);
    }

    @Bean
    public RiskFactor promoExpiryFactor(
            @Value("${financeforge.optimization.risk.promo-expiry.weight:0.1}") double weight,
            @Value("${financeforge.optimization.risk.promo-expiry.horizon-days:365}") long horizonDays) {
        return promoExpiry(weight, horizonDays);
    }

    public static RiskFactor rateDifferential(double weight, double cap) {
        return new RiskFactor(RATE_DIFFERENTIAL, weight,
            candidate -> 1.0 - candidate.getRateDifferential().doubleValue() / cap);
    }

    public static RiskFactor balanceExposure(double weight, double cap) {
        return new RiskFactor(BALANCE_EXPOSURE, weight,
            candidate -> candidate.getTransferAmount().doubleValue() / cap);
    }

    /**
     * Destination utilization after the transfer; near the limit, penalty rates loom.
     */
    public static RiskFactor limitProximity(double weight) {
        return new RiskFactor(LIMIT_PROXIMITY, weight, candidate -> {
            BigDecimal limit = candidate.getDestination().getAccount().getCreditLimit();
            if (limit == null || limit.signum() == 0) {
                return 1.0;
            }
            BigDecimal after = candidate.getDestination().getBalance().add(candidate.getTransferAmount());
            return after.divide(limit, MathContext.DECIMAL64).doubleValue();
        });
    }

    public static RiskFactor promoExpiry(double weight, long horizonDays) {
        return new RiskFactor(PROMO_EXPIRY, weight, candidate -> {
            var expiry = candidate.getDestination().getAccount().getPromoRateExpiry();
            if (expiry == null) {
                return 0.0;
            }
            long daysRemaining = ChronoUnit.DAYS.between(candidate.getEvaluationDate(), expiry);
            if (daysRemaining <= 0) {
                return 1.0;
            }
            return 1.0 - (double) daysRemaining / horizonDays;
        });
    }
}
