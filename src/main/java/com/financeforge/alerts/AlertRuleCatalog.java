package com.financeforge.alerts;

import com.financeforge.phase.Phase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.temporal.ChronoUnit;

/**
 * Default alert rules.
 */
@Configuration
public class AlertRuleCatalog {

    @Bean
    public AlertRule overLimitRule() {
        return AlertRule.builder()
            .kind("OVER_LIMIT")
            .severity(AlertSeverity.CRITICAL)
            .scope(AlertScope.ACCOUNT)
            .predicate((subject, context) -> {
                var account = subject.getPosition().getAccount();
                return account.hasCreditLimit()
                    && subject.getPosition().getBalance().compareTo(account.getCreditLimit()) > 0;
            })
            .messageTemplate("{name} is over its limit: balance {balance} against limit {limit}")
            .build();
    }

    @Bean
    public AlertRule highUtilizationRule(
            @Value("${financeforge.alerts.high-utilization:0.8}") double threshold) {
        return AlertRule.builder()
            .kind("HIGH_UTILIZATION")
            .severity(AlertSeverity.WARNING)
            .scope(AlertScope.ACCOUNT)
            .predicate((subject, context) -> subject.getPosition().getAccount().hasCreditLimit()
                && subject.getPosition().hasBalance()
                && subject.getPosition().utilization() >= threshold)
            .messageTemplate("{name} is at {utilization} utilization ({balance} of {limit})")
            .build();
    }

    @Bean
    public AlertRule promoExpiringRule(
            @Value("${financeforge.alerts.promo-expiring-days:30}") long days) {
        return AlertRule.builder()
            .kind("PROMO_EXPIRING")
            .severity(AlertSeverity.WARNING)
            .scope(AlertScope.ACCOUNT)
            .predicate((subject, context) -> {
                var expiry = subject.getPosition().getAccount().getPromoRateExpiry();
                if (expiry == null || !subject.getPosition().hasBalance()) {
                    return false;
                }
                long remaining = ChronoUnit.DAYS.between(context.getEvaluationDate(), expiry);
                return remaining >= 0 && remaining <= days;
            })
            .messageTemplate("Promotional rate on {name} expires soon; {balance} will revert to the standard rate")
            .build();
    }

    @Bean
    public AlertRule highAprBalanceRule(
            @Value("${financeforge.alerts.high-apr:0.25}") BigDecimal threshold) {
        return AlertRule.builder()
            .kind("HIGH_APR_BALANCE")
            .severity(AlertSeverity.INFO)
            .scope(AlertScope.ACCOUNT)
            .predicate((subject, context) -> subject.getPosition().hasBalance()
                && subject.getPosition().getApr().compareTo(threshold) >= 0)
            .messageTemplate("{name} carries {balance} at APR {apr}")
            .build();
    }

    @Bean
    public AlertRule arbitrageAvailableRule() {
        return AlertRule.builder()
            .kind("ARBITRAGE_AVAILABLE")
            .severity(AlertSeverity.INFO)
            .scope(AlertScope.OPPORTUNITY)
            .predicate((subject, context) -> true)
            .messageTemplate("Moving {amount} from {from} to {to} saves {monthlySavings}/month ({annualSavings}/year)")
            .build();
    }

    @Bean
    public AlertRule crisisPhaseRule() {
        return AlertRule.builder()
            .kind("CRISIS_PHASE")
            .severity(AlertSeverity.CRITICAL)
            .scope(AlertScope.PORTFOLIO)
            .predicate((subject, context) -> context.getPhase() != null
                && context.getPhase().getPhase() == Phase.CRISIS)
            .messageTemplate("Portfolio is in crisis: debt {totalDebt}, debt-to-income {debtToIncome}, utilization {utilization}")
            .build();
    }
}
