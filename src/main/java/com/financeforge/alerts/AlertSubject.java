package com.financeforge.alerts;

import com.financeforge.optimization.OptimizationOpportunity;
import com.financeforge.projection.AccountPosition;
import lombok.Value;

import java.util.Map;

/**
 * The thing a rule fires on, with the attributes its message template can use.
 * Only one of position and opportunity is set, matching the rule's scope.
 */
@Value
public class AlertSubject {

    public static final String PORTFOLIO = "portfolio";

    String reference;
    Map<String, Object> attributes;
    AccountPosition position;
    OptimizationOpportunity opportunity;

    static AlertSubject of(AccountPosition position) {
        return new AlertSubject(position.getAccountId(), Map.of(
            "account", position.getAccountId(),
            "name", position.getAccount().getDisplayName(),
            "balance", position.getBalance().toPlainString(),
            "apr", position.getApr().toPlainString(),
            "limit", position.getAccount().hasCreditLimit()
                ? position.getAccount().getCreditLimit().toPlainString() : "none",
            "utilization", String.format("%.0f%%", position.utilization() * 100)
        ), position, null);
    }

    static AlertSubject of(OptimizationOpportunity opportunity) {
        return new AlertSubject(opportunity.getSubject(), Map.of(
            "from", opportunity.getFromAccountId(),
            "to", opportunity.getToAccountId(),
            "amount", opportunity.getTransferAmount().toPlainString(),
            "monthlySavings", opportunity.getMonthlySavings().toPlainString(),
            "annualSavings", opportunity.getAnnualSavings().toPlainString(),
            "riskScore", String.valueOf(opportunity.getRiskScore())
        ), null, opportunity);
    }

    static AlertSubject portfolio(AlertContext context) {
        Map<String, Object> attributes = context.getPhase() == null
            ? Map.of("accounts", context.getPositions().size())
            : Map.of(
                "accounts", context.getPositions().size(),
                "phase", context.getPhase().getPhase(),
                "totalDebt", context.getPhase().getTotalDebt().toPlainString(),
                "debtToIncome", String.format("%.2f", context.getPhase().getDebtToIncome()),
                "utilization", String.format("%.0f%%", context.getPhase().getUtilization() * 100));
        return new AlertSubject(PORTFOLIO, attributes, null, null);
    }
}
