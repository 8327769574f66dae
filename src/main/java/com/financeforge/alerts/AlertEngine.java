package com.financeforge.alerts;

import com.financeforge.optimization.OptimizationOpportunity;
import com.financeforge.projection.AccountPosition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates every registered {@link AlertRule} over an {@link AlertContext}.
 *
 * Rules are grouped by scope: account rules run once per position, opportunity
 * rules once per opportunity, portfolio rules once. A rule that throws is logged
 * and skipped so one faulty rule cannot suppress the others.
 */
@Service
@Slf4j
public class AlertEngine {

    private final List<AlertRule> rules;
    private final Clock clock;

    public AlertEngine(List<AlertRule> rules, Clock clock) {
        this.rules = List.copyOf(rules);
        this.clock = clock;
    }

    public AlertCycle beginCycle() {
        return new AlertCycle(clock);
    }

    /**
     * Run one complete cycle over the context.
     */
    public List<Alert> evaluate(AlertContext context) {
        AlertCycle cycle = beginCycle();
        evaluate(cycle, context);
        return cycle.getAlerts();
    }

    /**
     * Evaluate into an existing cycle; alerts already raised in it are not repeated.
     */
    public void evaluate(AlertCycle cycle, AlertContext context) {
        List<AlertSubject> accountSubjects = new ArrayList<>();
        for (AccountPosition position : context.getPositions()) {
            accountSubjects.add(AlertSubject.of(position));
        }
        List<AlertSubject> opportunitySubjects = new ArrayList<>();
        for (OptimizationOpportunity opportunity : context.getOpportunities()) {
            opportunitySubjects.add(AlertSubject.of(opportunity));
        }
        List<AlertSubject> portfolio = List.of(AlertSubject.portfolio(context));

        int fired = 0;
        for (AlertRule rule : rules) {
            List<AlertSubject> subjects = switch (rule.getScope()) {
                case ACCOUNT -> accountSubjects;
                case OPPORTUNITY -> opportunitySubjects;
                case PORTFOLIO -> portfolio;
            };
            for (AlertSubject subject : subjects) {
                if (matches(rule, subject, context)
                    && cycle.raise(rule.getKind(), rule.getSeverity(), subject.getReference(), rule.render(subject))) {
                    fired++;
                }
            }
        }
        log.debug("Alert evaluation raised {} new alerts from {} rules", fired, rules.size());
    }

    public List<AlertRule> getRules() {
        return rules;
    }

    private boolean matches(AlertRule rule, AlertSubject subject, AlertContext context) {
        try {
            return rule.matches(subject, context);
        } catch (RuntimeException e) {
            log.error("Alert rule {} failed on {}", rule.getKind(), subject.getReference(), e);
            return false;
        }
    }
}
