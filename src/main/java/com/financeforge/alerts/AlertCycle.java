package com.financeforge.alerts;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alerts raised within one evaluation cycle, keyed by (kind, subject).
 * Raising the same key twice keeps the first alert.
 */
public class AlertCycle {

    private static final Comparator<Alert> BY_SEVERITY =
        Comparator.comparing(Alert::getSeverity)
            .thenComparing(Alert::getKind)
            .thenComparing(Alert::getSubject);

    private final Clock clock;
    private final Map<String, Alert> raised = new LinkedHashMap<>();

    AlertCycle(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return true if the alert is new to this cycle
     */
    public synchronized boolean raise(String kind, AlertSeverity severity, String subject, String message) {
        return raised.putIfAbsent(kind + "|" + subject, Alert.builder()
            .kind(kind)
            .severity(severity)
            .subject(subject)
            .message(message)
            .triggeredAt(clock.instant())
            .build()) == null;
    }

    public synchronized List<Alert> getAlerts() {
        List<Alert> alerts = new ArrayList<>(raised.values());
        alerts.sort(BY_SEVERITY);
        return alerts;
    }
}
