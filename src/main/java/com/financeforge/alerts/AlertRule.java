package com.financeforge.alerts;

import lombok.Builder;
import lombok.Value;

import java.util.function.BiPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A declarative alert rule. Rules are registered as beans and picked up by the
 * {@link AlertEngine}; adding one needs no change to the engine.
 */
@Value
@Builder
public class AlertRule {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    String kind;
    AlertSeverity severity;
    AlertScope scope;
    BiPredicate<AlertSubject, AlertContext> predicate;

    /**
     * Message with {@code {attribute}} placeholders; unknown placeholders are left as-is.
     */
    String messageTemplate;

    public boolean matches(AlertSubject subject, AlertContext context) {
        return predicate.test(subject, context);
    }

    public String render(AlertSubject subject) {
        Matcher matcher = PLACEHOLDER.matcher(messageTemplate);
        StringBuilder message = new StringBuilder();
        while (matcher.find()) {
            Object value = subject.getAttributes().get(matcher.group(1));
            String replacement = value != null ? value.toString() : matcher.group();
            matcher.appendReplacement(message, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(message);
        return message.toString();
    }
}
