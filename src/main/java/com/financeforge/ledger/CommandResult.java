package com.financeforge.ledger;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of a ledger command: the committed (or previously committed) events.
 */
@Value
@Builder
public class CommandResult {

    CommandStatus status;
    List<LedgerEvent> events;
    String message;

    public static CommandResult committed(List<LedgerEvent> events) {
        return CommandResult.builder()
            .status(CommandStatus.COMMITTED)
            .events(List.copyOf(events))
            .build();
    }

    public static CommandResult duplicate(List<LedgerEvent> events) {
        return CommandResult.builder()
            .status(CommandStatus.DUPLICATE)
            .events(List.copyOf(events))
            .message("Idempotency key already applied")
            .build();
    }

    public static CommandResult noOp(String message) {
        return CommandResult.builder()
            .status(CommandStatus.NO_OP)
            .events(List.of())
            .message(message)
            .build();
    }

    /**
     * The single event of a one-event command, or null for a no-op.
     */
    public LedgerEvent getEvent() {
        return events.isEmpty() ? null : events.get(0);
    }
}
