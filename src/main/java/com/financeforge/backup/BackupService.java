package com.financeforge.backup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.financeforge.common.Amounts;
import com.financeforge.common.exception.LedgerIntegrityException;
import com.financeforge.common.exception.ValidationException;
import com.financeforge.ledger.EventStore;
import com.financeforge.ledger.LedgerEvent;
import com.financeforge.projection.ProjectionBuilder;
import com.financeforge.projection.Snapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Exports the event log as JSON Lines and restores it into an empty store.
 *
 * A backup is a frozen prefix of the log: a header line carrying the snapshot
 * of that prefix, then one line per event in commit order. Restoring replays the
 * events and compares the result with the header; on any mismatch the import
 * transaction is rolled back and the store stays empty.
 */
@Service
@Slf4j
public class BackupService {

    private final EventStore eventStore;
    private final ProjectionBuilder projectionBuilder;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BackupService(EventStore eventStore, ProjectionBuilder projectionBuilder,
                         ObjectMapper objectMapper, Clock clock) {
        this.eventStore = eventStore;
        this.projectionBuilder = projectionBuilder;
        // One record per line
        this.objectMapper = objectMapper.copy()
            .disable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
    }

    public BackupSummary export(OutputStream out) {
        List<LedgerEvent> prefix = eventStore.frozenPrefix();
        Snapshot snapshot = projectionBuilder.foldEvents(prefix);
        long highWaterMark = prefix.isEmpty() ? 0L : prefix.get(prefix.size() - 1).getId();

        BackupHeader header = BackupHeader.builder()
            .format(BackupHeader.FORMAT)
            .version(BackupHeader.VERSION)
            .createdAt(clock.instant())
            .eventCount(prefix.size())
            .highWaterMark(highWaterMark)
            .balances(snapshot.getBalances())
            .sequences(snapshot.getSequences())
            .build();

        try {
            BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            writeLine(writer, header);
            for (LedgerEvent event : prefix) {
                writeLine(writer, BackupRecord.of(event));
            }
            writer.flush();
        } catch (IOException e) {
            throw new BackupException("Failed to write backup", e);
        }

        log.info("Exported {} events across {} accounts (high-water mark {})",
            prefix.size(), snapshot.getBalances().size(), highWaterMark);
        return new BackupSummary(header.getCreatedAt(), prefix.size(), highWaterMark, snapshot.getBalances().size());
    }

    /**
     * @throws ValidationException if the file is malformed or the store is not empty
     * @throws LedgerIntegrityException if the restored log does not reproduce the header snapshot
     */
    public BackupSummary restore(InputStream in) {
        BackupHeader header;
        List<LedgerEvent> events = new ArrayList<>();
        try {
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line = reader.readLine();
            if (line == null || line.isBlank()) {
                throw new ValidationException("Backup is empty");
            }
            header = parse(line, BackupHeader.class, 1);
            validateHeader(header);

            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                BackupRecord record = parse(line, BackupRecord.class, lineNumber);
                validateRecord(record, lineNumber);
                events.add(record.toEvent());
            }
        } catch (IOException e) {
            throw new BackupException("Failed to read backup", e);
        }

        if (events.size() != header.getEventCount()) {
            throw new ValidationException(String.format(
                "Backup header announces %d events but %d were read", header.getEventCount(), events.size()));
        }

        eventStore.importEvents(events, () -> verifyAgainst(header));
        projectionBuilder.invalidateCheckpoints();

        log.info("Restored {} events across {} accounts from backup created {}",
            events.size(), header.getBalances().size(), header.getCreatedAt());
        return new BackupSummary(header.getCreatedAt(), events.size(), header.getHighWaterMark(),
            header.getBalances().size());
    }

    private void verifyAgainst(BackupHeader header) {
        Snapshot restored = projectionBuilder.fullReplay(null);
        Set<String> accountIds = new HashSet<>(restored.accountIds());
        accountIds.addAll(header.getBalances().keySet());

        for (String accountId : accountIds) {
            BigDecimal expected = header.getBalances().getOrDefault(accountId, Amounts.ZERO);
            long expectedSequence = header.getSequences().getOrDefault(accountId, 0L);
            if (restored.balanceOf(accountId).compareTo(expected) != 0
                || restored.sequenceOf(accountId) != expectedSequence) {
                log.error("Restored account {} replays to #{}={}, backup header says #{}={}",
                    accountId, restored.sequenceOf(accountId), restored.balanceOf(accountId),
                    expectedSequence, expected);
                throw new LedgerIntegrityException(String.format(
                    "Restored balance of %s (%s) does not match the backup (%s)",
                    accountId, restored.balanceOf(accountId), expected));
            }
        }
    }

    private static void validateHeader(BackupHeader header) {
        if (!BackupHeader.FORMAT.equals(header.getFormat())) {
            throw new ValidationException("Not a ledger backup: format " + header.getFormat());
        }
        if (header.getVersion() != BackupHeader.VERSION) {
            throw new ValidationException("Unsupported backup version " + header.getVersion());
        }
        if (header.getBalances() == null || header.getSequences() == null) {
            throw new ValidationException("Backup header carries no snapshot");
        }
    }

    private static void validateRecord(BackupRecord record, int lineNumber) {
        if (record.getAccountId() == null || record.getKind() == null || record.getAmount() == null
            || record.getBalanceBefore() == null || record.getBalanceAfter() == null
            || record.getOccurredAt() == null || record.getRecordedAt() == null || record.getCausationId() == null) {
            throw new ValidationException("Backup line " + lineNumber + " is incomplete");
        }
        if (record.getBalanceBefore().add(record.getAmount()).compareTo(record.getBalanceAfter()) != 0) {
            throw new ValidationException(String.format(
                "Backup line %d is damaged: %s + %s != %s", lineNumber,
                record.getBalanceBefore(), record.getAmount(), record.getBalanceAfter()));
        }
    }

    private void writeLine(BufferedWriter writer, Object value) throws IOException {
        writer.write(objectMapper.writeValueAsString(value));
        writer.newLine();
    }

    private <T> T parse(String line, Class<T> type, int lineNumber) {
        try {
            return objectMapper.readValue(line, type);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Backup line " + lineNumber + " is not valid: " + e.getOriginalMessage());
        }
    }
}
