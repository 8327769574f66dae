package com.financeforge.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.financeforge.accounts.AccountKind;
import com.financeforge.accounts.AccountRegistration;
import com.financeforge.accounts.AccountService;
import com.financeforge.common.exception.LedgerIntegrityException;
import com.financeforge.common.exception.ValidationException;
import com.financeforge.ledger.LedgerCommandService;
import com.financeforge.projection.ProjectionBuilder;
import com.financeforge.projection.Snapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for export and restore of the event log.
 *
 * Runs against its own in-memory database because restoring requires an empty log.
 */
@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:backupdb;DB_CLOSE_DELAY=-1")
@ActiveProfiles("test")
class BackupServiceTest {

    @Autowired
    private BackupService backupService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerCommandService commandService;

    @Autowired
    private ProjectionBuilder projectionBuilder;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private String cardId;
    private String helocId;

    @BeforeEach
    void setUp() {
        wipeEvents();
        String suffix = UUID.randomUUID().toString();
        cardId = register("card-" + suffix, AccountKind.REVOLVING_CREDIT, "0.2999", "10000.00");
        helocId = register("heloc-" + suffix, AccountKind.HOME_EQUITY_LINE, "0.09", "50000.00");
        commandService.updateBalance(cardId, new BigDecimal("8331.82"), "open-" + suffix);
        commandService.recordPayment(cardId, new BigDecimal("331.82"), null);
        commandService.executeTransfer(cardId, helocId, new BigDecimal("5000.00"), null);
    }

    @Test
    void testExportWritesHeaderThenOneLinePerEvent() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        BackupSummary summary = backupService.export(out);

        List<String> lines = lines(out);
        assertEquals(4, summary.getEventCount());
        assertEquals(5, lines.size());
        BackupHeader header = objectMapper.readValue(lines.get(0), BackupHeader.class);
        assertEquals(BackupHeader.FORMAT, header.getFormat());
        assertEquals(0, new BigDecimal("3000.00").compareTo(header.getBalances().get(cardId)));
        assertEquals(0, new BigDecimal("5000.00").compareTo(header.getBalances().get(helocId)));
    }

    @Test
    void testRestoreReproducesSnapshot() {
        Snapshot before = projectionBuilder.fullReplay(null);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        backupService.export(out);

        wipeEvents();
        BackupSummary summary = backupService.restore(new ByteArrayInputStream(out.toByteArray()));

        assertEquals(4, summary.getEventCount());
        Snapshot after = projectionBuilder.fullReplay(null);
        assertEquals(0, before.balanceOf(cardId).compareTo(after.balanceOf(cardId)));
        assertEquals(0, before.balanceOf(helocId).compareTo(after.balanceOf(helocId)));
        assertEquals(before.sequenceOf(cardId), after.sequenceOf(cardId));
    }

    @Test
    void testRestoreIntoNonEmptyLogRejected() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        backupService.export(out);

        assertThrows(ValidationException.class,
            () -> backupService.restore(new ByteArrayInputStream(out.toByteArray())));
    }

    @Test
    void testHeaderMismatchRollsRestoreBack() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        backupService.export(out);
        List<String> lines = lines(out);
        ObjectNode header = (ObjectNode) objectMapper.readTree(lines.get(0));
        ((ObjectNode) header.get("balances")).put(cardId, new BigDecimal("2999.99"));
        lines.set(0, objectMapper.writeValueAsString(header));

        wipeEvents();

        assertThrows(LedgerIntegrityException.class, () -> backupService.restore(stream(lines)));
        assertEquals(0, countEvents());
    }

    @Test
    void testDamagedLineRejected() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        backupService.export(out);
        List<String> lines = lines(out);
        ObjectNode record = (ObjectNode) objectMapper.readTree(lines.get(2));
        record.put("balanceAfter", new BigDecimal("1.00"));
        lines.set(2, objectMapper.writeValueAsString(record));

        wipeEvents();

        assertThrows(ValidationException.class, () -> backupService.restore(stream(lines)));
        assertEquals(0, countEvents());
    }

    @Test
    void testTruncatedBackupRejected() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        backupService.export(out);
        List<String> lines = lines(out);
        lines.remove(lines.size() - 1);

        wipeEvents();

        assertThrows(ValidationException.class, () -> backupService.restore(stream(lines)));
    }

    private void wipeEvents() {
        jdbcTemplate.update("DELETE FROM ledger_events");
        projectionBuilder.invalidateCheckpoints();
    }

    private int countEvents() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ledger_events", Integer.class);
        return count != null ? count : 0;
    }

    private String register(String id, AccountKind kind, String apr, String limit) {
        accountService.registerAccount(AccountRegistration.builder()
            .accountId(id)
            .displayName("Backup " + id)
            .kind(kind)
            .apr(new BigDecimal(apr))
            .creditLimit(new BigDecimal(limit))
            .build());
        return id;
    }

    private static List<String> lines(ByteArrayOutputStream out) {
        return new ArrayList<>(Arrays.asList(out.toString(StandardCharsets.UTF_8).split("\\R")));
    }

    private static ByteArrayInputStream stream(List<String> lines) {
        return new ByteArrayInputStream((String.join("\n", lines) + "\n").getBytes(StandardCharsets.UTF_8));
    }
}
