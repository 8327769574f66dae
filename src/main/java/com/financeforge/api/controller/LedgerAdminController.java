package com.financeforge.api.controller;

import com.financeforge.backup.BackupService;
import com.financeforge.backup.BackupSummary;
import com.financeforge.projection.ProjectionBuilder;
import com.financeforge.projection.Snapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * Snapshots, checkpoints, backup and restore of the event log.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Ledger", description = "Projection and backup administration")
public class LedgerAdminController {

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final ProjectionBuilder projectionBuilder;
    private final BackupService backupService;

    @GetMapping("/snapshot")
    @Operation(summary = "Balances of every account, optionally as of an instant")
    public ResponseEntity<Snapshot> getSnapshot(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf) {
        return ResponseEntity.ok(projectionBuilder.snapshot(asOf));
    }

    @PostMapping("/checkpoints")
    @Operation(summary = "Verify the current checkpoints and take new ones")
    public ResponseEntity<Map<String, Integer>> checkpoint() {
        return ResponseEntity.ok(Map.of("accounts", projectionBuilder.checkpoint()));
    }

    @PostMapping("/checkpoints/verify")
    @Operation(summary = "Verify the current checkpoints against a full replay")
    public ResponseEntity<Map<String, Integer>> verifyCheckpoints() {
        projectionBuilder.verifyCheckpoints();
        return ResponseEntity.ok(Map.of("verified", projectionBuilder.getCheckpoints().size()));
    }

    @GetMapping(value = "/backup", produces = "application/x-ndjson")
    @Operation(summary = "Export the event log as JSON Lines")
    public ResponseEntity<StreamingResponseBody> backup() {
        StreamingResponseBody body = out -> backupService.export(out);
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"ledger-backup.jsonl\"")
            .contentType(NDJSON)
            .body(body);
    }

    @PostMapping(value = "/restore", consumes = {"application/x-ndjson", MediaType.APPLICATION_OCTET_STREAM_VALUE})
    @Operation(summary = "Restore a JSON Lines backup into an empty event log")
    public ResponseEntity<BackupSummary> restore(HttpServletRequest request) throws IOException {
        BackupSummary summary = backupService.restore(request.getInputStream());
        log.info("Restore completed: {} events", summary.getEventCount());
        return ResponseEntity.ok(summary);
    }
}
