package com.archiver.api.rest;

import com.archiver.core.model.BatchResult;
import com.archiver.engine.service.ArchiveService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for batch delivery.
 *
 * A batch answers 200 when every week was merged or already up to date,
 * 207 when some weeks failed or were not reached. Re-delivering the same
 * batch is safe either way.
 */
@RestController
@RequestMapping("/api/v1/batches")
public class BatchController {

    private final ArchiveService archiveService;

    public BatchController(ArchiveService archiveService) {
        this.archiveService = archiveService;
    }

    /**
     * Deliver a log document as written by the audit source, plain or gzip-compressed.
     */
    @PostMapping(consumes = {
        MediaType.APPLICATION_OCTET_STREAM_VALUE,
        "application/gzip",
        "application/x-gzip"
    })
    public ResponseEntity<BatchResult> ingestLog(@RequestBody byte[] document) {
        return respond(archiveService.ingestLog(document));
    }

    /**
     * Deliver records as JSON: a bare array or the <code>{"Records": [...]}</code> envelope.
     * Entries are bound one at a time, so an entry that does not fit the record layout
     * is counted as malformed instead of rejecting the batch.
     */
    @PostMapping(path = "/records", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BatchResult> ingestRecords(@RequestBody byte[] records) {
        return respond(archiveService.ingestLog(records));
    }

    private static ResponseEntity<BatchResult> respond(BatchResult result) {
        HttpStatus status = result.isComplete() ? HttpStatus.OK : HttpStatus.MULTI_STATUS;
        return ResponseEntity.status(status).body(result);
    }
}
