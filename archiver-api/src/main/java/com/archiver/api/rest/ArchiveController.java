package com.archiver.api.rest;

import com.archiver.core.model.ArchiveListing;
import com.archiver.core.model.WeekArchive;
import com.archiver.core.model.WeekKey;
import com.archiver.engine.codec.ArchiveDocumentCodec;
import com.archiver.engine.service.ArchiveService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Read-only REST API over the weekly archives.
 * Archives and summaries are rendered in their stored document layout.
 */
@RestController
@RequestMapping("/api/v1/archives")
public class ArchiveController {

    private final ArchiveService archiveService;
    private final ArchiveDocumentCodec codec;

    public ArchiveController(ArchiveService archiveService, ArchiveDocumentCodec codec) {
        this.archiveService = archiveService;
        this.codec = codec;
    }

    /**
     * List archived weeks, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<ArchiveListingResponse>> listWeeks() {
        List<ArchiveListingResponse> responses = archiveService.listWeeks().stream()
            .map(ArchiveListingResponse::from)
            .toList();
        return ResponseEntity.ok(responses);
    }

    /**
     * Most recently modified week.
     */
    @GetMapping("/latest")
    public ResponseEntity<ObjectNode> getLatest() {
        return ResponseEntity.ok(codec.toTree(archiveService.getLatest()));
    }

    @GetMapping("/{week}")
    public ResponseEntity<ObjectNode> getArchive(@PathVariable String week) {
        WeekArchive archive = archiveService.getArchive(WeekKey.parse(week));
        return ResponseEntity.ok(codec.toTree(archive));
    }

    @GetMapping("/{week}/summary")
    public ResponseEntity<ObjectNode> getSummary(@PathVariable String week) {
        return ResponseEntity.ok(codec.summaryToTree(archiveService.getSummary(WeekKey.parse(week))));
    }

    // ========== DTOs ==========

    public record ArchiveListingResponse(
        String week,
        String storageKey,
        Instant lastModified,
        long sizeBytes
    ) {
        public static ArchiveListingResponse from(ArchiveListing listing) {
            return new ArchiveListingResponse(
                listing.week().toString(),
                listing.storageKey(),
                listing.lastModified(),
                listing.sizeBytes()
            );
        }
    }
}
