package com.priceintel.harvester.config;

import com.priceintel.harvester.fetch.FeedFetchException;
import com.priceintel.harvester.model.BlockingErrorCode;
import com.priceintel.harvester.model.FeedType;
import com.priceintel.harvester.model.QuarantinedRecord;
import com.priceintel.harvester.quarantine.QuarantineService;
import com.priceintel.harvester.repository.FeedRepository;
import com.priceintel.harvester.repository.QuarantineFilter;
import com.priceintel.harvester.resolver.ProductResolver;
import com.priceintel.harvester.scheduler.FeedRunProcessor;
import com.priceintel.harvester.visibility.RetailerVisibilityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

@RestController
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
@Slf4j
@RequiredArgsConstructor
public class FeedAdminController {

    private final FeedRepository feedRepository;
    private final FeedRunProcessor feedRunProcessor;
    private final QuarantineService quarantineService;
    private final ProductResolver productResolver;
    private final RetailerVisibilityService visibilityService;

    // ── Feeds & runs ──────────────────────────────────────────────────────────

    /** Marks a manual run; the scheduler picks it up on its next pass. */
    @PostMapping("/feeds/{feedId}/trigger")
    public ResponseEntity<?> trigger(@PathVariable String feedId) {
        if (!feedRepository.requestManualRun(feedId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Feed " + feedId + " not found"));
        }
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "feedId", feedId));
    }

    /**
     * Fetch and parse a feed with the interactive timeout. Nothing is written.
     *
     * POST /feeds/{feedId}/test
     */
    @PostMapping("/feeds/{feedId}/test")
    public ResponseEntity<?> test(@PathVariable String feedId) {
        try {
            return ResponseEntity.ok(feedRunProcessor.testFeed(feedId));
        } catch (FeedFetchException e) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(Map.of("error", String.valueOf(e.getMessage()), "errorCode", e.getErrorCode()));
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Test fetch failed for feed {}: {}", feedId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<?> run(@PathVariable String runId) {
        return handle("run lookup " + runId, () -> feedRepository.findRun(runId)
                .orElseThrow(() -> new NoSuchElementException("Run " + runId + " not found")));
    }

    // ── Quarantine ────────────────────────────────────────────────────────────

    @GetMapping("/quarantine/{recordId}")
    public ResponseEntity<?> quarantined(@PathVariable String recordId) {
        return handle("quarantine lookup " + recordId, () -> {
            QuarantinedRecord record = quarantineService.getRecord(recordId);
            return Map.of("record", record, "effectiveFields", quarantineService.effectiveFields(record));
        });
    }

    /**
     * Append a correction.
     *
     * POST /quarantine/{id}/corrections?field=upc&value=012345678905&author=ops
     */
    @PostMapping("/quarantine/{recordId}/corrections")
    public ResponseEntity<?> correct(@PathVariable String recordId,
                                     @RequestParam String field,
                                     @RequestParam(required = false) String value,
                                     @RequestParam String author) {
        return handle("correction of " + recordId,
                () -> quarantineService.applyCorrection(recordId, field, value, author));
    }

    @PostMapping("/quarantine/{recordId}/reprocess")
    public ResponseEntity<?> reprocess(@PathVariable String recordId) {
        return handle("reprocess of " + recordId, () -> quarantineService.reprocess(recordId));
    }

    @PostMapping("/quarantine/{recordId}/dismiss")
    public ResponseEntity<?> dismiss(@PathVariable String recordId, @RequestParam String note) {
        return handle("dismissal of " + recordId, () -> {
            quarantineService.dismiss(recordId, note);
            return Map.of("status", "dismissed", "recordId", recordId);
        });
    }

    @PostMapping("/quarantine/reprocess-all")
    public ResponseEntity<?> reprocessAll(@RequestParam(required = false) FeedType feedType,
                                          @RequestParam(required = false) BlockingErrorCode reasonCode,
                                          @RequestParam(required = false) String feedId,
                                          @RequestParam(required = false) Integer limit) {
        return handle("bulk reprocess", () -> quarantineService.reprocessAll(
                new QuarantineFilter(feedType, reasonCode, feedId), limit));
    }

    @PostMapping("/quarantine/dismiss-all")
    public ResponseEntity<?> dismissAll(@RequestParam(required = false) FeedType feedType,
                                        @RequestParam(required = false) BlockingErrorCode reasonCode,
                                        @RequestParam(required = false) String feedId,
                                        @RequestParam(required = false) Integer limit,
                                        @RequestParam String note) {
        return handle("bulk dismissal", () -> quarantineService.dismissAll(
                new QuarantineFilter(feedType, reasonCode, feedId), note, limit));
    }

    // ── Resolver & visibility ─────────────────────────────────────────────────

    @PostMapping("/resolver/reresolve")
    public ResponseEntity<?> reresolve(@RequestParam(required = false) Integer limit) {
        return handle("re-resolution", () -> productResolver.reresolveOpenLinks(limit));
    }

    @GetMapping("/retailers/{retailerId}/visibility")
    public ResponseEntity<?> visibility(@PathVariable String retailerId) {
        return handle("visibility of " + retailerId, () -> visibilityService.describe(retailerId));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ResponseEntity<?> handle(String operation, Supplier<?> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", String.valueOf(e.getMessage())));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", String.valueOf(e.getMessage())));
        } catch (Exception e) {
            log.error("{} failed: {}", operation, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
