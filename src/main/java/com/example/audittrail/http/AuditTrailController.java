package com.example.audittrail.http;

import com.example.audittrail.config.VerificationProperties;
import com.example.audittrail.models.Actor;
import com.example.audittrail.models.AuditAction;
import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.models.AuditPage;
import com.example.audittrail.models.AuditStats;
import com.example.audittrail.models.AuditVerification;
import com.example.audittrail.models.DisplayPolicy;
import com.example.audittrail.models.DisplayedEntry;
import com.example.audittrail.models.ExportFormat;
import com.example.audittrail.models.ExportRecord;
import com.example.audittrail.models.VerificationRecord;
import com.example.audittrail.requests.AppendEntryHttpRequest;
import com.example.audittrail.requests.AuditQuery;
import com.example.audittrail.requests.DisplayPolicyHttpRequest;
import com.example.audittrail.requests.ExportHttpRequest;
import com.example.audittrail.requests.ExportServiceRequest;
import com.example.audittrail.requests.VerifyHttpRequest;
import com.example.audittrail.service.AppendService;
import com.example.audittrail.service.AuditExportService;
import com.example.audittrail.service.AuditQueryService;
import com.example.audittrail.service.AuditTrailException;
import com.example.audittrail.service.DisplayPolicyService;
import com.example.audittrail.service.LedgerVerifier;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for the audit trail: listing and detail views, verification, export, stats and
 * the ingress endpoint business services use to append entries.
 *
 * <p>The caller of verify and export is taken from the optional {@code X-User-*} headers and falls
 * back to the system actor.
 */
@RestController
public class AuditTrailController {

    public static final String TOTAL_COUNT = "X-Total-Count";
    public static final String PAGE = "X-Page";
    public static final String PER_PAGE = "X-Per-Page";

    private final AuditQueryService queryService;
    private final AppendService appendService;
    private final LedgerVerifier verifier;
    private final AuditExportService exportService;
    private final DisplayPolicyService displayPolicyService;
    private final VerificationProperties verificationProperties;

    public AuditTrailController(AuditQueryService queryService,
                                AppendService appendService,
                                LedgerVerifier verifier,
                                AuditExportService exportService,
                                DisplayPolicyService displayPolicyService,
                                VerificationProperties verificationProperties) {
        this.queryService = queryService;
        this.appendService = appendService;
        this.verifier = verifier;
        this.exportService = exportService;
        this.displayPolicyService = displayPolicyService;
        this.verificationProperties = verificationProperties;
    }

    @GetMapping("/audit-trail")
    public ResponseEntity<List<AuditLogEntryResponse>> list(
            @RequestParam(name = "entity_type", required = false) String entityType,
            @RequestParam(name = "entity_id", required = false) String entityId,
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "user_id", required = false) String userId,
            @RequestParam(name = "date_from", required = false) String dateFrom,
            @RequestParam(name = "date_to", required = false) String dateTo,
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "per_page", defaultValue = "" + AuditQueryService.DEFAULT_PER_PAGE) int perPage
    ) {
        AuditQuery query = AuditQuery.of(entityType, entityId, action, userId, dateFrom, dateTo);
        AuditPage result = queryService.list(query, page, perPage);
        return ResponseEntity.ok()
                .header(TOTAL_COUNT, Long.toString(result.total()))
                .header(PAGE, Integer.toString(result.page()))
                .header(PER_PAGE, Integer.toString(result.perPage()))
                .body(result.items().stream().map(this::map).toList());
    }

    @PostMapping("/audit-trail/entries")
    public ResponseEntity<AuditLogEntryResponse> append(@Valid @RequestBody AppendEntryHttpRequest request,
                                                        HttpServletRequest http) {
        AuditLogEntry entry = appendService.append(
                request.toCandidate(RequestIdFilter.currentRequestId(), http.getRemoteAddr()));
        DisplayedEntry shown = new DisplayedEntry(entry, Boolean.TRUE.equals(entry.getSensitive()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .header(HttpHeaders.LOCATION, "/audit-trail/" + entry.getSequence())
                .body(map(shown));
    }

    @GetMapping("/audit-trail/{sequence:\\d+}")
    public ResponseEntity<AuditLogEntryResponse> get(@PathVariable long sequence) {
        return ResponseEntity.ok(map(queryService.get(sequence)));
    }

    @GetMapping("/audit-trail/entity/{entityType}/{entityId}")
    public ResponseEntity<List<AuditLogEntryResponse>> entityHistory(@PathVariable String entityType,
                                                                     @PathVariable String entityId) {
        return ResponseEntity.ok(queryService.entityHistory(entityType, entityId).stream()
                .map(this::map)
                .toList());
    }

    @GetMapping("/audit-trail/user/{userId}")
    public ResponseEntity<List<AuditLogEntryResponse>> userActivity(
            @PathVariable String userId,
            @RequestParam(name = "days", defaultValue = "30") int days) {
        return ResponseEntity.ok(queryService.userActivity(userId, days).stream()
                .map(this::map)
                .toList());
    }

    @PostMapping("/audit-trail/verify")
    public ResponseEntity<VerificationResponse> verify(@RequestBody(required = false) VerifyHttpRequest request,
                                                       HttpServletRequest http) {
        String verifiedBy = actorFrom(http).userId();
        AuditVerification result;
        if (request != null && request.isRange()) {
            long from = request.from() == null ? 1L : request.from();
            result = verifier.verifyRange(from, request.to(), request.anchorHash(), verifiedBy);
        } else {
            result = verifier.verify(verifiedBy);
        }
        return ResponseEntity.ok(new VerificationResponse(
                result.valid(),
                result.entriesVerified(),
                result.firstInvalidSequence(),
                result.failureReason(),
                result.startSequence(),
                result.endSequence(),
                result.verifiedAt().toString(),
                verifiedBy
        ));
    }

    @GetMapping("/audit-trail/verifications")
    public ResponseEntity<List<VerificationResponse>> verifications(
            @RequestParam(name = "limit", required = false) Integer limit) {
        int n = limit == null ? verificationProperties.getHistoryLimit() : limit;
        if (n < 1 || n > 100) {
            throw AuditTrailException.validation("limit must be between 1 and 100");
        }
        return ResponseEntity.ok(verifier.history(n).stream().map(this::mapVerification).toList());
    }

    @PostMapping("/audit-trail/export")
    public ResponseEntity<?> export(@RequestBody ExportHttpRequest request, HttpServletRequest http) {
        AuditQuery filters = AuditQuery.of(request.entityType(), null, null, null,
                request.dateFrom(), request.dateTo());
        ExportRecord record = exportService.export(new ExportServiceRequest(
                filters,
                request.reason(),
                request.format(),
                actorFrom(http),
                http.getRemoteAddr(),
                RequestIdFilter.currentRequestId()
        ));

        if (record.format() == ExportFormat.CSV) {
            ResponseEntity.BodyBuilder builder = ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType("text/csv; charset=UTF-8"))
                    .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                            .filename("audit-export-" + record.exportId() + ".csv", StandardCharsets.UTF_8)
                            .build()
                            .toString())
                    .header("X-Export-Id", record.exportId())
                    .header("X-Manifest-Hash", record.manifestHash())
                    .header("X-Audit-Logged", Boolean.toString(record.auditLogged()));
            if (record.warning() != null) {
                builder.header("X-Audit-Warning", record.warning());
            }
            return builder.body(record.payload());
        }

        return ResponseEntity.ok(new ExportResponse(
                record.exportId(),
                record.format().wireName(),
                record.entriesCount(),
                record.manifestHash(),
                record.manifestHash(),
                record.generatedAt().toString(),
                record.auditLogged(),
                record.exportEntrySequence(),
                record.warning(),
                new String(record.payload(), StandardCharsets.UTF_8)
        ));
    }

    @GetMapping("/audit-trail/stats")
    public ResponseEntity<StatsResponse> stats(@RequestParam(name = "days", defaultValue = "30") int days) {
        AuditStats stats = queryService.stats(days);
        return ResponseEntity.ok(new StatsResponse(
                stats.totalEntries(),
                stats.byAction(),
                stats.uniqueUsers(),
                stats.byEntityType(),
                stats.topUsers().stream()
                        .map(u -> new StatsResponse.UserCount(u.user(), u.count()))
                        .toList(),
                stats.periodDays()
        ));
    }

    @GetMapping("/audit-trail/actions")
    public ResponseEntity<List<String>> actions() {
        return ResponseEntity.ok(Arrays.stream(AuditAction.values()).map(AuditAction::wireName).toList());
    }

    @GetMapping("/audit-trail/entity-types")
    public ResponseEntity<List<String>> entityTypes() {
        // the types seen in the last year of activity
        return ResponseEntity.ok(List.copyOf(new TreeSet<>(
                queryService.stats(AuditQueryService.MAX_STATS_DAYS).byEntityType().keySet())));
    }

    @PutMapping("/audit-trail/{sequence:\\d+}/display-policy")
    public ResponseEntity<DisplayPolicyResponse> setDisplayPolicy(@PathVariable long sequence,
                                                                  @Valid @RequestBody DisplayPolicyHttpRequest request,
                                                                  HttpServletRequest http) {
        DisplayPolicy policy = displayPolicyService.setSensitivity(
                sequence, request.sensitive(), request.reason(), actorFrom(http).userId());
        return ResponseEntity.ok(new DisplayPolicyResponse(
                policy.getSequence(),
                policy.getSensitive(),
                policy.getUpdatedAt(),
                policy.getUpdatedBy(),
                policy.getReason()
        ));
    }

    private static Actor actorFrom(HttpServletRequest http) {
        String userId = http.getHeader("X-User-Id");
        if (userId == null || userId.isBlank()) {
            return Actor.SYSTEM;
        }
        return Actor.of(userId, http.getHeader("X-User-Name"), http.getHeader("X-User-Email"));
    }

    private AuditLogEntryResponse map(DisplayedEntry shown) {
        AuditLogEntry e = shown.entry();
        return new AuditLogEntryResponse(
                e.getSequence(),
                e.getSequence(),
                Instant.ofEpochMilli(e.getTimestamp()).toString(),
                e.getUserId(),
                e.getUserName(),
                e.getUserEmail(),
                e.getUserRole(),
                e.getAction(),
                e.getActionCategory(),
                e.getEntityType(),
                e.getEntityId(),
                e.getEntityName(),
                e.getChangedFields(),
                shown.oldValues(),
                shown.newValues(),
                e.getIpAddress(),
                e.getUserAgent(),
                e.getRequestId(),
                e.getSessionId(),
                e.getMetadata(),
                shown.sensitive(),
                e.getPrevHash(),
                e.getEntryHash()
        );
    }

    private VerificationResponse mapVerification(VerificationRecord r) {
        return new VerificationResponse(
                r.getValid(),
                r.getEntriesVerified(),
                r.getFirstInvalidSequence(),
                r.getFailureReason(),
                r.getStartSequence(),
                r.getEndSequence(),
                Instant.ofEpochMilli(r.getVerifiedAt()).toString(),
                r.getVerifiedBy()
        );
    }
}
