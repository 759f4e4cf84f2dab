package com.example.audittrail.service;

import com.example.audittrail.chain.HashChain;
import com.example.audittrail.config.ExportProperties;
import com.example.audittrail.models.AuditAction;
import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.models.DisplayedEntry;
import com.example.audittrail.models.ExportFormat;
import com.example.audittrail.models.ExportRecord;
import com.example.audittrail.requests.AuditEntryCandidate;
import com.example.audittrail.requests.ExportServiceRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Produces filtered snapshots of the ledger and records every export as an {@code export} entry.
 *
 * <p>The manifest hash is the SHA-256 of the exact payload bytes handed back, so a recipient can
 * confirm the file was not altered after generation. The snapshot is built and hashed before the
 * export is appended; a snapshot that fails appends nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditExportService {

    public static final String EXPORT_ENTITY_TYPE = "audit_log";

    private static final String CSV_HEADER = "id,sequence,timestamp,user_id,user_name,user_email,user_role,"
            + "action,action_category,entity_type,entity_id,entity_name,changed_fields,old_values,new_values,"
            + "ip_address,is_sensitive,prev_hash,entry_hash\n";

    // sorted keys and no whitespace give one byte form per snapshot
    private static final ObjectMapper PAYLOAD_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    private final AuditQueryService queryService;
    private final DisplayPolicyService displayPolicyService;
    private final AppendService appendService;
    private final ExportProperties properties;
    private final Clock clock;

    public ExportRecord export(ExportServiceRequest request) {
        if (request.reason() == null || request.reason().isBlank()) {
            throw AuditTrailException.validation("reason is required for an export");
        }
        int max = properties.getMaxEntries();
        List<AuditLogEntry> snapshot = queryService.snapshot(request.filters(), max);
        if (snapshot.size() > max) {
            throw AuditTrailException.validation(
                    "Export matches more than " + max + " entries; narrow the filters");
        }

        List<DisplayedEntry> rows = displayPolicyService.display(snapshot);
        byte[] payload = request.format() == ExportFormat.CSV ? toCsv(rows) : toJson(rows);
        String manifestHash = HashChain.sha256Hex(payload);
        String exportId = UUID.randomUUID().toString();
        Instant generatedAt = Instant.now(clock);
        log.info("Export {} generated: format={}, entries={}, manifest={}, reason='{}'",
                exportId, request.format().wireName(), rows.size(), manifestHash, request.reason());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reason", request.reason());
        metadata.put("format", request.format().wireName());
        metadata.put("entries_count", rows.size());
        metadata.put("manifest_hash", manifestHash);
        metadata.put("export_id", exportId);
        metadata.putAll(request.filters().describe());

        AuditEntryCandidate exportEntry = AuditEntryCandidate.builder()
                .action(AuditAction.EXPORT)
                .entityType(EXPORT_ENTITY_TYPE)
                .entityId(exportId)
                .entityName("Audit log export")
                .actor(request.requestedBy())
                .ipAddress(request.ipAddress())
                .requestId(request.requestId())
                .metadata(metadata)
                .build();

        try {
            AuditLogEntry logged = appendService.append(exportEntry);
            return new ExportRecord(exportId, request.format(), rows.size(), manifestHash, payload,
                    generatedAt, true, logged.getSequence(), null);
        } catch (RuntimeException ex) {
            // the snapshot is still handed over; the gap in the trail is reported, not hidden
            log.error("Export {} was generated but could not be recorded in the audit trail", exportId, ex);
            String warning = "Export could not be recorded in the audit trail: " + ex.getMessage();
            return new ExportRecord(exportId, request.format(), rows.size(), manifestHash, payload,
                    generatedAt, false, null, warning);
        }
    }

    private static byte[] toJson(List<DisplayedEntry> rows) {
        try {
            return PAYLOAD_MAPPER.writeValueAsBytes(rows.stream().map(AuditExportService::toRow).toList());
        } catch (JsonProcessingException ex) {
            throw AuditTrailException.encodingError("Failed to serialize export payload", ex);
        }
    }

    private static byte[] toCsv(List<DisplayedEntry> rows) {
        StringBuilder sb = new StringBuilder(CSV_HEADER);
        for (DisplayedEntry row : rows) {
            AuditLogEntry e = row.entry();
            sb.append(csv(e.getSequence())).append(',')
                    .append(csv(e.getSequence())).append(',')
                    .append(csv(Instant.ofEpochMilli(e.getTimestamp()))).append(',')
                    .append(csv(e.getUserId())).append(',')
                    .append(csv(e.getUserName())).append(',')
                    .append(csv(e.getUserEmail())).append(',')
                    .append(csv(e.getUserRole())).append(',')
                    .append(csv(e.getAction().wireName())).append(',')
                    .append(csv(e.getActionCategory() == null ? null : e.getActionCategory().wireName())).append(',')
                    .append(csv(e.getEntityType())).append(',')
                    .append(csv(e.getEntityId())).append(',')
                    .append(csv(e.getEntityName())).append(',')
                    .append(csv(e.getChangedFields() == null ? null : String.join(";", e.getChangedFields()))).append(',')
                    .append(csv(json(row.oldValues()))).append(',')
                    .append(csv(json(row.newValues()))).append(',')
                    .append(csv(e.getIpAddress())).append(',')
                    .append(csv(row.sensitive())).append(',')
                    .append(csv(e.getPrevHash())).append(',')
                    .append(csv(e.getEntryHash())).append('\n');
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    static Map<String, Object> toRow(DisplayedEntry row) {
        AuditLogEntry e = row.entry();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", e.getSequence());
        m.put("sequence", e.getSequence());
        m.put("timestamp", Instant.ofEpochMilli(e.getTimestamp()).toString());
        m.put("user_id", e.getUserId());
        m.put("user_name", e.getUserName());
        m.put("user_email", e.getUserEmail());
        m.put("user_role", e.getUserRole());
        m.put("action", e.getAction().wireName());
        m.put("action_category", e.getActionCategory() == null ? null : e.getActionCategory().wireName());
        m.put("entity_type", e.getEntityType());
        m.put("entity_id", e.getEntityId());
        m.put("entity_name", e.getEntityName());
        m.put("changed_fields", e.getChangedFields());
        m.put("old_values", row.oldValues());
        m.put("new_values", row.newValues());
        m.put("ip_address", e.getIpAddress());
        m.put("user_agent", e.getUserAgent());
        m.put("request_id", e.getRequestId());
        m.put("session_id", e.getSessionId());
        m.put("metadata", e.getMetadata());
        m.put("is_sensitive", row.sensitive());
        m.put("prev_hash", e.getPrevHash());
        m.put("entry_hash", e.getEntryHash());
        return m;
    }

    private static String json(Map<String, Object> values) {
        if (values == null) {
            return null;
        }
        try {
            return PAYLOAD_MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException ex) {
            throw AuditTrailException.encodingError("Failed to serialize values for CSV", ex);
        }
    }

    private static String csv(Object v) {
        if (v == null) {
            return "";
        }
        String s = String.valueOf(v);
        boolean quote = s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r");
        return quote ? "\"" + s.replace("\"", "\"\"") + "\"" : s;
    }
}
