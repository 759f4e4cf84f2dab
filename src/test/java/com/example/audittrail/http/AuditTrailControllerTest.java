package com.example.audittrail.http;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.audittrail.chain.HashChain;
import com.example.audittrail.config.VerificationProperties;
import com.example.audittrail.models.AuditAction;
import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.models.AuditPage;
import com.example.audittrail.models.AuditStats;
import com.example.audittrail.models.AuditVerification;
import com.example.audittrail.models.DisplayPolicy;
import com.example.audittrail.models.DisplayedEntry;
import com.example.audittrail.models.ExportFormat;
import com.example.audittrail.models.ExportRecord;
import com.example.audittrail.requests.AuditEntryCandidate;
import com.example.audittrail.requests.AuditQuery;
import com.example.audittrail.requests.ExportServiceRequest;
import com.example.audittrail.service.AppendService;
import com.example.audittrail.service.AuditExportService;
import com.example.audittrail.service.AuditQueryService;
import com.example.audittrail.service.AuditTrailException;
import com.example.audittrail.service.DisplayPolicyService;
import com.example.audittrail.service.LedgerVerifier;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@WebMvcTest(controllers = AuditTrailController.class)
@Import({RequestIdFilter.class, VerificationProperties.class})
class AuditTrailControllerTest {

    private static final Instant NOW = Instant.parse("2024-10-01T12:34:56Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuditQueryService queryService;

    @MockBean
    private AppendService appendService;

    @MockBean
    private LedgerVerifier verifier;

    @MockBean
    private AuditExportService exportService;

    @MockBean
    private DisplayPolicyService displayPolicyService;

    @Test
    @DisplayName("GET /audit-trail returns the page as an array with paging headers")
    void listWithHeaders() throws Exception {
        when(queryService.list(any(), eq(2), eq(1))).thenReturn(new AuditPage(
                List.of(new DisplayedEntry(entry(2L), false)), 3, 2, 1));

        mockMvc.perform(MockMvcRequestBuilders.get("/audit-trail")
                        .param("entity_type", "incident")
                        .param("page", "2")
                        .param("per_page", "1"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.header().string(AuditTrailController.TOTAL_COUNT, "3"))
                .andExpect(MockMvcResultMatchers.header().string(AuditTrailController.PAGE, "2"))
                .andExpect(MockMvcResultMatchers.header().string(AuditTrailController.PER_PAGE, "1"))
                .andExpect(MockMvcResultMatchers.header().exists("X-Request-Id"))
                .andExpect(MockMvcResultMatchers.jsonPath("$", hasSize(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$[0].id", equalTo(2)))
                .andExpect(MockMvcResultMatchers.jsonPath("$[0].action", equalTo("update")))
                .andExpect(MockMvcResultMatchers.jsonPath("$[0].timestamp", equalTo("2024-10-01T12:34:56Z")))
                .andExpect(MockMvcResultMatchers.jsonPath("$[0].is_sensitive", equalTo(false)));

        ArgumentCaptor<AuditQuery> captor = ArgumentCaptor.forClass(AuditQuery.class);
        verify(queryService).list(captor.capture(), eq(2), eq(1));
        assertEquals("incident", captor.getValue().entityType());
    }

    @Test
    @DisplayName("GET /audit-trail with an unknown action is a 400")
    void listUnknownAction() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/audit-trail").param("action", "explode"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("VALIDATION_ERROR")));

        verify(queryService, never()).list(any(), anyInt(), anyInt());
    }

    @Test
    @DisplayName("GET /audit-trail/{sequence} redacts a sensitive entry")
    void getRedacted() throws Exception {
        when(queryService.get(2L)).thenReturn(new DisplayedEntry(entry(2L), true));

        mockMvc.perform(MockMvcRequestBuilders.get("/audit-trail/2"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.is_sensitive", equalTo(true)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.new_values.status", equalTo(DisplayedEntry.REDACTED)));
    }

    @Test
    @DisplayName("GET /audit-trail/{sequence} returns 404 for a missing entry")
    void getMissing() throws Exception {
        when(queryService.get(99L)).thenThrow(AuditTrailException.entryNotFound(99));

        mockMvc.perform(MockMvcRequestBuilders.get("/audit-trail/99"))
                .andExpect(MockMvcResultMatchers.status().isNotFound())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("ENTRY_NOT_FOUND")));
    }

    @Test
    @DisplayName("POST /audit-trail/entries appends with the request id and returns 201")
    void appendEntry() throws Exception {
        when(appendService.append(any())).thenReturn(entry(1L));

        mockMvc.perform(MockMvcRequestBuilders.post("/audit-trail/entries")
                        .header("X-Request-Id", "req-abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"update\",\"entity_type\":\"incident\",\"entity_id\":\"INC-1\","
                                + "\"user_id\":\"u-42\",\"new_values\":{\"status\":\"closed\"}}"))
                .andExpect(MockMvcResultMatchers.status().isCreated())
                .andExpect(MockMvcResultMatchers.header().string("Location", "/audit-trail/1"))
                .andExpect(MockMvcResultMatchers.jsonPath("$.sequence", equalTo(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.prev_hash", equalTo(HashChain.GENESIS_HASH)));

        ArgumentCaptor<AuditEntryCandidate> captor = ArgumentCaptor.forClass(AuditEntryCandidate.class);
        verify(appendService).append(captor.capture());
        AuditEntryCandidate candidate = captor.getValue();
        assertEquals(AuditAction.UPDATE, candidate.action());
        assertEquals("req-abc", candidate.requestId());
        assertEquals(Map.of("status", "closed"), candidate.newValues());
    }

    @Test
    @DisplayName("POST /audit-trail/entries without an action is a 400")
    void appendWithoutAction() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/audit-trail/entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entity_type\":\"incident\"}"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("VALIDATION_ERROR")));

        verify(appendService, never()).append(any());
    }

    @Test
    @DisplayName("POST /audit-trail/entries returns 409 while the ledger is frozen")
    void appendFrozen() throws Exception {
        when(appendService.append(any())).thenThrow(AuditTrailException.integrityViolation(4));

        mockMvc.perform(MockMvcRequestBuilders.post("/audit-trail/entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"view\"}"))
                .andExpect(MockMvcResultMatchers.status().isConflict())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("INTEGRITY_VIOLATION")));
    }

    @Test
    @DisplayName("POST /audit-trail/entries returns 503 when the write failed")
    void appendUnavailable() throws Exception {
        when(appendService.append(any())).thenThrow(
                AuditTrailException.appendError("Durable write failed", new IllegalStateException("throttled")));

        mockMvc.perform(MockMvcRequestBuilders.post("/audit-trail/entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"view\"}"))
                .andExpect(MockMvcResultMatchers.status().isServiceUnavailable())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("APPEND_ERROR")));
    }

    @Test
    @DisplayName("POST /audit-trail/verify without a body verifies the whole chain as the calling user")
    void verifyFull() throws Exception {
        when(verifier.verify("u-9")).thenReturn(
                AuditVerification.invalid(3, 4, AuditVerification.HASH_MISMATCH, 1, 4, NOW));

        mockMvc.perform(MockMvcRequestBuilders.post("/audit-trail/verify").header("X-User-Id", "u-9"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.is_valid", equalTo(false)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.entries_verified", equalTo(3)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.first_invalid_sequence", equalTo(4)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.verified_by", equalTo("u-9")));
    }

    @Test
    @DisplayName("POST /audit-trail/verify with a range passes the anchor through")
    void verifyRange() throws Exception {
        String anchor = "a".repeat(64);
        when(verifier.verifyRange(3L, 5L, anchor, "system"))
                .thenReturn(AuditVerification.valid(3, 3, 5, NOW));

        mockMvc.perform(MockMvcRequestBuilders.post("/audit-trail/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from\":3,\"to\":5,\"anchor_hash\":\"" + anchor + "\"}"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.is_valid", equalTo(true)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.start_sequence", equalTo(3)));

        verify(verifier, never()).verify(anyString());
    }

    @Test
    @DisplayName("GET /audit-trail/verifications rejects a limit over 100")
    void verificationsLimit() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/audit-trail/verifications").param("limit", "500"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest());

        verify(verifier, never()).history(anyInt());
    }

    @Test
    @DisplayName("POST /audit-trail/export returns the JSON payload inline with its manifest hash")
    void exportJson() throws Exception {
        byte[] payload = "[{\"sequence\":1}]".getBytes(StandardCharsets.UTF_8);
        when(exportService.export(any())).thenReturn(new ExportRecord("exp-1", ExportFormat.JSON, 1,
                HashChain.sha256Hex(payload), payload, NOW, true, 7L, null));

        mockMvc.perform(MockMvcRequestBuilders.post("/audit-trail/export")
                        .header("X-User-Id", "u-7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entity_type\":\"incident\",\"reason\":\"audit review\"}"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.export_id", equalTo("exp-1")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.manifest_hash", equalTo(HashChain.sha256Hex(payload))))
                .andExpect(MockMvcResultMatchers.jsonPath("$.audit_logged", equalTo(true)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data[0].sequence", equalTo(1)));

        ArgumentCaptor<ExportServiceRequest> captor = ArgumentCaptor.forClass(ExportServiceRequest.class);
        verify(exportService).export(captor.capture());
        ExportServiceRequest request = captor.getValue();
        assertEquals("audit review", request.reason());
        assertEquals("incident", request.filters().entityType());
        assertEquals("u-7", request.requestedBy().userId());
        assertEquals(ExportFormat.JSON, request.format());
    }

    @Test
    @DisplayName("POST /audit-trail/export as CSV is a download carrying the audit warning")
    void exportCsv() throws Exception {
        byte[] payload = "id,sequence\n1,1\n".getBytes(StandardCharsets.UTF_8);
        when(exportService.export(any())).thenReturn(new ExportRecord("exp-2", ExportFormat.CSV, 1,
                HashChain.sha256Hex(payload), payload, NOW, false, null, "Export could not be recorded"));

        mockMvc.perform(MockMvcRequestBuilders.post("/audit-trail/export")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"format\":\"csv\",\"reason\":\"audit review\"}"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.header().string("X-Export-Id", "exp-2"))
                .andExpect(MockMvcResultMatchers.header().string("X-Audit-Logged", "false"))
                .andExpect(MockMvcResultMatchers.header().exists("X-Audit-Warning"))
                .andExpect(MockMvcResultMatchers.content().bytes(payload));
    }

    @Test
    @DisplayName("POST /audit-trail/export without a reason is a 400")
    void exportWithoutReason() throws Exception {
        when(exportService.export(any())).thenThrow(AuditTrailException.validation("reason is required for an export"));

        mockMvc.perform(MockMvcRequestBuilders.post("/audit-trail/export")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("VALIDATION_ERROR")));
    }

    @Test
    @DisplayName("GET /audit-trail/stats maps the aggregate counts")
    void stats() throws Exception {
        when(queryService.stats(7)).thenReturn(new AuditStats(5, Map.of("update", 5L), 2,
                Map.of("incident", 5L), List.of(new AuditStats.UserCount("dana@example.com", 4)), 7));

        mockMvc.perform(MockMvcRequestBuilders.get("/audit-trail/stats").param("days", "7"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.total_entries", equalTo(5)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.by_action.update", equalTo(5)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.top_users[0].user", equalTo("dana@example.com")));
    }

    @Test
    @DisplayName("GET /audit-trail/actions lists every action wire name")
    void actions() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/audit-trail/actions"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$", hasSize(AuditAction.values().length)))
                .andExpect(MockMvcResultMatchers.jsonPath("$[0]", equalTo("create")));
    }

    @Test
    @DisplayName("PUT /audit-trail/{sequence}/display-policy records who changed it")
    void displayPolicy() throws Exception {
        when(displayPolicyService.setSensitivity(eq(2L), eq(true), eq("health data"), eq("dpo")))
                .thenReturn(DisplayPolicy.builder()
                        .ledgerId("default")
                        .sequence(2L)
                        .sensitive(true)
                        .updatedAt(NOW.toEpochMilli())
                        .updatedBy("dpo")
                        .reason("health data")
                        .build());

        mockMvc.perform(MockMvcRequestBuilders.put("/audit-trail/2/display-policy")
                        .header("X-User-Id", "dpo")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"is_sensitive\":true,\"reason\":\"health data\"}"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.is_sensitive", equalTo(true)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.updated_by", equalTo("dpo")));
    }

    @Test
    @DisplayName("PUT display-policy without is_sensitive is a 400")
    void displayPolicyMissingFlag() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.put("/audit-trail/2/display-policy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"x\"}"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest());

        verify(displayPolicyService, never()).setSensitivity(anyLong(), anyBoolean(), any(), any());
    }

    @Test
    @DisplayName("POST /audit-trail/entries with a null changed field is a 400")
    void appendNullChangedField() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/audit-trail/entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"update\",\"entity_type\":\"incident\",\"changed_fields\":[null]}"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("VALIDATION_ERROR")));

        verify(appendService, never()).append(any());
    }

    private static AuditLogEntry entry(long seq) {
        return AuditLogEntry.builder()
                .ledgerId("default")
                .sequence(seq)
                .timestamp(NOW.toEpochMilli())
                .prevHash(HashChain.GENESIS_HASH)
                .action(AuditAction.UPDATE)
                .entityType("incident")
                .entityId("INC-1")
                .userId("u-42")
                .newValues(Map.of("status", "closed"))
                .build();
    }
}
