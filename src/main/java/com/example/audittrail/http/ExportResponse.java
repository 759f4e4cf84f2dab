package com.example.audittrail.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;

/**
 * JSON export response. {@code data} is embedded verbatim so its bytes are exactly the ones the
 * manifest hash covers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportResponse(
        @JsonProperty("export_id") String exportId,
        @JsonProperty("format") String format,
        @JsonProperty("entries_count") long entriesCount,
        @JsonProperty("manifest_hash") String manifestHash,
        @JsonProperty("file_hash") String fileHash,
        @JsonProperty("generated_at") String generatedAt,
        @JsonProperty("audit_logged") boolean auditLogged,
        @JsonProperty("export_entry_sequence") Long exportEntrySequence,
        @JsonProperty("warning") String warning,
        @JsonProperty("data") @JsonRawValue String data
) { }
