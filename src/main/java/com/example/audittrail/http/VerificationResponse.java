package com.example.audittrail.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationResponse(
        @JsonProperty("is_valid") boolean valid,
        @JsonProperty("entries_verified") long entriesVerified,
        @JsonProperty("first_invalid_sequence") Long firstInvalidSequence,
        @JsonProperty("failure_reason") String failureReason,
        @JsonProperty("start_sequence") long startSequence,
        @JsonProperty("end_sequence") long endSequence,
        @JsonProperty("verified_at") String verifiedAt,
        @JsonProperty("verified_by") String verifiedBy
) { }
