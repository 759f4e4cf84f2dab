package com.example.audittrail.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional body of POST /audit-trail/verify. Without {@code from}/{@code to} the whole chain is verified.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerifyHttpRequest(
        @JsonProperty("from") Long from,
        @JsonProperty("to") Long to,
        @JsonProperty("anchor_hash") String anchorHash
) {

    public boolean isRange() {
        return from != null || to != null;
    }
}
