package com.example.audittrail.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DisplayPolicyResponse(
        @JsonProperty("sequence") Long sequence,
        @JsonProperty("is_sensitive") Boolean sensitive,
        @JsonProperty("updated_at") Long updatedAt,
        @JsonProperty("updated_by") String updatedBy,
        @JsonProperty("reason") String reason
) { }
