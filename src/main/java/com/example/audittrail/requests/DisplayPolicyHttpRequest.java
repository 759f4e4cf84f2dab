package com.example.audittrail.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DisplayPolicyHttpRequest(
        @JsonProperty("is_sensitive") @NotNull Boolean sensitive,
        @JsonProperty("reason") String reason
) {}
