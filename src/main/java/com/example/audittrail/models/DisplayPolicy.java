package com.example.audittrail.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * Mutable display override for one ledger entry. Lives in its own table so changing how an entry
 * is shown never touches the entry or its hash.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class DisplayPolicy {

    @NonNull private String ledgerId;
    @NonNull private Long sequence;
    @NonNull private Boolean sensitive;
    @NonNull private Long updatedAt;

    private String updatedBy;
    private String reason;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("ledger_id")
    public String getLedgerId() { return ledgerId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("sequence")
    public Long getSequence() { return sequence; }

    @DynamoDbAttribute("is_sensitive")
    public Boolean getSensitive() { return sensitive; }

    @DynamoDbAttribute("updated_at")
    public Long getUpdatedAt() { return updatedAt; }

    @DynamoDbAttribute("updated_by")
    public String getUpdatedBy() { return updatedBy; }

    @DynamoDbAttribute("reason")
    public String getReason() { return reason; }
}
