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
 * History row written after each verification run. Not a ledger entry and not chained.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class VerificationRecord {

    @NonNull private String ledgerId;      // PK
    @NonNull private String verificationId; // SK "{millis}_{UUID}"
    @NonNull private Long verifiedAt;
    @NonNull private Boolean valid;
    @NonNull private Long entriesVerified;
    @NonNull private Long startSequence;
    @NonNull private Long endSequence;

    private Long firstInvalidSequence;
    private String failureReason;
    private String verifiedBy;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("ledger_id")
    public String getLedgerId() { return ledgerId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("verification_id")
    public String getVerificationId() { return verificationId; }

    @DynamoDbAttribute("verified_at")
    public Long getVerifiedAt() { return verifiedAt; }

    @DynamoDbAttribute("is_valid")
    public Boolean getValid() { return valid; }

    @DynamoDbAttribute("entries_verified")
    public Long getEntriesVerified() { return entriesVerified; }

    @DynamoDbAttribute("start_sequence")
    public Long getStartSequence() { return startSequence; }

    @DynamoDbAttribute("end_sequence")
    public Long getEndSequence() { return endSequence; }

    @DynamoDbAttribute("first_invalid_sequence")
    public Long getFirstInvalidSequence() { return firstInvalidSequence; }

    @DynamoDbAttribute("failure_reason")
    public String getFailureReason() { return failureReason; }

    @DynamoDbAttribute("verified_by")
    public String getVerifiedBy() { return verifiedBy; }
}
