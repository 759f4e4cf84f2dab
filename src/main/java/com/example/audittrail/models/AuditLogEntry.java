package com.example.audittrail.models;

import com.example.audittrail.chain.HashChain;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * One immutable ledger entry. The whole ledger lives in a single partition ({@code ledger_id})
 * ordered by {@code sequence}, so tail lookups and range scans are plain key-ordered queries.
 *
 * <p>Setters exist only because the DynamoDB bean mapper needs them; nothing in the service layer
 * mutates an entry once it has been built.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class AuditLogEntry {

    // Required fields: Lombok @NonNull enforces runtime null checks in builder
    @NonNull private String ledgerId;     // PK
    @NonNull private Long sequence;       // SK
    @NonNull private Long timestamp;      // epoch millis
    @NonNull private String prevHash;
    @NonNull private AuditAction action;

    // filled by the builder
    private String entryHash;
    private ActionCategory actionCategory;

    // Subject
    private String entityType;
    private String entityId;
    private String entityName;

    // Actor
    private String userId;
    private String userName;
    private String userEmail;
    private String userRole;

    // Change
    private List<String> changedFields;
    private Map<String, Object> oldValues;
    private Map<String, Object> newValues;

    // Request context
    private String ipAddress;
    private String userAgent;
    private String requestId;
    private String sessionId;
    private Map<String, Object> metadata;

    // display hint only, never hashed
    private Boolean sensitive;

    // ----- DynamoDB annotations on getters -----
    @DynamoDbPartitionKey
    @DynamoDbAttribute("ledger_id")
    public String getLedgerId() { return ledgerId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("sequence")
    public Long getSequence() { return sequence; }

    @DynamoDbAttribute("timestamp")
    public Long getTimestamp() { return timestamp; }

    @DynamoDbAttribute("prev_hash")
    public String getPrevHash() { return prevHash; }

    @DynamoDbAttribute("entry_hash")
    public String getEntryHash() { return entryHash; }

    @DynamoDbAttribute("action")
    public AuditAction getAction() { return action; }

    @DynamoDbAttribute("action_category")
    public ActionCategory getActionCategory() { return actionCategory; }

    @DynamoDbAttribute("entity_type")
    public String getEntityType() { return entityType; }

    @DynamoDbAttribute("entity_id")
    public String getEntityId() { return entityId; }

    @DynamoDbAttribute("entity_name")
    public String getEntityName() { return entityName; }

    @DynamoDbAttribute("user_id")
    public String getUserId() { return userId; }

    @DynamoDbAttribute("user_name")
    public String getUserName() { return userName; }

    @DynamoDbAttribute("user_email")
    public String getUserEmail() { return userEmail; }

    @DynamoDbAttribute("user_role")
    public String getUserRole() { return userRole; }

    @DynamoDbAttribute("changed_fields")
    public List<String> getChangedFields() { return changedFields; }

    @DynamoDbConvertedBy(JsonStringMapAttributeConverter.class)
    @DynamoDbAttribute("old_values")
    public Map<String, Object> getOldValues() { return oldValues; }

    @DynamoDbConvertedBy(JsonStringMapAttributeConverter.class)
    @DynamoDbAttribute("new_values")
    public Map<String, Object> getNewValues() { return newValues; }

    @DynamoDbAttribute("ip_address")
    public String getIpAddress() { return ipAddress; }

    @DynamoDbAttribute("user_agent")
    public String getUserAgent() { return userAgent; }

    @DynamoDbAttribute("request_id")
    public String getRequestId() { return requestId; }

    @DynamoDbAttribute("session_id")
    public String getSessionId() { return sessionId; }

    @DynamoDbConvertedBy(JsonStringMapAttributeConverter.class)
    @DynamoDbAttribute("metadata")
    public Map<String, Object> getMetadata() { return metadata; }

    @DynamoDbAttribute("is_sensitive")
    public Boolean getSensitive() { return sensitive; }

    /**
     * Recomputes the hash this entry should carry given its own {@code prev_hash} and fields.
     */
    public String recomputeHash() {
        return HashChain.entryHash(this);
    }

    public static class AuditLogEntryBuilder {
        public AuditLogEntry build() {
            AuditLogEntry e = new AuditLogEntry(
                    ledgerId, sequence, timestamp, prevHash, action,
                    null,
                    actionCategory != null ? actionCategory : ActionCategory.defaultFor(action),
                    entityType, entityId, entityName,
                    userId, userName, userEmail, userRole,
                    changedFields == null ? List.of() : List.copyOf(changedFields),
                    oldValues, newValues,
                    ipAddress, userAgent, requestId, sessionId,
                    metadata == null ? Map.of() : metadata,
                    sensitive != null ? sensitive : Boolean.FALSE
            );
            e.entryHash = HashChain.entryHash(e);
            return e;
        }
    }
}
