package com.example.audittrail.access;

import com.example.audittrail.config.LedgerProperties;
import com.example.audittrail.models.VerificationRecord;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
public class DynamoVerificationAccess implements VerificationAccess {

    public static final String TABLE_NAME = "audit_verifications";

    private final DynamoDbTable<VerificationRecord> table;
    private final String ledgerId;

    public DynamoVerificationAccess(DynamoDbEnhancedClient enhancedClient, LedgerProperties properties) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(VerificationRecord.class));
        this.ledgerId = properties.getLedgerId();
    }

    @Override
    public void save(VerificationRecord record) {
        table.putItem(record);
    }

    @Override
    public List<VerificationRecord> findLatest(int limit) {
        // verification ids start with the run's epoch millis, so key order is time order
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                                Key.builder().partitionValue(ledgerId).build()))
                        .scanIndexForward(false)
                        .limit(limit))
                .items()
                .stream()
                .limit(limit)
                .collect(Collectors.toList());
    }
}
