package com.example.audittrail.access;

import com.example.audittrail.config.LedgerProperties;
import com.example.audittrail.models.DisplayPolicy;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
public class DynamoDisplayPolicyAccess implements DisplayPolicyAccess {

    public static final String TABLE_NAME = "audit_display_policies";

    private final DynamoDbTable<DisplayPolicy> table;
    private final String ledgerId;

    public DynamoDisplayPolicyAccess(DynamoDbEnhancedClient enhancedClient, LedgerProperties properties) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(DisplayPolicy.class));
        this.ledgerId = properties.getLedgerId();
    }

    @Override
    public Optional<DisplayPolicy> findBySequence(long sequence) {
        return Optional.ofNullable(table.getItem(r -> r.key(Key.builder()
                        .partitionValue(ledgerId)
                        .sortValue(sequence)
                        .build())));
    }

    @Override
    public List<DisplayPolicy> findAll() {
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                        Key.builder().partitionValue(ledgerId).build())))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public DisplayPolicy save(DisplayPolicy policy) {
        table.putItem(policy);
        return policy;
    }
}
