package com.example.audittrail.access;

import com.example.audittrail.config.LedgerProperties;
import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.models.LedgerTail;
import com.example.audittrail.service.AuditTrailException;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;

/**
 * Writes go through the enhanced client. Reads fetch raw items and map each one separately, so a
 * single unreadable row becomes a {@link CorruptEntryException} at its own sequence instead of
 * failing the whole query.
 */
@Component
public class DynamoLedgerAccess implements LedgerAccess {

    public static final String TABLE_NAME = "audit_log_entries";

    private static final Expression SEQUENCE_NOT_TAKEN = Expression.builder()
            .expression("attribute_not_exists(#seq)")
            .putExpressionName("#seq", "sequence")
            .build();

    // "timestamp" is a DynamoDB reserved word
    private static final Map<String, String> NAMES = Map.of(
            "#pk", "ledger_id",
            "#seq", "sequence",
            "#ts", "timestamp",
            "#hash", "entry_hash");

    private final DynamoDbClient dynamo;
    private final TableSchema<AuditLogEntry> schema;
    private final DynamoDbTable<AuditLogEntry> table;
    private final String ledgerId;

    public DynamoLedgerAccess(DynamoDbClient dynamo,
                              DynamoDbEnhancedClient enhancedClient,
                              LedgerProperties properties) {
        this.dynamo = dynamo;
        this.schema = TableSchema.fromBean(AuditLogEntry.class);
        this.table = enhancedClient.table(TABLE_NAME, schema);
        this.ledgerId = properties.getLedgerId();
    }

    @Override
    public void append(AuditLogEntry entry) {
        if (!ledgerId.equals(entry.getLedgerId())) {
            throw new IllegalArgumentException("Entry belongs to ledger " + entry.getLedgerId()
                    + ", this store serves " + ledgerId);
        }
        long currentMax = tail().map(LedgerTail::sequence).orElse(0L);
        if (entry.getSequence() != currentMax + 1) {
            throw AuditTrailException.sequenceConflict(entry.getSequence(), currentMax);
        }
        try {
            // The condition catches a racing writer that passed the tail check at the same time.
            table.putItem(r -> r.item(entry).conditionExpression(SEQUENCE_NOT_TAKEN));
        } catch (ConditionalCheckFailedException ex) {
            throw AuditTrailException.sequenceConflict(entry.getSequence(), ex);
        }
    }

    @Override
    public Optional<LedgerTail> tail() {
        // Only the key, hash and timestamp are read, so a damaged value map never blocks appends.
        QueryRequest request = QueryRequest.builder()
                .tableName(TABLE_NAME)
                .keyConditionExpression("#pk = :pk")
                .projectionExpression("#seq, #hash, #ts")
                .expressionAttributeNames(NAMES)
                .expressionAttributeValues(Map.of(":pk", AttributeValue.fromS(ledgerId)))
                .scanIndexForward(false)
                .consistentRead(true)
                .limit(1)
                .build();
        return dynamo.query(request).items().stream()
                .findFirst()
                .map(DynamoLedgerAccess::toTail);
    }

    @Override
    public Optional<AuditLogEntry> findBySequence(long sequence) {
        Map<String, AttributeValue> item = dynamo.getItem(r -> r.tableName(TABLE_NAME)
                .key(Map.of("ledger_id", AttributeValue.fromS(ledgerId), "sequence", number(sequence)))
                .consistentRead(true))
                .item();
        if (item == null || item.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toEntry(item));
    }

    @Override
    public Stream<AuditLogEntry> scanFrom(long fromSequence) {
        long upper = tail().map(LedgerTail::sequence).orElse(0L);
        if (upper < fromSequence) {
            return Stream.empty();
        }
        return scanRange(fromSequence, upper);
    }

    @Override
    public Stream<AuditLogEntry> scanRange(long fromSequence, long toSequence) {
        if (toSequence < fromSequence) {
            return Stream.empty();
        }
        return query("#pk = :pk AND #seq BETWEEN :from AND :to",
                Map.of(":pk", AttributeValue.fromS(ledgerId),
                        ":from", number(fromSequence),
                        ":to", number(toSequence)),
                true);
    }

    @Override
    public Stream<AuditLogEntry> scanNewestFirst() {
        Optional<LedgerTail> tail = tail();
        if (tail.isEmpty()) {
            return Stream.empty();
        }
        return query("#pk = :pk AND #seq <= :to",
                Map.of(":pk", AttributeValue.fromS(ledgerId), ":to", number(tail.get().sequence())),
                false);
    }

    private Stream<AuditLogEntry> query(String keyCondition, Map<String, AttributeValue> values, boolean ascending) {
        QueryRequest request = QueryRequest.builder()
                .tableName(TABLE_NAME)
                .keyConditionExpression(keyCondition)
                .expressionAttributeNames(Map.of("#pk", "ledger_id", "#seq", "sequence"))
                .expressionAttributeValues(values)
                .scanIndexForward(ascending)
                .consistentRead(true)
                .build();
        return dynamo.queryPaginator(request).items().stream().map(this::toEntry);
    }

    private AuditLogEntry toEntry(Map<String, AttributeValue> item) {
        try {
            return schema.mapToItem(item);
        } catch (RuntimeException ex) {
            throw new CorruptEntryException(sequenceOf(item), ex);
        }
    }

    private static LedgerTail toTail(Map<String, AttributeValue> item) {
        long sequence = sequenceOf(item);
        try {
            return new LedgerTail(sequence, item.get("entry_hash").s(), Long.parseLong(item.get("timestamp").n()));
        } catch (RuntimeException ex) {
            throw new CorruptEntryException(sequence, ex);
        }
    }

    // sequence is the sort key, so it is always present and numeric
    private static long sequenceOf(Map<String, AttributeValue> item) {
        return Long.parseLong(item.get("sequence").n());
    }

    private static AttributeValue number(long value) {
        return AttributeValue.fromN(Long.toString(value));
    }
}
