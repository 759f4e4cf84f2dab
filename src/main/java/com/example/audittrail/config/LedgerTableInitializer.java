package com.example.audittrail.config;

import com.example.audittrail.access.DynamoDisplayPolicyAccess;
import com.example.audittrail.access.DynamoLedgerAccess;
import com.example.audittrail.access.DynamoVerificationAccess;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Creates the ledger, display policy and verification tables when they are missing. Intended for
 * LocalStack and test environments; production tables are provisioned outside the application.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "audit.ledger.create-tables", havingValue = "true")
public class LedgerTableInitializer implements ApplicationRunner {

    private final DynamoDbClient dynamo;

    @Override
    public void run(ApplicationArguments args) {
        ensureTables(dynamo);
    }

    public static void ensureTables(DynamoDbClient dynamo) {
        ensureTable(dynamo, DynamoLedgerAccess.TABLE_NAME, "sequence", ScalarAttributeType.N);
        ensureTable(dynamo, DynamoDisplayPolicyAccess.TABLE_NAME, "sequence", ScalarAttributeType.N);
        ensureTable(dynamo, DynamoVerificationAccess.TABLE_NAME, "verification_id", ScalarAttributeType.S);
    }

    private static void ensureTable(DynamoDbClient dynamo, String tableName, String sortKey,
                                    ScalarAttributeType sortKeyType) {
        try {
            dynamo.describeTable(b -> b.tableName(tableName));
        } catch (ResourceNotFoundException ex) {
            log.info("Creating table {}", tableName);
            dynamo.createTable(CreateTableRequest.builder()
                    .tableName(tableName)
                    .attributeDefinitions(
                            AttributeDefinition.builder().attributeName("ledger_id").attributeType(ScalarAttributeType.S).build(),
                            AttributeDefinition.builder().attributeName(sortKey).attributeType(sortKeyType).build())
                    .keySchema(
                            KeySchemaElement.builder().attributeName("ledger_id").keyType(KeyType.HASH).build(),
                            KeySchemaElement.builder().attributeName(sortKey).keyType(KeyType.RANGE).build())
                    .billingMode("PAY_PER_REQUEST")
                    .build());
            dynamo.waiter().waitUntilTableExists(b -> b.tableName(tableName));
        }
    }
}
