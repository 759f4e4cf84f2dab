package com.example.audittrail.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the ledger and its single writer.
 * These values are bound from application.yml (audit.ledger.*).
 * The defaults below serve as fallbacks if properties are missing from YAML.
 */
@Component
@ConfigurationProperties(prefix = "audit.ledger")
@Data
public class LedgerProperties {

    private String ledgerId = "default";
    private int appendQueueCapacity = 1000;  // Pending appends beyond this are rejected
    private boolean freezeOnViolation = true;
    private boolean createTables = false;
}
