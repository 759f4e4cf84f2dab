package com.example.audittrail.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for scheduled chain verification.
 * These values are bound from application.yml (audit.verification.*).
 * To enable the job, set audit.verification.enabled=true in application.yml.
 */
@Component
@ConfigurationProperties(prefix = "audit.verification")
@Data
public class VerificationProperties {

    private boolean enabled = false;
    private String schedule = "0 0 3 * * *";
    private int historyLimit = 10;
}
