package com.example.audittrail.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "audit.export")
@Data
public class ExportProperties {

    private int maxEntries = 10000;
}
