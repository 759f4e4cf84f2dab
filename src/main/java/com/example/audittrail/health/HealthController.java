package com.example.audittrail.health;

import com.example.audittrail.access.LedgerAccess;
import com.example.audittrail.models.LedgerTail;
import com.example.audittrail.service.LedgerIntegrityState;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Slf4j
public class HealthController {

    private final BuildProperties buildProperties;
    private final String env;
    private final LedgerAccess ledgerAccess;
    private final LedgerIntegrityState integrityState;
    private final Clock clock;

    public HealthController(@Value("${app.env:local}") String env,
                            ObjectProvider<BuildProperties> buildProperties,
                            LedgerAccess ledgerAccess,
                            LedgerIntegrityState integrityState,
                            Clock clock) {
        this.env = env;
        this.buildProperties = buildProperties.getIfAvailable();
        this.ledgerAccess = ledgerAccess;
        this.integrityState = integrityState;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("ts", Instant.now(clock).toString());
        body.put("env", env);
        body.put("app", buildProperties != null ? buildProperties.getName() : "audit-trail");
        body.put("version", buildProperties != null ? buildProperties.getVersion() : "dev");
        try {
            body.put("ledger_tail", ledgerAccess.tail().map(LedgerTail::sequence).orElse(0L));
        } catch (RuntimeException ex) {
            log.warn("Health check could not read the ledger tail: {}", ex.getMessage());
            body.put("status", "degraded");
        }
        body.put("integrity_flagged", integrityState.isFlagged());
        return ResponseEntity.ok(body);
    }
}
