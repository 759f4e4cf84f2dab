package com.example.audittrail.service;

import com.example.audittrail.models.DisplayedEntry;
import com.example.audittrail.requests.AuditEntryCandidate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Replaces credential-like values before an entry is built, so the raw value never reaches the
 * ledger or its hash.
 *
 * <p>Long markers match anywhere in the key ({@code user_password}, {@code apiToken}). Short ones only
 * match a whole word of the key, so {@code pin} masks {@code pin} and {@code card_pin} but not
 * {@code shipping}.
 */
public final class PiiMasker {

    public static final String REDACTED = DisplayedEntry.REDACTED;

    private static final List<String> SUBSTRING_MARKERS =
            List.of("password", "secret", "token", "creditcard", "cardnumber");
    private static final Set<String> WORD_MARKERS = Set.of("ssn", "cvv", "pin");

    private PiiMasker() {}

    public static AuditEntryCandidate mask(AuditEntryCandidate candidate) {
        return candidate.toBuilder()
                .oldValues(mask(candidate.oldValues()))
                .newValues(mask(candidate.newValues()))
                .metadata(mask(candidate.metadata()))
                .build();
    }

    public static Map<String, Object> mask(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return values;
        }
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k, isSensitiveKey(k) && v != null ? REDACTED : v));
        return out;
    }

    static boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        // fooBar -> foo_bar so camelCase keys split into words the same way snake_case ones do
        String snake = key.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
        String compact = snake.replaceAll("[^a-z0-9]", "");
        for (String marker : SUBSTRING_MARKERS) {
            if (compact.contains(marker)) {
                return true;
            }
        }
        for (String word : snake.split("[^a-z0-9]+")) {
            if (WORD_MARKERS.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
