package com.example.audittrail.chain;

import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.service.AuditTrailException;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteFeature;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Deterministic byte encoding of an entry's logical fields, used as hash input.
 *
 * <p>Output is one compact UTF-8 JSON object whose top-level fields are always written in the order
 * below, whatever order the entry was populated in. Absent optional fields are written as an explicit
 * {@code null}. Keys of the value maps are sorted. Numbers are normalised so {@code 3}, {@code 3L} and
 * {@code 3.0} encode identically, which keeps hashes stable across storage round trips.
 *
 * <p>{@code entry_hash} and {@code is_sensitive} are not part of the encoding.
 *
 * <p>Permitted values are strings, numbers, booleans, null and lists of those. Anything else fails
 * with {@link AuditTrailException.Code#ENCODING_ERROR}: audited values must be flattened to JSON-safe
 * scalars before the entry is built.
 */
public final class CanonicalEncoder {

    private static final JsonFactory FACTORY = JsonFactory.builder()
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private CanonicalEncoder() {}

    public static byte[] encode(AuditLogEntry e) {
        Objects.requireNonNull(e, "entry");
        ByteArrayOutputStream out = new ByteArrayOutputStream(512);
        try (JsonGenerator gen = FACTORY.createGenerator(out, JsonEncoding.UTF8)) {
            gen.writeStartObject();
            writeNumber(gen, "sequence", e.getSequence());
            writeNumber(gen, "timestamp", e.getTimestamp());
            writeString(gen, "prev_hash", e.getPrevHash());
            writeString(gen, "action", e.getAction() == null ? null : e.getAction().wireName());
            writeString(gen, "action_category",
                    e.getActionCategory() == null ? null : e.getActionCategory().wireName());
            writeString(gen, "entity_type", e.getEntityType());
            writeString(gen, "entity_id", e.getEntityId());
            writeString(gen, "entity_name", e.getEntityName());
            writeString(gen, "user_id", e.getUserId());
            writeString(gen, "user_name", e.getUserName());
            writeString(gen, "user_email", e.getUserEmail());
            writeString(gen, "user_role", e.getUserRole());
            gen.writeFieldName("changed_fields");
            writeValue(gen, e.getChangedFields(), "changed_fields");
            writeMap(gen, "old_values", e.getOldValues());
            writeMap(gen, "new_values", e.getNewValues());
            writeString(gen, "ip_address", e.getIpAddress());
            writeString(gen, "user_agent", e.getUserAgent());
            writeString(gen, "request_id", e.getRequestId());
            writeString(gen, "session_id", e.getSessionId());
            writeMap(gen, "metadata", e.getMetadata());
            gen.writeEndObject();
        } catch (IOException ex) {
            throw AuditTrailException.encodingError("Failed to encode entry " + e.getSequence(), ex);
        }
        return out.toByteArray();
    }

    /**
     * Fails fast when a value map holds something that cannot be canonicalised.
     */
    public static void requireEncodable(Map<String, ?> values, String field) {
        if (values == null) {
            return;
        }
        for (Map.Entry<String, ?> en : values.entrySet()) {
            if (en.getKey() == null) {
                throw AuditTrailException.encodingError(field + " contains a null key");
            }
            checkValue(en.getValue(), field + "." + en.getKey());
        }
    }

    private static void checkValue(Object v, String path) {
        if (v == null || v instanceof String || v instanceof Boolean) {
            return;
        }
        if (v instanceof Number n) {
            normalize(n, path);
            return;
        }
        if (v instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                checkValue(list.get(i), path + "[" + i + "]");
            }
            return;
        }
        throw unsupported(v, path);
    }

    private static void writeString(JsonGenerator gen, String name, String value) throws IOException {
        gen.writeFieldName(name);
        if (value == null) {
            gen.writeNull();
        } else {
            gen.writeString(value);
        }
    }

    private static void writeNumber(JsonGenerator gen, String name, Long value) throws IOException {
        gen.writeFieldName(name);
        if (value == null) {
            gen.writeNull();
        } else {
            gen.writeNumber(value);
        }
    }

    private static void writeMap(JsonGenerator gen, String name, Map<String, Object> map) throws IOException {
        gen.writeFieldName(name);
        if (map == null) {
            gen.writeNull();
            return;
        }
        requireEncodable(map, name);
        gen.writeStartObject();
        for (Map.Entry<String, Object> en : new TreeMap<>(map).entrySet()) {
            gen.writeFieldName(en.getKey());
            writeValue(gen, en.getValue(), name + "." + en.getKey());
        }
        gen.writeEndObject();
    }

    private static void writeValue(JsonGenerator gen, Object v, String path) throws IOException {
        if (v == null) {
            gen.writeNull();
        } else if (v instanceof String s) {
            gen.writeString(s);
        } else if (v instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (v instanceof Number n) {
            gen.writeNumber(normalize(n, path));
        } else if (v instanceof List<?> list) {
            gen.writeStartArray();
            for (int i = 0; i < list.size(); i++) {
                writeValue(gen, list.get(i), path + "[" + i + "]");
            }
            gen.writeEndArray();
        } else {
            throw unsupported(v, path);
        }
    }

    static BigDecimal normalize(Number n, String path) {
        BigDecimal d;
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
            d = BigDecimal.valueOf(n.longValue());
        } else if (n instanceof BigInteger bi) {
            d = new BigDecimal(bi);
        } else if (n instanceof BigDecimal bd) {
            d = bd;
        } else if (n instanceof Double || n instanceof Float) {
            double dv = n.doubleValue();
            if (Double.isNaN(dv) || Double.isInfinite(dv)) {
                throw AuditTrailException.encodingError("Non-finite number at " + path);
            }
            // toString of the boxed type gives the shortest decimal that round-trips
            d = new BigDecimal(n.toString());
        } else {
            throw unsupported(n, path);
        }
        return d.signum() == 0 ? BigDecimal.ZERO : d.stripTrailingZeros();
    }

    private static AuditTrailException unsupported(Object v, String path) {
        return AuditTrailException.encodingError(
                "Unsupported value type " + v.getClass().getName() + " at " + path);
    }
}
