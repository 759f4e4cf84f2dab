package com.example.audittrail.chain;

import com.example.audittrail.models.AuditLogEntry;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 hash chain: {@code entry_hash = hex(SHA-256(prev_hash_hex_ascii || canonical_bytes))}.
 */
public final class HashChain {

    /** Expected {@code prev_hash} of sequence 1, shared by every verifier. */
    public static final String GENESIS_HASH = "0".repeat(64);

    private static final String ALGORITHM = "SHA-256";

    private HashChain() {}

    public static String computeHash(String prevHash, byte[] canonical) {
        MessageDigest md = digest();
        md.update(prevHash.getBytes(StandardCharsets.US_ASCII));
        md.update(canonical);
        return HexFormat.of().formatHex(md.digest());
    }

    public static String entryHash(AuditLogEntry entry) {
        byte[] canonical = CanonicalEncoder.encode(entry);
        return computeHash(entry.getPrevHash(), canonical);
    }

    public static String sha256Hex(byte[] payload) {
        return HexFormat.of().formatHex(digest().digest(payload));
    }

    private static MessageDigest digest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Hash algorithm not available: " + ALGORITHM, e);
        }
    }
}
