package com.callprobe.instrumenter.engine;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Default {@link SourceHasher}: the first {@code length} lowercase hex characters of SHA-256.
 */
public class Sha256SourceHasher implements SourceHasher {

    public static final int DEFAULT_LENGTH = 8;

    private final int length;

    public Sha256SourceHasher() {
        this(DEFAULT_LENGTH);
    }

    public Sha256SourceHasher(int length) {
        if (length < 1 || length > 64) {
            throw new IllegalArgumentException("hash length must be between 1 and 64, got: " + length);
        }
        this.length = length;
    }

    @Override
    public String hash(String text) {
        byte[] digest = sha256().digest(text.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest).substring(0, length);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
