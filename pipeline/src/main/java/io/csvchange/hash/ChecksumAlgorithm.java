package io.csvchange.hash;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Supported payload digests. MD5 is the fast option, SHA-256 the cryptographic one.
 */
public enum ChecksumAlgorithm {
    MD5("MD5", "md5"),
    SHA256("SHA-256", "sha256");

    private static final HexFormat HEX = HexFormat.of();

    private final String jcaName;
    private final String id;

    ChecksumAlgorithm(String jcaName, String id) {
        this.jcaName = jcaName;
        this.id = id;
    }

    @JsonValue
    public String id() { return id; }

    @JsonCreator
    public static ChecksumAlgorithm fromId(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT).replace("-", "");
        for (ChecksumAlgorithm a : values()) {
            if (a.id.equals(v)) return a;
        }
        throw new IllegalArgumentException("Unknown checksum algorithm: " + value);
    }

    public MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(jcaName);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(jcaName + " not available", e);
        }
    }

    /** Lowercase hex digest of {@code bytes}. */
    public String hex(byte[] bytes) {
        return HEX.formatHex(newDigest().digest(bytes));
    }

    /** Lowercase hex digest of a file, streamed. */
    public String hex(Path file) throws IOException {
        MessageDigest md = newDigest();
        byte[] buf = new byte[64 * 1024];
        try (InputStream in = Files.newInputStream(file)) {
            int n;
            while ((n = in.read(buf)) > 0) md.update(buf, 0, n);
        }
        return HEX.formatHex(md.digest());
    }
}
