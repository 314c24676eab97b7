package io.pipeguard.idempotency;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Deterministic ids derived from content: the first 16 hex characters of the SHA-256 digest
 * of the parts joined with {@code |}.
 *
 * <p>The same inputs always yield the same id, so a replayed unit of work maps onto the row
 * its first delivery wrote.
 */
public final class ContentIds {
    public static final int LENGTH = 16;
    private static final String SEPARATOR = "|";

    private ContentIds() {
    }

    public static String derive(String... parts) {
        if (parts.length == 0) {
            throw new IllegalArgumentException("at least one part is required");
        }
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                joined.append(SEPARATOR);
            }
            joined.append(Objects.requireNonNull(parts[i], "part " + i));
        }
        return HexFormat.of().formatHex(sha256(joined.toString())).substring(0, LENGTH);
    }

    public static String derive(Iterable<String> parts) {
        StringBuilder joined = new StringBuilder();
        boolean first = true;
        for (String part : parts) {
            if (!first) {
                joined.append(SEPARATOR);
            }
            joined.append(Objects.requireNonNull(part, "part"));
            first = false;
        }
        if (first) {
            throw new IllegalArgumentException("at least one part is required");
        }
        return HexFormat.of().formatHex(sha256(joined.toString())).substring(0, LENGTH);
    }

    public static boolean isContentId(String value) {
        return value != null && value.matches("[0-9a-f]{" + LENGTH + "}");
    }

    private static byte[] sha256(String text) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
