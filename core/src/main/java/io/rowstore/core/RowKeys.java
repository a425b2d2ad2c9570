// file: core/src/main/java/io/rowstore/core/RowKeys.java
package io.rowstore.core;

import com.google.protobuf.ByteString;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;

/**
 * Helpers for binary row keys.
 * Row keys sort as unsigned byte sequences, shorter-prefix first.
 */
public final class RowKeys {

    private static final Comparator<ByteString> ORDER = ByteString.unsignedLexicographicalComparator();

    private RowKeys() {
        // utility
    }

    public static Comparator<ByteString> order() {
        return ORDER;
    }

    public static int compare(ByteString a, ByteString b) {
        return ORDER.compare(a, b);
    }

    public static ByteString of(String key) {
        return ByteString.copyFrom(key, StandardCharsets.UTF_8);
    }

    /** Smallest key strictly greater than {@code key}: the key followed by a 0x00 byte. */
    public static ByteString successor(ByteString key) {
        return key.concat(ByteString.copyFrom(new byte[]{0}));
    }

    /**
     * Smallest key greater than every key with the given prefix, or {@code null}
     * when no such key exists (empty prefix, or a prefix made only of 0xFF bytes).
     */
    public static ByteString prefixEnd(ByteString prefix) {
        byte[] b = prefix.toByteArray();
        int i = b.length - 1;
        while (i >= 0 && b[i] == (byte) 0xFF) {
            i--;
        }
        if (i < 0) {
            return null;
        }
        byte[] end = new byte[i + 1];
        System.arraycopy(b, 0, end, 0, i + 1);
        end[i]++;
        return ByteString.copyFrom(end);
    }

    /** Printable form for logs and error messages. */
    public static String debugString(ByteString key) {
        if (key.isValidUtf8()) {
            return key.toStringUtf8();
        }
        StringBuilder sb = new StringBuilder("0x");
        for (int i = 0; i < key.size(); i++) {
            sb.append(String.format("%02x", key.byteAt(i) & 0xFF));
        }
        return sb.toString();
    }
}
