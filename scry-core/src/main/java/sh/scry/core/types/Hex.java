// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.types;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Utility methods for hex encoding/decoding with optional {@code 0x} prefixes.
 *
 * <p>On-chain metadata values and feedback tags travel through the subgraph as
 * {@code Bytes}; these helpers convert between those and readable text.
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Convert an optionally {@code 0x}-prefixed hex string into a byte array.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  characters, or contains invalid hex
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }

        final int start = hasPrefix(hexString) ? 2 : 0;
        final int hexLength = hexString.length() - start;

        if ((hexLength & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }

        final byte[] out = new byte[hexLength / 2];
        for (int i = 0; i < out.length; i++) {
            final int hi = nibble(hexString.charAt(start + 2 * i));
            final int lo = nibble(hexString.charAt(start + 2 * i + 1));
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("invalid hex character in: " + hexString);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    /**
     * Encode bytes as a {@code 0x}-prefixed lowercase hex string.
     */
    public static String encode(final byte[] bytes) {
        final char[] out = new char[2 + bytes.length * 2];
        out[0] = '0';
        out[1] = 'x';
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            out[2 + 2 * i] = HEX_CHARS[v >>> 4];
            out[3 + 2 * i] = HEX_CHARS[v & 0x0F];
        }
        return new String(out);
    }

    /**
     * Hex-encodes the UTF-8 bytes of {@code text}, e.g. {@code "v1"} becomes {@code 0x7631}.
     */
    public static String encodeUtf8(final String text) {
        return encode(text.getBytes(StandardCharsets.UTF_8));
    }

    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static int nibble(final char c) {
        return c < 128 ? NIBBLE_LOOKUP[c] : -1;
    }
}
