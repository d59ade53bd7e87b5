// File: DigitConverter.java
package org.security.watermark;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Conversions between non-negative integers and big-endian digit arrays.
 *
 * <p>The secret code travels in two digit forms: a fixed-length bit array (length eta) that is
 * scattered over parameter pairs, and a base-6 array (length mu) that is carried by the
 * watermark graph.</p>
 */
public final class DigitConverter {

    private DigitConverter() { }

    /** Big-endian digits of {@code n} in {@code base}; {@code 0} gives {@code [0]}. */
    public static int[] toDigits(BigInteger n, int base) {
        if (base < 2) throw new IllegalArgumentException("base must be >= 2");
        Objects.requireNonNull(n, "n must not be null");
        if (n.signum() < 0) throw new IllegalArgumentException("n must be non-negative");
        if (n.signum() == 0) return new int[]{0};
        BigInteger b = BigInteger.valueOf(base);
        int[] buf = new int[n.bitLength()];
        int len = 0;
        while (n.signum() > 0) {
            BigInteger[] qr = n.divideAndRemainder(b);
            buf[len++] = qr[1].intValue();
            n = qr[0];
        }
        int[] out = new int[len];
        for (int i = 0; i < len; i++) out[i] = buf[len - 1 - i];
        return out;
    }

    public static int[] toDigits(long n, int base) { return toDigits(BigInteger.valueOf(n), base); }

    /** Inverse of {@link #toDigits(BigInteger, int)}. */
    public static BigInteger fromDigits(int[] digits, int base) {
        if (base < 2) throw new IllegalArgumentException("base must be >= 2");
        if (digits == null || digits.length == 0) throw new IllegalArgumentException("digits must be non-empty");
        BigInteger b = BigInteger.valueOf(base);
        BigInteger n = BigInteger.ZERO;
        for (int d : digits) {
            if (d < 0 || d >= base) {
                throw new IllegalArgumentException(String.format("digit %d out of range for base %d", d, base));
            }
            n = n.multiply(b).add(BigInteger.valueOf(d));
        }
        return n;
    }

    /**
     * Fixed-length big-endian bit array of {@code n}, zero-padded on the left.
     *
     * @throws IllegalArgumentException if eta is not positive, n is negative or n needs more than eta bits
     */
    public static int[] bitsFromInt(BigInteger n, int eta) {
        if (eta <= 0) throw new IllegalArgumentException("eta must be > 0");
        Objects.requireNonNull(n, "n must not be null");
        if (n.signum() < 0) throw new IllegalArgumentException("n must be non-negative");
        if (n.bitLength() > eta) {
            throw new IllegalArgumentException(String.format("eta=%d too small to represent %s (%d bits)", eta, n, n.bitLength()));
        }
        int[] out = new int[eta];
        for (int i = 0; i < eta; i++) out[eta - 1 - i] = n.testBit(i) ? 1 : 0;
        return out;
    }

    public static BigInteger intFromBits(int[] bits) { return fromDigits(bits, 2); }

    /** Re-expresses a digit array in another base through an integer intermediate. */
    public static int[] convertBase(int[] digits, int baseFrom, int baseTo) {
        return toDigits(fromDigits(digits, baseFrom), baseTo);
    }
}
