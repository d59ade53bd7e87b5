// File: DifferenceExpansion.java
package org.security.watermark;

import java.math.BigInteger;

/**
 * Reversible difference expansion: hides one bit in an integer pair (x, y) and recovers both
 * the bit and the original pair exactly.
 *
 * <pre>
 * embed:   d = x - y, a = floor((x + y) / 2), d' = 2d + bit
 *          x' = a + ceil(d' / 2), y' = a - floor(d' / 2)
 * extract: d' = x' - y', bit = d' mod 2, d = floor(d' / 2), a = floor((x' + y') / 2)
 *          x = a + ceil(d / 2), y = a - floor(d / 2)
 * </pre>
 *
 * The expanded difference can double in magnitude, hence {@link BigInteger}.
 */
public final class DifferenceExpansion {

    private static final BigInteger TWO = BigInteger.valueOf(2);

    private DifferenceExpansion() { }

    /* ---- Data structures ---- */
    public static final class EmbeddedPair {
        public final BigInteger x;
        public final BigInteger y;

        public EmbeddedPair(BigInteger x, BigInteger y) { this.x = x; this.y = y; }

        @Override public String toString() { return "EmbeddedPair(" + x + ", " + y + ")"; }
    }

    public static final class Extraction {
        public final int bit;
        public final BigInteger x;
        public final BigInteger y;

        public Extraction(int bit, BigInteger x, BigInteger y) { this.bit = bit; this.x = x; this.y = y; }

        @Override public String toString() { return "Extraction(bit=" + bit + ", " + x + ", " + y + ")"; }
    }

    /* ---- Exact halving ---- */
    // shiftRight on BigInteger is an arithmetic shift, i.e. floor division by 2
    static BigInteger floorHalf(BigInteger n) { return n.shiftRight(1); }
    static BigInteger ceilHalf(BigInteger n) { return n.negate().shiftRight(1).negate(); }

    /* ---- Embed / extract ---- */
    public static EmbeddedPair embed(BigInteger x, BigInteger y, int bit) {
        if (bit != 0 && bit != 1) throw new IllegalArgumentException("bit must be 0 or 1");
        BigInteger d = x.subtract(y);
        BigInteger a = floorHalf(x.add(y));
        BigInteger dPrime = d.shiftLeft(1).add(BigInteger.valueOf(bit));
        return new EmbeddedPair(a.add(ceilHalf(dPrime)), a.subtract(floorHalf(dPrime)));
    }

    public static Extraction extract(BigInteger xPrime, BigInteger yPrime) {
        BigInteger dPrime = xPrime.subtract(yPrime);
        int bit = dPrime.mod(TWO).intValue();
        BigInteger d = floorHalf(dPrime);
        BigInteger a = floorHalf(xPrime.add(yPrime));
        return new Extraction(bit, a.add(ceilHalf(d)), a.subtract(floorHalf(d)));
    }
}
