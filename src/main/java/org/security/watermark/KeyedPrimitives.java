// File: KeyedPrimitives.java
package org.security.watermark;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.Pack;

import java.nio.charset.StandardCharsets;

/**
 * Keyed pseudorandom routines driven by HMAC-SHA256.
 *
 * <p>Every random value is a pure function of {@code (key, label)}: the first 8 bytes of
 * HMAC-SHA256(key, UTF-8(label)) read as an unsigned big-endian 64-bit integer. Counters are
 * part of the label and are threaded explicitly, so the embedding side and the verifying side
 * derive the same values from the same key. The label formats are fixed; changing any of them
 * breaks compatibility with already watermarked parameter lists.</p>
 */
public final class KeyedPrimitives {

    public static final String SEED_LABEL = "PRNG|v1";
    public static final String PERMUTATION_CONTEXT = "KPerm|v1";
    public static final String INDEX_LABEL = "KInd|v1";

    /** Separator between index label fields (U+2014 EM DASH). */
    private static final String INDEX_SEPARATOR = "\u2014";

    private KeyedPrimitives() { }

    /* ---- HMAC core ---- */

    /** Full 32-byte HMAC-SHA256 of the UTF-8 encoded label. */
    public static byte[] hmac(byte[] key, String label) {
        HMac mac = new HMac(new SHA256Digest());
        mac.init(new KeyParameter(key));
        byte[] msg = label.getBytes(StandardCharsets.UTF_8);
        mac.update(msg, 0, msg.length);
        byte[] out = new byte[mac.getMacSize()];
        mac.doFinal(out, 0);
        return out;
    }

    /** Unsigned 64-bit draw; compare and reduce with the {@code Long.*Unsigned} helpers. */
    public static long draw(byte[] key, String label) {
        return Pack.bigEndianToLong(hmac(key, label), 0);
    }

    // true iff r < 2^64 - (2^64 mod m), i.e. r falls in the largest multiple of m below 2^64
    static boolean belowLimit(long r, long m) {
        long excess = (Long.remainderUnsigned(-1L, m) + 1) % m;
        return excess == 0 || Long.compareUnsigned(r, -excess) < 0;
    }

    /* ---- Seed ---- */

    /** Seed material for {@link #keyedPermutation(byte[], int)}. */
    public static byte[] seed(byte[] key) {
        return hmac(key, SEED_LABEL);
    }

    /* ---- Permutation ---- */

    public static int[] keyedPermutation(byte[] seed, int n) {
        return keyedPermutation(seed, n, PERMUTATION_CONTEXT);
    }

    /**
     * Deterministic shuffle of {@code [0..n)}.
     *
     * <p>Step i swaps P[i] with P[j], j drawn uniformly from [0, i] by rejection sampling.
     * The counter is shared by all steps and increments on every draw, accepted or not.</p>
     */
    public static int[] keyedPermutation(byte[] seed, int n, String ctx) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0");
        int[] perm = new int[n];
        for (int i = 0; i < n; i++) perm[i] = i;
        long c = 0;
        for (int i = 0; i < n - 1; i++) {
            long m = i + 1;
            while (true) {
                long r = draw(seed, "perm|" + ctx + "|i=" + i + "|c=" + c);
                c++;
                if (belowLimit(r, m)) {
                    int j = (int) Long.remainderUnsigned(r, m);
                    int tmp = perm[i]; perm[i] = perm[j]; perm[j] = tmp;
                    break;
                }
            }
        }
        return perm;
    }

    /* ---- Index ---- */

    /** Maps pair index {@code p} uniformly onto a bit position in {@code [0, eta)}. */
    public static int keyedIndex(int p, int eta, byte[] key) {
        if (eta <= 0) throw new IllegalArgumentException("eta must be > 0");
        long c = 0;
        while (true) {
            long r = draw(key, INDEX_LABEL + INDEX_SEPARATOR + p + INDEX_SEPARATOR + c);
            c++;
            if (belowLimit(r, eta)) return (int) Long.remainderUnsigned(r, eta);
        }
    }

    /* ---- Bit ---- */

    public static int keyedBit(byte[] key, String label) {
        return (int) (draw(key, label) & 1L);
    }
}
