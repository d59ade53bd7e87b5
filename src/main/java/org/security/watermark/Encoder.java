// File: Encoder.java
package org.security.watermark;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;

/**
 * Watermark hint embedding (sending side) and watermark reconstruction (receiving side).
 *
 * <p>Parameters are read as pairs {@code (params[2p], params[2p+1])}. Each pair carries one hint
 * bit, its difference parity, placed there by {@link DifferenceExpansion}. A keyed index maps
 * every pair onto one of the eta bit positions of the secret code, so each position is carried
 * redundantly by several pairs. A trailing odd parameter is not part of any pair and is passed
 * through untouched.</p>
 */
public final class Encoder {

    private static final Logger log = LoggerFactory.getLogger(Encoder.class);

    static final String BIT_LABEL = "KBit|v1";

    private static final BigInteger TWO = BigInteger.valueOf(2);

    private Encoder() { }

    /* ---- Data structures ---- */

    /** Sending-side output: the watermarked carrier list and the traversal used. */
    public static final class PreparedInput {
        public final BigInteger[] watermarkedParams;
        public final int[] permutation;
        public final int eta;

        public PreparedInput(BigInteger[] watermarkedParams, int[] permutation, int eta) {
            this.watermarkedParams = watermarkedParams;
            this.permutation = permutation;
            this.eta = eta;
        }
    }

    /** Receiving-side output: the rebuilt graph and the traversal needed for restoration. */
    public static final class AuthenticationBuild {
        public final WatermarkGraph graph;
        public final int[] permutation;
        public final int eta;

        public AuthenticationBuild(WatermarkGraph graph, int[] permutation, int eta) {
            this.graph = graph;
            this.permutation = permutation;
            this.eta = eta;
        }
    }

    public static BigInteger[] valuesOf(long... values) {
        BigInteger[] out = new BigInteger[values.length];
        for (int i = 0; i < values.length; i++) out[i] = BigInteger.valueOf(values[i]);
        return out;
    }

    /* ---- Permutation and coverage ---- */

    /**
     * Keyed traversal order over the pairs of a parameter list of length {@code paramsLen}.
     *
     * @throws IllegalArgumentException on an invalid eta or fewer than two parameters
     * @throws CoverageException if some bit position would receive no vote
     */
    public static int[] computePermutation(int paramsLen, byte[] key, int eta) {
        Objects.requireNonNull(key, "key must not be null");
        if (eta <= 0) throw new IllegalArgumentException("eta must be > 0, got " + eta);
        if (paramsLen < 2) throw new IllegalArgumentException("Need at least 2 parameters (one pair).");
        int nPairs = paramsLen / 2;
        if (nPairs < eta) {
            throw new CoverageException(String.format(
                    "Not enough parameter pairs to support eta=%d: need at least %d pairs, got %d.", eta, eta, nPairs),
                    nPairs, eta);
        }
        int[] perm = KeyedPrimitives.keyedPermutation(KeyedPrimitives.seed(key), nPairs);
        BitSet covered = new BitSet(eta);
        for (int p : perm) covered.set(KeyedPrimitives.keyedIndex(p, eta, key));
        int count = covered.cardinality();
        if (count < eta) {
            throw new CoverageException(String.format(
                    "Insufficient keyed index coverage: only %d/%d bit positions receive votes.", count, eta),
                    count, eta);
        }
        log.debug("Permutation over {} pairs covers all {} bit positions", nPairs, eta);
        return perm;
    }

    /* ---- Hints detection ---- */

    /** Hint vector: {@code gamma[p] = (x - y) mod 2} for every pair p in the traversal. */
    public static int[] hintsDetection(BigInteger[] params, int[] perm) {
        int[] gamma = new int[params.length / 2];
        for (int p : perm) gamma[p] = params[2 * p].subtract(params[2 * p + 1]).mod(TWO).intValue();
        return gamma;
    }

    /* ---- Code builder ---- */

    /**
     * Rebuilds the eta-bit code from hint votes.
     *
     * <p>A position voted only 1 yields 1 and a position voted only 0 yields 0. Any mix of
     * votes, balanced or not, is settled by a keyed bit over the position and both tallies.</p>
     */
    public static int[] codeBuilder(int[] gamma, int eta, byte[] key, int[] perm) {
        int[] ones = new int[eta];
        int[] zeros = new int[eta];
        for (int p : perm) {
            int j = KeyedPrimitives.keyedIndex(p, eta, key);
            if (gamma[p] == 1) ones[j]++; else zeros[j]++;
        }

        int[] zeta2 = new int[eta];
        int mixed = 0;
        for (int j = 0; j < eta; j++) {
            int o = ones[j];
            int z = zeros[j];
            if (o > 0 && z == 0) {
                zeta2[j] = 1;
            } else if (z > 0 && o == 0) {
                zeta2[j] = 0;
            } else {
                zeta2[j] = KeyedPrimitives.keyedBit(key, BIT_LABEL + "|chaos|j=" + j + "|o=" + o + "|z=" + z);
                mixed++;
            }
        }
        if (mixed > 0) log.debug("{} of {} bit positions had disagreeing votes", mixed, eta);
        return zeta2;
    }

    /* ---- Sending side ---- */

    /**
     * Embeds the secret code into a copy of {@code params}.
     *
     * @throws IllegalArgumentException if zeta is negative or does not fit in eta bits
     * @throws CoverageException if the list has too few pairs for eta
     */
    public static PreparedInput prepare(BigInteger[] params, byte[] key, BigInteger zeta, int eta) {
        Objects.requireNonNull(params, "params must not be null");
        Objects.requireNonNull(zeta, "zeta must not be null");
        if (zeta.signum() < 0) throw new IllegalArgumentException("zeta must be non-negative");
        int[] perm = computePermutation(params.length, key, eta);
        int[] zeta2 = DigitConverter.bitsFromInt(zeta, eta);
        if (!WatermarkGraph.roundTrips(DigitConverter.toDigits(zeta, WatermarkGraph.BASE))) {
            log.warn("Code {} cannot be read back from its watermark graph; verification will fail", zeta);
        }

        // scatter, not vote: every pair mapped to position j carries zeta2[j]
        int[] gamma = new int[params.length / 2];
        for (int p : perm) gamma[p] = zeta2[KeyedPrimitives.keyedIndex(p, eta, key)];

        BigInteger[] out = Arrays.copyOf(params, params.length);
        for (int p : perm) {
            DifferenceExpansion.EmbeddedPair e = DifferenceExpansion.embed(out[2 * p], out[2 * p + 1], gamma[p]);
            out[2 * p] = e.x;
            out[2 * p + 1] = e.y;
        }
        log.debug("Embedded {}-bit code into {} pairs", eta, perm.length);
        return new PreparedInput(out, perm, eta);
    }

    public static PreparedInput prepare(BigInteger[] params, byte[] key, long zeta, int eta) {
        return prepare(params, key, BigInteger.valueOf(zeta), eta);
    }

    /* ---- Receiving side ---- */

    /** Rebuilds the watermark graph from received parameters. Nothing is embedded here. */
    public static AuthenticationBuild build(BigInteger[] received, byte[] key, int eta) {
        Objects.requireNonNull(received, "received params must not be null");
        int[] perm = computePermutation(received.length, key, eta);
        int[] gamma = hintsDetection(received, perm);
        int[] zeta2 = codeBuilder(gamma, eta, key, perm);
        int[] zeta6 = DigitConverter.convertBase(zeta2, 2, WatermarkGraph.BASE);
        return new AuthenticationBuild(WatermarkGraph.encode(zeta6), perm, eta);
    }

    /** Reverses the embedding of every pair in {@code perm}; the input array is left as is. */
    public static BigInteger[] restore(BigInteger[] watermarked, int[] perm) {
        BigInteger[] out = Arrays.copyOf(watermarked, watermarked.length);
        for (int p : perm) {
            DifferenceExpansion.Extraction ex = DifferenceExpansion.extract(out[2 * p], out[2 * p + 1]);
            out[2 * p] = ex.x;
            out[2 * p + 1] = ex.y;
        }
        return out;
    }
}
