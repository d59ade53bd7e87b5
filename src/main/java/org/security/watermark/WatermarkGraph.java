// File: WatermarkGraph.java
package org.security.watermark;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * Base-6 watermark graph (Collberg–Thomborson style) stored as an arena of nodes.
 *
 * <p>Nodes are addressed by index. Every node has a {@code next} relation and an optional
 * {@code digit} relation, both held as indices into the arena ({@code -1} when absent).
 * An encoded graph of mu nodes is a single ring {@code r -> r+1 mod mu}; node r points its
 * digit relation at node {@code (r + d - 1) mod mu} for digit d in [1,5], and has no digit
 * relation for d = 0. The digits live only in the pointer structure.</p>
 *
 * <p>Instances are mutable through {@link #link}, {@link #unlink}, {@link #pointDigit} and
 * {@link #clearDigit}, so a caller can model a corrupted heap structure and check that
 * decoding rejects it.</p>
 */
public final class WatermarkGraph {

    public static final int BASE = 6;

    private static final int NONE = -1;

    private final int[] next;
    private final int[] digit;
    private final int head;

    private WatermarkGraph(int size, int head) {
        this.next = new int[size];
        this.digit = new int[size];
        this.head = head;
        Arrays.fill(next, NONE);
        Arrays.fill(digit, NONE);
    }

    /** Arena of {@code size} unlinked nodes with head 0. */
    public static WatermarkGraph empty(int size) {
        if (size <= 0) throw new IllegalArgumentException("size must be > 0");
        return new WatermarkGraph(size, 0);
    }

    /* ---- Encoding ---- */

    /**
     * Builds the ring for a base-6 digit array. The head of the returned graph is node 0.
     *
     * @throws IllegalArgumentException if zeta6 is empty or holds a digit outside [0,5]
     */
    public static WatermarkGraph encode(int[] zeta6) {
        if (zeta6 == null || zeta6.length == 0) throw new IllegalArgumentException("zeta6 must be non-empty");
        int mu = zeta6.length;
        WatermarkGraph g = new WatermarkGraph(mu, 0);
        for (int r = 0; r < mu; r++) g.next[r] = (r + 1) % mu;
        for (int r = 0; r < mu; r++) {
            int d = zeta6[r];
            if (d < 0 || d >= BASE) throw new IllegalArgumentException("digit " + d + " out of range for base 6");
            if (d != 0) g.digit[r] = (r + d - 1) % mu;
        }
        return g;
    }

    /**
     * True iff {@code decode(encode(zeta6), mu)} gives back {@code zeta6}. A digit d only
     * survives when {@code d <= mu}; larger digits wrap past their own node and read back
     * as a smaller value.
     */
    public static boolean roundTrips(int[] zeta6) {
        for (int d : zeta6) {
            if (d > zeta6.length) return false;
        }
        return true;
    }

    /* ---- Decoding ---- */

    public int[] decode(int mu) { return decode(head, mu); }

    /**
     * Recovers the base-6 digits by walking the structure from {@code start}.
     *
     * <p>Collects mu nodes along {@code next}; then, per node, counts the {@code next} steps s
     * to its digit target and reports digit s+1 (0 when the node has no digit relation).</p>
     *
     * @throws MalformedGraphException on a missing {@code next} relation ("broken ring") or a
     *         digit target not reached within mu steps ("unreachable digit")
     */
    public int[] decode(int start, int mu) {
        if (mu <= 0) throw new IllegalArgumentException("mu must be > 0");
        checkIndex(start);

        int[] ring = new int[mu];
        ring[0] = start;
        int cur = start;
        for (int k = 1; k < mu; k++) {
            if (next[cur] == NONE) throw new MalformedGraphException("invalid structure (broken ring)");
            cur = next[cur];
            ring[k] = cur;
        }

        int[] zeta6 = new int[mu];
        for (int r = 0; r < mu; r++) {
            int node = ring[r];
            int target = digit[node];
            if (target == NONE) continue;

            int s = 0;
            int probe = node;
            while (probe != target) {
                probe = next[probe];
                s++;
                if (probe == NONE) throw new MalformedGraphException("invalid structure (broken ring)");
                if (s > mu) throw new MalformedGraphException("invalid structure (unreachable digit)");
            }
            zeta6[r] = s + 1;
        }
        return zeta6;
    }

    /* ---- Arena access ---- */

    public int head() { return head; }

    public int size() { return next.length; }

    public OptionalInt next(int node) {
        checkIndex(node);
        return next[node] == NONE ? OptionalInt.empty() : OptionalInt.of(next[node]);
    }

    public OptionalInt digit(int node) {
        checkIndex(node);
        return digit[node] == NONE ? OptionalInt.empty() : OptionalInt.of(digit[node]);
    }

    public void link(int from, int to) {
        checkIndex(from);
        checkIndex(to);
        next[from] = to;
    }

    public void unlink(int from) {
        checkIndex(from);
        next[from] = NONE;
    }

    public void pointDigit(int from, int to) {
        checkIndex(from);
        checkIndex(to);
        digit[from] = to;
    }

    public void clearDigit(int from) {
        checkIndex(from);
        digit[from] = NONE;
    }

    private void checkIndex(int node) {
        if (node < 0 || node >= next.length) {
            throw new IndexOutOfBoundsException("node " + node + " outside arena of size " + next.length);
        }
    }

    @Override
    public String toString() {
        return "WatermarkGraph(size=" + next.length + ", head=" + head
                + ", next=" + Arrays.toString(next) + ", digit=" + Arrays.toString(digit) + ")";
    }
}
