// File: Controller.java
package org.security.watermark;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * Authority that decides whether a rebuilt watermark graph carries the expected secret code.
 *
 * <p>Structural failures of the graph are reported as a non-authentic result, never thrown.</p>
 */
public final class Controller {

    private static final Logger log = LoggerFactory.getLogger(Controller.class);

    private Controller() { }

    /** Outcome of {@link #verify(WatermarkGraph, BigInteger)}. */
    public static final class VerificationResult {
        public final boolean authentic;
        /** Decoded code, or {@code null} when decoding failed. */
        public final BigInteger recoveredCode;
        /** Decoded base-6 digits, or {@code null} when decoding failed. */
        public final int[] recoveredZeta6;
        /** Decode failure text, or {@code null}. */
        public final String error;

        public VerificationResult(boolean authentic, BigInteger recoveredCode, int[] recoveredZeta6, String error) {
            this.authentic = authentic;
            this.recoveredCode = recoveredCode;
            this.recoveredZeta6 = recoveredZeta6;
            this.error = error;
        }

        public boolean isAuthentic() { return authentic; }

        @Override
        public String toString() {
            return "VerificationResult(authentic=" + authentic + ", recoveredCode=" + recoveredCode
                    + ", recoveredZeta6=" + Arrays.toString(recoveredZeta6) + ", error=" + error + ")";
        }
    }

    /**
     * Decodes {@code graph} from its head with mu = number of base-6 digits of
     * {@code expectedCode} and compares the result.
     *
     * @throws IllegalArgumentException if expectedCode is negative
     */
    public static VerificationResult verify(WatermarkGraph graph, BigInteger expectedCode) {
        Objects.requireNonNull(expectedCode, "expected code must not be null");
        if (expectedCode.signum() < 0) throw new IllegalArgumentException("expected code must be non-negative");
        int mu = DigitConverter.toDigits(expectedCode, WatermarkGraph.BASE).length;

        int[] zeta6;
        BigInteger recovered;
        try {
            zeta6 = graph.decode(mu);
            recovered = DigitConverter.fromDigits(zeta6, WatermarkGraph.BASE);
        } catch (MalformedGraphException | IllegalArgumentException ex) {
            log.warn("Watermark graph rejected: {}", ex.getMessage());
            return new VerificationResult(false, null, null, ex.getMessage());
        }

        boolean authentic = recovered.equals(expectedCode);
        log.debug("Decoded code {} over mu={} nodes, authentic={}", recovered, mu, authentic);
        return new VerificationResult(authentic, recovered, zeta6, null);
    }

    public static VerificationResult verify(WatermarkGraph graph, long expectedCode) {
        return verify(graph, BigInteger.valueOf(expectedCode));
    }
}
