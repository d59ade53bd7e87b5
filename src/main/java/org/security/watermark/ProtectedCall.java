// File: ProtectedCall.java
package org.security.watermark;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Guards a function over a parameter list: the list must carry the configured secret code
 * before the function sees it.
 *
 * <p>{@link #call(List)} rebuilds the watermark graph from the received list and lets the
 * {@link Controller} verify it. Authentic lists are restored to their original values and
 * passed to the body. Other lists are handled by the configured {@link TamperPolicy}.
 * Configuration and coverage errors from the rebuild propagate whatever the policy.</p>
 *
 * <pre>{@code
 * ProtectedCall<BigInteger> sum = ProtectedCall.protect(config,
 *         params -> params.stream().reduce(BigInteger.ZERO, BigInteger::add));
 * List<BigInteger> watermarked = ProtectedCall.prepare(original, config);
 * BigInteger total = sum.call(watermarked);
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 *
 * @param <R> result type of the protected body
 */
public final class ProtectedCall<R> {

    private static final Logger log = LoggerFactory.getLogger(ProtectedCall.class);

    private final ProtectionConfig config;
    private final Function<List<BigInteger>, R> body;
    private final R sentinel;

    private ProtectedCall(ProtectionConfig config, Function<List<BigInteger>, R> body, R sentinel) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.body = Objects.requireNonNull(body, "body must not be null");
        this.sentinel = sentinel;
    }

    /** Protects {@code body}; {@link TamperPolicy#RETURN_SENTINEL} returns {@code null}. */
    public static <R> ProtectedCall<R> protect(ProtectionConfig config, Function<List<BigInteger>, R> body) {
        return new ProtectedCall<>(config, body, null);
    }

    public static <R> ProtectedCall<R> protect(ProtectionConfig config, Function<List<BigInteger>, R> body, R sentinel) {
        return new ProtectedCall<>(config, body, sentinel);
    }

    /** Sending side: the watermarked copy of {@code params}. */
    public static List<BigInteger> prepare(List<BigInteger> params, ProtectionConfig config) {
        Objects.requireNonNull(params, "params must not be null");
        BigInteger[] in = params.toArray(new BigInteger[0]);
        Encoder.PreparedInput prepared = Encoder.prepare(in, config.getKey(), config.getZeta(), config.getEta());
        return Arrays.asList(prepared.watermarkedParams);
    }

    public ProtectionConfig getConfig() { return config; }

    /**
     * Verifies {@code received} and runs the body.
     *
     * @throws TamperedParametersException if verification fails under {@link TamperPolicy#RAISE}
     * @throws CoverageException if the list has too few pairs for the configured eta
     */
    public R call(List<BigInteger> received) {
        Objects.requireNonNull(received, "received params must not be null");
        BigInteger[] in = received.toArray(new BigInteger[0]);
        byte[] key = config.getKey();

        Encoder.AuthenticationBuild build = Encoder.build(in, key, config.getEta());
        Controller.VerificationResult vr = Controller.verify(build.graph, config.getZeta());

        if (vr.authentic) {
            BigInteger[] restored = Encoder.restore(in, build.permutation);
            return body.apply(Collections.unmodifiableList(Arrays.asList(restored)));
        }

        log.warn("Parameter authentication failed ({}), applying {}", reason(vr), config.getOnTamper());
        switch (config.getOnTamper()) {
            case CALL_ANYWAY:
                return body.apply(Collections.unmodifiableList(Arrays.asList(in)));
            case RETURN_SENTINEL:
                return sentinel;
            case RAISE:
            default:
                throw new TamperedParametersException("Parameter authentication failed: " + reason(vr), vr);
        }
    }

    private static String reason(Controller.VerificationResult vr) {
        return vr.error != null ? vr.error : "code mismatch";
    }
}
