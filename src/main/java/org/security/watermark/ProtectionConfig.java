// File: ProtectionConfig.java
package org.security.watermark;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable settings shared by the sending and receiving sides of a protected call.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ProtectionConfig config = new ProtectionConfig.Builder()
 *     .key("shared-secret".getBytes(StandardCharsets.UTF_8))
 *     .zeta(123456789L)
 *     .eta(32)
 *     .onTamper(TamperPolicy.RAISE)
 *     .build();
 * }</pre>
 *
 * @see ProtectedCall
 */
public final class ProtectionConfig {

    private static final Logger log = LoggerFactory.getLogger(ProtectionConfig.class);

    /** Property names understood by {@link #fromProperties(Properties)}. */
    public static final String KEY_PROPERTY = "watermark.key";
    public static final String ZETA_PROPERTY = "watermark.zeta";
    public static final String ETA_PROPERTY = "watermark.eta";
    public static final String ON_TAMPER_PROPERTY = "watermark.onTamper";

    private final byte[] key;
    private final BigInteger zeta;
    private final int eta;
    private final TamperPolicy onTamper;

    private ProtectionConfig(Builder b) {
        this.key = b.key.clone();
        this.zeta = b.zeta;
        this.eta = b.eta;
        this.onTamper = b.onTamper;
    }

    /** Copy of the shared key. */
    public byte[] getKey() { return key.clone(); }

    public BigInteger getZeta() { return zeta; }

    public int getEta() { return eta; }

    public TamperPolicy getOnTamper() { return onTamper; }

    /**
     * Reads {@code watermark.key} (UTF-8 text), {@code watermark.zeta}, {@code watermark.eta} and
     * the optional {@code watermark.onTamper} (policy name, case-insensitive).
     *
     * @throws IllegalArgumentException if a required property is missing or malformed
     */
    public static ProtectionConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props must not be null");
        Builder b = new Builder()
                .key(required(props, KEY_PROPERTY).getBytes(StandardCharsets.UTF_8))
                .zeta(parseInteger(props, ZETA_PROPERTY))
                .eta(parseEta(props));
        String policy = props.getProperty(ON_TAMPER_PROPERTY);
        if (policy != null) {
            try {
                b.onTamper(TamperPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("unknown " + ON_TAMPER_PROPERTY + ": " + policy, ex);
            }
        }
        return b.build();
    }

    private static String required(Properties props, String name) {
        String v = props.getProperty(name);
        if (v == null || v.trim().isEmpty()) throw new IllegalArgumentException("missing property " + name);
        return v.trim();
    }

    private static BigInteger parseInteger(Properties props, String name) {
        String v = required(props, name);
        try {
            return new BigInteger(v);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " is not an integer: " + v, ex);
        }
    }

    private static int parseEta(Properties props) {
        try {
            return parseInteger(props, ETA_PROPERTY).intValueExact();
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException(ETA_PROPERTY + " is out of range: " + props.getProperty(ETA_PROPERTY), ex);
        }
    }

    @Override
    public String toString() {
        // key bytes are never printed
        return "ProtectionConfig(keyLength=" + key.length + ", zeta=" + zeta + ", eta=" + eta + ", onTamper=" + onTamper + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProtectionConfig)) return false;
        ProtectionConfig that = (ProtectionConfig) o;
        return zeta.equals(that.zeta) && eta == that.eta && onTamper == that.onTamper && Arrays.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(zeta, eta, onTamper) + Arrays.hashCode(key);
    }

    public static class Builder {

        private byte[] key;
        private BigInteger zeta;
        private int eta;
        private TamperPolicy onTamper = TamperPolicy.RAISE;

        /**
         * Sets the shared secret key. Required.
         *
         * @param key the key bytes, copied on {@link #build()}
         * @return this builder
         */
        public Builder key(byte[] key) {
            this.key = Objects.requireNonNull(key, "key must not be null");
            return this;
        }

        /**
         * Sets the secret code. Required.
         *
         * @param zeta a non-negative code below 2^eta
         * @return this builder
         */
        public Builder zeta(BigInteger zeta) {
            this.zeta = Objects.requireNonNull(zeta, "zeta must not be null");
            return this;
        }

        public Builder zeta(long zeta) {
            return zeta(BigInteger.valueOf(zeta));
        }

        /**
         * Sets the bit length of the code. Required.
         *
         * @param eta a positive bit count
         * @return this builder
         */
        public Builder eta(int eta) {
            this.eta = eta;
            return this;
        }

        /**
         * Sets the policy applied to parameters that fail verification.
         * Defaults to {@link TamperPolicy#RAISE}.
         *
         * @param policy the tamper policy
         * @return this builder
         */
        public Builder onTamper(TamperPolicy policy) {
            this.onTamper = Objects.requireNonNull(policy, "onTamper must not be null");
            return this;
        }

        public ProtectionConfig build() {
            if (key == null) throw new IllegalArgumentException("key must be set");
            if (zeta == null || zeta.signum() < 0) throw new IllegalArgumentException("zeta must be set and non-negative");
            if (eta <= 0) throw new IllegalArgumentException("eta must be > 0, got " + eta);
            if (zeta.bitLength() > eta) {
                throw new IllegalArgumentException(String.format("zeta=%s does not fit in eta=%d bits", zeta, eta));
            }
            if (!WatermarkGraph.roundTrips(DigitConverter.toDigits(zeta, WatermarkGraph.BASE))) {
                // every call will then fail verification and fall to the tamper policy
                log.warn("zeta={} has a base-6 digit larger than its digit count and can never verify", zeta);
            }
            return new ProtectionConfig(this);
        }
    }
}
