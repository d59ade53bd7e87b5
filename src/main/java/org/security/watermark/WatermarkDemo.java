// File: WatermarkDemo.java
package org.security.watermark;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Demo: a client watermarks 512 integers, a protected function accepts them, then rejects the
 * same list with one parameter flipped.
 *
 * <p>Reads its settings from {@code watermark-demo.properties} on the classpath.</p>
 */
public class WatermarkDemo {

    private static final Logger log = LoggerFactory.getLogger(WatermarkDemo.class);

    static final String CONFIG_RESOURCE = "watermark-demo.properties";
    static final int PARAM_COUNT = 512;
    static final int TAMPERED_INDEX = 33;

    static ProtectionConfig loadConfig() throws IOException {
        Properties props = new Properties();
        try (InputStream in = WatermarkDemo.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (in == null) throw new IOException("classpath resource not found: " + CONFIG_RESOURCE);
            props.load(in);
        }
        return ProtectionConfig.fromProperties(props);
    }

    /** Toy workload: sum of the values at even indices. */
    static BigInteger sumEvenIndexed(List<BigInteger> params) {
        BigInteger sum = BigInteger.ZERO;
        for (int i = 0; i < params.size(); i += 2) sum = sum.add(params.get(i));
        return sum;
    }

    public static void main(String[] args) throws IOException {
        ProtectionConfig config = loadConfig();
        log.info("Loaded {}", config);

        List<BigInteger> original = new ArrayList<>(PARAM_COUNT);
        for (int i = 1; i <= PARAM_COUNT; i++) original.add(BigInteger.valueOf(i));
        List<BigInteger> watermarked = ProtectedCall.prepare(original, config);

        ProtectedCall<BigInteger> protectedSum = ProtectedCall.protect(config, WatermarkDemo::sumEvenIndexed);

        log.info("Original params length: {}", original.size());
        log.info("Calling protected function with authentic watermarked params...");
        log.info("Result: {}", protectedSum.call(watermarked));

        List<BigInteger> tampered = new ArrayList<>(watermarked);
        tampered.set(TAMPERED_INDEX, tampered.get(TAMPERED_INDEX).xor(BigInteger.ONE));
        log.info("Calling protected function with tampered params (index {} flipped)...", TAMPERED_INDEX);
        try {
            log.info("Result: {}", protectedSum.call(tampered));
        } catch (TamperedParametersException ex) {
            log.info("Tamper detected: {}", ex.getMessage());
        }
    }
}
