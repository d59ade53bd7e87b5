package org.security.watermark;

import org.junit.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.junit.Assert.*;

public class ProtectionConfigTest {

    private static final byte[] KEY = "k".getBytes(StandardCharsets.UTF_8);

    @Test
    public void testBuilderDefaults() {
        ProtectionConfig cfg = new ProtectionConfig.Builder().key(KEY).zeta(424242L).eta(20).build();
        assertEquals(TamperPolicy.RAISE, cfg.getOnTamper());
        assertEquals(BigInteger.valueOf(424242), cfg.getZeta());
        assertEquals(20, cfg.getEta());
        assertArrayEquals(KEY, cfg.getKey());
    }

    @Test
    public void testKeyIsCopied() {
        byte[] key = "secret".getBytes(StandardCharsets.UTF_8);
        ProtectionConfig cfg = new ProtectionConfig.Builder().key(key).zeta(0L).eta(1).build();
        key[0] = 'X';
        cfg.getKey()[1] = 'Y';
        assertArrayEquals("secret".getBytes(StandardCharsets.UTF_8), cfg.getKey());
        assertFalse(cfg.toString().contains("secret"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingKey() {
        new ProtectionConfig.Builder().zeta(1L).eta(1).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingZeta() {
        new ProtectionConfig.Builder().key(KEY).eta(8).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveEta() {
        new ProtectionConfig.Builder().key(KEY).zeta(0L).eta(0).build();
    }

    @Test
    public void testWideCode() {
        BigInteger zeta = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
        ProtectionConfig cfg = new ProtectionConfig.Builder().key(KEY).zeta(zeta).eta(64).build();
        assertEquals(zeta, cfg.getZeta());
        assertEquals(64, cfg.getEta());
    }

    @Test
    public void testEmptyKeyIsAccepted() {
        ProtectionConfig cfg = new ProtectionConfig.Builder().key(new byte[0]).zeta(9999L).eta(16).build();
        assertEquals(0, cfg.getKey().length);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZetaTooLargeForEta() {
        new ProtectionConfig.Builder().key(KEY).zeta(16L).eta(4).build();
    }

    @Test
    public void testCodesThatCannotVerifyStillBuild() {
        long[] unverifiable = {5L, 35L, 215L, 1295L};
        for (long zeta : unverifiable) {
            assertFalse(WatermarkGraph.roundTrips(DigitConverter.toDigits(zeta, 6)));
            ProtectionConfig cfg = new ProtectionConfig.Builder().key(KEY).zeta(zeta).eta(20).build();
            assertEquals(BigInteger.valueOf(zeta), cfg.getZeta());
        }
    }

    @Test
    public void testFromPropertiesReadsWideCode() {
        Properties props = new Properties();
        props.setProperty(ProtectionConfig.KEY_PROPERTY, "demo-key");
        props.setProperty(ProtectionConfig.ZETA_PROPERTY, "18446744073709551615");
        props.setProperty(ProtectionConfig.ETA_PROPERTY, "64");
        ProtectionConfig cfg = ProtectionConfig.fromProperties(props);
        assertEquals(new BigInteger("18446744073709551615"), cfg.getZeta());
        assertEquals(64, cfg.getEta());
    }

    @Test
    public void testFromProperties() {
        Properties props = new Properties();
        props.setProperty(ProtectionConfig.KEY_PROPERTY, "demo-key");
        props.setProperty(ProtectionConfig.ZETA_PROPERTY, " 123456789 ");
        props.setProperty(ProtectionConfig.ETA_PROPERTY, "32");
        props.setProperty(ProtectionConfig.ON_TAMPER_PROPERTY, "call_anyway");
        ProtectionConfig cfg = ProtectionConfig.fromProperties(props);
        assertArrayEquals("demo-key".getBytes(StandardCharsets.UTF_8), cfg.getKey());
        assertEquals(BigInteger.valueOf(123456789), cfg.getZeta());
        assertEquals(32, cfg.getEta());
        assertEquals(TamperPolicy.CALL_ANYWAY, cfg.getOnTamper());
    }

    @Test
    public void testFromPropertiesRejectsUnknownPolicy() {
        Properties props = new Properties();
        props.setProperty(ProtectionConfig.KEY_PROPERTY, "demo-key");
        props.setProperty(ProtectionConfig.ZETA_PROPERTY, "36");
        props.setProperty(ProtectionConfig.ETA_PROPERTY, "8");
        props.setProperty(ProtectionConfig.ON_TAMPER_PROPERTY, "ignore");
        try {
            ProtectionConfig.fromProperties(props);
            fail("unknown policy must be rejected");
        } catch (IllegalArgumentException ex) {
            assertEquals("unknown watermark.onTamper: ignore", ex.getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromPropertiesRequiresEta() {
        Properties props = new Properties();
        props.setProperty(ProtectionConfig.KEY_PROPERTY, "demo-key");
        props.setProperty(ProtectionConfig.ZETA_PROPERTY, "36");
        ProtectionConfig.fromProperties(props);
    }
}
