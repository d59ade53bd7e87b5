package org.security.watermark;

import org.junit.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class WatermarkDemoTest {

    @Test
    public void testDemoConfigLoads() throws Exception {
        ProtectionConfig cfg = WatermarkDemo.loadConfig();
        assertEquals(BigInteger.valueOf(123456789), cfg.getZeta());
        assertEquals(32, cfg.getEta());
        assertEquals(TamperPolicy.RAISE, cfg.getOnTamper());
    }

    @Test
    public void testDemoFlow() throws Exception {
        ProtectionConfig cfg = WatermarkDemo.loadConfig();
        List<BigInteger> original = new ArrayList<>();
        for (int i = 1; i <= WatermarkDemo.PARAM_COUNT; i++) original.add(BigInteger.valueOf(i));

        ProtectedCall<BigInteger> f = ProtectedCall.protect(cfg, WatermarkDemo::sumEvenIndexed);
        List<BigInteger> watermarked = ProtectedCall.prepare(original, cfg);
        // 1 + 3 + ... + 511
        assertEquals(BigInteger.valueOf(65536), f.call(watermarked));

        List<BigInteger> tampered = new ArrayList<>(watermarked);
        tampered.set(WatermarkDemo.TAMPERED_INDEX, tampered.get(WatermarkDemo.TAMPERED_INDEX).xor(BigInteger.ONE));
        try {
            f.call(tampered);
            fail("flipped parameter must be detected");
        } catch (TamperedParametersException ex) {
            assertEquals(BigInteger.valueOf(123456821), ex.getResult().recoveredCode);
        }
    }

    @Test
    public void testMainRuns() throws Exception {
        WatermarkDemo.main(new String[0]);
    }
}
