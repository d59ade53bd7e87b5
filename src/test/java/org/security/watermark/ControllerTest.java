package org.security.watermark;

import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.*;

public class ControllerTest {

    @Test
    public void testAuthenticGraph() {
        WatermarkGraph g = WatermarkGraph.encode(DigitConverter.toDigits(424242L, 6));
        Controller.VerificationResult vr = Controller.verify(g, 424242L);
        assertTrue(vr.isAuthentic());
        assertEquals(BigInteger.valueOf(424242), vr.recoveredCode);
        assertArrayEquals(new int[]{1, 3, 0, 3, 2, 0, 3, 0}, vr.recoveredZeta6);
        assertNull(vr.error);
    }

    @Test
    public void testCodeMismatchIsNotAnError() {
        WatermarkGraph g = WatermarkGraph.encode(DigitConverter.toDigits(424242L, 6));
        Controller.VerificationResult vr = Controller.verify(g, 424243L);
        assertFalse(vr.authentic);
        assertEquals(BigInteger.valueOf(424242), vr.recoveredCode);
        assertNull(vr.error);
    }

    @Test
    public void testZeroCode() {
        Controller.VerificationResult vr = Controller.verify(WatermarkGraph.encode(new int[]{0}), 0L);
        assertTrue(vr.authentic);
        assertEquals(BigInteger.valueOf(0), vr.recoveredCode);
    }

    @Test
    public void testBrokenGraphIsReportedNotThrown() {
        WatermarkGraph g = WatermarkGraph.encode(DigitConverter.toDigits(424242L, 6));
        g.unlink(3);
        Controller.VerificationResult vr = Controller.verify(g, 424242L);
        assertFalse(vr.authentic);
        assertNull(vr.recoveredCode);
        assertNull(vr.recoveredZeta6);
        assertEquals("invalid structure (broken ring)", vr.error);
    }

    @Test
    public void testUnreachableDigitIsReportedNotThrown() {
        WatermarkGraph g = WatermarkGraph.empty(9);
        for (int r = 0; r < 8; r++) g.link(r, (r + 1) % 8);
        g.pointDigit(2, 8);
        Controller.VerificationResult vr = Controller.verify(g, 424242L);
        assertFalse(vr.authentic);
        assertEquals("invalid structure (unreachable digit)", vr.error);
    }

    @Test
    public void testDecodedDigitOutsideBase6IsReported() {
        WatermarkGraph g = WatermarkGraph.encode(DigitConverter.toDigits(424242L, 6));
        g.pointDigit(0, 6); // six steps away reads as digit 7
        Controller.VerificationResult vr = Controller.verify(g, 424242L);
        assertFalse(vr.authentic);
        assertEquals("digit 7 out of range for base 6", vr.error);
    }

    @Test
    public void testCodeWiderThanALong() {
        BigInteger code = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
        Controller.VerificationResult vr = Controller.verify(WatermarkGraph.encode(DigitConverter.toDigits(code, 6)), code);
        assertTrue(vr.authentic);
        assertEquals(code, vr.recoveredCode);
        assertEquals(25, vr.recoveredZeta6.length);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeExpectedCodeFailsFast() {
        Controller.verify(WatermarkGraph.encode(new int[]{1}), -1L);
    }
}
