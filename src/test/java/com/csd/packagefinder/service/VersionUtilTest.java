package com.csd.packagefinder.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class VersionUtilTest {

    @Test
    void compareVersions() {
        assertTrue(VersionUtil.compare("1.0.0", "1.0.1") < 0);
        assertTrue(VersionUtil.compare("2.0.0", "1.9.9") > 0);
        assertEquals(0, VersionUtil.compare("1.0", "1.0"));
    }

    @Test
    void belowLogic() {
        assertTrue(VersionUtil.isBelow("1.0.0", "1.1.0"));
        assertFalse(VersionUtil.isBelow("1.1.0", "1.1.0"));
        assertFalse(VersionUtil.isBelow("1.2.0", "1.1.0"));
        assertFalse(VersionUtil.isBelow(null, "1.0"));
    }

    @Test
    void componentsCompareNumerically() {
        assertTrue(VersionUtil.compare("1.10", "1.9") > 0);
        assertTrue(VersionUtil.compare("10", "2") > 0);
        assertTrue(VersionUtil.compare("1.2", "1.2.1") < 0);
        assertTrue(VersionUtil.compare("v2.0", "1.9") > 0);
    }

    @Test
    void hugeComponentsDoNotOverflow() {
        assertTrue(VersionUtil.compare("1.99999999999999999999999", "1.99999999999999999999998") > 0);
        assertTrue(VersionUtil.compare("20240101000000000000", "9") > 0);
        assertEquals(List.of("7", "0"), VersionUtil.numericComponents("007.000"));
    }

    @Test
    void nonNumericVersionsSortFirst() {
        assertTrue(VersionUtil.compare("latest", "0.1") < 0);
        assertTrue(VersionUtil.compare("devel", "latest") < 0);
        assertTrue(VersionUtil.numericComponents("latest").isEmpty());
    }

    @Test
    void suffixBreaksTies() {
        // with equal numeric prefixes the suffix decides, then the longer string
        assertTrue(VersionUtil.compare("1.2.3", "1.2.3-rc1") < 0);
        assertTrue(VersionUtil.compare("1.2.3a", "1.2.3b") < 0);
        assertTrue(VersionUtil.compare("1.2", "1.02") < 0);
        assertTrue(VersionUtil.compare("v1.2", "1.2") > 0);
    }

    @Test
    void orderIsTotalAndConsistentWithEquals() {
        List<String> samples = List.of("1.0", "1.00", "v1.0", "1.0.", "1..0", "abc", "", "0", "1.0-beta", "1.0.0", "V1");
        for (String a : samples) {
            for (String b : samples) {
                int ab = Integer.signum(VersionUtil.compare(a, b));
                int ba = Integer.signum(VersionUtil.compare(b, a));
                assertEquals(-ab, ba, a + " vs " + b);
                assertEquals(a.equals(b), ab == 0, a + " vs " + b);
            }
        }
    }

    @Test
    void latestPicksGreatestIgnoringBlanks() {
        List<String> versions = new ArrayList<>(List.of("0.11.9", "0.12.1", "latest", " "));
        versions.add(null);
        assertEquals("0.12.1", VersionUtil.latest(versions));
        assertNull(VersionUtil.latest(List.of()));
    }

    @Test
    void majorMinorKeyKeepsTextAsWritten() {
        assertEquals("1.2", VersionUtil.majorMinorKey("v1.2.3-rc1"));
        assertEquals("0.11", VersionUtil.majorMinorKey("0.11.9"));
        assertEquals("10", VersionUtil.majorMinorKey("10"));
        assertEquals("latest", VersionUtil.majorMinorKey("latest"));
        assertEquals("01.02", VersionUtil.majorMinorKey("01.02.3"));
    }
}
