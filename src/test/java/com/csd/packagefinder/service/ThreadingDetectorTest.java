package com.csd.packagefinder.service;

import com.csd.packagefinder.model.ThreadingSupport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ThreadingDetectorTest {

    @Test
    void noTextIsUnknown() {
        assertEquals(ThreadingSupport.UNKNOWN, ThreadingDetector.detect().getSupport());
        assertEquals(ThreadingSupport.UNKNOWN, ThreadingDetector.detect(null, "  ").getSupport());
    }

    @Test
    void threadFlagsAreCollected() {
        ThreadingDetector.Assessment a = ThreadingDetector.detect("Usage: bwa mem -t 8 ref.fa reads.fq", "Set --threads=4 or --cores 2");
        assertEquals(ThreadingSupport.EXPLICIT, a.getSupport());
        assertEquals(List.of("-t", "--threads", "--cores"), a.getFlags());
    }

    @Test
    void shortFlagsNeedANumber() {
        ThreadingDetector.Assessment a = ThreadingDetector.detect("use -n to print line numbers and -t for tabs");
        assertEquals(ThreadingSupport.NONE_DETECTED, a.getSupport());
        assertTrue(a.getFlags().isEmpty());

        assertEquals(List.of("-t"), ThreadingDetector.detect("samtools sort -t8").getFlags());
    }

    @Test
    void flagsInsideWordsAreIgnored() {
        ThreadingDetector.Assessment a = ThreadingDetector.detect("a multi-t 4 word and x--threads");
        assertTrue(a.getFlags().isEmpty());
    }

    @Test
    void keywordsAloneAreEnough() {
        ThreadingDetector.Assessment a = ThreadingDetector.detect("Supports Multithreaded compression");
        assertEquals(ThreadingSupport.EXPLICIT, a.getSupport());
        assertTrue(a.getFlags().isEmpty());
    }

    @Test
    void plainDescriptionHasNoSupport() {
        assertEquals(ThreadingSupport.NONE_DETECTED, ThreadingDetector.detect("A quality control tool").getSupport());
    }
}
