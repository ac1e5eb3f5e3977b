package com.pavlovmedia.oss.jctl2gelf.impl;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.pavlovmedia.oss.jctl2gelf.lib.GelfException;
import com.pavlovmedia.oss.jctl2gelf.lib.GelfException.ErrorKind;

class JournalLineSourceTest {

    @Test
    void testReadsLinesThenReportsStderr() throws Exception {
        assumeTrue(JournalLineSource.isPlatformSupported());

        // Given: a stand-in for journalctl that prints one record and dies
        JournalLineSource source = JournalLineSource.start(Arrays.asList("sh", "-c",
                "echo '{\"MESSAGE\":\"hello\"}'; echo 'Failed to open journal' >&2; exit 1"));

        try {
            // When / Then
            assertEquals("{\"MESSAGE\":\"hello\"}", source.nextLine().get());

            GelfException e = assertThrows(GelfException.class, source::nextLine);
            assertEquals(ErrorKind.INTERNAL_FAILURE, e.getKind());
            assertTrue(e.getMessage().contains("Failed to open journal"), e.getMessage());
        } finally {
            source.close();
        }
    }

    @Test
    void testChattyStderrDoesNotBlockOutput() throws Exception {
        assumeTrue(JournalLineSource.isPlatformSupported());

        // Given: far more than a pipe buffer of warnings before the first record
        JournalLineSource source = JournalLineSource.start(Arrays.asList("sh", "-c",
                "i=0; while [ $i -lt 5000 ]; do echo \"warning number $i padded out to fill the pipe\" >&2; i=$((i+1)); done;"
                + " echo '{\"MESSAGE\":\"after\"}'; echo 'last words' >&2; exit 1"));

        try {
            // When / Then
            assertEquals("{\"MESSAGE\":\"after\"}", source.nextLine().get());

            GelfException e = assertThrows(GelfException.class, source::nextLine);
            assertEquals(ErrorKind.INTERNAL_FAILURE, e.getKind());
            assertTrue(e.getMessage().contains("last words"), e.getMessage());
            assertFalse(e.getMessage().contains("warning number 0 "), "only the tail of stderr is kept");
        } finally {
            source.close();
        }
    }

    @Test
    void testBlankLineFromLiveProcessIsPassedThrough() throws Exception {
        assumeTrue(JournalLineSource.isPlatformSupported());

        // Given: a blank line while the process keeps running
        JournalLineSource source = JournalLineSource.start(Arrays.asList("sh", "-c",
                "echo ''; echo '{\"MESSAGE\":\"next\"}'; sleep 30"));

        try {
            // When / Then
            assertEquals("", source.nextLine().get());
            assertEquals("{\"MESSAGE\":\"next\"}", source.nextLine().get());
        } finally {
            source.close();
        }
    }

    @Test
    void testMissingBinary() {
        assumeTrue(JournalLineSource.isPlatformSupported());

        GelfException e = assertThrows(GelfException.class,
                () -> JournalLineSource.start(Arrays.asList("/nonexistent/journalctl-for-test")));

        assertEquals(ErrorKind.IO_FAILURE, e.getKind());
    }

    @Test
    void testUnsupportedPlatform() {
        assumeTrue(!JournalLineSource.isPlatformSupported());

        GelfException e = assertThrows(GelfException.class, JournalLineSource::start);

        assertEquals(ErrorKind.INTERNAL_FAILURE, e.getKind());
    }
}
