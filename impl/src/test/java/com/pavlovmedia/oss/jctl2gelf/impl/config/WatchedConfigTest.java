package com.pavlovmedia.oss.jctl2gelf.impl.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.pavlovmedia.oss.jctl2gelf.lib.MessageCompression;
import com.pavlovmedia.oss.jctl2gelf.lib.MessageLevel;
import com.pavlovmedia.oss.jctl2gelf.lib.SystemLevel;

class WatchedConfigTest {

    @Test
    void testUpdateFromCopiesDifferences() {
        // Given
        WatchedConfig current = new WatchedConfig("a:1").setCompression(MessageCompression.NONE);
        WatchedConfig newer = current.copy()
                .setCompression(MessageCompression.GZIP)
                .setTeam("platform")
                .setLogLevelMessage(MessageLevel.WARNING);

        // When
        boolean changed = current.updateFrom(newer);

        // Then
        assertTrue(changed);
        assertEquals(newer, current);
        assertEquals(MessageCompression.GZIP, current.getCompression());
        assertEquals("platform", current.getTeam().get());
    }

    @Test
    void testUpdateFromSameValue() {
        WatchedConfig current = new WatchedConfig("a:1").setService("svc");

        assertFalse(current.updateFrom(current.copy()));
    }

    @Test
    void testUpdateFromClearsOptionalFields() {
        WatchedConfig current = new WatchedConfig("a:1").setTeam("t").setLogLevelMessage(MessageLevel.INFO);
        WatchedConfig newer = new WatchedConfig("b:2").setLogLevelSystem(SystemLevel.DEBUG);

        assertTrue(current.updateFrom(newer));

        assertEquals("b:2", current.getGraylogAddr());
        assertFalse(current.getTeam().isPresent());
        assertFalse(current.getLogLevelMessage().isPresent());
        assertEquals(SystemLevel.DEBUG, current.getLogLevelSystem());
    }

    @Test
    void testCopyIsIndependent() {
        WatchedConfig original = new WatchedConfig("a:1");
        WatchedConfig copy = original.copy();

        copy.setTeam("other");

        assertFalse(original.getTeam().isPresent());
    }
}
