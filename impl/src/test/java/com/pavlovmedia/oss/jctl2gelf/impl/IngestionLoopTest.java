package com.pavlovmedia.oss.jctl2gelf.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.zip.GZIPInputStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pavlovmedia.oss.jctl2gelf.impl.config.GlobalConfig;
import com.pavlovmedia.oss.jctl2gelf.impl.config.Jctl2GelfConfig;
import com.pavlovmedia.oss.jctl2gelf.impl.config.LogSource;
import com.pavlovmedia.oss.jctl2gelf.impl.config.SharedConfig;
import com.pavlovmedia.oss.jctl2gelf.impl.config.WatchedConfig;
import com.pavlovmedia.oss.jctl2gelf.lib.ChunkedMessage;
import com.pavlovmedia.oss.jctl2gelf.lib.GelfException;
import com.pavlovmedia.oss.jctl2gelf.lib.GelfException.ErrorKind;
import com.pavlovmedia.oss.jctl2gelf.lib.IGelfTransporter;
import com.pavlovmedia.oss.jctl2gelf.lib.MessageCompression;
import com.pavlovmedia.oss.jctl2gelf.lib.SystemLevel;

class IngestionLoopTest {
    private static final String RECORD = "{\"MESSAGE\":\"disk full\",\"_HOSTNAME\":\"h1\",\"PRIORITY\":\"3\"}";

    private final ObjectMapper mapper = new ObjectMapper();
    private SharedConfig shared;
    private CapturingTransporter transporter;

    @BeforeEach
    void setUp() {
        shared = new SharedConfig(new Jctl2GelfConfig(
                new GlobalConfig(LogSource.STDIN, 0),
                new WatchedConfig("127.0.0.1:12201")
                    .setCompression(MessageCompression.NONE)
                    .setLogLevelSystem(SystemLevel.WARNING)));
        transporter = new CapturingTransporter();
    }

    @Test
    void testSendsAcceptedRecords() throws Exception {
        // Given
        LineSource source = new StdinLineSource(stream(RECORD, "", "not json", "{\"_HOSTNAME\":\"h1\"}",
                "{\"MESSAGE\":\"chatty\",\"PRIORITY\":\"7\"}", RECORD));

        // When
        new IngestionLoop(shared, source, transporter).run();

        // Then
        assertEquals(2, transporter.sent.size());
        JsonNode json = mapper.readTree(transporter.sent.get(0));
        assertEquals("h1", json.get("host").asText());
        assertEquals(3, json.get("level").asInt());
        assertEquals(Arrays.asList("127.0.0.1:12201", "127.0.0.1:12201"), transporter.targets);
        assertTrue(transporter.opened);
        assertTrue(transporter.closed);
    }

    @Test
    void testCompressionChangeAppliesToNextRecord() throws Exception {
        // Given: the watcher publishes gzip after the first record was read
        List<String> lines = Arrays.asList(RECORD, RECORD);
        Iterator<String> it = lines.iterator();
        LineSource source = new ScriptedSource(it, 1,
                () -> shared.replace(shared.snapshot().setCompression(MessageCompression.GZIP)));

        // When
        new IngestionLoop(shared, source, transporter).run();

        // Then
        assertEquals(2, transporter.sent.size());
        assertEquals("h1", mapper.readTree(transporter.sent.get(0)).get("host").asText());
        byte[] second = transporter.sent.get(1);
        assertEquals((byte) 0x1f, second[0]);
        assertEquals((byte) 0x8b, second[1]);
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(second))) {
            assertEquals("h1", mapper.readTree(in).get("host").asText());
        }
        assertFalse(shared.hasChanged());
    }

    @Test
    void testTargetChangeAppliesToNextRecord() throws Exception {
        LineSource source = new ScriptedSource(Arrays.asList(RECORD, RECORD).iterator(), 1,
                () -> shared.replace(shared.snapshot().setGraylogAddr("10.0.0.1:12201")));

        new IngestionLoop(shared, source, transporter).run();

        assertEquals(Arrays.asList("127.0.0.1:12201", "10.0.0.1:12201"), transporter.targets);
    }

    @Test
    void testThresholdChangeAppliesToNextRecord() throws Exception {
        LineSource source = new ScriptedSource(Arrays.asList(RECORD, RECORD).iterator(), 1,
                () -> shared.replace(shared.snapshot().setLogLevelSystem(SystemLevel.CRITICAL)));

        IngestionLoop loop = new IngestionLoop(shared, source, transporter);
        loop.run();

        assertEquals(1, transporter.sent.size());
        assertEquals(SystemLevel.CRITICAL, loop.getCurrentConfig().getLogLevelSystem());
    }

    @Test
    void testBindFailureIsFatal() {
        transporter.failOpen = true;
        IngestionLoop loop = new IngestionLoop(shared, new StdinLineSource(stream(RECORD)), transporter);

        GelfException e = assertThrows(GelfException.class, loop::run);

        assertEquals(ErrorKind.IO_FAILURE, e.getKind());
        assertTrue(transporter.sent.isEmpty());
    }

    @Test
    void testSourceFailureIsFatal() {
        LineSource failing = new LineSource() {
            @Override
            public Optional<String> nextLine() throws GelfException {
                throw new GelfException(ErrorKind.INTERNAL_FAILURE, "journalctl died");
            }

            @Override
            public void close() { }
        };

        GelfException e = assertThrows(GelfException.class,
                () -> new IngestionLoop(shared, failing, transporter).run());

        assertEquals(ErrorKind.INTERNAL_FAILURE, e.getKind());
        assertTrue(transporter.closed);
    }

    @Test
    void testSendFailureDoesNotStopLoop() throws Exception {
        transporter.failSend = true;

        new IngestionLoop(shared, new StdinLineSource(stream(RECORD, RECORD)), transporter).run();

        assertEquals(2, transporter.attempts);
    }

    @Test
    void testStop() throws Exception {
        IngestionLoop[] loop = new IngestionLoop[1];
        LineSource source = new ScriptedSource(Arrays.asList(RECORD, RECORD, RECORD).iterator(), 1,
                () -> loop[0].stop());
        loop[0] = new IngestionLoop(shared, source, transporter);

        loop[0].run();

        // The record in hand is finished, the third one is never read
        assertEquals(2, transporter.sent.size());
    }

    private static ByteArrayInputStream stream(final String... lines) {
        return new ByteArrayInputStream(String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Runs an action right after handing out a given number of lines
     */
    private static class ScriptedSource implements LineSource {
        private final Iterator<String> lines;
        private final int after;
        private final Runnable action;
        private int served;

        ScriptedSource(final Iterator<String> lines, final int after, final Runnable action) {
            this.lines = lines;
            this.after = after;
            this.action = action;
        }

        @Override
        public Optional<String> nextLine() {
            if (served == after) {
                action.run();
            }
            served++;
            return lines.hasNext() ? Optional.of(lines.next()) : Optional.empty();
        }

        @Override
        public void close() { }
    }

    private static class CapturingTransporter implements IGelfTransporter {
        final List<byte[]> sent = new ArrayList<>();
        final List<String> targets = new ArrayList<>();
        boolean opened;
        boolean closed;
        boolean failOpen;
        boolean failSend;
        int attempts;

        @Override
        public void open() throws IOException {
            if (failOpen) {
                throw new SocketException("Address already in use");
            }
            opened = true;
        }

        @Override
        public void sendGelfMessage(final ChunkedMessage message, final String target,
                final Consumer<IOException> onException) {
            attempts++;
            if (failSend) {
                onException.accept(new IOException("Network is unreachable"));
                return;
            }
            targets.add(target);
            for (byte[] chunk : message) {
                sent.add(chunk);
            }
        }

        @Override
        public void sendGelfMessage(final ChunkedMessage message, final String target) {
            sendGelfMessage(message, target, e -> { });
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
