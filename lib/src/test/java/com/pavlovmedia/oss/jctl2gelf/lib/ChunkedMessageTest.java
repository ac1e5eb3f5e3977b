package com.pavlovmedia.oss.jctl2gelf.lib;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Optional;
import java.util.Random;

import org.junit.jupiter.api.Test;

class ChunkedMessageTest {
    private static final int BODY = ChunkSize.WAN.getBodySize();

    @Test
    void testChunkSizes() {
        assertEquals(1408, ChunkSize.WAN.getBodySize());
        assertEquals(8142, ChunkSize.LAN.getBodySize());
    }

    @Test
    void testSmallPayloadIsSentAsIs() {
        byte[] payload = payload(BODY);

        ChunkedMessage chunked = ChunkedMessage.create(ChunkSize.WAN, payload).get();

        assertEquals(1, chunked.getChunkCount());
        assertFalse(chunked.isChunked());
        assertArrayEquals(payload, chunked.iterator().next());
    }

    @Test
    void testEmptyPayload() {
        ChunkedMessage chunked = ChunkedMessage.create(ChunkSize.WAN, new byte[0]).get();

        assertEquals(1, chunked.getChunkCount());
        assertEquals(0, chunked.iterator().next().length);
    }

    @Test
    void testHeaderLayout() {
        // Given
        byte[] payload = payload(BODY * 2 + 10);

        // When
        ChunkedMessage chunked = ChunkedMessage.create(ChunkSize.WAN, payload).get();

        // Then
        assertEquals(3, chunked.getChunkCount());
        assertTrue(chunked.isChunked());
        byte[] id = chunked.getId();
        assertEquals(8, id.length);

        int sequence = 0;
        for (byte[] chunk : chunked) {
            assertEquals((byte) 0x1e, chunk[0]);
            assertEquals((byte) 0x0f, chunk[1]);
            assertArrayEquals(id, Arrays.copyOfRange(chunk, 2, 10));
            assertEquals(sequence, chunk[10]);
            assertEquals(3, chunk[11]);
            assertTrue(chunk.length <= ChunkSize.WAN.getSize());
            sequence++;
        }
    }

    @Test
    void testReassembly() {
        byte[] payload = payload(BODY * 5 + 1);

        ChunkedMessage chunked = ChunkedMessage.create(ChunkSize.WAN, payload).get();

        assertEquals(6, chunked.getChunkCount());
        assertArrayEquals(payload, reassemble(chunked));
        // Iterating twice gives the same datagrams
        assertArrayEquals(payload, reassemble(chunked));
    }

    @Test
    void testMaximumChunkCount() {
        byte[] payload = payload(BODY * ChunkedMessage.MAX_CHUNKS);

        ChunkedMessage chunked = ChunkedMessage.create(ChunkSize.WAN, payload).get();

        assertEquals(128, chunked.getChunkCount());
        byte[] last = null;
        for (byte[] chunk : chunked) {
            last = chunk;
        }
        assertEquals(127, last[10] & 0xff);
        assertEquals(128, last[11] & 0xff);
        assertArrayEquals(payload, reassemble(chunked));
    }

    @Test
    void testTooManyChunks() {
        Optional<ChunkedMessage> chunked = ChunkedMessage.create(ChunkSize.WAN, payload(BODY * ChunkedMessage.MAX_CHUNKS + 1));

        assertFalse(chunked.isPresent());
    }

    @Test
    void testLanFitsMore() {
        byte[] payload = payload(BODY * 200);

        assertFalse(ChunkedMessage.create(ChunkSize.WAN, payload).isPresent());
        assertTrue(ChunkedMessage.create(ChunkSize.LAN, payload).isPresent());
    }

    @Test
    void testIdsDifferPerMessage() {
        byte[] payload = payload(BODY + 1);

        byte[] first = ChunkedMessage.create(ChunkSize.WAN, payload).get().getId();
        byte[] second = ChunkedMessage.create(ChunkSize.WAN, payload).get().getId();

        assertFalse(Arrays.equals(first, second));
    }

    private static byte[] reassemble(final ChunkedMessage chunked) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        for (byte[] chunk : chunked) {
            bos.write(chunk, ChunkedMessage.HEADER_SIZE, chunk.length - ChunkedMessage.HEADER_SIZE);
        }
        return bos.toByteArray();
    }

    private static byte[] payload(final int size) {
        byte[] ret = new byte[size];
        new Random(size).nextBytes(ret);
        return ret;
    }
}
