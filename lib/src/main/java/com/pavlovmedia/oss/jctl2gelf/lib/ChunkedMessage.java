/*
 * Copyright 2014 Pavlov Media
 * 
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *     http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.pavlovmedia.oss.jctl2gelf.lib;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A GELF payload split into UDP datagrams. When the payload does not fit
 * into one datagram each chunk is prefixed with the GELF chunk header:
 * <pre>
 *   0x1e 0x0f | 8 byte message id | sequence number | sequence count | body
 * </pre>
 * A payload that fits is sent as is, receivers tell the two apart by the
 * magic bytes.
 * 
 * Chunks are built up front, so this can be iterated more than once.
 * 
 * @author Shawn Dempsay
 *
 */
public final class ChunkedMessage implements Iterable<byte[]> {
    public static final int HEADER_SIZE = 12;
    public static final int MAX_CHUNKS = 128;
    public static final int ID_SIZE = 8;
    
    static final byte MAGIC_0 = 0x1e;
    static final byte MAGIC_1 = 0x0f;
    
    private final byte[] id;
    private final List<byte[]> chunks;
    
    private ChunkedMessage(final byte[] id, final List<byte[]> chunks) {
        this.id = id;
        this.chunks = Collections.unmodifiableList(chunks);
    }
    
    /**
     * Splits a payload into datagrams
     * 
     * @param chunkSize the datagram size class
     * @param payload the (compressed) GELF document
     * @return the chunks, or an empty Optional if more than {@value #MAX_CHUNKS} would be needed
     */
    public static Optional<ChunkedMessage> create(final ChunkSize chunkSize, final byte[] payload) {
        Objects.requireNonNull(chunkSize, "chunkSize is Null");
        Objects.requireNonNull(payload, "payload is Null");
        
        int bodySize = chunkSize.getBodySize();
        byte[] id = new byte[ID_SIZE];
        ThreadLocalRandom.current().nextBytes(id);
        
        if (payload.length <= bodySize) {
            return Optional.of(new ChunkedMessage(id, Collections.singletonList(payload)));
        }
        
        int count = (payload.length + bodySize - 1) / bodySize;
        if (count > MAX_CHUNKS) {
            return Optional.empty();
        }
        
        List<byte[]> chunks = new ArrayList<>(count);
        for (int sequence = 0; sequence < count; sequence++) {
            int offset = sequence * bodySize;
            int length = Math.min(bodySize, payload.length - offset);
            
            byte[] chunk = new byte[HEADER_SIZE + length];
            chunk[0] = MAGIC_0;
            chunk[1] = MAGIC_1;
            System.arraycopy(id, 0, chunk, 2, ID_SIZE);
            chunk[10] = (byte) sequence;
            chunk[11] = (byte) count;
            System.arraycopy(payload, offset, chunk, HEADER_SIZE, length);
            chunks.add(chunk);
        }
        return Optional.of(new ChunkedMessage(id, chunks));
    }
    
    /**
     * @return a copy of the message id shared by all chunks
     */
    public byte[] getId() {
        return Arrays.copyOf(id, id.length);
    }
    
    public int getChunkCount() {
        return chunks.size();
    }
    
    /**
     * True if the payload was split and every datagram carries a chunk header
     */
    public boolean isChunked() {
        return chunks.size() > 1;
    }
    
    @Override
    public Iterator<byte[]> iterator() {
        return chunks.iterator();
    }
}
