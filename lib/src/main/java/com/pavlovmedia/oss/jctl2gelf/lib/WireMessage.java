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

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.pavlovmedia.oss.jctl2gelf.lib.GelfException.ErrorKind;

/**
 * A fully assembled GELF message: the event itself plus the team and
 * service tags that come from configuration. This is the only place
 * that knows the on-wire layout, see {@link WireMessageSerializer}.
 * 
 * @author Shawn Dempsay
 *
 */
@JsonSerialize(using=WireMessageSerializer.class)
public class WireMessage {
    public static final String GELF_VERSION = "1.1";
    
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    private final GelfMessage message;
    private final Optional<String> team;
    private final Optional<String> service;
    
    public WireMessage(final GelfMessage message, final Optional<String> team, final Optional<String> service) {
        this.message = Objects.requireNonNull(message, "message is Null");
        this.team = Objects.requireNonNull(team, "team is Null");
        this.service = Objects.requireNonNull(service, "service is Null");
    }
    
    public WireMessage(final GelfMessage message) {
        this(message, Optional.empty(), Optional.empty());
    }
    
    public GelfMessage getMessage() {
        return message;
    }
    
    public Optional<String> getTeam() {
        return team;
    }
    
    public Optional<String> getService() {
        return service;
    }
    
    /**
     * @return the GELF/JSON document of this message
     * @throws GelfException if Jackson fails to write it
     */
    public String toGelf() throws GelfException {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new GelfException(ErrorKind.PARSING_FAILURE, e.getOriginalMessage(), e);
        }
    }
    
    /**
     * @return the UTF-8 bytes of {@link #toGelf()}
     */
    public byte[] toGelfBytes() throws GelfException {
        return toGelf().getBytes(StandardCharsets.UTF_8);
    }
    
    public byte[] toCompressedGelf(final MessageCompression compression) throws GelfException {
        return compression.compress(this);
    }
    
    /**
     * Serializes, compresses and splits this message into datagrams
     * @throws GelfException INTERNAL_FAILURE if the message needs more chunks than GELF allows
     */
    public ChunkedMessage toChunkedMessage(final ChunkSize chunkSize, final MessageCompression compression) 
            throws GelfException {
        byte[] payload = toCompressedGelf(compression);
        return ChunkedMessage.create(chunkSize, payload)
                .orElseThrow(() -> new GelfException(ErrorKind.INTERNAL_FAILURE, 
                        String.format("failed to split %d bytes on %d-byte chunks", payload.length, chunkSize.getSize())));
    }
}
