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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Class representation of a single GELF event. It is wrapped in a
 * {@link WireMessage} to get the JSON needed for a GELF packet.
 * 
 * Instances live for the processing of one record and are not
 * meant to be shared between threads.
 * 
 * @author Shawn Dempsay
 *
 */
public class GelfMessage {
    /** GELF reserves this additional field name */
    public static final String RESERVED_ID = "id";
    
    private final String host;
    private final String shortMessage;
    private String fullMessage;
    
    /** Seconds since UNIX epoch, filled in at encode time when absent */
    private Double timestamp;
    private SystemLevel level = SystemLevel.ALERT;
    private final Map<String,JsonNode> metadata = new HashMap<>();
    
    public GelfMessage(final String host, final String shortMessage) {
        this.host = Objects.requireNonNull(host, "host is Null");
        this.shortMessage = Objects.requireNonNull(shortMessage, "shortMessage is Null");
    }
    
    public String getHost() {
        return host;
    }
    
    public String getShortMessage() {
        return shortMessage;
    }
    
    public Optional<String> getFullMessage() {
        return Optional.ofNullable(fullMessage);
    }
    
    public GelfMessage setFullMessage(final String fullMessage) {
        this.fullMessage = fullMessage;
        return this;
    }
    
    public GelfMessage clearFullMessage() {
        this.fullMessage = null;
        return this;
    }
    
    public Optional<Double> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }
    
    public GelfMessage setTimestamp(final double timestamp) {
        this.timestamp = timestamp;
        return this;
    }
    
    public GelfMessage clearTimestamp() {
        this.timestamp = null;
        return this;
    }
    
    public SystemLevel getLevel() {
        return level;
    }
    
    public GelfMessage setLevel(final SystemLevel level) {
        this.level = Objects.requireNonNull(level, "level is Null");
        return this;
    }
    
    public Optional<JsonNode> getMetadata(final String key) {
        return Optional.ofNullable(metadata.get(key));
    }
    
    public Map<String,JsonNode> getAllMetadata() {
        return Collections.unmodifiableMap(metadata);
    }
    
    /**
     * Adds an additional field. The key is sent with a leading underscore.
     * 
     * @param key field name, must not be "id"
     * @param value any JSON value, passed through unchanged
     * @return false if the key was rejected and nothing was stored
     */
    public boolean setMetadata(final String key, final JsonNode value) {
        if (RESERVED_ID.equals(key)) {
            return false;
        }
        metadata.put(key, value);
        return true;
    }
}
