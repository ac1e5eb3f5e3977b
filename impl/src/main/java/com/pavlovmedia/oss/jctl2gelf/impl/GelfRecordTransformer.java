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
package com.pavlovmedia.oss.jctl2gelf.impl;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pavlovmedia.oss.jctl2gelf.impl.config.WatchedConfig;
import com.pavlovmedia.oss.jctl2gelf.lib.GelfException;
import com.pavlovmedia.oss.jctl2gelf.lib.GelfException.ErrorKind;
import com.pavlovmedia.oss.jctl2gelf.lib.GelfMessage;
import com.pavlovmedia.oss.jctl2gelf.lib.MessageLevel;
import com.pavlovmedia.oss.jctl2gelf.lib.SystemLevel;
import com.pavlovmedia.oss.jctl2gelf.lib.WireMessage;

/**
 * This is a utility class that will convert one JSON log record, as written
 * by <code>journalctl -o json</code>, into a suitably formatted GELF message.
 * 
 * Records below the configured thresholds are rejected with
 * {@link ErrorKind#INSUFFICIENT_LOG_LEVEL}. Nothing here does I/O.
 * 
 * @author Shawn Dempsay
 *
 */
public final class GelfRecordTransformer {
    static final String MESSAGE = "MESSAGE";
    static final String HOSTNAME = "_HOSTNAME";
    static final String REALTIME_TIMESTAMP = "__REALTIME_TIMESTAMP";
    static final String PRIORITY = "PRIORITY";
    
    static final String UNDEFINED_HOST = "undefined";
    
    /** Journal fields that are either mapped to GELF fields or are noise */
    static final Set<String> IGNORED_FIELDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            MESSAGE,
            HOSTNAME,
            REALTIME_TIMESTAMP,
            PRIORITY,
            "__CURSOR",
            "_BOOT_ID",
            "_MACHINE_ID",
            "_SYSTEMD_CGROUP",
            "_SYSTEMD_SLICE")));
    
    // First match wins: 'level=some_log_level'
    private static final Pattern MESSAGE_LEVEL = Pattern.compile("level=([a-z]+)", Pattern.CASE_INSENSITIVE);
    
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    private GelfRecordTransformer() { }
    
    /**
     * Takes a raw record and turns it into the bytes of a (compressed)
     * GELF document, ready to be chunked.
     * 
     * @param rawLine one JSON object
     * @param config supplies thresholds, tags and the compression to use
     * @return the compressed GELF document
     * @throws GelfException PARSING_FAILURE, NO_MESSAGE, INSUFFICIENT_LOG_LEVEL or COMPRESSION_FAILURE
     */
    public static byte[] transform(final String rawLine, final WatchedConfig config) throws GelfException {
        return toWireMessage(rawLine, config).toCompressedGelf(config.getCompression());
    }
    
    /**
     * Same as {@link #transform(String, WatchedConfig)} without the final
     * encoding step
     */
    public static WireMessage toWireMessage(final String rawLine, final WatchedConfig config) throws GelfException {
        JsonNode record = parseRecord(rawLine);
        
        JsonNode shortMessage = record.get(MESSAGE);
        if (null == shortMessage) {
            throw GelfException.noMessage();
        }
        String text = asText(shortMessage);
        String host = Optional.ofNullable(record.get(HOSTNAME))
                .map(GelfRecordTransformer::asText)
                .orElse(UNDEFINED_HOST);
        
        if (config.getLogLevelMessage().isPresent()) {
            Optional<MessageLevel> level = findMessageLevel(text);
            if (level.isPresent() && level.get().isBelow(config.getLogLevelMessage().get())) {
                throw GelfException.insufficientLevel();
            }
        }
        
        GelfMessage message = new GelfMessage(host, text);
        
        Optional<SystemLevel> systemLevel = Optional.ofNullable(record.get(PRIORITY))
                .flatMap(GelfRecordTransformer::parseSystemLevel);
        if (systemLevel.isPresent()) {
            if (systemLevel.get().isBelow(config.getLogLevelSystem())) {
                throw GelfException.insufficientLevel();
            }
            message.setLevel(systemLevel.get());
        }
        
        Optional.ofNullable(record.get(REALTIME_TIMESTAMP))
            .flatMap(GelfRecordTransformer::parseTimestamp)
            .ifPresent(message::setTimestamp);
        
        Iterator<Map.Entry<String,JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String,JsonNode> field = fields.next();
            if (!IGNORED_FIELDS.contains(field.getKey())) {
                // "id" is reserved by GELF, the message drops it
                message.setMetadata(field.getKey(), field.getValue());
            }
        }
        
        return new WireMessage(message, config.getTeam(), config.getService());
    }
    
    /**
     * Looks for <code>level=word</code> in free text. Unknown words count as debug.
     */
    static Optional<MessageLevel> findMessageLevel(final String text) {
        Matcher matcher = MESSAGE_LEVEL.matcher(text);
        return matcher.find()
                ? Optional.of(MessageLevel.fromWord(matcher.group(1)))
                : Optional.empty();
    }
    
    /**
     * Journald writes PRIORITY as a string, but a number is accepted as well.
     * Anything that is not an unsigned byte is ignored.
     */
    static Optional<SystemLevel> parseSystemLevel(final JsonNode priority) {
        int code;
        if (priority.isIntegralNumber() && priority.canConvertToInt()) {
            code = priority.intValue();
        } else if (priority.isTextual()) {
            try {
                code = Integer.parseInt(priority.asText().trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        
        if (code < 0 || code > 0xff) {
            return Optional.empty();
        }
        return Optional.of(SystemLevel.fromCode(code));
    }
    
    /**
     * Converts systemd's microseconds since the epoch into GELF's
     * fractional seconds
     */
    static Optional<Double> parseTimestamp(final JsonNode timestamp) {
        if (timestamp.isNumber()) {
            return Optional.of(timestamp.doubleValue() / 1_000_000d);
        }
        if (timestamp.isTextual()) {
            try {
                return Optional.of(Long.parseLong(timestamp.asText().trim()) / 1_000_000d);
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
    
    private static JsonNode parseRecord(final String rawLine) throws GelfException {
        JsonNode record;
        try {
            record = MAPPER.readTree(rawLine);
        } catch (JsonProcessingException e) {
            throw new GelfException(ErrorKind.PARSING_FAILURE, e.getOriginalMessage(), e);
        }
        if (null == record || !record.isObject()) {
            throw new GelfException(ErrorKind.PARSING_FAILURE, "record is not a JSON object");
        }
        return record;
    }
    
    private static String asText(final JsonNode node) {
        return node.isTextual() ? node.asText() : node.toString();
    }
}
