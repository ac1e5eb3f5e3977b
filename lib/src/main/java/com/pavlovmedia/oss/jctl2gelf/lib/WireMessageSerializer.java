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

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

/**
 * A serializer module for Jackson that will turn our WireMessage
 * into GELF 1.1 JSON.
 * 
 * @author Shawn Dempsay
 *
 */
public class WireMessageSerializer extends JsonSerializer<WireMessage> {
    private static final String TRIMMED = "\" ";

    @Override
    public void serialize(final WireMessage value, final JsonGenerator jgen,
            final SerializerProvider provider) throws IOException {
        GelfMessage message = value.getMessage();
        
        jgen.writeStartObject();
        jgen.writeStringField("version", WireMessage.GELF_VERSION);
        jgen.writeStringField("host", trim(message.getHost()));
        jgen.writeStringField("short_message", trim(message.getShortMessage()));
        jgen.writeNumberField("level", message.getLevel().getCode());
        
        if (message.getFullMessage().isPresent()) {
            jgen.writeStringField("full_message", message.getFullMessage().get());
        }
        
        // Stamped here, not when the message was built
        jgen.writeNumberField("timestamp", message.getTimestamp().orElseGet(WireMessageSerializer::now));
        
        if (value.getTeam().isPresent()) {
            jgen.writeStringField("team", value.getTeam().get());
        }
        if (value.getService().isPresent()) {
            jgen.writeStringField("service", value.getService().get());
        }
        
        for (Map.Entry<String,JsonNode> entry : message.getAllMetadata().entrySet()) {
            jgen.writeFieldName("_" + entry.getKey());
            jgen.writeTree(entry.getValue());
        }
        jgen.writeEndObject();
    }
    
    /**
     * @return seconds since the epoch with sub-second precision
     */
    static double now() {
        Instant instant = Instant.now();
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000d;
    }
    
    /**
     * Strips wrapping quote and space characters
     */
    static String trim(final String s) {
        int start = 0;
        int end = s.length();
        while (start < end && TRIMMED.indexOf(s.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && TRIMMED.indexOf(s.charAt(end - 1)) >= 0) {
            end--;
        }
        return s.substring(start, end);
    }
}
