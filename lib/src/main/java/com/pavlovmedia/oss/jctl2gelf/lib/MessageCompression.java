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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Locale;
import java.util.Optional;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPOutputStream;

import com.pavlovmedia.oss.jctl2gelf.lib.GelfException.ErrorKind;

/**
 * The compression algorithms a GELF input understands
 * 
 * @author Shawn Dempsay
 *
 */
public enum MessageCompression {
    NONE,
    GZIP,
    ZLIB;
    
    public static MessageCompression getDefault() {
        return GZIP;
    }
    
    /**
     * @param name one of none, gzip or zlib, case is ignored
     * @return the algorithm, or an empty Optional for an unknown name
     */
    public static Optional<MessageCompression> fromName(final String name) {
        if (null == name) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
    
    /**
     * Serializes the message and compresses it with this algorithm
     * 
     * @param message the message to encode
     * @return the bytes that go into the datagram(s)
     * @throws GelfException if serialization or compression fails
     */
    public byte[] compress(final WireMessage message) throws GelfException {
        byte[] json = message.toGelfBytes();
        if (this == NONE) {
            return json;
        }
        
        ByteArrayOutputStream bos = new ByteArrayOutputStream(json.length);
        try (OutputStream os = wrap(bos)) {
            os.write(json);
        } catch (IOException e) {
            throw new GelfException(ErrorKind.COMPRESSION_FAILURE, 
                    String.format("%s failed: %s", this, e.getMessage()), e);
        }
        return bos.toByteArray();
    }
    
    private OutputStream wrap(final OutputStream os) throws IOException {
        switch (this) {
        case GZIP:
            return new GZIPOutputStream(os);
        case ZLIB:
            return new DeflaterOutputStream(os);
        default:
            return os;
        }
    }
    
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
