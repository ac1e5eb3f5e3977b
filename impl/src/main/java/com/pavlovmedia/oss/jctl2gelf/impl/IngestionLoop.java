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

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pavlovmedia.oss.jctl2gelf.impl.config.SharedConfig;
import com.pavlovmedia.oss.jctl2gelf.impl.config.WatchedConfig;
import com.pavlovmedia.oss.jctl2gelf.lib.ChunkSize;
import com.pavlovmedia.oss.jctl2gelf.lib.ChunkedMessage;
import com.pavlovmedia.oss.jctl2gelf.lib.GelfException;
import com.pavlovmedia.oss.jctl2gelf.lib.GelfException.ErrorKind;
import com.pavlovmedia.oss.jctl2gelf.lib.IGelfTransporter;

/**
 * The main read, transform, send loop.
 * 
 * Before every record the loop checks the shared configuration for a change
 * and merges it into its private copy, so a reload is picked up by the very
 * next record. Per-record failures are logged and skipped; only a failing
 * source or socket ends the loop.
 * 
 * @author Shawn Dempsay
 *
 */
public class IngestionLoop {
    private static final Logger log = LoggerFactory.getLogger(IngestionLoop.class);
    
    private final SharedConfig shared;
    private final LineSource source;
    private final IGelfTransporter transporter;
    private final WatchedConfig current;
    
    private final AtomicBoolean running = new AtomicBoolean(true);
    
    public IngestionLoop(final SharedConfig shared, final LineSource source, final IGelfTransporter transporter) {
        this.shared = Objects.requireNonNull(shared, "shared is Null");
        this.source = Objects.requireNonNull(source, "source is Null");
        this.transporter = Objects.requireNonNull(transporter, "transporter is Null");
        this.current = shared.snapshot();
    }
    
    /**
     * Runs until the source ends or {@link #stop()} is called.
     * 
     * @throws GelfException if the socket cannot be bound or the source fails
     */
    public void run() throws GelfException {
        try {
            transporter.open();
        } catch (IOException e) {
            throw new GelfException(ErrorKind.IO_FAILURE, 
                    String.format("cannot bind UDP port %d: %s", shared.getGlobal().getSenderPort(), e.getMessage()), e);
        }
        
        log.debug("start reading from {}", source);
        try {
            while (running.get()) {
                Optional<String> line = source.nextLine();
                if (!line.isPresent()) {
                    log.debug("{} reached end of input", source);
                    break;
                }
                applyPendingConfig();
                processRecord(line.get().trim());
            }
        } finally {
            transporter.close();
        }
    }
    
    /**
     * Asks the loop to end after the record it is working on. A loop
     * blocked on a read ends once the read returns.
     */
    public void stop() {
        running.set(false);
    }
    
    /**
     * @return the configuration the next record will be processed with
     */
    WatchedConfig getCurrentConfig() {
        return current;
    }
    
    void applyPendingConfig() {
        shared.pollChange().ifPresent(current::updateFrom);
    }
    
    void processRecord(final String line) {
        if (line.isEmpty()) {
            return;
        }
        
        ChunkedMessage chunked;
        try {
            chunked = GelfRecordTransformer.toWireMessage(line, current)
                    .toChunkedMessage(ChunkSize.WAN, current.getCompression());
        } catch (GelfException e) {
            report(e, line);
            return;
        }
        
        transporter.sendGelfMessage(chunked, current.getGraylogAddr(), 
                e -> log.error("sender failure to {}: {}", current.getGraylogAddr(), e.getMessage()));
    }
    
    private void report(final GelfException e, final String line) {
        switch (e.getKind()) {
        case INSUFFICIENT_LOG_LEVEL:
            // Filtering is the normal case, keep quiet
            break;
        case NO_MESSAGE:
            log.debug("no message field found");
            break;
        case PARSING_FAILURE:
            log.warn("parsing error: {}, message: {}", e.getMessage(), line);
            break;
        default:
            log.error("dropping record: {}", e.getMessage());
        }
    }
}
