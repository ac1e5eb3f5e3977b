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
package com.pavlovmedia.oss.jctl2gelf.impl.config;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.pavlovmedia.oss.jctl2gelf.impl.GelfUdpTransporter;
import com.pavlovmedia.oss.jctl2gelf.impl.external.ConfigValueHelper;
import com.pavlovmedia.oss.jctl2gelf.impl.external.ExceptionConsumer;
import com.pavlovmedia.oss.jctl2gelf.lib.GelfException;
import com.pavlovmedia.oss.jctl2gelf.lib.GelfException.ErrorKind;
import com.pavlovmedia.oss.jctl2gelf.lib.MessageCompression;
import com.pavlovmedia.oss.jctl2gelf.lib.MessageLevel;
import com.pavlovmedia.oss.jctl2gelf.lib.SystemLevel;

/**
 * Reads the TOML configuration file. Watched keys live at the top level,
 * the startup-only ones in a <code>[global]</code> table:
 * <pre>
 * graylog_addr = "graylog.example.com:12201"
 * compression = "gzip"
 * team = "platform"
 * service = "billing"
 * log_level_system = "informational"
 * log_level_message = "error"
 *
 * [global]
 * log_source = "journal"
 * sender_port = 5000
 * </pre>
 * Every field is validated before failing, so one error message
 * lists all the problems in the file.
 * 
 * @author Shawn Dempsay
 *
 */
public final class ConfigParser {
    static final String GLOBAL = "global";
    static final String LOG_SOURCE = "log_source";
    static final String SENDER_PORT = "sender_port";
    
    static final String GRAYLOG_ADDR = "graylog_addr";
    static final String COMPRESSION = "compression";
    static final String TEAM = "team";
    static final String SERVICE = "service";
    static final String LOG_LEVEL_SYSTEM = "log_level_system";
    static final String LOG_LEVEL_MESSAGE = "log_level_message";
    
    /** Maximum length in bytes for team or service names */
    static final int MAX_NAME_LEN = 2048;
    
    private static final TomlMapper MAPPER = new TomlMapper();
    private static final TypeReference<Map<String,Object>> DOCUMENT = new TypeReference<Map<String,Object>>() { };
    
    private ConfigParser() { }
    
    /**
     * Reads and validates a configuration file
     * @throws GelfException IO_FAILURE if the file cannot be read, PARSING_FAILURE if it is invalid
     */
    public static Jctl2GelfConfig parse(final Path path) throws GelfException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new GelfException(ErrorKind.IO_FAILURE, 
                    String.format("cannot read %s: %s", path, e.getMessage()), e);
        }
    }
    
    public static Jctl2GelfConfig parse(final String document) throws GelfException {
        try {
            return parse(new StringReader(document));
        } catch (IOException e) {
            throw new GelfException(ErrorKind.IO_FAILURE, e.getMessage(), e);
        }
    }
    
    private static Jctl2GelfConfig parse(final Reader reader) throws GelfException, IOException {
        Map<String,Object> document;
        try {
            document = MAPPER.readValue(reader, DOCUMENT);
        } catch (JsonProcessingException e) {
            throw new GelfException(ErrorKind.PARSING_FAILURE, e.getOriginalMessage(), e);
        }
        return fromDocument(new ConfigValueHelper(document));
    }
    
    static Jctl2GelfConfig fromDocument(final ConfigValueHelper helper) throws GelfException {
        ExceptionConsumer errors = new ExceptionConsumer();
        
        GlobalConfig global = readGlobal(helper.getTable(GLOBAL), errors);
        WatchedConfig watched = readWatched(helper, errors);
        
        errors.andThrow(msg -> new GelfException(ErrorKind.PARSING_FAILURE, "invalid configuration: " + msg));
        return new Jctl2GelfConfig(global, watched);
    }
    
    private static GlobalConfig readGlobal(final ConfigValueHelper helper, final ExceptionConsumer errors) {
        LogSource source = LogSource.STDIN;
        try {
            Optional<LogSource> oSource = helper.getNamed(LOG_SOURCE, LogSource::fromName);
            if (oSource.isPresent()) {
                source = oSource.get();
            } else {
                errors.onError(new IllegalArgumentException(GLOBAL + "." + LOG_SOURCE + ": required"));
            }
        } catch (IllegalArgumentException e) {
            errors.onError(new IllegalArgumentException(GLOBAL + "." + e.getMessage()));
        }
        
        int port = GlobalConfig.SENDER_PORT_DEFAULT;
        try {
            port = helper.getInteger(SENDER_PORT).orElse(GlobalConfig.SENDER_PORT_DEFAULT);
            if (port < 0 || port > 0xffff) {
                errors.onError(new IllegalArgumentException(
                        String.format("%s.%s: %d is not a valid port", GLOBAL, SENDER_PORT, port)));
            }
        } catch (NumberFormatException e) {
            errors.onError(new IllegalArgumentException(
                    String.format("%s.%s: not a number", GLOBAL, SENDER_PORT)));
        }
        return new GlobalConfig(source, port);
    }
    
    private static WatchedConfig readWatched(final ConfigValueHelper helper, final ExceptionConsumer errors) {
        WatchedConfig watched = new WatchedConfig(helper.getString(GRAYLOG_ADDR).orElse(""));
        
        if (!helper.contains(GRAYLOG_ADDR)) {
            errors.onError(new IllegalArgumentException(GRAYLOG_ADDR + ": required"));
        } else {
            errors.attempt(() -> GelfUdpTransporter.parseTarget(watched.getGraylogAddr()));
        }
        
        errors.attempt(() -> helper.getNamed(COMPRESSION, MessageCompression::fromName)
                .ifPresent(watched::setCompression));
        errors.attempt(() -> helper.getNamed(LOG_LEVEL_SYSTEM, SystemLevel::fromName)
                .ifPresent(watched::setLogLevelSystem));
        errors.attempt(() -> helper.getNamed(LOG_LEVEL_MESSAGE, MessageLevel::fromName)
                .ifPresent(watched::setLogLevelMessage));
        
        errors.attempt(() -> watched.setTeam(readName(helper, TEAM).orElse(null)));
        errors.attempt(() -> watched.setService(readName(helper, SERVICE).orElse(null)));
        return watched;
    }
    
    private static Optional<String> readName(final ConfigValueHelper helper, final String propertyName) {
        Optional<String> name = helper.getString(propertyName);
        if (name.isPresent() && name.get().getBytes(StandardCharsets.UTF_8).length > MAX_NAME_LEN) {
            throw new IllegalArgumentException(String.format("%s: longer than %d bytes", propertyName, MAX_NAME_LEN));
        }
        return name;
    }
}
