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

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pavlovmedia.oss.jctl2gelf.lib.MessageCompression;
import com.pavlovmedia.oss.jctl2gelf.lib.MessageLevel;
import com.pavlovmedia.oss.jctl2gelf.lib.SystemLevel;

/**
 * The part of the configuration that can be changed while the process
 * runs by editing the configuration file.
 * 
 * The ingestion loop keeps its own private instance and pulls changes into
 * it with {@link #updateFrom(WatchedConfig)}. Not thread safe, use
 * {@link #copy()} to hand it across threads.
 * 
 * @author Shawn Dempsay
 *
 */
public final class WatchedConfig {
    private static final Logger log = LoggerFactory.getLogger(WatchedConfig.class);
    
    private String graylogAddr;
    private MessageCompression compression = MessageCompression.getDefault();
    private String team;
    private String service;
    private SystemLevel logLevelSystem = SystemLevel.INFORMATIONAL;
    private MessageLevel logLevelMessage;
    
    public WatchedConfig(final String graylogAddr) {
        this.graylogAddr = Objects.requireNonNull(graylogAddr, "graylogAddr is Null");
    }
    
    public WatchedConfig copy() {
        WatchedConfig ret = new WatchedConfig(graylogAddr);
        ret.compression = compression;
        ret.team = team;
        ret.service = service;
        ret.logLevelSystem = logLevelSystem;
        ret.logLevelMessage = logLevelMessage;
        return ret;
    }
    
    /**
     * Copies every field that differs in the newer value into this one,
     * logging each change.
     * 
     * @return true if anything changed
     */
    public boolean updateFrom(final WatchedConfig newer) {
        boolean changed = false;
        if (!graylogAddr.equals(newer.graylogAddr)) {
            log.info("config change: graylog_addr {} -> {}", graylogAddr, newer.graylogAddr);
            graylogAddr = newer.graylogAddr;
            changed = true;
        }
        if (compression != newer.compression) {
            log.info("config change: compression {} -> {}", compression, newer.compression);
            compression = newer.compression;
            changed = true;
        }
        if (!Objects.equals(team, newer.team)) {
            log.info("config change: team {} -> {}", team, newer.team);
            team = newer.team;
            changed = true;
        }
        if (!Objects.equals(service, newer.service)) {
            log.info("config change: service {} -> {}", service, newer.service);
            service = newer.service;
            changed = true;
        }
        if (logLevelSystem != newer.logLevelSystem) {
            log.info("config change: log_level_system {} -> {}", logLevelSystem, newer.logLevelSystem);
            logLevelSystem = newer.logLevelSystem;
            changed = true;
        }
        if (logLevelMessage != newer.logLevelMessage) {
            log.info("config change: log_level_message {} -> {}", logLevelMessage, newer.logLevelMessage);
            logLevelMessage = newer.logLevelMessage;
            changed = true;
        }
        return changed;
    }
    
    /**
     * @return the collector as host:port
     */
    public String getGraylogAddr() {
        return graylogAddr;
    }
    
    public WatchedConfig setGraylogAddr(final String graylogAddr) {
        this.graylogAddr = Objects.requireNonNull(graylogAddr, "graylogAddr is Null");
        return this;
    }
    
    public MessageCompression getCompression() {
        return compression;
    }
    
    public WatchedConfig setCompression(final MessageCompression compression) {
        this.compression = Objects.requireNonNull(compression, "compression is Null");
        return this;
    }
    
    public Optional<String> getTeam() {
        return Optional.ofNullable(team);
    }
    
    public WatchedConfig setTeam(final String team) {
        this.team = team;
        return this;
    }
    
    public Optional<String> getService() {
        return Optional.ofNullable(service);
    }
    
    public WatchedConfig setService(final String service) {
        this.service = service;
        return this;
    }
    
    public SystemLevel getLogLevelSystem() {
        return logLevelSystem;
    }
    
    public WatchedConfig setLogLevelSystem(final SystemLevel logLevelSystem) {
        this.logLevelSystem = Objects.requireNonNull(logLevelSystem, "logLevelSystem is Null");
        return this;
    }
    
    public Optional<MessageLevel> getLogLevelMessage() {
        return Optional.ofNullable(logLevelMessage);
    }
    
    public WatchedConfig setLogLevelMessage(final MessageLevel logLevelMessage) {
        this.logLevelMessage = logLevelMessage;
        return this;
    }
    
    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WatchedConfig)) {
            return false;
        }
        WatchedConfig other = (WatchedConfig) o;
        return graylogAddr.equals(other.graylogAddr)
                && compression == other.compression
                && Objects.equals(team, other.team)
                && Objects.equals(service, other.service)
                && logLevelSystem == other.logLevelSystem
                && logLevelMessage == other.logLevelMessage;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(graylogAddr, compression, team, service, logLevelSystem, logLevelMessage);
    }
    
    @Override
    public String toString() {
        return String.format("WatchedConfig[addr=%s, compression=%s, team=%s, service=%s, system=%s, message=%s]",
                graylogAddr, compression, team, service, logLevelSystem, logLevelMessage);
    }
}
