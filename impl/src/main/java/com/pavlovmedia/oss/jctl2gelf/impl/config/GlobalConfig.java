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

/**
 * The part of the configuration that is read once at startup and never
 * changes while the process runs.
 */
public final class GlobalConfig {
    public static final int SENDER_PORT_DEFAULT = 5000;
    
    private final LogSource logSource;
    private final int senderPort;
    
    public GlobalConfig(final LogSource logSource, final int senderPort) {
        this.logSource = Objects.requireNonNull(logSource, "logSource is Null");
        this.senderPort = senderPort;
    }
    
    public LogSource getLogSource() {
        return logSource;
    }
    
    /**
     * @return local UDP port to send from, 0 for an ephemeral one
     */
    public int getSenderPort() {
        return senderPort;
    }
    
    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GlobalConfig)) {
            return false;
        }
        GlobalConfig other = (GlobalConfig) o;
        return logSource == other.logSource && senderPort == other.senderPort;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(logSource, senderPort);
    }
    
    @Override
    public String toString() {
        return String.format("GlobalConfig[source=%s, port=%d]", logSource, senderPort);
    }
}
