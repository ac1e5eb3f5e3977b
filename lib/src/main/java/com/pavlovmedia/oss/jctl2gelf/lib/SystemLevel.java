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

import java.util.Locale;
import java.util.Optional;

/**
 * GELF's representation of a severity. The numeric codes are the
 * syslog severities from RFC 5424, so a smaller code is more severe.
 * 
 * @author Shawn Dempsay
 *
 */
public enum SystemLevel {
    EMERGENCY(0, "emergency"),
    ALERT(1, "alert"),
    CRITICAL(2, "critical"),
    ERROR(3, "error"),
    WARNING(4, "warning"),
    NOTICE(5, "notice"),
    INFORMATIONAL(6, "informational"),
    DEBUG(7, "debug");
    
    private final int code;
    private final String label;
    
    SystemLevel(final int code, final String label) {
        this.code = code;
        this.label = label;
    }
    
    /**
     * @return the syslog numeric code of this level
     */
    public int getCode() {
        return code;
    }
    
    /**
     * Maps a syslog numeric code onto a level. Anything past 7
     * is treated as debug.
     * @param code a syslog priority code, must not be negative
     * @return the matching level
     */
    public static SystemLevel fromCode(final int code) {
        if (code < 0) {
            throw new IllegalArgumentException("Negative syslog level " + code);
        }
        return code >= DEBUG.code ? DEBUG : values()[code];
    }
    
    /**
     * Finds a level by its configuration name, "info" is accepted
     * as a shorthand for informational.
     * @param name the level name, case is ignored
     * @return the level or an empty Optional if the name is unknown
     */
    public static Optional<SystemLevel> fromName(final String name) {
        if (null == name) {
            return Optional.empty();
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        if ("info".equals(lower)) {
            return Optional.of(INFORMATIONAL);
        }
        for (SystemLevel level : values()) {
            if (level.label.equals(lower)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
    
    /**
     * True if this level is less severe than the given threshold,
     * which means a record with it should be dropped.
     */
    public boolean isBelow(final SystemLevel threshold) {
        return code > threshold.code;
    }
    
    @Override
    public String toString() {
        return label;
    }
}
