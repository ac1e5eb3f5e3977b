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

import java.util.Locale;
import java.util.Optional;

/**
 * Where log records are read from
 */
public enum LogSource {
    STDIN("stdin"),
    JOURNAL("journal");
    
    private final String label;
    
    LogSource(final String label) {
        this.label = label;
    }
    
    public static Optional<LogSource> fromName(final String name) {
        if (null == name) {
            return Optional.empty();
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        for (LogSource source : values()) {
            if (source.label.equals(lower)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }
    
    @Override
    public String toString() {
        return label;
    }
}
