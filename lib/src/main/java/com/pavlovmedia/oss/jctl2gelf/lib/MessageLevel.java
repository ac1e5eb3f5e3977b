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
 * Severity an application writes into its own log text, like
 * <code>level=error</code>. Ordered from the most to the least severe.
 * This never goes on the wire, it is only used for filtering.
 */
public enum MessageLevel {
    FATAL,
    PANIC,
    ERROR,
    WARNING,
    INFO,
    DEBUG;
    
    /**
     * Lenient mapping used for words found in log text, unknown
     * words fall through to debug.
     */
    public static MessageLevel fromWord(final String word) {
        return fromName(word).orElse(DEBUG);
    }
    
    /**
     * Strict mapping used for configuration values
     * @return the level or an empty Optional if the name is unknown
     */
    public static Optional<MessageLevel> fromName(final String name) {
        if (null == name) {
            return Optional.empty();
        }
        String upper = name.trim().toUpperCase(Locale.ROOT);
        for (MessageLevel level : values()) {
            if (level.name().equals(upper)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
    
    /**
     * True if this level is less severe than the given threshold
     */
    public boolean isBelow(final MessageLevel threshold) {
        return ordinal() > threshold.ordinal();
    }
    
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
