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
 * A complete configuration document: the startup-only part plus
 * the part that can be hot reloaded.
 */
public final class Jctl2GelfConfig {
    private final GlobalConfig global;
    private final WatchedConfig watched;
    
    public Jctl2GelfConfig(final GlobalConfig global, final WatchedConfig watched) {
        this.global = Objects.requireNonNull(global, "global is Null");
        this.watched = Objects.requireNonNull(watched, "watched is Null");
    }
    
    public GlobalConfig getGlobal() {
        return global;
    }
    
    public WatchedConfig getWatched() {
        return watched;
    }
}
