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
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Hands configuration from the file watcher to the ingestion loop.
 * 
 * The watcher is the only writer and the loop the only reader. The value is
 * guarded by a lock that is only held long enough to swap or copy it, and a
 * change flag tells the loop that a new value is there. The flag is a polling
 * signal, nobody ever waits on it.
 * 
 * @author Shawn Dempsay
 *
 */
public final class SharedConfig {
    private final GlobalConfig global;
    
    private final Object configLock = new Object();
    private WatchedConfig watched;
    
    private final AtomicBoolean changed = new AtomicBoolean(false);
    
    public SharedConfig(final Jctl2GelfConfig config) {
        this.global = config.getGlobal();
        this.watched = config.getWatched().copy();
    }
    
    public GlobalConfig getGlobal() {
        return global;
    }
    
    /**
     * @return a private copy of the current watched value
     */
    public WatchedConfig snapshot() {
        synchronized (configLock) {
            return watched.copy();
        }
    }
    
    /**
     * Replaces the watched value and raises the change flag
     */
    public void replace(final WatchedConfig newer) {
        Objects.requireNonNull(newer, "newer is Null");
        WatchedConfig copy = newer.copy();
        synchronized (configLock) {
            watched = copy;
        }
        changed.set(true);
    }
    
    public boolean hasChanged() {
        return changed.get();
    }
    
    /**
     * Non-blocking check for a new value. When the flag is raised this
     * returns a copy of the current value and lowers the flag.
     */
    public Optional<WatchedConfig> pollChange() {
        // Lower first, a replace that lands after this raises it again
        if (!changed.compareAndSet(true, false)) {
            return Optional.empty();
        }
        return Optional.of(snapshot());
    }
}
