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

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pavlovmedia.oss.jctl2gelf.lib.GelfException;

/**
 * Background loop that reloads the configuration file when it is written.
 * 
 * Events are coalesced: after the first write the watcher waits until the
 * file has been quiet for the debounce window before it reads the file,
 * so an editor's partial writes become a single reload. A file that fails to
 * parse, or that was removed, leaves the last good configuration in place.
 * 
 * @author Shawn Dempsay
 *
 */
public final class ConfigWatcher implements Runnable, Closeable {
    private static final Logger log = LoggerFactory.getLogger(ConfigWatcher.class);
    
    public static final Duration DEBOUNCE_DEFAULT = Duration.ofSeconds(2);
    
    private final Path file;
    private final SharedConfig shared;
    private final long debounceMillis;
    private final WatchService watchService;
    private final AtomicBoolean running = new AtomicBoolean(true);
    
    /**
     * Registers the watch on the file's directory. Nothing is reloaded
     * until {@link #run()} is called.
     * 
     * @throws IOException if the directory cannot be watched
     */
    public ConfigWatcher(final Path file, final SharedConfig shared, final Duration debounce) throws IOException {
        this.file = Objects.requireNonNull(file, "file is Null").toAbsolutePath();
        this.shared = Objects.requireNonNull(shared, "shared is Null");
        this.debounceMillis = debounce.toMillis();
        
        Path directory = this.file.getParent();
        this.watchService = directory.getFileSystem().newWatchService();
        directory.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
    }
    
    public ConfigWatcher(final Path file, final SharedConfig shared) throws IOException {
        this(file, shared, DEBOUNCE_DEFAULT);
    }
    
    @Override
    public void run() {
        log.debug("watching {} for changes", file);
        try {
            while (running.get()) {
                if (!drain(watchService.take())) {
                    continue;
                }
                
                awaitQuiet();
                reload();
            }
        } catch (ClosedWatchServiceException e) {
            log.debug("config watcher closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("config watcher interrupted");
        } catch (IllegalStateException e) {
            log.error("config watcher stopped, changes to {} will not be picked up: {}", file, e.getMessage());
        }
    }
    
    /**
     * Blocks until the configuration file has gone a full debounce window
     * without an event. Events for other files in the directory do not
     * restart the window.
     */
    private void awaitQuiet() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(debounceMillis);
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            WatchKey next = watchService.poll(remaining, TimeUnit.NANOSECONDS);
            if (null == next) {
                return;
            }
            if (drain(next)) {
                deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(debounceMillis);
            }
        }
    }
    
    /**
     * Reads the file and publishes the watched part. On any failure the
     * shared value is left untouched.
     * 
     * @return true if a new value was published
     */
    boolean reload() {
        if (!Files.isRegularFile(file)) {
            log.warn("config file {} was removed or moved, keeping the last good configuration", file);
            return false;
        }
        
        Jctl2GelfConfig config;
        try {
            config = ConfigParser.parse(file);
        } catch (GelfException e) {
            log.error("config reload failed, keeping the last good configuration: {}", e.getMessage());
            return false;
        }
        
        if (!config.getGlobal().equals(shared.getGlobal())) {
            log.warn("changes to the [global] section only take effect after a restart");
        }
        shared.replace(config.getWatched());
        log.info("configuration reloaded from {}", file);
        return true;
    }
    
    /**
     * Consumes the events of a key.
     * @return true if any event concerns the configuration file
     */
    private boolean drain(final WatchKey key) {
        boolean relevant = false;
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == OVERFLOW) {
                relevant = true;
            } else if (file.getFileName().equals(event.context())) {
                relevant = true;
                if (event.kind() == ENTRY_DELETE) {
                    log.warn("config file {} was deleted", file);
                }
            }
        }
        if (!key.reset()) {
            throw new IllegalStateException("directory " + file.getParent() + " is no longer accessible");
        }
        return relevant;
    }
    
    @Override
    public void close() throws IOException {
        running.set(false);
        watchService.close();
    }
}
