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

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pavlovmedia.oss.jctl2gelf.impl.config.ConfigParser;
import com.pavlovmedia.oss.jctl2gelf.impl.config.ConfigWatcher;
import com.pavlovmedia.oss.jctl2gelf.impl.config.GlobalConfig;
import com.pavlovmedia.oss.jctl2gelf.impl.config.Jctl2GelfConfig;
import com.pavlovmedia.oss.jctl2gelf.impl.config.SharedConfig;
import com.pavlovmedia.oss.jctl2gelf.impl.external.ThreadPoolUtils;
import com.pavlovmedia.oss.jctl2gelf.lib.GelfException;

/**
 * Reads logs from stdin or the journal and sends them to Graylog.
 * 
 * Usage: <code>jctl2gelf [config.toml]</code>
 * 
 * @author Shawn Dempsay
 *
 */
public final class Jctl2Gelf {
    private static final Logger log = LoggerFactory.getLogger(Jctl2Gelf.class);
    
    static final String CONFIG_DEFAULT = "/etc/jctl2gelf/config.toml";
    
    private Jctl2Gelf() { }
    
    public static void main(final String[] args) {
        Path configPath = Paths.get(args.length > 0 ? args[0] : CONFIG_DEFAULT);
        System.exit(run(configPath));
    }
    
    /**
     * @return the process exit status
     */
    static int run(final Path configPath) {
        Jctl2GelfConfig config;
        try {
            config = ConfigParser.parse(configPath);
        } catch (GelfException e) {
            log.error("cannot load configuration: {}", e.getMessage());
            return 1;
        }
        
        SharedConfig shared = new SharedConfig(config);
        GlobalConfig global = shared.getGlobal();
        Optional<ConfigWatcher> watcher = startWatcher(configPath, shared);
        
        LineSource source;
        try {
            source = openSource(global);
        } catch (GelfException e) {
            log.error("{} processing stopped: {}", global.getLogSource(), e.getMessage());
            watcher.ifPresent(Jctl2Gelf::closeQuietly);
            return 1;
        }
        
        IngestionLoop loop = new IngestionLoop(shared, source, new GelfUdpTransporter(global.getSenderPort()));
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            loop.stop();
            watcher.ifPresent(Jctl2Gelf::closeQuietly);
        }, "jctl2gelf-shutdown"));
        
        try {
            loop.run();
            log.info("{} processing finished", global.getLogSource());
            return 0;
        } catch (GelfException e) {
            log.error("{} processing stopped: {}", global.getLogSource(), e.getMessage());
            return 1;
        } finally {
            watcher.ifPresent(Jctl2Gelf::closeQuietly);
            closeQuietly(source);
        }
    }
    
    private static LineSource openSource(final GlobalConfig global) throws GelfException {
        switch (global.getLogSource()) {
        case JOURNAL:
            return JournalLineSource.start();
        case STDIN:
        default:
            return new StdinLineSource();
        }
    }
    
    private static Optional<ConfigWatcher> startWatcher(final Path configPath, final SharedConfig shared) {
        try {
            ConfigWatcher watcher = new ConfigWatcher(configPath, shared);
            ThreadPoolUtils.getDaemonThreadFactory("jctl2gelf-config", new AtomicInteger(0),
                    (t, e) -> log.error("{} died: {}", t.getName(), e.getMessage(), e))
                .newThread(watcher)
                .start();
            return Optional.of(watcher);
        } catch (IOException e) {
            log.warn("cannot watch {}, configuration changes need a restart: {}", configPath, e.getMessage());
            return Optional.empty();
        }
    }
    
    private static void closeQuietly(final Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("close failed: {}", e.getMessage());
        }
    }
}
