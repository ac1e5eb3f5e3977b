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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pavlovmedia.oss.jctl2gelf.impl.external.ThreadPoolUtils;
import com.pavlovmedia.oss.jctl2gelf.lib.GelfException;
import com.pavlovmedia.oss.jctl2gelf.lib.GelfException.ErrorKind;

/**
 * Follows the systemd journal through a <code>journalctl</code> subprocess.
 * 
 * The journal never ends on its own, so the end of its output means the
 * subprocess died. Standard error is drained in the background while it
 * runs, and the last lines of it become the failure message.
 * 
 * @author Shawn Dempsay
 *
 */
public class JournalLineSource implements LineSource {
    private static final Logger log = LoggerFactory.getLogger(JournalLineSource.class);
    
    public static final List<String> JOURNALCTL = Arrays.asList("journalctl", "-o", "json", "-f");
    
    /** Lines of standard error kept for the failure message */
    static final int STDERR_TAIL = 20;
    
    private static final long EXIT_WAIT_MILLIS = 2_000;
    private static final AtomicInteger drainerCount = new AtomicInteger(0);
    
    private final Process process;
    private final BufferedReader stdout;
    private final Deque<String> stderrTail = new ArrayDeque<>();
    private final Thread stderrDrainer;
    
    JournalLineSource(final Process process) {
        this.process = Objects.requireNonNull(process, "process is Null");
        this.stdout = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        this.stderrDrainer = ThreadPoolUtils.getDaemonThreadFactory("journalctl-stderr", drainerCount,
                (t, e) -> log.error("{} failed", t.getName(), e))
            .newThread(this::drainStderr);
        this.stderrDrainer.start();
    }
    
    /**
     * Spawns <code>journalctl -o json -f</code>
     * @throws GelfException INTERNAL_FAILURE off Linux, IO_FAILURE if the process cannot be started
     */
    public static JournalLineSource start() throws GelfException {
        return start(JOURNALCTL);
    }
    
    static JournalLineSource start(final List<String> command) throws GelfException {
        if (!isPlatformSupported()) {
            throw new GelfException(ErrorKind.INTERNAL_FAILURE, 
                    "operating system currently unsupported: " + System.getProperty("os.name"));
        }
        try {
            log.debug("starting {}", String.join(" ", command));
            return new JournalLineSource(new ProcessBuilder(command).start());
        } catch (IOException e) {
            throw GelfException.fromIo(e);
        }
    }
    
    public static boolean isPlatformSupported() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("linux");
    }
    
    /**
     * Blank lines are passed through, only the end of the output is a failure.
     */
    @Override
    public Optional<String> nextLine() throws GelfException {
        String line;
        try {
            line = stdout.readLine();
        } catch (IOException e) {
            throw GelfException.fromIo(e);
        }
        
        if (null == line) {
            throw new GelfException(ErrorKind.INTERNAL_FAILURE, readError());
        }
        return Optional.of(line);
    }
    
    private void drainStderr() {
        try (BufferedReader stderr = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while (null != (line = stderr.readLine())) {
                log.trace("journalctl: {}", line);
                synchronized (stderrTail) {
                    if (stderrTail.size() == STDERR_TAIL) {
                        stderrTail.removeFirst();
                    }
                    stderrTail.addLast(line);
                }
            }
        } catch (IOException e) {
            if (process.isAlive()) {
                throw new UncheckedIOException(e);
            }
        }
    }
    
    /**
     * Gives the dead process a moment to finish writing standard error.
     */
    private String readError() {
        try {
            if (process.waitFor(EXIT_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                stderrDrainer.join(EXIT_WAIT_MILLIS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        
        String message;
        synchronized (stderrTail) {
            message = String.join("\n", stderrTail).trim();
        }
        return message.isEmpty() ? "journalctl output closed" : message;
    }
    
    @Override
    public void close() throws IOException {
        process.destroy();
        stdout.close();
    }
    
    @Override
    public String toString() {
        return "journalctl";
    }
}
