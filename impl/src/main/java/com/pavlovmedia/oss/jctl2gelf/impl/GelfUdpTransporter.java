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

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.Optional;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pavlovmedia.oss.jctl2gelf.lib.ChunkedMessage;
import com.pavlovmedia.oss.jctl2gelf.lib.IGelfTransporter;

/**
 * Sends GELF datagrams over UDP. The local socket is bound once; the
 * target is resolved again on every send so address changes in the
 * configuration (or in DNS) apply to the next message.
 * 
 * Fire and forget: there is no ack and nothing is retried.
 * 
 * @author Shawn Dempsay
 *
 */
public class GelfUdpTransporter implements IGelfTransporter {
    private static final Logger log = LoggerFactory.getLogger(GelfUdpTransporter.class);
    
    private final int localPort;
    
    private final Object socketLock = new Object();
    private Optional<DatagramSocket> transport = Optional.empty();
    
    /**
     * @param localPort the port to send from, 0 for an ephemeral one
     */
    public GelfUdpTransporter(final int localPort) {
        this.localPort = localPort;
    }
    
    @Override
    public void open() throws SocketException {
        synchronized (socketLock) {
            if (!transport.isPresent()) {
                DatagramSocket socket = new DatagramSocket(new InetSocketAddress(localPort));
                transport = Optional.of(socket);
                log.debug("GELF sender bound to {}", socket.getLocalSocketAddress());
            }
        }
    }
    
    /**
     * @return the bound local port, or -1 when not open
     */
    public int getLocalPort() {
        synchronized (socketLock) {
            return transport.map(DatagramSocket::getLocalPort).orElse(-1);
        }
    }
    
    @Override
    public void sendGelfMessage(final ChunkedMessage message, final String target) {
        sendGelfMessage(message, target, e -> { });
    }
    
    @Override
    public void sendGelfMessage(final ChunkedMessage message, final String target,
            final Consumer<IOException> onException) {
        DatagramSocket socket;
        synchronized (socketLock) {
            if (!transport.isPresent()) {
                onException.accept(new SocketException("GELF sender is not open"));
                return;
            }
            socket = transport.get();
        }
        
        InetSocketAddress address;
        try {
            address = resolveTarget(target);
        } catch (UnknownHostException e) {
            onException.accept(e);
            return;
        }
        
        for (byte[] chunk : message) {
            try {
                socket.send(new DatagramPacket(chunk, chunk.length, address));
            } catch (IOException e) {
                onException.accept(e);
            }
        }
    }
    
    @Override
    public void close() {
        synchronized (socketLock) {
            transport.ifPresent(socket -> {
                log.debug("Shutting down GELF sender");
                socket.close();
            });
            transport = Optional.empty();
        }
    }
    
    /**
     * Resolves a host:port target
     * @throws UnknownHostException if the host does not resolve
     */
    public static InetSocketAddress resolveTarget(final String target) throws UnknownHostException {
        InetSocketAddress unresolved;
        try {
            unresolved = parseTarget(target);
        } catch (IllegalArgumentException e) {
            throw new UnknownHostException(e.getMessage());
        }
        InetSocketAddress resolved = new InetSocketAddress(unresolved.getHostString(), unresolved.getPort());
        if (resolved.isUnresolved()) {
            throw new UnknownHostException("Cannot resolve " + target);
        }
        return resolved;
    }
    
    /**
     * Splits a host:port target without resolving it. IPv6 literals
     * go in brackets, like <code>[::1]:12201</code>.
     * 
     * @throws IllegalArgumentException if the target is malformed
     */
    public static InetSocketAddress parseTarget(final String target) {
        if (null == target || target.trim().isEmpty()) {
            throw new IllegalArgumentException("graylog_addr: empty address");
        }
        String trimmed = target.trim();
        int colon = trimmed.lastIndexOf(':');
        if (colon <= 0 || colon == trimmed.length() - 1) {
            throw new IllegalArgumentException(String.format("graylog_addr: '%s' is not host:port", target));
        }
        
        String host = trimmed.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        } else if (host.indexOf(':') >= 0) {
            throw new IllegalArgumentException(String.format("graylog_addr: IPv6 address '%s' needs brackets", target));
        }
        
        int port;
        try {
            port = Integer.parseInt(trimmed.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("graylog_addr: bad port in '%s'", target));
        }
        if (host.isEmpty() || port < 1 || port > 0xffff) {
            throw new IllegalArgumentException(String.format("graylog_addr: '%s' is not host:port", target));
        }
        return InetSocketAddress.createUnresolved(host, port);
    }
}
