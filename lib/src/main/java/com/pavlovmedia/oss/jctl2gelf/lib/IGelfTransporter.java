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

import java.io.Closeable;
import java.io.IOException;
import java.util.function.Consumer;

/**
 * Something that puts GELF datagrams on the wire
 * 
 * @author shawn
 *
 */
public interface IGelfTransporter extends Closeable {
    /**
     * Binds the local end. Must be called once before sending.
     * @throws IOException if the local port cannot be bound
     */
    void open() throws IOException;
    
    /**
     * Sends every chunk of the message to the target.
     * @param target a host:port string, resolved on every call
     * @param onException called for each chunk that failed to go out
     */
    void sendGelfMessage(ChunkedMessage message, String target, Consumer<IOException> onException);
    
    void sendGelfMessage(ChunkedMessage message, String target);
    
    /**
     * Releases the local socket. Never fails.
     */
    @Override
    void close();
}
