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
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import com.pavlovmedia.oss.jctl2gelf.lib.GelfException;

/**
 * Reads records from a stream, standard input unless told otherwise,
 * until end of input.
 */
public class StdinLineSource implements LineSource {
    private final BufferedReader reader;
    
    public StdinLineSource() {
        this(System.in);
    }
    
    public StdinLineSource(final InputStream in) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }
    
    @Override
    public Optional<String> nextLine() throws GelfException {
        try {
            return Optional.ofNullable(reader.readLine());
        } catch (IOException e) {
            throw GelfException.fromIo(e);
        }
    }
    
    @Override
    public void close() throws IOException {
        reader.close();
    }
    
    @Override
    public String toString() {
        return "stdin";
    }
}
