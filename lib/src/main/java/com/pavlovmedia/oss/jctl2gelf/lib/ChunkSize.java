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

/**
 * Datagram size classes for GELF over UDP. The sizes include the
 * 12 byte chunk header.
 */
public enum ChunkSize {
    /** Safe on paths with a reduced MTU */
    WAN(1420),
    /** Jumbo-ish, for local networks */
    LAN(8154);
    
    private final int size;
    
    ChunkSize(final int size) {
        this.size = size;
    }
    
    public int getSize() {
        return size;
    }
    
    /**
     * @return how many payload bytes fit in one chunk
     */
    public int getBodySize() {
        return size - ChunkedMessage.HEADER_SIZE;
    }
}
