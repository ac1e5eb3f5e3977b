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
import java.util.Optional;

import com.pavlovmedia.oss.jctl2gelf.lib.GelfException;

/**
 * A blocking source of log lines, one JSON record per line
 */
public interface LineSource extends Closeable {
    /**
     * Blocks until the next line is available
     * @return the line, or an empty Optional once the input has ended
     * @throws GelfException if the source failed and no more lines will come
     */
    Optional<String> nextLine() throws GelfException;
}
