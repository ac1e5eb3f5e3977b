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

import java.io.IOException;

/**
 * The single failure type of the GELF pipeline. The {@link ErrorKind}
 * tells the caller whether the failure is an expected outcome (a record
 * was filtered) or something worth reporting.
 * 
 * @author Shawn Dempsay
 *
 */
public class GelfException extends Exception {
    private static final long serialVersionUID = 1L;

    public enum ErrorKind {
        IO_FAILURE("IO"),
        PARSING_FAILURE("JSON parsing"),
        INSUFFICIENT_LOG_LEVEL("Filtered"),
        NO_MESSAGE("No message"),
        INTERNAL_FAILURE("Internal"),
        COMPRESSION_FAILURE("Compression");
        
        private final String label;
        
        ErrorKind(final String label) {
            this.label = label;
        }
    }
    
    private final ErrorKind kind;
    
    public GelfException(final ErrorKind kind, final String message) {
        super(String.format("[%s] %s", kind.label, message));
        this.kind = kind;
    }
    
    public GelfException(final ErrorKind kind, final String message, final Throwable cause) {
        super(String.format("[%s] %s", kind.label, message), cause);
        this.kind = kind;
    }
    
    public ErrorKind getKind() {
        return kind;
    }
    
    public static GelfException insufficientLevel() {
        return new GelfException(ErrorKind.INSUFFICIENT_LOG_LEVEL, "insufficient log level");
    }
    
    public static GelfException noMessage() {
        return new GelfException(ErrorKind.NO_MESSAGE, "no message found");
    }
    
    public static GelfException fromIo(final IOException e) {
        return new GelfException(ErrorKind.IO_FAILURE, e.getMessage(), e);
    }
}
