/*
 * Copyright (c) 2026, RapidBench contributors.
 * All rights reserved.
 *
 * This file is part of RapidBench.
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
 *
 */

package com.rapidbench.bench;

/**
 * Thrown when circuit text is malformed. The message names the source and the
 * line, and the offending token where there is one.
 */
public class BenchParseException extends RuntimeException {

    private final String source;
    private final int line;
    private final String token;

    public BenchParseException(String source, int line, String token, String message) {
        super(format(source, line, token, message));
        this.source = source;
        this.line = line;
        this.token = token;
    }

    public BenchParseException(String source, int line, String message) {
        this(source, line, null, message);
    }

    public BenchParseException(String source, BenchToken token, String message) {
        this(source, token.line, token.text, message);
    }

    private static String format(String source, int line, String token, String message) {
        StringBuilder sb = new StringBuilder("ERROR: ");
        sb.append(source).append(':').append(line).append(": ").append(message);
        if (token != null) {
            sb.append(" (token '").append(token).append("')");
        }
        return sb.toString();
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    /**
     * @return The offending token, or null if the error is not tied to one.
     */
    public String getToken() {
        return token;
    }
}
