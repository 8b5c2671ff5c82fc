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

import java.util.Objects;

/**
 * A token of circuit text with the line it was read from and the byte offset
 * of its first byte.
 */
public class BenchToken {
    public final String text;
    public final int line;
    public final long byteOffset;

    public BenchToken(String text, int line, long byteOffset) {
        this.text = Objects.requireNonNull(text);
        this.line = line;
        this.byteOffset = byteOffset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BenchToken benchToken = (BenchToken) o;
        return line == benchToken.line && byteOffset == benchToken.byteOffset && text.equals(benchToken.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, line, byteOffset);
    }

    @Override
    public String toString() {
        String displayText = text;
        if (text.length() > 120) {
            displayText = text.substring(0, 100) + "[shortened, length is " + text.length() + "]";
        }
        return displayText + "@" + line;
    }
}
