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
 * Lexical class of a byte of circuit text.
 */
public enum CharClass {
    /** Part of a token */
    NORMAL,
    /** Starts a comment running to the end of the physical line */
    COMMENT,
    /** Ends a statement and a line */
    STOP,
    /** Separates tokens and is dropped */
    CLEAN;
}
