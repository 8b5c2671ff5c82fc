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

package com.rapidbench.netlist;

/**
 * Thrown when a netlist violates a structural invariant: a net with two
 * drivers, or a combinational cycle.
 */
public class NetlistIntegrityException extends RuntimeException {

    public NetlistIntegrityException(String message) {
        super(message);
    }

    public NetlistIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
