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

package com.rapidbench.util;

/**
 * Common class for generating console messages. RapidBench reports to the
 * console only: regular messages go to standard out, warnings and errors to
 * standard error.
 */
public class MessageGenerator {

    /**
     * Used as a general way to create an error message and send it to
     * std.err.
     * @param msg The message to print to standard error
     */
    public static void briefError(String msg) {
        System.err.println(msg);
    }

    /**
     * Prints a message prefixed with "WARNING: " to standard error.
     * @param msg The warning text
     */
    public static void warning(String msg) {
        briefError("WARNING: " + msg);
    }

    /**
     * Used as a general way to create a message and send it to
     * std.out.
     * @param msg The message to print to standard out
     */
    public static void briefMessage(String msg) {
        System.out.println(msg);
    }

    /**
     * Prints the message to standard out only if {@link Params#RB_VERBOSE} is set.
     * @param msg The message to print
     */
    public static void verboseMessage(String msg) {
        if (Params.RB_VERBOSE) {
            briefMessage(msg);
        }
    }

    /**
     * Formats an elapsed time given in nanoseconds the way progress summaries
     * print it.
     * @param nanos Elapsed nanoseconds
     * @return Seconds with two decimals, e.g. "  0.42s"
     */
    public static String formatRuntime(long nanos) {
        return String.format("%7.2fs", nanos * 1e-9);
    }
}
