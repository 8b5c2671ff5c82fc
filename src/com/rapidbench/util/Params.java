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
 * Aims to be a centralized helper class to manage global RapidBench settings.
 * Every setting can be provided either as an environment variable or as a JVM
 * system property of the same name (-DNAME=value).
 */
public class Params {

    public static String RB_VERBOSE_NAME = "RB_VERBOSE";

    public static String RB_BENCH_MAX_TOKEN_LENGTH_NAME = "RB_BENCH_MAX_TOKEN_LENGTH";

    public static String RB_BENCH_NUMERIC_CONSTANT_NETS_NAME = "RB_BENCH_NUMERIC_CONSTANT_NETS";

    public static String RB_ZSTD_COMPRESSION_LEVEL_NAME = "RB_ZSTD_COMPRESSION_LEVEL";

    public static String RB_CUT_SIZE_NAME = "RB_CUT_SIZE";

    public static String RB_CUT_LIMIT_NAME = "RB_CUT_LIMIT";

    public static String RB_CUT_FANIN_LIMIT_NAME = "RB_CUT_FANIN_LIMIT";

    public static int RB_ZSTD_DEFAULT_COMPRESSION_LEVEL = 3;

    /**
     * Maximum length of a single token (net name or truth table literal) when
     * reading circuit text. Must be a power of two. The read buffer is twice
     * this size. The default is large enough for a 15-input LUT literal.
     */
    public static int RB_BENCH_DEFAULT_MAX_TOKEN_LENGTH = 1 << 21;

    /**
     * Flag to print progress summaries (statement counts, runtimes) while
     * reading and writing circuit text.
     */
    public static boolean RB_VERBOSE = isParamSet(RB_VERBOSE_NAME);

    /**
     * Flag to tie undriven nets literally named "1" and "2" to constant 0 and 1
     * respectively. Some older benchmark generators rely on this convention.
     */
    public static boolean RB_BENCH_NUMERIC_CONSTANT_NETS = isParamSet(RB_BENCH_NUMERIC_CONSTANT_NETS_NAME);

    public static int RB_BENCH_MAX_TOKEN_LENGTH = getParamOrDefaultIntSetting(RB_BENCH_MAX_TOKEN_LENGTH_NAME,
            RB_BENCH_DEFAULT_MAX_TOKEN_LENGTH);

    /**
     * ZStandard compression effort level to use when writing binary netlists.
     * This can range from -7 to 22, with higher numbers producing a more
     * compact result for more runtime.
     */
    public static int RB_ZSTD_COMPRESSION_LEVEL = getParamOrDefaultIntSetting(RB_ZSTD_COMPRESSION_LEVEL_NAME,
            RB_ZSTD_DEFAULT_COMPRESSION_LEVEL);

    /**
     * Checks if the named RapidBench parameter is set via an environment variable
     * or by a JVM parameter of the same name.
     *
     * @param key Name of the global RapidBench parameter
     * @return True if the parameter is set (as defined by {@link #isSet(String)}),
     *         false otherwise
     */
    public static boolean isParamSet(String key) {
        return isSet(System.getenv(key)) || isSet(System.getProperty(key));
    }

    /**
     * Checks if a parameter is set by examining the provided value.
     *
     * @param value An environment variable or JVM parameter value
     * @return True if (1) value is not null, (2) is not an empty string, (3) is not
     *         0 and (4) is not false (case-insensitive).
     */
    public static boolean isSet(String value) {
        return !(value == null
               || value.isEmpty()
               || value.equals("0")
               || value.equalsIgnoreCase("false"));
    }

    /**
     * Gets the integer value of the provided parameter name.
     *
     * @param key Name of the system parameter to get.
     * @return The set integer value of the parameter, or null if none was set. If
     *         the value cannot be parsed as an integer, a warning is printed and
     *         null is returned.
     */
    public static Integer getParamIntValue(String key) {
        String value = getParamValue(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                MessageGenerator.briefError("WARNING: Couldn't interpret the value '" + value
                        + "' from the parameter '" + key + "' as an integer.");
            }
        }
        return null;
    }

    /**
     * Gets the string value of the provided parameter name. Environment
     * variables take precedence over JVM system properties.
     *
     * @param key Name of the system parameter to get.
     * @return The set string value of the parameter, or null if none was set.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return value;
    }

    /**
     * Checks the parameter value of the provided key. If it is set, it returns the
     * set value. Otherwise it will return the default value.
     *
     * @param key          Name of the system parameter to check.
     * @param defaultValue The default value to return if the parameter is not set.
     * @return The system parameter value if is set, otherwise it returns
     *         defaultValue.
     */
    public static int getParamOrDefaultIntSetting(String key, int defaultValue) {
        Integer setValue = getParamIntValue(key);
        return setValue == null ? defaultValue : setValue;
    }
}
