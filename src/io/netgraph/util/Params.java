/*
 * Copyright (c) 2026, NetGraph contributors.
 * All rights reserved.
 *
 * This file is part of NetGraph.
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

package io.netgraph.util;

/**
 * Centralized helper class to manage global NetGraph settings. Each setting can
 * be provided as an environment variable or as a JVM system property of the
 * same name.
 */
public class Params {

    public static String NETGRAPH_STRICT_NAME = "NETGRAPH_STRICT";

    public static String NETGRAPH_VERBOSE_NAME = "NETGRAPH_VERBOSE";

    public static String NETGRAPH_MAX_NESTED_DEPTH_NAME = "NETGRAPH_MAX_NESTED_DEPTH";

    public static int NETGRAPH_DEFAULT_MAX_NESTED_DEPTH = 8;

    /**
     * Flag to stop building a diagram at the first rejected module instead of
     * reporting the rejection and continuing with the remaining modules.
     */
    public static boolean NETGRAPH_STRICT = isParamSet(NETGRAPH_STRICT_NAME);

    /**
     * Flag to print per-module stage timing and statistics.
     */
    public static boolean NETGRAPH_VERBOSE = isParamSet(NETGRAPH_VERBOSE_NAME);

    /**
     * Maximum depth of nested queries the signal resolver may open while
     * resolving a sink that overlaps another unresolved sink.
     */
    public static int NETGRAPH_MAX_NESTED_DEPTH = getParamOrDefaultIntSetting(NETGRAPH_MAX_NESTED_DEPTH_NAME,
            NETGRAPH_DEFAULT_MAX_NESTED_DEPTH);

    /**
     * Checks if the named parameter is set via an environment variable or by a
     * JVM parameter of the same name.
     *
     * @param key Name of the global parameter
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
     * @return True if the value is not null, not empty, not "0" and not "false"
     *         (case-insensitive).
     */
    public static boolean isSet(String value) {
        return !(value == null
               || value.length() == 0
               || value.equals("0")
               || value.equalsIgnoreCase("false"));
    }

    /**
     * Gets the integer value of the provided parameter name.
     *
     * @param key Name of the parameter to get.
     * @return The integer value of the parameter, or null if none was set. A
     *         value that is not a parsable integer produces a warning and null.
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
     * Gets the string value of the provided parameter name, the environment
     * variable taking precedence over the system property.
     *
     * @param key Name of the parameter to get.
     * @return The value of the parameter, or null if none was set.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return value;
    }

    public static int getParamOrDefaultIntSetting(String key, int defaultValue) {
        Integer setValue = getParamIntValue(key);
        return setValue == null ? defaultValue : setValue;
    }
}
