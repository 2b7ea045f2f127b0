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
 * Console output helpers shared by the library and the command-line tool.
 * Messages carry an {@code INFO:}, {@code WARNING:} or {@code ERROR:} prefix.
 */
public class MessageGenerator {

    public static final String INFO_PREFIX = "INFO: ";

    public static final String WARNING_PREFIX = "WARNING: ";

    public static final String ERROR_PREFIX = "ERROR: ";

    /**
     * Sends a message to standard out.
     * @param msg The message to print.
     */
    public static void briefMessage(String msg) {
        System.out.println(msg);
    }

    /**
     * Sends a message to standard error.
     * @param msg The message to print.
     */
    public static void briefError(String msg) {
        System.err.println(msg);
    }

    public static void info(String msg) {
        briefMessage(INFO_PREFIX + msg);
    }

    public static void warning(String msg) {
        briefError(WARNING_PREFIX + msg);
    }

    /**
     * Prints an error to standard error, adding the error prefix unless the
     * message already starts with it.
     * @param msg The message to print.
     */
    public static void error(String msg) {
        briefError(msg != null && msg.startsWith(ERROR_PREFIX) ? msg : ERROR_PREFIX + msg);
    }

    /**
     * Prints an error and exits the program with return value 1.
     * @param msg The message to print.
     */
    public static void briefErrorAndExit(String msg) {
        error(msg);
        System.exit(1);
    }

    /**
     * Prints a generic header to standard out to separate operations.
     * @param s The header text.
     */
    public static void printHeader(String s) {
        String bar = "==============================================================================";
        double whiteSpace = (72 - s.length()) / 2.0;
        String left = makeWhiteSpace((int) whiteSpace);
        String right = makeWhiteSpace((int) (whiteSpace + 0.5));
        System.out.println(bar);
        System.out.println("== " + left + s + right + " ==");
        System.out.println(bar);
    }

    /**
     * Creates a whitespace string with length number of spaces.
     * @param length Number of spaces in the string.
     * @return The whitespace string, empty for lengths below 1.
     */
    public static String makeWhiteSpace(int length) {
        if (length < 1) return "";
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
