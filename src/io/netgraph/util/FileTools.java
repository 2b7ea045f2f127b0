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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;

/**
 * Text file helpers. Files ending in {@code .gz} are transparently
 * decompressed when read.
 */
public class FileTools {

    /**
     * Creates a BufferedReader that reads an input file and determines based on
     * file extension (*.gz) if the file is gzipped or not.
     * @param fileName Name of the text or gzipped file
     * @return An opened BufferedReader to the file.
     */
    public static BufferedReader getProperInputStream(String fileName) {
        try {
            if (fileName.endsWith(".gz")) {
                return new BufferedReader(new InputStreamReader(
                        new GZIPInputStream(new FileInputStream(fileName)), StandardCharsets.UTF_8));
            }
            return new BufferedReader(new InputStreamReader(new FileInputStream(fileName), StandardCharsets.UTF_8));
        } catch (FileNotFoundException e) {
            throw new UncheckedIOException("ERROR: Could not find file: " + fileName, e);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Problem reading file: " + fileName, e);
        }
    }

    /**
     * Reads the whole content of a (possibly gzipped) text file.
     * @param fileName Name of the file to read.
     * @return The content of the file.
     */
    public static String getStringFromFile(String fileName) {
        StringBuilder sb = new StringBuilder();
        char[] buffer = new char[8192];
        try (BufferedReader br = getProperInputStream(fileName)) {
            int read;
            while ((read = br.read(buffer)) != -1) {
                sb.append(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Problem reading file: " + fileName, e);
        }
        return sb.toString();
    }

    /**
     * Writes the provided text followed by a line separator to a file, replacing
     * any previous content.
     * @param text The text to write.
     * @param fileName Name of the file to write.
     */
    public static void writeStringToTextFile(String text, String fileName) {
        String nl = System.lineSeparator();
        try (BufferedWriter bw = new BufferedWriter(
                new OutputStreamWriter(new FileOutputStream(fileName), StandardCharsets.UTF_8))) {
            bw.write(text + nl);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Problem writing file: " + fileName, e);
        }
    }
}
