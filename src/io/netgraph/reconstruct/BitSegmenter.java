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

package io.netgraph.reconstruct;

import java.util.LinkedHashMap;
import java.util.Map;

import io.netgraph.netlist.BitVector;

/**
 * Splits a bit vector into maximal runs of constant bits (0 or 1) and runs of
 * everything else (net tokens and no-connect markers).
 */
public class BitSegmenter {

    /**
     * Segments the provided bits. Concatenating the values of the returned map
     * in iteration order reproduces the input and two adjacent runs never share
     * a classification.
     * @param bits The bits to segment.
     * @return Each run keyed by its inclusive index range, in ascending order.
     * Empty for an empty input.
     */
    public static Map<BitRange, BitVector> segment(BitVector bits) {
        Map<BitRange, BitVector> segments = new LinkedHashMap<>();
        if (bits.isEmpty()) return segments;
        int runStart = 0;
        boolean runConstant = bits.get(0).isConstant();
        for (int i = 1; i < bits.size(); i++) {
            boolean constant = bits.get(i).isConstant();
            if (constant != runConstant) {
                segments.put(new BitRange(runStart, i - 1), bits.slice(runStart, i));
                runStart = i;
                runConstant = constant;
            }
        }
        segments.put(new BitRange(runStart, bits.size() - 1), bits.slice(runStart, bits.size()));
        return segments;
    }
}
