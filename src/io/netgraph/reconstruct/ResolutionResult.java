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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.netgraph.netlist.BitVector;

/**
 * The split and join requests discovered by the {@link SignalResolver}. Both
 * maps iterate in discovery order.
 */
public class ResolutionResult {

    /** Source bits to the distinct sub-sequences that must be split out of them */
    private final Map<BitVector, List<BitVector>> splitInfo = new LinkedHashMap<>();

    /** Composite bits to the ordered parts that must be joined to produce them */
    private final Map<BitVector, List<BitVector>> joinInfo = new LinkedHashMap<>();

    private final List<BitVector> unresolved = new ArrayList<>();

    void addSplit(BitVector source, BitVector child) {
        List<BitVector> children = splitInfo.computeIfAbsent(source, k -> new ArrayList<>());
        if (!children.contains(child)) {
            children.add(child);
        }
    }

    void addJoin(BitVector composite, BitVector part) {
        joinInfo.computeIfAbsent(composite, k -> new ArrayList<>()).add(part);
    }

    void addUnresolved(BitVector bits) {
        unresolved.add(bits);
    }

    boolean hasJoin(BitVector composite) {
        return joinInfo.containsKey(composite);
    }

    public Map<BitVector, List<BitVector>> getSplitInfo() {
        return Collections.unmodifiableMap(splitInfo);
    }

    public Map<BitVector, List<BitVector>> getJoinInfo() {
        return Collections.unmodifiableMap(joinInfo);
    }

    /**
     * @return Single bits for which no driver could be found. These produce no
     * path and are not an error.
     */
    public List<BitVector> getUnresolved() {
        return Collections.unmodifiableList(unresolved);
    }

    public boolean isEmpty() {
        return splitInfo.isEmpty() && joinInfo.isEmpty();
    }

    @Override
    public String toString() {
        return "ResolutionResult(Splits: " + splitInfo + ", Joins: " + joinInfo
                + ", Unresolved: " + unresolved + ")";
    }
}
