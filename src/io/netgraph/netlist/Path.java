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

package io.netgraph.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents a reconstructed wire or bus: one bit-sequence with at most one
 * driving port (the source) and any number of consuming ports (the
 * destinations). Ports are referenced by id; the owning {@link Module}
 * resolves them.
 */
public class Path extends NetlistObject {

    private final BitVector bits;

    private final boolean hiddenName;

    private int sourceId = NO_ID;

    private final List<Integer> destinationIds = new ArrayList<>();

    private final List<String> alternativeNames = new ArrayList<>();

    public Path(String name, BitVector bits, boolean hiddenName) {
        super(name);
        this.bits = bits;
        this.hiddenName = hiddenName;
    }

    public BitVector getBits() {
        return bits;
    }

    public int getWidth() {
        return bits.size();
    }

    public boolean isBus() {
        return bits.size() > 1;
    }

    public boolean isNameHidden() {
        return hiddenName;
    }

    public int getSourceId() {
        return sourceId;
    }

    void setSourceId(int sourceId) {
        this.sourceId = sourceId;
    }

    public boolean hasSource() {
        return sourceId != NO_ID;
    }

    public List<Integer> getDestinationIds() {
        return Collections.unmodifiableList(destinationIds);
    }

    void addDestinationId(int destinationId) {
        destinationIds.add(destinationId);
    }

    public boolean hasDestinations() {
        return !destinationIds.isEmpty();
    }

    public boolean hasNoConnectBits() {
        return bits.hasNoConnectBits();
    }

    /**
     * A path is connected when it has a source and at least one destination.
     * Paths carrying no-connect bits are always considered connected.
     * @return True if this path is connected.
     */
    public boolean hasConnection() {
        return (hasSource() && hasDestinations()) || hasNoConnectBits();
    }

    public boolean partialBitsMatch(BitVector other) {
        return bits.contains(other);
    }

    public void addAlternativeName(String name) {
        alternativeNames.add(name);
    }

    public void addAlternativeNames(List<String> names) {
        alternativeNames.addAll(names);
    }

    public List<String> getAlternativeNames() {
        return Collections.unmodifiableList(alternativeNames);
    }

    /**
     * Gets the text a renderer prints next to this path. Hidden names produce
     * an empty label. Otherwise everything up to a backslash and from the
     * first '[' is removed and buses get a {@code [msb:0]} suffix.
     * @return The label text.
     */
    public String getLabel() {
        if (hiddenName) return "";
        String label = getName();
        int index = label.lastIndexOf('\\');
        if (index != -1) {
            label = label.substring(index + 1);
        }
        index = label.indexOf('[');
        if (index != -1) {
            label = label.substring(0, index);
        }
        if (isBus()) {
            label += "[" + (bits.size() - 1) + ":0]";
        }
        return label;
    }

    @Override
    public String toString() {
        return "Path(" + getName() + ", " + bits.size() + ", Bits: " + bits
                + ", Source: " + sourceId + ", Destinations: " + destinationIds + ")";
    }
}
