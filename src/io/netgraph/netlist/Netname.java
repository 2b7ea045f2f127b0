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
 * A user declared alias binding a bit-sequence to a preferred display name.
 * Further aliases of the same bits are kept as alternative names.
 */
public class Netname {

    private final String name;

    private final BitVector bits;

    private final boolean hidden;

    private final List<String> alternativeNames = new ArrayList<>();

    public Netname(String name, BitVector bits, boolean hidden) {
        this.name = name;
        this.bits = bits;
        this.hidden = hidden;
    }

    public String getName() {
        return name;
    }

    public BitVector getBits() {
        return bits;
    }

    public boolean isHidden() {
        return hidden;
    }

    public int getWidth() {
        return bits.size();
    }

    public void addAlternativeName(String alternativeName) {
        alternativeNames.add(alternativeName);
    }

    public List<String> getAlternativeNames() {
        return Collections.unmodifiableList(alternativeNames);
    }

    @Override
    public String toString() {
        return "Netname(" + name + ", " + bits + (hidden ? ", hidden)" : ")");
    }
}
