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
import java.util.List;

import io.netgraph.netlist.Bit;
import io.netgraph.netlist.BitVector;
import io.netgraph.netlist.Module;

/**
 * Hands out fresh numeric net tokens for one module. Tokens increase
 * monotonically starting one past the highest token the module already uses.
 */
public class BitTokenAllocator {

    private long lastToken;

    public BitTokenAllocator(long lastToken) {
        this.lastToken = lastToken;
    }

    public static BitTokenAllocator forModule(Module module) {
        return new BitTokenAllocator(module.getMaxBitNumber());
    }

    public BitVector allocate(int count) {
        List<Bit> bits = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            bits.add(Bit.net(++lastToken));
        }
        return new BitVector(bits);
    }

    /**
     * @return The most recently allocated token, or the seed if none has been
     * allocated yet.
     */
    public long getLastToken() {
        return lastToken;
    }
}
