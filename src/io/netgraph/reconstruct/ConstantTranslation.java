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
 * Records, for every port rewritten by the {@link ConstantMaterializer}, its
 * bits before (with constant literals) and after (with fresh net tokens)
 * the rewrite. Used to recover declared names of constant-derived paths.
 * <p>
 * Entries are keyed by the rewritten bits, which always contain fresh tokens
 * and are therefore unique even when two ports carried the same literals.
 */
public class ConstantTranslation {

    private final Map<BitVector, BitVector> rewrittenToOriginal = new LinkedHashMap<>();

    public void record(BitVector original, BitVector rewritten) {
        rewrittenToOriginal.put(rewritten, original);
    }

    /**
     * @return The rewritten bits of the first recorded port that carried the
     * provided original bits, or null.
     */
    public BitVector getRewritten(BitVector original) {
        for (Map.Entry<BitVector, BitVector> e : rewrittenToOriginal.entrySet()) {
            if (e.getValue().equals(original)) return e.getKey();
        }
        return null;
    }

    /**
     * Finds the original bits of a rewritten port.
     * @param rewritten The full bits of a port after the rewrite.
     * @return The bits before the rewrite, or null if no port was rewritten to
     * exactly these bits.
     */
    public BitVector findOriginal(BitVector rewritten) {
        return rewrittenToOriginal.get(rewritten);
    }

    public int size() {
        return rewrittenToOriginal.size();
    }
}
