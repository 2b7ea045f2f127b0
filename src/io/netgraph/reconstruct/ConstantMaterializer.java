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
import java.util.Map;

import io.netgraph.netlist.BitVector;
import io.netgraph.netlist.Module;
import io.netgraph.netlist.Port;

/**
 * Replaces constant literals on consuming ports (boundary outputs and node
 * inputs) by fresh net tokens and adds one CONST driver port per constant run.
 */
public class ConstantMaterializer {

    public static final String CONST_PORT_SUFFIX = "_const";

    private final List<Port> constPorts = new ArrayList<>();

    /**
     * Materializes every constant run of the module's consuming ports. The new
     * CONST ports are added to the module boundary, even when the rewritten
     * port belongs to a node.
     * @param module The module to rewrite.
     * @param allocator Source of fresh net tokens for this module.
     * @return The original to rewritten bits of every processed port.
     */
    public ConstantTranslation materialize(Module module, BitTokenAllocator allocator) {
        ConstantTranslation translation = new ConstantTranslation();
        for (Port port : module.getConsumerPorts()) {
            if (!port.hasConstantBits()) continue;
            BitVector original = port.getBits();
            for (Map.Entry<BitRange, BitVector> e : BitSegmenter.segment(original).entrySet()) {
                BitVector literals = e.getValue();
                if (!literals.get(0).isConstant()) continue;
                BitVector fresh = allocator.allocate(literals.size());
                Port constPort = Port.createConstPort(port.getName() + CONST_PORT_SUFFIX, fresh, literals);
                module.addPort(constPort);
                constPorts.add(constPort);
                port.replaceBits(e.getKey().getStart(), fresh);
            }
            translation.record(original, port.getBits());
        }
        return translation;
    }

    /**
     * @return The CONST ports created by all calls to
     * {@link #materialize(Module, BitTokenAllocator)}.
     */
    public List<Port> getConstPorts() {
        return constPorts;
    }
}
