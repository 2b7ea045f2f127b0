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
import io.netgraph.netlist.Node;
import io.netgraph.netlist.Port;
import io.netgraph.netlist.PortDirection;

/**
 * Turns the requests of a {@link ResolutionResult} into split and join nodes
 * of a module.
 */
public class NodeSynthesizer {

    /**
     * Adds one join node per join request followed by one split node per
     * split request. Nodes are named {@code split<i>} and {@code join<i>},
     * skipping names already used in the module.
     * @param module The module receiving the nodes.
     * @param result The resolved requests.
     * @return The created nodes, joins first.
     */
    public List<Node> synthesize(Module module, ResolutionResult result) {
        List<Node> created = new ArrayList<>();
        int joinIndex = 0;
        for (Map.Entry<BitVector, List<BitVector>> e : result.getJoinInfo().entrySet()) {
            List<Port> ports = new ArrayList<>();
            int index = 0;
            for (BitVector part : e.getValue()) {
                ports.add(new Port("in" + index++, PortDirection.INPUT, part));
            }
            ports.add(new Port(Node.JOIN_OUTPUT_NAME, PortDirection.OUTPUT, e.getKey()));
            String name = Node.JOIN_TYPE + joinIndex++;
            while (module.hasNode(name)) {
                name = Node.JOIN_TYPE + joinIndex++;
            }
            created.add(module.addNode(new Node(name, Node.JOIN_TYPE, ports)));
        }

        int splitIndex = 0;
        for (Map.Entry<BitVector, List<BitVector>> e : result.getSplitInfo().entrySet()) {
            List<Port> ports = new ArrayList<>();
            ports.add(new Port(Node.SPLIT_INPUT_NAME, PortDirection.INPUT, e.getKey()));
            int index = 0;
            for (BitVector child : e.getValue()) {
                ports.add(new Port("out" + index++, PortDirection.OUTPUT, child));
            }
            String name = Node.SPLIT_TYPE + splitIndex++;
            while (module.hasNode(name)) {
                name = Node.SPLIT_TYPE + splitIndex++;
            }
            created.add(module.addNode(new Node(name, Node.SPLIT_TYPE, ports)));
        }
        return created;
    }
}
