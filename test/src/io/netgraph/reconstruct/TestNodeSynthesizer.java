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

import static io.netgraph.support.NetlistTestUtils.bits;
import static io.netgraph.support.NetlistTestUtils.cell;
import static io.netgraph.support.NetlistTestUtils.input;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import io.netgraph.netlist.Module;
import io.netgraph.netlist.Node;
import io.netgraph.netlist.Port;

public class TestNodeSynthesizer {

    @Test
    public void testSplitAndJoinPorts() {
        ResolutionResult r = new ResolutionResult();
        r.addSplit(bits("2", "3", "4"), bits("2"));
        r.addSplit(bits("2", "3", "4"), bits("3", "4"));
        r.addJoin(bits("5", "6"), bits("5"));
        r.addJoin(bits("5", "6"), bits("6"));
        Module m = new Module("m");

        List<Node> nodes = new NodeSynthesizer().synthesize(m, r);

        Assertions.assertEquals(2, nodes.size());
        Node split = nodes.get(1);
        Assertions.assertEquals("split0", split.getName());
        Assertions.assertTrue(split.isSplit());
        Assertions.assertEquals(3, split.getPorts().size());
        Port in = split.getPort("in");
        Assertions.assertTrue(in.isInput());
        Assertions.assertEquals(bits("2", "3", "4"), in.getBits());
        Assertions.assertEquals(bits("2"), split.getPort("out0").getBits());
        Assertions.assertEquals(bits("3", "4"), split.getPort("out1").getBits());
        Assertions.assertArrayEquals(new int[] { 2, 1 }, split.getSplitJoinBitPositions(split.getPort("out1")));

        Node join = nodes.get(0);
        Assertions.assertEquals("join0", join.getName());
        Assertions.assertTrue(join.isJoin());
        Assertions.assertEquals(bits("5"), join.getPort("in0").getBits());
        Assertions.assertEquals(bits("6"), join.getPort("in1").getBits());
        Port out = join.getPort("out");
        Assertions.assertTrue(out.isOutput());
        Assertions.assertEquals(bits("5", "6"), out.getBits());
        Assertions.assertEquals("out", join.getPorts().get(2).getName());

        Assertions.assertEquals(join, m.getParentNode(out));
    }

    @Test
    public void testUniqueNames() {
        Module m = new Module("m");
        m.addNode(cell("split0", "$buf", input("A", "9")));
        ResolutionResult r = new ResolutionResult();
        r.addSplit(bits("2", "3"), bits("2"));
        r.addSplit(bits("4", "5"), bits("5"));

        List<Node> nodes = new NodeSynthesizer().synthesize(m, r);

        Assertions.assertEquals("split1", nodes.get(0).getName());
        Assertions.assertEquals("split2", nodes.get(1).getName());
    }

    @Test
    public void testNoRequests() {
        Module m = new Module("m");
        Assertions.assertTrue(new NodeSynthesizer().synthesize(m, new ResolutionResult()).isEmpty());
        Assertions.assertTrue(m.getNodes().isEmpty());
    }
}
