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

package io.netgraph.yosys;

import static io.netgraph.support.NetlistTestUtils.bits;
import static io.netgraph.support.NetlistTestUtils.json;

import java.util.Arrays;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.netgraph.netlist.Bit;
import io.netgraph.netlist.BitType;
import io.netgraph.netlist.Module;
import io.netgraph.netlist.ModuleException;
import io.netgraph.netlist.NetlistStructureException;
import io.netgraph.netlist.Node;
import io.netgraph.netlist.PortDirection;
import io.netgraph.support.NetlistTestUtils;

public class TestYosysJsonReader {

    private final YosysJsonReader reader = new YosysJsonReader();

    private Module read(String moduleBody) {
        return reader.readModule("m", json(moduleBody));
    }

    @ParameterizedTest
    @ValueSource(strings = {"{}", "{'modules': {}}", "{'creator': 'Yosys'}"})
    public void testNoModules(String document) {
        NetlistStructureException e = Assertions.assertThrows(NetlistStructureException.class,
                () -> reader.getModuleNames(json(document)));
        Assertions.assertEquals("No modules found in Yosys JSON object", e.getMessage());
    }

    @Test
    public void testInvalidDocument() {
        Assertions.assertThrows(NetlistStructureException.class, () -> YosysJsonReader.parseJson("{'modules'"));
    }

    @Test
    public void testModuleNamesSorted() {
        JSONObject doc = json(NetlistTestUtils.HIERARCHICAL_DESIGN);
        Assertions.assertEquals(Arrays.asList("$lut", "sub", "top"), reader.getModuleNames(doc));
        Assertions.assertTrue(YosysJsonReader.isBlackbox(reader.getModuleJson(doc, "$lut")));
        Assertions.assertTrue(YosysJsonReader.isTop(reader.getModuleJson(doc, "top")));
        Assertions.assertFalse(YosysJsonReader.isTop(reader.getModuleJson(doc, "sub")));
    }

    @Test
    public void testReadModule() {
        JSONObject doc = json(NetlistTestUtils.HIERARCHICAL_DESIGN);
        Module top = reader.readModule("top", reader.getModuleJson(doc, "top"));

        Assertions.assertTrue(top.isTop());
        Assertions.assertEquals(2, top.getPorts().size());
        Assertions.assertEquals(PortDirection.INPUT, top.getPort("a").getDirection());
        Assertions.assertEquals(bits("4", "5"), top.getPort("y").getBits());
        Node sub = top.getNode("u_sub");
        Assertions.assertEquals("sub", sub.getType());
        Assertions.assertEquals(PortDirection.OUTPUT, sub.getPort("o").getDirection());
        Assertions.assertEquals(2, top.getNetnames().size());
        Assertions.assertTrue(top.getPaths().isEmpty());
    }

    @Test
    public void testInoutRejected() {
        ModuleException e = Assertions.assertThrows(ModuleException.class,
                () -> read("{'ports': {'io': {'direction': 'inout', 'bits': [2]}}}"));
        Assertions.assertEquals("Error while parsing m: Invalid direction 'inout' of port io", e.getMessage());
    }

    @Test
    public void testPortWithoutBits() {
        ModuleException e = Assertions.assertThrows(ModuleException.class,
                () -> read("{'ports': {'a': {'direction': 'input', 'bits': []}}}"));
        Assertions.assertEquals("No bits found for port a", e.getReason());
    }

    @Test
    public void testCellConnectionMismatch() {
        String body = "{'cells': {'u0': {'type': '$and',"
                + " 'port_directions': {'A': 'input', 'B': 'input', 'Y': 'output'},"
                + " 'connections': {'A': [2], 'Y': [3]}}}}";
        ModuleException e = Assertions.assertThrows(ModuleException.class, () -> read(body));
        Assertions.assertTrue(e.getReason().contains("does not match"));
    }

    @Test
    public void testCellWithoutType() {
        String body = "{'cells': {'u0': {'type': 7,"
                + " 'port_directions': {'A': 'input'}, 'connections': {'A': [2]}}}}";
        ModuleException e = Assertions.assertThrows(ModuleException.class, () -> read(body));
        Assertions.assertEquals("Cell type of u0 is not valid", e.getReason());
    }

    @Test
    public void testUnusedBitsRemoved() {
        Module m = read("{'netnames': {'bus': {'hide_name': 0, 'bits': [2, 3, 4, 5],"
                + " 'attributes': {'unused_bits': '0 2'}}}}");
        Assertions.assertEquals(bits("3", "5"), m.getNetnames().get(0).getBits());
    }

    @Test
    public void testUnusedBitOutOfRange() {
        Assertions.assertThrows(ModuleException.class,
                () -> read("{'netnames': {'bus': {'bits': [2, 3], 'attributes': {'unused_bits': '4'}}}}"));
    }

    @Test
    public void testNetnames() {
        Module m = read("{'netnames': {"
                + "'$auto$1': {'hide_name': 1, 'bits': [2, 3]},"
                + "'nc': {'hide_name': 0, 'bits': ['x', 'z']},"
                + "'data': {'hide_name': 0, 'bits': [2, 3]},"
                + "'k': {'hide_name': 0, 'bits': ['0', '1']}}}");

        // Sorted visiting makes the hidden alias the primary name
        Assertions.assertEquals(2, m.getNetnames().size());
        Assertions.assertEquals("$auto$1", m.getNetnameByBits(bits("2", "3")).getName());
        Assertions.assertTrue(m.getNetnameByBits(bits("2", "3")).isHidden());
        Assertions.assertEquals(Arrays.asList("data"), m.getNetnameByBits(bits("2", "3")).getAlternativeNames());
        Assertions.assertEquals("k", m.getNetnameByBits(bits("0", "1")).getName());
    }

    @Test
    public void testToBitList() {
        List<Bit> list = YosysJsonReader.toBitList("m", "p", new JSONArray("[7, \"0\", \"1\", \"x\", \"z\", \"12\"]"));
        Assertions.assertEquals(Bit.net(7), list.get(0));
        Assertions.assertEquals(Bit.ZERO, list.get(1));
        Assertions.assertEquals(Bit.ONE, list.get(2));
        Assertions.assertEquals(BitType.NO_CONNECT, list.get(3).getType());
        Assertions.assertEquals(BitType.NO_CONNECT, list.get(4).getType());
        Assertions.assertEquals(Bit.net(12), list.get(5));

        Assertions.assertThrows(ModuleException.class,
                () -> YosysJsonReader.toBitList("m", "p", new JSONArray("[true]")));
    }
}
