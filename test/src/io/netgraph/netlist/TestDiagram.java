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

import static io.netgraph.support.NetlistTestUtils.cell;
import static io.netgraph.support.NetlistTestUtils.input;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestDiagram {

    private static Module moduleWithCells(String name, String... cellTypes) {
        Module m = new Module(name);
        int i = 0;
        for (String type : cellTypes) {
            m.addNode(cell("u" + i++, type, input("A", "2")));
        }
        return m;
    }

    @Test
    public void testLinkSubModules() {
        Diagram d = new Diagram();
        Module leaf = moduleWithCells("leaf", "$and");
        Module mid = moduleWithCells("mid", "leaf", "leaf");
        Module top = moduleWithCells("top", "mid", "$or");
        d.addModule(leaf);
        d.addModule(mid);
        d.addTopModule(top);

        d.linkSubModules(d.getTopModule());

        Assertions.assertEquals(top, d.getTopModule());
        Assertions.assertEquals(3, d.getModules().size());
        Assertions.assertEquals(1, top.getSubModules().size());
        Assertions.assertEquals(mid, top.getSubModules().get("u0"));
        Assertions.assertEquals(2, mid.getSubModules().size());
        Assertions.assertTrue(leaf.getSubModules().isEmpty());
        Assertions.assertEquals(mid, d.getModuleByName("mid"));
        Assertions.assertNull(d.getModuleByName("missing"));

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        d.printSubModuleHierarchy(top, new PrintStream(bytes, true));
        String[] lines = new String(bytes.toByteArray(), StandardCharsets.UTF_8).split("\\R");
        Assertions.assertArrayEquals(new String[] { "top", "  mid", "    leaf", "    leaf" }, lines);
    }

    @Test
    public void testRecursiveInstantiationTerminates() {
        Diagram d = new Diagram();
        Module a = moduleWithCells("a", "b");
        Module b = moduleWithCells("b", "a");
        d.addTopModule(a);
        d.addModule(b);

        d.linkSubModules(a);

        Assertions.assertEquals(b, a.getSubModules().get("u0"));
        Assertions.assertEquals(a, b.getSubModules().get("u0"));
    }

    @Test
    public void testNullModulesIgnored() {
        Diagram d = new Diagram();
        d.addModule(null);
        d.addTopModule(null);
        d.linkSubModules(null);
        Assertions.assertTrue(d.getModules().isEmpty());
        Assertions.assertNull(d.getTopModule());
    }
}
