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

import static io.netgraph.support.NetlistTestUtils.json;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.netgraph.netlist.Diagram;
import io.netgraph.netlist.Module;
import io.netgraph.netlist.ModuleException;
import io.netgraph.netlist.ModuleState;
import io.netgraph.reconstruct.ModuleAssembler;
import io.netgraph.support.NetlistTestUtils;

public class TestDiagramBuilder {

    private static JSONObject designWithRejectedModule() {
        JSONObject doc = json(NetlistTestUtils.HIERARCHICAL_DESIGN);
        doc.getJSONObject(YosysJson.MODULES).put("bad",
                json("{'ports': {'a': {'direction': 'input', 'bits': [2]}}}"));
        return doc;
    }

    private static List<String> names(List<Module> modules) {
        List<String> names = new ArrayList<>();
        for (Module m : modules) {
            names.add(m.getName());
        }
        return names;
    }

    @Test
    public void testHierarchicalDesign() {
        DiagramBuilder builder = new DiagramBuilder(new ModuleAssembler(8, false), false);
        Diagram diagram = builder.build(json(NetlistTestUtils.HIERARCHICAL_DESIGN));

        Assertions.assertEquals(List.of("sub", "top"), names(diagram.getModules()));
        Assertions.assertNull(diagram.getModuleByName("$lut"));
        Module top = diagram.getTopModule();
        Assertions.assertEquals("top", top.getName());
        Assertions.assertEquals(diagram.getModuleByName("sub"), top.getSubModules().get("u_sub"));
        for (Module m : diagram.getModules()) {
            Assertions.assertEquals(ModuleState.ACCEPTED, m.getState());
            Assertions.assertTrue(m.isLocked());
        }
        Assertions.assertTrue(builder.getRejections().isEmpty());

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        diagram.printSubModuleHierarchy(top, new PrintStream(out, true, StandardCharsets.UTF_8));
        Assertions.assertEquals(List.of("top", "  sub"),
                List.of(out.toString(StandardCharsets.UTF_8).split("\\R")));
    }

    @Test
    public void testRejectedModuleIsolated() {
        DiagramBuilder builder = new DiagramBuilder(new ModuleAssembler(8, false), false);
        Diagram diagram = builder.build(designWithRejectedModule());

        Assertions.assertEquals(List.of("sub", "top"), names(diagram.getModules()));
        Assertions.assertEquals(1, builder.getRejections().size());
        ModuleException e = builder.getRejections().get(0);
        Assertions.assertEquals("bad", e.getModuleName());
        Assertions.assertEquals(ModuleAssembler.INVALID_PATHS, e.getReason());
    }

    @Test
    public void testStrictRethrows() {
        DiagramBuilder builder = new DiagramBuilder(new ModuleAssembler(8, false), true);
        ModuleException e = Assertions.assertThrows(ModuleException.class,
                () -> builder.build(designWithRejectedModule()));
        Assertions.assertEquals("Error while parsing bad: Module has invalid Paths", e.getMessage());
    }

    @Test
    public void testBuildFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("design.json");
        Files.writeString(file, json(NetlistTestUtils.HIERARCHICAL_DESIGN).toString(2));
        Diagram diagram = new DiagramBuilder(new ModuleAssembler(8, false), false).build(file.toString());
        Assertions.assertEquals(2, diagram.getModules().size());
    }

    @Test
    public void testRepeatedBuildsAreIdentical() {
        DiagramBuilder builder = new DiagramBuilder(new ModuleAssembler(8, false), false);
        Diagram first = builder.build(json(NetlistTestUtils.HIERARCHICAL_DESIGN));
        Diagram second = builder.build(json(NetlistTestUtils.HIERARCHICAL_DESIGN));
        for (String name : List.of("sub", "top")) {
            Assertions.assertEquals(first.getModuleByName(name).toString(), second.getModuleByName(name).toString());
        }
    }
}
