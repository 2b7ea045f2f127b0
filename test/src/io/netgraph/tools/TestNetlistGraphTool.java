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

package io.netgraph.tools;

import static io.netgraph.support.NetlistTestUtils.json;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.netgraph.netlist.Diagram;
import io.netgraph.netlist.Module;
import io.netgraph.support.NetlistTestUtils;
import io.netgraph.util.FileTools;
import io.netgraph.yosys.DiagramBuilder;

public class TestNetlistGraphTool {

    private static Path writeDesign(Path dir, String fileName) throws Exception {
        Path file = dir.resolve(fileName);
        byte[] content = json(NetlistTestUtils.HIERARCHICAL_DESIGN).toString(2).getBytes(StandardCharsets.UTF_8);
        if (fileName.endsWith(".gz")) {
            try (OutputStream os = new GZIPOutputStream(Files.newOutputStream(file))) {
                os.write(content);
            }
        } else {
            Files.write(file, content);
        }
        return file;
    }

    @ParameterizedTest
    @ValueSource(strings = {"design.json", "design.json.gz"})
    public void testWriteReport(String fileName, @TempDir Path dir) throws Exception {
        Path input = writeDesign(dir, fileName);
        Path output = dir.resolve("graph.json");
        NetlistGraphToolConfig config = new NetlistGraphToolConfig(new String[] {
                "-i", input.toString(), "-o", output.toString(), "--hierarchy"});
        Assertions.assertTrue(config.isPrintHierarchy());

        Diagram diagram = new NetlistGraphTool(config).run();
        Assertions.assertEquals(2, diagram.getModules().size());
        JSONObject report = new JSONObject(FileTools.getStringFromFile(output.toString()));
        Assertions.assertEquals("top", report.getString(DiagramJsonWriter.TOP));
        Assertions.assertTrue(report.getJSONObject(DiagramJsonWriter.MODULES).has("sub"));
    }

    @Test
    public void testModuleFilter(@TempDir Path dir) throws Exception {
        Path input = writeDesign(dir, "design.json");
        Path output = dir.resolve("graph.json");
        NetlistGraphToolConfig config = new NetlistGraphToolConfig(new String[] {
                "-i", input.toString(), "-o", output.toString(), "-m", "sub"});
        new NetlistGraphTool(config).run();

        JSONObject modules = new JSONObject(FileTools.getStringFromFile(output.toString()))
                .getJSONObject(DiagramJsonWriter.MODULES);
        Assertions.assertEquals(1, modules.length());
        Assertions.assertTrue(modules.has("sub"));
    }

    @Test
    public void testUnknownModule(@TempDir Path dir) throws Exception {
        NetlistGraphToolConfig config = new NetlistGraphToolConfig(writeDesign(dir, "design.json").toString());
        config.setModuleName("missing");
        RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                () -> new NetlistGraphTool(config).run());
        Assertions.assertTrue(e.getMessage().startsWith("ERROR: Module missing not found"));
    }

    @Test
    public void testMissingInput() {
        RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                () -> new NetlistGraphToolConfig(new String[] {"-o", "graph.json"}));
        Assertions.assertTrue(e.getMessage().startsWith("ERROR: No input netlist found."));
    }

    @ParameterizedTest
    @ValueSource(strings = {"-h", "--help", "-?"})
    public void testHelp(String option) {
        Assertions.assertTrue(new NetlistGraphToolConfig(new String[] {option}).isHelp());
    }

    @Test
    public void testOptions() {
        NetlistGraphToolConfig config = new NetlistGraphToolConfig(new String[] {
                "-i", "design.json", "--strict", "-v", "--max-nested-depth", "3"});
        Assertions.assertEquals("design.json", config.getInputFileName());
        Assertions.assertTrue(config.isStrict());
        Assertions.assertTrue(config.isVerbose());
        Assertions.assertEquals(3, config.getMaxNestedDepth());
        Assertions.assertNull(config.getOutputFileName());

        Assertions.assertThrows(RuntimeException.class, () -> config.setMaxNestedDepth(-1));
        Assertions.assertThrows(RuntimeException.class, () -> new NetlistGraphToolConfig(new String[] {
                "-i", "design.json", "--max-nested-depth", "deep"}));
    }

    @Test
    public void testSummary() {
        Diagram diagram = new DiagramBuilder().build(json(NetlistTestUtils.HIERARCHICAL_DESIGN));
        Module top = diagram.getModuleByName("top");
        Assertions.assertEquals("Module top (top): 2 ports, 1 nodes (0 split, 0 join), 2 paths",
                NetlistGraphTool.getSummary(top));
    }
}
