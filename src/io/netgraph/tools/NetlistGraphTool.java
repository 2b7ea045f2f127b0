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

import java.io.UncheckedIOException;

import io.netgraph.netlist.Diagram;
import io.netgraph.netlist.Module;
import io.netgraph.netlist.ModuleException;
import io.netgraph.netlist.NetlistStructureException;
import io.netgraph.netlist.Node;
import io.netgraph.reconstruct.ModuleAssembler;
import io.netgraph.util.MessageGenerator;
import io.netgraph.yosys.DiagramBuilder;

/**
 * Command-line front end: reads a Yosys JSON netlist, reconstructs the signal
 * graph of every module and reports it.
 */
public class NetlistGraphTool {

    private final NetlistGraphToolConfig config;

    private DiagramBuilder builder;

    public NetlistGraphTool(NetlistGraphToolConfig config) {
        this.config = config;
    }

    /**
     * Builds the diagram and writes the report (or prints a summary line per
     * module when no output file is configured).
     * @return The built diagram.
     */
    public Diagram run() {
        builder = new DiagramBuilder(new ModuleAssembler(config.getMaxNestedDepth(), config.isVerbose()),
                config.isStrict());
        Diagram diagram = builder.build(config.getInputFileName());

        String moduleName = config.getModuleName();
        if (moduleName != null && diagram.getModuleByName(moduleName) == null && !isRejected(moduleName)) {
            throw new RuntimeException("ERROR: Module " + moduleName + " not found in "
                    + config.getInputFileName());
        }

        if (config.getOutputFileName() != null) {
            DiagramJsonWriter.write(DiagramJsonWriter.toJson(diagram, builder.getRejections(), moduleName),
                    config.getOutputFileName());
            MessageGenerator.info("Wrote graph report to " + config.getOutputFileName());
        } else {
            for (Module m : diagram.getModules()) {
                if (moduleName != null && !moduleName.equals(m.getName())) continue;
                MessageGenerator.info(getSummary(m));
            }
        }

        if (config.isPrintHierarchy()) {
            if (diagram.getTopModule() == null) {
                MessageGenerator.warning("No top module found, cannot print the hierarchy");
            } else {
                diagram.printSubModuleHierarchy(diagram.getTopModule(), System.out);
            }
        }
        return diagram;
    }

    private boolean isRejected(String moduleName) {
        for (ModuleException e : builder.getRejections()) {
            if (e.getModuleName().equals(moduleName)) return true;
        }
        return false;
    }

    public DiagramBuilder getBuilder() {
        return builder;
    }

    /**
     * @return One line describing the content of an accepted module.
     */
    public static String getSummary(Module module) {
        int splits = 0;
        int joins = 0;
        for (Node n : module.getNodes()) {
            if (n.isSplit()) splits++;
            if (n.isJoin()) joins++;
        }
        return "Module " + module.getName() + (module.isTop() ? " (top)" : "") + ": "
                + module.getPorts().size() + " ports, "
                + module.getNodes().size() + " nodes (" + splits + " split, " + joins + " join), "
                + module.getPaths().size() + " paths";
    }

    public static void main(String[] args) {
        NetlistGraphToolConfig config;
        try {
            config = new NetlistGraphToolConfig(args);
        } catch (RuntimeException e) {
            NetlistGraphToolConfig.printHelp();
            MessageGenerator.briefErrorAndExit(e.getMessage());
            return;
        }
        if (config.isHelp()) {
            NetlistGraphToolConfig.printHelp();
            return;
        }
        try {
            new NetlistGraphTool(config).run();
        } catch (NetlistStructureException | ModuleException | UncheckedIOException e) {
            MessageGenerator.briefErrorAndExit(e.getMessage());
        }
    }
}
