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

import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

import io.netgraph.netlist.Diagram;
import io.netgraph.netlist.Module;
import io.netgraph.netlist.ModuleException;
import io.netgraph.netlist.Node;
import io.netgraph.netlist.Path;
import io.netgraph.netlist.Port;
import io.netgraph.util.FileTools;

/**
 * Writes the reconstructed graph of a diagram as a JSON report for consumers
 * such as layout or rendering tools.
 */
public class DiagramJsonWriter {

    public static final String TOP = "top";
    public static final String MODULES = "modules";
    public static final String REJECTED = "rejected";
    public static final String PORTS = "ports";
    public static final String NODES = "nodes";
    public static final String PATHS = "paths";
    public static final String SUB_MODULES = "submodules";

    /**
     * Creates the report of a diagram.
     * @param diagram The diagram to report.
     * @param rejections Modules rejected while building the diagram.
     * @param moduleName If not null, only the module of this name (accepted or
     * rejected) is reported.
     * @return The report.
     */
    public static JSONObject toJson(Diagram diagram, List<ModuleException> rejections, String moduleName) {
        JSONObject report = new JSONObject();
        Module top = diagram.getTopModule();
        report.put(TOP, top == null ? JSONObject.NULL : top.getName());

        JSONObject modules = new JSONObject();
        for (Module m : diagram.getModules()) {
            if (moduleName != null && !moduleName.equals(m.getName())) continue;
            modules.put(m.getName(), moduleToJson(m));
        }
        report.put(MODULES, modules);

        JSONArray rejected = new JSONArray();
        for (ModuleException e : rejections) {
            if (moduleName != null && !moduleName.equals(e.getModuleName())) continue;
            JSONObject entry = new JSONObject();
            entry.put("module", e.getModuleName());
            entry.put("reason", e.getReason());
            rejected.put(entry);
        }
        report.put(REJECTED, rejected);
        return report;
    }

    public static JSONObject moduleToJson(Module module) {
        JSONObject json = new JSONObject();
        json.put(TOP, module.isTop());
        json.put("state", module.getState().toString());

        JSONArray ports = new JSONArray();
        for (Port p : module.getPorts()) {
            ports.put(portToJson(module, p));
        }
        json.put(PORTS, ports);

        JSONArray nodes = new JSONArray();
        for (Node n : module.getNodes()) {
            JSONObject node = new JSONObject();
            node.put("name", n.getName());
            node.put("type", n.getType());
            JSONArray nodePorts = new JSONArray();
            for (Port p : n.getPorts()) {
                nodePorts.put(portToJson(module, p));
            }
            node.put(PORTS, nodePorts);
            nodes.put(node);
        }
        json.put(NODES, nodes);

        JSONArray paths = new JSONArray();
        for (Path p : module.getPaths()) {
            JSONObject path = new JSONObject();
            path.put("name", p.getName());
            path.put("label", p.getLabel());
            path.put("hidden", p.isNameHidden());
            path.put("bits", new JSONArray(p.getBits().toStringList()));
            Port source = module.getSource(p);
            path.put("driver", source == null ? JSONObject.NULL : getPortReference(module, source));
            JSONArray destinations = new JSONArray();
            for (Port d : module.getDestinations(p)) {
                destinations.put(getPortReference(module, d));
            }
            path.put("destinations", destinations);
            path.put("alternative_names", new JSONArray(p.getAlternativeNames()));
            paths.put(path);
        }
        json.put(PATHS, paths);

        JSONObject subModules = new JSONObject();
        for (Map.Entry<String, Module> e : module.getSubModules().entrySet()) {
            subModules.put(e.getKey(), e.getValue().getName());
        }
        json.put(SUB_MODULES, subModules);
        return json;
    }

    private static JSONObject portToJson(Module module, Port port) {
        JSONObject json = new JSONObject();
        json.put("name", port.getName());
        json.put("direction", port.getDirection().toString());
        json.put("bits", new JSONArray(port.getBits().toStringList()));
        Path path = module.getPath(port);
        json.put("path", path == null ? JSONObject.NULL : path.getName());
        if (port.isConst()) {
            json.put("value", port.getConstValueDecimal());
            json.put("hex", port.getConstValueHex());
        }
        String label = module.getSplitJoinLabel(port);
        if (!label.isEmpty()) {
            json.put("label", label);
        }
        return json;
    }

    /**
     * @return The port name for boundary ports, {@code <node>.<port>} for node
     * ports.
     */
    public static String getPortReference(Module module, Port port) {
        Node parent = module.getParentNode(port);
        return parent == null ? port.getName() : parent.getName() + "." + port.getName();
    }

    public static void write(JSONObject report, String fileName) {
        FileTools.writeStringToTextFile(report.toString(4), fileName);
    }
}
