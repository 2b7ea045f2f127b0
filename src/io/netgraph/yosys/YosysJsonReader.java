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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import io.netgraph.netlist.Bit;
import io.netgraph.netlist.BitVector;
import io.netgraph.netlist.Module;
import io.netgraph.netlist.ModuleException;
import io.netgraph.netlist.Netname;
import io.netgraph.netlist.NetlistStructureException;
import io.netgraph.netlist.Node;
import io.netgraph.netlist.Port;
import io.netgraph.netlist.PortDirection;
import io.netgraph.util.FileTools;

/**
 * Reads the modules of a Yosys JSON netlist into {@link Module}s holding the
 * boundary ports, cells and netnames. Object keys are visited in sorted order
 * so that repeated reads produce identical modules.
 */
public class YosysJsonReader {

    /**
     * Reads and parses a (possibly gzipped) Yosys JSON file.
     * @param fileName Name of the file.
     * @return The parsed document.
     */
    public static JSONObject readJsonFile(String fileName) {
        return parseJson(FileTools.getStringFromFile(fileName));
    }

    public static JSONObject parseJson(String text) {
        try {
            return new JSONObject(text);
        } catch (JSONException e) {
            throw new NetlistStructureException("Invalid Yosys JSON document: " + e.getMessage());
        }
    }

    /**
     * @param document A Yosys JSON document.
     * @return The names of all modules of the document in sorted order.
     * @throws NetlistStructureException If the document has no modules.
     */
    public List<String> getModuleNames(JSONObject document) {
        JSONObject modules = document.optJSONObject(YosysJson.MODULES);
        if (modules == null || modules.isEmpty()) {
            throw new NetlistStructureException("No modules found in Yosys JSON object");
        }
        return sortedKeys(modules);
    }

    public JSONObject getModuleJson(JSONObject document, String moduleName) {
        return document.getJSONObject(YosysJson.MODULES).getJSONObject(moduleName);
    }

    /**
     * @return True if the module carries a blackbox attribute, which marks
     * library cells that are not drawn.
     */
    public static boolean isBlackbox(JSONObject moduleJson) {
        return hasAttribute(moduleJson, YosysJson.BLACKBOX);
    }

    public static boolean isTop(JSONObject moduleJson) {
        return hasAttribute(moduleJson, YosysJson.TOP);
    }

    private static boolean hasAttribute(JSONObject json, String key) {
        JSONObject attributes = json.optJSONObject(YosysJson.ATTRIBUTES);
        return attributes != null && attributes.has(key) && !attributes.isNull(key);
    }

    /**
     * Creates a module from its JSON object: netnames first, then boundary
     * ports, then one node per cell.
     * @param name Name of the module.
     * @param moduleJson The JSON object of the module.
     * @return The populated module, not yet assembled.
     * @throws ModuleException If any part of the module is malformed.
     */
    public Module readModule(String name, JSONObject moduleJson) {
        Module module = new Module(name);
        module.setTop(isTop(moduleJson));
        try {
            readNetnames(module, moduleJson.optJSONObject(YosysJson.NETNAMES));
            readPorts(module, moduleJson.optJSONObject(YosysJson.PORTS));
            readCells(module, moduleJson.optJSONObject(YosysJson.CELLS));
        } catch (JSONException e) {
            throw new ModuleException(name, "Malformed module: " + e.getMessage(), e);
        }
        return module;
    }

    private void readNetnames(Module module, JSONObject netnames) {
        if (netnames == null) return;
        for (String netName : sortedKeys(netnames)) {
            JSONObject data = netnames.getJSONObject(netName);
            boolean hidden = data.optInt(YosysJson.HIDE_NAME, 0) == 1;
            JSONArray bitArray = data.optJSONArray(YosysJson.BITS);
            if (bitArray == null || bitArray.isEmpty()) {
                throw new ModuleException(module.getName(), "No bits found for netname " + netName);
            }
            List<Bit> bits = toBitList(module.getName(), netName, bitArray);
            if (new BitVector(bits).isAllNoConnect()) continue;
            removeUnusedBits(module.getName(), netName, bits, data.optJSONObject(YosysJson.ATTRIBUTES));
            if (bits.isEmpty()) continue;
            module.addNetname(new Netname(netName, new BitVector(bits), hidden));
        }
    }

    private static void removeUnusedBits(String moduleName, String netName, List<Bit> bits, JSONObject attributes) {
        if (attributes == null) return;
        Object unused = attributes.opt(YosysJson.UNUSED_BITS);
        if (!(unused instanceof String)) return;
        TreeSet<Integer> indices = new TreeSet<>(Collections.reverseOrder());
        for (String index : ((String) unused).trim().split("\\s+")) {
            if (index.isEmpty()) continue;
            try {
                indices.add(Integer.parseInt(index));
            } catch (NumberFormatException e) {
                throw new ModuleException(moduleName, "Invalid unused bit index '" + index
                        + "' for netname " + netName, e);
            }
        }
        for (int index : indices) {
            if (index < 0 || index >= bits.size()) {
                throw new ModuleException(moduleName, "Unused bit index " + index
                        + " out of range for netname " + netName);
            }
            bits.remove(index);
        }
    }

    private void readPorts(Module module, JSONObject ports) {
        if (ports == null) return;
        for (String portName : sortedKeys(ports)) {
            JSONObject data = ports.getJSONObject(portName);
            module.addPort(createPort(module.getName(), portName,
                    data.opt(YosysJson.BITS), data.opt(YosysJson.DIRECTION)));
        }
    }

    private void readCells(Module module, JSONObject cells) {
        if (cells == null) return;
        for (String cellName : sortedKeys(cells)) {
            JSONObject data = cells.getJSONObject(cellName);
            Object type = data.opt(YosysJson.TYPE);
            if (!(type instanceof String)) {
                throw new ModuleException(module.getName(), "Cell type of " + cellName + " is not valid");
            }
            JSONObject directions = data.optJSONObject(YosysJson.PORT_DIRECTIONS);
            JSONObject connections = data.optJSONObject(YosysJson.CONNECTIONS);
            if (directions == null || directions.isEmpty() || connections == null || connections.isEmpty()) {
                throw new ModuleException(module.getName(), "No port directions or connections found for cell "
                        + cellName);
            }
            if (directions.length() != connections.length()) {
                throw new ModuleException(module.getName(), "The number of port direction definitions of cell "
                        + cellName + " does not match the number of port connections");
            }
            List<Port> ports = new ArrayList<>();
            for (String portName : sortedKeys(directions)) {
                if (!connections.has(portName)) {
                    throw new ModuleException(module.getName(), "Port " + portName + " of cell " + cellName
                            + " has no connection");
                }
                ports.add(createPort(module.getName(), portName,
                        connections.get(portName), directions.get(portName)));
            }
            module.addNode(new Node(cellName, (String) type, ports));
        }
    }

    private static Port createPort(String moduleName, String portName, Object bitData, Object directionData) {
        PortDirection direction = directionData instanceof String
                ? PortDirection.getYosysDirection((String) directionData) : null;
        if (direction == null) {
            throw new ModuleException(moduleName, "Invalid direction '" + directionData + "' of port " + portName);
        }
        if (!(bitData instanceof JSONArray) || ((JSONArray) bitData).isEmpty()) {
            throw new ModuleException(moduleName, "No bits found for port " + portName);
        }
        return new Port(portName, direction, new BitVector(toBitList(moduleName, portName, (JSONArray) bitData)));
    }

    /**
     * Converts Yosys bit values: integers are net tokens, strings are constants,
     * no-connect markers or (rarely) net tokens.
     */
    static List<Bit> toBitList(String moduleName, String ownerName, JSONArray array) {
        List<Bit> bits = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            Object value = array.get(i);
            if (value instanceof Number) {
                bits.add(Bit.net(((Number) value).longValue()));
            } else if (value instanceof String && !((String) value).isEmpty()) {
                bits.add(Bit.parse((String) value));
            } else {
                throw new ModuleException(moduleName, "Invalid bit value '" + value + "' of " + ownerName);
            }
        }
        return bits;
    }

    private static List<String> sortedKeys(JSONObject object) {
        List<String> keys = new ArrayList<>(object.keySet());
        Collections.sort(keys);
        return keys;
    }
}
