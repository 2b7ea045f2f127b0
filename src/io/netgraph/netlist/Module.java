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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the boundary ports, nodes, paths and netnames of one circuit unit.
 * Every owned object receives an integer id when added; ports, nodes and
 * paths reference each other through these ids and the module resolves
 * them. Once a module is locked (after it has been accepted) its contents
 * can no longer be changed.
 */
public class Module {

    private final String name;

    private boolean top;

    private ModuleState state = ModuleState.PARSING;

    private boolean locked;

    private int nextId;

    /** Boundary ports, CONST ports included */
    private final List<Port> ports = new ArrayList<>();

    private final List<Node> nodes = new ArrayList<>();

    private final List<Path> paths = new ArrayList<>();

    private final List<Netname> netnames = new ArrayList<>();

    private final Map<BitVector, Netname> netnamesByBits = new LinkedHashMap<>();

    /** Every port of the module (boundary and node owned) by id */
    private final Map<Integer, Port> portMap = new HashMap<>();

    private final Map<Integer, Node> nodeMap = new HashMap<>();

    private final Map<String, Node> nodeNameMap = new HashMap<>();

    private final Map<Integer, Path> pathMap = new HashMap<>();

    /** Sub-module instances, keyed by the name of the instantiating node */
    private final Map<String, Module> subModules = new LinkedHashMap<>();

    public Module(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean isTop() {
        return top;
    }

    public void setTop(boolean top) {
        this.top = top;
    }

    public ModuleState getState() {
        return state;
    }

    public void setState(ModuleState state) {
        this.state = state;
    }

    public boolean isLocked() {
        return locked;
    }

    /**
     * Makes the module read-only. Any later attempt to add or remove ports,
     * nodes, paths or netnames throws an {@link IllegalStateException}.
     */
    public void lock() {
        locked = true;
    }

    private void checkUnlocked() {
        if (locked) {
            throw new IllegalStateException("ERROR: Module " + name + " is locked and cannot be modified");
        }
    }

    private int allocateId() {
        return nextId++;
    }

    private void registerPort(Port port) {
        if (port.getId() != NetlistObject.NO_ID) {
            throw new IllegalArgumentException("ERROR: Port " + port.getName()
                    + " already belongs to a module");
        }
        port.setId(allocateId());
        portMap.put(port.getId(), port);
    }

    /**
     * Adds a port to the boundary of this module.
     * @param port The port to add.
     * @return The added port.
     */
    public Port addPort(Port port) {
        checkUnlocked();
        registerPort(port);
        ports.add(port);
        return port;
    }

    /**
     * Adds a node and all of its ports to this module. Node names must be
     * unique within a module.
     * @param node The node to add.
     * @return The added node.
     */
    public Node addNode(Node node) {
        checkUnlocked();
        if (nodeNameMap.containsKey(node.getName())) {
            throw new RuntimeException("ERROR: Node name collision inside module " + name
                    + ", trying to add node " + node.getName() + " which already exists.");
        }
        node.setId(allocateId());
        for (Port p : node.getPorts()) {
            registerPort(p);
            p.setParentNodeId(node.getId());
        }
        nodes.add(node);
        nodeMap.put(node.getId(), node);
        nodeNameMap.put(node.getName(), node);
        return node;
    }

    public Path addPath(Path path) {
        checkUnlocked();
        path.setId(allocateId());
        paths.add(path);
        pathMap.put(path.getId(), path);
        return path;
    }

    /**
     * Removes a path and detaches its source and destination ports.
     * @param path The path to remove.
     * @return True if the path belonged to this module.
     */
    public boolean removePath(Path path) {
        checkUnlocked();
        if (pathMap.remove(path.getId()) == null) return false;
        paths.remove(path);
        if (path.hasSource()) {
            portMap.get(path.getSourceId()).setPathId(NetlistObject.NO_ID);
        }
        for (int destinationId : path.getDestinationIds()) {
            portMap.get(destinationId).setPathId(NetlistObject.NO_ID);
        }
        return true;
    }

    /**
     * Adds a netname. If another netname already binds the same bits, the
     * provided name is recorded as an alternative name of that netname instead.
     * @param netname The netname to add.
     * @return The netname that now carries the provided name.
     */
    public Netname addNetname(Netname netname) {
        checkUnlocked();
        Netname existing = netnamesByBits.get(netname.getBits());
        if (existing != null) {
            existing.addAlternativeName(netname.getName());
            return existing;
        }
        netnames.add(netname);
        netnamesByBits.put(netname.getBits(), netname);
        return netname;
    }

    private void checkAttachable(Path path, Port port) {
        if (!pathMap.containsKey(path.getId()) || !portMap.containsKey(port.getId())) {
            throw new IllegalArgumentException("ERROR: Path " + path.getName() + " and port "
                    + port.getName() + " must both belong to module " + name);
        }
        if (port.hasPath()) {
            throw new RuntimeException("ERROR: Port " + port.getName() + " is already attached to path "
                    + pathMap.get(port.getPathId()).getName());
        }
        if (!port.getBits().equals(path.getBits())) {
            throw new RuntimeException("ERROR: Bits of port " + port.getName() + " " + port.getBits()
                    + " differ from bits of path " + path.getName() + " " + path.getBits());
        }
    }

    /**
     * Attaches a port as the single driver of a path.
     * @param path The path being driven.
     * @param port The driving port, which must carry the path's bits.
     */
    public void attachSource(Path path, Port port) {
        checkUnlocked();
        if (path.hasSource()) {
            throw new RuntimeException("ERROR: Path " + path.getName() + " already has a driver "
                    + portMap.get(path.getSourceId()).getName());
        }
        checkAttachable(path, port);
        path.setSourceId(port.getId());
        port.setPathId(path.getId());
    }

    public void attachDestination(Path path, Port port) {
        checkUnlocked();
        checkAttachable(path, port);
        path.addDestinationId(port.getId());
        port.setPathId(path.getId());
    }

    public List<Port> getPorts() {
        return Collections.unmodifiableList(ports);
    }

    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Path> getPaths() {
        return Collections.unmodifiableList(paths);
    }

    public List<Netname> getNetnames() {
        return Collections.unmodifiableList(netnames);
    }

    /**
     * @return The boundary ports followed by the ports of each node, in the
     * order they were added.
     */
    public List<Port> getAllPorts() {
        List<Port> all = new ArrayList<>(ports);
        for (Node n : nodes) {
            all.addAll(n.getPorts());
        }
        return all;
    }

    /**
     * @return All ports that drive a signal: boundary INPUT and CONST ports
     * followed by node OUTPUT ports.
     */
    public List<Port> getDriverPorts() {
        List<Port> drivers = new ArrayList<>();
        for (Port p : getAllPorts()) {
            if (p.isDriver()) drivers.add(p);
        }
        return drivers;
    }

    /**
     * @return All ports that consume a signal: boundary OUTPUT ports followed
     * by node INPUT ports.
     */
    public List<Port> getConsumerPorts() {
        List<Port> consumers = new ArrayList<>();
        for (Port p : getAllPorts()) {
            if (!p.isDriver()) consumers.add(p);
        }
        return consumers;
    }

    public Port getPort(int id) {
        return portMap.get(id);
    }

    public Port getPort(String portName) {
        for (Port p : ports) {
            if (p.getName().equals(portName)) return p;
        }
        return null;
    }

    public Node getNode(int id) {
        return nodeMap.get(id);
    }

    public Node getNode(String nodeName) {
        return nodeNameMap.get(nodeName);
    }

    public boolean hasNode(String nodeName) {
        return nodeNameMap.containsKey(nodeName);
    }

    public Node getParentNode(Port port) {
        return nodeMap.get(port.getParentNodeId());
    }

    public Path getPath(Port port) {
        return pathMap.get(port.getPathId());
    }

    public Port getSource(Path path) {
        return portMap.get(path.getSourceId());
    }

    public List<Port> getDestinations(Path path) {
        List<Port> destinations = new ArrayList<>();
        for (int id : path.getDestinationIds()) {
            destinations.add(portMap.get(id));
        }
        return destinations;
    }

    public Netname getNetnameByBits(BitVector bits) {
        return netnamesByBits.get(bits);
    }

    /**
     * @return The first path whose bits equal the provided ones, or null.
     */
    public Path getPathByBits(BitVector bits) {
        for (Path p : paths) {
            if (p.getBits().equals(bits)) return p;
        }
        return null;
    }

    /**
     * Gets the label of the narrow side of a split or join node, the position
     * of a split output or join input inside the wide bus.
     * @param port A port of a split or join node.
     * @return The label in the form {@code <msb:lsb>}, or an empty string if
     * the port is not a split output or join input.
     */
    public String getSplitJoinLabel(Port port) {
        Node node = getParentNode(port);
        if (node == null) return "";
        if (!(node.isSplit() && port.isOutput()) && !(node.isJoin() && port.isInput())) return "";
        int[] positions = node.getSplitJoinBitPositions(port);
        if (positions == null) return "";
        return "<" + positions[0] + ":" + positions[1] + ">";
    }

    /**
     * @return The highest numeric net token used anywhere in this module, by
     * a boundary port, a node port or a netname.
     */
    public long getMaxBitNumber() {
        long max = 0;
        for (Port p : getAllPorts()) {
            max = Math.max(max, p.getBits().getMaxTokenNumber());
        }
        for (Netname n : netnames) {
            max = Math.max(max, n.getBits().getMaxTokenNumber());
        }
        return max;
    }

    /**
     * @return True if the module has no paths or any path is neither fully
     * connected nor carrying no-connect bits.
     */
    public boolean hasModuleInvalidPaths() {
        if (paths.isEmpty()) return true;
        for (Path p : paths) {
            if (!p.hasConnection()) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return ports.isEmpty() && nodes.isEmpty() && paths.isEmpty();
    }

    /**
     * @return True if every boundary port, every node and every path is
     * connected.
     */
    public boolean hasConnection() {
        for (Port p : ports) {
            if (!p.hasConnection()) return false;
        }
        for (Node n : nodes) {
            if (!n.hasConnection()) return false;
        }
        for (Path p : paths) {
            if (!p.hasConnection()) return false;
        }
        return true;
    }

    public void addSubModule(String instanceName, Module subModule) {
        subModules.put(instanceName, subModule);
    }

    public Map<String, Module> getSubModules() {
        return Collections.unmodifiableMap(subModules);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Module(").append(name).append(", ").append(state);
        sb.append(", Ports: ").append(ports.size());
        sb.append(", Nodes: ").append(nodes.size());
        sb.append(", Paths: ").append(paths.size());
        sb.append(", Netnames: ").append(netnames.size()).append(")");
        return sb.toString();
    }
}
