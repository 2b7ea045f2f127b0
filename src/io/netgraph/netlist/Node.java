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
import java.util.List;

/**
 * Represents a cell of a module: either an ordinary cell read from the
 * netlist or a synthesized split/join node. The node owns its ports in the
 * order they were provided.
 */
public class Node extends NetlistObject {

    /** Type tag of synthesized nodes decomposing one bus into sub ranges */
    public static final String SPLIT_TYPE = "split";

    /** Type tag of synthesized nodes composing one bus from several parts */
    public static final String JOIN_TYPE = "join";

    public static final String SPLIT_INPUT_NAME = "in";

    public static final String JOIN_OUTPUT_NAME = "out";

    private final String type;

    private final List<Port> ports;

    public Node(String name, String type, List<Port> ports) {
        super(name);
        this.type = type;
        this.ports = Collections.unmodifiableList(new ArrayList<>(ports));
    }

    public String getType() {
        return type;
    }

    public boolean isSplit() {
        return SPLIT_TYPE.equals(type);
    }

    public boolean isJoin() {
        return JOIN_TYPE.equals(type);
    }

    public List<Port> getPorts() {
        return ports;
    }

    public Port getPort(String name) {
        for (Port p : ports) {
            if (p.getName().equals(name)) return p;
        }
        return null;
    }

    /**
     * Gets the position of a split output (or join input) inside the wide bus
     * of the node, used to label the narrow side as {@code <msb:lsb>}.
     * @param labelPort A port of this node.
     * @return The pair {msb, lsb}, or null if this is not a split/join node or
     * the bits of the port do not occur in the wide bus.
     */
    public int[] getSplitJoinBitPositions(Port labelPort) {
        String wideName;
        if (isSplit()) {
            wideName = SPLIT_INPUT_NAME;
        } else if (isJoin()) {
            wideName = JOIN_OUTPUT_NAME;
        } else {
            return null;
        }
        Port wide = getPort(wideName);
        if (wide == null) return null;
        int lsb = wide.getBits().indexOf(labelPort.getBits());
        if (lsb == -1) return null;
        return new int[] { lsb + labelPort.getWidth() - 1, lsb };
    }

    /**
     * @return True if every port of this node is connected.
     */
    public boolean hasConnection() {
        for (Port p : ports) {
            if (!p.hasConnection()) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Node(").append(getName()).append(", ").append(type).append(", Ports: [");
        for (Port p : ports) {
            sb.append("\n    ").append(p);
        }
        sb.append("])");
        return sb.toString();
    }
}
