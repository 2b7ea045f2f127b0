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

/**
 * Provides the directional options for ports. CONST ports are never read from
 * a netlist, they are synthesized to drive constant bits.
 */
public enum PortDirection {
    INPUT,
    OUTPUT,
    CONST;

    /**
     * Maps a Yosys direction string onto a port direction.
     * @param s The direction as written by Yosys ("input" or "output").
     * @return The matching direction, or null if the string is not a supported
     * direction ("inout" included).
     */
    public static PortDirection getYosysDirection(String s) {
        if (s == null) return null;
        if (s.equals("input")) return INPUT;
        if (s.equals("output")) return OUTPUT;
        return null;
    }

    /**
     * @return True if a port of this direction placed on the module boundary
     * drives a signal into the module.
     */
    public boolean isBoundaryDriver() {
        return this == INPUT || this == CONST;
    }

    /**
     * @return True if a port of this direction placed on a cell drives a signal
     * out of the cell.
     */
    public boolean isCellDriver() {
        return this == OUTPUT;
    }
}
