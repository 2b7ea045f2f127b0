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

package io.netgraph.reconstruct;

import java.util.ArrayList;
import java.util.List;

import io.netgraph.netlist.Module;
import io.netgraph.netlist.Path;

/**
 * Removes every path that is not connected, that is a path lacking a driver
 * or lacking any destination. Paths carrying no-connect bits are kept.
 */
public class DanglingPathPruner {

    /**
     * @param module The module to prune.
     * @return The removed paths.
     */
    public List<Path> prune(Module module) {
        List<Path> toRemove = new ArrayList<>();
        for (Path p : module.getPaths()) {
            if (!p.hasConnection()) {
                toRemove.add(p);
            }
        }
        for (Path p : toRemove) {
            module.removePath(p);
        }
        return toRemove;
    }
}
