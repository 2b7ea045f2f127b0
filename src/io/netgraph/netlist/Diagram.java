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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The accepted modules of one design, in processing order, and the design's
 * top module.
 */
public class Diagram {

    private final List<Module> modules = new ArrayList<>();

    private Module topModule;

    public void addModule(Module module) {
        if (module != null) {
            modules.add(module);
        }
    }

    public void addTopModule(Module module) {
        if (module != null) {
            addModule(module);
            topModule = module;
        }
    }

    public Module getTopModule() {
        return topModule;
    }

    public List<Module> getModules() {
        return Collections.unmodifiableList(modules);
    }

    public Module getModuleByName(String name) {
        for (Module m : modules) {
            if (m.getName().equals(name)) return m;
        }
        return null;
    }

    /**
     * Links sub-module instances starting from the provided module: every node
     * whose type is the name of another module becomes an instance of that
     * module. Linking continues recursively into each instantiated module.
     * @param module The module to start from, typically the top module.
     */
    public void linkSubModules(Module module) {
        linkSubModules(module, new HashSet<>());
    }

    private void linkSubModules(Module module, Set<Module> visited) {
        if (module == null || !visited.add(module)) return;
        for (Node node : module.getNodes()) {
            Module subModule = getModuleByName(node.getType());
            if (subModule != null) {
                module.addSubModule(node.getName(), subModule);
                linkSubModules(subModule, visited);
            }
        }
    }

    /**
     * Prints the tree of module types below the provided module, indenting
     * two spaces per level.
     * @param module The root of the printed tree.
     * @param ps The stream to print to.
     */
    public void printSubModuleHierarchy(Module module, PrintStream ps) {
        printSubModuleHierarchy(module, ps, 0);
    }

    private void printSubModuleHierarchy(Module module, PrintStream ps, int depth) {
        if (module == null || depth > modules.size()) return;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        ps.println(sb + module.getName());
        for (Map.Entry<String, Module> e : module.getSubModules().entrySet()) {
            printSubModuleHierarchy(e.getValue(), ps, depth + 1);
        }
    }
}
