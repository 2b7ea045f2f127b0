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

import org.json.JSONObject;

import io.netgraph.netlist.Diagram;
import io.netgraph.netlist.Module;
import io.netgraph.netlist.ModuleException;
import io.netgraph.reconstruct.ModuleAssembler;
import io.netgraph.util.MessageGenerator;
import io.netgraph.util.Params;

/**
 * Builds a {@link Diagram} from a Yosys JSON document by reading and
 * assembling every module in turn. A rejected module is reported and skipped
 * unless strict mode is on.
 */
public class DiagramBuilder {

    private final YosysJsonReader reader = new YosysJsonReader();

    private final ModuleAssembler assembler;

    private final boolean strict;

    private final List<ModuleException> rejections = new ArrayList<>();

    public DiagramBuilder() {
        this(new ModuleAssembler(), Params.NETGRAPH_STRICT);
    }

    public DiagramBuilder(ModuleAssembler assembler, boolean strict) {
        this.assembler = assembler;
        this.strict = strict;
    }

    public Diagram build(JSONObject document) {
        rejections.clear();
        Diagram diagram = new Diagram();
        for (String name : reader.getModuleNames(document)) {
            JSONObject moduleJson = reader.getModuleJson(document, name);
            if (YosysJsonReader.isBlackbox(moduleJson)) continue;
            try {
                Module module = assembler.assemble(reader.readModule(name, moduleJson));
                if (module.isTop()) {
                    diagram.addTopModule(module);
                } else {
                    diagram.addModule(module);
                }
            } catch (ModuleException e) {
                rejections.add(e);
                if (strict) throw e;
                MessageGenerator.error(e.getMessage());
            }
        }
        diagram.linkSubModules(diagram.getTopModule());
        return diagram;
    }

    public Diagram build(String fileName) {
        return build(YosysJsonReader.readJsonFile(fileName));
    }

    /**
     * @return The rejections of the most recent {@link #build(JSONObject)}, in
     * processing order.
     */
    public List<ModuleException> getRejections() {
        return Collections.unmodifiableList(rejections);
    }
}
