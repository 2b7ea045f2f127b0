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

import java.util.List;

import io.netgraph.netlist.Module;
import io.netgraph.netlist.ModuleException;
import io.netgraph.netlist.ModuleState;
import io.netgraph.netlist.Node;
import io.netgraph.netlist.Path;
import io.netgraph.util.MessageGenerator;
import io.netgraph.util.Params;
import io.netgraph.util.RuntimeTracker;

/**
 * Runs the reconstruction stages on a module populated with boundary ports,
 * cells and netnames, and validates the result. An accepted module is
 * locked; a rejected one raises a {@link ModuleException}.
 */
public class ModuleAssembler {

    public static final String NO_PORTS_OR_NODES = "Module has no Ports or Nodes";

    public static final String INVALID_PATHS = "Module has invalid Paths";

    public static final String EMPTY_MODULE = "Module is empty";

    private final int maxNestedDepth;

    private final boolean verbose;

    private ResolutionResult lastResolution;

    public ModuleAssembler() {
        this(Params.NETGRAPH_MAX_NESTED_DEPTH, Params.NETGRAPH_VERBOSE);
    }

    public ModuleAssembler(int maxNestedDepth, boolean verbose) {
        this.maxNestedDepth = maxNestedDepth;
        this.verbose = verbose;
    }

    /**
     * Materializes constants, resolves splits and joins, synthesizes nodes,
     * stitches paths, prunes dangling paths and validates the module.
     * @param module A module in the {@link ModuleState#PARSING} state.
     * @return The same module, now accepted and locked.
     * @throws ModuleException If the module is rejected.
     */
    public Module assemble(Module module) {
        if (module.getState() != ModuleState.PARSING) {
            throw new IllegalStateException("ERROR: Module " + module.getName()
                    + " cannot be assembled in state " + module.getState());
        }
        if (module.getPorts().isEmpty() && module.getNodes().isEmpty()) {
            reject(module, NO_PORTS_OR_NODES, null);
        }

        RuntimeTracker total = new RuntimeTracker("Assemble " + module.getName());
        total.start();

        RuntimeTracker t = total.startChild("Materialize constants");
        ConstantMaterializer materializer = new ConstantMaterializer();
        ConstantTranslation translation = materializer.materialize(module, BitTokenAllocator.forModule(module));
        t.stop();

        t = total.startChild("Resolve signals");
        try {
            lastResolution = new SignalResolver(maxNestedDepth).resolve(module);
        } catch (IllegalStateException e) {
            reject(module, e.getMessage(), e);
        }
        t.stop();

        t = total.startChild("Synthesize nodes");
        List<Node> synthesized = new NodeSynthesizer().synthesize(module, lastResolution);
        t.stop();

        t = total.startChild("Stitch signals");
        List<Path> stitched = new SignalStitcher(translation).stitch(module);
        t.stop();

        t = total.startChild("Prune paths");
        List<Path> pruned = new DanglingPathPruner().prune(module);
        t.stop();

        module.setState(ModuleState.VALIDATING);
        if (module.hasModuleInvalidPaths()) {
            reject(module, INVALID_PATHS, null);
        }
        if (module.isEmpty()) {
            reject(module, EMPTY_MODULE, null);
        }
        module.setState(ModuleState.ACCEPTED);
        module.lock();
        total.stop();

        if (verbose) {
            MessageGenerator.info("Module " + module.getName() + ": "
                    + materializer.getConstPorts().size() + " constant ports, "
                    + synthesized.size() + " split/join nodes, "
                    + stitched.size() + " paths stitched, "
                    + pruned.size() + " pruned, "
                    + lastResolution.getUnresolved().size() + " unresolved bits");
            MessageGenerator.briefMessage(total.trackerWithChildren());
        }
        return module;
    }

    /**
     * @return The split and join requests of the most recently assembled
     * module, or null if none has been resolved yet.
     */
    public ResolutionResult getLastResolution() {
        return lastResolution;
    }

    private static void reject(Module module, String reason, Throwable cause) {
        module.setState(ModuleState.REJECTED);
        throw cause == null ? new ModuleException(module.getName(), reason)
                : new ModuleException(module.getName(), reason, cause);
    }
}
