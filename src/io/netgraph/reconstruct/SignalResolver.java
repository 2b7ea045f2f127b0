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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import io.netgraph.netlist.BitVector;
import io.netgraph.netlist.Module;
import io.netgraph.netlist.Port;
import io.netgraph.util.Params;

/**
 * Determines, for every sink bit vector, which known sources drive it and
 * which split and join nodes are needed to connect them.
 * <p>
 * Each sink is resolved with an explicit stack of {@link ResolveTask}s. A
 * query that exactly matches a source is satisfied directly. A query found
 * inside a source requires a split of that source. A query found inside
 * another sink is resolved on its own first (a nested query, bounded in
 * depth) and then joined. Any other query is shrunk by one bit from its end
 * and retried. Whenever the query is not the whole sink, the sink becomes a
 * join of its resolved parts.
 * <p>
 * All pools are scanned in insertion order, so the first structural match
 * wins and results are reproducible.
 */
public class SignalResolver {

    private final int maxNestedDepth;

    public SignalResolver() {
        this(Params.NETGRAPH_MAX_NESTED_DEPTH);
    }

    public SignalResolver(int maxNestedDepth) {
        if (maxNestedDepth < 0) {
            throw new IllegalArgumentException("ERROR: Maximum nested depth must not be negative: " + maxNestedDepth);
        }
        this.maxNestedDepth = maxNestedDepth;
    }

    public int getMaxNestedDepth() {
        return maxNestedDepth;
    }

    /**
     * Collects the bits of every driving port of the module (boundary INPUT and
     * CONST ports, node OUTPUT ports). Ports carrying no-connect bits are left
     * out.
     */
    public static List<BitVector> collectSources(Module module) {
        List<BitVector> sources = new ArrayList<>();
        for (Port p : module.getDriverPorts()) {
            if (!p.hasNoConnectBits()) sources.add(p.getBits());
        }
        return sources;
    }

    /**
     * Collects the bits of every consuming port of the module (boundary OUTPUT
     * ports, node INPUT ports). Ports carrying no-connect bits are left out.
     */
    public static List<BitVector> collectSinks(Module module) {
        List<BitVector> sinks = new ArrayList<>();
        for (Port p : module.getConsumerPorts()) {
            if (!p.hasNoConnectBits()) sinks.add(p.getBits());
        }
        return sinks;
    }

    public ResolutionResult resolve(Module module) {
        return resolve(collectSources(module), collectSinks(module));
    }

    /**
     * Resolves every sink against the sources.
     * @param sources Bits that may drive a wire. The list is not modified.
     * @param sinks Bits that consume a wire. The list is not modified.
     * @return The split and join requests.
     */
    public ResolutionResult resolve(List<BitVector> sources, List<BitVector> sinks) {
        ResolutionResult result = new ResolutionResult();
        List<BitVector> sourcePool = new ArrayList<>(sources);
        List<BitVector> sinkPool = new ArrayList<>(sinks);
        for (BitVector sink : sinks) {
            // Already composed as part of an earlier sink
            if (result.hasJoin(sink)) continue;
            resolveSink(sink, sourcePool, sinkPool, result, 0);
        }
        return result;
    }

    private void resolveSink(BitVector sink, List<BitVector> sourcePool, List<BitVector> sinkPool,
                             ResolutionResult result, int depth) {
        if (depth > maxNestedDepth) {
            throw new IllegalStateException("ERROR: Resolving " + sink + " exceeds the maximum nested depth of "
                    + maxNestedDepth + " (" + Params.NETGRAPH_MAX_NESTED_DEPTH_NAME + ")");
        }
        Deque<ResolveTask> tasks = new ArrayDeque<>();
        tasks.push(ResolveTask.forSink(sink));

        while (!tasks.isEmpty()) {
            ResolveTask task = tasks.pop();
            // A sink is claimed at most once
            sinkPool.remove(sink);

            if (task.isExhausted(sink)) continue;

            BitVector query = task.getBits();
            boolean partial = !query.equals(sink);

            if (sourcePool.contains(query)) {
                if (partial) result.addJoin(sink, query);
                tasks.push(task.remainder(sink));
                continue;
            }

            BitVector wider = findContaining(sourcePool, query);
            if (wider != null) {
                if (partial) result.addJoin(sink, query);
                result.addSplit(wider, query);
                sourcePool.add(query);
                tasks.push(task.remainder(sink));
                continue;
            }

            if (findContaining(sinkPool, query) != null) {
                if (partial) result.addJoin(sink, query);
                resolveSink(query, sourcePool, new ArrayList<>(), result, depth + 1);
                sourcePool.add(query);
                if (sink.contains(query)) {
                    tasks.push(task.remainder(sink));
                }
                continue;
            }

            if (query.size() == 1) {
                result.addUnresolved(query);
            }
            tasks.push(task.shrink(sink));
        }
    }

    private static BitVector findContaining(List<BitVector> pool, BitVector query) {
        for (BitVector candidate : pool) {
            if (candidate.contains(query)) return candidate;
        }
        return null;
    }
}
