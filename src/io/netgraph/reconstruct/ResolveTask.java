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

import io.netgraph.netlist.BitVector;

/**
 * One unit of work of the {@link SignalResolver}: the query {@code bits},
 * which occupy the half open range {@code [start, end)} of the sink being
 * resolved.
 */
final class ResolveTask {

    private final int start;

    private final int end;

    private final BitVector bits;

    ResolveTask(int start, int end, BitVector bits) {
        this.start = start;
        this.end = end;
        this.bits = bits;
    }

    static ResolveTask forSink(BitVector sink) {
        return new ResolveTask(0, sink.size(), sink);
    }

    int getStart() {
        return start;
    }

    int getEnd() {
        return end;
    }

    BitVector getBits() {
        return bits;
    }

    /**
     * @return True if nothing is left to resolve for this task.
     */
    boolean isExhausted(BitVector sink) {
        return start >= sink.size() || end - start < 1;
    }

    /**
     * @return The task resolving everything of the sink after this query.
     */
    ResolveTask remainder(BitVector sink) {
        return new ResolveTask(end, sink.size(), sink.slice(end, sink.size()));
    }

    /**
     * @return The same query with its last bit dropped.
     */
    ResolveTask shrink(BitVector sink) {
        return new ResolveTask(start, end - 1, sink.slice(start, end - 1));
    }

    @Override
    public String toString() {
        return "ResolveTask([" + start + ", " + end + "), " + bits + ")";
    }
}
