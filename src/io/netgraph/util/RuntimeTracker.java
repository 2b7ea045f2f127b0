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

package io.netgraph.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Records the elapsed time of a named stage. Trackers can be nested to report
 * the stages of one module under a common parent.
 */
public class RuntimeTracker {

    private final String name;

    private long time;

    private long start;

    private final List<RuntimeTracker> children = new ArrayList<>();

    public RuntimeTracker(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void start() {
        start = System.nanoTime();
    }

    /**
     * Stops the tracker and adds the time elapsed since the last
     * {@link #start()} to its total.
     */
    public void stop() {
        time += System.nanoTime() - start;
    }

    /**
     * @return The total time elapsed in nanoseconds.
     */
    public long getTime() {
        return time;
    }

    /**
     * Creates, registers and starts a child tracker.
     * @param childName Name of the stage.
     * @return The running child tracker.
     */
    public RuntimeTracker startChild(String childName) {
        RuntimeTracker child = new RuntimeTracker(childName);
        children.add(child);
        child.start();
        return child;
    }

    @Override
    public String toString() {
        return String.format("%-36s%9.3fs", name + ":", time * 1e-9);
    }

    /**
     * @return This tracker followed by one line per child tracker.
     */
    public String trackerWithChildren() {
        StringBuilder sb = new StringBuilder(toString());
        for (int i = 0; i < children.size(); i++) {
            sb.append('\n').append(i < children.size() - 1 ? "├─ " : "└─ ");
            sb.append(children.get(i));
        }
        return sb.toString();
    }
}
