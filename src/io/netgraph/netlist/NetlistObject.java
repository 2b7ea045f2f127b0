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
 * Common ancestor of the named objects owned by a {@link Module}. Each object
 * receives a stable integer id when it is added to a module; cross references
 * between ports, nodes and paths are stored as these ids.
 */
public abstract class NetlistObject {

    public static final int NO_ID = -1;

    /** Name of the object */
    private final String name;

    private int id = NO_ID;

    protected NetlistObject(String name) {
        if (name == null) {
            throw new IllegalArgumentException("ERROR: Name must not be null");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @return The id assigned by the owning module, or {@link #NO_ID} if the
     * object has not been added to a module yet.
     */
    public int getId() {
        return id;
    }

    void setId(int id) {
        this.id = id;
    }

    @Override
    public String toString() {
        return name;
    }
}
