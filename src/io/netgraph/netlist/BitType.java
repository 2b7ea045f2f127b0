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
 * The kinds of values a single bit slot of a port or wire can hold.
 */
public enum BitType {
    /** A reference to a single-bit net, identified by an opaque token */
    NET,
    /** Constant logic 0 */
    ZERO,
    /** Constant logic 1 */
    ONE,
    /** Intentionally unconnected ("x") */
    NO_CONNECT;

    public boolean isConstant() {
        return this == ZERO || this == ONE;
    }
}
