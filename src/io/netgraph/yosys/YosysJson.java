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

/**
 * Keys of the JSON document written by the Yosys {@code write_json} command.
 */
public class YosysJson {

    public static final String MODULES = "modules";
    public static final String PORTS = "ports";
    public static final String CELLS = "cells";
    public static final String NETNAMES = "netnames";

    public static final String ATTRIBUTES = "attributes";
    public static final String BLACKBOX = "blackbox";
    public static final String TOP = "top";
    public static final String UNUSED_BITS = "unused_bits";

    public static final String DIRECTION = "direction";
    public static final String BITS = "bits";

    public static final String TYPE = "type";
    public static final String PORT_DIRECTIONS = "port_directions";
    public static final String CONNECTIONS = "connections";

    public static final String HIDE_NAME = "hide_name";

    private YosysJson() {
    }
}
