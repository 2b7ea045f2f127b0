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
 * Thrown when a single module cannot be parsed or fails validation. Only the
 * offending module is abandoned, its siblings are processed normally.
 */
public class ModuleException extends RuntimeException {

    private static final long serialVersionUID = 4207651954210931286L;

    private final String moduleName;

    private final String reason;

    public ModuleException(String moduleName, String reason) {
        super("Error while parsing " + moduleName + ": " + reason);
        this.moduleName = moduleName;
        this.reason = reason;
    }

    public ModuleException(String moduleName, String reason, Throwable cause) {
        super("Error while parsing " + moduleName + ": " + reason, cause);
        this.moduleName = moduleName;
        this.reason = reason;
    }

    public String getModuleName() {
        return moduleName;
    }

    public String getReason() {
        return reason;
    }
}
