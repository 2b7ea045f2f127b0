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

import java.util.ArrayList;
import java.util.List;

import io.netgraph.netlist.BitVector;
import io.netgraph.netlist.Module;
import io.netgraph.netlist.Netname;
import io.netgraph.netlist.Path;
import io.netgraph.netlist.Port;

/**
 * Creates one path per driving port and attaches every consuming port whose
 * bits exactly match a path.
 */
public class SignalStitcher {

    public static final String SIGNAL_SUFFIX = "_sig";

    private final ConstantTranslation translation;

    public SignalStitcher(ConstantTranslation translation) {
        this.translation = translation;
    }

    /**
     * Stitches all drivers and consumers of the module. Consumers without a
     * matching path are left unattached.
     * @param module The module to stitch.
     * @return The created paths, in driver order.
     */
    public List<Path> stitch(Module module) {
        List<Path> created = new ArrayList<>();
        for (Port driver : module.getDriverPorts()) {
            Netname netname = findNetname(module, driver);
            Path path;
            if (netname != null) {
                path = new Path(netname.getName(), driver.getBits(), netname.isHidden());
                path.addAlternativeNames(netname.getAlternativeNames());
            } else {
                path = new Path(driver.getName() + SIGNAL_SUFFIX, driver.getBits(), true);
            }
            module.addPath(path);
            module.attachSource(path, driver);
            created.add(path);
        }

        for (Port consumer : module.getConsumerPorts()) {
            Path path = module.getPathByBits(consumer.getBits());
            if (path != null) {
                module.attachDestination(path, consumer);
            }
        }
        return created;
    }

    /**
     * Looks up the declared name of the bits a driver carries. A CONST driver
     * is named only when it replaced every bit of a port, by the literals of
     * that port; a CONST driver for part of a port stays unnamed. Other
     * drivers are looked up by their bits and, failing that, by the
     * pre-rewrite bits of a port that was rewritten to exactly these bits.
     */
    Netname findNetname(Module module, Port driver) {
        BitVector bits = driver.getBits();
        if (driver.isConst()) {
            BitVector original = translation.findOriginal(bits);
            return original == null ? null : module.getNetnameByBits(original);
        }
        Netname netname = module.getNetnameByBits(bits);
        if (netname == null) {
            BitVector original = translation.findOriginal(bits);
            if (original != null) {
                netname = module.getNetnameByBits(original);
            }
        }
        return netname;
    }
}
