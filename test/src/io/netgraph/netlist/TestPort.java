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

import static io.netgraph.support.NetlistTestUtils.bits;

import java.math.BigInteger;
import java.util.Arrays;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestPort {

    @Test
    public void testPortWithoutBits() {
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> new Port("p", PortDirection.INPUT, BitVector.EMPTY));
        Assertions.assertEquals("ERROR: Port p has no bits", e.getMessage());
    }

    @Test
    public void testReplaceBitsKeepsWidth() {
        Port p = new Port("p", PortDirection.OUTPUT, bits("2", "0", "1", "3"));
        p.replaceBits(1, bits("10", "11"));
        Assertions.assertEquals(bits("2", "10", "11", "3"), p.getBits());
        Assertions.assertEquals(4, p.getWidth());
        Assertions.assertFalse(p.hasConstantBits());
    }

    @ParameterizedTest
    @CsvSource({
            "0,0,0,0x0",
            "1,0,1,0x1",
            "0,1,2,0x2",
            "1,1,3,0x3",
    })
    public void testConstValueIsLsbFirst(String bit0, String bit1, String decimal, String hex) {
        Port p = Port.createConstPort("c", bits("8", "9"), bits(bit0, bit1));
        Assertions.assertTrue(p.isConst());
        Assertions.assertEquals(decimal, p.getConstValueDecimal());
        Assertions.assertEquals(hex, p.getConstValueHex());
    }

    @Test
    public void testWideConstValue() {
        String[] literals = new String[12];
        for (int i = 0; i < literals.length; i++) {
            literals[i] = "1";
        }
        String[] tokens = new String[12];
        for (int i = 0; i < tokens.length; i++) {
            tokens[i] = Integer.toString(100 + i);
        }
        Port p = Port.createConstPort("c", bits(tokens), bits(literals));
        Assertions.assertEquals(BigInteger.valueOf(4095), p.getConstValue());
        Assertions.assertEquals("0xfff", p.getConstValueHex());
    }

    @Test
    public void testConstPortWidthMismatch() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> Port.createConstPort("c", bits("8", "9"), bits("1")));
    }

    @Test
    public void testDriverRole() {
        Module m = new Module("m");
        Port in = m.addPort(new Port("in", PortDirection.INPUT, bits("2")));
        Port out = m.addPort(new Port("out", PortDirection.OUTPUT, bits("2")));
        Port cellIn = new Port("A", PortDirection.INPUT, bits("2"));
        Port cellOut = new Port("Y", PortDirection.OUTPUT, bits("3"));
        m.addNode(new Node("u0", "$not", Arrays.asList(cellIn, cellOut)));

        Assertions.assertTrue(in.isBoundaryPort());
        Assertions.assertTrue(in.isDriver());
        Assertions.assertFalse(out.isDriver());
        Assertions.assertFalse(cellIn.isBoundaryPort());
        Assertions.assertFalse(cellIn.isDriver());
        Assertions.assertTrue(cellOut.isDriver());
    }

    @Test
    public void testNoConnectPortIsConnected() {
        Port p = new Port("p", PortDirection.OUTPUT, bits("x", "4"));
        Assertions.assertFalse(p.hasPath());
        Assertions.assertTrue(p.hasConnection());
        Assertions.assertFalse(new Port("q", PortDirection.OUTPUT, bits("4")).hasConnection());
    }
}
