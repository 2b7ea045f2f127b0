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

import java.math.BigInteger;

/**
 * Represents a port either on the boundary of a {@link Module} or owned by a
 * {@link Node}. The port stores the id of its owning node and of the
 * {@link Path} it is attached to; the module resolves those ids.
 */
public class Port extends NetlistObject {

    private final PortDirection direction;

    private BitVector bits;

    private int parentNodeId = NO_ID;

    private int pathId = NO_ID;

    /** Constant literals this port drives, CONST ports only */
    private BitVector constLiterals;

    public Port(String name, PortDirection direction, BitVector bits) {
        super(name);
        if (direction == null) {
            throw new IllegalArgumentException("ERROR: Port " + name + " has no direction");
        }
        if (bits == null || bits.isEmpty()) {
            throw new IllegalArgumentException("ERROR: Port " + name + " has no bits");
        }
        this.direction = direction;
        this.bits = bits;
    }

    /**
     * Creates a CONST port driving the provided fresh net tokens and remembers
     * the literals it stands for.
     * @param name Name of the new port.
     * @param bits The fresh net tokens driven by the port.
     * @param literals The constant literals, same width as bits.
     * @return The new CONST port.
     */
    public static Port createConstPort(String name, BitVector bits, BitVector literals) {
        if (literals.size() != bits.size()) {
            throw new IllegalArgumentException("ERROR: Constant port " + name + " has " + bits.size()
                    + " bits but " + literals.size() + " literals");
        }
        Port port = new Port(name, PortDirection.CONST, bits);
        port.constLiterals = literals;
        return port;
    }

    public PortDirection getDirection() {
        return direction;
    }

    public boolean isInput() {
        return direction == PortDirection.INPUT;
    }

    public boolean isOutput() {
        return direction == PortDirection.OUTPUT;
    }

    public boolean isConst() {
        return direction == PortDirection.CONST;
    }

    public BitVector getBits() {
        return bits;
    }

    public int getWidth() {
        return bits.size();
    }

    public boolean isBus() {
        return bits.size() > 1;
    }

    /**
     * Overwrites a range of bits starting at the provided index. The width of
     * the port never changes.
     * @param start Index of the first bit to replace.
     * @param replacement The new bits.
     */
    public void replaceBits(int start, BitVector replacement) {
        bits = bits.replace(start, replacement);
    }

    public boolean hasConstantBits() {
        return bits.hasConstantBits();
    }

    public boolean hasNoConnectBits() {
        return bits.hasNoConnectBits();
    }

    /**
     * @return True if this port is not owned by a node.
     */
    public boolean isBoundaryPort() {
        return parentNodeId == NO_ID;
    }

    /**
     * @return True if this port drives a signal, based on its direction and
     * whether it sits on the module boundary or on a node.
     */
    public boolean isDriver() {
        return isBoundaryPort() ? direction.isBoundaryDriver() : direction.isCellDriver();
    }

    public int getParentNodeId() {
        return parentNodeId;
    }

    void setParentNodeId(int parentNodeId) {
        this.parentNodeId = parentNodeId;
    }

    public int getPathId() {
        return pathId;
    }

    void setPathId(int pathId) {
        this.pathId = pathId;
    }

    public boolean hasPath() {
        return pathId != NO_ID;
    }

    /**
     * @return True if this port is attached to a path or is intentionally not
     * connected.
     */
    public boolean hasConnection() {
        return hasPath() || hasNoConnectBits();
    }

    public BitVector getConstLiterals() {
        return constLiterals;
    }

    /**
     * Interprets the constant literals of a CONST port as an unsigned number.
     * Bit index 0 is the least significant bit.
     * @return The constant value, 0 if this is not a CONST port.
     */
    public BigInteger getConstValue() {
        if (constLiterals == null) return BigInteger.ZERO;
        BigInteger value = BigInteger.ZERO;
        for (int i = constLiterals.size() - 1; i >= 0; i--) {
            value = value.shiftLeft(1);
            if (constLiterals.get(i).getType() == BitType.ONE) {
                value = value.setBit(0);
            }
        }
        return value;
    }

    public String getConstValueDecimal() {
        return getConstValue().toString();
    }

    public String getConstValueHex() {
        return "0x" + getConstValue().toString(16);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Port(").append(getName()).append(", ").append(direction).append(", Bits: ").append(bits);
        if (constLiterals != null) {
            sb.append(", Value: ").append(getConstValueHex());
        }
        sb.append(")");
        return sb.toString();
    }
}
