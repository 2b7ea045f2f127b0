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
 * One slot of a bit-sequence: either a net token, a constant 0/1 or a
 * no-connect marker. Instances are immutable and compare by value, so two
 * ports that reference the same net token hold equal bits.
 */
public final class Bit {

    public static final Bit ZERO = new Bit(BitType.ZERO, "0");

    public static final Bit ONE = new Bit(BitType.ONE, "1");

    public static final Bit NO_CONNECT = new Bit(BitType.NO_CONNECT, "x");

    private final BitType type;

    private final String token;

    private Bit(BitType type, String token) {
        this.type = type;
        this.token = token;
    }

    /**
     * Creates a bit referencing the net identified by the provided token.
     * @param token The opaque net token (Yosys uses integers).
     * @return The new net bit.
     */
    public static Bit net(String token) {
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("ERROR: Net token must not be empty");
        }
        return new Bit(BitType.NET, token);
    }

    public static Bit net(long token) {
        return new Bit(BitType.NET, Long.toString(token));
    }

    /**
     * Interprets a string bit value the way Yosys writes them: "0" and "1" are
     * constants, "x" and "z" are not connected and anything else names a net.
     * @param value The string value of the bit.
     * @return The matching bit.
     */
    public static Bit parse(String value) {
        switch (value) {
            case "0":
                return ZERO;
            case "1":
                return ONE;
            case "x":
            case "z":
                return NO_CONNECT;
            default:
                return net(value);
        }
    }

    public BitType getType() {
        return type;
    }

    public String getToken() {
        return token;
    }

    public boolean isNet() {
        return type == BitType.NET;
    }

    public boolean isConstant() {
        return type.isConstant();
    }

    public boolean isNoConnect() {
        return type == BitType.NO_CONNECT;
    }

    /**
     * Gets the numeric value of a net token.
     * @return The decimal value of the token if it only consists of digits, 0
     * for constants, no-connects and non-numeric tokens.
     */
    public long getTokenNumber() {
        if (type != BitType.NET) return 0;
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) return 0;
        }
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + token.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Bit)) return false;
        Bit other = (Bit) obj;
        return type == other.type && token.equals(other.token);
    }

    @Override
    public String toString() {
        return token;
    }
}
