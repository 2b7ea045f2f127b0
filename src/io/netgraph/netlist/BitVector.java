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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An immutable ordered sequence of {@link Bit}s. The length of the sequence is
 * the electrical width of the port or wire it describes. Bit vectors compare
 * by content and are used as keys throughout the reconstruction.
 */
public final class BitVector implements Iterable<Bit> {

    public static final BitVector EMPTY = new BitVector(new Bit[0]);

    private final Bit[] bits;

    private int hash;

    private BitVector(Bit[] bits) {
        this.bits = bits;
    }

    public BitVector(List<Bit> bits) {
        this(bits.toArray(new Bit[0]));
        for (Bit b : this.bits) {
            if (b == null) throw new IllegalArgumentException("ERROR: Null bit in bit vector " + bits);
        }
    }

    public static BitVector of(Bit... bits) {
        return new BitVector(Arrays.asList(bits));
    }

    /**
     * Builds a bit vector from string values using {@link Bit#parse(String)}.
     * @param values The bit values, index 0 first.
     * @return The new bit vector.
     */
    public static BitVector parse(String... values) {
        Bit[] bits = new Bit[values.length];
        for (int i = 0; i < values.length; i++) {
            bits[i] = Bit.parse(values[i]);
        }
        return new BitVector(bits);
    }

    public int size() {
        return bits.length;
    }

    public boolean isEmpty() {
        return bits.length == 0;
    }

    public Bit get(int index) {
        return bits[index];
    }

    /**
     * Finds the first contiguous occurrence of the provided sequence in this one.
     * @param other The sequence to search for.
     * @return The index of the first bit of the occurrence, or -1 if none exists.
     * An empty sequence is never found.
     */
    public int indexOf(BitVector other) {
        int n = other.bits.length;
        if (n == 0 || n > bits.length) return -1;
        outer:
        for (int i = 0; i <= bits.length - n; i++) {
            for (int j = 0; j < n; j++) {
                if (!bits[i + j].equals(other.bits[j])) continue outer;
            }
            return i;
        }
        return -1;
    }

    /**
     * @return True if the provided sequence appears contiguously in this one
     * (equal sequences included).
     */
    public boolean contains(BitVector other) {
        return indexOf(other) != -1;
    }

    /**
     * Gets the bits in the half open range [from, to).
     */
    public BitVector slice(int from, int to) {
        if (from < 0 || to > bits.length || from > to) {
            throw new IndexOutOfBoundsException("ERROR: Invalid slice [" + from + ", " + to
                    + ") of bit vector with width " + bits.length);
        }
        if (from == to) return EMPTY;
        return new BitVector(Arrays.copyOfRange(bits, from, to));
    }

    /**
     * Creates a copy of this sequence where the bits starting at the provided
     * index are overwritten by the replacement. The width never changes.
     * @param start Index of the first bit to overwrite.
     * @param replacement The bits to write.
     * @return The rewritten copy.
     */
    public BitVector replace(int start, BitVector replacement) {
        if (start < 0 || start + replacement.size() > bits.length) {
            throw new IndexOutOfBoundsException("ERROR: Replacement of width " + replacement.size()
                    + " at index " + start + " does not fit into width " + bits.length);
        }
        Bit[] copy = bits.clone();
        System.arraycopy(replacement.bits, 0, copy, start, replacement.bits.length);
        return new BitVector(copy);
    }

    public BitVector concat(BitVector other) {
        Bit[] copy = Arrays.copyOf(bits, bits.length + other.bits.length);
        System.arraycopy(other.bits, 0, copy, bits.length, other.bits.length);
        return new BitVector(copy);
    }

    public boolean hasConstantBits() {
        for (Bit b : bits) {
            if (b.isConstant()) return true;
        }
        return false;
    }

    public boolean hasNoConnectBits() {
        for (Bit b : bits) {
            if (b.isNoConnect()) return true;
        }
        return false;
    }

    public boolean isAllNoConnect() {
        for (Bit b : bits) {
            if (!b.isNoConnect()) return false;
        }
        return true;
    }

    public boolean isAllConstantOrNoConnect() {
        for (Bit b : bits) {
            if (b.isNet()) return false;
        }
        return true;
    }

    /**
     * @return The highest numeric net token in this sequence, 0 if there is none.
     */
    public long getMaxTokenNumber() {
        long max = 0;
        for (Bit b : bits) {
            max = Math.max(max, b.getTokenNumber());
        }
        return max;
    }

    public List<Bit> toList() {
        return Collections.unmodifiableList(Arrays.asList(bits));
    }

    public List<String> toStringList() {
        List<String> values = new ArrayList<>(bits.length);
        for (Bit b : bits) {
            values.add(b.getToken());
        }
        return values;
    }

    @Override
    public Iterator<Bit> iterator() {
        return toList().iterator();
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0 && bits.length > 0) {
            h = Arrays.hashCode(bits);
            hash = h;
        }
        return h;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BitVector)) return false;
        return Arrays.equals(bits, ((BitVector) obj).bits);
    }

    @Override
    public String toString() {
        return Arrays.toString(bits);
    }
}
