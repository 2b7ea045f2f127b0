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

/**
 * An inclusive range of bit indices {@code [start, end]} within a bit vector.
 */
public final class BitRange implements Comparable<BitRange> {

    private final int start;

    private final int end;

    public BitRange(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("ERROR: Invalid bit range [" + start + ", " + end + "]");
        }
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getLength() {
        return end - start + 1;
    }

    @Override
    public int compareTo(BitRange o) {
        int c = Integer.compare(start, o.start);
        return c != 0 ? c : Integer.compare(end, o.end);
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BitRange)) return false;
        BitRange other = (BitRange) obj;
        return start == other.start && end == other.end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
