/*
 * Copyright (c) 2024, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of RapidLUT.
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

package com.xilinx.rapidlut.cut;

import java.util.Arrays;

/**
 * An immutable set of leaf node ids bounding a candidate LUT rooted at some node. Leaves are kept
 * sorted in a small array so that union, subset and equality tests are linear merges over at most
 * K entries. A 64-bit signature with bit (id mod 64) set per leaf rejects most non-subsets in
 * constant time.
 */
public final class Cut implements Comparable<Cut> {

    /** Largest cut size (LUT input count) a cut can be built for */
    public static final int MAX_SIZE = 16;

    private final int[] leaves;
    private final long signature;

    private Cut(int[] sortedLeaves) {
        this.leaves = sortedLeaves;
        long sig = 0;
        for (int leaf : sortedLeaves) {
            sig |= 1L << (leaf & 63);
        }
        this.signature = sig;
    }

    /**
     * Creates the cut made of a node alone. Every node has this cut first in its cut list.
     * @param nodeId The node.
     * @return The single-leaf cut.
     */
    public static Cut trivial(int nodeId) {
        return new Cut(new int[] {nodeId});
    }

    /**
     * Creates a cut from arbitrary leaf ids. Duplicates are collapsed.
     * @param leafIds Leaf node ids.
     * @return The cut.
     */
    public static Cut of(int... leafIds) {
        int[] sorted = Arrays.stream(leafIds).sorted().distinct().toArray();
        if (sorted.length > MAX_SIZE) {
            throw new IllegalArgumentException("ERROR: Cut of " + sorted.length
                    + " leaves exceeds the maximum size of " + MAX_SIZE);
        }
        return new Cut(sorted);
    }

    /**
     * Merges this cut with another one.
     * @param other The cut to merge with.
     * @param maxSize The largest acceptable result size (K).
     * @return The union of both leaf sets, or null if it has more than maxSize leaves.
     */
    public Cut union(Cut other, int maxSize) {
        if (Long.bitCount(signature | other.signature) > maxSize) {
            // more distinct residues than allowed leaves already
            return null;
        }
        int[] merged = new int[Math.min(leaves.length + other.leaves.length, maxSize + 1)];
        int i = 0;
        int j = 0;
        int n = 0;
        while (i < leaves.length || j < other.leaves.length) {
            int next;
            if (j == other.leaves.length || (i < leaves.length && leaves[i] < other.leaves[j])) {
                next = leaves[i++];
            } else if (i == leaves.length || other.leaves[j] < leaves[i]) {
                next = other.leaves[j++];
            } else {
                next = leaves[i++];
                j++;
            }
            if (n == maxSize) {
                return null;
            }
            merged[n++] = next;
        }
        return new Cut(n == merged.length ? merged : Arrays.copyOf(merged, n));
    }

    /**
     * Checks set inclusion.
     * @param other The potential superset.
     * @return True if every leaf of this cut is a leaf of other (equal cuts included).
     */
    public boolean isSubsetOf(Cut other) {
        if (leaves.length > other.leaves.length || (signature & ~other.signature) != 0) {
            return false;
        }
        int j = 0;
        for (int leaf : leaves) {
            while (j < other.leaves.length && other.leaves[j] < leaf) {
                j++;
            }
            if (j == other.leaves.length || other.leaves[j] != leaf) {
                return false;
            }
            j++;
        }
        return true;
    }

    public boolean contains(int nodeId) {
        if ((signature & (1L << (nodeId & 63))) == 0) {
            return false;
        }
        return Arrays.binarySearch(leaves, nodeId) >= 0;
    }

    public int size() {
        return leaves.length;
    }

    /**
     * @param index Position in ascending leaf order.
     * @return The leaf node id.
     */
    public int getLeaf(int index) {
        return leaves[index];
    }

    /**
     * @return A copy of the leaf ids in ascending order.
     */
    public int[] leaves() {
        return leaves.clone();
    }

    public long getSignature() {
        return signature;
    }

    /**
     * Orders cuts by size, then by their ascending leaf ids.
     */
    @Override
    public int compareTo(Cut o) {
        if (leaves.length != o.leaves.length) {
            return Integer.compare(leaves.length, o.leaves.length);
        }
        return Arrays.compare(leaves, o.leaves);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cut)) return false;
        Cut other = (Cut) o;
        return signature == other.signature && Arrays.equals(leaves, other.leaves);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(leaves);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < leaves.length; i++) {
            if (i > 0) sb.append(",");
            sb.append(leaves[i]);
        }
        return sb.append("}").toString();
    }
}
