/*
 * Copyright (c) 2026, RapidBench contributors.
 * All rights reserved.
 *
 * This file is part of RapidBench.
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

package com.rapidbench.opt;

import java.util.Arrays;

/**
 * A cut: a set of netlist indices, kept sorted, whose values determine the
 * value of the node the cut belongs to.
 */
public class Cut implements Comparable<Cut> {

    private static final Cut EMPTY = new Cut(new int[0]);

    private final int[] leaves;

    private Cut(int[] sortedLeaves) {
        this.leaves = sortedLeaves;
    }

    public static Cut empty() {
        return EMPTY;
    }

    public static Cut of(int... leaves) {
        int[] sorted = leaves.clone();
        Arrays.sort(sorted);
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i] == sorted[i - 1]) {
                throw new IllegalArgumentException("Duplicate leaf " + sorted[i]);
            }
        }
        return new Cut(sorted);
    }

    public int size() {
        return leaves.length;
    }

    public int[] getLeaves() {
        return leaves.clone();
    }

    public boolean isTrivialFor(int index) {
        return leaves.length == 1 && leaves[0] == index;
    }

    /**
     * @param other Another cut.
     * @return The union of both cuts.
     */
    public Cut merge(Cut other) {
        int[] merged = new int[leaves.length + other.leaves.length];
        int i = 0, j = 0, n = 0;
        while (i < leaves.length && j < other.leaves.length) {
            if (leaves[i] < other.leaves[j]) {
                merged[n++] = leaves[i++];
            } else if (leaves[i] > other.leaves[j]) {
                merged[n++] = other.leaves[j++];
            } else {
                merged[n++] = leaves[i++];
                j++;
            }
        }
        while (i < leaves.length) merged[n++] = leaves[i++];
        while (j < other.leaves.length) merged[n++] = other.leaves[j++];
        return new Cut(Arrays.copyOf(merged, n));
    }

    /**
     * @param other Another cut.
     * @return True if every leaf of this cut is a leaf of the other.
     */
    public boolean dominates(Cut other) {
        if (leaves.length > other.leaves.length) return false;
        int j = 0;
        for (int leaf : leaves) {
            while (j < other.leaves.length && other.leaves[j] < leaf) j++;
            if (j == other.leaves.length || other.leaves[j] != leaf) return false;
            j++;
        }
        return true;
    }

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
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(leaves, ((Cut) o).leaves);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(leaves);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{ ");
        for (int leaf : leaves) {
            sb.append(leaf).append(' ');
        }
        return sb.append('}').toString();
    }
}
