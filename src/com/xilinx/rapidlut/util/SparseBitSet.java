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

package com.xilinx.rapidlut.util;

import java.util.Arrays;

/**
 * Bit set over non-negative node ids that only allocates storage for the regions in use.
 * Traversals create one per call to track visited nodes without marking the nodes themselves.
 */
public class SparseBitSet {
    protected static final int INITIAL_SIZE_FIRST_DIM = 32;

    protected static final int BITS_MAX = 31;
    protected static final int BITS_LAST_DIM = 6; // log2(64) where 64 bits exist in a long
    protected static final int BITS_FIRST_DIM = 16;
    protected static final int BITS_SECOND_DIM = BITS_MAX - BITS_LAST_DIM - BITS_FIRST_DIM;
    protected static final int SHIFT_SECOND_DIM = BITS_LAST_DIM;
    protected static final int SHIFT_FIRST_DIM = BITS_SECOND_DIM + SHIFT_SECOND_DIM;
    protected static final int MASK_LAST_DIM = (1 << BITS_LAST_DIM) - 1;
    protected static final int MASK_SECOND_DIM = ((1 << BITS_SECOND_DIM) - 1) << BITS_LAST_DIM;

    protected long[][] words = new long[INITIAL_SIZE_FIRST_DIM][];
    protected int highestSetWord = -1;
    private int cardinality;

    public SparseBitSet() {
    }

    public boolean get(int bit) {
        final int firstDim = bit >> SHIFT_FIRST_DIM;
        if (firstDim > highestSetWord) {
            return false;
        }
        if (words[firstDim] == null)
            return false;
        final int secondDim = (bit & MASK_SECOND_DIM) >> SHIFT_SECOND_DIM;
        final long bitMask = 1L << (bit & MASK_LAST_DIM);
        return (words[firstDim][secondDim] & bitMask) != 0;
    }

    /**
     * Sets the given bit.
     * @param bit Bit index, must be non-negative.
     * @return True if the bit was previously clear.
     */
    public boolean set(int bit) {
        if (bit < 0) {
            throw new IndexOutOfBoundsException("ERROR: Negative bit index " + bit);
        }
        final int firstDim = bit >> SHIFT_FIRST_DIM;
        if (firstDim >= words.length) {
            // Round up to next power of 2
            words = Arrays.copyOf(words, Integer.highestOneBit(firstDim) << 1);
        }
        if (words[firstDim] == null) {
            words[firstDim] = new long[1 << BITS_SECOND_DIM];
        }
        final int secondDim = (bit & MASK_SECOND_DIM) >> SHIFT_SECOND_DIM;
        final long bitMask = 1L << (bit & MASK_LAST_DIM);
        boolean wasClear = (words[firstDim][secondDim] & bitMask) == 0;
        words[firstDim][secondDim] |= bitMask;
        highestSetWord = Math.max(highestSetWord, firstDim);
        if (wasClear) {
            cardinality++;
        }
        return wasClear;
    }

    /**
     * Clears the given bit, leaving the storage in place for later reuse.
     * @param bit Bit index.
     */
    public void clear(int bit) {
        if (!get(bit)) {
            return;
        }
        final int firstDim = bit >> SHIFT_FIRST_DIM;
        final int secondDim = (bit & MASK_SECOND_DIM) >> SHIFT_SECOND_DIM;
        final long bitMask = 1L << (bit & MASK_LAST_DIM);
        words[firstDim][secondDim] &= ~bitMask;
        cardinality--;
    }

    public void clear() {
        Arrays.fill(words, 0, highestSetWord + 1, null);
        highestSetWord = -1;
        cardinality = 0;
    }

    public boolean isEmpty() {
        return cardinality == 0;
    }

    public int cardinality() {
        return cardinality;
    }
}
