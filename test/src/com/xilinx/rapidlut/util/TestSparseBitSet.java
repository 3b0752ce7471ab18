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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestSparseBitSet {

    @Test
    public void testSetAndGet() {
        SparseBitSet bits = new SparseBitSet();
        Assertions.assertTrue(bits.isEmpty());
        Assertions.assertTrue(bits.set(0));
        Assertions.assertTrue(bits.set(63));
        Assertions.assertTrue(bits.set(64));
        Assertions.assertTrue(bits.set(5_000_000));
        Assertions.assertFalse(bits.set(64));
        Assertions.assertEquals(4, bits.cardinality());
        Assertions.assertTrue(bits.get(5_000_000));
        Assertions.assertFalse(bits.get(4_999_999));
        Assertions.assertFalse(bits.get(Integer.MAX_VALUE));
    }

    @Test
    public void testClear() {
        SparseBitSet bits = new SparseBitSet();
        bits.set(10);
        bits.set(70_000);
        bits.clear(10);
        bits.clear(11);
        Assertions.assertFalse(bits.get(10));
        Assertions.assertEquals(1, bits.cardinality());
        bits.clear();
        Assertions.assertTrue(bits.isEmpty());
        Assertions.assertFalse(bits.get(70_000));
        Assertions.assertTrue(bits.set(70_000));
    }

    @Test
    public void testNegativeIndex() {
        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> new SparseBitSet().set(-1));
    }
}
