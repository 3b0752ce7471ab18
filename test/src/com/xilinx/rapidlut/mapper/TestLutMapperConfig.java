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

package com.xilinx.rapidlut.mapper;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.xilinx.rapidlut.cut.CutEnumerator;
import com.xilinx.rapidlut.util.Params;

public class TestLutMapperConfig {

    @Test
    public void testDefaults() {
        LutMapperConfig config = new LutMapperConfig();
        Assertions.assertEquals(Params.RAPIDLUT_DEFAULT_LUT_SIZE, config.getLutSize());
        Assertions.assertEquals(CutEnumerator.UNLIMITED, config.getMaxCutsPerNode());
        Assertions.assertFalse(config.isPrintSlackReport());
        config.validate();
        Assertions.assertTrue(config.toString().contains("unlimited"));
    }

    @Test
    public void testArguments() {
        LutMapperConfig config = new LutMapperConfig(new String[] {"--lutSize", "4", "--maxCutsPerNode", "8",
                "--verbose", "--printSlackReport"});
        Assertions.assertEquals(4, config.getLutSize());
        Assertions.assertEquals(8, config.getMaxCutsPerNode());
        Assertions.assertTrue(config.isVerbose());
        Assertions.assertTrue(config.isPrintSlackReport());
    }

    @Test
    public void testBadArguments() {
        Assertions.assertThrows(ConfigException.class, () -> new LutMapperConfig(new String[] {"--lutsize", "4"}));
        Assertions.assertThrows(ConfigException.class, () -> new LutMapperConfig(new String[] {"--lutSize"}));
        ConfigException e = Assertions.assertThrows(ConfigException.class,
                () -> new LutMapperConfig(new String[] {"--maxCutsPerNode", "many"}));
        Assertions.assertTrue(e.getCause() instanceof NumberFormatException);
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 0, 1, 17})
    public void testInvalidLutSize(int lutSize) {
        LutMapperConfig config = new LutMapperConfig();
        config.setLutSize(lutSize);
        Assertions.assertThrows(ConfigException.class, config::validate);
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 6, 16})
    public void testValidLutSize(int lutSize) {
        LutMapperConfig config = new LutMapperConfig();
        config.setLutSize(lutSize);
        config.validate();
    }

    @Test
    public void testInvalidCutLimit() {
        LutMapperConfig config = new LutMapperConfig(new String[] {"--maxCutsPerNode", "0"});
        Assertions.assertThrows(ConfigException.class, config::validate);
    }

    @Test
    public void testJvmPropertyDefaults() {
        System.setProperty(Params.RAPIDLUT_LUT_SIZE_NAME, "5");
        System.setProperty(Params.RAPIDLUT_MAX_CUTS_PER_NODE_NAME, "12");
        try {
            LutMapperConfig config = new LutMapperConfig();
            Assertions.assertEquals(5, config.getLutSize());
            Assertions.assertEquals(12, config.getMaxCutsPerNode());
            // arguments override the defaults
            config = new LutMapperConfig(new String[] {"--lutSize", "3"});
            Assertions.assertEquals(3, config.getLutSize());
        } finally {
            System.clearProperty(Params.RAPIDLUT_LUT_SIZE_NAME);
            System.clearProperty(Params.RAPIDLUT_MAX_CUTS_PER_NODE_NAME);
        }
    }
}
