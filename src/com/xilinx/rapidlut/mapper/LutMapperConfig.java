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

import com.xilinx.rapidlut.cut.Cut;
import com.xilinx.rapidlut.cut.CutEnumerator;
import com.xilinx.rapidlut.util.MessageGenerator;
import com.xilinx.rapidlut.util.Params;

/**
 * A collection of customizable parameters for a {@link LutMapper}.
 * Defaults come from the RapidLUT parameters (see {@link Params}) and can be modified by adding
 * corresponding options with values to the arguments. Each option name must start with two
 * dashes. Values of parameters do not need dashes.
 */
public class LutMapperConfig {
    /** Number of inputs of a LUT (K) */
    private int lutSize;
    /** Number of non-trivial cuts kept per node, smallest first */
    private int maxCutsPerNode;
    /** true to display pass messages and runtimes */
    private boolean verbose;
    /** true to print the slack report at the end of a verbose run */
    private boolean printSlackReport;

    /** Constructs a configuration with default values */
    public LutMapperConfig() {
        this(null);
    }

    /**
     * Constructs a configuration from option arguments.
     * @param arguments Options such as "--lutSize 4", may be null.
     * @throws ConfigException If an option is unknown or its value cannot be parsed.
     */
    public LutMapperConfig(String[] arguments) {
        lutSize = Params.getParamOrDefaultIntSetting(Params.RAPIDLUT_LUT_SIZE_NAME, Params.RAPIDLUT_DEFAULT_LUT_SIZE);
        maxCutsPerNode = Params.getParamOrDefaultIntSetting(Params.RAPIDLUT_MAX_CUTS_PER_NODE_NAME, CutEnumerator.UNLIMITED);
        verbose = Params.isParamSet(Params.RAPIDLUT_VERBOSE_NAME);
        printSlackReport = false;
        if (arguments != null) {
            parseArguments(arguments);
        }
    }

    private void parseArguments(String[] arguments) {
        for (int i = 0; i < arguments.length; i++) {
            String arg = arguments[i];
            switch (arg) {
            case "--lutSize":
                setLutSize(parseInt(arg, arguments, ++i));
                break;
            case "--maxCutsPerNode":
                setMaxCutsPerNode(parseInt(arg, arguments, ++i));
                break;
            case "--verbose":
                setVerbose(true);
                break;
            case "--printSlackReport":
                setPrintSlackReport(true);
                break;
            default:
                throw new ConfigException("ERROR: Undefined parameter " + arg
                        + ", please check the spelling. Valid options are --lutSize, --maxCutsPerNode, "
                        + "--verbose and --printSlackReport.");
            }
        }
    }

    private static int parseInt(String option, String[] arguments, int index) {
        if (index >= arguments.length) {
            throw new ConfigException("ERROR: Missing value for option " + option);
        }
        try {
            return Integer.parseInt(arguments[index]);
        } catch (NumberFormatException e) {
            throw new ConfigException("ERROR: Value '" + arguments[index] + "' of option " + option
                    + " is not an integer", e);
        }
    }

    /**
     * Checks that a mapping can run with these values.
     * @throws ConfigException If the LUT size is below 2 or above {@link Cut#MAX_SIZE}, or the
     * cut limit is not positive.
     */
    public void validate() {
        if (lutSize < 2) {
            throw new ConfigException("ERROR: LUT size must be at least 2, got " + lutSize
                    + ". No gate can be covered by a smaller LUT.");
        }
        if (lutSize > Cut.MAX_SIZE) {
            throw new ConfigException("ERROR: LUT size must be at most " + Cut.MAX_SIZE + ", got " + lutSize);
        }
        if (maxCutsPerNode < 1) {
            throw new ConfigException("ERROR: maxCutsPerNode must be positive, got " + maxCutsPerNode);
        }
    }

    public int getLutSize() {
        return lutSize;
    }

    public void setLutSize(int lutSize) {
        this.lutSize = lutSize;
    }

    public int getMaxCutsPerNode() {
        return maxCutsPerNode;
    }

    public void setMaxCutsPerNode(int maxCutsPerNode) {
        this.maxCutsPerNode = maxCutsPerNode;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public boolean isPrintSlackReport() {
        return printSlackReport;
    }

    public void setPrintSlackReport(boolean printSlackReport) {
        this.printSlackReport = printSlackReport;
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        s.append(MessageGenerator.formatString("Mapper Configuration"));
        s.append(MessageGenerator.formatString("LUT size: ", lutSize));
        s.append(MessageGenerator.formatString("Max cuts per node: ",
                maxCutsPerNode == CutEnumerator.UNLIMITED ? "unlimited" : maxCutsPerNode));
        s.append(MessageGenerator.formatString("Verbose: ", verbose));
        return s.toString();
    }
}
