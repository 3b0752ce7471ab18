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

package com.xilinx.rapidlut.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One lookup table of a mapped network: it implements the logic cone between the leaves of the
 * selected cut of its source node and the source node itself.
 */
public final class Lut {

    private final int id;
    private final int sourceNodeId;
    private final List<LutInput> inputs;

    public Lut(int id, int sourceNodeId, List<LutInput> inputs) {
        this.id = id;
        this.sourceNodeId = sourceNodeId;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
    }

    public int getId() {
        return id;
    }

    /**
     * @return The id of the network node whose function this LUT computes.
     */
    public int getSourceNodeId() {
        return sourceNodeId;
    }

    public List<LutInput> getInputs() {
        return inputs;
    }

    public int getInputCount() {
        return inputs.size();
    }

    @Override
    public String toString() {
        return "LUT" + id + "(node " + sourceNodeId + ") <- " + inputs;
    }
}
