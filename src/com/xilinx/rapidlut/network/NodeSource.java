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

package com.xilinx.rapidlut.network;

/**
 * Read-only structural view of a graph of primary inputs and two-input gates, as consumed by
 * {@link TopoOrder}. Node ids are dense, from 0 to {@link #getNodeCount()} - 1.
 */
public interface NodeSource {

    int getNodeCount();

    boolean isPrimaryInput(int nodeId);

    /**
     * @param nodeId A gate id.
     * @return The id of the first fanin of the gate.
     */
    int getLeft(int nodeId);

    /**
     * @param nodeId A gate id.
     * @return The id of the second fanin of the gate.
     */
    int getRight(int nodeId);

    int getOutputCount();

    /**
     * @param outputIndex Position of the primary output.
     * @return The id of the node driving the primary output.
     */
    int getOutputNode(int outputIndex);
}
