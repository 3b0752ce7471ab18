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

/**
 * Receives the values of every node in the output cones after each pass of a mapping run, for
 * reporting or visualization. Observers only ever see immutable snapshots.
 */
@FunctionalInterface
public interface NodeObserver {

    /**
     * @param pass The pass that just completed.
     * @param snapshot The node's values after that pass.
     */
    void onNode(AnalysisPass pass, NodeSnapshot snapshot);
}
