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
 * Thrown when a network is structurally malformed: a gate that references itself or a node
 * created after it, an output that references an unknown node, a duplicate name, or a cycle
 * found while ordering the nodes.
 */
public class GraphException extends RuntimeException {

    private static final long serialVersionUID = -2950312285620137064L;

    public GraphException(String message) {
        super(message);
    }
}
