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
 * Thrown when a mapping pass finds its own state inconsistent, such as a node whose first cut is
 * not its trivial cut or a gate left without any feasible cut. These point to a defect in a pass,
 * not to a malformed input, and are never recovered from.
 */
public class MappingInvariantException extends RuntimeException {

    private static final long serialVersionUID = 4419730961845216208L;

    public MappingInvariantException(String message) {
        super(message);
    }
}
