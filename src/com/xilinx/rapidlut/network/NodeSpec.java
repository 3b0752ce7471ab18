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
 * One entry of an ordered node list handed to {@link Network#fromNodeList(java.util.List, int[])}:
 * either a primary input or a gate over two earlier entries.
 */
public final class NodeSpec {

    private static final NodeSpec INPUT = new NodeSpec(NodeKind.PRIMARY_INPUT, -1, -1);

    private final NodeKind kind;
    private final int left;
    private final int right;

    private NodeSpec(NodeKind kind, int left, int right) {
        this.kind = kind;
        this.left = left;
        this.right = right;
    }

    public static NodeSpec input() {
        return INPUT;
    }

    public static NodeSpec gate(int left, int right) {
        return new NodeSpec(NodeKind.GATE, left, right);
    }

    public NodeKind getKind() {
        return kind;
    }

    public int getLeft() {
        return left;
    }

    public int getRight() {
        return right;
    }

    @Override
    public String toString() {
        return kind == NodeKind.PRIMARY_INPUT ? "PI" : "GATE(" + left + "," + right + ")";
    }
}
