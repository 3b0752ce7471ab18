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
 * An immutable node of a {@link Network}: either a primary input or a two-input gate.
 * Gates only reference nodes with a smaller id, which keeps every network acyclic by construction.
 */
public final class NetworkNode {

    private final int id;
    private final String name;
    private final NodeKind kind;
    private final int left;
    private final int right;

    NetworkNode(int id, String name, NodeKind kind, int left, int right) {
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.left = left;
        this.right = right;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    public boolean isPrimaryInput() {
        return kind == NodeKind.PRIMARY_INPUT;
    }

    /**
     * @return The id of the first fanin, or -1 for a primary input.
     */
    public int getLeft() {
        return left;
    }

    /**
     * @return The id of the second fanin, or -1 for a primary input.
     */
    public int getRight() {
        return right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NetworkNode)) return false;
        NetworkNode other = (NetworkNode) o;
        return id == other.id && kind == other.kind && left == other.left && right == other.right
                && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        if (isPrimaryInput()) {
            return name + ": PI";
        }
        return name + ": " + left + " & " + right;
    }
}
