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

/**
 * A reference used as a LUT input or as the driver of a primary output: either a primary input of
 * the original network, identified by its node id, or another LUT, identified by its LUT id.
 */
public final class LutInput {

    public enum Kind {
        PRIMARY_INPUT,
        LUT;
    }

    private final Kind kind;
    private final int id;

    private LutInput(Kind kind, int id) {
        this.kind = kind;
        this.id = id;
    }

    public static LutInput primaryInput(int nodeId) {
        return new LutInput(Kind.PRIMARY_INPUT, nodeId);
    }

    public static LutInput lut(int lutId) {
        return new LutInput(Kind.LUT, lutId);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isPrimaryInput() {
        return kind == Kind.PRIMARY_INPUT;
    }

    public boolean isLut() {
        return kind == Kind.LUT;
    }

    /**
     * @return The node id of a primary input, or the LUT id of a LUT.
     */
    public int getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LutInput)) return false;
        LutInput other = (LutInput) o;
        return kind == other.kind && id == other.id;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + id;
    }

    @Override
    public String toString() {
        return (kind == Kind.PRIMARY_INPUT ? "PI:" : "LUT:") + id;
    }
}
