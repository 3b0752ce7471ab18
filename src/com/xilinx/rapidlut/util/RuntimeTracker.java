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

package com.xilinx.rapidlut.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Records the total elapsed time of one mapping step through start and stop calls.
 * Trackers form a tree when created through a {@link RuntimeTrackerTree}, so that the
 * runtime of a whole mapping run can be broken down pass by pass.
 */
public class RuntimeTracker {
    private final String name;
    private long time;
    private long start;
    private short level;
    private final List<RuntimeTracker> children;

    public RuntimeTracker(String name) {
        this(name, (short) 0);
    }

    public RuntimeTracker(String name, short level) {
        this.name = name;
        this.time = 0;
        this.level = level;
        this.children = new ArrayList<>();
    }

    public short getLevel() {
        return level;
    }

    /**
     * Sets the level (depth) of a tracker included in a tree.
     * @param level Depth below the root, the root being level 0.
     */
    public void setLevel(short level) {
        this.level = level;
    }

    public List<RuntimeTracker> getChildren() {
        return children;
    }

    /**
     * Adds a child runtime tracker.
     * @param runtimeTracker The child runtime tracker.
     */
    public void addChild(RuntimeTracker runtimeTracker) {
        if (!children.contains(runtimeTracker)) {
            children.add(runtimeTracker);
            runtimeTracker.setLevel((short) (level + 1));
        }
    }

    public void start() {
        start = System.nanoTime();
    }

    /**
     * Stops the runtime tracker and accumulates the time elapsed since the last
     * {@link #start()} in nanoseconds.
     */
    public void stop() {
        time += System.nanoTime() - start;
    }

    /**
     * Gets the total time in nanoseconds. The root of a tree reports the sum of its children.
     * @return The total time elapsed in nanoseconds.
     */
    public long getTime() {
        if (level == 0 && !children.isEmpty()) {
            long total = 0;
            for (RuntimeTracker child : children) {
                total += child.getTime();
            }
            return total;
        }
        return time;
    }

    public String getName() {
        return name;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RuntimeTracker)) return false;
        return name.equals(((RuntimeTracker) o).name);
    }

    @Override
    public String toString() {
        int length = 36 - level * 3 - name.length() - 1;
        return name + ":" + MessageGenerator.makeWhiteSpace(length)
                + String.format("%9.3fs\n", getTime() * 1e-9);
    }

    /**
     * Returns a string that represents the full hierarchy of this tracker down to the leaf trackers.
     */
    public String trackerWithFullHierarchy() {
        StringBuilder buffer = new StringBuilder();
        appendFullHierarchy(buffer, "", "");
        return buffer.toString();
    }

    private void appendFullHierarchy(StringBuilder buffer, String prefix, String childPrefix) {
        buffer.append(prefix);
        buffer.append(this);
        for (Iterator<RuntimeTracker> it = children.iterator(); it.hasNext();) {
            RuntimeTracker next = it.next();
            if (it.hasNext()) {
                next.appendFullHierarchy(buffer, childPrefix + "├─ ", childPrefix + "│  ");
            } else {
                next.appendFullHierarchy(buffer, childPrefix + "└─ ", childPrefix + "   ");
            }
        }
    }

    /**
     * Returns a string representing this tracker and its direct children.
     */
    public String trackerWithOneLevelChildren() {
        StringBuilder buffer = new StringBuilder();
        buffer.append(this);
        for (int i = 0; i < children.size(); i++) {
            buffer.append(i < children.size() - 1 ? "├─ " : "└─ ");
            buffer.append(children.get(i));
        }
        return buffer.toString();
    }
}
