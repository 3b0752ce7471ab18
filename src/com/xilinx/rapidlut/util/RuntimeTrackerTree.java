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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@link RuntimeTrackerTree} Object consists of {@link RuntimeTracker} Objects,
 * providing methods to create a tree of runtime trackers for the runtime breakdown of a mapping run.
 */
public class RuntimeTrackerTree {
    private final Map<String, RuntimeTracker> runtimeTrackers;
    private final RuntimeTracker root;
    private final boolean verbose;

    public RuntimeTrackerTree(String rootName, boolean verbose) {
        this.verbose = verbose;
        this.runtimeTrackers = new LinkedHashMap<>();
        this.root = new RuntimeTracker(rootName, (short) 0);
        this.runtimeTrackers.put(rootName, root);
    }

    /**
     * Creates a {@link RuntimeTracker} instance with its name and its parent name.
     * If a runtime tracker under the given name exists, returns it.
     * Otherwise, creates a new one and returns it.
     * @param name Name of a runtime tracker.
     * @param parent The parent runtime tracker name.
     * @return A runtime tracker under the name.
     */
    public RuntimeTracker createRuntimeTracker(String name, String parent) {
        if (parent == null) {
            throw new IllegalArgumentException("ERROR: Null parent name.");
        }
        RuntimeTracker parentTracker = runtimeTrackers.get(parent);
        if (parentTracker == null) {
            throw new IllegalArgumentException("ERROR: No parent runtime tracker under name " + parent +
                    ".\n Please refer to one of the created runtime trackers: " + runtimeTrackers.keySet());
        }
        RuntimeTracker newTracker = runtimeTrackers.get(name);
        if (newTracker == null) {
            newTracker = new RuntimeTracker(name);
            parentTracker.addChild(newTracker);
            runtimeTrackers.put(name, newTracker);
        }
        return newTracker;
    }

    /**
     * Gets a created {@link RuntimeTracker} instance corresponding to a name.
     * @param name The name of the runtime tracker.
     * @return A {@link RuntimeTracker} instance under the name.
     */
    public RuntimeTracker getRuntimeTracker(String name) {
        RuntimeTracker tracker = runtimeTrackers.get(name);
        if (tracker == null) {
            throw new IllegalArgumentException("ERROR: No runtime tracker instance under name " + name + "."
                        + "\n Please check if the name is correct. Runtime trackers created: " + runtimeTrackers.keySet());
        }
        return tracker;
    }

    /**
     * Gets the name of the root runtime tracker.
     */
    public String getRootRuntimeTracker() {
        return root.getName();
    }

    @Override
    public String toString() {
        if (verbose) {
            return root.trackerWithFullHierarchy();
        }
        return root.trackerWithOneLevelChildren();
    }
}
