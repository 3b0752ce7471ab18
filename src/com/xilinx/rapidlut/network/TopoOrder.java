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

import java.util.Arrays;

import com.xilinx.rapidlut.util.SparseBitSet;

/**
 * Computes a topological ordering of every node in the fanin cone of a set of roots, children
 * before the gates that consume them. The traversal is a depth-first post-order (first fanin, then
 * second fanin, then the node itself) driven by an explicit work stack, so deep networks do not
 * exhaust the call stack. Visited and on-path markers live in the traversal, which leaves the
 * network untouched and lets several orderings run over the same network.
 */
public class TopoOrder {

    private TopoOrder() {
    }

    /**
     * Orders the fanin cones of all primary outputs, visiting the outputs in output order.
     * @param source The graph to order.
     * @return Node ids, each appearing once, every node after both of its fanins.
     * @throws GraphException If a cycle or a reference outside the graph is found.
     */
    public static int[] compute(NodeSource source) {
        int[] roots = new int[source.getOutputCount()];
        for (int i = 0; i < roots.length; i++) {
            roots[i] = source.getOutputNode(i);
        }
        return compute(source, roots);
    }

    /**
     * Orders the fanin cones of the given roots. A node shared between cones is emitted once, at
     * the position of its first discovery.
     * @param source The graph to order.
     * @param roots Node ids to start from, in visiting order.
     * @return Node ids, each appearing once, every node after both of its fanins.
     * @throws GraphException If a cycle or a reference outside the graph is found.
     */
    public static int[] compute(NodeSource source, int[] roots) {
        int nodeCount = source.getNodeCount();
        SparseBitSet visited = new SparseBitSet();
        SparseBitSet onPath = new SparseBitSet();
        int[] order = new int[Math.min(nodeCount, 16)];
        int orderSize = 0;
        // stackState counts the fanins already pushed for the node at the same depth
        int[] stackNodes = new int[16];
        int[] stackState = new int[16];

        for (int root : roots) {
            checkId(source, root, -1);
            if (visited.get(root)) continue;
            int sp = 0;
            stackNodes[sp] = root;
            stackState[sp] = 0;
            sp++;
            onPath.set(root);
            while (sp > 0) {
                int node = stackNodes[sp - 1];
                int state = stackState[sp - 1];
                if (!source.isPrimaryInput(node) && state < 2) {
                    int child = state == 0 ? source.getLeft(node) : source.getRight(node);
                    stackState[sp - 1]++;
                    checkId(source, child, node);
                    if (onPath.get(child)) {
                        throw new GraphException("ERROR: Cycle detected, node " + child
                                + " is reachable from its fanout " + node);
                    }
                    if (visited.get(child)) continue;
                    if (sp == stackNodes.length) {
                        stackNodes = Arrays.copyOf(stackNodes, sp * 2);
                        stackState = Arrays.copyOf(stackState, sp * 2);
                    }
                    stackNodes[sp] = child;
                    stackState[sp] = 0;
                    sp++;
                    onPath.set(child);
                } else {
                    sp--;
                    onPath.clear(node);
                    visited.set(node);
                    if (orderSize == order.length) {
                        order = Arrays.copyOf(order, Math.max(orderSize * 2, 1));
                    }
                    order[orderSize++] = node;
                }
            }
        }
        return Arrays.copyOf(order, orderSize);
    }

    private static void checkId(NodeSource source, int nodeId, int fanout) {
        if (nodeId < 0 || nodeId >= source.getNodeCount()) {
            String from = fanout < 0 ? "an output" : "node " + fanout;
            throw new GraphException("ERROR: Unknown node " + nodeId + " referenced from " + from);
        }
    }
}
