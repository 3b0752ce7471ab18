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

package com.xilinx.rapidlut.area;

import com.xilinx.rapidlut.mapper.MappingView;
import com.xilinx.rapidlut.timing.SlackReport;

/**
 * Extension point for a slack-aware area recovery step, called once after required times are
 * known. An implementation reads the cut costs and slacks to decide on cheaper cuts for nodes that
 * are off the critical path.
 */
@FunctionalInterface
public interface AreaRecovery {

    /**
     * @param view Read-only view of the mapping state.
     * @param slackReport Slack of every constrained node.
     */
    void recoverArea(MappingView view, SlackReport slackReport);
}
