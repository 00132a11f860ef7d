/*
 * Copyright [2013-2021], Alibaba Group Holding Limited
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.alibaba.polardbx.topsql.common.reporter;

import com.alibaba.polardbx.topsql.common.model.TopSqlCpuTimeRecord;

import java.util.List;

/**
 * Receives the cpu time samples collected in one sampling round.
 */
public interface TopSqlCollector {

    /**
     * @param timestamp when the samples were taken, unix seconds
     * @param records samples of this round, may be empty
     */
    void collect(long timestamp, List<TopSqlCpuTimeRecord> records);
}
