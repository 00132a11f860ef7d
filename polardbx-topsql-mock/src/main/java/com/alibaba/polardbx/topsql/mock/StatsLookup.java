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

package com.alibaba.polardbx.topsql.mock;

import com.alibaba.polardbx.topsql.common.model.TopSqlCpuTimeRecord;
import com.google.common.collect.ImmutableList;
import lombok.Value;

import java.util.List;

/**
 * Stat records of a lookup together with how the lookup ended.
 */
@Value
public class StatsLookup {

    LookupOutcome outcome;

    List<TopSqlCpuTimeRecord> records;

    static StatsLookup of(List<TopSqlCpuTimeRecord> records, LookupOutcome outcomeIfEmpty) {
        if (records.isEmpty()) {
            return new StatsLookup(outcomeIfEmpty, ImmutableList.of());
        }
        return new StatsLookup(LookupOutcome.FOUND, ImmutableList.copyOf(records));
    }

    public boolean isFound() {
        return outcome == LookupOutcome.FOUND;
    }
}
