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

import com.alibaba.polardbx.topsql.common.digest.Digest;

/**
 * Producer side of top sql: besides the cpu samples, the executor announces the
 * normalized text behind every sql digest and plan digest it has seen.
 * Announcing the same digest more than once is allowed.
 */
public interface TopSqlReporter extends TopSqlCollector {

    void registerSql(Digest sqlDigest, String normalizedSql);

    void registerPlan(Digest planDigest, String normalizedPlan);
}
