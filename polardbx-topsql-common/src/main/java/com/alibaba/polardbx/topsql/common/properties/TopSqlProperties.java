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

package com.alibaba.polardbx.topsql.common.properties;

public class TopSqlProperties {

    /**
     * overall deadline of a blocking wait or lookup on the mock reporter, unit: milliseconds
     */
    public static final String TOPSQL_MOCK_WAIT_TIMEOUT_MS = "TOPSQL_MOCK_WAIT_TIMEOUT_MS";

    /**
     * max interval between two progress checks of a blocking wait, unit: milliseconds
     */
    public static final String TOPSQL_MOCK_POLL_INTERVAL_MS = "TOPSQL_MOCK_POLL_INTERVAL_MS";

    public static final long DEFAULT_TOPSQL_MOCK_WAIT_TIMEOUT_MS = 10000L;

    public static final long DEFAULT_TOPSQL_MOCK_POLL_INTERVAL_MS = 10L;
}
