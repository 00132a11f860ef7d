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

package com.alibaba.polardbx.topsql.common.exception.code;

import org.apache.commons.lang3.StringUtils;

/**
 * Error codes of the top sql module.
 */
public enum ErrorCode {

    ERR_ASSERT_NULL(4001, "Assert failed, object is null: {0}"),

    ERR_CONFIG(4010, "Invalid top sql config: {0}"),

    ERR_DIGEST(4020, "Failed to build digest: {0}");

    private final int code;

    private final String template;

    ErrorCode(int code, String template) {
        this.code = code;
        this.template = template;
    }

    public int getCode() {
        return code;
    }

    public String getMessage(String... params) {
        String detail = params == null ? "" : StringUtils.join(params, ", ");
        String message = StringUtils.replace(template, "{0}", StringUtils.defaultString(detail));
        return "ERR-CODE: [TOPSQL-" + code + "][" + name() + "] " + message;
    }
}
