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

package com.alibaba.polardbx.topsql.common.exception;

import com.alibaba.polardbx.topsql.common.exception.code.ErrorCode;

public class TddlRuntimeException extends TddlNestableRuntimeException {

    private static final long serialVersionUID = 3158826147370342915L;

    private final ErrorCode errorCode;

    public TddlRuntimeException(ErrorCode errorCode, String... params) {
        super(errorCode.getMessage(params));
        this.vendorCode = errorCode.getCode();
        this.errorCode = errorCode;
    }

    public TddlRuntimeException(ErrorCode errorCode, Throwable cause, String... params) {
        super(errorCode.getMessage(params), cause);
        this.errorCode = errorCode;
        // keep the vendor code of a nested tddl exception, fall back to our own
        if (this.vendorCode == 0) {
            this.vendorCode = errorCode.getCode();
        }
    }

    public ErrorCode getErrorCodeType() {
        return errorCode;
    }
}
