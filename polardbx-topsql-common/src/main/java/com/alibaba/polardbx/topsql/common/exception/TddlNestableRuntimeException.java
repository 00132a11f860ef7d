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

import java.util.concurrent.ExecutionException;

public class TddlNestableRuntimeException extends RuntimeException {

    private static final long serialVersionUID = -4729385722108470553L;

    protected int vendorCode;

    public TddlNestableRuntimeException(String msg) {
        super(msg);
    }

    public TddlNestableRuntimeException(String msg, Throwable cause) {
        super(msg, cause);
        buildVendorCode(cause);
    }

    @Override
    public String getMessage() {
        if (super.getMessage() != null) {
            return super.getMessage();
        } else if (getCause() != null) {
            return getCause().getMessage();
        } else {
            return null;
        }
    }

    @Override
    public String toString() {
        return super.getLocalizedMessage();
    }

    private void buildVendorCode(Throwable e) {
        if (e instanceof TddlNestableRuntimeException) {
            this.vendorCode = ((TddlNestableRuntimeException) e).getErrorCode();
        } else if (e instanceof ExecutionException) {
            buildVendorCode(e.getCause());
        }
    }

    public int getErrorCode() {
        return vendorCode;
    }
}
