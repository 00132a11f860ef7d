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

package com.alibaba.polardbx.topsql.common.digest;

import com.alibaba.polardbx.topsql.common.exception.TddlRuntimeException;
import com.alibaba.polardbx.topsql.common.exception.code.ErrorCode;
import com.alibaba.polardbx.topsql.common.utils.Assert;
import com.google.common.io.BaseEncoding;

import java.util.Arrays;
import java.util.Locale;

/**
 * Immutable digest bytes of a normalized sql or plan.
 * Two digests are equal only if their bytes are equal.
 */
public final class Digest {

    public static final Digest EMPTY = new Digest(new byte[0]);

    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    private final byte[] bytes;

    private final int hash;

    private Digest(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    public static Digest of(byte[] bytes) {
        Assert.assertNotNull(bytes, "digest bytes");
        return bytes.length == 0 ? EMPTY : new Digest(bytes.clone());
    }

    public static Digest fromHex(String hex) {
        Assert.assertNotNull(hex, "digest hex");
        try {
            return of(HEX.decode(hex.toLowerCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new TddlRuntimeException(ErrorCode.ERR_DIGEST, e, "invalid hex digest " + hex);
        }
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    public String toHex() {
        return HEX.encode(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Digest)) {
            return false;
        }
        Digest that = (Digest) o;
        return hash == that.hash && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return toHex();
    }
}
