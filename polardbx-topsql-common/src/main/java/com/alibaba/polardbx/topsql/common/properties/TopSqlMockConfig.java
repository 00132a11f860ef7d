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

import com.alibaba.polardbx.topsql.common.exception.TddlRuntimeException;
import com.alibaba.polardbx.topsql.common.exception.code.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Timing knobs of the mock top sql reporter.
 */
public class TopSqlMockConfig {

    private static final Logger logger = LoggerFactory.getLogger(TopSqlMockConfig.class);

    public static final String DEFAULT_RESOURCE = "topsql-mock.properties";

    private volatile long waitTimeoutMs = TopSqlProperties.DEFAULT_TOPSQL_MOCK_WAIT_TIMEOUT_MS;

    private volatile long pollIntervalMs = TopSqlProperties.DEFAULT_TOPSQL_MOCK_POLL_INTERVAL_MS;

    public TopSqlMockConfig() {
    }

    public TopSqlMockConfig(long waitTimeoutMs, long pollIntervalMs) {
        setWaitTimeoutMs(waitTimeoutMs);
        setPollIntervalMs(pollIntervalMs);
    }

    /**
     * load config from a classpath resource, defaults are kept if the resource does not exist
     */
    public static TopSqlMockConfig fromClasspath(String resource) {
        TopSqlMockConfig config = new TopSqlMockConfig();
        try (InputStream in = TopSqlMockConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.debug("config resource " + resource + " not found, use defaults");
                return config;
            }
            Properties properties = new Properties();
            properties.load(in);
            config.loadFrom(properties);
        } catch (IOException e) {
            throw new TddlRuntimeException(ErrorCode.ERR_CONFIG, e, "failed to read " + resource);
        }
        return config;
    }

    public void loadFrom(Properties properties) {
        for (String key : properties.stringPropertyNames()) {
            loadValue(logger, key, properties.getProperty(key));
        }
    }

    public void loadValue(Logger logger, String key, String value) {
        if (key != null && value != null) {
            switch (key.toUpperCase(Locale.ROOT)) {
            case TopSqlProperties.TOPSQL_MOCK_WAIT_TIMEOUT_MS:
                setWaitTimeoutMs(parseLong(key, value));
                logger.info("set " + key + " to " + waitTimeoutMs);
                break;
            case TopSqlProperties.TOPSQL_MOCK_POLL_INTERVAL_MS:
                setPollIntervalMs(parseLong(key, value));
                logger.info("set " + key + " to " + pollIntervalMs);
                break;
            default:
                logger.warn("unknown top sql config " + key + ", ignored");
                break;
            }
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new TddlRuntimeException(ErrorCode.ERR_CONFIG, e, key + " = " + value);
        }
    }

    public long getWaitTimeoutMs() {
        return waitTimeoutMs;
    }

    public void setWaitTimeoutMs(long waitTimeoutMs) {
        if (waitTimeoutMs <= 0) {
            throw new TddlRuntimeException(ErrorCode.ERR_CONFIG,
                TopSqlProperties.TOPSQL_MOCK_WAIT_TIMEOUT_MS + " = " + waitTimeoutMs);
        }
        this.waitTimeoutMs = waitTimeoutMs;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        if (pollIntervalMs <= 0) {
            throw new TddlRuntimeException(ErrorCode.ERR_CONFIG,
                TopSqlProperties.TOPSQL_MOCK_POLL_INTERVAL_MS + " = " + pollIntervalMs);
        }
        this.pollIntervalMs = pollIntervalMs;
    }

    @Override
    public String toString() {
        return "TopSqlMockConfig{waitTimeoutMs=" + waitTimeoutMs + ", pollIntervalMs=" + pollIntervalMs + "}";
    }
}
