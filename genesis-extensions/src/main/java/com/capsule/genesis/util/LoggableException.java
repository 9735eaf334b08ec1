/*
 * LoggableException.java
 *
 * This source file is part of the Genesis Graph open source project
 *
 * Copyright 2024-2026 the Genesis Graph project authors
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
 */

package com.capsule.genesis.util;

import com.capsule.genesis.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * Unchecked exception that carries keys and values describing the failure, so that callers can log it in a
 * searchable form instead of parsing the message.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException implements LoggableKeysAndValues<LoggableException> {
    @Nonnull
    private final LoggableKeysAndValuesImpl loggableKeysAndValues = new LoggableKeysAndValuesImpl();

    /**
     * Create an exception with a message and a flattened sequence of key/value pairs.
     *
     * @param msg error message
     * @param keyValues alternating keys and values
     * @throws IllegalArgumentException if {@code keyValues} has odd length
     */
    public LoggableException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            loggableKeysAndValues.addLogInfo(keyValues);
        }
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public LoggableException(@Nonnull String msg) {
        super(msg);
    }

    @Nonnull
    @Override
    public Map<String, Object> getLogInfo() {
        return loggableKeysAndValues.getLogInfo();
    }

    @Nonnull
    @Override
    public LoggableException addLogInfo(@Nonnull Object key, Object value) {
        loggableKeysAndValues.addLogInfo(key, value);
        return this;
    }

    @Nonnull
    @Override
    public LoggableException addLogInfo(@Nonnull Object... keyValues) {
        loggableKeysAndValues.addLogInfo(keyValues);
        return this;
    }

    @Nonnull
    @Override
    public Object[] exportLogInfo() {
        return loggableKeysAndValues.exportLogInfo();
    }

    /**
     * The message followed by the log information in {@code key=value} form.
     *
     * @return message with log information
     */
    @Nonnull
    public String getMessageWithLogInfo() {
        final Map<String, Object> info = getLogInfo();
        if (info.isEmpty()) {
            return String.valueOf(getMessage());
        }
        final StringBuilder sb = new StringBuilder(String.valueOf(getMessage()));
        for (Map.Entry<String, Object> entry : info.entrySet()) {
            sb.append(' ').append(entry.getKey()).append('=').append(entry.getValue());
        }
        return sb.toString();
    }
}
