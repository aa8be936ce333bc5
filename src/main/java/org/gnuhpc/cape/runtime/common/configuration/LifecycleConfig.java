/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gnuhpc.cape.runtime.common.configuration;

import java.time.Duration;

/**
 * Centralized configuration for the CAPE runtime.
 * Reads from System properties, then Environment variables, then built-in defaults.
 */
public class LifecycleConfig {

    public static final String START_TIMEOUT_KEY = "lifecycle.start.timeout.ms";
    public static final String STOP_TIMEOUT_KEY = "lifecycle.stop.timeout.ms";
    public static final String SIGNALS_ENABLED_KEY = "lifecycle.signals.enabled";
    public static final String HEALTH_CHECK_ENABLED_KEY = "health.check.enabled";
    public static final String HEALTH_CHECK_PORT_KEY = "health.check.port";

    private static final long DEFAULT_TIMEOUT_MS = 15_000L;

    // Lifecycle
    public Duration getStartTimeout() {
        return Duration.ofMillis(getLong(START_TIMEOUT_KEY, DEFAULT_TIMEOUT_MS));
    }

    public Duration getStopTimeout() {
        return Duration.ofMillis(getLong(STOP_TIMEOUT_KEY, DEFAULT_TIMEOUT_MS));
    }

    public boolean isSignalHandlingEnabled() {
        return getBoolean(SIGNALS_ENABLED_KEY, true);
    }

    // Health check
    public boolean isHealthCheckEnabled() {
        return getBoolean(HEALTH_CHECK_ENABLED_KEY, true);
    }

    public int getHealthCheckPort() {
        return getInt(HEALTH_CHECK_PORT_KEY, 8080);
    }

    // Helper methods for property resolution
    public String get(String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value != null && !value.isBlank()) return value;

        // Environment variable convention: 'lifecycle.stop.timeout.ms' -> 'LIFECYCLE_STOP_TIMEOUT_MS'
        value = getEnv(envKey(key));
        if (value != null && !value.isBlank()) return value;

        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        String val = get(key, null);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = get(key, null);
        if (val == null) return defaultValue;
        try {
            long parsed = Long.parseLong(val.trim());
            return parsed < 0 ? defaultValue : parsed;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = get(key, null);
        if (val == null) return defaultValue;
        return Boolean.parseBoolean(val.trim());
    }

    static String envKey(String key) {
        return key.replace('.', '_').replace('-', '_').toUpperCase();
    }

    /** Overridable in tests. */
    protected String getEnv(String name) {
        return System.getenv(name);
    }
}
