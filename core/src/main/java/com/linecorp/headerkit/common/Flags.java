/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package com.linecorp.headerkit.common;

import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ascii;

/**
 * The system properties that affect HeaderKit's runtime behavior.
 *
 * <p>Every flag is read once when this class is initialized. Specify a flag with the
 * {@code -Dcom.linecorp.headerkit.<flagName>=<value>} JVM option.</p>
 */
public final class Flags {

    private static final Logger logger = LoggerFactory.getLogger(Flags.class);

    private static final String PREFIX = "com.linecorp.headerkit.";

    private static final boolean VALIDATE_HEADERS = getBoolean("validateHeaders", true);

    private static final boolean WARN_MALFORMED_SET_COOKIE = getBoolean("warnMalformedSetCookie", false);

    /**
     * Returns whether to validate the names of the headers added through the strict path of
     * {@link HttpHeaderStore#add(String, String)}.
     *
     * <p>This flag is enabled by default.
     * Specify the {@code -Dcom.linecorp.headerkit.validateHeaders=false} JVM option to disable it.</p>
     */
    public static boolean validateHeaders() {
        return VALIDATE_HEADERS;
    }

    /**
     * Returns whether a {@code "Set-Cookie"} header value that cannot be split completely is logged at
     * {@code WARN} level instead of {@code DEBUG}.
     *
     * <p>This flag is disabled by default.
     * Specify the {@code -Dcom.linecorp.headerkit.warnMalformedSetCookie=true} JVM option to enable it.</p>
     */
    public static boolean warnMalformedSetCookie() {
        return WARN_MALFORMED_SET_COOKIE;
    }

    private static boolean getBoolean(String name, boolean defaultValue) {
        return getBoolean(name, defaultValue, value -> true);
    }

    private static boolean getBoolean(String name, boolean defaultValue, Predicate<Boolean> validator) {
        return Boolean.parseBoolean(getNormalized(name, String.valueOf(defaultValue), value -> {
            if ("true".equals(value)) {
                return validator.test(true);
            }

            if ("false".equals(value)) {
                return validator.test(false);
            }
            return false;
        }));
    }

    private static String getNormalized(String name, String defaultValue, Predicate<String> validator) {
        final String fullName = PREFIX + name;
        String value = System.getProperty(fullName);
        if (value != null) {
            value = Ascii.toLowerCase(value);
            if (validator.test(value)) {
                logger.info("{}: {} (sysprops)", name, value);
                return value;
            }
            logger.warn("{}: {} (sysprops, validation failed)", name, value);
        }
        logger.info("{}: {} (default)", name, defaultValue);
        return defaultValue;
    }

    private Flags() {}
}
