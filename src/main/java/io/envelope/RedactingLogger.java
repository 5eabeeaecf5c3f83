/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.envelope;

import java.security.Key;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thin wrapper around an slf4j logger that redacts passwords, keys and raw byte arrays before they reach the
 * log. Only the levels used by the envelope codecs are exposed.
 */
final class RedactingLogger {
    private final Logger realLogger;

    private RedactingLogger(Logger realLogger) {
        this.realLogger = Objects.requireNonNull(realLogger);
    }

    static RedactingLogger getLogger(Class<?> forClass) {
        return new RedactingLogger(LoggerFactory.getLogger(forClass));
    }

    void trace(String message, Object... args) {
        if (realLogger.isTraceEnabled()) {
            realLogger.trace(message, redactAll(args));
        }
    }

    void debug(String message, Object... args) {
        if (realLogger.isDebugEnabled()) {
            realLogger.debug(message, redactAll(args));
        }
    }

    static Object[] redactAll(Object... args) {
        var redacted = new Object[args.length];
        for (int i = 0; i < args.length; ++i) {
            // Throwables pass through unchanged.
            redacted[i] = args[i] instanceof Throwable ? args[i] : redact(args[i]);
        }
        return redacted;
    }

    static Object redact(Object arg) {
        if (arg instanceof byte[]) {
            return "<" + ((byte[]) arg).length + " bytes>";
        }
        if (arg instanceof char[]) {
            return "<redacted>";
        }
        if (arg instanceof Key) {
            return "<" + ((Key) arg).getAlgorithm() + " key>";
        }
        if (arg instanceof Credentials) {
            return "<credentials>";
        }
        return arg;
    }
}
