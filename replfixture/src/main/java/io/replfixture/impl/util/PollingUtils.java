/*
 * Copyright (c) 2026, ReplFixture.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.replfixture.impl.util;

import io.replfixture.exception.ReplFixtureException;
import io.replfixture.runtime.Sleeper;

import java.util.Map;

/**
 * Helpers shared by the polling loops and the command response checks.
 */
public final class PollingUtils {

    private PollingUtils() {
    }

    /**
     * Sleeps through the given sleeper. If the calling thread is
     * interrupted, the interrupt flag is restored and the wait fails.
     */
    public static void sleep(Sleeper sleeper, long millis) {
        if (millis <= 0) {
            return;
        }

        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReplFixtureException("Interrupted while sleeping " + millis + " millis", e);
        }
    }

    /**
     * Returns true if the given response value is a true boolean or a
     * non-zero number.
     */
    public static boolean isTrue(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        } else if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }

        return false;
    }

    /**
     * Walks the nested documents of a command response along the given
     * path. Returns null if a step is missing or is not a document.
     */
    public static Object getNested(Map<String, Object> document, String... path) {
        Object current = document;
        for (String key : path) {
            if (!(current instanceof Map)) {
                return null;
            }

            current = ((Map<?, ?>) current).get(key);
        }

        return current;
    }

}
