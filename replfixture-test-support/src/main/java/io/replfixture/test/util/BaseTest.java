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

package io.replfixture.test.util;

import org.junit.Rule;
import org.junit.rules.TestWatcher;
import org.junit.runner.Description;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of the tests. Logs start, end and duration of each test
 * method so that fixture logs of consecutive tests can be told apart.
 */
public class BaseTest {

    static final Logger LOGGER = LoggerFactory.getLogger("Test");

    @Rule
    public final TestWatcher testWatcher = new TestWatcher() {
        private long start;

        @Override
        protected void starting(Description description) {
            super.starting(description);
            LOGGER.info("- STARTED: " + description.getMethodName());
            start = System.nanoTime();
        }

        @Override
        protected void succeeded(Description description) {
            super.succeeded(description);
            LOGGER.info("+ SUCCEEDED: " + description.getMethodName() + " IN " + formatDuration(System.nanoTime() - start));
        }

        @Override
        protected void failed(Throwable e, Description description) {
            super.failed(e, description);
            LOGGER.info("- FAILED: " + description.getMethodName() + " IN " + formatDuration(System.nanoTime() - start));
        }
    };

    static String formatDuration(long durationNanos) {
        long micros = durationNanos / 1000;
        long millis = micros / 1000;
        long seconds = millis / 1000;
        if (seconds > 0) {
            return seconds + " secs";
        } else if (millis > 0) {
            return millis + " millis";
        } else if (micros > 0) {
            return micros + " micros";
        }

        return durationNanos + " nanos";
    }

}
