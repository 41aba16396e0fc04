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

package io.replfixture.runtime;

/**
 * Suspends the calling thread between two iterations of a polling loop.
 * <p>
 * The fixture reads time from a {@link java.time.Clock} and sleeps through
 * this abstraction, so that tests can simulate the passage of time without
 * sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps via {@link Thread#sleep(long)}.
     */
    Sleeper THREAD_SLEEPER = Thread::sleep;

    /**
     * Sleeps for the given duration.
     *
     * @param millis
     *         the duration to sleep in milliseconds
     *
     * @throws InterruptedException
     *         if the calling thread is interrupted
     */
    void sleep(long millis) throws InterruptedException;

}
