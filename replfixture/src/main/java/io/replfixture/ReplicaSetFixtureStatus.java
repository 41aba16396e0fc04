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

package io.replfixture;

/**
 * Statuses of a replica set fixture during its lifecycle.
 * <p>
 * A fixture moves forward through the statuses in declaration order. It
 * stays in {@link #FULLY_CONFIGURED} or {@link #READY} when setup or
 * readiness checks are repeated.
 *
 * @see ReplicaSetFixture
 */
public enum ReplicaSetFixtureStatus {

    /**
     * Initial status of a fixture. No replica set configuration has been
     * sent to the nodes yet.
     */
    UNCONFIGURED,

    /**
     * The first node is initiated as a single member replica set and
     * elected as primary.
     */
    SINGLE_MEMBER_INITIATED,

    /**
     * The full member list is configured and every secondary reported its
     * role, or the nodes already had a replica set configuration.
     */
    FULLY_CONFIGURED,

    /**
     * The primary and all secondaries are confirmed and the session cache
     * is refreshed. The fixture can be used by test workloads.
     */
    READY,

    /**
     * The fixture is torn down. No further setup is possible.
     */
    TORN_DOWN;

    /**
     * Returns true if the given status is terminal.
     *
     * @param status
     *         the status object to check
     *
     * @return true if the given status is terminal, false otherwise
     */
    public static boolean isTerminal(ReplicaSetFixtureStatus status) {
        return status == TORN_DOWN;
    }

}
