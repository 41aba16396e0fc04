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

package io.replfixture.exception;

/**
 * Thrown when no member of a replica set reports itself as primary within
 * the given time budget.
 */
public class LeaderDiscoveryTimeoutException
        extends ReplFixtureException {

    private static final long serialVersionUID = 1430578839254190337L;

    private final String replicaSetName;

    public LeaderDiscoveryTimeoutException(String replicaSetName, long elapsedMillis) {
        super("Timed out while waiting for a primary for replica set '" + replicaSetName + "' after " + elapsedMillis
                      + " millis.");
        this.replicaSetName = replicaSetName;
    }

    public String getReplicaSetName() {
        return replicaSetName;
    }

}
