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
 * Thrown when a node does not reach its expected replica set role within
 * the readiness timeout.
 *
 * @see io.replfixture.ReplicaSetConfig#getReadinessTimeoutSecs()
 */
public class ReadinessTimeoutException
        extends ReplFixtureException {

    private static final long serialVersionUID = -7398040613187021495L;

    public ReadinessTimeoutException(String message) {
        super(message);
    }

}
