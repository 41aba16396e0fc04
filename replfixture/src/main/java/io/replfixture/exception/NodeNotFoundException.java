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
 * Thrown when a replica set initiate or reconfigure command fails its
 * quorum check because a heartbeat to one of the members timed out.
 * <p>
 * This failure is transient. The fixture retries the command a bounded
 * number of times before giving up.
 *
 * @see io.replfixture.ReplicaSetConfig#getInitiateAttempts()
 */
public class NodeNotFoundException
        extends CommandFailedException {

    private static final long serialVersionUID = 3504476930263651181L;

    public NodeNotFoundException(String message) {
        super(NODE_NOT_FOUND_CODE, message);
    }

}
