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

package io.replfixture.client;

/**
 * Routing of the commands sent through a {@link ClusterClient}.
 */
public enum ReadPreference {

    /**
     * Commands are accepted only while the node is primary.
     */
    PRIMARY,

    /**
     * Commands are accepted by a secondary as well, so a role query does
     * not depend on the availability of the primary.
     */
    SECONDARY

}
