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

package io.replfixture.node;

import javax.annotation.Nonnull;

/**
 * Creates the {@link Node} handles of a replica set fixture. Creating a
 * node does not start its process.
 */
@FunctionalInterface
public interface NodeFactory {

    /**
     * Creates a new node with the given options.
     *
     * @param options
     *         the options to launch the node with
     *
     * @return the created node
     */
    @Nonnull
    Node createNode(@Nonnull NodeOptions options);

}
