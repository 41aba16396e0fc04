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

import io.replfixture.client.ClusterClient;
import io.replfixture.client.ReadPreference;
import io.replfixture.exception.NodeProcessException;

import javax.annotation.Nonnull;

/**
 * Handle of a single server process that takes part in a replica set
 * fixture.
 * <p>
 * Nodes are created by a {@link NodeFactory} and owned exclusively by the
 * fixture that created them. The port and therefore the internal address
 * of a node are known before the node is started.
 *
 * @see NodeFactory
 * @see NodeOptions
 */
public interface Node {

    /**
     * Returns the index of the node in its replica set. It is the same as
     * the id of the replica set member the node runs.
     *
     * @return the index of the node in its replica set
     */
    int getIndex();

    /**
     * Returns the port the node listens on.
     *
     * @return the port the node listens on
     */
    int getPort();

    /**
     * Returns the "host:port" string other members use to reach this node.
     *
     * @return the "host:port" string other members use to reach this node
     */
    @Nonnull
    String getInternalAddress();

    /**
     * Returns the connection URL a driver uses to connect directly to this
     * node.
     *
     * @return the connection URL a driver uses to connect directly to this
     *         node
     */
    @Nonnull
    String getDriverUrl();

    /**
     * Returns the options the node is launched with.
     *
     * @return the options the node is launched with
     */
    @Nonnull
    NodeOptions getOptions();

    /**
     * Starts the server process.
     *
     * @throws NodeProcessException
     *         if the process cannot be started
     */
    void start();

    /**
     * Blocks until the server process accepts connections.
     *
     * @throws NodeProcessException
     *         if the process exited before accepting connections
     */
    void awaitReady();

    /**
     * Stops the server process. Stopping a node that is not running is a
     * no-op and succeeds.
     *
     * @return true if the process is stopped cleanly, false otherwise
     *
     * @throws NodeProcessException
     *         if stopping the process fails unexpectedly
     */
    boolean stop();

    /**
     * Returns true if the server process is running.
     *
     * @return true if the server process is running
     */
    boolean isRunning();

    /**
     * Returns a client connected directly to this node.
     *
     * @param readPreference
     *         the routing of the commands sent through the client
     *
     * @return a client connected directly to this node
     */
    @Nonnull
    ClusterClient client(@Nonnull ReadPreference readPreference);

}
