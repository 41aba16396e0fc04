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

import io.micrometer.core.instrument.MeterRegistry;
import io.replfixture.exception.CommandFailedException;
import io.replfixture.exception.LeaderDiscoveryTimeoutException;
import io.replfixture.exception.NodeNotFoundException;
import io.replfixture.exception.NodeProcessException;
import io.replfixture.impl.ReplicaSetFixtureBuilderImpl;
import io.replfixture.node.Node;
import io.replfixture.node.NodeFactory;
import io.replfixture.runtime.Sleeper;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.util.List;

/**
 * A replica set fixture brings up a group of server nodes configured to
 * replicate from a single primary to the rest, waits until the group
 * converged to the expected roles, and tears it down once test workloads
 * are done with it.
 * <p>
 * Setup happens in two phases. The first node is initiated as a single
 * member replica set and elected as primary. Then the replica set is
 * reconfigured with the full member list and the fixture waits until every
 * other node reports itself as secondary. Both phases tolerate transient
 * quorum check failures by retrying a bounded number of times.
 * <p>
 * Unless {@link ReplicaSetConfig#isAllNodesElectable()} is set, only the
 * first node can become primary and the primary is known without asking
 * the nodes.
 * <p>
 * A fixture is not thread-safe. Setup, readiness checks and teardown are
 * performed sequentially by the calling thread.
 *
 * @see ReplicaSetConfig
 * @see ReplicaSetFixtureStatus
 * @see NodeFactory
 */
public interface ReplicaSetFixture {

    /**
     * Returns a new builder to configure the fixture that is going to be
     * created.
     *
     * @return a new builder to configure the fixture that is going to be
     *         created
     */
    @Nonnull
    static ReplicaSetFixtureBuilder newBuilder() {
        return new ReplicaSetFixtureBuilderImpl();
    }

    /**
     * Creates and starts the nodes and configures the replica set.
     * <p>
     * Calling this method again does not create new nodes. Nodes that are
     * not running are started again, and the replica set configuration is
     * skipped if the first node already has one.
     *
     * @throws NodeProcessException
     *         if a node cannot be started
     * @throws NodeNotFoundException
     *         if a quorum check keeps failing after all attempts
     * @throws CommandFailedException
     *         if a replica set command is rejected
     * @throws IllegalStateException
     *         if the fixture is already torn down
     */
    void setup();

    /**
     * Waits until the first node is primary and every other node is
     * secondary, then refreshes the logical session cache on the primary.
     *
     * @throws IllegalStateException
     *         if the fixture is not set up or already torn down
     */
    void awaitReady();

    /**
     * Stops the hidden member, if any, then the regular nodes in reverse
     * order so that the primary is stopped last.
     *
     * @return true if every node stopped cleanly or nothing was running
     */
    boolean teardown();

    /**
     * Returns true if all regular nodes are running, or the hidden member is
     * running.
     *
     * @return true if the fixture is running
     */
    boolean isRunning();

    /**
     * Returns the current primary, waiting at most
     * {@link ReplicaSetConfig#getLeaderDiscoveryTimeoutSecs()}.
     *
     * @return the current primary
     *
     * @throws LeaderDiscoveryTimeoutException
     *         if no node reports itself as primary in time
     */
    @Nonnull
    Node getLeader();

    /**
     * Returns the current primary, waiting at most the given duration.
     *
     * @param timeoutSeconds
     *         the time budget in seconds
     *
     * @return the current primary
     *
     * @throws LeaderDiscoveryTimeoutException
     *         if no node reports itself as primary in time
     */
    @Nonnull
    Node getLeader(long timeoutSeconds);

    /**
     * Returns the regular nodes other than the current primary.
     *
     * @return the regular nodes other than the current primary
     */
    @Nonnull
    List<Node> getFollowers();

    /**
     * Returns the hidden initial sync member, or null if there is none.
     *
     * @return the hidden initial sync member, or null if there is none
     */
    @Nullable
    Node getHiddenSyncMember();

    /**
     * Returns the regular nodes ordered by their index.
     *
     * @return the regular nodes ordered by their index
     */
    @Nonnull
    List<Node> getNodes();

    /**
     * Returns the "name/host1,host2,..." string used for wiring other
     * processes to this replica set.
     *
     * @return the internal connection string of the replica set
     *
     * @throws IllegalStateException
     *         if called before {@link #setup()}
     */
    @Nonnull
    String getInternalAddress();

    /**
     * Returns the connection URL for drivers. It is a replica set
     * connection string if
     * {@link ReplicaSetConfig#isUseReplicaSetConnectionString()} is set,
     * otherwise a direct connection to the first node.
     *
     * @return the connection URL for drivers
     *
     * @throws IllegalStateException
     *         if called before {@link #setup()}
     */
    @Nonnull
    String getDriverUrl();

    @Nonnull
    ReplicaSetFixtureStatus getStatus();

    @Nonnull
    ReplicaSetConfig getConfig();

    /**
     * The builder interface for configuring and creating replica set
     * fixtures.
     */
    interface ReplicaSetFixtureBuilder {

        /**
         * Sets the config of the fixture. If not set,
         * {@link ReplicaSetConfig#DEFAULT_REPLICA_SET_CONFIG} is used.
         *
         * @param config
         *         the config to create the fixture with
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        ReplicaSetFixtureBuilder setConfig(@Nonnull ReplicaSetConfig config);

        /**
         * Sets the factory that creates the nodes. Must be provided.
         *
         * @param nodeFactory
         *         the factory to create the nodes with
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        ReplicaSetFixtureBuilder setNodeFactory(@Nonnull NodeFactory nodeFactory);

        /**
         * Sets the clock used for measuring elapsed time in polling loops. If
         * not set, {@link Clock#systemUTC()} is used.
         *
         * @param clock
         *         the clock to use
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        ReplicaSetFixtureBuilder setClock(@Nonnull Clock clock);

        /**
         * Sets the sleeper used between two iterations of polling loops. If
         * not set, {@link Sleeper#THREAD_SLEEPER} is used.
         *
         * @param sleeper
         *         the sleeper to use
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        ReplicaSetFixtureBuilder setSleeper(@Nonnull Sleeper sleeper);

        /**
         * Sets the registry the fixture publishes its metrics to. If not set,
         * a simple in-memory registry is used.
         *
         * @param meterRegistry
         *         the registry to publish metrics to
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        ReplicaSetFixtureBuilder setMeterRegistry(@Nonnull MeterRegistry meterRegistry);

        /**
         * Builds the fixture. No node is created until
         * {@link ReplicaSetFixture#setup()} is called.
         *
         * @return the fixture
         *
         * @throws IllegalStateException
         *         if the node factory is missing or the builder is already
         *         used
         */
        @Nonnull
        ReplicaSetFixture build();

    }

}
