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

import io.replfixture.client.AuthOptions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.replfixture.model.ReplicaSetSpec.ELECTION_TIMEOUT_MILLIS_SETTING;
import static java.util.Objects.requireNonNull;

/**
 * Contains the configuration parameters of a replica set fixture.
 * <p>
 * ReplicaSetConfig is an immutable configuration class. You can use a
 * ReplicaSetConfigBuilder to build a ReplicaSetConfig object.
 */
public final class ReplicaSetConfig {

    /**
     * The default value for {@link #replicaSetName}.
     */
    public static final String DEFAULT_REPLICA_SET_NAME = "rs";

    /**
     * The default value for {@link #nodeCount}.
     */
    public static final int DEFAULT_NODE_COUNT = 2;

    /**
     * The default value for {@link #dbpathPrefix}.
     */
    public static final String DEFAULT_DBPATH_PREFIX = "data/replfixture";

    /**
     * The default value for {@link #pollIntervalMillis}.
     */
    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 100;

    /**
     * The default value for {@link #initiateAttempts}.
     */
    public static final int DEFAULT_INITIATE_ATTEMPTS = 3;

    /**
     * The default value for {@link #initiateRetryDelayMillis}.
     */
    public static final long DEFAULT_INITIATE_RETRY_DELAY_MILLIS = 5000;

    /**
     * The default value for {@link #leaderDiscoveryTimeoutSecs}.
     */
    public static final long DEFAULT_LEADER_DISCOVERY_TIMEOUT_SECS = 30;

    /**
     * The config object with default configuration.
     */
    public static final ReplicaSetConfig DEFAULT_REPLICA_SET_CONFIG = newBuilder().build();

    /**
     * Name of the replica set. Passed to every node and used as the "_id" of
     * the replica set configuration.
     */
    private final String replicaSetName;

    /**
     * Number of regular (non-hidden) nodes. The first node is always the
     * initial primary.
     */
    private final int nodeCount;

    /**
     * If true, every node is electable. Otherwise only the first node can
     * become primary and all other nodes are configured with priority 0.
     */
    private final boolean allNodesElectable;

    /**
     * Whether the secondaries vote. Follows {@link #allNodesElectable} when
     * not set. At most 7 members vote regardless of this setting.
     */
    private final Boolean votingSecondaries;

    /**
     * Whether the driver URL of the fixture is a replica set connection
     * string. Follows {@link #allNodesElectable} when not set, so that a
     * fixture with a single electable node gives a direct connection to it
     * and clients fail instead of following a failover.
     */
    private final Boolean useReplicaSetConnectionString;

    /**
     * If true, each non-first node is forced to sync from its immediate
     * predecessor.
     */
    private final boolean linearChain;

    /**
     * If true, an additional hidden, non-voting member is started. It only
     * receives a copy of the data via initial sync.
     */
    private final boolean startInitialSyncNode;

    /**
     * Value of "writeConcernMajorityJournalDefault" of the replica set
     * configuration. When not set, the first node is asked whether its
     * storage is durable and the field is set to false only if it is not.
     */
    private final Boolean writeConcernMajorityJournalDefault;

    /**
     * If true, the replica set is initiated as a config server replica set.
     */
    private final boolean configServer;

    /**
     * The "settings" document of the replica set configuration.
     */
    private final Map<String, Object> settings;

    /**
     * Server options passed to every node. A "dbpath" entry overrides
     * {@link #dbpathPrefix}.
     */
    private final Map<String, Object> nodeOptions;

    /**
     * Directory under which each node gets its own data directory named
     * after its index.
     */
    private final String dbpathPrefix;

    /**
     * If true, the data directories of the nodes are kept between runs.
     */
    private final boolean preserveDbpath;

    /**
     * Credentials of the administrative connections, if authentication is
     * enabled on the nodes.
     */
    private final AuthOptions authOptions;

    /**
     * Interval between two role queries while waiting for the primary or a
     * secondary.
     */
    private final long pollIntervalMillis;

    /**
     * Number of attempts in total for a replica set initiate or reconfigure
     * command that fails with a transient quorum check failure.
     */
    private final int initiateAttempts;

    /**
     * Delay between two attempts of a replica set initiate or reconfigure
     * command.
     */
    private final long initiateRetryDelayMillis;

    /**
     * Default time budget of the primary discovery after setup.
     */
    private final long leaderDiscoveryTimeoutSecs;

    /**
     * Time budget of each wait for a node to reach its expected role during
     * setup. Waits are unbounded when not set.
     */
    private final Long readinessTimeoutSecs;

    private ReplicaSetConfig(ReplicaSetConfigBuilder builder) {
        this.replicaSetName = builder.replicaSetName;
        this.nodeCount = builder.nodeCount;
        this.allNodesElectable = builder.allNodesElectable;
        this.votingSecondaries = builder.votingSecondaries;
        this.useReplicaSetConnectionString = builder.useReplicaSetConnectionString;
        this.linearChain = builder.linearChain;
        this.startInitialSyncNode = builder.startInitialSyncNode;
        this.writeConcernMajorityJournalDefault = builder.writeConcernMajorityJournalDefault;
        this.configServer = builder.configServer;
        this.settings = Collections.unmodifiableMap(new LinkedHashMap<>(builder.settings));
        this.nodeOptions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodeOptions));
        this.dbpathPrefix = builder.dbpathPrefix;
        this.preserveDbpath = builder.preserveDbpath;
        this.authOptions = builder.authOptions;
        this.pollIntervalMillis = builder.pollIntervalMillis;
        this.initiateAttempts = builder.initiateAttempts;
        this.initiateRetryDelayMillis = builder.initiateRetryDelayMillis;
        this.leaderDiscoveryTimeoutSecs = builder.leaderDiscoveryTimeoutSecs;
        this.readinessTimeoutSecs = builder.readinessTimeoutSecs;
    }

    /**
     * Creates a new replica set config builder.
     *
     * @return the builder to populate the parameters for ReplicaSetConfig.
     */
    @Nonnull
    public static ReplicaSetConfigBuilder newBuilder() {
        return new ReplicaSetConfigBuilder();
    }

    private static void checkPositive(long value, String errorMessage) {
        if (value <= 0) {
            throw new IllegalArgumentException(errorMessage);
        }
    }

    @Nonnull
    public String getReplicaSetName() {
        return replicaSetName;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public boolean isAllNodesElectable() {
        return allNodesElectable;
    }

    /**
     * @return true if the secondaries vote
     *
     * @see #votingSecondaries
     */
    public boolean isVotingSecondaries() {
        return votingSecondaries != null ? votingSecondaries : allNodesElectable;
    }

    /**
     * @return true if the driver URL is a replica set connection string
     *
     * @see #useReplicaSetConnectionString
     */
    public boolean isUseReplicaSetConnectionString() {
        return useReplicaSetConnectionString != null ? useReplicaSetConnectionString : allNodesElectable;
    }

    public boolean isLinearChain() {
        return linearChain;
    }

    public boolean isStartInitialSyncNode() {
        return startInitialSyncNode;
    }

    /**
     * @return the configured write concern majority journal default, or
     *         null if it is decided by asking the first node
     *
     * @see #writeConcernMajorityJournalDefault
     */
    @Nullable
    public Boolean getWriteConcernMajorityJournalDefault() {
        return writeConcernMajorityJournalDefault;
    }

    public boolean isConfigServer() {
        return configServer;
    }

    @Nonnull
    public Map<String, Object> getSettings() {
        return settings;
    }

    @Nonnull
    public Map<String, Object> getNodeOptions() {
        return nodeOptions;
    }

    @Nonnull
    public String getDbpathPrefix() {
        return dbpathPrefix;
    }

    public boolean isPreserveDbpath() {
        return preserveDbpath;
    }

    @Nullable
    public AuthOptions getAuthOptions() {
        return authOptions;
    }

    public long getPollIntervalMillis() {
        return pollIntervalMillis;
    }

    public int getInitiateAttempts() {
        return initiateAttempts;
    }

    public long getInitiateRetryDelayMillis() {
        return initiateRetryDelayMillis;
    }

    public long getLeaderDiscoveryTimeoutSecs() {
        return leaderDiscoveryTimeoutSecs;
    }

    /**
     * @return the readiness timeout in seconds, or null if waits are
     *         unbounded
     *
     * @see #readinessTimeoutSecs
     */
    @Nullable
    public Long getReadinessTimeoutSecs() {
        return readinessTimeoutSecs;
    }

    @Override
    public String toString() {
        return "ReplicaSetConfig{" + "replicaSetName='" + replicaSetName + '\'' + ", nodeCount=" + nodeCount
               + ", allNodesElectable=" + allNodesElectable + ", votingSecondaries=" + isVotingSecondaries()
               + ", useReplicaSetConnectionString=" + isUseReplicaSetConnectionString() + ", linearChain="
               + linearChain + ", startInitialSyncNode=" + startInitialSyncNode
               + ", writeConcernMajorityJournalDefault=" + writeConcernMajorityJournalDefault + ", configServer="
               + configServer + ", settings=" + settings + ", nodeOptions=" + nodeOptions + ", dbpathPrefix='"
               + dbpathPrefix + '\'' + ", preserveDbpath=" + preserveDbpath + ", authOptions=" + authOptions
               + ", pollIntervalMillis=" + pollIntervalMillis + ", initiateAttempts=" + initiateAttempts
               + ", initiateRetryDelayMillis=" + initiateRetryDelayMillis + ", leaderDiscoveryTimeoutSecs="
               + leaderDiscoveryTimeoutSecs + ", readinessTimeoutSecs=" + readinessTimeoutSecs + '}';
    }

    /**
     * Builder for replica set config
     */
    public static final class ReplicaSetConfigBuilder {

        private String replicaSetName = DEFAULT_REPLICA_SET_NAME;
        private int nodeCount = DEFAULT_NODE_COUNT;
        private boolean allNodesElectable;
        private Boolean votingSecondaries;
        private Boolean useReplicaSetConnectionString;
        private boolean linearChain;
        private boolean startInitialSyncNode;
        private Boolean writeConcernMajorityJournalDefault;
        private boolean configServer;
        private Map<String, Object> settings = Collections.emptyMap();
        private Map<String, Object> nodeOptions = Collections.emptyMap();
        private String dbpathPrefix = DEFAULT_DBPATH_PREFIX;
        private boolean preserveDbpath;
        private AuthOptions authOptions;
        private long pollIntervalMillis = DEFAULT_POLL_INTERVAL_MILLIS;
        private int initiateAttempts = DEFAULT_INITIATE_ATTEMPTS;
        private long initiateRetryDelayMillis = DEFAULT_INITIATE_RETRY_DELAY_MILLIS;
        private long leaderDiscoveryTimeoutSecs = DEFAULT_LEADER_DISCOVERY_TIMEOUT_SECS;
        private Long readinessTimeoutSecs;

        private ReplicaSetConfigBuilder() {
        }

        @Nonnull
        public ReplicaSetConfigBuilder setReplicaSetName(@Nonnull String replicaSetName) {
            requireNonNull(replicaSetName);
            if (replicaSetName.isEmpty() || replicaSetName.contains("/") || replicaSetName.contains(",")) {
                throw new IllegalArgumentException("Invalid replica set name: '" + replicaSetName + "'");
            }

            this.replicaSetName = replicaSetName;
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setNodeCount(int nodeCount) {
            checkPositive(nodeCount, "node count must be positive!");
            this.nodeCount = nodeCount;
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setAllNodesElectable(boolean allNodesElectable) {
            this.allNodesElectable = allNodesElectable;
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setVotingSecondaries(boolean votingSecondaries) {
            this.votingSecondaries = votingSecondaries;
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setUseReplicaSetConnectionString(boolean useReplicaSetConnectionString) {
            this.useReplicaSetConnectionString = useReplicaSetConnectionString;
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setLinearChain(boolean linearChain) {
            this.linearChain = linearChain;
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setStartInitialSyncNode(boolean startInitialSyncNode) {
            this.startInitialSyncNode = startInitialSyncNode;
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setWriteConcernMajorityJournalDefault(boolean writeConcernMajorityJournalDefault) {
            this.writeConcernMajorityJournalDefault = writeConcernMajorityJournalDefault;
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setConfigServer(boolean configServer) {
            this.configServer = configServer;
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setSettings(@Nonnull Map<String, Object> settings) {
            this.settings = new LinkedHashMap<>(requireNonNull(settings));
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setNodeOptions(@Nonnull Map<String, Object> nodeOptions) {
            this.nodeOptions = new LinkedHashMap<>(requireNonNull(nodeOptions));
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setDbpathPrefix(@Nonnull String dbpathPrefix) {
            this.dbpathPrefix = requireNonNull(dbpathPrefix);
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setPreserveDbpath(boolean preserveDbpath) {
            this.preserveDbpath = preserveDbpath;
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setAuthOptions(@Nonnull AuthOptions authOptions) {
            this.authOptions = requireNonNull(authOptions);
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setPollIntervalMillis(long pollIntervalMillis) {
            checkPositive(pollIntervalMillis, "poll interval millis must be positive!");
            this.pollIntervalMillis = pollIntervalMillis;
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setInitiateAttempts(int initiateAttempts) {
            checkPositive(initiateAttempts, "initiate attempts must be positive!");
            this.initiateAttempts = initiateAttempts;
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setInitiateRetryDelayMillis(long initiateRetryDelayMillis) {
            if (initiateRetryDelayMillis < 0) {
                throw new IllegalArgumentException("initiate retry delay millis cannot be negative!");
            }

            this.initiateRetryDelayMillis = initiateRetryDelayMillis;
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setLeaderDiscoveryTimeoutSecs(long leaderDiscoveryTimeoutSecs) {
            checkPositive(leaderDiscoveryTimeoutSecs, "leader discovery timeout secs must be positive!");
            this.leaderDiscoveryTimeoutSecs = leaderDiscoveryTimeoutSecs;
            return this;
        }

        @Nonnull
        public ReplicaSetConfigBuilder setReadinessTimeoutSecs(long readinessTimeoutSecs) {
            checkPositive(readinessTimeoutSecs, "readiness timeout secs must be positive!");
            this.readinessTimeoutSecs = readinessTimeoutSecs;
            return this;
        }

        /**
         * Builds the ReplicaSetConfig object.
         *
         * @return the ReplicaSetConfig object.
         */
        @Nonnull
        public ReplicaSetConfig build() {
            if (linearChain && nodeCount < 2) {
                throw new IllegalArgumentException("linear chain requires at least 2 nodes, but node count is "
                                                   + nodeCount);
            }

            Object electionTimeout = settings.get(ELECTION_TIMEOUT_MILLIS_SETTING);
            if (electionTimeout != null && !(electionTimeout instanceof Number)) {
                throw new IllegalArgumentException("electionTimeoutMillis setting must be a number: "
                                                   + electionTimeout);
            }

            return new ReplicaSetConfig(this);
        }

        @Override
        public String toString() {
            return "ReplicaSetConfigBuilder{" + "replicaSetName='" + replicaSetName + '\'' + ", nodeCount="
                   + nodeCount + ", allNodesElectable=" + allNodesElectable + ", votingSecondaries="
                   + votingSecondaries + ", linearChain=" + linearChain + ", startInitialSyncNode="
                   + startInitialSyncNode + '}';
        }

    }

}
