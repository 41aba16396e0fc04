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

/**
 * Contains the HOCON config field names to populate {@link ReplicaSetConfig}
 */
public final class HoconReplicaSetConfigFields {

    /**
     * Container object name for ReplicaSetConfig fields
     */
    public static final String REPLICA_SET_CONFIG_CONTAINER_NAME = "replica-set";

    /**
     * Field name of {@link ReplicaSetConfig#getReplicaSetName()}
     */
    public static final String REPLICA_SET_NAME_FIELD_NAME = "replica-set.replica-set-name";

    /**
     * Field name of {@link ReplicaSetConfig#getNodeCount()}
     */
    public static final String NODE_COUNT_FIELD_NAME = "replica-set.node-count";

    /**
     * Field name of {@link ReplicaSetConfig#isAllNodesElectable()}
     */
    public static final String ALL_NODES_ELECTABLE_FIELD_NAME = "replica-set.all-nodes-electable";

    /**
     * Field name of {@link ReplicaSetConfig#isVotingSecondaries()}
     */
    public static final String VOTING_SECONDARIES_FIELD_NAME = "replica-set.voting-secondaries";

    /**
     * Field name of {@link ReplicaSetConfig#isUseReplicaSetConnectionString()}
     */
    public static final String USE_REPLICA_SET_CONNECTION_STRING_FIELD_NAME = "replica-set.use-replica-set-connection-string";

    /**
     * Field name of {@link ReplicaSetConfig#isLinearChain()}
     */
    public static final String LINEAR_CHAIN_FIELD_NAME = "replica-set.linear-chain";

    /**
     * Field name of {@link ReplicaSetConfig#isStartInitialSyncNode()}
     */
    public static final String START_INITIAL_SYNC_NODE_FIELD_NAME = "replica-set.start-initial-sync-node";

    /**
     * Field name of {@link ReplicaSetConfig#getWriteConcernMajorityJournalDefault()}
     */
    public static final String WRITE_CONCERN_MAJORITY_JOURNAL_DEFAULT_FIELD_NAME = "replica-set.write-concern-majority-journal-default";

    /**
     * Field name of {@link ReplicaSetConfig#isConfigServer()}
     */
    public static final String CONFIG_SERVER_FIELD_NAME = "replica-set.config-server";

    /**
     * Field name of {@link ReplicaSetConfig#getSettings()}
     */
    public static final String SETTINGS_FIELD_NAME = "replica-set.settings";

    /**
     * Field name of {@link ReplicaSetConfig#getNodeOptions()}
     */
    public static final String NODE_OPTIONS_FIELD_NAME = "replica-set.node-options";

    /**
     * Field name of {@link ReplicaSetConfig#getDbpathPrefix()}
     */
    public static final String DBPATH_PREFIX_FIELD_NAME = "replica-set.dbpath-prefix";

    /**
     * Field name of {@link ReplicaSetConfig#isPreserveDbpath()}
     */
    public static final String PRESERVE_DBPATH_FIELD_NAME = "replica-set.preserve-dbpath";

    /**
     * Field name of {@link ReplicaSetConfig#getAuthOptions()}
     */
    public static final String AUTH_FIELD_NAME = "replica-set.auth";

    /**
     * Field name of {@link ReplicaSetConfig#getPollIntervalMillis()}
     */
    public static final String POLL_INTERVAL_MILLIS_FIELD_NAME = "replica-set.poll-interval-millis";

    /**
     * Field name of {@link ReplicaSetConfig#getInitiateAttempts()}
     */
    public static final String INITIATE_ATTEMPTS_FIELD_NAME = "replica-set.initiate-attempts";

    /**
     * Field name of {@link ReplicaSetConfig#getInitiateRetryDelayMillis()}
     */
    public static final String INITIATE_RETRY_DELAY_MILLIS_FIELD_NAME = "replica-set.initiate-retry-delay-millis";

    /**
     * Field name of {@link ReplicaSetConfig#getLeaderDiscoveryTimeoutSecs()}
     */
    public static final String LEADER_DISCOVERY_TIMEOUT_SECS_FIELD_NAME = "replica-set.leader-discovery-timeout-secs";

    /**
     * Field name of {@link ReplicaSetConfig#getReadinessTimeoutSecs()}
     */
    public static final String READINESS_TIMEOUT_SECS_FIELD_NAME = "replica-set.readiness-timeout-secs";

    /**
     * Field name of {@link AuthOptions#getAuthenticationDatabase()}, under the "auth" object
     */
    public static final String AUTH_AUTHENTICATION_DATABASE_FIELD_NAME = "authentication-database";

    /**
     * Field name of {@link AuthOptions#getUsername()}, under the "auth" object
     */
    public static final String AUTH_USERNAME_FIELD_NAME = "username";

    /**
     * Field name of {@link AuthOptions#getPassword()}, under the "auth" object
     */
    public static final String AUTH_PASSWORD_FIELD_NAME = "password";

    /**
     * Field name of {@link AuthOptions#getAuthenticationMechanism()}, under the "auth" object
     */
    public static final String AUTH_MECHANISM_FIELD_NAME = "mechanism";

    private HoconReplicaSetConfigFields() {
    }

}
