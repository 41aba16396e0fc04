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

import com.typesafe.config.Config;
import io.replfixture.ReplicaSetConfig.ReplicaSetConfigBuilder;
import io.replfixture.client.AuthOptions;
import io.replfixture.client.AuthOptions.AuthOptionsBuilder;

import javax.annotation.Nonnull;

import static com.typesafe.config.ConfigException.WrongType;
import static io.replfixture.HoconReplicaSetConfigFields.ALL_NODES_ELECTABLE_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.AUTH_AUTHENTICATION_DATABASE_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.AUTH_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.AUTH_MECHANISM_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.AUTH_PASSWORD_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.AUTH_USERNAME_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.CONFIG_SERVER_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.DBPATH_PREFIX_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.INITIATE_ATTEMPTS_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.INITIATE_RETRY_DELAY_MILLIS_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.LEADER_DISCOVERY_TIMEOUT_SECS_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.LINEAR_CHAIN_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.NODE_COUNT_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.NODE_OPTIONS_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.POLL_INTERVAL_MILLIS_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.PRESERVE_DBPATH_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.READINESS_TIMEOUT_SECS_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.REPLICA_SET_CONFIG_CONTAINER_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.REPLICA_SET_NAME_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.SETTINGS_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.START_INITIAL_SYNC_NODE_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.USE_REPLICA_SET_CONNECTION_STRING_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.VOTING_SECONDARIES_FIELD_NAME;
import static io.replfixture.HoconReplicaSetConfigFields.WRITE_CONCERN_MAJORITY_JOURNAL_DEFAULT_FIELD_NAME;
import static java.util.Objects.requireNonNull;

/**
 * {@link ReplicaSetConfig} parser for HOCON files
 */
public final class HoconReplicaSetConfigParser {

    /*

        A sample HOCON string is below:
        ---
        replica-set {
          replica-set-name: "shard0"
          node-count: 3
          all-nodes-electable: true
          linear-chain: false
          start-initial-sync-node: true
          settings {
            electionTimeoutMillis: 5000
          }
          node-options {
            oplogSize: 511
          }
          dbpath-prefix: "/data/db/job0"
          auth {
            username: "admin"
            password: "secret"
          }
          initiate-attempts: 5
          readiness-timeout-secs: 300
        }

     */
    private HoconReplicaSetConfigParser() {
    }

    /**
     * Parses the given config object to populate ReplicaSetConfig
     *
     * @return the created ReplicaSetConfig object
     *
     * @throws NullPointerException
     *         if the given config object is null
     * @throws IllegalArgumentException
     *         if the given config object has no "replica-set.*" field, or a
     *         value is not valid
     * @throws WrongType
     *         if a configuration value has wrong type
     */
    @SuppressWarnings("checkstyle:npathcomplexity")
    public static ReplicaSetConfig parseConfig(@Nonnull Config config) {
        requireNonNull(config);
        if (!config.hasPath(REPLICA_SET_CONFIG_CONTAINER_NAME)) {
            throw new IllegalArgumentException("No replica set config provided!");
        }

        ReplicaSetConfigBuilder builder = ReplicaSetConfig.newBuilder();

        if (config.hasPath(REPLICA_SET_NAME_FIELD_NAME)) {
            builder.setReplicaSetName(config.getString(REPLICA_SET_NAME_FIELD_NAME));
        }

        if (config.hasPath(NODE_COUNT_FIELD_NAME)) {
            builder.setNodeCount(config.getInt(NODE_COUNT_FIELD_NAME));
        }

        if (config.hasPath(ALL_NODES_ELECTABLE_FIELD_NAME)) {
            builder.setAllNodesElectable(config.getBoolean(ALL_NODES_ELECTABLE_FIELD_NAME));
        }

        if (config.hasPath(VOTING_SECONDARIES_FIELD_NAME)) {
            builder.setVotingSecondaries(config.getBoolean(VOTING_SECONDARIES_FIELD_NAME));
        }

        if (config.hasPath(USE_REPLICA_SET_CONNECTION_STRING_FIELD_NAME)) {
            builder.setUseReplicaSetConnectionString(config.getBoolean(USE_REPLICA_SET_CONNECTION_STRING_FIELD_NAME));
        }

        if (config.hasPath(LINEAR_CHAIN_FIELD_NAME)) {
            builder.setLinearChain(config.getBoolean(LINEAR_CHAIN_FIELD_NAME));
        }

        if (config.hasPath(START_INITIAL_SYNC_NODE_FIELD_NAME)) {
            builder.setStartInitialSyncNode(config.getBoolean(START_INITIAL_SYNC_NODE_FIELD_NAME));
        }

        if (config.hasPath(WRITE_CONCERN_MAJORITY_JOURNAL_DEFAULT_FIELD_NAME)) {
            builder.setWriteConcernMajorityJournalDefault(
                    config.getBoolean(WRITE_CONCERN_MAJORITY_JOURNAL_DEFAULT_FIELD_NAME));
        }

        if (config.hasPath(CONFIG_SERVER_FIELD_NAME)) {
            builder.setConfigServer(config.getBoolean(CONFIG_SERVER_FIELD_NAME));
        }

        if (config.hasPath(SETTINGS_FIELD_NAME)) {
            builder.setSettings(config.getConfig(SETTINGS_FIELD_NAME).root().unwrapped());
        }

        if (config.hasPath(NODE_OPTIONS_FIELD_NAME)) {
            builder.setNodeOptions(config.getConfig(NODE_OPTIONS_FIELD_NAME).root().unwrapped());
        }

        if (config.hasPath(DBPATH_PREFIX_FIELD_NAME)) {
            builder.setDbpathPrefix(config.getString(DBPATH_PREFIX_FIELD_NAME));
        }

        if (config.hasPath(PRESERVE_DBPATH_FIELD_NAME)) {
            builder.setPreserveDbpath(config.getBoolean(PRESERVE_DBPATH_FIELD_NAME));
        }

        if (config.hasPath(AUTH_FIELD_NAME)) {
            builder.setAuthOptions(parseAuthOptions(config.getConfig(AUTH_FIELD_NAME)));
        }

        if (config.hasPath(POLL_INTERVAL_MILLIS_FIELD_NAME)) {
            builder.setPollIntervalMillis(config.getLong(POLL_INTERVAL_MILLIS_FIELD_NAME));
        }

        if (config.hasPath(INITIATE_ATTEMPTS_FIELD_NAME)) {
            builder.setInitiateAttempts(config.getInt(INITIATE_ATTEMPTS_FIELD_NAME));
        }

        if (config.hasPath(INITIATE_RETRY_DELAY_MILLIS_FIELD_NAME)) {
            builder.setInitiateRetryDelayMillis(config.getLong(INITIATE_RETRY_DELAY_MILLIS_FIELD_NAME));
        }

        if (config.hasPath(LEADER_DISCOVERY_TIMEOUT_SECS_FIELD_NAME)) {
            builder.setLeaderDiscoveryTimeoutSecs(config.getLong(LEADER_DISCOVERY_TIMEOUT_SECS_FIELD_NAME));
        }

        if (config.hasPath(READINESS_TIMEOUT_SECS_FIELD_NAME)) {
            builder.setReadinessTimeoutSecs(config.getLong(READINESS_TIMEOUT_SECS_FIELD_NAME));
        }

        return builder.build();
    }

    private static AuthOptions parseAuthOptions(Config auth) {
        AuthOptionsBuilder builder = AuthOptions.newBuilder();

        if (auth.hasPath(AUTH_AUTHENTICATION_DATABASE_FIELD_NAME)) {
            builder.setAuthenticationDatabase(auth.getString(AUTH_AUTHENTICATION_DATABASE_FIELD_NAME));
        }

        if (auth.hasPath(AUTH_USERNAME_FIELD_NAME)) {
            builder.setUsername(auth.getString(AUTH_USERNAME_FIELD_NAME));
        }

        if (auth.hasPath(AUTH_PASSWORD_FIELD_NAME)) {
            builder.setPassword(auth.getString(AUTH_PASSWORD_FIELD_NAME));
        }

        if (auth.hasPath(AUTH_MECHANISM_FIELD_NAME)) {
            builder.setAuthenticationMechanism(auth.getString(AUTH_MECHANISM_FIELD_NAME));
        }

        return builder.build();
    }

}
